package dev.usageexporter.exporter;

import dev.usageexporter.core.SimpleVmRelabeler;
import dev.usageexporter.core.StartDateSource;
import dev.usageexporter.core.StaticWeightSource;
import dev.usageexporter.core.UsageSource;
import dev.usageexporter.core.WeightSource;
import dev.usageexporter.exporter.openstack.OpenStackClient;
import dev.usageexporter.exporter.openstack.OpenStackUsageSource;
import dev.usageexporter.exporter.weights.RemoteStartDateSource;
import dev.usageexporter.exporter.weights.RemoteWeightSource;
import dev.usageexporter.exporter.weights.WeightsFileReader;
import dev.usageexporter.simulator.SimulatedUsageSource;
import dev.usageexporter.simulator.UsageModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the usage, weight and start-date implementations the configuration asks for.
 */
public final class SourceFactory {
    private static final Logger logger = LoggerFactory.getLogger(SourceFactory.class);

    private final ExporterConfig config;
    private final JsonHttpClient http;

    public SourceFactory(ExporterConfig config, JsonHttpClient http) {
        this.config = config;
        this.http = http;
    }

    public UsageSource usageSource() {
        SimpleVmRelabeler simpleVm = simpleVm();
        if (config.isDummyMode()) {
            logger.info("Using simulated usage from {} ({} model)", config.dummyDataFile, config.simulationModel);
            return SimulatedUsageSource.open(config.dummyDataFile, config.processStart,
                    UsageModel.named(config.simulationModel), simpleVm);
        }
        logger.info("Using OpenStack usage ({})", config.credentials);
        return new OpenStackUsageSource(new OpenStackClient(http, config.credentials), simpleVm);
    }

    public WeightSource weightSource() {
        if (config.dummyWeightsFile != null) {
            return new StaticWeightSource(WeightsFileReader.read(config.dummyWeightsFile));
        }
        if (config.weightUpdateEndpoint != null) {
            return new RemoteWeightSource(http, config.weightUpdateEndpoint);
        }
        return WeightSource.neutral();
    }

    public StartDateSource startDateSource() {
        if (config.startDateEndpoint != null) {
            return new RemoteStartDateSource(http, config.startDateEndpoint, config.startDate);
        }
        return StartDateSource.fixed(config.startDate);
    }

    SimpleVmRelabeler simpleVm() {
        if (config.simpleVmProjectId == null) {
            return SimpleVmRelabeler.disabled();
        }
        return new SimpleVmRelabeler(config.simpleVmProjectId, config.simpleVmTag);
    }
}
