package dev.usageexporter.simulator;

import dev.usageexporter.core.ConfigurationException;
import dev.usageexporter.core.DomainFilter;
import dev.usageexporter.core.InstanceUsage;
import dev.usageexporter.core.SimpleVmRelabeler;
import dev.usageexporter.core.SourceUnavailableException;
import dev.usageexporter.core.UsageSample;
import dev.usageexporter.core.UsageSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Usage source backed by a declarative machine-lifetime file instead of a cloud.
 *
 * The file is re-read on every {@link #collect} call, so it can be edited while the exporter
 * runs. Results depend only on the file contents and the instants passed in.
 */
public class SimulatedUsageSource implements UsageSource {
    private static final Logger logger = LoggerFactory.getLogger(SimulatedUsageSource.class);

    private final Path file;
    private final SimulationFileReader reader;
    private final UsageModel model;
    private final SimpleVmRelabeler simpleVm;

    public SimulatedUsageSource(Path file, SimulationFileReader reader, UsageModel model,
                                SimpleVmRelabeler simpleVm) {
        this.file = Objects.requireNonNull(file, "file");
        this.reader = Objects.requireNonNull(reader, "reader");
        this.model = Objects.requireNonNull(model, "model");
        this.simpleVm = Objects.requireNonNull(simpleVm, "simpleVm");
    }

    /**
     * Create the source and read the file once, so a broken file is reported at startup.
     */
    public static SimulatedUsageSource open(Path file, Instant simulationStart, UsageModel model,
                                            SimpleVmRelabeler simpleVm) {
        SimulationFileReader reader = new SimulationFileReader(simulationStart);
        try {
            List<SimulatedProject> projects = reader.read(file);
            logger.info("Simulation file {} declares {} projects", file, projects.size());
        } catch (IOException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
        return new SimulatedUsageSource(file, reader, model, simpleVm);
    }

    @Override
    public List<UsageSample> collect(DomainFilter filter, Instant windowStart, Instant now)
            throws SourceUnavailableException {
        List<SimulatedProject> projects;
        try {
            projects = reader.read(file);
        } catch (IOException e) {
            throw new SourceUnavailableException(e.getMessage(), e);
        }

        List<UsageSample> samples = new ArrayList<>();
        for (SimulatedProject simulated : projects) {
            if (!filter.accepts(simulated.project)) {
                continue;
            }
            List<InstanceUsage> instances = new ArrayList<>(simulated.machines.size());
            for (LifetimeSpec machine : simulated.machines) {
                double[] usage = model.usage(machine, windowStart, now);
                instances.add(new InstanceUsage(machine.instanceId, usage[0], usage[1], machine.metadata));
            }

            if (simpleVm.isUmbrella(simulated.project)) {
                samples.addAll(simpleVm.relabel(simulated.project, instances));
            } else {
                samples.add(sum(simulated, instances));
            }
        }
        logger.debug("Simulated {} samples from {} at {}", samples.size(), file, now);
        return samples;
    }

    private static UsageSample sum(SimulatedProject simulated, List<InstanceUsage> instances) {
        double memory = 0;
        double vcpus = 0;
        for (InstanceUsage instance : instances) {
            memory += instance.memoryMbUsage;
            vcpus += instance.vcpuUsage;
        }
        return new UsageSample(simulated.project, memory, vcpus);
    }

    @Override
    public String describe() {
        return "simulated(" + file + ", model=" + model + ")";
    }
}
