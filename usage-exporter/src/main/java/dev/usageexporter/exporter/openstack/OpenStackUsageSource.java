package dev.usageexporter.exporter.openstack;

import com.fasterxml.jackson.databind.JsonNode;
import dev.usageexporter.core.DomainFilter;
import dev.usageexporter.core.InstanceUsage;
import dev.usageexporter.core.Project;
import dev.usageexporter.core.SimpleVmRelabeler;
import dev.usageexporter.core.SourceUnavailableException;
import dev.usageexporter.core.UsageMetric;
import dev.usageexporter.core.UsageSample;
import dev.usageexporter.core.UsageSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Usage source backed by the OpenStack compute usage API.
 *
 * Projects are listed and filtered first; usage is only requested for accepted projects. The
 * SimpleVM umbrella project is broken down per server and relabeled by metadata tag.
 */
public class OpenStackUsageSource implements UsageSource {
    private static final Logger logger = LoggerFactory.getLogger(OpenStackUsageSource.class);

    private final OpenStackClient client;
    private final SimpleVmRelabeler simpleVm;

    public OpenStackUsageSource(OpenStackClient client, SimpleVmRelabeler simpleVm) {
        this.client = client;
        this.simpleVm = simpleVm;
    }

    @Override
    public List<UsageSample> collect(DomainFilter filter, Instant windowStart, Instant now)
            throws SourceUnavailableException {
        List<Project> projects = listProjects(filter);
        List<UsageSample> samples = new ArrayList<>();
        int skipped = 0;
        for (Project project : projects) {
            if (!filter.accepts(project)) {
                skipped++;
                continue;
            }
            JsonNode usage = client.tenantUsage(project.projectId, windowStart, now);
            if (simpleVm.isUmbrella(project)) {
                samples.addAll(simpleVm.relabel(project, instanceUsages(project, usage)));
            } else {
                samples.add(new UsageSample(project,
                        usage.path(UsageMetric.TOTAL_MEMORY_MB_USAGE.key()).asDouble(0.0),
                        usage.path(UsageMetric.TOTAL_VCPUS_USAGE.key()).asDouble(0.0)));
            }
        }
        logger.debug("Collected usage for {} projects, {} filtered out", projects.size() - skipped, skipped);
        return samples;
    }

    private List<Project> listProjects(DomainFilter filter) throws SourceUnavailableException {
        Map<String, String> domainNames = new HashMap<>();
        List<Project> projects = new ArrayList<>();
        for (JsonNode node : client.listProjects(filter.domainId())) {
            String domainId = node.path("domain_id").asText("");
            String domainName = domainNames.get(domainId);
            if (domainName == null) {
                domainName = domainId.isEmpty() ? "" : client.domainName(domainId);
                domainNames.put(domainId, domainName);
            }
            projects.add(new Project(node.path("id").asText(), node.path("name").asText(), domainId, domainName));
        }
        return projects;
    }

    /**
     * Per-server usage for the umbrella project; usage API figures are size times hours.
     */
    private List<InstanceUsage> instanceUsages(Project project, JsonNode usage) throws SourceUnavailableException {
        Map<String, Map<String, String>> metadata = client.serverMetadata(project.projectId);
        List<InstanceUsage> instances = new ArrayList<>();
        for (JsonNode server : usage.path("server_usages")) {
            String instanceId = server.path("instance_id").asText();
            double hours = server.path("hours").asDouble(0.0);
            instances.add(new InstanceUsage(instanceId,
                    server.path("memory_mb").asDouble(0.0) * hours,
                    server.path("vcpus").asDouble(0.0) * hours,
                    metadata.getOrDefault(instanceId, Map.of())));
        }
        return instances;
    }

    @Override
    public String describe() {
        return "openstack(simpleVm: " + simpleVm + ")";
    }
}
