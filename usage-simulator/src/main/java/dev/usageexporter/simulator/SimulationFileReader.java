package dev.usageexporter.simulator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import dev.usageexporter.core.Instants;
import dev.usageexporter.core.Project;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses the TOML machine-lifetime file.
 *
 * Layout: one table per domain ({@code domain_id} optional), holding an array of
 * {@code projects} ({@code project_name}, optional {@code project_id}), each holding an array of
 * {@code machines} ({@code memory_mb}, {@code vcpus}, {@code started_at}, {@code ended_at},
 * {@code instance_id}, {@code metadata}). Malformed projects or machines are skipped with a
 * warning; a file that is not valid TOML fails as a whole.
 */
public class SimulationFileReader {
    private static final Logger logger = LoggerFactory.getLogger(SimulationFileReader.class);

    static final double DEFAULT_MEMORY_MB = 8192;
    static final double DEFAULT_VCPUS = 4;

    private final TomlMapper mapper = new TomlMapper();
    private final Instant simulationStart;

    /**
     * @param simulationStart start time for machines that do not declare {@code started_at}
     */
    public SimulationFileReader(Instant simulationStart) {
        this.simulationStart = simulationStart;
    }

    public List<SimulatedProject> read(Path file) throws IOException {
        JsonNode root;
        try {
            root = mapper.readTree(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new IOException("Cannot read simulation file " + file + ": " + e.getMessage(), e);
        }

        List<SimulatedProject> projects = new ArrayList<>();
        if (root == null) {
            return projects;
        }
        Iterator<Map.Entry<String, JsonNode>> domains = root.fields();
        while (domains.hasNext()) {
            Map.Entry<String, JsonNode> domain = domains.next();
            if (!domain.getValue().isObject()) {
                logger.warn("Skipping top-level key '{}' in {}: expected a domain table", domain.getKey(), file);
                continue;
            }
            readDomain(domain.getKey(), domain.getValue(), projects);
        }
        return projects;
    }

    private void readDomain(String domainName, JsonNode domain, List<SimulatedProject> out) {
        String domainId = text(domain, "domain_id", ProjectIds.fromName(domainName));
        JsonNode projects = domain.path("projects");
        if (!projects.isArray()) {
            logger.warn("Domain '{}' declares no projects array", domainName);
            return;
        }
        int index = 0;
        for (JsonNode node : projects) {
            index++;
            String projectName = text(node, "project_name", null);
            if (projectName == null) {
                logger.warn("Skipping project #{} of domain '{}': project_name missing", index, domainName);
                continue;
            }
            Project project = new Project(text(node, "project_id", ProjectIds.fromName(projectName)),
                    projectName, domainId, domainName);
            out.add(new SimulatedProject(project, readMachines(project, node.path("machines"))));
        }
    }

    private List<LifetimeSpec> readMachines(Project project, JsonNode machines) {
        List<LifetimeSpec> specs = new ArrayList<>();
        if (!machines.isArray()) {
            return specs;
        }
        int index = 0;
        for (JsonNode node : machines) {
            index++;
            try {
                specs.add(readMachine(project, index, node));
            } catch (IllegalArgumentException e) {
                logger.warn("Skipping machine #{} of project '{}': {}", index, project.projectName, e.getMessage());
            }
        }
        return specs;
    }

    private LifetimeSpec readMachine(Project project, int index, JsonNode node) {
        if (!node.isObject()) {
            throw new IllegalArgumentException("expected a table, got '" + node.asText() + "'");
        }
        String instanceId = text(node, "instance_id", project.projectName + "-" + index);
        double memoryMb = number(node, "memory_mb", DEFAULT_MEMORY_MB);
        double vcpus = number(node, "vcpus", DEFAULT_VCPUS);
        String started = text(node, "started_at", null);
        String ended = text(node, "ended_at", null);
        Instant startedAt = started == null ? simulationStart : Instants.parse(started);
        Instant endedAt = ended == null || "ongoing".equalsIgnoreCase(ended) ? null : Instants.parse(ended);

        Map<String, String> metadata = new LinkedHashMap<>();
        node.path("metadata").fields().forEachRemaining(e -> metadata.put(e.getKey(), e.getValue().asText()));

        return new LifetimeSpec(project, instanceId, memoryMb, vcpus, startedAt, endedAt, metadata);
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            return fallback;
        }
        return value.asText();
    }

    private static double number(JsonNode node, String field, double fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (!value.isNumber()) {
            throw new IllegalArgumentException(field + " must be a number, got '" + value.asText() + "'");
        }
        return value.asDouble();
    }
}
