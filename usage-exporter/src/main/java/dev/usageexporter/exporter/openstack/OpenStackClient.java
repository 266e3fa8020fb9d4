package dev.usageexporter.exporter.openstack;

import com.fasterxml.jackson.databind.JsonNode;
import dev.usageexporter.core.SourceUnavailableException;
import dev.usageexporter.exporter.JsonHttpClient;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only calls against Keystone (projects, domains) and Nova (simple tenant usage, server
 * details) authenticated with a pre-issued token.
 */
public class OpenStackClient {
    private static final String AUTH_HEADER = "X-Auth-Token";
    private static final DateTimeFormatter USAGE_DATE =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS").withZone(ZoneOffset.UTC);

    private final JsonHttpClient http;
    private final OpenStackCredentials credentials;

    public OpenStackClient(JsonHttpClient http, OpenStackCredentials credentials) {
        this.http = http;
        this.credentials = credentials;
    }

    /**
     * Projects with {@code id}, {@code name} and {@code domain_id}; restricted to one domain when
     * an id is given.
     */
    public List<JsonNode> listProjects(Optional<String> domainId) throws SourceUnavailableException {
        String query = domainId.map(id -> "?domain_id=" + encode(id)).orElse("");
        JsonNode body = get(credentials.identityEndpoint + "/v3/projects" + query);
        JsonNode projects = body.path("projects");
        if (!projects.isArray()) {
            throw new SourceUnavailableException("Identity API returned no projects array");
        }
        List<JsonNode> result = new ArrayList<>();
        projects.forEach(result::add);
        return result;
    }

    public String domainName(String domainId) throws SourceUnavailableException {
        JsonNode domain = get(credentials.identityEndpoint + "/v3/domains/" + encode(domainId)).path("domain");
        return domain.path("name").asText(domainId);
    }

    /**
     * The {@code tenant_usage} object for one project; empty when the project had no servers
     * in the window.
     */
    public JsonNode tenantUsage(String projectId, Instant start, Instant end) throws SourceUnavailableException {
        String url = credentials.computeEndpoint + "/os-simple-tenant-usage/" + encode(projectId)
                + "?start=" + USAGE_DATE.format(start)
                + "&end=" + USAGE_DATE.format(end);
        return get(url).path("tenant_usage");
    }

    /**
     * Server id to metadata for every server of a project, following {@code servers_links}
     * pagination. {@code all_tenants} is required: without it Nova replaces the project filter
     * with the token's own project.
     */
    public Map<String, Map<String, String>> serverMetadata(String projectId) throws SourceUnavailableException {
        Map<String, Map<String, String>> metadata = new LinkedHashMap<>();
        Set<String> visited = new HashSet<>();
        String url = credentials.computeEndpoint + "/servers/detail?all_tenants=1&project_id=" + encode(projectId);
        while (url != null && visited.add(url)) {
            JsonNode body = get(url);
            for (JsonNode server : body.path("servers")) {
                Map<String, String> values = new LinkedHashMap<>();
                server.path("metadata").fields().forEachRemaining(e -> values.put(e.getKey(), e.getValue().asText()));
                metadata.put(server.path("id").asText(), values);
            }
            url = body.path("servers").size() == 0 ? null : nextLink(body.path("servers_links"));
        }
        return metadata;
    }

    private static String nextLink(JsonNode links) {
        for (JsonNode link : links) {
            if ("next".equals(link.path("rel").asText()) && link.hasNonNull("href")) {
                return link.path("href").asText();
            }
        }
        return null;
    }

    private JsonNode get(String url) throws SourceUnavailableException {
        return http.get(URI.create(url), Map.of(AUTH_HEADER, credentials.token));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
