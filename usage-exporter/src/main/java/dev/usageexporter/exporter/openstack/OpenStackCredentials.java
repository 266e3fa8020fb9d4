package dev.usageexporter.exporter.openstack;

import java.net.URI;
import java.util.Map;
import java.util.Objects;

/**
 * A pre-issued Keystone token plus the identity and compute base URLs it is valid for.
 * Obtaining the token is left to the deployment.
 */
public final class OpenStackCredentials {
    public static final String TOKEN_ENV = "OS_AUTH_TOKEN";
    public static final String IDENTITY_ENDPOINT_ENV = "OS_IDENTITY_ENDPOINT";
    public static final String COMPUTE_ENDPOINT_ENV = "OS_COMPUTE_ENDPOINT";

    public final String token;
    public final URI identityEndpoint;
    public final URI computeEndpoint;

    public OpenStackCredentials(String token, URI identityEndpoint, URI computeEndpoint) {
        this.token = Objects.requireNonNull(token, "token");
        this.identityEndpoint = Objects.requireNonNull(identityEndpoint, "identityEndpoint");
        this.computeEndpoint = Objects.requireNonNull(computeEndpoint, "computeEndpoint");
    }

    /**
     * @return credentials, or {@code null} when any of the three variables is missing
     */
    public static OpenStackCredentials fromEnvironment(Map<String, String> env) {
        String token = env.get(TOKEN_ENV);
        String identity = env.get(IDENTITY_ENDPOINT_ENV);
        String compute = env.get(COMPUTE_ENDPOINT_ENV);
        if (isBlank(token) || isBlank(identity) || isBlank(compute)) {
            return null;
        }
        return new OpenStackCredentials(token.trim(), URI.create(stripSlash(identity)), URI.create(stripSlash(compute)));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String stripSlash(String url) {
        String trimmed = url.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    @Override
    public String toString() {
        return "identity=" + identityEndpoint + ", compute=" + computeEndpoint;
    }
}
