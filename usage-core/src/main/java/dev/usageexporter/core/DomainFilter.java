package dev.usageexporter.core;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Decides which projects are exported.
 *
 * A configured domain id wins over everything else and is matched exactly. Otherwise a project
 * is accepted when its domain name is one of the configured names. With neither configured,
 * every readable project is accepted.
 */
public final class DomainFilter {
    private static final DomainFilter ACCEPT_ALL = new DomainFilter(null, Set.of());

    private final String domainId;
    private final Set<String> domainNames;

    private DomainFilter(String domainId, Collection<String> domainNames) {
        this.domainId = domainId;
        this.domainNames = Set.copyOf(new LinkedHashSet<>(domainNames));
    }

    public static DomainFilter acceptAll() {
        return ACCEPT_ALL;
    }

    public static DomainFilter byDomainId(String domainId) {
        Objects.requireNonNull(domainId, "domainId");
        return new DomainFilter(domainId, Set.of());
    }

    public static DomainFilter byDomainNames(Collection<String> domainNames) {
        return domainNames.isEmpty() ? ACCEPT_ALL : new DomainFilter(null, domainNames);
    }

    /**
     * Builds a filter from raw configuration; blank ids count as absent and the names are
     * ignored whenever an id is present.
     */
    public static DomainFilter of(String domainId, Collection<String> domainNames) {
        if (domainId != null && !domainId.isBlank()) {
            return byDomainId(domainId.trim());
        }
        return byDomainNames(domainNames);
    }

    public boolean accepts(Project project) {
        if (domainId != null) {
            return domainId.equals(project.domainId);
        }
        return domainNames.isEmpty() || domainNames.contains(project.domainName);
    }

    /** The configured domain id, if filtering by id. */
    public Optional<String> domainId() {
        return Optional.ofNullable(domainId);
    }

    @Override
    public String toString() {
        if (domainId != null) {
            return "domain_id=" + domainId;
        }
        return domainNames.isEmpty() ? "all domains" : "domains=" + domainNames;
    }
}
