package dev.usageexporter.core;

import java.util.Objects;

/**
 * Identity of a project (tenant) whose usage is exported.
 * Instances are rebuilt from the usage source on every tick and never mutated.
 */
public final class Project {
    public final String projectId;
    public final String projectName;
    public final String domainId;
    public final String domainName;

    public Project(String projectId, String projectName, String domainId, String domainName) {
        this.projectId = Objects.requireNonNull(projectId, "projectId");
        this.projectName = Objects.requireNonNull(projectName, "projectName");
        this.domainId = domainId == null ? "" : domainId;
        this.domainName = domainName == null ? "" : domainName;
    }

    /**
     * Same project ids and domain, different display name. Used for SimpleVM sub-projects.
     */
    public Project withProjectName(String name) {
        return new Project(projectId, name, domainId, domainName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Project)) return false;
        Project other = (Project) o;
        return projectId.equals(other.projectId)
                && projectName.equals(other.projectName)
                && domainId.equals(other.domainId)
                && domainName.equals(other.domainName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(projectId, projectName, domainId, domainName);
    }

    @Override
    public String toString() {
        return String.format("%s(%s)@%s(%s)", projectName, projectId, domainName, domainId);
    }
}
