package dev.usageexporter.simulator;

import dev.usageexporter.core.Project;

import java.util.List;
import java.util.Objects;

/**
 * A project declared in the simulation file together with its machines.
 */
public final class SimulatedProject {
    public final Project project;
    public final List<LifetimeSpec> machines;

    public SimulatedProject(Project project, List<LifetimeSpec> machines) {
        this.project = Objects.requireNonNull(project, "project");
        this.machines = List.copyOf(machines);
    }
}
