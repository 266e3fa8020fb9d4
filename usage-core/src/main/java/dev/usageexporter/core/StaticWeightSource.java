package dev.usageexporter.core;

import java.util.Objects;

/**
 * Fixed weight table, e.g. read once from a dummy-weights file.
 */
public final class StaticWeightSource implements WeightSource {
    private final WeightTable weights;

    public StaticWeightSource(WeightTable weights) {
        this.weights = Objects.requireNonNull(weights, "weights");
    }

    @Override
    public WeightTable current() {
        return weights;
    }

    @Override
    public String toString() {
        return "static(" + weights + ")";
    }
}
