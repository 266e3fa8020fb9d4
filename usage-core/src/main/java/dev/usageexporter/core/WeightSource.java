package dev.usageexporter.core;

/**
 * Supplies the current weight table. Implementations never throw for transport problems;
 * they fall back to the last value they successfully obtained.
 */
public interface WeightSource {

    WeightTable current();

    /** Neutral weights, used when nothing else is configured. */
    static WeightSource neutral() {
        return new StaticWeightSource(WeightTable.NEUTRAL);
    }
}
