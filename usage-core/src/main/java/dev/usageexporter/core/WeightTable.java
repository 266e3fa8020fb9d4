package dev.usageexporter.core;

/**
 * Per-resource multipliers applied to raw usage before export.
 */
public final class WeightTable {
    public static final WeightTable NEUTRAL = new WeightTable(1.0, 1.0);

    public final double mbWeight;
    public final double vcpuWeight;

    public WeightTable(double mbWeight, double vcpuWeight) {
        if (!Double.isFinite(mbWeight) || !Double.isFinite(vcpuWeight)) {
            throw new IllegalArgumentException(
                    "Weights must be finite numbers (mb=" + mbWeight + ", vcpu=" + vcpuWeight + ")");
        }
        this.mbWeight = mbWeight;
        this.vcpuWeight = vcpuWeight;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WeightTable)) return false;
        WeightTable other = (WeightTable) o;
        return Double.compare(mbWeight, other.mbWeight) == 0
                && Double.compare(vcpuWeight, other.vcpuWeight) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(mbWeight) * 31 + Double.hashCode(vcpuWeight);
    }

    @Override
    public String toString() {
        return String.format("mb_weight=%s, vcpu_weight=%s", mbWeight, vcpuWeight);
    }
}
