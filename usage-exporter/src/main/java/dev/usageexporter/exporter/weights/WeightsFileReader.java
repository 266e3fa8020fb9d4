package dev.usageexporter.exporter.weights;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import dev.usageexporter.core.ConfigurationException;
import dev.usageexporter.core.WeightTable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a dummy-weights TOML file holding {@code mb_weight} and {@code vcpu_weight}.
 */
public final class WeightsFileReader {

    private WeightsFileReader() {
    }

    public static WeightTable read(Path file) {
        JsonNode root;
        try {
            root = new TomlMapper().readTree(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read weights file " + file + ": " + e.getMessage(), e);
        }
        JsonNode mb = root == null ? null : root.get("mb_weight");
        JsonNode vcpu = root == null ? null : root.get("vcpu_weight");
        if (mb == null || vcpu == null || !mb.isNumber() || !vcpu.isNumber()) {
            throw new ConfigurationException(
                    "Weights file " + file + " must define numeric mb_weight and vcpu_weight");
        }
        try {
            return new WeightTable(mb.asDouble(), vcpu.asDouble());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Weights file " + file + ": " + e.getMessage(), e);
        }
    }
}
