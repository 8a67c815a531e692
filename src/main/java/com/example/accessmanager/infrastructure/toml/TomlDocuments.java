package com.example.accessmanager.infrastructure.toml;

import com.example.accessmanager.domain.ConfigurationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads TOML files into Jackson trees and extracts typed values with
 * descriptive errors.
 */
final class TomlDocuments {
    private static final TomlMapper MAPPER = new TomlMapper();

    private TomlDocuments() {}

    static JsonNode read(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return MAPPER.readTree(in);
        } catch (IOException ex) {
            throw new ConfigurationException("Failed to read " + file + ": " + ex.getMessage(), ex);
        }
    }

    static List<JsonNode> tables(JsonNode root, String key) {
        JsonNode node = root.get(key);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new ConfigurationException("Expected '" + key + "' to be an array of tables");
        }
        List<JsonNode> result = new ArrayList<>();
        node.forEach(result::add);
        return result;
    }

    static JsonNode requiredTable(JsonNode root, String key) {
        JsonNode node = root.get(key);
        if (node == null || !node.isObject()) {
            throw new ConfigurationException("Missing table [" + key + "]");
        }
        return node;
    }

    static String requiredText(JsonNode table, String key, String context) {
        JsonNode node = table.get(key);
        if (node == null || !node.isValueNode()) {
            throw new ConfigurationException("Missing key '" + key + "' in " + context);
        }
        return node.asText();
    }

    static String optionalText(JsonNode table, String key, String defaultValue) {
        JsonNode node = table.get(key);
        return node == null || node.isNull() ? defaultValue : node.asText();
    }

    static long requiredLong(JsonNode table, String key, String context) {
        JsonNode node = table.get(key);
        if (node == null || !node.canConvertToLong()) {
            throw new ConfigurationException("Missing integer key '" + key + "' in " + context);
        }
        return node.asLong();
    }

    static long optionalLong(JsonNode table, String key, long defaultValue) {
        JsonNode node = table.get(key);
        if (node == null) {
            return defaultValue;
        }
        if (!node.canConvertToLong()) {
            throw new ConfigurationException("Expected integer value for '" + key + "'");
        }
        return node.asLong();
    }

    static boolean optionalBoolean(JsonNode table, String key, boolean defaultValue) {
        JsonNode node = table.get(key);
        if (node == null) {
            return defaultValue;
        }
        if (!node.isBoolean()) {
            throw new ConfigurationException("Expected boolean value for '" + key + "'");
        }
        return node.asBoolean();
    }

    static List<String> textList(JsonNode table, String key) {
        JsonNode node = table.get(key);
        if (node == null) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new ConfigurationException("Expected '" + key + "' to be a list");
        }
        List<String> values = new ArrayList<>();
        node.forEach(value -> values.add(value.asText()));
        return values;
    }
}
