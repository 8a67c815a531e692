package com.example.accessmanager.domain;

import com.fasterxml.jackson.core.io.JsonStringEncoder;

/**
 * Formatting helpers shared by the {@code render()} implementations.
 */
public final class TomlText {
    private TomlText() {}

    public static String quote(String value) {
        return '"' + new String(JsonStringEncoder.getInstance().quoteAsString(value)) + '"';
    }

    public static String keyValue(String key, String value) {
        return key + " = " + quote(value);
    }

    public static String keyValue(String key, long value) {
        return key + " = " + value;
    }

    public static String keyValue(String key, boolean value) {
        return key + " = " + value;
    }
}
