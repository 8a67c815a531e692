package com.example.accessmanager.domain.bitwarden;

import com.example.accessmanager.domain.ConfigurationException;

import java.util.Locale;

public enum GroupAccess {
    READONLY,
    WRITE;

    public static GroupAccess fromReadOnly(boolean readOnly) {
        return readOnly ? READONLY : WRITE;
    }

    public static GroupAccess fromName(String name) {
        try {
            return valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException("Unknown group access '" + name + "'", ex);
        }
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
