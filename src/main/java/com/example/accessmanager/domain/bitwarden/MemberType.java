package com.example.accessmanager.domain.bitwarden;

import com.example.accessmanager.domain.ConfigurationException;

import java.util.Locale;

/** Organization user type. The Bitwarden API encodes it as the ordinal. */
public enum MemberType {
    OWNER,
    ADMIN,
    USER,
    MANAGER,
    CUSTOM;

    public static MemberType fromCode(int code) {
        MemberType[] types = values();
        if (code < 0 || code >= types.length) {
            throw new IllegalArgumentException("Unknown member type code " + code);
        }
        return types[code];
    }

    public static MemberType fromName(String name) {
        try {
            return valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException("Unknown member type '" + name + "'", ex);
        }
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
