package com.example.accessmanager.domain.github;

import com.example.accessmanager.domain.ConfigurationException;

import java.util.Locale;

public enum OrganizationRole {
    ADMIN("admin"),
    MEMBER("member");

    private final String value;

    OrganizationRole(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static OrganizationRole fromValue(String value) {
        for (OrganizationRole role : values()) {
            if (role.value.equals(value.toLowerCase(Locale.ROOT))) {
                return role;
            }
        }
        throw new ConfigurationException("Unknown organization role '" + value + "'");
    }
}
