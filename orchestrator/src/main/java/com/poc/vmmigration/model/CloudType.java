package com.poc.vmmigration.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.poc.vmmigration.exception.InvalidArgumentException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Allowed cloud types for migration targets.
 */
public enum CloudType {
    AWS("aws"),
    AZURE("azure"),
    VSPHERE("vsphere"),
    VCLOUD("vcloud");

    private final String value;

    CloudType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parse a cloud type name, ignoring case.
     *
     * @throws InvalidArgumentException if the name is not a known cloud type
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static CloudType parse(String name) {
        if (name == null) {
            throw new InvalidArgumentException("Cloud type is required");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new InvalidArgumentException(
                        "Invalid cloud type: " + name + " (allowed: " + allowedValues() + ")"));
    }

    private static String allowedValues() {
        return Arrays.stream(values()).map(CloudType::getValue).collect(Collectors.joining(", "));
    }
}
