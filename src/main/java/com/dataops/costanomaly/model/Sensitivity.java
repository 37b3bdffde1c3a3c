package com.dataops.costanomaly.model;

import com.dataops.costanomaly.exception.ValidationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

public enum Sensitivity {
    LOW,
    MEDIUM,
    HIGH;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Sensitivity fromValue(String value) {
        if (value != null) {
            for (Sensitivity s : values()) {
                if (s.name().equalsIgnoreCase(value.trim())) {
                    return s;
                }
            }
        }
        throw new ValidationException("Sensitivity must be one of "
                + Arrays.stream(values()).map(Sensitivity::value).collect(Collectors.joining(", "))
                + " but was: " + value, "sensitivity");
    }
}
