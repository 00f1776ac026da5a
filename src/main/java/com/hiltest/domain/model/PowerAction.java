package com.hiltest.domain.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * Acciones soportadas sobre un puerto de hub conmutable.
 */
public enum PowerAction {
    ON("on"),
    OFF("off"),
    CYCLE("cycle"),
    TOGGLE("toggle");

    private final String value;

    PowerAction(String value) {
        this.value = value;
    }

    /**
     * Valor usado en el argumento --action.
     */
    public String getValue() {
        return value;
    }

    public static PowerAction fromValue(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(a -> a.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Acción desconocida: " + value));
    }
}
