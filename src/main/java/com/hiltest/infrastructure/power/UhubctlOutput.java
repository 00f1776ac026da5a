package com.hiltest.infrastructure.power;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Salida estándar de una invocación de uhubctl.
 *
 * Es el valor que devuelve cada invocación y que consumen las funciones de
 * {@link UhubctlOutputParser}; una salida vacía representa "sin hubs".
 */
public record UhubctlOutput(String text) {

    private static final UhubctlOutput EMPTY = new UhubctlOutput("");

    public UhubctlOutput {
        text = text == null ? "" : text;
    }

    public static UhubctlOutput empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return text.isBlank();
    }

    /**
     * Líneas recortadas y no vacías, en orden.
     */
    public List<String> lines() {
        return Arrays.stream(text.split("\\R"))
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.toList());
    }
}
