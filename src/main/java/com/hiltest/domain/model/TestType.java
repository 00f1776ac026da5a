package com.hiltest.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Tipos de prueba soportados por el ejecutor del plan.
 */
public enum TestType {
    /**
     * Pruebas de un solo dispositivo en una única invocación
     */
    SINGLE("single"),

    /**
     * Pruebas de un solo dispositivo, una invocación por script con espera entre ellas
     */
    SINGLE_POST_DELAY("single_post_delay"),

    /**
     * Pruebas de dos dispositivos con el framework multi-dispositivo
     */
    MULTI("multi"),

    /**
     * Prueba en el DUT con un script contraparte corriendo en el stub
     */
    MULTI_STUB("multi_stub"),

    /**
     * Scripts arbitrarios que reciben el puerto del DUT
     */
    CUSTOM("custom");

    private final String key;

    TestType(String key) {
        this.key = key;
    }

    /**
     * Clave usada en el documento del plan.
     */
    public String getKey() {
        return key;
    }

    public boolean requiresMultipleDevices() {
        return this == MULTI || this == MULTI_STUB;
    }

    public static Optional<TestType> fromKey(String key) {
        return Arrays.stream(values())
                .filter(t -> t.key.equals(key))
                .findFirst();
    }

    /**
     * Deduce el tipo cuando el plan no lo declara. MULTI y CUSTOM nunca se
     * deducen, deben declararse explícitamente.
     *
     * @param stubScript      Script del stub, puede ser null
     * @param postTestDelayMs Espera entre pruebas en milisegundos
     * @return Tipo deducido
     */
    public static TestType infer(String stubScript, int postTestDelayMs) {
        if (stubScript != null) {
            return MULTI_STUB;
        }
        return postTestDelayMs > 0 ? SINGLE_POST_DELAY : SINGLE;
    }
}
