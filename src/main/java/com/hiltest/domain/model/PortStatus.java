package com.hiltest.domain.model;

/**
 * Estados de un puerto de hub derivados de la salida de texto de la
 * herramienta de alimentación.
 */
public enum PortStatus {
    /**
     * Puerto sin alimentación
     */
    OFF("off"),

    /**
     * Puerto alimentado sin dispositivo enumerado
     */
    ON("on"),

    /**
     * Puerto alimentado con dispositivo conectado
     */
    ON_CONNECTED("on connected"),

    /**
     * No se pudo determinar el estado
     */
    UNKNOWN("unknown");

    private final String label;

    PortStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
