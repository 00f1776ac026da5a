package com.hiltest.domain.model;

/**
 * Rol de un dispositivo dentro de una prueba.
 */
public enum DeviceRole {
    /**
     * Dispositivo bajo prueba
     */
    DUT,

    /**
     * Dispositivo auxiliar que ejecuta el script contraparte
     */
    STUB
}
