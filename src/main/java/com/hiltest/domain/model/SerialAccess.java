package com.hiltest.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Modelo de dominio que representa el acceso serie a un dispositivo.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SerialAccess {

    /** Ruta del puerto serie (ej: /dev/ttyACM0, COM3) */
    private String address;

    /** Número de serie del hardware USB (si aplica) */
    private String serialNumber;

    /**
     * Crea un acceso a partir de una dirección fija, sin número de serie.
     *
     * @param address Ruta del puerto serie
     * @return Nuevo SerialAccess
     */
    public static SerialAccess of(String address) {
        return SerialAccess.builder()
                .address(address)
                .build();
    }
}
