package com.hiltest.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Requisito de dispositivo declarado en el plan de pruebas.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceRequirement {

    /** Nombre de la placa requerida */
    private String board;

    /** Versión requerida, null para cualquier versión */
    private String version;

    /**
     * Verifica si un dispositivo del registro cumple este requisito.
     * La versión se busca entre las características del dispositivo.
     */
    public boolean isSatisfiedBy(Device device) {
        if (board == null || !board.equals(device.getName())) {
            return false;
        }
        return version == null || device.getFeatures().contains(version);
    }
}
