package com.hiltest.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Modelo de dominio que representa información de un puerto serial
 * enumerado en el sistema.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SerialPortInfo {

    /** Ruta del puerto (ej: /dev/ttyACM0, COM3) */
    private String systemPortPath;

    /** Descripción del puerto */
    private String descriptivePortName;

    /** Número de serie del dispositivo USB (si aplica) */
    private String serialNumber;

    /** Vendor ID del dispositivo USB (si aplica) */
    private String vendorId;

    /** Product ID del dispositivo USB (si aplica) */
    private String productId;

    /**
     * Convierte el puerto en un acceso serie de dispositivo.
     */
    public SerialAccess toAccess() {
        return SerialAccess.builder()
                .address(systemPortPath)
                .serialNumber(serialNumber)
                .build();
    }
}
