package com.hiltest.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Dirección de un interruptor de alimentación USB (hub + puerto).
 * Un puerto nulo representa todos los puertos del hub.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceSwitch {

    /** Ubicación del hub (ej: 1-1.3) */
    private String hub;

    /** Número de puerto dentro del hub, null para todos los puertos */
    private Integer port;

    public static DeviceSwitch of(HubPort hubPort) {
        return new DeviceSwitch(hubPort.hub(), hubPort.port());
    }
}
