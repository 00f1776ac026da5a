package com.hiltest.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Modelo de dominio que representa una placa declarada en el registro de
 * dispositivos.
 *
 * El acceso serie y el interruptor se enlazan al construir el dispositivo
 * comparando el {@code uid} con el hardware conectado en ese momento. Un
 * dispositivo sin enlaces es válido: simplemente no está conectado.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Device {

    /** Nombre de la placa (ej: CY8CKIT-062S2-AI) */
    private String name;

    /** Identificador estable del hardware (número de serie USB) */
    private String uid;

    /** Características declaradas (versiones, periféricos, etc.) */
    @Builder.Default
    private Set<String> features = new LinkedHashSet<>();

    /** Acceso serie enlazado, null si no está conectado */
    private SerialAccess access;

    /** Interruptor de alimentación enlazado, null si no es conmutable */
    private DeviceSwitch powerSwitch;

    /**
     * Dispositivo vacío, sin acceso ni interruptor.
     */
    public static Device unresolved() {
        return Device.builder().build();
    }

    /**
     * Dispositivo anónimo accesible por un puerto fijo.
     *
     * @param address Puerto serie, puede ser null
     * @return Dispositivo sin interruptor
     */
    public static Device atAddress(String address) {
        return Device.builder()
                .access(address != null ? SerialAccess.of(address) : null)
                .build();
    }

    public boolean hasAccess() {
        return access != null && access.getAddress() != null;
    }

    public boolean isSwitchable() {
        return powerSwitch != null;
    }

    /**
     * Obtiene la dirección del acceso serie.
     *
     * @return Dirección o null si no hay acceso
     */
    public String getAddress() {
        return hasAccess() ? access.getAddress() : null;
    }
}
