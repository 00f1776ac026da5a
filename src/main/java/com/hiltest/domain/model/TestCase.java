package com.hiltest.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Modelo de dominio que representa una prueba del plan.
 *
 * Las rutas de los scripts son relativas al directorio de pruebas de
 * MicroPython. El tipo se fija al cargar el plan y no se vuelve a deducir.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TestCase {

    /** Nombre único de la prueba dentro del plan */
    private String name;

    /** Tipo de ejecución */
    private TestType type;

    /** Scripts o directorios de prueba, en orden */
    @Builder.Default
    private List<String> scripts = new ArrayList<>();

    /** Scripts excluidos */
    @Builder.Default
    private Set<String> excludes = new LinkedHashSet<>();

    /** Espera tras cada script (solo single_post_delay) */
    private int postTestDelayMs;

    /** Script que ejecuta el stub (solo multi_stub) */
    private String stubScript;

    /** Espera tras arrancar el stub */
    private int postStubDelayMs;

    /** Dispositivos soportados como DUT */
    @Builder.Default
    private List<DeviceRequirement> dutRequirements = new ArrayList<>();

    /** Dispositivos soportados como stub */
    @Builder.Default
    private List<DeviceRequirement> stubRequirements = new ArrayList<>();

    /** Argumentos extra para pruebas custom */
    @Builder.Default
    private List<String> customArgs = new ArrayList<>();

    public boolean requiresMultipleDevices() {
        return type.requiresMultipleDevices();
    }

    /**
     * Obtiene los requisitos que aplican a un rol y a una placa.
     * Las pruebas MULTI usan la lista del DUT también para el stub.
     *
     * @param role  Rol del dispositivo
     * @param board Nombre de la placa
     * @return Requisitos cuya placa coincide
     */
    public List<DeviceRequirement> getSupportedDevices(DeviceRole role, String board) {
        List<DeviceRequirement> source;
        if (role == DeviceRole.DUT || type == TestType.MULTI) {
            source = dutRequirements;
        } else {
            source = stubRequirements;
        }

        return source.stream()
                .filter(r -> board != null && board.equals(r.getBoard()))
                .collect(Collectors.toList());
    }
}
