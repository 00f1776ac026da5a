package com.hiltest.application.service;

import com.hiltest.domain.model.ResolvedDevices;
import com.hiltest.domain.model.TestCase;

/**
 * Estrategia para obtener los dispositivos (DUT y stub) de una prueba.
 * Se elige una vez al arrancar la ejecución del plan.
 */
public interface DeviceResolutionStrategy {

    /**
     * Resuelve los dispositivos de la prueba. Nunca devuelve null: un
     * dispositivo no disponible se representa sin acceso serie.
     *
     * @param testCase Prueba a ejecutar
     * @return Par DUT/stub
     */
    ResolvedDevices resolve(TestCase testCase);

    /**
     * Descripción breve para el log de cabecera del plan.
     */
    String describe();
}
