package com.hiltest.application.service;

import com.hiltest.domain.model.Device;
import com.hiltest.domain.model.ResolvedDevices;
import com.hiltest.domain.model.TestCase;

/**
 * Resolución por puertos fijos: todas las pruebas usan los mismos puertos
 * DUT y stub, sin interruptor de alimentación.
 */
public class StaticPortResolution implements DeviceResolutionStrategy {

    private final String dutPort;
    private final String stubPort;

    public StaticPortResolution(String dutPort, String stubPort) {
        this.dutPort = dutPort;
        this.stubPort = stubPort;
    }

    @Override
    public ResolvedDevices resolve(TestCase testCase) {
        return new ResolvedDevices(Device.atAddress(dutPort), Device.atAddress(stubPort));
    }

    @Override
    public String describe() {
        return "puertos fijos (dut=" + dutPort + ", stub=" + stubPort + ")";
    }
}
