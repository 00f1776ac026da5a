package com.hiltest.domain.model;

import java.util.Objects;

/**
 * Par de dispositivos resuelto para una prueba (DUT y stub).
 * Ninguno es nulo: un dispositivo no resuelto se representa sin acceso.
 */
public record ResolvedDevices(Device dut, Device stub) {

    public ResolvedDevices {
        Objects.requireNonNull(dut, "dut");
        Objects.requireNonNull(stub, "stub");
    }

    public static ResolvedDevices none() {
        return new ResolvedDevices(Device.unresolved(), Device.unresolved());
    }
}
