package com.hiltest.application.service;

import com.hiltest.domain.model.Device;
import com.hiltest.domain.model.DeviceRequirement;
import com.hiltest.domain.model.DeviceRole;
import com.hiltest.domain.model.ResolvedDevices;
import com.hiltest.domain.model.TestCase;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Resolución contra el registro de dispositivos HIL para una placa.
 *
 * El DUT es el primer candidato accesible; el stub, el primer candidato
 * accesible con una dirección distinta de la del DUT.
 */
@Slf4j
public class HilCatalogResolution implements DeviceResolutionStrategy {

    private final DeviceRegistry deviceRegistry;
    private final Path registryPath;
    private final String board;

    public HilCatalogResolution(DeviceRegistry deviceRegistry, Path registryPath, String board) {
        this.deviceRegistry = Objects.requireNonNull(deviceRegistry, "deviceRegistry");
        this.registryPath = Objects.requireNonNull(registryPath, "registryPath");
        this.board = Objects.requireNonNull(board, "board");
    }

    @Override
    public ResolvedDevices resolve(TestCase testCase) {
        Device dut = candidates(testCase, DeviceRole.DUT).stream()
                .filter(Device::hasAccess)
                .findFirst()
                .orElse(null);

        if (dut == null) {
            log.debug("Sin DUT accesible para {} en placa {}", testCase.getName(), board);
            return ResolvedDevices.none();
        }

        Device stub = Device.unresolved();
        if (testCase.requiresMultipleDevices()) {
            stub = candidates(testCase, DeviceRole.STUB).stream()
                    .filter(Device::hasAccess)
                    .filter(d -> !d.getAddress().equals(dut.getAddress()))
                    .findFirst()
                    .orElse(Device.unresolved());
        }

        return new ResolvedDevices(dut, stub);
    }

    @Override
    public String describe() {
        return "registro HIL " + registryPath + " (placa " + board + ")";
    }

    /**
     * Dispositivos del registro que cumplen algún requisito del rol. El
     * registro se vuelve a cargar por cada requisito para reflejar el
     * hardware conectado en ese momento.
     */
    private List<Device> candidates(TestCase testCase, DeviceRole role) {
        List<Device> candidates = new ArrayList<>();
        for (DeviceRequirement requirement : testCase.getSupportedDevices(role, board)) {
            for (Device device : deviceRegistry.load(registryPath)) {
                if (requirement.isSatisfiedBy(device)) {
                    candidates.add(device);
                }
            }
        }
        return candidates;
    }
}
