package com.hiltest.application.service;

import com.hiltest.domain.model.DeviceSwitch;
import com.hiltest.domain.model.HubPort;
import com.hiltest.domain.model.HubPortObservation;
import com.hiltest.domain.model.PortStatus;
import com.hiltest.domain.model.PowerAction;
import com.hiltest.domain.port.PowerControlPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Operaciones manuales sobre los interruptores de alimentación.
 */
@Service
@Slf4j
public class DeviceSwitchService {

    private final PowerControlPort powerControl;

    public DeviceSwitchService(PowerControlPort powerControl) {
        this.powerControl = powerControl;
    }

    public void on(DeviceSwitch powerSwitch) {
        powerControl.runAction(PowerAction.ON, powerSwitch.getHub(), powerSwitch.getPort());
    }

    public void off(DeviceSwitch powerSwitch) {
        powerControl.runAction(PowerAction.OFF, powerSwitch.getHub(), powerSwitch.getPort());
    }

    public void reset(DeviceSwitch powerSwitch) {
        powerControl.runAction(PowerAction.CYCLE, powerSwitch.getHub(), powerSwitch.getPort());
    }

    public PortStatus status(DeviceSwitch powerSwitch) {
        if (powerSwitch.getPort() == null) {
            return PortStatus.UNKNOWN;
        }
        return powerControl.getStatus(powerSwitch.getHub(), powerSwitch.getPort());
    }

    /**
     * Ejecuta una acción arbitraria; hub y puerto nulos significan "todos".
     */
    public void runAction(PowerAction action, String hub, Integer port) {
        powerControl.runAction(action, hub, port);
    }

    /**
     * Un interruptor por cada par (hub, puerto) observado, duplicados incluidos.
     */
    public List<DeviceSwitch> scanSwitches() {
        return powerControl.scanHubsPorts().stream()
                .map(DeviceSwitch::of)
                .collect(Collectors.toList());
    }

    public List<HubPortObservation> scanObservations() {
        return powerControl.scanObservations();
    }

    /**
     * Ciclo de alimentación de todos los puertos de cada hub distinto, una
     * sola vez por hub.
     *
     * @return Hubs reiniciados
     */
    public Set<String> resetAll() {
        Set<String> hubs = powerControl.scanHubsPorts().stream()
                .map(HubPort::hub)
                .collect(Collectors.toCollection(LinkedHashSet::new));

        for (String hub : hubs) {
            log.info("Reiniciando todos los puertos del hub {}", hub);
            powerControl.runAction(PowerAction.CYCLE, hub, null);
        }
        return hubs;
    }
}
