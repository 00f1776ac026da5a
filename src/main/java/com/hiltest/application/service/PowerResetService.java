package com.hiltest.application.service;

import com.hiltest.domain.model.Device;
import com.hiltest.domain.model.DeviceSwitch;
import com.hiltest.domain.model.PortStatus;
import com.hiltest.domain.model.PowerAction;
import com.hiltest.domain.model.ResolvedDevices;
import com.hiltest.domain.port.PowerControlPort;
import com.hiltest.domain.port.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Reinicio por ciclo de alimentación de los dispositivos conmutables antes
 * de cada prueba.
 *
 * Tras el ciclo se consulta el estado del puerto hasta que aparece el
 * dispositivo conectado o se agotan los intentos; en ambos casos se espera
 * el tiempo de asentamiento y la prueba continúa.
 */
@Service
@Slf4j
public class PowerResetService {

    private final PowerControlPort powerControl;
    private final Sleeper sleeper;

    @Value("${hil.reset.poll-attempts:5}")
    private int pollAttempts = 5;

    @Value("${hil.reset.poll-interval-ms:1000}")
    private long pollIntervalMs = 1000;

    @Value("${hil.reset.settle-delay-ms:2000}")
    private long settleDelayMs = 2000;

    public PowerResetService(PowerControlPort powerControl, Sleeper sleeper) {
        this.powerControl = powerControl;
        this.sleeper = sleeper;
    }

    /**
     * Reinicia el DUT y el stub, en ese orden, si tienen interruptor.
     */
    public void resetSwitchableDevices(ResolvedDevices devices) {
        for (Device device : List.of(devices.dut(), devices.stub())) {
            if (device.isSwitchable()) {
                resetAndWait(device);
            }
        }
    }

    /**
     * Ciclo de alimentación y espera de disponibilidad de un dispositivo.
     *
     * @param device Dispositivo con interruptor
     * @return true si el puerto llegó a "on connected" antes de agotar los intentos
     */
    public boolean resetAndWait(Device device) {
        DeviceSwitch powerSwitch = device.getPowerSwitch();
        log.info("Ciclo de alimentación del dispositivo {} (hub={} puerto={})",
                device.getName(), powerSwitch.getHub(), powerSwitch.getPort());

        powerControl.runAction(PowerAction.CYCLE, powerSwitch.getHub(), powerSwitch.getPort());

        boolean connected = false;
        if (powerSwitch.getPort() != null) {
            int attempts = 0;
            connected = isConnected(powerSwitch);
            while (!connected && attempts < pollAttempts) {
                sleeper.sleep(pollIntervalMs);
                attempts++;
                connected = isConnected(powerSwitch);
            }
        }

        if (!connected) {
            log.warn("El dispositivo {} no aparece conectado tras el ciclo, se continúa igualmente",
                    device.getName());
        }

        // Tiempo extra para que arranque el firmware
        sleeper.sleep(settleDelayMs);
        return connected;
    }

    void setTimings(int pollAttempts, long pollIntervalMs, long settleDelayMs) {
        this.pollAttempts = pollAttempts;
        this.pollIntervalMs = pollIntervalMs;
        this.settleDelayMs = settleDelayMs;
    }

    private boolean isConnected(DeviceSwitch powerSwitch) {
        return powerControl.getStatus(powerSwitch.getHub(), powerSwitch.getPort()) == PortStatus.ON_CONNECTED;
    }
}
