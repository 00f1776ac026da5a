package com.hiltest.application.service;

import com.hiltest.domain.model.Device;
import com.hiltest.domain.model.DeviceSwitch;
import com.hiltest.domain.model.SerialAccess;
import com.hiltest.domain.model.SerialPortInfo;
import com.hiltest.domain.port.PowerControlPort;
import com.hiltest.domain.port.SerialPortDirectory;
import com.hiltest.infrastructure.file.YamlDeviceRegistryReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Registro de dispositivos HIL.
 *
 * Cada llamada a {@link #load(Path)} vuelve a leer el documento y a enlazar
 * los dispositivos con el hardware conectado en ese momento; no hay cache
 * entre llamadas.
 */
@Service
@Slf4j
public class DeviceRegistry {

    private final YamlDeviceRegistryReader registryReader;
    private final SerialPortDirectory serialPortDirectory;
    private final PowerControlPort powerControl;

    public DeviceRegistry(YamlDeviceRegistryReader registryReader,
            SerialPortDirectory serialPortDirectory,
            PowerControlPort powerControl) {
        this.registryReader = registryReader;
        this.serialPortDirectory = serialPortDirectory;
        this.powerControl = powerControl;
    }

    /**
     * Carga los dispositivos declarados y enlaza su acceso serie e
     * interruptor por el uid.
     *
     * @param registryPath Ruta del registro YAML
     * @return Un dispositivo por entrada, conectado o no
     */
    public List<Device> load(Path registryPath) {
        List<Device> devices = registryReader.read(registryPath);
        devices.forEach(this::bind);

        log.debug("Registro cargado: {} dispositivos, {} accesibles", devices.size(),
                devices.stream().filter(Device::hasAccess).count());
        return devices;
    }

    /**
     * Lee el registro sin enlazar hardware, para detectar un archivo ausente
     * o mal formado antes de ejecutar nada.
     *
     * @param registryPath Ruta del registro YAML
     * @return Número de dispositivos declarados
     */
    public int validate(Path registryPath) {
        int declared = registryReader.read(registryPath).size();
        log.debug("Registro {} válido: {} dispositivos", registryPath, declared);
        return declared;
    }

    /**
     * Todos los puertos serie conectados, como dispositivos sin registro.
     * El uid de cada uno es el número de serie del puerto.
     */
    public List<Device> scanSerialAccess() {
        return serialPortDirectory.getAvailablePorts().stream()
                .map(this::toDevice)
                .collect(Collectors.toList());
    }

    private void bind(Device device) {
        String uid = device.getUid();
        if (uid == null || uid.isBlank()) {
            log.warn("Dispositivo '{}' sin uid: no se puede enlazar", device.getName());
            return;
        }

        SerialAccess access = serialPortDirectory.findBySerialNumber(uid)
                .map(SerialPortInfo::toAccess)
                .orElse(null);
        DeviceSwitch powerSwitch = powerControl.getHubPortByDesc(uid)
                .map(DeviceSwitch::of)
                .orElse(null);

        device.setAccess(access);
        device.setPowerSwitch(powerSwitch);

        if (access != null || powerSwitch != null) {
            log.debug("Dispositivo {} ({}): acceso={} interruptor={}", device.getName(), uid,
                    access != null ? access.getAddress() : "-",
                    powerSwitch != null ? powerSwitch.getHub() + ":" + powerSwitch.getPort() : "-");
        } else {
            log.debug("Dispositivo {} ({}) no conectado", device.getName(), uid);
        }
    }

    private Device toDevice(SerialPortInfo port) {
        return Device.builder()
                .name(port.getDescriptivePortName())
                .uid(port.getSerialNumber())
                .access(port.toAccess())
                .build();
    }
}
