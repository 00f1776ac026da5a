package com.hiltest.application.service;

import com.hiltest.domain.model.Device;
import com.hiltest.domain.model.DeviceField;
import com.hiltest.domain.model.DeviceQueryFilter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Consulta de campos de dispositivos.
 *
 * La fuente es el registro HIL, si se indica, o los puertos serie
 * conectados en otro caso.
 */
@Service
@Slf4j
public class DeviceQueryService {

    private final DeviceRegistry deviceRegistry;

    public DeviceQueryService(DeviceRegistry deviceRegistry) {
        this.deviceRegistry = deviceRegistry;
    }

    /**
     * Valor del campo en cada dispositivo que lo tiene y cumple todos los
     * filtros.
     *
     * @param fieldKey     Nombre del campo a devolver
     * @param filters      Expresiones {@code campo=valor} o {@code campo~valor}
     * @param registryPath Registro HIL, puede ser null
     * @param notConnected Incluir dispositivos del registro no conectados
     * @return Valores en el orden de los dispositivos
     */
    public List<String> query(String fieldKey, List<String> filters, Path registryPath, boolean notConnected) {
        DeviceField field = DeviceField.fromKey(fieldKey);
        List<DeviceQueryFilter> parsedFilters = filters.stream()
                .map(DeviceQueryFilter::parse)
                .collect(Collectors.toList());

        return query(field, parsedFilters, devices(registryPath, notConnected));
    }

    List<String> query(DeviceField field, List<DeviceQueryFilter> filters, List<Device> devices) {
        return devices.stream()
                .filter(d -> filters.stream().allMatch(f -> f.matches(d)))
                .map(field::value)
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
    }

    private List<Device> devices(Path registryPath, boolean notConnected) {
        if (registryPath == null) {
            return deviceRegistry.scanSerialAccess();
        }

        List<Device> devices = deviceRegistry.load(registryPath);
        if (notConnected) {
            return devices;
        }
        return devices.stream()
                .filter(Device::hasAccess)
                .collect(Collectors.toList());
    }
}
