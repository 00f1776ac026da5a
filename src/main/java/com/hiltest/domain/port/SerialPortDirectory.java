package com.hiltest.domain.port;

import com.hiltest.domain.model.SerialPortInfo;

import java.util.List;
import java.util.Optional;

/**
 * Puerto (interfaz) para enumerar las interfaces serie conectadas.
 */
public interface SerialPortDirectory {

    /**
     * Obtiene la lista de puertos serie disponibles en el sistema.
     *
     * @return Lista de información de puertos
     */
    List<SerialPortInfo> getAvailablePorts();

    /**
     * Busca el puerto cuyo número de serie coincide exactamente.
     *
     * @param serialNumber Número de serie del hardware
     * @return Optional con el puerto si está conectado
     */
    default Optional<SerialPortInfo> findBySerialNumber(String serialNumber) {
        if (serialNumber == null) {
            return Optional.empty();
        }
        return getAvailablePorts().stream()
                .filter(p -> serialNumber.equals(p.getSerialNumber()))
                .findFirst();
    }
}
