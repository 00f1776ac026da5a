package com.hiltest.infrastructure.serial;

import com.fazecast.jSerialComm.SerialPort;
import com.hiltest.domain.model.SerialPortInfo;
import com.hiltest.domain.port.SerialPortDirectory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Escáner de puertos seriales usando jSerialComm.
 */
@Component
@Slf4j
public class SerialPortScanner implements SerialPortDirectory {

    /**
     * Obtiene la lista de puertos seriales disponibles en el sistema.
     *
     * @return Lista de información de puertos
     */
    @Override
    public List<SerialPortInfo> getAvailablePorts() {
        SerialPort[] ports = SerialPort.getCommPorts();

        log.debug("Escaneando puertos seriales. Encontrados: {}", ports.length);

        return Arrays.stream(ports)
                .map(this::toSerialPortInfo)
                .collect(Collectors.toList());
    }

    /**
     * Convierte un SerialPort de jSerialComm a nuestro modelo de dominio.
     */
    private SerialPortInfo toSerialPortInfo(SerialPort port) {
        String serialNumber = port.getSerialNumber();
        if (serialNumber != null && (serialNumber.isBlank() || "Unknown".equalsIgnoreCase(serialNumber))) {
            serialNumber = null;
        }

        return SerialPortInfo.builder()
                .systemPortPath(port.getSystemPortPath())
                .descriptivePortName(port.getDescriptivePortName())
                .serialNumber(serialNumber)
                .vendorId(toHex(port.getVendorID()))
                .productId(toHex(port.getProductID()))
                .build();
    }

    private String toHex(int id) {
        return id < 0 ? null : String.format("%04x", id);
    }
}
