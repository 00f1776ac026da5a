package com.hiltest.infrastructure.file;

import com.fasterxml.jackson.databind.JsonNode;
import com.hiltest.domain.exception.ConfigurationException;
import com.hiltest.domain.model.Device;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Lector del registro de dispositivos en YAML.
 *
 * Formato de cada entrada:
 * <pre>
 * - name: CY8CKIT-062S2-AI
 *   uid: 1106035A012D2400
 *   features: [psoc6, ble]
 * </pre>
 */
@Component
@Slf4j
public class YamlDeviceRegistryReader {

    private final YamlDocumentLoader documentLoader;

    public YamlDeviceRegistryReader(YamlDocumentLoader documentLoader) {
        this.documentLoader = documentLoader;
    }

    /**
     * Lee las entradas declaradas, sin enlazar acceso ni interruptor.
     *
     * @param registryPath Ruta del archivo de registro
     * @return Un dispositivo por entrada, en orden
     */
    public List<Device> read(Path registryPath) {
        List<JsonNode> records = documentLoader.loadRecords(registryPath);
        List<Device> devices = new ArrayList<>(records.size());

        for (int i = 0; i < records.size(); i++) {
            JsonNode entry = records.get(i);
            if (!entry.isObject()) {
                throw ConfigurationException.invalidEntry(registryPath.toString(), i, "se esperaba un mapa");
            }

            String name = YamlDocumentLoader.text(entry, "name");
            String uid = YamlDocumentLoader.text(entry, "uid");

            devices.add(Device.builder()
                    .name(name != null ? name : "")
                    .uid(uid != null ? uid : "")
                    .features(new LinkedHashSet<>(YamlDocumentLoader.textList(entry, "features")))
                    .build());
        }

        log.debug("Registro {}: {} dispositivos declarados", registryPath, devices.size());
        return devices;
    }
}
