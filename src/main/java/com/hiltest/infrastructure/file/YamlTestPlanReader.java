package com.hiltest.infrastructure.file;

import com.fasterxml.jackson.databind.JsonNode;
import com.hiltest.domain.exception.ConfigurationException;
import com.hiltest.domain.model.DeviceRequirement;
import com.hiltest.domain.model.TestCase;
import com.hiltest.domain.model.TestType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Lector del plan de pruebas en YAML.
 *
 * Claves de cada prueba:
 * <pre>
 * name: nombre de la prueba
 * type: single | single_post_delay | multi | multi_stub | custom   # obligatorio para multi y custom
 * test:
 *   script: scripts o directorios (escalar o lista)
 *   exclude: scripts excluidos (escalar o lista)
 *   device:
 *     - board: nombre de la placa
 *       version: versión (opcional)
 *   post_test_delay_ms: espera entre scripts (opcional)
 *   args: argumentos extra (solo custom)
 * stub:
 *   script: script del stub
 *   device: placas soportadas como stub
 *   post_stub_delay_ms: espera tras arrancar el stub (opcional)
 * </pre>
 */
@Component
@Slf4j
public class YamlTestPlanReader {

    private final YamlDocumentLoader documentLoader;

    public YamlTestPlanReader(YamlDocumentLoader documentLoader) {
        this.documentLoader = documentLoader;
    }

    /**
     * Carga todas las pruebas del plan, en orden.
     *
     * @param testPlanPath Ruta del plan
     * @return Lista de pruebas con su tipo ya resuelto
     */
    public List<TestCase> read(Path testPlanPath) {
        List<JsonNode> records = documentLoader.loadRecords(testPlanPath);
        List<TestCase> tests = new ArrayList<>(records.size());
        Set<String> names = new HashSet<>();

        for (int i = 0; i < records.size(); i++) {
            TestCase test = parseTest(records.get(i), testPlanPath, i);
            // Los resultados y reintentos se indexan por nombre
            if (!names.add(test.getName())) {
                throw ConfigurationException.invalidEntry(testPlanPath.toString(), i,
                        "nombre duplicado '" + test.getName() + "'");
            }
            tests.add(test);
        }

        log.info("Plan {}: {} pruebas cargadas", testPlanPath.getFileName(), tests.size());
        return tests;
    }

    private TestCase parseTest(JsonNode entry, Path source, int index) {
        if (!entry.isObject()) {
            throw ConfigurationException.invalidEntry(source.toString(), index, "se esperaba un mapa");
        }

        String name = YamlDocumentLoader.text(entry, "name");
        if (name == null || name.isBlank()) {
            throw ConfigurationException.invalidEntry(source.toString(), index, "falta 'name'");
        }

        JsonNode test = entry.path("test");
        JsonNode stub = entry.path("stub");

        String stubScript = YamlDocumentLoader.text(stub, "script");
        int postTestDelayMs = intValue(test, "post_test_delay_ms", source, index);
        int postStubDelayMs = stub.has("post_stub_delay_ms")
                ? intValue(stub, "post_stub_delay_ms", source, index)
                : intValue(test, "post_stub_delay_ms", source, index);

        String typeKey = YamlDocumentLoader.text(entry, "type");
        TestType type;
        if (typeKey != null) {
            type = TestType.fromKey(typeKey)
                    .orElseThrow(() -> ConfigurationException.invalidEntry(source.toString(), index,
                            "tipo de prueba desconocido '" + typeKey + "'"));
        } else {
            type = TestType.infer(stubScript, postTestDelayMs);
        }

        return TestCase.builder()
                .name(name)
                .type(type)
                .scripts(YamlDocumentLoader.textList(test, "script"))
                .excludes(new LinkedHashSet<>(YamlDocumentLoader.textList(test, "exclude")))
                .postTestDelayMs(postTestDelayMs)
                .stubScript(stubScript)
                .postStubDelayMs(postStubDelayMs)
                .dutRequirements(requirements(test.path("device")))
                .stubRequirements(requirements(stub.path("device")))
                .customArgs(YamlDocumentLoader.textList(test, "args"))
                .build();
    }

    private List<DeviceRequirement> requirements(JsonNode devices) {
        List<DeviceRequirement> requirements = new ArrayList<>();
        if (!devices.isArray()) {
            return requirements;
        }
        for (JsonNode device : devices) {
            requirements.add(DeviceRequirement.builder()
                    .board(YamlDocumentLoader.text(device, "board"))
                    .version(YamlDocumentLoader.text(device, "version"))
                    .build());
        }
        return requirements;
    }

    private int intValue(JsonNode node, String field, Path source, int index) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return 0;
        }
        if (!value.canConvertToInt() || value.asInt() < 0) {
            throw ConfigurationException.invalidEntry(source.toString(), index,
                    "'" + field + "' debe ser un entero no negativo");
        }
        return value.asInt();
    }
}
