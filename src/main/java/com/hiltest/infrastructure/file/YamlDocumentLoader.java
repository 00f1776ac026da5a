package com.hiltest.infrastructure.file;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.hiltest.domain.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Carga documentos YAML cuya raíz es una lista de registros.
 */
@Component
@Slf4j
public class YamlDocumentLoader {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    /**
     * Lee el documento y devuelve sus registros en orden.
     *
     * @param path Ruta del archivo YAML
     * @return Registros del documento (vacío si el documento está vacío)
     * @throws ConfigurationException si el archivo no existe, no se puede
     *                                parsear o su raíz no es una lista
     */
    public List<JsonNode> loadRecords(Path path) {
        if (path == null || !Files.exists(path)) {
            throw ConfigurationException.fileNotFound(String.valueOf(path));
        }

        JsonNode root;
        try {
            root = yamlMapper.readTree(path.toFile());
        } catch (IOException e) {
            throw ConfigurationException.cannotRead(path.toString(), e);
        }

        List<JsonNode> records = new ArrayList<>();
        if (root == null || root.isNull() || root.isMissingNode()) {
            log.warn("Documento YAML vacío: {}", path);
            return records;
        }
        if (!root.isArray()) {
            throw new ConfigurationException("La raíz del documento YAML debe ser una lista: " + path);
        }

        root.forEach(records::add);
        log.debug("Leídos {} registros de {}", records.size(), path);
        return records;
    }

    /**
     * Texto de un campo escalar, null si falta o es nulo.
     */
    static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? null : value.asText();
    }

    /**
     * Valores de un campo que puede ser escalar o lista.
     */
    static List<String> textList(JsonNode node, String field) {
        JsonNode value = node.path(field);
        List<String> values = new ArrayList<>();
        if (value.isArray()) {
            value.forEach(v -> {
                if (!v.isNull()) {
                    values.add(v.asText());
                }
            });
        } else if (!value.isMissingNode() && !value.isNull()) {
            values.add(value.asText());
        }
        return values;
    }
}
