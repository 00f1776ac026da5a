package com.hiltest.domain.exception;

/**
 * Excepción lanzada cuando un documento de configuración (registro de
 * dispositivos, plan de pruebas) o una consulta no es válida.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Excepción cuando el archivo no existe.
     */
    public static ConfigurationException fileNotFound(String filePath) {
        return new ConfigurationException("El archivo YAML no existe: " + filePath);
    }

    /**
     * Excepción cuando no se puede leer o parsear el archivo.
     */
    public static ConfigurationException cannotRead(String filePath, Throwable cause) {
        return new ConfigurationException("No se puede abrir el archivo YAML: " + filePath, cause);
    }

    /**
     * Excepción cuando una entrada del documento tiene un formato inválido.
     */
    public static ConfigurationException invalidEntry(String filePath, int index, String reason) {
        return new ConfigurationException(
                String.format("Entrada inválida en %s, posición %d: %s", filePath, index, reason));
    }

    /**
     * Excepción cuando se consulta un campo de dispositivo desconocido.
     */
    public static ConfigurationException unknownField(String field) {
        return new ConfigurationException("Campo de dispositivo desconocido: " + field);
    }
}
