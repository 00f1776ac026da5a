package com.hiltest.domain.exception;

import java.util.List;

/**
 * Excepción lanzada cuando no se puede lanzar o esperar un proceso externo.
 */
public class ProcessExecutionException extends RuntimeException {

    public ProcessExecutionException(String message) {
        super(message);
    }

    public ProcessExecutionException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Excepción cuando el proceso no se puede arrancar.
     */
    public static ProcessExecutionException cannotStart(List<String> command, Throwable cause) {
        return new ProcessExecutionException("No se puede ejecutar el comando: " + String.join(" ", command), cause);
    }

    /**
     * Excepción cuando la espera del proceso fue interrumpida.
     */
    public static ProcessExecutionException interrupted(List<String> command, Throwable cause) {
        return new ProcessExecutionException("Interrumpido esperando el comando: " + String.join(" ", command), cause);
    }

    /**
     * Excepción cuando no se puede leer la salida del proceso.
     */
    public static ProcessExecutionException cannotRead(List<String> command, Throwable cause) {
        return new ProcessExecutionException("No se puede leer la salida del comando: " + String.join(" ", command), cause);
    }
}
