package com.hiltest.domain.exception;

/**
 * Excepción lanzada cuando no se puede escribir el informe de resultados.
 */
public class ReportWriteException extends RuntimeException {

    public ReportWriteException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ReportWriteException cannotWrite(String filePath, Throwable cause) {
        return new ReportWriteException("No se puede escribir el informe: " + filePath, cause);
    }
}
