package com.hiltest.domain.port;

import com.hiltest.domain.exception.ProcessExecutionException;

import java.nio.file.Path;
import java.util.List;

/**
 * Puerto (interfaz) para ejecutar procesos externos de forma bloqueante.
 */
public interface ProcessLauncher {

    /**
     * Ejecuta un comando heredando la entrada/salida de la aplicación.
     *
     * @param command    Comando y argumentos
     * @param workingDir Directorio de trabajo, null para el actual
     * @return Código de salida
     * @throws ProcessExecutionException si el proceso no se puede ejecutar
     */
    int run(List<String> command, Path workingDir);

    /**
     * Ejecuta un comando capturando stdout y stderr.
     *
     * @param command Comando y argumentos
     * @return Resultado con código de salida y salidas capturadas
     * @throws ProcessExecutionException si el proceso no se puede ejecutar
     */
    ProcessResult capture(List<String> command);

    /**
     * Resultado de un proceso con salida capturada.
     */
    record ProcessResult(int exitCode, String stdout, String stderr) {
    }
}
