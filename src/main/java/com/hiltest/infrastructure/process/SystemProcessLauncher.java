package com.hiltest.infrastructure.process;

import com.hiltest.domain.exception.ProcessExecutionException;
import com.hiltest.domain.port.ProcessLauncher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Lanzador de procesos externos basado en ProcessBuilder.
 * Cada llamada bloquea hasta que el proceso termina.
 */
@Component
@Slf4j
public class SystemProcessLauncher implements ProcessLauncher {

    @Override
    public int run(List<String> command, Path workingDir) {
        log.debug("Ejecutando: {} (directorio: {})", String.join(" ", command), workingDir);

        ProcessBuilder builder = new ProcessBuilder(command).inheritIO();
        if (workingDir != null) {
            builder.directory(workingDir.toFile());
        }

        Process process = start(builder, command);
        int exitCode = waitFor(process, command);
        log.debug("Proceso finalizado con código {}: {}", exitCode, command.get(0));
        return exitCode;
    }

    @Override
    public ProcessResult capture(List<String> command) {
        log.debug("Ejecutando con captura: {}", String.join(" ", command));

        Process process = start(new ProcessBuilder(command), command);
        // stderr se lee en paralelo con stdout
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(
                () -> read(process.getErrorStream(), command));
        String stdout = read(process.getInputStream(), command);
        int exitCode = waitFor(process, command);

        try {
            return new ProcessResult(exitCode, stdout, stderr.join());
        } catch (CompletionException e) {
            if (e.getCause() instanceof ProcessExecutionException) {
                throw (ProcessExecutionException) e.getCause();
            }
            throw ProcessExecutionException.cannotRead(command, e.getCause());
        }
    }

    private Process start(ProcessBuilder builder, List<String> command) {
        try {
            return builder.start();
        } catch (IOException e) {
            throw ProcessExecutionException.cannotStart(command, e);
        }
    }

    private int waitFor(Process process, List<String> command) {
        try {
            return process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroy();
            throw ProcessExecutionException.interrupted(command, e);
        }
    }

    private String read(InputStream stream, List<String> command) {
        try (InputStream in = stream) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw ProcessExecutionException.cannotRead(command, e);
        }
    }
}
