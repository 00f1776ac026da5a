package com.hiltest.presentation.cli;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

/**
 * Punto de entrada de la línea de comandos dentro de Spring Boot.
 * El código de salida de picocli se devuelve como código de salida de la
 * aplicación.
 */
@Component
@Slf4j
public class CommandLineRunnerAdapter implements CommandLineRunner, ExitCodeGenerator {

    private final RunTestPlanCommand rootCommand;
    private final SpringCommandFactory commandFactory;

    private int exitCode;

    public CommandLineRunnerAdapter(RunTestPlanCommand rootCommand, SpringCommandFactory commandFactory) {
        this.rootCommand = rootCommand;
        this.commandFactory = commandFactory;
    }

    @Override
    public void run(String... args) {
        exitCode = createCommandLine().execute(args);
        log.debug("Código de salida: {}", exitCode);
    }

    CommandLine createCommandLine() {
        return new CommandLine(rootCommand, commandFactory);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
