package com.hiltest.application.service;

import com.hiltest.domain.exception.ProcessExecutionException;
import com.hiltest.domain.model.TestCase;
import com.hiltest.domain.port.ProcessLauncher;
import com.hiltest.domain.port.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Ejecuta una prueba del plan según su tipo invocando las herramientas de
 * pruebas de MicroPython como procesos externos.
 *
 * Los scripts son relativos al directorio de pruebas de MicroPython, que es
 * el directorio de trabajo de todas las invocaciones.
 */
@Service
@Slf4j
public class TestCaseRunner {

    static final String RUN_TESTS = "run-tests.py";
    static final String RUN_MULTITESTS = "run-multitests.py";

    private final ProcessLauncher processLauncher;
    private final Sleeper sleeper;

    @Value("${hil.python-command:python}")
    private String pythonCommand = "python";

    public TestCaseRunner(ProcessLauncher processLauncher, Sleeper sleeper) {
        this.processLauncher = processLauncher;
        this.sleeper = sleeper;
    }

    /**
     * Ejecuta la prueba.
     *
     * @param testCase Prueba a ejecutar
     * @param dutPort  Puerto del DUT
     * @param stubPort Puerto del stub (solo tipos multi)
     * @param testDir  Directorio de pruebas de MicroPython
     * @return Código de salida, 0 si la prueba pasó
     */
    public int run(TestCase testCase, String dutPort, String stubPort, Path testDir) {
        return switch (testCase.getType()) {
            case SINGLE -> runSingle(testCase, dutPort, testDir);
            case SINGLE_POST_DELAY -> runSinglePostDelay(testCase, dutPort, testDir);
            case MULTI_STUB -> runMultiStub(testCase, dutPort, stubPort, testDir);
            case MULTI -> runMulti(testCase, dutPort, stubPort, testDir);
            case CUSTOM -> runCustom(testCase, dutPort, testDir);
        };
    }

    /**
     * Una sola invocación de run-tests.py con todos los scripts. Los
     * directorios van precedidos de -d y cada exclusión de -e.
     */
    int runSingle(TestCase testCase, String dutPort, Path testDir) {
        List<String> testArgs = new ArrayList<>();
        for (String script : testCase.getScripts()) {
            if (Files.isDirectory(testDir.resolve(script))) {
                testArgs.add("-d");
            }
            testArgs.add(script);
        }

        List<String> excludeArgs = new ArrayList<>();
        for (String excluded : testCase.getExcludes()) {
            excludeArgs.add("-e");
            excludeArgs.add(excluded);
        }

        return runTestsCommand(dutPort, testArgs, excludeArgs, testDir);
    }

    /**
     * Una invocación por script, con espera tras cada una. Se detiene en el
     * primer fallo.
     */
    int runSinglePostDelay(TestCase testCase, String dutPort, Path testDir) {
        List<String> scripts = expandScripts(testCase.getScripts(), testDir);
        scripts.removeAll(testCase.getExcludes());

        for (String script : scripts) {
            int exitCode = runTestsCommand(dutPort, List.of(script), List.of(), testDir);
            if (exitCode != 0) {
                return exitCode;
            }

            if (testCase.getPostTestDelayMs() > 0) {
                sleeper.sleep(testCase.getPostTestDelayMs());
            }
        }
        return 0;
    }

    /**
     * Arranca el script del stub con mpremote y luego ejecuta la prueba
     * single en el DUT.
     */
    int runMultiStub(TestCase testCase, String dutPort, String stubPort, Path testDir) {
        Path mpremote = testDir.resolve("..").resolve("tools").resolve("mpremote").resolve("mpremote.py").normalize();
        List<String> stubCmd = List.of(mpremote.toString(), "connect", stubPort, "run", "--no-follow",
                testCase.getStubScript());

        int exitCode = launch(stubCmd, testDir);
        if (exitCode != 0) {
            log.warn("El script del stub {} falló con código {}", testCase.getStubScript(), exitCode);
            return exitCode;
        }

        if (testCase.getPostStubDelayMs() > 0) {
            sleeper.sleep(testCase.getPostStubDelayMs());
        }

        return runSingle(testCase, dutPort, testDir);
    }

    /**
     * Una invocación de run-multitests.py con ambos dispositivos.
     */
    int runMulti(TestCase testCase, String dutPort, String stubPort, Path testDir) {
        List<String> cmd = new ArrayList<>(List.of(pythonCommand, RUN_MULTITESTS, "-t", dutPort, "-t", stubPort));
        cmd.addAll(expandScripts(testCase.getScripts(), testDir));
        return launch(cmd, testDir);
    }

    /**
     * Cada script es un proceso propio que recibe el puerto del DUT y los
     * argumentos extra. Falla si falla cualquiera de ellos.
     */
    int runCustom(TestCase testCase, String dutPort, Path testDir) {
        int result = 0;
        for (String script : testCase.getScripts()) {
            List<String> cmd = new ArrayList<>(List.of(pythonCommand, script, dutPort));
            cmd.addAll(testCase.getCustomArgs());

            if (launch(cmd, testDir) != 0) {
                result = 1;
            }
        }
        return result;
    }

    private int runTestsCommand(String dutPort, List<String> testArgs, List<String> excludeArgs, Path testDir) {
        List<String> cmd = new ArrayList<>(List.of(pythonCommand, RUN_TESTS, "-t", "port:" + dutPort));
        cmd.addAll(testArgs);
        cmd.addAll(excludeArgs);

        int exitCode = launch(cmd, testDir);

        if (exitCode != 0) {
            launch(List.of(pythonCommand, RUN_TESTS, "--print-failures"), testDir);
            launch(List.of(pythonCommand, RUN_TESTS, "--clean-failures"), testDir);
        }
        return exitCode;
    }

    /**
     * Sustituye cada directorio por los archivos .py que contiene, en orden.
     */
    List<String> expandScripts(List<String> scripts, Path testDir) {
        List<String> expanded = new ArrayList<>();
        for (String script : scripts) {
            Path path = testDir.resolve(script);
            if (!Files.isDirectory(path)) {
                expanded.add(script);
                continue;
            }

            try (Stream<Path> files = Files.walk(path)) {
                expanded.addAll(files
                        .filter(Files::isRegularFile)
                        .filter(p -> p.getFileName().toString().endsWith(".py"))
                        .map(p -> testDir.relativize(p).toString())
                        .sorted()
                        .collect(Collectors.toList()));
            } catch (IOException e) {
                throw new UncheckedIOException("No se puede recorrer el directorio de pruebas " + path, e);
            }
        }
        return expanded;
    }

    private int launch(List<String> cmd, Path testDir) {
        try {
            return processLauncher.run(cmd, testDir);
        } catch (ProcessExecutionException e) {
            log.error("Error ejecutando prueba: {}", e.getMessage(), e);
            return 1;
        }
    }
}
