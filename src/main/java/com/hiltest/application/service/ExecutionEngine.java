package com.hiltest.application.service;

import com.hiltest.application.dto.ExecutionSummaryDto;
import com.hiltest.domain.model.Device;
import com.hiltest.domain.model.ResolvedDevices;
import com.hiltest.domain.model.TestCase;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Bucle de ejecución del plan.
 *
 * Por cada prueba: resolver dispositivos, omitir si no están disponibles,
 * reiniciar los conmutables, ejecutar y registrar el resultado. Las pruebas
 * fallidas con reintentos pendientes se repiten en pasadas sucesivas hasta
 * que no quede ninguna.
 */
@Service
@Slf4j
public class ExecutionEngine {

    private final PowerResetService powerResetService;
    private final TestCaseRunner testCaseRunner;

    public ExecutionEngine(PowerResetService powerResetService, TestCaseRunner testCaseRunner) {
        this.powerResetService = powerResetService;
        this.testCaseRunner = testCaseRunner;
    }

    /**
     * Ejecuta las pruebas con reintentos.
     *
     * @param tests      Pruebas en orden de ejecución
     * @param resolution Estrategia de resolución de dispositivos
     * @param maxRetries Reintentos por prueba fallida
     * @param testDir    Directorio de pruebas de MicroPython
     * @return Resumen final
     */
    public ExecutionSummaryDto execute(List<TestCase> tests, DeviceResolutionStrategy resolution,
            int maxRetries, Path testDir) {
        ResultTracker tracker = new ResultTracker(maxRetries);
        List<TestCase> pending = tests;
        int passes = 0;

        log.info("Ejecutando {} pruebas con {} (reintentos: {})", tests.size(), resolution.describe(), maxRetries);

        while (!pending.isEmpty()) {
            passes++;
            for (TestCase testCase : pending) {
                runOne(testCase, resolution, tracker, testDir);
            }

            pending = tracker.filterRetries(pending);
            if (!pending.isEmpty()) {
                log.warn("Reintentando pruebas: {}", pending.stream()
                        .map(TestCase::getName)
                        .collect(Collectors.joining(" ")));
            }
        }

        ExecutionSummaryDto summary = ExecutionSummaryDto.fromTracker(tracker, passes);
        logSummary(summary);
        return summary;
    }

    private void runOne(TestCase testCase, DeviceResolutionStrategy resolution, ResultTracker tracker,
            Path testDir) {
        ResolvedDevices devices = resolution.resolve(testCase);
        Device dut = devices.dut();
        Device stub = devices.stub();

        if (!dut.hasAccess() || (testCase.requiresMultipleDevices() && !stub.hasAccess())) {
            tracker.registerSkip(testCase.getName());
            log.warn("Prueba omitida: {} (dispositivos no disponibles)", testCase.getName());
            return;
        }

        powerResetService.resetSwitchableDevices(devices);

        if (stub.hasAccess()) {
            log.info("Ejecutando prueba: {} (dut: {}, stub: {})", testCase.getName(), dut.getAddress(),
                    stub.getAddress());
        } else {
            log.info("Ejecutando prueba: {} (dut: {})", testCase.getName(), dut.getAddress());
        }

        int exitCode = testCaseRunner.run(testCase, dut.getAddress(), stub.getAddress(), testDir);

        if (exitCode != 0) {
            tracker.registerFail(testCase.getName());
            log.error("Prueba fallida: {} (código {}, reintentos restantes: {})", testCase.getName(), exitCode,
                    tracker.remainingRetries(testCase.getName()).orElse(0));
        } else {
            tracker.registerPass(testCase.getName());
            log.info("Prueba superada: {}", testCase.getName());
        }
    }

    private void logSummary(ExecutionSummaryDto summary) {
        log.info("========== Resumen ==========");
        if (!summary.getPassed().isEmpty()) {
            log.info("Superadas : {}", String.join(" ", summary.getPassed()));
        }
        if (!summary.getSkipped().isEmpty()) {
            log.info("Omitidas  : {}", String.join(" ", summary.getSkipped()));
        }
        if (!summary.getFailed().isEmpty()) {
            log.error("Fallidas  : {}", String.join(" ", summary.getFailed()));
        }
        log.info("Pasadas: {}. Resultado: {}", summary.getPasses(), summary.isSuccess() ? "OK" : "FALLO");
    }
}
