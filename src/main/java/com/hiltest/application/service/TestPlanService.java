package com.hiltest.application.service;

import com.hiltest.application.dto.ExecutionSummaryDto;
import com.hiltest.application.dto.TestPlanRunOptions;
import com.hiltest.domain.exception.ReportWriteException;
import com.hiltest.domain.model.TestCase;
import com.hiltest.infrastructure.file.CsvResultReportWriter;
import com.hiltest.infrastructure.file.YamlTestPlanReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Servicio de alto nivel para ejecutar un plan de pruebas completo.
 *
 * Carga el plan, selecciona las pruebas pedidas, elige la estrategia de
 * resolución una sola vez y delega el bucle en {@link ExecutionEngine}.
 */
@Service
@Slf4j
public class TestPlanService {

    private final YamlTestPlanReader testPlanReader;
    private final DeviceRegistry deviceRegistry;
    private final ExecutionEngine executionEngine;
    private final CsvResultReportWriter reportWriter;

    public TestPlanService(YamlTestPlanReader testPlanReader,
            DeviceRegistry deviceRegistry,
            ExecutionEngine executionEngine,
            CsvResultReportWriter reportWriter) {
        this.testPlanReader = testPlanReader;
        this.deviceRegistry = deviceRegistry;
        this.executionEngine = executionEngine;
        this.reportWriter = reportWriter;
    }

    /**
     * Ejecuta el plan según las opciones.
     *
     * @param options Opciones de ejecución
     * @return Resumen de la ejecución
     */
    public ExecutionSummaryDto run(TestPlanRunOptions options) {
        List<TestCase> plan = testPlanReader.read(options.getTestPlanFile());
        List<TestCase> tests = selectTests(plan, options.getTestNames());
        DeviceResolutionStrategy resolution = createResolution(options);

        log.info("Plan de pruebas: {} ({} de {} pruebas seleccionadas)", options.getTestPlanFile(),
                tests.size(), plan.size());
        if (options.isHilMode()) {
            log.info("Placa: {}, registro HIL: {}", options.getBoard(), options.getHilDevsFile());
        }

        ExecutionSummaryDto summary = executionEngine.execute(tests, resolution, options.getMaxRetries(),
                options.getTestDir());

        if (options.getResultsCsv() != null) {
            writeReport(options.getResultsCsv(), summary);
        }
        return summary;
    }

    // El informe no altera el resultado de las pruebas ya ejecutadas
    private void writeReport(Path reportPath, ExecutionSummaryDto summary) {
        try {
            reportWriter.write(reportPath, summary.getResults());
        } catch (ReportWriteException e) {
            log.error("Informe no generado ({}); resultado de la ejecución: {}", e.getMessage(),
                    summary.isSuccess() ? "correcto" : "con fallos");
        }
    }

    /**
     * Pruebas del plan con los nombres pedidos, en el orden pedido. Una lista
     * vacía selecciona todo el plan.
     */
    List<TestCase> selectTests(List<TestCase> plan, List<String> testNames) {
        if (testNames == null || testNames.isEmpty()) {
            return plan;
        }

        List<TestCase> selected = new ArrayList<>();
        for (String testName : testNames) {
            List<TestCase> matches = plan.stream()
                    .filter(t -> t.getName().equals(testName))
                    .toList();
            if (matches.isEmpty()) {
                log.warn("La prueba '{}' no existe en el plan", testName);
            }
            selected.addAll(matches);
        }
        return selected;
    }

    DeviceResolutionStrategy createResolution(TestPlanRunOptions options) {
        if (options.isHilMode()) {
            deviceRegistry.validate(options.getHilDevsFile());
            return new HilCatalogResolution(deviceRegistry, options.getHilDevsFile(), options.getBoard());
        }
        return new StaticPortResolution(options.getDutPort(), options.getStubPort());
    }
}
