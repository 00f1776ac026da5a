package com.hiltest.presentation.cli;

import com.hiltest.application.dto.ExecutionSummaryDto;
import com.hiltest.application.dto.TestPlanRunOptions;
import com.hiltest.application.service.TestPlanService;
import com.hiltest.domain.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Comando principal: ejecuta el plan de pruebas.
 *
 * Con --hil-devs los dispositivos se buscan en el registro HIL para la placa
 * indicada con --board; sin él se usan los puertos --dut-port y --stub-port.
 */
@Component
@Slf4j
@Command(
    name = "hil-test-runner",
    version = "1.0.0",
    description = "Ejecuta suites de pruebas de MicroPython sobre dispositivos reales",
    mixinStandardHelpOptions = true,
    subcommands = {DevsQueryCommand.class, PowerCommand.class}
)
public class RunTestPlanCommand implements Callable<Integer> {

    private final TestPlanService testPlanService;

    @Spec
    private CommandSpec spec;

    @Parameters(
        paramLabel = "TEST_SUITE",
        arity = "0..*",
        description = "Pruebas del plan a ejecutar (por defecto todas)"
    )
    private List<String> testSuites = new ArrayList<>();

    @Option(
        names = {"--test-plan"},
        description = "Ruta del plan de pruebas (por defecto test-plan.yml)"
    )
    private Path testPlan;

    @Option(
        names = {"--hil-devs"},
        description = "Ruta del registro de dispositivos HIL"
    )
    private Path hilDevs;

    @Option(
        names = {"-b", "--board"},
        description = "Placa a probar (solo con --hil-devs)"
    )
    private String board;

    @Option(
        names = {"-d", "--dut-port"},
        description = "Puerto del dispositivo bajo prueba (por defecto /dev/ttyACM0)"
    )
    private String dutPort;

    @Option(
        names = {"-s", "--stub-port"},
        description = "Puerto del dispositivo stub (por defecto /dev/ttyACM1)"
    )
    private String stubPort;

    @Option(
        names = {"--max-retries"},
        description = "Reintentos por prueba fallida (por defecto: ${DEFAULT-VALUE})",
        defaultValue = "0"
    )
    private int maxRetries;

    @Option(
        names = {"--mpy-root-dir"},
        description = "Raíz del repositorio de MicroPython"
    )
    private Path mpyRootDir;

    @Option(
        names = {"--results-csv"},
        description = "Escribe el resultado de cada prueba en un CSV"
    )
    private Path resultsCsv;

    @Value("${hil.test-plan:test-plan.yml}")
    private String defaultTestPlan = "test-plan.yml";

    @Value("${hil.mpy-root-dir:../..}")
    private String defaultMpyRootDir = "../..";

    @Value("${hil.dut-port:/dev/ttyACM0}")
    private String defaultDutPort = "/dev/ttyACM0";

    @Value("${hil.stub-port:/dev/ttyACM1}")
    private String defaultStubPort = "/dev/ttyACM1";

    public RunTestPlanCommand(TestPlanService testPlanService) {
        this.testPlanService = testPlanService;
    }

    @Override
    public Integer call() {
        TestPlanRunOptions options = buildOptions();

        try {
            ExecutionSummaryDto summary = testPlanService.run(options);
            return summary.getExitCode();
        } catch (ConfigurationException e) {
            log.error("Error de configuración: {}", e.getMessage());
            return 1;
        }
    }

    /**
     * Valida la combinación de opciones y completa los valores por defecto.
     *
     * @throws ParameterException si las opciones son incompatibles
     */
    TestPlanRunOptions buildOptions() {
        if (maxRetries < 0) {
            throw new ParameterException(spec.commandLine(), "--max-retries no puede ser negativo");
        }

        TestPlanRunOptions.TestPlanRunOptionsBuilder options = TestPlanRunOptions.builder()
                .testNames(testSuites)
                .maxRetries(maxRetries)
                .testPlanFile(absolute(testPlan != null ? testPlan : Path.of(defaultTestPlan)))
                .mpyRootDir(absolute(mpyRootDir != null ? mpyRootDir : Path.of(defaultMpyRootDir)))
                .resultsCsv(resultsCsv);

        if (hilDevs != null) {
            if (board == null) {
                throw new ParameterException(spec.commandLine(), "--hil-devs requiere --board");
            }
            if (dutPort != null || stubPort != null) {
                throw new ParameterException(spec.commandLine(),
                        "--dut-port y --stub-port no se admiten con --hil-devs");
            }
            return options
                    .hilDevsFile(absolute(hilDevs))
                    .board(board)
                    .build();
        }

        if (board != null) {
            throw new ParameterException(spec.commandLine(), "--board solo se admite con --hil-devs");
        }
        return options
                .dutPort(dutPort != null ? dutPort : defaultDutPort)
                .stubPort(stubPort != null ? stubPort : defaultStubPort)
                .build();
    }

    private static Path absolute(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
