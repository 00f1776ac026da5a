package com.hiltest.presentation.cli;

import com.hiltest.application.service.DeviceQueryService;
import com.hiltest.domain.exception.ConfigurationException;
import com.hiltest.domain.model.DeviceField;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Consulta un campo de los dispositivos del registro o de los puertos serie
 * conectados. Imprime los valores separados por espacios.
 */
@Component
@Slf4j
@Command(
    name = "devs-query",
    description = "Consulta campos de dispositivos (name, uid, features, address, serial_number, hub, port)",
    mixinStandardHelpOptions = true
)
public class DevsQueryCommand implements Callable<Integer> {

    private final DeviceQueryService deviceQueryService;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "FIELD", description = "Campo a consultar")
    private String field;

    @Option(
        names = {"-f", "--filter"},
        arity = "1..*",
        description = "Filtro 'campo=valor' (exacto) o 'campo~valor' (contiene); admite varios"
    )
    private List<String> filters = new ArrayList<>();

    @Option(
        names = {"-y", "--devs-yml"},
        description = "Registro de dispositivos; sin él se consultan los puertos serie conectados"
    )
    private Path devsYml;

    @Option(
        names = {"--not-connected"},
        description = "Incluye los dispositivos del registro que no están conectados"
    )
    private boolean notConnected;

    public DevsQueryCommand(DeviceQueryService deviceQueryService) {
        this.deviceQueryService = deviceQueryService;
    }

    @Override
    public Integer call() {
        try {
            List<String> values = deviceQueryService.query(field, filters, devsYml, notConnected);
            spec.commandLine().getOut().println(String.join(" ", values));
            spec.commandLine().getOut().flush();
            return 0;
        } catch (ConfigurationException e) {
            log.error("Consulta no válida: {} (campos: {})", e.getMessage(), String.join(", ", DeviceField.keys()));
            return 1;
        }
    }
}
