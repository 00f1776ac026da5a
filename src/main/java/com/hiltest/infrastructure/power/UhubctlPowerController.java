package com.hiltest.infrastructure.power;

import com.hiltest.domain.exception.ProcessExecutionException;
import com.hiltest.domain.model.HubPort;
import com.hiltest.domain.model.HubPortObservation;
import com.hiltest.domain.model.PortStatus;
import com.hiltest.domain.model.PowerAction;
import com.hiltest.domain.port.PowerControlPort;
import com.hiltest.domain.port.ProcessLauncher;
import com.hiltest.domain.port.ProcessLauncher.ProcessResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Controlador de alimentación USB que envuelve la herramienta uhubctl.
 * El hub al que se conecta el dispositivo debe estar soportado por uhubctl
 * (https://github.com/mvp/uhubctl).
 *
 * Cada invocación produce un {@link UhubctlOutput} que se analiza de
 * inmediato. La última salida se conserva en un único buffer que solo
 * escribe la invocación en curso: esta clase no es segura para uso
 * concurrente y cada pareja invocación + consulta debe completarse antes de
 * iniciar la siguiente.
 */
@Component
@Slf4j
public class UhubctlPowerController implements PowerControlPort {

    static final String NO_DEVICES_DETECTED = "No compatible devices detected!";

    private final ProcessLauncher processLauncher;
    private final String command;

    private UhubctlOutput lastOutput = UhubctlOutput.empty();

    public UhubctlPowerController(ProcessLauncher processLauncher,
            @Value("${hil.power.command:uhubctl}") String command) {
        this.processLauncher = processLauncher;
        this.command = command;
    }

    @Override
    public void runAction(PowerAction action, String hub, Integer port) {
        List<String> args = new ArrayList<>(List.of("--action", action.getValue()));
        if (hub != null) {
            args.add("--location");
            args.add(hub);
        }
        if (port != null) {
            args.add("--port");
            args.add(String.valueOf(port));
        }

        log.info("Acción de alimentación '{}' en hub={} puerto={}", action.getValue(),
                hub != null ? hub : "*", port != null ? port : "*");
        invoke(args);
    }

    @Override
    public PortStatus getStatus(String hub, int port) {
        UhubctlOutput output = invoke(List.of("--location", hub, "--port", String.valueOf(port)));
        PortStatus status = UhubctlOutputParser.parseStatus(output, hub, port);
        log.debug("Estado de hub={} puerto={}: {}", hub, port, status.getLabel());
        return status;
    }

    @Override
    public List<HubPort> scanHubsPorts() {
        return UhubctlOutputParser.parseHubPorts(invoke(List.of()));
    }

    @Override
    public List<HubPortObservation> scanObservations() {
        return UhubctlOutputParser.parseObservations(invoke(List.of()));
    }

    @Override
    public Optional<HubPort> getHubPortByDesc(String descMatch) {
        UhubctlOutput output = invoke(List.of("--search", descMatch));
        return UhubctlOutputParser.findHubPortByDesc(output, descMatch);
    }

    /**
     * Salida de la última invocación.
     */
    public UhubctlOutput getLastOutput() {
        return lastOutput;
    }

    /**
     * Ejecuta uhubctl con los argumentos indicados.
     *
     * Que no haya hubs compatibles no es un error: puede que el hub no esté
     * conectado. Cualquier otro fallo se registra y se trata como salida vacía.
     */
    private UhubctlOutput invoke(List<String> args) {
        List<String> cmd = new ArrayList<>();
        cmd.add(command);
        cmd.addAll(args);

        UhubctlOutput output;
        try {
            ProcessResult result = processLauncher.capture(cmd);

            if (result.exitCode() == 0) {
                output = new UhubctlOutput(result.stdout());
            } else if (result.stderr() != null && result.stderr().contains(NO_DEVICES_DETECTED)) {
                log.debug("uhubctl no detectó hubs compatibles");
                output = UhubctlOutput.empty();
            } else {
                log.error("El comando uhubctl {} falló con código {}: {}", args, result.exitCode(),
                        result.stderr() != null ? result.stderr().trim() : "");
                output = UhubctlOutput.empty();
            }
        } catch (ProcessExecutionException e) {
            log.error("No se pudo ejecutar uhubctl {}: {}", args, e.getMessage(), e);
            output = UhubctlOutput.empty();
        }

        log.debug("Salida de uhubctl {}:\n{}", args, output.text());
        lastOutput = output;
        return output;
    }
}
