package com.hiltest.presentation.cli;

import com.hiltest.application.service.DeviceSwitchService;
import com.hiltest.domain.model.DeviceSwitch;
import com.hiltest.domain.model.HubPortObservation;
import com.hiltest.domain.model.PortStatus;
import com.hiltest.domain.model.PowerAction;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Set;

/**
 * Control manual de los interruptores de alimentación USB.
 */
@Component
@Command(
    name = "power",
    description = "Control de alimentación de los hubs USB",
    mixinStandardHelpOptions = true
)
public class PowerCommand implements Runnable {

    private final DeviceSwitchService deviceSwitchService;

    @Spec
    private CommandSpec spec;

    public PowerCommand(DeviceSwitchService deviceSwitchService) {
        this.deviceSwitchService = deviceSwitchService;
    }

    @Override
    public void run() {
        throw new ParameterException(spec.commandLine(), "Falta el subcomando (scan, status, action, reset-all)");
    }

    @Command(name = "scan", description = "Lista los puertos de todos los hubs con su estado")
    public int scan() {
        PrintWriter out = spec.commandLine().getOut();
        for (HubPortObservation observation : deviceSwitchService.scanObservations()) {
            out.printf("%s %d %s%n", observation.hub(), observation.port(), observation.status().getLabel());
        }
        out.flush();
        return 0;
    }

    @Command(name = "status", description = "Estado de un puerto")
    public int status(
            @Parameters(index = "0", paramLabel = "HUB") String hub,
            @Parameters(index = "1", paramLabel = "PORT") int port) {
        PortStatus status = deviceSwitchService.status(new DeviceSwitch(hub, port));
        spec.commandLine().getOut().println(status.getLabel());
        spec.commandLine().getOut().flush();
        return 0;
    }

    @Command(name = "action", description = "Ejecuta on, off, cycle o toggle")
    public int action(
            @Parameters(index = "0", paramLabel = "ACTION", description = "on, off, cycle o toggle") String action,
            @Option(names = {"--hub"}, description = "Hub (por defecto todos)") String hub,
            @Option(names = {"--port"}, description = "Puerto (por defecto todos)") Integer port) {
        PowerAction powerAction;
        try {
            powerAction = PowerAction.fromValue(action);
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage(), e);
        }
        if (hub == null && port != null) {
            throw new ParameterException(spec.commandLine(), "--port requiere --hub");
        }

        deviceSwitchService.runAction(powerAction, hub, port);
        return 0;
    }

    @Command(name = "reset-all", description = "Ciclo de alimentación de todos los hubs")
    public int resetAll() {
        Set<String> hubs = deviceSwitchService.resetAll();
        spec.commandLine().getOut().println(String.join(" ", hubs));
        spec.commandLine().getOut().flush();
        return 0;
    }
}
