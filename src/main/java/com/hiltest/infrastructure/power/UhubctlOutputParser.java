package com.hiltest.infrastructure.power;

import com.hiltest.domain.model.HubPort;
import com.hiltest.domain.model.HubPortObservation;
import com.hiltest.domain.model.PortStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Clasificación de la salida de texto de uhubctl.
 *
 * Todas las operaciones hacen una única pasada sobre las líneas manteniendo
 * el hub de la sección actual. Ejemplo de salida con la dualidad USB 3.0
 * (un KitProg3 con número de serie 1106035A012D2400 en el hub 1-1, puerto 2):
 *
 * <pre>
 * Current status for hub 2-1 [0bda:0411 Generic USB3.2 Hub, USB 3.20, 4 ports, ppps]
 *   Port 2: 02a0 power 5gbps Rx.Detect
 * Current status for hub 1-1 [0bda:5411 Generic USB2.1 Hub, USB 2.10, 4 ports, ppps]
 *   Port 2: 0103 power enable connect [04b4:f155 Cypress Semiconductor KitProg3 CMSIS-DAP 1106035A012D2400]
 * </pre>
 */
public final class UhubctlOutputParser {

    static final String HUB_LINE_PREFIX = "Current status for hub";
    static final String PORT_LINE_PREFIX = "Port";

    private static final Pattern HUB_PATTERN = Pattern.compile("hub (\\S+)");
    private static final Pattern PORT_PATTERN = Pattern.compile("Port (\\d{1,9}):");

    private UhubctlOutputParser() {
    }

    /**
     * Todos los pares (hub, puerto) en el orden de la salida, duplicados incluidos.
     */
    public static List<HubPort> parseHubPorts(UhubctlOutput output) {
        List<HubPort> discovered = new ArrayList<>();
        walk(output, (hubPort, line) -> {
            discovered.add(hubPort);
            return false;
        });
        return discovered;
    }

    /**
     * Todos los puertos con su estado en el orden de la salida.
     */
    public static List<HubPortObservation> parseObservations(UhubctlOutput output) {
        List<HubPortObservation> observations = new ArrayList<>();
        walk(output, (hubPort, line) -> {
            observations.add(new HubPortObservation(hubPort.hub(), hubPort.port(), classify(line)));
            return false;
        });
        return observations;
    }

    /**
     * Estado de la primera línea que corresponde al hub y puerto indicados.
     *
     * @return Estado clasificado, UNKNOWN si no hay línea para ese par
     */
    public static PortStatus parseStatus(UhubctlOutput output, String hub, int port) {
        HubPortObservation[] found = new HubPortObservation[1];
        walk(output, (hubPort, line) -> {
            if (hubPort.hub().equals(hub) && hubPort.port() == port) {
                found[0] = new HubPortObservation(hub, port, classify(line));
                return true;
            }
            return false;
        });
        return found[0] != null ? found[0].status() : PortStatus.UNKNOWN;
    }

    /**
     * Primer puerto, dentro de una sección de hub, cuya línea contiene el texto.
     */
    public static Optional<HubPort> findHubPortByDesc(UhubctlOutput output, String descMatch) {
        if (descMatch == null) {
            return Optional.empty();
        }
        HubPort[] found = new HubPort[1];
        walk(output, (hubPort, line) -> {
            if (line.contains(descMatch)) {
                found[0] = hubPort;
                return true;
            }
            return false;
        });
        return Optional.ofNullable(found[0]);
    }

    /**
     * Clasifica una línea de puerto.
     */
    static PortStatus classify(String portLine) {
        if (portLine.contains(" off")) {
            return PortStatus.OFF;
        } else if (portLine.contains(" power") && portLine.contains("enable connect")) {
            return PortStatus.ON_CONNECTED;
        } else if (portLine.contains(" power")) {
            return PortStatus.ON;
        }
        return PortStatus.UNKNOWN;
    }

    /**
     * Recorre las líneas de puerto asociadas a un hub. El visitante devuelve
     * true para detener el recorrido.
     */
    private static void walk(UhubctlOutput output, PortLineVisitor visitor) {
        String currentHub = null;

        for (String line : output.lines()) {
            currentHub = updateHub(line, currentHub);
            Integer currentPort = parsePort(line);

            if (currentHub != null && currentPort != null
                    && visitor.visit(new HubPort(currentHub, currentPort), line)) {
                return;
            }
        }
    }

    private static String updateHub(String line, String currentHub) {
        if (line.startsWith(HUB_LINE_PREFIX)) {
            Matcher matcher = HUB_PATTERN.matcher(line);
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        return currentHub;
    }

    private static Integer parsePort(String line) {
        if (line.startsWith(PORT_LINE_PREFIX)) {
            Matcher matcher = PORT_PATTERN.matcher(line);
            if (matcher.find()) {
                return Integer.valueOf(matcher.group(1));
            }
        }
        return null;
    }

    @FunctionalInterface
    private interface PortLineVisitor {
        boolean visit(HubPort hubPort, String line);
    }
}
