package com.hiltest.domain.port;

import com.hiltest.domain.model.HubPort;
import com.hiltest.domain.model.HubPortObservation;
import com.hiltest.domain.model.PortStatus;
import com.hiltest.domain.model.PowerAction;

import java.util.List;
import java.util.Optional;

/**
 * Puerto (interfaz) para el control de alimentación de hubs USB.
 *
 * Las implementaciones degradan los fallos de la herramienta subyacente a
 * observaciones vacías: ninguna operación lanza excepciones por un error de
 * la herramienta.
 */
public interface PowerControlPort {

    /**
     * Ejecuta una acción sobre un hub y puerto.
     *
     * @param action Acción a realizar
     * @param hub    Hub, null para todos los hubs (el puerto no debe ser null)
     * @param port   Puerto, null para todos los puertos del hub
     */
    void runAction(PowerAction action, String hub, Integer port);

    /**
     * Obtiene el estado actual de un puerto.
     *
     * @param hub  Ubicación del hub (ej: 1-1.3)
     * @param port Número de puerto
     * @return Estado clasificado, UNKNOWN si no se encuentra
     */
    PortStatus getStatus(String hub, int port);

    /**
     * Enumera todos los pares (hub, puerto) en el orden de la salida.
     * Los duplicados se conservan.
     */
    List<HubPort> scanHubsPorts();

    /**
     * Enumera todos los puertos con su estado en el orden de la salida.
     */
    List<HubPortObservation> scanObservations();

    /**
     * Busca el hub y puerto del dispositivo cuya descripción contiene el texto.
     *
     * @param descMatch Texto a buscar (ej: número de serie)
     * @return Optional con el primer par encontrado
     */
    Optional<HubPort> getHubPortByDesc(String descMatch);
}
