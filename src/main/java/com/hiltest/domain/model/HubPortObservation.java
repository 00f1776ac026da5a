package com.hiltest.domain.model;

/**
 * Observación de topología: hub, puerto y estado de alimentación.
 */
public record HubPortObservation(String hub, int port, PortStatus status) {
}
