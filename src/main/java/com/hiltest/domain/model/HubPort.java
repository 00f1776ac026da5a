package com.hiltest.domain.model;

/**
 * Par (hub, puerto) observado en la salida de la herramienta de alimentación.
 */
public record HubPort(String hub, int port) {
}
