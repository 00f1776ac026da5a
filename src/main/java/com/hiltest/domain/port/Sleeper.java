package com.hiltest.domain.port;

/**
 * Espera bloqueante del hilo de ejecución.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(long millis);
}
