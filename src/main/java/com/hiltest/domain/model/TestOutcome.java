package com.hiltest.domain.model;

/**
 * Resultado final de una prueba tras agotar los reintentos.
 */
public enum TestOutcome {
    PASSED,
    FAILED,
    SKIPPED
}
