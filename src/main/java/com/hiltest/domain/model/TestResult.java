package com.hiltest.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Resultado final de una prueba del plan.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TestResult {

    /** Nombre de la prueba */
    private String name;

    /** Resultado final */
    private TestOutcome outcome;

    /** Reintentos restantes en el registro, null si no tiene entrada */
    private Integer remainingRetries;
}
