package com.hiltest.application.dto;

import com.hiltest.application.service.ResultTracker;
import com.hiltest.domain.model.TestResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * DTO con el resumen de la ejecución de un plan.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionSummaryDto {

    @Builder.Default
    private List<String> passed = new ArrayList<>();

    @Builder.Default
    private List<String> failed = new ArrayList<>();

    @Builder.Default
    private List<String> skipped = new ArrayList<>();

    /** Resultado final de cada prueba, para el informe */
    @Builder.Default
    private List<TestResult> results = new ArrayList<>();

    /** Número de pasadas sobre la lista de pruebas (la primera más los reintentos) */
    private int passes;

    public boolean isSuccess() {
        return failed.isEmpty();
    }

    /**
     * Código de salida del proceso: 0 si ninguna prueba falló, 1 en otro caso.
     */
    public int getExitCode() {
        return isSuccess() ? 0 : 1;
    }

    /**
     * Crea el resumen a partir del estado final del seguimiento.
     */
    public static ExecutionSummaryDto fromTracker(ResultTracker tracker, int passes) {
        return ExecutionSummaryDto.builder()
                .passed(tracker.getPassed())
                .failed(tracker.getFailed())
                .skipped(tracker.getSkipped())
                .results(tracker.toResults())
                .passes(passes)
                .build();
    }
}
