package com.hiltest.application.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Opciones de una ejecución del plan de pruebas.
 *
 * Con {@code hilDevsFile} los dispositivos se resuelven en el registro para
 * la placa indicada; sin él se usan los puertos fijos.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TestPlanRunOptions {

    private Path testPlanFile;

    /** Nombres de prueba a ejecutar, vacío para todo el plan */
    @Builder.Default
    private List<String> testNames = new ArrayList<>();

    private Path hilDevsFile;
    private String board;

    private String dutPort;
    private String stubPort;

    private int maxRetries;

    /** Raíz del repositorio de MicroPython */
    private Path mpyRootDir;

    /** Informe CSV opcional */
    private Path resultsCsv;

    public boolean isHilMode() {
        return hilDevsFile != null;
    }

    /**
     * Directorio de pruebas de MicroPython, donde se ejecutan los scripts.
     */
    public Path getTestDir() {
        return mpyRootDir.resolve("tests");
    }
}
