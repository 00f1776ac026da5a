package com.hiltest.infrastructure.file;

import com.hiltest.domain.exception.ReportWriteException;
import com.hiltest.domain.model.TestResult;
import com.opencsv.CSVWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Escribe el informe de resultados de una ejecución del plan en CSV.
 */
@Component
@Slf4j
public class CsvResultReportWriter {

    static final String[] CSV_HEADER = { "name", "status", "remaining_retries" };

    /**
     * Escribe un registro por prueba, sobrescribiendo el archivo.
     *
     * @param reportPath Ruta del archivo CSV
     * @param results    Resultados en orden
     * @throws ReportWriteException si no se puede escribir el archivo
     */
    public void write(Path reportPath, List<TestResult> results) {
        try {
            // Crear directorios si no existen
            Path parent = reportPath.toAbsolutePath().getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
                log.info("Directorio creado: {}", parent);
            }

            try (CSVWriter writer = new CSVWriter(new FileWriter(reportPath.toFile(), StandardCharsets.UTF_8))) {
                writer.writeNext(CSV_HEADER);

                for (TestResult result : results) {
                    writer.writeNext(new String[] {
                            result.getName(),
                            result.getOutcome().name().toLowerCase(Locale.ROOT),
                            result.getRemainingRetries() != null ? String.valueOf(result.getRemainingRetries()) : ""
                    });
                }
            }

            log.info("Informe de resultados guardado: {} ({} pruebas)", reportPath, results.size());

        } catch (IOException e) {
            log.error("Error escribiendo informe CSV {}: {}", reportPath, e.getMessage());
            throw ReportWriteException.cannotWrite(reportPath.toString(), e);
        }
    }
}
