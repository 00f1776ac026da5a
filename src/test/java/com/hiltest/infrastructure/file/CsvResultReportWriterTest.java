package com.hiltest.infrastructure.file;

import com.hiltest.domain.exception.ReportWriteException;
import com.hiltest.domain.model.TestOutcome;
import com.hiltest.domain.model.TestResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvResultReportWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void writesHeaderAndOneRowPerResult() throws IOException {
        Path report = tempDir.resolve("out/results.csv");

        new CsvResultReportWriter().write(report, List.of(
                new TestResult("basics", TestOutcome.PASSED, null),
                new TestResult("i2c", TestOutcome.FAILED, 0),
                new TestResult("uart", TestOutcome.SKIPPED, null)));

        assertThat(Files.readAllLines(report)).containsExactly(
                "\"name\",\"status\",\"remaining_retries\"",
                "\"basics\",\"passed\",\"\"",
                "\"i2c\",\"failed\",\"0\"",
                "\"uart\",\"skipped\",\"\"");
    }

    @Test
    void unwritablePathIsReportError() {
        // el destino es un directorio existente
        assertThatThrownBy(() -> new CsvResultReportWriter().write(tempDir, List.of(
                new TestResult("basics", TestOutcome.PASSED, null))))
                .isInstanceOf(ReportWriteException.class)
                .hasMessageContaining(tempDir.toString());
    }
}
