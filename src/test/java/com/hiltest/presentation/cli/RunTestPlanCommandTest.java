package com.hiltest.presentation.cli;

import com.hiltest.application.dto.ExecutionSummaryDto;
import com.hiltest.application.dto.TestPlanRunOptions;
import com.hiltest.application.service.DeviceQueryService;
import com.hiltest.application.service.DeviceSwitchService;
import com.hiltest.application.service.TestPlanService;
import com.hiltest.domain.exception.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RunTestPlanCommandTest {

    @Mock
    private TestPlanService testPlanService;

    private CommandLine commandLine;
    private final StringWriter err = new StringWriter();

    @BeforeEach
    void setUp() {
        commandLine = new CommandLine(new RunTestPlanCommand(testPlanService),
                new StubCommandFactory(mock(DeviceQueryService.class), mock(DeviceSwitchService.class)));
        commandLine.setErr(new PrintWriter(err));
    }

    @Test
    void defaultsToFixedPortsAndWholePlan() {
        when(testPlanService.run(any())).thenReturn(new ExecutionSummaryDto());

        int exitCode = commandLine.execute();

        assertThat(exitCode).isZero();
        TestPlanRunOptions options = captureOptions();
        assertThat(options.isHilMode()).isFalse();
        assertThat(options.getDutPort()).isEqualTo("/dev/ttyACM0");
        assertThat(options.getStubPort()).isEqualTo("/dev/ttyACM1");
        assertThat(options.getTestNames()).isEmpty();
        assertThat(options.getMaxRetries()).isZero();
        assertThat(options.getTestPlanFile()).isEqualTo(Path.of("test-plan.yml").toAbsolutePath().normalize());
    }

    @Test
    void passesSelectionAndHilOptions() {
        when(testPlanService.run(any())).thenReturn(new ExecutionSummaryDto());

        int exitCode = commandLine.execute("basics", "i2c", "--hil-devs", "hil-devs.yml",
                "-b", "CY8CPROTO-062-4343W", "--max-retries", "2", "--mpy-root-dir", "/opt/micropython");

        assertThat(exitCode).isZero();
        TestPlanRunOptions options = captureOptions();
        assertThat(options.getTestNames()).containsExactly("basics", "i2c");
        assertThat(options.isHilMode()).isTrue();
        assertThat(options.getBoard()).isEqualTo("CY8CPROTO-062-4343W");
        assertThat(options.getMaxRetries()).isEqualTo(2);
        assertThat(options.getTestDir()).isEqualTo(Path.of("/opt/micropython/tests"));
    }

    @Test
    void failedTestsExitWithOne() {
        when(testPlanService.run(any())).thenReturn(ExecutionSummaryDto.builder().failed(List.of("i2c")).build());

        assertThat(commandLine.execute()).isEqualTo(1);
    }

    @Test
    void hilDevsRequiresBoard() {
        assertThat(commandLine.execute("--hil-devs", "hil-devs.yml")).isEqualTo(2);
        assertThat(err.toString()).contains("--board");
        verify(testPlanService, never()).run(any());
    }

    @Test
    void boardRequiresHilDevs() {
        assertThat(commandLine.execute("-b", "CY8CPROTO-062-4343W")).isEqualTo(2);
        verify(testPlanService, never()).run(any());
    }

    @Test
    void portsAreNotAllowedWithHilDevs() {
        assertThat(commandLine.execute("--hil-devs", "hil-devs.yml", "-b", "X", "-d", "/dev/ttyUSB0")).isEqualTo(2);
        verify(testPlanService, never()).run(any());
    }

    @Test
    void configurationErrorExitsWithOne() {
        when(testPlanService.run(any())).thenThrow(ConfigurationException.fileNotFound("test-plan.yml"));

        assertThat(commandLine.execute()).isEqualTo(1);
    }

    private TestPlanRunOptions captureOptions() {
        ArgumentCaptor<TestPlanRunOptions> captor = ArgumentCaptor.forClass(TestPlanRunOptions.class);
        verify(testPlanService).run(captor.capture());
        return captor.getValue();
    }
}
