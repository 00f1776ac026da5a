package com.hiltest.application.service;

import com.hiltest.application.dto.ExecutionSummaryDto;
import com.hiltest.domain.model.Device;
import com.hiltest.domain.model.ResolvedDevices;
import com.hiltest.domain.model.TestCase;
import com.hiltest.domain.model.TestType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExecutionEngineTest {

    private static final Path TEST_DIR = Path.of("/opt/micropython/tests");

    @Mock
    private PowerResetService powerResetService;

    @Mock
    private TestCaseRunner testCaseRunner;

    @Mock
    private DeviceResolutionStrategy resolution;

    private ExecutionEngine engine;

    private final ResolvedDevices connected = new ResolvedDevices(
            Device.atAddress("/dev/ttyACM0"), Device.atAddress("/dev/ttyACM1"));

    @BeforeEach
    void setUp() {
        engine = new ExecutionEngine(powerResetService, testCaseRunner);
    }

    @Test
    void skipsUnavailableTestAndPassesTheOther() {
        TestCase t1 = test("T1", TestType.SINGLE);
        TestCase t2 = test("T2", TestType.SINGLE);
        when(resolution.resolve(t1)).thenReturn(ResolvedDevices.none());
        when(resolution.resolve(t2)).thenReturn(connected);
        when(testCaseRunner.run(t2, "/dev/ttyACM0", "/dev/ttyACM1", TEST_DIR)).thenReturn(0);

        ExecutionSummaryDto summary = engine.execute(List.of(t1, t2), resolution, 1, TEST_DIR);

        assertThat(summary.getSkipped()).containsExactly("T1");
        assertThat(summary.getPassed()).containsExactly("T2");
        assertThat(summary.getFailed()).isEmpty();
        assertThat(summary.getExitCode()).isZero();
        verify(testCaseRunner, never()).run(eq(t1), any(), any(), any());
        verify(powerResetService).resetSwitchableDevices(connected);
    }

    @Test
    void alwaysFailingTestRunsOncePlusRetries() {
        TestCase t3 = test("T3", TestType.SINGLE);
        when(resolution.resolve(t3)).thenReturn(connected);
        when(testCaseRunner.run(t3, "/dev/ttyACM0", "/dev/ttyACM1", TEST_DIR)).thenReturn(1);

        ExecutionSummaryDto summary = engine.execute(List.of(t3), resolution, 2, TEST_DIR);

        verify(testCaseRunner, times(3)).run(t3, "/dev/ttyACM0", "/dev/ttyACM1", TEST_DIR);
        assertThat(summary.getPasses()).isEqualTo(3);
        assertThat(summary.getFailed()).containsExactly("T3");
        assertThat(summary.getExitCode()).isEqualTo(1);
    }

    @Test
    void flakyTestPassesOnRetry() {
        TestCase t1 = test("T1", TestType.SINGLE);
        TestCase t2 = test("T2", TestType.SINGLE);
        when(resolution.resolve(any())).thenReturn(connected);
        when(testCaseRunner.run(t1, "/dev/ttyACM0", "/dev/ttyACM1", TEST_DIR)).thenReturn(1, 0);
        when(testCaseRunner.run(t2, "/dev/ttyACM0", "/dev/ttyACM1", TEST_DIR)).thenReturn(0);

        ExecutionSummaryDto summary = engine.execute(List.of(t1, t2), resolution, 3, TEST_DIR);

        assertThat(summary.getPassed()).containsExactly("T2", "T1");
        assertThat(summary.getFailed()).isEmpty();
        assertThat(summary.getPasses()).isEqualTo(2);
        verify(testCaseRunner, times(1)).run(t2, "/dev/ttyACM0", "/dev/ttyACM1", TEST_DIR);
        assertThat(summary.isSuccess()).isTrue();
    }

    @Test
    void multiTestWithoutStubIsSkipped() {
        TestCase multi = test("network", TestType.MULTI);
        when(resolution.resolve(multi)).thenReturn(
                new ResolvedDevices(Device.atAddress("/dev/ttyACM0"), Device.unresolved()));

        ExecutionSummaryDto summary = engine.execute(List.of(multi), resolution, 1, TEST_DIR);

        assertThat(summary.getSkipped()).containsExactly("network");
        verify(powerResetService, never()).resetSwitchableDevices(any());
    }

    @Test
    void deviceVanishingDuringRetryEndsAsFailure() {
        TestCase t1 = test("T1", TestType.SINGLE);
        when(resolution.resolve(t1)).thenReturn(connected, ResolvedDevices.none(), ResolvedDevices.none());
        when(testCaseRunner.run(t1, "/dev/ttyACM0", "/dev/ttyACM1", TEST_DIR)).thenReturn(1);

        ExecutionSummaryDto summary = engine.execute(List.of(t1), resolution, 2, TEST_DIR);

        assertThat(summary.getFailed()).containsExactly("T1");
        assertThat(summary.getSkipped()).isEmpty();
        assertThat(summary.getPasses()).isEqualTo(3);
    }

    @Test
    void emptyPlanSucceedsWithoutPasses() {
        ExecutionSummaryDto summary = engine.execute(List.of(), resolution, 2, TEST_DIR);

        assertThat(summary.getPasses()).isZero();
        assertThat(summary.getExitCode()).isZero();
    }

    private static TestCase test(String name, TestType type) {
        return TestCase.builder().name(name).type(type).scripts(List.of(name + ".py")).build();
    }
}
