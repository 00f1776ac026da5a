package com.hiltest.application.service;

import com.hiltest.domain.model.Device;
import com.hiltest.domain.model.DeviceSwitch;
import com.hiltest.domain.model.PortStatus;
import com.hiltest.domain.model.PowerAction;
import com.hiltest.domain.model.ResolvedDevices;
import com.hiltest.domain.model.SerialAccess;
import com.hiltest.domain.port.PowerControlPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PowerResetServiceTest {

    @Mock
    private PowerControlPort powerControl;

    private final List<Long> sleeps = new ArrayList<>();

    private PowerResetService service;

    @BeforeEach
    void setUp() {
        service = new PowerResetService(powerControl, sleeps::add);
    }

    @Test
    void waitsUntilPortReportsConnectedThenSettles() {
        when(powerControl.getStatus("1-1", 2))
                .thenReturn(PortStatus.OFF, PortStatus.ON, PortStatus.ON_CONNECTED);

        boolean connected = service.resetAndWait(switchable("1-1", 2));

        assertThat(connected).isTrue();
        verify(powerControl).runAction(PowerAction.CYCLE, "1-1", 2);
        verify(powerControl, times(3)).getStatus("1-1", 2);
        assertThat(sleeps).containsExactly(1000L, 1000L, 2000L);
    }

    @Test
    void givesUpAfterFivePollsAndStillSettles() {
        when(powerControl.getStatus("1-1", 2)).thenReturn(PortStatus.ON);

        boolean connected = service.resetAndWait(switchable("1-1", 2));

        assertThat(connected).isFalse();
        verify(powerControl, times(6)).getStatus("1-1", 2);
        assertThat(sleeps).containsExactly(1000L, 1000L, 1000L, 1000L, 1000L, 2000L);
    }

    @Test
    void honoursConfiguredTimings() {
        service.setTimings(2, 10, 20);
        when(powerControl.getStatus("1-1", 2)).thenReturn(PortStatus.UNKNOWN);

        service.resetAndWait(switchable("1-1", 2));

        assertThat(sleeps).containsExactly(10L, 10L, 20L);
    }

    @Test
    void resetsDutBeforeStubAndSkipsUnswitchable() {
        when(powerControl.getStatus(anyString(), anyInt())).thenReturn(PortStatus.ON_CONNECTED);
        Device dut = switchable("1-1", 1);
        Device stub = switchable("1-1", 3);

        service.resetSwitchableDevices(new ResolvedDevices(dut, stub));

        InOrder order = inOrder(powerControl);
        order.verify(powerControl).runAction(PowerAction.CYCLE, "1-1", 1);
        order.verify(powerControl).runAction(PowerAction.CYCLE, "1-1", 3);
    }

    @Test
    void doesNothingWithoutSwitches() {
        Device dut = Device.builder().access(SerialAccess.of("/dev/ttyACM0")).build();

        service.resetSwitchableDevices(new ResolvedDevices(dut, Device.unresolved()));

        verify(powerControl, never()).runAction(any(), any(), any());
        assertThat(sleeps).isEmpty();
    }

    private static Device switchable(String hub, int port) {
        return Device.builder()
                .name("CY8CPROTO-062-4343W")
                .access(SerialAccess.of("/dev/ttyACM0"))
                .powerSwitch(new DeviceSwitch(hub, port))
                .build();
    }
}
