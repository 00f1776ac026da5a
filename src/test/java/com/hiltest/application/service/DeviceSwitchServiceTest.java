package com.hiltest.application.service;

import com.hiltest.domain.model.DeviceSwitch;
import com.hiltest.domain.model.HubPort;
import com.hiltest.domain.model.PortStatus;
import com.hiltest.domain.model.PowerAction;
import com.hiltest.domain.port.PowerControlPort;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DeviceSwitchServiceTest {

    @Mock
    private PowerControlPort powerControl;

    @InjectMocks
    private DeviceSwitchService service;

    @Test
    void resetAllCyclesEachDistinctHubOnce() {
        when(powerControl.scanHubsPorts()).thenReturn(List.of(
                new HubPort("2-1", 2),
                new HubPort("1-1", 2),
                new HubPort("2-1", 3),
                new HubPort("1-1", 4)));

        assertThat(service.resetAll()).containsExactly("2-1", "1-1");

        verify(powerControl).runAction(PowerAction.CYCLE, "2-1", null);
        verify(powerControl).runAction(PowerAction.CYCLE, "1-1", null);
        verify(powerControl, times(2)).runAction(any(), anyString(), any());
    }

    @Test
    void scanKeepsDuplicates() {
        when(powerControl.scanHubsPorts()).thenReturn(List.of(new HubPort("2-1", 2), new HubPort("2-1", 2)));

        assertThat(service.scanSwitches()).hasSize(2);
    }

    @Test
    void switchOperationsTargetItsAddress() {
        DeviceSwitch powerSwitch = new DeviceSwitch("1-1.3", 4);

        service.on(powerSwitch);
        service.off(powerSwitch);
        service.reset(powerSwitch);

        verify(powerControl).runAction(PowerAction.ON, "1-1.3", 4);
        verify(powerControl).runAction(PowerAction.OFF, "1-1.3", 4);
        verify(powerControl).runAction(PowerAction.CYCLE, "1-1.3", 4);
    }

    @Test
    void statusOfWholeHubIsUnknown() {
        assertThat(service.status(new DeviceSwitch("1-1", null))).isEqualTo(PortStatus.UNKNOWN);
        verify(powerControl, never()).getStatus(anyString(), anyInt());
    }
}
