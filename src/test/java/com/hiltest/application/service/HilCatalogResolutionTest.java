package com.hiltest.application.service;

import com.hiltest.domain.model.Device;
import com.hiltest.domain.model.DeviceRequirement;
import com.hiltest.domain.model.ResolvedDevices;
import com.hiltest.domain.model.SerialAccess;
import com.hiltest.domain.model.TestCase;
import com.hiltest.domain.model.TestType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HilCatalogResolutionTest {

    private static final String BOARD = "CY8CPROTO-062-4343W";
    private static final Path REGISTRY = Path.of("hil-devs.yml");

    @Mock
    private DeviceRegistry deviceRegistry;

    private HilCatalogResolution resolution;

    @BeforeEach
    void setUp() {
        resolution = new HilCatalogResolution(deviceRegistry, REGISTRY, BOARD);
    }

    @Test
    void picksFirstAccessibleDut() {
        when(deviceRegistry.load(REGISTRY)).thenReturn(List.of(
                device(BOARD, null, "0.1.0"),
                device(BOARD, "/dev/ttyACM3", "0.1.0"),
                device(BOARD, "/dev/ttyACM4", "0.1.0")));

        ResolvedDevices devices = resolution.resolve(single(new DeviceRequirement(BOARD, null)));

        assertThat(devices.dut().getAddress()).isEqualTo("/dev/ttyACM3");
        assertThat(devices.stub().hasAccess()).isFalse();
    }

    @Test
    void filtersByVersionFeature() {
        when(deviceRegistry.load(REGISTRY)).thenReturn(List.of(
                device(BOARD, "/dev/ttyACM0", "0.1.0"),
                device(BOARD, "/dev/ttyACM1", "0.2.0")));

        ResolvedDevices devices = resolution.resolve(single(new DeviceRequirement(BOARD, "0.2.0")));

        assertThat(devices.dut().getAddress()).isEqualTo("/dev/ttyACM1");
    }

    @Test
    void stubMustDifferFromDut() {
        when(deviceRegistry.load(REGISTRY)).thenReturn(List.of(
                device(BOARD, "/dev/ttyACM0", "0.2.0"),
                device(BOARD, "/dev/ttyACM1", "0.2.0")));

        TestCase multi = TestCase.builder()
                .name("network")
                .type(TestType.MULTI)
                .dutRequirements(List.of(new DeviceRequirement(BOARD, null)))
                .build();

        ResolvedDevices devices = resolution.resolve(multi);

        assertThat(devices.dut().getAddress()).isEqualTo("/dev/ttyACM0");
        assertThat(devices.stub().getAddress()).isEqualTo("/dev/ttyACM1");
    }

    @Test
    void noStubWhenOnlyOneBoardIsConnected() {
        when(deviceRegistry.load(REGISTRY)).thenReturn(List.of(
                device(BOARD, "/dev/ttyACM0", "0.2.0"),
                device("CY8CPROTO-063-BLE", null, "0.2.0")));

        TestCase multiStub = TestCase.builder()
                .name("i2c")
                .type(TestType.MULTI_STUB)
                .stubScript("i2c_slave.py")
                .dutRequirements(List.of(new DeviceRequirement(BOARD, null)))
                .stubRequirements(List.of(new DeviceRequirement(BOARD, null)))
                .build();

        ResolvedDevices devices = resolution.resolve(multiStub);

        assertThat(devices.dut().hasAccess()).isTrue();
        assertThat(devices.stub().hasAccess()).isFalse();
    }

    @Test
    void unsupportedBoardResolvesNothing() {
        ResolvedDevices devices = resolution.resolve(single(new DeviceRequirement("CY8CKIT-062S2-AI", null)));

        assertThat(devices.dut().hasAccess()).isFalse();
    }

    private static TestCase single(DeviceRequirement requirement) {
        return TestCase.builder()
                .name("basics")
                .type(TestType.SINGLE)
                .dutRequirements(List.of(requirement))
                .build();
    }

    private static Device device(String name, String address, String feature) {
        return Device.builder()
                .name(name)
                .uid(name + address)
                .features(Set.of(feature))
                .access(address != null ? SerialAccess.of(address) : null)
                .build();
    }
}
