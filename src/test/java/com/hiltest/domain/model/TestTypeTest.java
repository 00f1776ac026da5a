package com.hiltest.domain.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TestTypeTest {

    @Test
    void infersFromStubScriptAndDelay() {
        assertThat(TestType.infer("i2c_slave.py", 0)).isEqualTo(TestType.MULTI_STUB);
        assertThat(TestType.infer("i2c_slave.py", 500)).isEqualTo(TestType.MULTI_STUB);
        assertThat(TestType.infer(null, 500)).isEqualTo(TestType.SINGLE_POST_DELAY);
        assertThat(TestType.infer(null, 0)).isEqualTo(TestType.SINGLE);
    }

    @Test
    void onlyMultiTypesNeedTwoDevices() {
        assertThat(TestType.MULTI.requiresMultipleDevices()).isTrue();
        assertThat(TestType.MULTI_STUB.requiresMultipleDevices()).isTrue();
        assertThat(TestType.SINGLE.requiresMultipleDevices()).isFalse();
        assertThat(TestType.CUSTOM.requiresMultipleDevices()).isFalse();
    }

    @Test
    void resolvesPlanKeys() {
        assertThat(TestType.fromKey("single_post_delay")).contains(TestType.SINGLE_POST_DELAY);
        assertThat(TestType.fromKey("SINGLE")).isEmpty();
    }
}
