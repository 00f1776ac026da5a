package com.hiltest.infrastructure.process;

import com.hiltest.domain.port.Sleeper;
import org.springframework.stereotype.Component;

/**
 * Espera real mediante Thread.sleep.
 */
@Component
public class ThreadSleeper implements Sleeper {

    @Override
    public void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Espera interrumpida", e);
        }
    }
}
