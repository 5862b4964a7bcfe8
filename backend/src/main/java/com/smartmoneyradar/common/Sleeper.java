package com.smartmoneyradar.common;

/**
 * Blocking pause used between retries. Swapped for a recording fake in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = millis -> {
        if (millis > 0) {
            Thread.sleep(millis);
        }
    };

    void sleep(long millis) throws InterruptedException;
}
