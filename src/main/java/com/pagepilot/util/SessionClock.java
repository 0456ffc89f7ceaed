package com.pagepilot.util;

/**
 * Time source and sleeper for the agent loop, swapped out in tests.
 */
public interface SessionClock {

    long now();

    void sleep(long millis) throws InterruptedException;

    static SessionClock system() {
        return new SessionClock() {
            @Override
            public long now() {
                return System.currentTimeMillis();
            }

            @Override
            public void sleep(long millis) throws InterruptedException {
                if (millis > 0) {
                    Thread.sleep(millis);
                }
            }
        };
    }
}
