package com.sptjm.integration.mail;

import java.time.Duration;

/**
 * Pause between two send attempts.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
