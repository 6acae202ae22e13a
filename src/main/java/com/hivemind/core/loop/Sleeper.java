package com.hivemind.core.loop;

import java.time.Duration;

/**
 * Blocking wait used between retry attempts. Must respond to interruption.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
