package com.bko.team.completion;

import java.time.Duration;

@FunctionalInterface
public interface BackoffSleeper {

    BackoffSleeper THREAD_SLEEP = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
