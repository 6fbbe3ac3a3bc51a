package com.example.reviewharvester.util;

import java.time.Duration;

/**
 * Blocking wait used for pacing between browser interactions. Swappable so tests
 * don't actually sleep.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration);

    Sleeper NONE = duration -> { };
}
