package net.fabricspark.client.core;

import java.time.Duration;

/** Blocking wait used between polls and retries. */
@FunctionalInterface
public interface Sleeper {
  Sleeper THREAD_SLEEPER = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
