package net.fabricspark.client.util;

import java.time.Duration;

/** Measures the wall time of a single HTTP exchange or poll loop. Not thread safe. */
public final class Stopwatch {
  private long startedAt;
  private long stoppedAt;
  private boolean running;

  /** Returns a stopwatch that is already running. */
  public static Stopwatch createStarted() {
    Stopwatch stopwatch = new Stopwatch();
    stopwatch.start();
    return stopwatch;
  }

  public Stopwatch start() {
    if (running) {
      throw new IllegalStateException("Stopwatch is already running");
    }
    running = true;
    startedAt = System.nanoTime();
    return this;
  }

  public Stopwatch stop() {
    if (!running) {
      throw new IllegalStateException("Stopwatch is not running");
    }
    stoppedAt = System.nanoTime();
    running = false;
    return this;
  }

  /** Time since start while running, otherwise the time between start and stop. */
  public Duration elapsed() {
    long end = running ? System.nanoTime() : stoppedAt;
    return Duration.ofNanos(end - startedAt);
  }

  public long elapsedMillis() {
    return elapsed().toMillis();
  }

  public boolean isRunning() {
    return running;
  }
}
