package net.fabricspark.client.util;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class StopwatchTest {

  @Test
  public void testStartStop() throws Exception {
    Stopwatch stopwatch = Stopwatch.createStarted();
    assertTrue(stopwatch.isRunning());
    Thread.sleep(20);
    stopwatch.stop();
    assertFalse(stopwatch.isRunning());
    long elapsed = stopwatch.elapsedMillis();
    assertThat(elapsed, greaterThanOrEqualTo(20L));
    Thread.sleep(5);
    assertThat(stopwatch.elapsedMillis(), greaterThanOrEqualTo(elapsed));
  }

  @Test
  public void testInvalidTransitions() {
    Stopwatch stopwatch = new Stopwatch();
    assertThrows(IllegalStateException.class, stopwatch::stop);
    stopwatch.start();
    assertThrows(IllegalStateException.class, stopwatch::start);
  }
}
