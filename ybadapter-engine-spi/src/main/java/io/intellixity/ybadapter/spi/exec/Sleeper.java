package io.intellixity.ybadapter.spi.exec;

import java.time.Duration;

/** Blocking pause between connection attempts (replaceable in tests). */
@FunctionalInterface
public interface Sleeper {
  Sleeper SYSTEM = d -> {
    if (!d.isZero()) Thread.sleep(d.toMillis());
  };

  void sleep(Duration duration) throws InterruptedException;
}
