package com.consullo.cup.driver;

import com.consullo.cup.core.PlatformAdapter;
import java.time.Clock;

/**
 * Factory for creating capture sessions with sensible defaults.
 */
public final class CaptureSessionFactory {

  private CaptureSessionFactory() {
  }

  /**
   * Creates a session with default configuration and the system UTC clock.
   *
   * @param adapter platform adapter
   * @return session
   */
  public static CaptureSession createSession(PlatformAdapter adapter) {
    return createSession(adapter, CaptureSessionConfig.defaults());
  }

  /**
   * Creates a session with the given configuration and the system UTC clock.
   *
   * @param adapter platform adapter
   * @param config configuration
   * @return session
   */
  public static CaptureSession createSession(PlatformAdapter adapter, CaptureSessionConfig config) {
    if (adapter == null) {
      throw new IllegalArgumentException("adapter must not be null.");
    }
    return CaptureSession.create(adapter, config, Clock.systemUTC());
  }
}
