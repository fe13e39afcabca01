package com.consullo.cup.driver;

import com.consullo.cup.capture.EnvelopeBuilderConfig;
import com.consullo.cup.format.CompactFormatConfig;

/**
 * Capture session configuration values.
 *
 * @param builder envelope builder settings
 * @param format compact text settings
 * @param prettyJson if true, JSON output is indented
 * @since 1.0
 */
public record CaptureSessionConfig(EnvelopeBuilderConfig builder, CompactFormatConfig format, boolean prettyJson) {

  public CaptureSessionConfig {
    if (builder == null || format == null) {
      throw new IllegalArgumentException("builder/format must not be null.");
    }
  }

  public static CaptureSessionConfig defaults() {
    return new CaptureSessionConfig(EnvelopeBuilderConfig.defaults(), CompactFormatConfig.defaults(), false);
  }
}
