package com.consullo.cup.capture;

/**
 * Envelope builder configuration values.
 *
 * @param version format version written into every envelope
 * @param defaultMaxDepth depth limit used when a request does not name one
 * @since 1.0
 */
public record EnvelopeBuilderConfig(String version, int defaultMaxDepth) {

  public EnvelopeBuilderConfig {
    if (version == null || version.isBlank()) {
      throw new IllegalArgumentException("version must not be blank.");
    }
  }

  public static EnvelopeBuilderConfig defaults() {
    return new EnvelopeBuilderConfig("0.1.0", 999);
  }
}
