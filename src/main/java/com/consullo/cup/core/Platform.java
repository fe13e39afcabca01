package com.consullo.cup.core;

/**
 * Platform identifiers used in envelopes.
 *
 * @since 1.0
 */
public enum Platform {
  WINDOWS("windows"),
  MACOS("macos"),
  LINUX("linux"),
  WEB("web"),
  ANDROID("android"),
  IOS("ios");

  private final String wireName;

  Platform(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  /**
   * Parses a platform identifier, ignoring case.
   *
   * @param value identifier such as "windows"
   * @return platform
   * @throws IllegalArgumentException if the identifier is unknown
   */
  public static Platform fromWireName(String value) {
    if (value != null) {
      for (Platform p : values()) {
        if (p.wireName.equalsIgnoreCase(value.trim())) {
          return p;
        }
      }
    }
    throw new IllegalArgumentException("Unknown platform: " + value);
  }
}
