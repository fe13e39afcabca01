package com.consullo.cup.capture;

/**
 * Pruning aggressiveness. Each level keeps a subset of the nodes kept by the level before it.
 *
 * @since 1.0
 */
public enum DetailLevel {
  /** No pruning. */
  FULL("full"),
  /** Viewport clipping, noise removal and wrapper collapse. */
  STANDARD("standard"),
  /** Same policy as {@link #STANDARD}. */
  COMPACT("compact"),
  /** Interactive nodes and their ancestors only. */
  MINIMAL("minimal");

  private final String wireName;

  DetailLevel(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  /**
   * Parses a detail level name, ignoring case.
   *
   * @param value name such as "compact"
   * @return detail level
   * @throws IllegalArgumentException if the name is unknown
   */
  public static DetailLevel fromWireName(String value) {
    if (value != null) {
      for (DetailLevel d : values()) {
        if (d.wireName.equalsIgnoreCase(value.trim())) {
          return d;
        }
      }
    }
    throw new IllegalArgumentException("Unknown detail level: " + value);
  }
}
