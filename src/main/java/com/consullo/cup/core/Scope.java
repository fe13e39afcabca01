package com.consullo.cup.core;

/**
 * Which part of the UI a capture covers.
 *
 * @since 1.0
 */
public enum Scope {
  /** Window list only, no tree walking. */
  OVERVIEW("overview"),
  /** Foreground window tree. */
  FOREGROUND("foreground"),
  /** Desktop surface (icons, widgets). */
  DESKTOP("desktop"),
  /** All top-level windows. */
  FULL("full");

  private final String wireName;

  Scope(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }
}
