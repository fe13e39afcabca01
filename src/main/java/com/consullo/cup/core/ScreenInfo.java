package com.consullo.cup.core;

/**
 * Primary display metrics.
 *
 * @param w width in pixels
 * @param h height in pixels
 * @param scale device scale factor (1.0 for standard density)
 * @since 1.0
 */
public record ScreenInfo(int w, int h, double scale) {

  public ScreenInfo {
    if (w < 0 || h < 0) {
      throw new IllegalArgumentException("screen w/h must not be negative.");
    }
    if (scale <= 0) {
      throw new IllegalArgumentException("screen scale must be positive.");
    }
  }

  /**
   * Returns the screen as a rectangle anchored at the origin.
   *
   * @return screen rectangle
   */
  public Bounds toBounds() {
    return new Bounds(0, 0, w, h);
  }
}
