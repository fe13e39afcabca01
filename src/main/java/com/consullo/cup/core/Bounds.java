package com.consullo.cup.core;

/**
 * Absolute screen rectangle in pixels.
 *
 * @param x left edge
 * @param y top edge
 * @param w width (zero for hidden or off-screen elements)
 * @param h height (zero for hidden or off-screen elements)
 * @since 1.0
 */
public record Bounds(double x, double y, double w, double h) {

  public static final Bounds ZERO = new Bounds(0, 0, 0, 0);

  public Bounds {
    if (w < 0) {
      w = 0;
    }
    if (h < 0) {
      h = 0;
    }
  }

  /**
   * Creates a zero-size rectangle at the given origin.
   *
   * @param x left edge
   * @param y top edge
   * @return zero-size bounds
   */
  public static Bounds emptyAt(double x, double y) {
    return new Bounds(x, y, 0, 0);
  }

  public double right() {
    return x + w;
  }

  public double bottom() {
    return y + h;
  }

  public double area() {
    return w * h;
  }

  /**
   * Returns true when the rectangle covers no pixels.
   *
   * @return true if width or height is zero
   */
  public boolean isEmpty() {
    return w <= 0 || h <= 0;
  }

  /**
   * Returns the overlap of this rectangle and another. Disjoint rectangles yield a zero-size result.
   *
   * @param other other rectangle
   * @return intersection
   */
  public Bounds intersect(Bounds other) {
    double x1 = Math.max(x, other.x);
    double y1 = Math.max(y, other.y);
    double x2 = Math.min(right(), other.right());
    double y2 = Math.min(bottom(), other.bottom());
    return new Bounds(x1, y1, Math.max(0, x2 - x1), Math.max(0, y2 - y1));
  }

  /**
   * Returns true if the two rectangles overlap with positive area.
   *
   * @param other other rectangle
   * @return true on non-empty overlap
   */
  public boolean intersects(Bounds other) {
    return !intersect(other).isEmpty();
  }
}
