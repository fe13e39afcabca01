package com.consullo.cup.format;

/**
 * Compact text format configuration values.
 *
 * @param indentWidth spaces per tree depth
 * @param maxNameChars names longer than this are cut and suffixed with "..."
 * @param maxValueChars values longer than this are cut and suffixed with "..."
 * @param maxOutputChars hard output limit; zero or negative disables truncation
 * @since 1.0
 */
public record CompactFormatConfig(int indentWidth, int maxNameChars, int maxValueChars, int maxOutputChars) {

  public CompactFormatConfig {
    if (indentWidth < 0) {
      throw new IllegalArgumentException("indentWidth must not be negative.");
    }
    if (maxNameChars <= 0 || maxValueChars <= 0) {
      throw new IllegalArgumentException("maxNameChars/maxValueChars must be positive.");
    }
  }

  public static CompactFormatConfig defaults() {
    return new CompactFormatConfig(2, 80, 120, 40_000);
  }
}
