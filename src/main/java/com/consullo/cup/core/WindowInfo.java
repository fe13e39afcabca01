package com.consullo.cup.core;

/**
 * Lightweight top-level window metadata reported by a platform adapter.
 *
 * @param title window title
 * @param pid owning process id (may be null)
 * @param bundleId platform bundle identifier (may be null)
 * @param foreground true for the focused window
 * @param bounds window rectangle (may be null)
 * @param url page URL for browser tabs (may be null)
 * @param handle adapter-specific window reference, never interpreted outside the adapter
 * @since 1.0
 */
public record WindowInfo(
    String title,
    Integer pid,
    String bundleId,
    boolean foreground,
    Bounds bounds,
    String url,
    Object handle) {

  /**
   * Creates window metadata without a URL or native handle.
   *
   * @param title title
   * @param pid pid
   * @param foreground foreground flag
   * @param bounds bounds
   * @return window info
   */
  public static WindowInfo of(String title, Integer pid, boolean foreground, Bounds bounds) {
    return new WindowInfo(title, pid, null, foreground, bounds, null, null);
  }
}
