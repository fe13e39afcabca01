package com.consullo.cup.core;

/**
 * Foreground application metadata attached to an envelope.
 *
 * @param name application or window title (may be null)
 * @param pid process id (may be null)
 * @param bundleId platform bundle identifier (may be null)
 * @since 1.0
 */
public record AppInfo(String name, Integer pid, String bundleId) {

  /**
   * Returns null when none of the fields carry information, otherwise a new instance.
   *
   * @param name name
   * @param pid pid
   * @param bundleId bundle id
   * @return app info or null
   */
  public static AppInfo ofNullable(String name, Integer pid, String bundleId) {
    boolean hasName = name != null && !name.isBlank();
    boolean hasBundle = bundleId != null && !bundleId.isBlank();
    if (!hasName && pid == null && !hasBundle) {
      return null;
    }
    return new AppInfo(hasName ? name : null, pid, hasBundle ? bundleId : null);
  }
}
