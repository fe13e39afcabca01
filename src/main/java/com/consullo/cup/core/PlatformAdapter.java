package com.consullo.cup.core;

import java.util.List;

/**
 * Capability interface implemented once per platform (UI Automation, AX, AT-SPI, browser DevTools).
 *
 * <p>The normalization pipeline depends only on this interface. Implementations walk the native accessibility
 * tree and report raw records; they never normalize vocabulary or prune.
 *
 * @since 1.0
 */
public interface PlatformAdapter {

  /**
   * Returns the platform identifier written into envelopes.
   *
   * @return platform
   */
  Platform platform();

  /**
   * Performs one-time setup. Must be idempotent.
   *
   * @throws Exception if the accessibility API cannot be initialized
   */
  void initialize() throws Exception;

  /**
   * Returns primary display metrics.
   *
   * @return screen info
   * @throws Exception if the display cannot be queried
   */
  ScreenInfo screenInfo() throws Exception;

  /**
   * Returns the focused top-level window.
   *
   * @return foreground window
   * @throws Exception if no window can be determined
   */
  WindowInfo foregroundWindow() throws Exception;

  /**
   * Returns all visible top-level windows eligible for tree capture.
   *
   * @return windows
   * @throws Exception if enumeration fails
   */
  List<WindowInfo> allWindows() throws Exception;

  /**
   * Returns lightweight metadata for every visible window without walking any tree.
   *
   * @return window list
   * @throws Exception if enumeration fails
   */
  List<WindowInfo> windowList() throws Exception;

  /**
   * Returns the desktop surface window, or null when the platform has no desktop concept.
   *
   * @return desktop window or null
   * @throws Exception if the desktop cannot be queried
   */
  WindowInfo desktopWindow() throws Exception;

  /**
   * Walks the accessibility trees of the given windows.
   *
   * @param windows windows to capture
   * @param maxDepth maximum depth to walk (roots are depth 0)
   * @return one raw root per captured window
   * @throws Exception if the native walk fails
   */
  List<RawElement> captureTree(List<WindowInfo> windows, int maxDepth) throws Exception;
}
