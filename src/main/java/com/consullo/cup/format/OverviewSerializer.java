package com.consullo.cup.format;

import com.consullo.cup.core.Bounds;
import com.consullo.cup.core.Platform;
import com.consullo.cup.core.ScreenInfo;
import com.consullo.cup.core.WindowInfo;
import java.util.List;
import org.apache.commons.lang3.StringUtils;

/**
 * Renders a window list without walking any tree. No element ids are produced.
 *
 * @since 1.0
 */
public final class OverviewSerializer {

  private static final int MAX_URL_CHARS = 80;

  /**
   * Serializes a window list.
   *
   * @param version format version
   * @param platform platform
   * @param screen screen metrics
   * @param windows windows in adapter order
   * @return overview text
   */
  public String serialize(String version, Platform platform, ScreenInfo screen, List<WindowInfo> windows) {
    if (version == null || platform == null || screen == null || windows == null) {
      throw new IllegalArgumentException("version/platform/screen/windows must not be null.");
    }
    StringBuilder out = new StringBuilder();
    out.append("# CUP ").append(version).append(" | ").append(platform.wireName())
        .append(" | ").append(screen.w()).append('x').append(screen.h()).append('\n');
    out.append("# overview | ").append(windows.size()).append(" windows\n");
    out.append('\n');
    for (WindowInfo w : windows) {
      out.append(w.foreground() ? "* [fg] " : "  ");
      out.append(StringUtils.defaultIfBlank(w.title(), "(untitled)"));
      if (w.pid() != null) {
        out.append(" (pid:").append(w.pid()).append(')');
      }
      Bounds b = w.bounds();
      if (b != null) {
        out.append(" @").append(TextSupport.bounds(b));
      }
      if (StringUtils.isNotEmpty(w.url())) {
        out.append(" url:").append(TextSupport.truncate(w.url(), MAX_URL_CHARS));
      }
      out.append('\n');
    }
    return out.toString();
  }
}
