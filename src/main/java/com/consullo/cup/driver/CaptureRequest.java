package com.consullo.cup.driver;

import com.consullo.cup.capture.DetailLevel;
import com.consullo.cup.core.Scope;

/**
 * Parameters of one capture.
 *
 * @param scope what to capture
 * @param appFilter case-insensitive window title substring, used with {@link Scope#FULL} (may be null)
 * @param maxDepth tree depth limit, or null for the configured default
 * @param compact true for compact text output, false for JSON
 * @param detail pruning level
 * @since 1.0
 */
public record CaptureRequest(Scope scope, String appFilter, Integer maxDepth, boolean compact, DetailLevel detail) {

  public CaptureRequest {
    if (scope == null || detail == null) {
      throw new IllegalArgumentException("scope/detail must not be null.");
    }
  }

  /**
   * Creates a compact-text request at {@link DetailLevel#COMPACT} with default depth.
   *
   * @param scope scope
   * @return request
   */
  public static CaptureRequest of(Scope scope) {
    return new CaptureRequest(scope, null, null, true, DetailLevel.COMPACT);
  }

  public CaptureRequest withDetail(DetailLevel newDetail) {
    return new CaptureRequest(scope, appFilter, maxDepth, compact, newDetail);
  }

  public CaptureRequest withAppFilter(String newAppFilter) {
    return new CaptureRequest(scope, newAppFilter, maxDepth, compact, detail);
  }

  public CaptureRequest withMaxDepth(Integer newMaxDepth) {
    return new CaptureRequest(scope, appFilter, newMaxDepth, compact, detail);
  }

  public CaptureRequest withCompact(boolean newCompact) {
    return new CaptureRequest(scope, appFilter, maxDepth, newCompact, detail);
  }
}
