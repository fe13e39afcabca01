package com.consullo.cup.driver;

import com.consullo.cup.capture.DefaultPruningPolicy;
import com.consullo.cup.capture.DetailLevel;
import com.consullo.cup.capture.EnvelopeBuilder;
import com.consullo.cup.capture.PruneCounts;
import com.consullo.cup.capture.PruneResult;
import com.consullo.cup.capture.PruningEngine;
import com.consullo.cup.core.AppInfo;
import com.consullo.cup.core.Envelope;
import com.consullo.cup.core.Node;
import com.consullo.cup.core.PlatformAdapter;
import com.consullo.cup.core.RawElement;
import com.consullo.cup.core.Scope;
import com.consullo.cup.core.ScreenInfo;
import com.consullo.cup.core.WindowInfo;
import com.consullo.cup.format.CompactSerializer;
import com.consullo.cup.format.EnvelopeJsonWriter;
import com.consullo.cup.format.OverviewSerializer;
import com.consullo.cup.search.SearchEngine;
import com.consullo.cup.search.SearchHit;
import com.consullo.cup.search.SearchQuery;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Represents one agent's view of a desktop.
 *
 * <p>
 * Owns:
 * <ul>
 * <li>Platform adapter (native tree walking)</li>
 * <li>Envelope builder and pruning engine</li>
 * <li>Serializers and search engine</li>
 * <li>The last pruned capture, which searches run against</li>
 * </ul>
 * Captures and searches are serialized on the session monitor; a search never observes a half-replaced capture.
 * </p>
 */
public final class CaptureSession {

  private static final Logger LOGGER = LoggerFactory.getLogger(CaptureSession.class);

  private final PlatformAdapter adapter;
  private final CaptureSessionConfig config;
  private final EnvelopeBuilder builder;
  private final PruningEngine pruningEngine;
  private final CompactSerializer compactSerializer;
  private final OverviewSerializer overviewSerializer;
  private final EnvelopeJsonWriter jsonWriter;
  private final SearchEngine searchEngine;

  private boolean initialized;
  private PruneResult lastCapture;

  private CaptureSession(PlatformAdapter adapter, CaptureSessionConfig config, Clock clock) {
    this.adapter = adapter;
    this.config = config;
    this.builder = new EnvelopeBuilder(config.builder(), clock);
    this.pruningEngine = new PruningEngine(new DefaultPruningPolicy());
    this.compactSerializer = new CompactSerializer(config.format());
    this.overviewSerializer = new OverviewSerializer();
    this.jsonWriter = new EnvelopeJsonWriter(config.prettyJson());
    this.searchEngine = new SearchEngine();
  }

  public static CaptureSession create(PlatformAdapter adapter, CaptureSessionConfig config, Clock clock) {
    if (adapter == null || config == null || clock == null) {
      throw new IllegalArgumentException("adapter/config/clock must not be null.");
    }
    return new CaptureSession(adapter, config, clock);
  }

  public PlatformAdapter adapter() {
    return adapter;
  }

  /**
   * Captures, normalizes, prunes and renders part of the UI.
   *
   * <p>Overview captures do not replace the last capture; every other scope does.
   *
   * @param request capture parameters
   * @return capture result
   * @throws Exception if the adapter fails
   */
  public synchronized CaptureResult capture(CaptureRequest request) throws Exception {
    if (request == null) {
      throw new IllegalArgumentException("request must not be null.");
    }
    ensureInitialized();
    ScreenInfo screen = adapter.screenInfo();
    int maxDepth = request.maxDepth() != null ? request.maxDepth() : config.builder().defaultMaxDepth();

    Envelope canonical;
    switch (request.scope()) {
      case OVERVIEW:
        return overview(screen, request);
      case DESKTOP: {
        WindowInfo desktop = adapter.desktopWindow();
        if (desktop == null) {
          LOGGER.debug("capture: no desktop window, falling back to overview");
          return overview(screen, request);
        }
        List<RawElement> raw = adapter.captureTree(List.of(desktop), maxDepth);
        canonical = builder.build(adapter.platform(), raw, Scope.DESKTOP, screen,
            AppInfo.ofNullable(desktop.title(), desktop.pid(), desktop.bundleId()), maxDepth);
        break;
      }
      case FULL: {
        List<WindowInfo> windows = filterByTitle(adapter.allWindows(), request.appFilter());
        List<RawElement> raw = adapter.captureTree(windows, maxDepth);
        canonical = builder.build(adapter.platform(), raw, Scope.FULL, screen, null, maxDepth);
        break;
      }
      default: {
        WindowInfo fg = adapter.foregroundWindow();
        List<WindowInfo> windowList = adapter.windowList();
        List<RawElement> raw = adapter.captureTree(List.of(fg), maxDepth);
        canonical = builder.build(adapter.platform(), raw, Scope.FOREGROUND, screen,
            AppInfo.ofNullable(fg.title(), fg.pid(), fg.bundleId()), maxDepth, windowList);
        break;
      }
    }

    PruneResult pruned = pruningEngine.prune(canonical, request.detail());
    lastCapture = pruned;
    String output = request.compact()
        ? compactSerializer.serialize(pruned)
        : jsonWriter.write(pruned.envelope());
    LOGGER.info("capture: scope={} detail={} nodes={} ({} before pruning)",
        canonical.scope().wireName(), request.detail().wireName(), pruned.counts().after(), pruned.counts().before());
    return new CaptureResult(canonical, pruned, output);
  }

  /**
   * Searches the last capture.
   *
   * @param query search request
   * @return matching nodes, best first
   * @throws com.consullo.cup.search.SearchPreconditionException if no capture was taken or the query is invalid
   */
  public synchronized List<Node> find(SearchQuery query) {
    return searchEngine.find(lastCaptureEnvelope(), query);
  }

  /**
   * Searches the last capture and returns scores alongside nodes.
   *
   * @param query search request
   * @return hits, best first
   */
  public synchronized List<SearchHit> rank(SearchQuery query) {
    return searchEngine.rank(lastCaptureEnvelope(), query);
  }

  /**
   * Returns the last tree capture, or null before the first one.
   *
   * @return last pruning result or null
   */
  public synchronized PruneResult lastCapture() {
    return lastCapture;
  }

  private Envelope lastCaptureEnvelope() {
    return lastCapture == null ? null : lastCapture.envelope();
  }

  private CaptureResult overview(ScreenInfo screen, CaptureRequest request) throws Exception {
    List<WindowInfo> windows = adapter.windowList();
    Envelope env = builder.build(adapter.platform(), List.of(), Scope.OVERVIEW, screen, null, 0, windows);
    PruneResult result = new PruneResult(env, DetailLevel.FULL, new PruneCounts(0, 0));
    String output = request.compact()
        ? overviewSerializer.serialize(env.version(), env.platform(), screen, windows)
        : jsonWriter.write(env);
    LOGGER.info("capture: scope=overview windows={}", windows.size());
    return new CaptureResult(env, result, output);
  }

  private void ensureInitialized() throws Exception {
    if (!initialized) {
      adapter.initialize();
      initialized = true;
    }
  }

  private static List<WindowInfo> filterByTitle(List<WindowInfo> windows, String filter) {
    if (StringUtils.isBlank(filter)) {
      return windows;
    }
    List<WindowInfo> out = new ArrayList<>();
    for (WindowInfo w : windows) {
      if (StringUtils.containsIgnoreCase(w.title(), filter.trim())) {
        out.add(w);
      }
    }
    if (out.isEmpty()) {
      throw new IllegalArgumentException("No window title contains: " + filter);
    }
    return out;
  }
}
