package com.consullo.cup.capture;

import com.consullo.cup.core.AppInfo;
import com.consullo.cup.core.Bounds;
import com.consullo.cup.core.Envelope;
import com.consullo.cup.core.Node;
import com.consullo.cup.core.Platform;
import com.consullo.cup.core.RawElement;
import com.consullo.cup.core.Scope;
import com.consullo.cup.core.ScreenInfo;
import com.consullo.cup.core.WindowInfo;
import com.consullo.cup.core.taxonomy.Action;
import com.consullo.cup.core.taxonomy.State;
import com.consullo.cup.core.taxonomy.Vocabulary;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts raw adapter records into a normalized {@link Envelope}.
 *
 * <p>
 * Strategy:
 * <ul>
 * <li>Walk depth-first with an explicit work stack so arbitrarily deep trees cannot overflow the call stack.</li>
 * <li>Assign ids {@code e0, e1, ...} in pre-order.</li>
 * <li>Map native role, state and action vocabulary through {@link Vocabulary}; unknown tokens are dropped.</li>
 * <li>Truncate an element that already appears on its own ancestor path.</li>
 * <li>Place elements without bounds at their parent's origin with zero size.</li>
 * </ul>
 * No filtering happens here; that is the pruning engine's job.
 * </p>
 */
public final class EnvelopeBuilder {

  private static final Logger LOGGER = LoggerFactory.getLogger(EnvelopeBuilder.class);

  private final EnvelopeBuilderConfig config;
  private final Clock clock;

  public EnvelopeBuilder(EnvelopeBuilderConfig config) {
    this(config, Clock.systemUTC());
  }

  public EnvelopeBuilder(EnvelopeBuilderConfig config, Clock clock) {
    if (config == null || clock == null) {
      throw new IllegalArgumentException("config/clock must not be null.");
    }
    this.config = config;
    this.clock = clock;
  }

  public EnvelopeBuilderConfig config() {
    return config;
  }

  /**
   * Builds an envelope without a window list.
   *
   * @param platform source platform
   * @param rawRoots raw roots, one per captured window
   * @param scope capture scope
   * @param screen screen metrics
   * @param app foreground application (may be null)
   * @param maxDepth maximum depth (roots are depth 0); negative means unbounded
   * @return envelope
   */
  public Envelope build(Platform platform, List<RawElement> rawRoots, Scope scope, ScreenInfo screen, AppInfo app,
      int maxDepth) {
    return build(platform, rawRoots, scope, screen, app, maxDepth, List.of());
  }

  /**
   * Builds an envelope and attaches a window list for the compact header.
   *
   * @param platform source platform
   * @param rawRoots raw roots, one per captured window
   * @param scope capture scope
   * @param screen screen metrics
   * @param app foreground application (may be null)
   * @param maxDepth maximum depth (roots are depth 0); negative means unbounded
   * @param windows window list (may be null)
   * @return envelope
   */
  public Envelope build(Platform platform, List<RawElement> rawRoots, Scope scope, ScreenInfo screen, AppInfo app,
      int maxDepth, List<WindowInfo> windows) {
    Validate.notNull(platform, "platform must not be null");
    Validate.notNull(scope, "scope must not be null");
    Validate.notNull(screen, "screen must not be null");

    List<Node> tree = buildTree(platform, rawRoots == null ? List.of() : rawRoots, maxDepth < 0 ? Integer.MAX_VALUE : maxDepth);
    LOGGER.debug("build: platform={} scope={} roots={}", platform.wireName(), scope.wireName(), tree.size());
    return new Envelope(config.version(), platform, clock.instant(), screen, scope, app, tree, windows);
  }

  private List<Node> buildTree(Platform platform, List<RawElement> rawRoots, int maxDepth) {
    // Phase 1: pre-order walk producing drafts in id order.
    List<Draft> drafts = new ArrayList<>();
    List<Draft> roots = new ArrayList<>();
    Deque<Frame> stack = new ArrayDeque<>();
    for (int i = rawRoots.size() - 1; i >= 0; i--) {
      RawElement r = rawRoots.get(i);
      if (r != null) {
        stack.push(new Frame(r, 0, null));
      }
    }

    int truncatedCycles = 0;
    while (!stack.isEmpty()) {
      Frame f = stack.pop();
      if (isOnAncestorPath(f.raw, f.parent)) {
        truncatedCycles++;
        continue;
      }
      Draft d = new Draft(f.raw, f.parent, "e" + drafts.size(), resolveBounds(f.raw, f.parent));
      drafts.add(d);
      if (f.parent == null) {
        roots.add(d);
      } else {
        f.parent.children.add(d);
      }
      if (f.depth >= maxDepth) {
        continue;
      }
      List<RawElement> children = f.raw.children();
      for (int i = children.size() - 1; i >= 0; i--) {
        RawElement c = children.get(i);
        if (c != null) {
          stack.push(new Frame(c, f.depth + 1, d));
        }
      }
    }
    if (truncatedCycles > 0) {
      LOGGER.warn("build: truncated {} cyclic element reference(s)", truncatedCycles);
    }

    // Phase 2: children always follow their parent in pre-order, so a reverse sweep sees them built first.
    for (int i = drafts.size() - 1; i >= 0; i--) {
      Draft d = drafts.get(i);
      d.node = normalize(platform, d);
    }

    List<Node> out = new ArrayList<>(roots.size());
    for (Draft r : roots) {
      out.add(r.node);
    }
    return out;
  }

  private static Node normalize(Platform platform, Draft d) {
    RawElement raw = d.raw;
    Node.Builder b = Node.builder()
        .id(d.id)
        .role(Vocabulary.role(platform, raw.role()))
        .name(raw.name())
        .bounds(d.bounds)
        .value(scalarValue(raw.value()))
        .platformExtra(raw.attributes());
    for (String token : raw.states()) {
      State s = Vocabulary.state(platform, token);
      if (s != null) {
        b.state(s);
      }
    }
    for (String token : raw.actions()) {
      Action a = Vocabulary.action(platform, token);
      if (a != null) {
        b.action(a);
      }
    }
    for (Draft c : d.children) {
      b.child(c.node);
    }
    return b.build();
  }

  private static Object scalarValue(Object value) {
    if (value == null || value instanceof Number || value instanceof Boolean) {
      return value;
    }
    String s = value.toString();
    return s.isEmpty() ? null : s;
  }

  private static Bounds resolveBounds(RawElement raw, Draft parent) {
    if (raw.bounds() != null) {
      return raw.bounds();
    }
    if (parent == null) {
      return Bounds.ZERO;
    }
    return Bounds.emptyAt(parent.bounds.x(), parent.bounds.y());
  }

  private static boolean isOnAncestorPath(RawElement raw, Draft parent) {
    for (Draft a = parent; a != null; a = a.parent) {
      if (sameElement(a.raw, raw)) {
        return true;
      }
    }
    return false;
  }

  private static boolean sameElement(RawElement a, RawElement b) {
    if (a == b) {
      return true;
    }
    return a.nativeId() != null && b.nativeId() != null && Objects.equals(a.nativeId(), b.nativeId());
  }

  private static final class Frame {
    final RawElement raw;
    final int depth;
    final Draft parent;

    Frame(RawElement raw, int depth, Draft parent) {
      this.raw = raw;
      this.depth = depth;
      this.parent = parent;
    }
  }

  private static final class Draft {
    final RawElement raw;
    final Draft parent;
    final String id;
    final Bounds bounds;
    final List<Draft> children = new ArrayList<>();
    Node node;

    Draft(RawElement raw, Draft parent, String id, Bounds bounds) {
      this.raw = raw;
      this.parent = parent;
      this.id = id;
      this.bounds = bounds;
    }
  }
}
