package com.consullo.cup.format;

import com.consullo.cup.capture.ClippedCounts;
import com.consullo.cup.capture.PruneResult;
import com.consullo.cup.core.Envelope;
import com.consullo.cup.core.Node;
import com.consullo.cup.core.Trees;
import com.consullo.cup.core.WindowInfo;
import com.consullo.cup.core.taxonomy.Action;
import com.consullo.cup.core.taxonomy.State;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;

/**
 * Renders a pruned envelope as line-oriented text for language models.
 *
 * <p>
 * One line per node, indented by depth. The output is a pure function of the envelope and the counts: the
 * timestamp is never written, so two captures of an unchanged UI serialize identically.
 * </p>
 */
public final class CompactSerializer {

  static final String TRUNCATION_NOTICE = "\n\n# OUTPUT TRUNCATED - exceeded character limit.\n"
      + "# Use find(name=...) to locate specific elements instead.\n";

  private static final int MAX_WINDOW_TITLE_CHARS = 50;
  private static final int MAX_PLACEHOLDER_CHARS = 30;

  private final CompactFormatConfig config;

  public CompactSerializer(CompactFormatConfig config) {
    if (config == null) {
      throw new IllegalArgumentException("config must not be null.");
    }
    this.config = config;
  }

  /**
   * Serializes a pruning result, reporting its before/after counts.
   *
   * @param result pruning result
   * @return compact text
   */
  public String serialize(PruneResult result) {
    if (result == null) {
      throw new IllegalArgumentException("result must not be null.");
    }
    return serialize(result.envelope(), result.counts().before(), result.clipped());
  }

  /**
   * Serializes an envelope as-is; the "before" count equals the node count.
   *
   * @param envelope envelope
   * @return compact text
   */
  public String serialize(Envelope envelope) {
    if (envelope == null) {
      throw new IllegalArgumentException("envelope must not be null.");
    }
    return serialize(envelope, Trees.count(envelope.tree()), Map.of());
  }

  private String serialize(Envelope envelope, int before, Map<String, ClippedCounts> clipped) {
    StringBuilder out = new StringBuilder();
    out.append("# CUP ").append(envelope.version())
        .append(" | ").append(envelope.platform().wireName())
        .append(" | ").append(envelope.screen().w()).append('x').append(envelope.screen().h())
        .append('\n');
    if (envelope.app() != null) {
      out.append("# app: ").append(StringUtils.defaultString(envelope.app().name())).append('\n');
    }
    out.append("# ").append(Trees.count(envelope.tree())).append(" nodes (")
        .append(before).append(" before pruning)\n");
    List<WindowInfo> windows = envelope.windows();
    if (!windows.isEmpty()) {
      out.append("# --- ").append(windows.size()).append(" open windows ---\n");
      for (WindowInfo w : windows) {
        String title = StringUtils.left(StringUtils.defaultIfBlank(w.title(), "(untitled)"), MAX_WINDOW_TITLE_CHARS);
        out.append("#   ").append(title).append(w.foreground() ? " [fg]" : "").append('\n');
      }
    }
    out.append('\n');

    appendTree(out, envelope.tree(), clipped);
    return enforceLimit(out.toString());
  }

  private void appendTree(StringBuilder out, List<Node> roots, Map<String, ClippedCounts> clipped) {
    Deque<Frame> stack = new ArrayDeque<>();
    for (int i = roots.size() - 1; i >= 0; i--) {
      stack.push(new Frame(roots.get(i), 0));
    }
    while (!stack.isEmpty()) {
      Frame f = stack.peek();
      if (f.next == 0) {
        out.append(indent(f.depth)).append(formatLine(f.node)).append('\n');
      }
      List<Node> children = f.node.children();
      if (f.next < children.size()) {
        stack.push(new Frame(children.get(f.next++), f.depth + 1));
        continue;
      }
      stack.pop();
      ClippedCounts hidden = clipped.get(f.node.id());
      if (hidden != null && hidden.total() > 0) {
        out.append(indent(f.depth + 1)).append("# ").append(hidden.total()).append(" more items - scroll ")
            .append(String.join("/", hidden.directions())).append(" to see\n");
      }
    }
  }

  private String indent(int depth) {
    return StringUtils.repeat(' ', depth * config.indentWidth());
  }

  /**
   * Formats a single node without indentation.
   *
   * @param n node
   * @return one line of compact text
   */
  public String formatLine(Node n) {
    List<String> parts = new ArrayList<>();
    parts.add("[" + n.id() + "]");
    parts.add(n.role().code());
    if (n.hasName()) {
      parts.add(TextSupport.quote(TextSupport.truncate(n.name(), config.maxNameChars())));
    }
    parts.add(TextSupport.bounds(n.bounds()));

    if (!n.states().isEmpty()) {
      List<String> codes = new ArrayList<>();
      for (State s : n.states()) {
        codes.add(s.code());
      }
      parts.add("{" + String.join(",", codes) + "}");
    }

    List<String> actionCodes = new ArrayList<>();
    for (Action a : n.actions()) {
      if (a.isActionable()) {
        actionCodes.add(a.code());
      }
    }
    if (!actionCodes.isEmpty()) {
      parts.add("[" + String.join(",", actionCodes) + "]");
    }

    if (n.value() != null) {
      String v = TextSupport.scalar(n.value());
      if (!v.isEmpty()) {
        parts.add("val=" + TextSupport.quote(TextSupport.truncate(v, config.maxValueChars())));
      }
    }

    String attrs = formatAttributes(n.platformExtra());
    if (!attrs.isEmpty()) {
      parts.add("(" + attrs + ")");
    }
    return String.join(" ", parts);
  }

  private static String formatAttributes(Map<String, Object> extra) {
    if (extra.isEmpty()) {
      return "";
    }
    List<String> parts = new ArrayList<>();
    Object level = extra.get("level");
    if (level != null) {
      parts.add("L" + TextSupport.scalar(level));
    }
    Object placeholder = extra.get("placeholder");
    if (placeholder != null) {
      parts.add("ph=" + TextSupport.quote(StringUtils.left(String.valueOf(placeholder), MAX_PLACEHOLDER_CHARS)));
    }
    Object orientation = extra.get("orientation");
    if (orientation != null && !String.valueOf(orientation).isEmpty()) {
      parts.add(String.valueOf(orientation).substring(0, 1));
    }
    if (extra.containsKey("valueMin") || extra.containsKey("valueMax")) {
      Object min = extra.get("valueMin");
      Object max = extra.get("valueMax");
      parts.add("range=" + (min == null ? "" : TextSupport.scalar(min)) + ".." + (max == null ? "" : TextSupport.scalar(max)));
    }
    return String.join(" ", parts);
  }

  private String enforceLimit(String output) {
    int max = config.maxOutputChars();
    if (max <= 0 || output.length() <= max) {
      return output;
    }
    String cut = output.substring(0, max);
    int lastNewline = cut.lastIndexOf('\n');
    if (lastNewline > 0) {
      cut = cut.substring(0, lastNewline);
    }
    return cut + TRUNCATION_NOTICE;
  }

  private static final class Frame {
    final Node node;
    final int depth;
    int next;

    Frame(Node node, int depth) {
      this.node = node;
      this.depth = depth;
    }
  }
}
