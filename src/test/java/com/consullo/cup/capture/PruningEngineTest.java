package com.consullo.cup.capture;

import com.consullo.cup.core.Bounds;
import com.consullo.cup.core.Envelope;
import com.consullo.cup.core.Node;
import com.consullo.cup.core.Platform;
import com.consullo.cup.core.Scope;
import com.consullo.cup.core.ScreenInfo;
import com.consullo.cup.core.Trees;
import com.consullo.cup.core.taxonomy.Action;
import com.consullo.cup.core.taxonomy.Role;
import com.consullo.cup.core.taxonomy.State;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for detail-level pruning.
 *
 * @since 1.0
 */
public class PruningEngineTest {

  private final PruningEngine engine = new PruningEngine(new DefaultPruningPolicy());

  @Test
  @DisplayName("Should drop a decorative image and keep window > document > button")
  void prune_Standard_DropsDecorativeImage() {
    Node button = node("e2", Role.BUTTON, "Back", new Bounds(10, 10, 20, 20)).action(Action.CLICK).build();
    Node image = node("e3", Role.IMG, null, new Bounds(40, 40, 20, 20)).build();
    Node document = node("e1", Role.DOCUMENT, null, new Bounds(0, 0, 800, 600)).child(button).child(image).build();
    Node window = node("e0", Role.WINDOW, null, new Bounds(0, 0, 800, 600)).child(document).build();

    PruneResult result = engine.prune(envelope(window), DetailLevel.STANDARD);

    Node root = result.envelope().tree().get(0);
    assertThat(root.id()).isEqualTo("e0");
    assertThat(root.children()).extracting(Node::id).containsExactly("e1");
    assertThat(root.children().get(0).children()).extracting(Node::id).containsExactly("e2");
    assertThat(result.counts()).isEqualTo(new PruneCounts(4, 3));
    assertThat(result.detail()).isEqualTo(DetailLevel.STANDARD);
  }

  @Test
  @DisplayName("Should return the canonical tree unchanged at full detail")
  void prune_Full_IsIdentity() {
    Node image = node("e1", Role.IMG, null, new Bounds(40, 40, 20, 20)).build();
    Node window = node("e0", Role.WINDOW, null, new Bounds(0, 0, 800, 600)).child(image).build();
    Envelope env = envelope(window);

    PruneResult result = engine.prune(env, DetailLevel.FULL);

    assertThat(result.envelope()).isSameAs(env);
    assertThat(result.counts()).isEqualTo(new PruneCounts(2, 2));
  }

  @Test
  @DisplayName("Should keep minimal within standard within full")
  void prune_Levels_AreMonotonic() {
    Envelope env = envelope(sampleWindow());

    List<String> full = Trees.ids(engine.prune(env, DetailLevel.FULL).envelope().tree());
    List<String> standard = Trees.ids(engine.prune(env, DetailLevel.STANDARD).envelope().tree());
    List<String> compact = Trees.ids(engine.prune(env, DetailLevel.COMPACT).envelope().tree());
    List<String> minimal = Trees.ids(engine.prune(env, DetailLevel.MINIMAL).envelope().tree());

    assertThat(full).containsAll(standard);
    assertThat(standard).containsAll(minimal);
    assertThat(compact).isEqualTo(standard);
    assertThat(minimal.size()).isLessThan(standard.size());
    assertThat(standard.size()).isLessThan(full.size());
  }

  @Test
  @DisplayName("Should keep surviving ids in canonical relative order")
  void prune_Standard_PreservesOrder() {
    List<String> standard = Trees.ids(engine.prune(envelope(sampleWindow()), DetailLevel.STANDARD).envelope().tree());

    assertThat(standard).containsExactly("e0", "e1", "e2", "e5", "e6", "e9");
  }

  @Test
  @DisplayName("Should always keep roots, even empty unnamed ones")
  void prune_Roots_AlwaysSurvive() {
    Node emptyRoot = node("e0", Role.GENERIC, null, Bounds.ZERO).build();
    Node other = node("e1", Role.GROUP, null, new Bounds(0, 0, 10, 10)).build();
    Envelope env = envelope(List.of(emptyRoot, other), new ScreenInfo(0, 0, 1.0));

    for (DetailLevel level : DetailLevel.values()) {
      assertThat(Trees.ids(engine.prune(env, level).envelope().tree())).containsExactly("e0", "e1");
    }
  }

  @Test
  @DisplayName("Should clip children that fall outside a scrollable container")
  void prune_ScrollableContainer_ClipsOutsideChildren() {
    Node visible = node("e2", Role.LISTITEM, "Visible", new Bounds(0, 120, 200, 20)).action(Action.CLICK).build();
    Node hidden = node("e3", Role.LISTITEM, "Below", new Bounds(0, 400, 200, 20)).action(Action.CLICK).build();
    Node list = node("e1", Role.LIST, "Items", new Bounds(0, 100, 200, 100))
        .action(Action.SCROLL).child(visible).child(hidden).build();
    Node window = node("e0", Role.WINDOW, "Win", new Bounds(0, 0, 800, 600)).child(list).build();

    List<String> ids = Trees.ids(engine.prune(envelope(window), DetailLevel.STANDARD).envelope().tree());

    assertThat(ids).containsExactly("e0", "e1", "e2");
  }

  @Test
  @DisplayName("Should count clipped items by scroll direction on the scrollable container")
  void prune_ScrollableContainer_CountsHiddenItems() {
    List<Node> items = new ArrayList<>();
    items.add(node("e2", Role.LISTITEM, "Item 2", new Bounds(0, 20, 200, 30)).action(Action.CLICK).build());
    items.addAll(scrolledItems(3, 6));
    Node list = node("e1", Role.LIST, null, new Bounds(0, 100, 200, 100)).action(Action.SCROLL)
        .children(items).build();
    Node window = node("e0", Role.WINDOW, "Win", new Bounds(0, 0, 400, 400)).child(list).build();

    PruneResult result = engine.prune(envelope(window), DetailLevel.STANDARD);

    assertThat(Trees.ids(result.envelope().tree())).containsExactly("e0", "e1", "e3", "e4", "e5");
    assertThat(result.clipped()).containsOnlyKeys("e1");
    assertThat(result.clippedFor("e1")).isEqualTo(new ClippedCounts(1, 3, 0, 0));
    assertThat(result.clippedFor("e1").directions()).containsExactly("up", "down");
    assertThat(result.clippedFor("e0")).isEqualTo(ClippedCounts.NONE);
  }

  @Test
  @DisplayName("Should move hidden counts of a collapsed wrapper to the surviving container")
  void prune_CollapsedWrapper_HandsHiddenCountsUp() {
    Node shown = node("e3", Role.LISTITEM, "Shown", new Bounds(0, 110, 200, 20)).action(Action.CLICK).build();
    Node label = node("e5", Role.TEXT, "Later", new Bounds(0, 250, 200, 20)).build();
    Node later = node("e4", Role.LISTITEM, "Later", new Bounds(0, 250, 200, 20)).action(Action.CLICK)
        .child(label).build();
    Node wrapper = node("e2", Role.GENERIC, null, new Bounds(0, 100, 200, 300)).child(shown).child(later).build();
    Node list = node("e1", Role.LIST, "Results", new Bounds(0, 100, 200, 100)).action(Action.SCROLL)
        .child(wrapper).build();
    Node window = node("e0", Role.WINDOW, "Win", new Bounds(0, 0, 400, 400)).child(list).build();

    PruneResult result = engine.prune(envelope(window), DetailLevel.STANDARD);

    assertThat(Trees.ids(result.envelope().tree())).containsExactly("e0", "e1", "e3");
    assertThat(result.clipped()).containsOnlyKeys("e1");
    assertThat(result.clippedFor("e1")).isEqualTo(new ClippedCounts(0, 2, 0, 0));
  }

  @Test
  @DisplayName("Should keep hidden counts only for containers that survive minimal pruning")
  void prune_Minimal_KeepsCountsOfSurvivors() {
    Node list = node("e1", Role.LIST, "Results", new Bounds(0, 100, 200, 100)).action(Action.SCROLL)
        .children(scrolledItems(2, 5)).build();
    Node notes = node("e7", Role.GROUP, "Notes", new Bounds(200, 100, 200, 40))
        .child(node("e8", Role.BUTTON, "Archived", new Bounds(200, 500, 200, 20)).action(Action.CLICK).build())
        .build();
    Node window = node("e0", Role.WINDOW, "Win", new Bounds(0, 0, 400, 400)).child(list).child(notes).build();

    PruneResult standard = engine.prune(envelope(window), DetailLevel.STANDARD);
    PruneResult minimal = engine.prune(envelope(window), DetailLevel.MINIMAL);

    assertThat(standard.clipped()).containsOnlyKeys("e1", "e7");
    assertThat(minimal.clipped()).containsOnlyKeys("e1");
    assertThat(minimal.clippedFor("e1")).isEqualTo(new ClippedCounts(0, 2, 0, 0));
    assertThat(Trees.ids(minimal.envelope().tree())).doesNotContain("e7");
  }

  @Test
  @DisplayName("Should not clip always-kept roles and should use the screen when the root has no area")
  void prune_AlwaysKeptAndScreenClip() {
    Node offDoc = node("e1", Role.DOCUMENT, "Elsewhere", new Bounds(5000, 5000, 100, 100)).build();
    Node offButton = node("e2", Role.BUTTON, "Far", new Bounds(3000, 3000, 10, 10)).action(Action.CLICK).build();
    Node onButton = node("e3", Role.BUTTON, "Near", new Bounds(10, 10, 10, 10)).action(Action.CLICK).build();
    Node root = node("e0", Role.APPLICATION, "App", Bounds.ZERO).child(offDoc).child(offButton).child(onButton).build();

    List<String> ids = Trees.ids(engine.prune(envelope(root), DetailLevel.STANDARD).envelope().tree());

    assertThat(ids).containsExactly("e0", "e1", "e3");
  }

  @Test
  @DisplayName("Should collapse chains of unnamed wrappers into their single descendant")
  void prune_WrapperChain_Collapses() {
    Node button = node("e3", Role.BUTTON, "Go", new Bounds(10, 10, 20, 20)).action(Action.CLICK).build();
    Node group = node("e2", Role.GROUP, null, new Bounds(0, 0, 100, 100)).child(button).build();
    Node generic = node("e1", Role.GENERIC, null, new Bounds(0, 0, 100, 100)).child(group).build();
    Node window = node("e0", Role.WINDOW, "Win", new Bounds(0, 0, 800, 600)).child(generic).build();

    Node root = engine.prune(envelope(window), DetailLevel.STANDARD).envelope().tree().get(0);

    assertThat(root.children()).extracting(Node::id).containsExactly("e3");
  }

  @Test
  @DisplayName("Should not collapse named wrappers or wrappers with several children")
  void prune_NamedOrBranchingWrapper_IsKept() {
    Node a = node("e2", Role.BUTTON, "A", new Bounds(0, 0, 10, 10)).action(Action.CLICK).build();
    Node b = node("e3", Role.BUTTON, "B", new Bounds(20, 0, 10, 10)).action(Action.CLICK).build();
    Node branching = node("e1", Role.GROUP, null, new Bounds(0, 0, 100, 100)).child(a).child(b).build();
    Node c = node("e5", Role.BUTTON, "C", new Bounds(0, 50, 10, 10)).action(Action.CLICK).build();
    Node named = node("e4", Role.REGION, "Toolbar area", new Bounds(0, 50, 100, 50)).child(c).build();
    Node window = node("e0", Role.WINDOW, "Win", new Bounds(0, 0, 800, 600)).child(branching).child(named).build();

    List<String> ids = Trees.ids(engine.prune(envelope(window), DetailLevel.STANDARD).envelope().tree());

    assertThat(ids).containsExactly("e0", "e1", "e2", "e3", "e4", "e5");
  }

  @Test
  @DisplayName("Should drop offscreen non-actionable nodes, chrome and redundant labels")
  void prune_NoiseRules() {
    Node offscreenText = node("e1", Role.TEXT, "Hidden", new Bounds(0, 0, 10, 10)).state(State.OFFSCREEN).build();
    Node offscreenLink = node("e2", Role.LINK, "More", new Bounds(0, 20, 10, 10))
        .state(State.OFFSCREEN).action(Action.CLICK).build();
    Node scrollbar = node("e3", Role.SCROLLBAR, "V", new Bounds(0, 40, 10, 10)).action(Action.SCROLL).build();
    Node label = node("e5", Role.TEXT, "Submit", new Bounds(0, 60, 10, 10)).build();
    Node submit = node("e4", Role.BUTTON, "Submit", new Bounds(0, 60, 10, 10)).action(Action.CLICK).child(label).build();
    Node blank = node("e6", Role.TEXT, null, new Bounds(0, 80, 10, 10)).build();
    Node busy = node("e7", Role.GENERIC, null, new Bounds(0, 100, 10, 10)).state(State.BUSY).build();
    Node window = node("e0", Role.WINDOW, "Win", new Bounds(0, 0, 800, 600))
        .child(offscreenText).child(offscreenLink).child(scrollbar).child(submit).child(blank).child(busy).build();

    List<String> ids = Trees.ids(engine.prune(envelope(window), DetailLevel.STANDARD).envelope().tree());

    assertThat(ids).containsExactly("e0", "e2", "e4", "e7");
  }

  @Test
  @DisplayName("Should keep only interactive nodes and their ancestors at minimal detail")
  void prune_Minimal_KeepsInteractivePaths() {
    PruneResult result = engine.prune(envelope(sampleWindow()), DetailLevel.MINIMAL);

    assertThat(Trees.ids(result.envelope().tree())).containsExactly("e0", "e1", "e2", "e5");
    assertThat(result.counts()).isEqualTo(new PruneCounts(10, 4));
  }

  /**
   * e0 window
   *   e1 toolbar "Tools"
   *     e2 button "Save" [click]
   *     e3 separator
   *   e4 generic
   *     e5 link "Help" [click]
   *   e6 heading "Title"
   *   e7 img (decorative)
   *   e8 generic (empty)
   *   e9 text "Footer"
   */
  private static Node sampleWindow() {
    Node save = node("e2", Role.BUTTON, "Save", new Bounds(10, 10, 40, 20)).action(Action.CLICK).build();
    Node sep = node("e3", Role.SEPARATOR, null, new Bounds(60, 10, 2, 20)).build();
    Node toolbar = node("e1", Role.TOOLBAR, "Tools", new Bounds(0, 0, 800, 40)).child(save).child(sep).build();
    Node help = node("e5", Role.LINK, "Help", new Bounds(10, 50, 40, 20)).action(Action.CLICK).build();
    Node wrapper = node("e4", Role.GENERIC, null, new Bounds(0, 40, 800, 40)).child(help).build();
    Node heading = node("e6", Role.HEADING, "Title", new Bounds(10, 100, 200, 30)).build();
    Node img = node("e7", Role.IMG, null, new Bounds(10, 140, 20, 20)).build();
    Node empty = node("e8", Role.GENERIC, null, new Bounds(10, 170, 20, 20)).build();
    Node footer = node("e9", Role.TEXT, "Footer", new Bounds(0, 570, 800, 30)).build();
    return node("e0", Role.WINDOW, "Main", new Bounds(0, 0, 800, 600))
        .child(toolbar).child(wrapper).child(heading).child(img).child(empty).child(footer).build();
  }

  /**
   * {@code count} clickable list items with ids from {@code e<first>}, 30px tall and 40px apart from y=100.
   */
  private static List<Node> scrolledItems(int first, int count) {
    List<Node> items = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      items.add(node("e" + (first + i), Role.LISTITEM, "Item " + (first + i), new Bounds(0, 100 + 40 * i, 200, 30))
          .action(Action.CLICK).build());
    }
    return items;
  }

  private static Node.Builder node(String id, Role role, String name, Bounds bounds) {
    return Node.builder().id(id).role(role).name(name).bounds(bounds);
  }

  private static Envelope envelope(Node root) {
    return envelope(List.of(root), new ScreenInfo(1920, 1080, 1.0));
  }

  private static Envelope envelope(List<Node> roots, ScreenInfo screen) {
    return new Envelope("0.1.0", Platform.WEB, Instant.EPOCH, screen, Scope.FOREGROUND, null, roots, List.of());
  }
}
