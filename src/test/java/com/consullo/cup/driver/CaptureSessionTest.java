package com.consullo.cup.driver;

import com.consullo.cup.capture.DetailLevel;
import com.consullo.cup.core.Bounds;
import com.consullo.cup.core.Node;
import com.consullo.cup.core.Platform;
import com.consullo.cup.core.PlatformAdapter;
import com.consullo.cup.core.RawElement;
import com.consullo.cup.core.Scope;
import com.consullo.cup.core.ScreenInfo;
import com.consullo.cup.core.WindowInfo;
import com.consullo.cup.search.SearchPreconditionException;
import com.consullo.cup.search.SearchQuery;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * Unit tests for the capture session using a mocked platform adapter.
 *
 * @since 1.0
 */
public class CaptureSessionTest {

  private static final WindowInfo EDITOR = WindowInfo.of("Editor - notes.txt", 10, true, new Bounds(0, 0, 800, 600));
  private static final WindowInfo TERMINAL = WindowInfo.of("Terminal", 11, false, new Bounds(0, 0, 800, 600));

  private PlatformAdapter adapter;
  private CaptureSession session;

  @BeforeEach
  void setUp() throws Exception {
    adapter = mock(PlatformAdapter.class);
    when(adapter.platform()).thenReturn(Platform.LINUX);
    when(adapter.screenInfo()).thenReturn(new ScreenInfo(1920, 1080, 1.0));
    when(adapter.foregroundWindow()).thenReturn(EDITOR);
    when(adapter.windowList()).thenReturn(List.of(EDITOR, TERMINAL));
    when(adapter.allWindows()).thenReturn(List.of(EDITOR, TERMINAL));
    when(adapter.captureTree(anyList(), anyInt())).thenAnswer(inv -> List.of(editorTree()));
    session = CaptureSession.create(adapter, CaptureSessionConfig.defaults(),
        Clock.fixed(Instant.EPOCH, ZoneOffset.UTC));
  }

  @Test
  @DisplayName("Should fail a search before any capture with the no-prior-capture precondition")
  void find_BeforeCapture_Fails() {
    assertThatThrownBy(() -> session.find(SearchQuery.builder().role("button").build()))
        .isInstanceOf(SearchPreconditionException.class)
        .extracting(e -> ((SearchPreconditionException) e).precondition())
        .isEqualTo(SearchPreconditionException.Precondition.NO_PRIOR_CAPTURE);
  }

  @Test
  @DisplayName("Should capture the foreground window with the window list and make it searchable")
  void capture_Foreground_ThenFind() throws Exception {
    CaptureResult result = session.capture(CaptureRequest.of(Scope.FOREGROUND));

    assertThat(result.canonical().scope()).isEqualTo(Scope.FOREGROUND);
    assertThat(result.canonical().app().name()).isEqualTo("Editor - notes.txt");
    assertThat(result.pruned().counts().before()).isEqualTo(4);
    assertThat(result.pruned().counts().after()).isEqualTo(2);
    assertThat(result.output())
        .startsWith("# CUP 0.1.0 | linux | 1920x1080\n# app: Editor - notes.txt\n# 2 nodes (4 before pruning)\n")
        .contains("#   Editor - notes.txt [fg]\n#   Terminal\n")
        .contains("\n  [e2] btn \"Save\" 10,10 40x20 [clk]");

    List<Node> found = session.find(SearchQuery.builder().query("save button").build());
    assertThat(found).extracting(Node::id).containsExactly("e2");
    verify(adapter).captureTree(List.of(EDITOR), 999);
  }

  @Test
  @DisplayName("Should initialize the adapter only once")
  void capture_Twice_InitializesOnce() throws Exception {
    session.capture(CaptureRequest.of(Scope.FOREGROUND));
    session.capture(CaptureRequest.of(Scope.FOREGROUND).withMaxDepth(3));

    verify(adapter, times(1)).initialize();
    verify(adapter).captureTree(List.of(EDITOR), 3);
  }

  @Test
  @DisplayName("Should list windows for an overview without walking trees or replacing the last capture")
  void capture_Overview_LeavesLastCapture() throws Exception {
    CaptureResult first = session.capture(CaptureRequest.of(Scope.FOREGROUND));
    reset(adapter);
    when(adapter.platform()).thenReturn(Platform.LINUX);
    when(adapter.screenInfo()).thenReturn(new ScreenInfo(1920, 1080, 1.0));
    when(adapter.windowList()).thenReturn(List.of(EDITOR, TERMINAL));

    CaptureResult overview = session.capture(CaptureRequest.of(Scope.OVERVIEW));

    assertThat(overview.output()).contains("# overview | 2 windows\n");
    assertThat(overview.canonical().tree()).isEmpty();
    assertThat(session.lastCapture()).isSameAs(first.pruned());
    verify(adapter, never()).captureTree(anyList(), anyInt());
  }

  @Test
  @DisplayName("Should fall back to an overview when the platform has no desktop")
  void capture_DesktopMissing_FallsBackToOverview() throws Exception {
    when(adapter.desktopWindow()).thenReturn(null);

    CaptureResult result = session.capture(CaptureRequest.of(Scope.DESKTOP));

    assertThat(result.canonical().scope()).isEqualTo(Scope.OVERVIEW);
    assertThat(result.output()).contains("# overview | 2 windows");
    assertThat(session.lastCapture()).isNull();
  }

  @Test
  @DisplayName("Should filter full captures by window title substring")
  void capture_FullWithFilter_CapturesMatchingWindows() throws Exception {
    CaptureResult result = session.capture(CaptureRequest.of(Scope.FULL).withAppFilter("TERM"));

    assertThat(result.canonical().scope()).isEqualTo(Scope.FULL);
    assertThat(result.canonical().app()).isNull();
    verify(adapter).captureTree(List.of(TERMINAL), 999);
    assertThatThrownBy(() -> session.capture(CaptureRequest.of(Scope.FULL).withAppFilter("browser")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("Should render JSON of the pruned envelope when compact output is off")
  void capture_Json_RendersPrunedEnvelope() throws Exception {
    CaptureResult result = session.capture(
        CaptureRequest.of(Scope.FOREGROUND).withCompact(false).withDetail(DetailLevel.FULL));

    JsonNode json = new ObjectMapper().readTree(result.output());
    assertThat(json.get("platform").asText()).isEqualTo("linux");
    assertThat(json.get("windows")).hasSize(2);
    assertThat(json.get("tree").get(0).get("children")).hasSize(2);
  }

  /**
   * frame "Editor" > [panel > push button "Save", icon].
   */
  private static RawElement editorTree() {
    RawElement save = RawElement.builder().role("push button").name("Save").bounds(10, 10, 40, 20)
        .actions("press").build();
    RawElement panel = RawElement.builder().role("panel").bounds(0, 0, 800, 100).child(save).build();
    RawElement icon = RawElement.builder().role("icon").bounds(700, 10, 16, 16).build();
    return RawElement.builder().role("frame").name("Editor").bounds(0, 0, 800, 600).child(panel).child(icon).build();
  }
}
