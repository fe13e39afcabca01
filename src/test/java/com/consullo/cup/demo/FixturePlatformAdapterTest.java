package com.consullo.cup.demo;

import com.consullo.cup.core.Platform;
import com.consullo.cup.core.RawElement;
import com.consullo.cup.core.WindowInfo;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the fixture-backed platform adapter.
 *
 * @since 1.0
 */
public class FixturePlatformAdapterTest {

  private FixturePlatformAdapter adapter;

  @BeforeEach
  void setUp() throws Exception {
    adapter = FixturePlatformAdapter.fromResource(CaptureDemo.DEFAULT_FIXTURE);
    adapter.initialize();
  }

  @Test
  @DisplayName("Should read platform, screen and windows from the fixture")
  void initialize_DemoFixture_ReadsMetadata() throws Exception {
    assertThat(adapter.platform()).isEqualTo(Platform.WINDOWS);
    assertThat(adapter.screenInfo().w()).isEqualTo(1920);
    assertThat(adapter.screenInfo().h()).isEqualTo(1080);
    assertThat(adapter.windowList()).extracting(WindowInfo::title).containsExactly("Settings - Browser", "Notes");
    assertThat(adapter.foregroundWindow().pid()).isEqualTo(4242);
    assertThat(adapter.foregroundWindow().url()).isEqualTo("https://example.test/settings");
    assertThat(adapter.desktopWindow().title()).isEqualTo("Desktop");
  }

  @Test
  @DisplayName("Should return the recorded tree of each requested window")
  void captureTree_KnownWindow_ReturnsRecordedRoot() throws Exception {
    WindowInfo notes = adapter.windowList().get(1);

    List<RawElement> roots = adapter.captureTree(List.of(notes), 999);

    assertThat(roots).hasSize(1);
    assertThat(roots.get(0).children()).isNotEmpty();
  }

  @Test
  @DisplayName("Should skip windows without a recorded tree")
  void captureTree_UnknownWindow_Skipped() throws Exception {
    WindowInfo ghost = WindowInfo.of("Ghost", null, false, null);

    assertThat(adapter.captureTree(List.of(ghost), 999)).isEmpty();
  }

  @Test
  @DisplayName("Should keep a separate tree for each window even when titles repeat")
  void captureTree_DuplicateTitles_KeepsBothTrees() throws Exception {
    FixturePlatformAdapter twins = FixturePlatformAdapter.fromResource("/fixtures/duplicate-titles.json");
    twins.initialize();
    List<WindowInfo> windows = twins.windowList();

    assertThat(windows).extracting(WindowInfo::title).containsExactly("Terminal", "Terminal");
    assertThat(windows).extracting(WindowInfo::handle).containsExactly(0, 1);
    assertThat(twins.captureTree(List.of(windows.get(0)), 999).get(0).children())
        .extracting(RawElement::name).containsExactly("Left tab");
    assertThat(twins.captureTree(List.of(windows.get(1)), 999).get(0).children())
        .extracting(RawElement::name).containsExactly("Right tab");
    assertThat(twins.captureTree(windows, 999)).hasSize(2);
    assertThat(twins.desktopWindow()).isNull();
  }

  @Test
  @DisplayName("Should report a missing fixture resource")
  void fromResource_Missing_Throws() {
    assertThatThrownBy(() -> FixturePlatformAdapter.fromResource("/fixtures/nope.json"))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("/fixtures/nope.json");
  }
}
