package com.consullo.cup.driver;

import com.consullo.cup.capture.DetailLevel;
import com.consullo.cup.core.Scope;
import com.consullo.cup.demo.FixturePlatformAdapter;
import com.consullo.cup.search.SearchHit;
import com.consullo.cup.search.SearchQuery;
import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Golden capture tests.
 *
 * <p>
 * The recorded demo window is replayed through a full session and the compact output is compared
 * byte for byte with the expected text fixtures.
 * </p>
 */
public final class GoldenCaptureTest {

  private static final Logger LOGGER = LoggerFactory.getLogger(GoldenCaptureTest.class);

  private CaptureSession session;

  @BeforeEach
  void setUp() throws Exception {
    session = CaptureSession.create(
        FixturePlatformAdapter.fromResource("/fixtures/demo-window.json"),
        CaptureSessionConfig.defaults(),
        Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC));
  }

  @Test
  public void foregroundStandardMatchesFixture() throws Exception {
    runFixture(CaptureRequest.of(Scope.FOREGROUND).withDetail(DetailLevel.STANDARD),
        "fixtures/demo-foreground-standard.txt");
  }

  @Test
  public void foregroundMinimalKeepsOnlyActionablePaths() throws Exception {
    runFixture(CaptureRequest.of(Scope.FOREGROUND).withDetail(DetailLevel.MINIMAL),
        "fixtures/demo-foreground-minimal.txt");
  }

  @Test
  public void overviewListsWindowsOnly() throws Exception {
    runFixture(CaptureRequest.of(Scope.OVERVIEW), "fixtures/demo-overview.txt");
  }

  @Test
  public void backButtonQueryRanksExactMatchFirst() throws Exception {
    session.capture(CaptureRequest.of(Scope.FOREGROUND).withDetail(DetailLevel.STANDARD));

    List<SearchHit> hits = session.rank(SearchQuery.builder().query("back button").build());

    assertThat(hits).extracting(h -> h.node().id()).startsWith("e4", "e14", "e5");
    assertThat(hits.get(0).score()).isGreaterThan(hits.get(1).score());
  }

  @Test
  public void desktopCaptureUsesRecordedDesktop() throws Exception {
    CaptureResult result = session.capture(CaptureRequest.of(Scope.DESKTOP).withDetail(DetailLevel.STANDARD));

    assertThat(result.canonical().scope()).isEqualTo(Scope.DESKTOP);
    assertThat(result.output()).contains("# app: Desktop\n").contains("\"Recycle Bin\"");
  }

  private void runFixture(CaptureRequest request, String expectedResource) throws Exception {
    LOGGER.info("runFixture: {}", expectedResource);
    String actual = session.capture(request).output();
    String expected = loadTextResource(expectedResource);

    LOGGER.info("runFixture: comparing actual ({} chars) vs expected ({} chars)", actual.length(), expected.length());
    assertThat(actual).isEqualTo(expected);
  }

  private static String loadTextResource(String path) throws Exception {
    InputStream is = GoldenCaptureTest.class.getClassLoader().getResourceAsStream(path);
    if (is == null) {
      throw new IllegalStateException("Missing resource: " + path);
    }
    return readAll(is);
  }

  private static String readAll(InputStream is) throws Exception {
    try (BufferedReader br = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
      StringBuilder sb = new StringBuilder();
      String line;
      while ((line = br.readLine()) != null) {
        sb.append(line);
        sb.append("\n");
      }
      return sb.toString();
    }
  }
}
