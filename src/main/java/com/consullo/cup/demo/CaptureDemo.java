package com.consullo.cup.demo;

import com.consullo.cup.capture.DetailLevel;
import com.consullo.cup.core.Scope;
import com.consullo.cup.driver.CaptureRequest;
import com.consullo.cup.driver.CaptureResult;
import com.consullo.cup.driver.CaptureSession;
import com.consullo.cup.driver.CaptureSessionFactory;
import com.consullo.cup.search.SearchHit;
import com.consullo.cup.search.SearchQuery;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimal demo that replays a recorded window, prints the compact capture and runs one search.
 *
 * <p>Usage: {@code CaptureDemo [fixture-resource] [query]}. Defaults to the bundled demo window and the query
 * "back button".
 *
 * @since 1.0
 */
public final class CaptureDemo {

  private static final Logger LOGGER = LoggerFactory.getLogger(CaptureDemo.class);

  static final String DEFAULT_FIXTURE = "/fixtures/demo-window.json";

  private CaptureDemo() {
  }

  /**
   * Demo entry point.
   *
   * @param args optional fixture resource and query
   * @throws Exception if demo fails
   */
  public static void main(final String[] args) throws Exception {
    final String fixture = args.length > 0 ? args[0] : DEFAULT_FIXTURE;
    final String query = args.length > 1 ? args[1] : "back button";

    final CaptureSession session = CaptureSessionFactory.createSession(FixturePlatformAdapter.fromResource(fixture));
    LOGGER.info("Replaying fixture {}", fixture);

    System.out.println(session.capture(CaptureRequest.of(Scope.OVERVIEW)).output());

    final CaptureResult result = session.capture(CaptureRequest.of(Scope.FOREGROUND).withDetail(DetailLevel.STANDARD));
    System.out.println(result.output());

    System.out.println("=== find(\"" + query + "\") ===");
    for (SearchHit hit : session.rank(SearchQuery.builder().query(query).build())) {
      System.out.println(String.format(Locale.ROOT, "%.3f  %s", hit.score(), hit.node()));
    }
    LOGGER.info("Demo completed");
  }
}
