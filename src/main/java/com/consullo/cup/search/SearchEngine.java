package com.consullo.cup.search;

import com.consullo.cup.core.Envelope;
import com.consullo.cup.core.Node;
import com.consullo.cup.core.taxonomy.Role;
import com.consullo.cup.core.taxonomy.RoleSynonyms;
import com.consullo.cup.core.taxonomy.State;
import com.consullo.cup.core.taxonomy.Vocabulary;
import com.consullo.cup.search.SearchPreconditionException.Precondition;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ranks the nodes of a capture against a {@link SearchQuery}.
 *
 * <p>
 * Scoring:
 * <ul>
 * <li>Role match weighs {@value #ROLE_WEIGHT}, name match {@value #NAME_WEIGHT}, state match
 * {@value #STATE_WEIGHT}.</li>
 * <li>Explicit role, state and name filters exclude non-matching candidates. A role implied by the freeform
 * query only adds score.</li>
 * <li>The name score also draws on the value, placeholder and description, so unlabeled inputs can be found by
 * their hint text.</li>
 * <li>Candidates with a positive combined score are returned. Context bonuses only reorder them: an ancestor
 * whose name shares a query word, an ancestor with a targeted role, being actionable, not being offscreen, and
 * having focus.</li>
 * <li>Ties are broken by pre-order position, so results are deterministic.</li>
 * </ul>
 * </p>
 */
public final class SearchEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(SearchEngine.class);

  public static final double ROLE_WEIGHT = 0.45;
  public static final double NAME_WEIGHT = 0.35;
  public static final double STATE_WEIGHT = 0.10;
  static final double ACTIONABLE_BONUS = 0.05;
  static final double FOCUSED_BONUS = 0.02;
  static final double VISIBLE_BONUS = 0.05;
  static final double ANCESTOR_NAME_BONUS = 0.1;
  static final double ANCESTOR_ROLE_BONUS = 0.1;

  private static final String PLACEHOLDER_KEY = "placeholder";
  private static final String DESCRIPTION_KEY = "description";

  private static final Comparator<SearchHit> RANKING = Comparator
      .comparingDouble(SearchHit::score).reversed()
      .thenComparingInt(SearchHit::index);

  private final QueryParser parser;
  private final NameMatcher matcher;

  public SearchEngine() {
    this(new QueryParser(), new NameMatcher());
  }

  public SearchEngine(QueryParser parser, NameMatcher matcher) {
    if (parser == null || matcher == null) {
      throw new IllegalArgumentException("parser/matcher must not be null.");
    }
    this.parser = parser;
    this.matcher = matcher;
  }

  /**
   * Returns the best matching nodes, children removed.
   *
   * @param capture last pruned capture (null when nothing was captured yet)
   * @param query search request
   * @return up to {@code query.limit()} nodes, best first
   * @throws SearchPreconditionException if the request cannot be evaluated
   */
  public List<Node> find(Envelope capture, SearchQuery query) {
    List<SearchHit> hits = rank(capture, query);
    List<Node> out = new ArrayList<>(hits.size());
    for (SearchHit h : hits) {
      out.add(h.node());
    }
    return out;
  }

  /**
   * Returns scored hits, children removed.
   *
   * @param capture last pruned capture (null when nothing was captured yet)
   * @param query search request
   * @return up to {@code query.limit()} hits, best first
   * @throws SearchPreconditionException if the request cannot be evaluated
   */
  public List<SearchHit> rank(Envelope capture, SearchQuery query) {
    if (query == null) {
      throw new IllegalArgumentException("query must not be null.");
    }
    if (capture == null) {
      throw new SearchPreconditionException(Precondition.NO_PRIOR_CAPTURE,
          "No capture available; take a capture before searching.");
    }
    if (query.limit() <= 0) {
      throw new SearchPreconditionException(Precondition.INVALID_LIMIT,
          "limit must be positive: " + query.limit());
    }
    if (StringUtils.isAllBlank(query.query(), query.role(), query.name(), query.state())) {
      throw new SearchPreconditionException(Precondition.EMPTY_QUERY,
          "At least one of query, role, name or state must be given.");
    }

    Set<Role> roleFilter = null;
    if (StringUtils.isNotBlank(query.role())) {
      roleFilter = RoleSynonyms.resolve(query.role());
      if (roleFilter == null) {
        throw new SearchPreconditionException(Precondition.UNSUPPORTED_FILTER,
            "Unknown role filter: " + query.role());
      }
    }
    State stateFilter = null;
    if (StringUtils.isNotBlank(query.state())) {
      stateFilter = State.fromWireName(Vocabulary.normalize(query.state()));
      if (stateFilter == null) {
        throw new SearchPreconditionException(Precondition.UNSUPPORTED_FILTER,
            "Unknown state filter: " + query.state());
      }
    }

    ParsedQuery parsed = parser.parse(query.query());
    boolean explicitName = StringUtils.isNotBlank(query.name());
    List<String> nameTokens = explicitName ? Tokenizer.tokenize(query.name()) : parsed.nameTokens();
    Set<Role> roleHint = parsed.roleHint();

    Set<Role> targetRoles = roleFilter != null ? roleFilter : roleHint;
    Set<String> queryTokenSet = new HashSet<>(nameTokens);

    int visited = 0;
    List<SearchHit> hits = new ArrayList<>();
    Deque<Visit> stack = new ArrayDeque<>();
    List<Node> roots = capture.tree();
    for (int r = roots.size() - 1; r >= 0; r--) {
      stack.push(new Visit(roots.get(r), false, false));
    }
    while (!stack.isEmpty()) {
      Visit v = stack.pop();
      Node n = v.node;
      int index = visited++;

      List<Node> children = n.children();
      if (!children.isEmpty()) {
        boolean nameBelow = v.ancestorNameMatch || sharesToken(n.name(), queryTokenSet);
        boolean roleBelow = v.ancestorRoleMatch || (targetRoles != null && targetRoles.contains(n.role()));
        for (int c = children.size() - 1; c >= 0; c--) {
          stack.push(new Visit(children.get(c), nameBelow, roleBelow));
        }
      }

      if (roleFilter != null && !roleFilter.contains(n.role())) {
        continue;
      }
      if (stateFilter != null && !n.states().contains(stateFilter)) {
        continue;
      }
      double nameScore = nameTokens.isEmpty() ? 0.0 : matcher.score(nameTokens, n.name(), secondaryText(n));
      if (explicitName && nameScore <= 0.0) {
        continue;
      }

      double roleScore = 0.0;
      if (roleFilter != null || (roleHint != null && roleHint.contains(n.role()))) {
        roleScore = 1.0;
      }
      double stateScore = stateFilter != null ? 1.0 : 0.0;
      double score = ROLE_WEIGHT * roleScore + NAME_WEIGHT * nameScore + STATE_WEIGHT * stateScore;
      if (score <= 0.0) {
        continue;
      }
      if (v.ancestorNameMatch) {
        score += ANCESTOR_NAME_BONUS;
      }
      if (v.ancestorRoleMatch) {
        score += ANCESTOR_ROLE_BONUS;
      }
      if (n.isActionable()) {
        score += ACTIONABLE_BONUS;
      }
      if (!n.states().contains(State.OFFSCREEN)) {
        score += VISIBLE_BONUS;
      }
      if (n.states().contains(State.FOCUSED)) {
        score += FOCUSED_BONUS;
      }
      hits.add(new SearchHit(n.withoutChildren(), score, index));
    }

    hits.sort(RANKING);
    List<SearchHit> out = hits.size() > query.limit() ? new ArrayList<>(hits.subList(0, query.limit())) : hits;
    LOGGER.debug("rank: {} candidates, {} matched, returning {}", visited, hits.size(), out.size());
    return out;
  }

  private static List<String> secondaryText(Node n) {
    List<String> fields = new ArrayList<>(3);
    if (n.value() != null) {
      fields.add(String.valueOf(n.value()));
    }
    Object placeholder = n.platformExtra().get(PLACEHOLDER_KEY);
    if (placeholder != null) {
      fields.add(String.valueOf(placeholder));
    }
    Object description = n.platformExtra().get(DESCRIPTION_KEY);
    if (description != null) {
      fields.add(String.valueOf(description));
    }
    return fields;
  }

  private static boolean sharesToken(String name, Set<String> queryTokens) {
    if (queryTokens.isEmpty() || StringUtils.isEmpty(name)) {
      return false;
    }
    for (String t : Tokenizer.tokenize(name)) {
      if (queryTokens.contains(t)) {
        return true;
      }
    }
    return false;
  }

  private static final class Visit {
    final Node node;
    final boolean ancestorNameMatch;
    final boolean ancestorRoleMatch;

    Visit(Node node, boolean ancestorNameMatch, boolean ancestorRoleMatch) {
      this.node = node;
      this.ancestorNameMatch = ancestorNameMatch;
      this.ancestorRoleMatch = ancestorRoleMatch;
    }
  }
}
