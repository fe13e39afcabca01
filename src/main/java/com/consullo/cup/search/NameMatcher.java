package com.consullo.cup.search;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.apache.commons.text.similarity.LevenshteinDistance;

/**
 * Token-based fuzzy name scoring.
 *
 * <p>
 * For query tokens q and a candidate name, the score is
 * {@code 0.6 * wholeWord + 0.4 * substring + 0.2 * nearMiss}, each term being the fraction of query tokens in
 * that class, capped at 1. A token that matches as a whole word also counts as a substring. A near miss is a
 * token of three or more characters with neither hit that lies within edit distance 1 (tokens up to four
 * characters) or 2 (longer tokens) of some name token.
 * </p>
 * <p>
 * Secondary text (value, placeholder, description) only boosts: the best fraction of query tokens found as whole
 * words in any one secondary field adds {@value #SECONDARY_WEIGHT} times that fraction, again capped at 1.
 * </p>
 */
public final class NameMatcher {

  static final double WHOLE_WORD_WEIGHT = 0.6;
  static final double SUBSTRING_WEIGHT = 0.4;
  static final double NEAR_MISS_WEIGHT = 0.2;
  static final double SECONDARY_WEIGHT = 0.15;

  private static final LevenshteinDistance SHORT_TOKEN_DISTANCE = new LevenshteinDistance(1);
  private static final LevenshteinDistance LONG_TOKEN_DISTANCE = new LevenshteinDistance(2);

  /**
   * Scores a candidate name against query tokens.
   *
   * @param queryTokens tokenized name query
   * @param name candidate name (may be null)
   * @return score in [0, 1]; zero when either side is empty
   */
  public double score(List<String> queryTokens, String name) {
    if (queryTokens == null || queryTokens.isEmpty() || name == null || name.isEmpty()) {
      return 0.0;
    }
    List<String> nameTokenList = Tokenizer.tokenize(name);
    if (nameTokenList.isEmpty()) {
      return 0.0;
    }
    Set<String> nameTokens = new HashSet<>(nameTokenList);
    String normalizedName = String.join(" ", nameTokenList);

    int whole = 0;
    int substring = 0;
    int near = 0;
    for (String q : queryTokens) {
      if (nameTokens.contains(q)) {
        whole++;
        substring++;
      } else if (normalizedName.contains(q)) {
        substring++;
      } else if (isNearMiss(q, nameTokens)) {
        near++;
      }
    }
    double n = queryTokens.size();
    double score = WHOLE_WORD_WEIGHT * whole / n + SUBSTRING_WEIGHT * substring / n + NEAR_MISS_WEIGHT * near / n;
    return Math.min(1.0, score);
  }

  /**
   * Scores a candidate name plus its secondary text fields against query tokens.
   *
   * @param queryTokens tokenized name query
   * @param name candidate name (may be null)
   * @param secondaryFields value, placeholder, description and similar text (null entries are skipped)
   * @return score in [0, 1]; positive when either the name or a secondary field matches
   */
  public double score(List<String> queryTokens, String name, List<String> secondaryFields) {
    double primary = score(queryTokens, name);
    double secondary = secondaryScore(queryTokens, secondaryFields);
    return Math.min(1.0, primary + SECONDARY_WEIGHT * secondary);
  }

  static double secondaryScore(List<String> queryTokens, List<String> fields) {
    if (queryTokens == null || queryTokens.isEmpty() || fields == null) {
      return 0.0;
    }
    double best = 0.0;
    for (String field : fields) {
      if (field == null || field.isEmpty()) {
        continue;
      }
      Set<String> fieldTokens = new HashSet<>(Tokenizer.tokenize(field));
      if (fieldTokens.isEmpty()) {
        continue;
      }
      int matched = 0;
      for (String q : queryTokens) {
        if (fieldTokens.contains(q)) {
          matched++;
        }
      }
      best = Math.max(best, (double) matched / queryTokens.size());
    }
    return best;
  }

  private static boolean isNearMiss(String q, Set<String> nameTokens) {
    if (q.length() < 3) {
      return false;
    }
    LevenshteinDistance distance = q.length() <= 4 ? SHORT_TOKEN_DISTANCE : LONG_TOKEN_DISTANCE;
    for (String t : nameTokens) {
      if (distance.apply(q, t) >= 0) {
        return true;
      }
    }
    return false;
  }
}
