package com.consullo.cup.search;

import com.consullo.cup.core.taxonomy.Role;
import com.consullo.cup.core.taxonomy.RoleSynonyms;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Decomposes freeform queries such as "the play button" into a role hint ("button") and name tokens
 * ("play").
 *
 * <p>The longest run of up to three adjacent tokens found in {@link RoleSynonyms} wins; among runs of equal
 * length the leftmost wins.
 *
 * @since 1.0
 */
public final class QueryParser {

  private static final int MAX_PHRASE_TOKENS = 3;

  private static final Set<String> NOISE_WORDS = Set.of(
      "the", "a", "an", "this", "that", "for", "in", "on", "of", "with",
      "to", "and", "or", "is", "it", "its", "my", "your");

  public ParsedQuery parse(String query) {
    List<String> tokens = Tokenizer.tokenize(query);
    if (tokens.isEmpty()) {
      return new ParsedQuery(null, null, List.of());
    }

    String phrase = null;
    int spanStart = 0;
    int spanEnd = 0;
    for (int length = Math.min(tokens.size(), MAX_PHRASE_TOKENS); length > 0 && phrase == null; length--) {
      for (int start = 0; start + length <= tokens.size(); start++) {
        String candidate = String.join(" ", tokens.subList(start, start + length));
        if (RoleSynonyms.contains(candidate)) {
          phrase = candidate;
          spanStart = start;
          spanEnd = start + length;
          break;
        }
      }
    }

    List<String> residual = new ArrayList<>();
    for (int i = 0; i < tokens.size(); i++) {
      if (i >= spanStart && i < spanEnd) {
        continue;
      }
      String t = tokens.get(i);
      if (!NOISE_WORDS.contains(t)) {
        residual.add(t);
      }
    }
    Set<Role> hint = phrase == null ? null : RoleSynonyms.lookup(phrase);
    return new ParsedQuery(phrase, hint, residual);
  }
}
