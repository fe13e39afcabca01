package com.consullo.cup.search;

import com.consullo.cup.core.taxonomy.Role;
import java.util.List;
import java.util.Set;

/**
 * A freeform query split into a role hint and residual name tokens.
 *
 * @param rolePhrase the phrase recognized as a role synonym, or null
 * @param roleHint roles named by {@link #rolePhrase}, or null
 * @param nameTokens remaining tokens with noise words removed
 * @since 1.0
 */
public record ParsedQuery(String rolePhrase, Set<Role> roleHint, List<String> nameTokens) {

  public ParsedQuery {
    nameTokens = nameTokens == null ? List.of() : List.copyOf(nameTokens);
  }
}
