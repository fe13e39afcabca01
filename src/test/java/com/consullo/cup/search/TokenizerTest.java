package com.consullo.cup.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class TokenizerTest {

  @Test
  @DisplayName("Should lowercase, strip accents and split on non-alphanumerics")
  void tokenize_Basic() {
    assertThat(Tokenizer.tokenize("Résumé: Save-As (v2)")).containsExactly("resume", "save", "as", "v2");
    assertThat(Tokenizer.tokenize("  ")).isEmpty();
    assertThat(Tokenizer.tokenize(null)).isEmpty();
  }
}
