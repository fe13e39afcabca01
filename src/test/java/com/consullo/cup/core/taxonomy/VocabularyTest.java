package com.consullo.cup.core.taxonomy;

import com.consullo.cup.core.Platform;
import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class VocabularyTest {

  @Test
  @DisplayName("Should map native role names per platform ignoring case, dashes and spaces")
  void role_NativeNames_MapToCanonical() {
    assertThat(Vocabulary.role(Platform.WINDOWS, "Button")).isEqualTo(Role.BUTTON);
    assertThat(Vocabulary.role(Platform.WINDOWS, "Edit")).isEqualTo(Role.TEXTBOX);
    assertThat(Vocabulary.role(Platform.WINDOWS, "Pane")).isEqualTo(Role.GENERIC);
    assertThat(Vocabulary.role(Platform.WINDOWS, "check box")).isEqualTo(Role.CHECKBOX);
  }

  @Test
  @DisplayName("Should fall back to canonical wire names and abbreviations on any platform")
  void role_CanonicalNames_AcceptedEverywhere() {
    assertThat(Vocabulary.role(Platform.ANDROID, "button")).isEqualTo(Role.BUTTON);
    assertThat(Vocabulary.role(Platform.IOS, "btn")).isEqualTo(Role.BUTTON);
    assertThat(Vocabulary.role(Platform.WEB, "menuitemcheckbox")).isEqualTo(Role.MENUITEMCHECKBOX);
  }

  @Test
  @DisplayName("Should map unknown and missing roles to generic")
  void role_Unknown_IsGeneric() {
    assertThat(Vocabulary.role(Platform.WINDOWS, "FluxCapacitor")).isEqualTo(Role.GENERIC);
    assertThat(Vocabulary.role(Platform.WINDOWS, null)).isEqualTo(Role.GENERIC);
    assertThat(Vocabulary.role(Platform.WINDOWS, "  ")).isEqualTo(Role.GENERIC);
  }

  @Test
  @DisplayName("Should drop unknown state and action tokens")
  void stateAndAction_Unknown_ReturnNull() {
    assertThat(Vocabulary.state(Platform.WINDOWS, "HasKeyboardFocus")).isEqualTo(State.FOCUSED);
    assertThat(Vocabulary.state(Platform.WINDOWS, "shimmering")).isNull();
    assertThat(Vocabulary.action(Platform.WINDOWS, "Invoke")).isEqualTo(Action.CLICK);
    assertThat(Vocabulary.action(Platform.MACOS, "AXPress")).isEqualTo(Action.CLICK);
    assertThat(Vocabulary.action(Platform.WINDOWS, "teleport")).isNull();
  }

  @Test
  @DisplayName("Should give every enum value a distinct abbreviation")
  void codes_AreUniquePerEnum() {
    Set<String> roleCodes = new HashSet<>();
    for (Role r : Role.values()) {
      assertThat(roleCodes.add(r.code())).as("duplicate role code %s", r.code()).isTrue();
    }
    Set<String> stateCodes = new HashSet<>();
    for (State s : State.values()) {
      assertThat(stateCodes.add(s.code())).isTrue();
    }
    Set<String> actionCodes = new HashSet<>();
    for (Action a : Action.values()) {
      assertThat(actionCodes.add(a.code())).isTrue();
    }
    assertThat(Role.values()).hasSize(59);
    assertThat(State.values()).hasSize(16);
    assertThat(Action.values()).hasSize(15);
  }

  @Test
  @DisplayName("Should treat every action but focus as actionable")
  void isActionable_FocusOnlyExcluded() {
    for (Action a : Action.values()) {
      assertThat(a.isActionable()).isEqualTo(a != Action.FOCUS);
    }
    assertThat(State.FOCUSED.isNotable()).isTrue();
    assertThat(State.DISABLED.isNotable()).isFalse();
  }
}
