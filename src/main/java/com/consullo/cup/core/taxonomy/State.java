package com.consullo.cup.core.taxonomy;

import java.util.HashMap;
import java.util.Map;

/**
 * Canonical element states.
 *
 * @since 1.0
 */
public enum State {
  BUSY("busy", "bsy", true),
  CHECKED("checked", "chk", true),
  COLLAPSED("collapsed", "col", false),
  DISABLED("disabled", "dis", false),
  EDITABLE("editable", "edt", false),
  EXPANDED("expanded", "exp", true),
  FOCUSED("focused", "foc", true),
  HIDDEN("hidden", "hid", false),
  MIXED("mixed", "mix", true),
  MODAL("modal", "mod", true),
  MULTISELECTABLE("multiselectable", "msel", false),
  OFFSCREEN("offscreen", "off", false),
  PRESSED("pressed", "prs", true),
  READONLY("readonly", "ro", false),
  REQUIRED("required", "req", false),
  SELECTED("selected", "sel", true);

  private static final Map<String, State> BY_WIRE_NAME = new HashMap<>();

  static {
    for (State s : values()) {
      BY_WIRE_NAME.put(s.wireName, s);
    }
  }

  private final String wireName;
  private final String code;
  private final boolean notable;

  State(String wireName, String code, boolean notable) {
    this.wireName = wireName;
    this.code = code;
    this.notable = notable;
  }

  public String wireName() {
    return wireName;
  }

  public String code() {
    return code;
  }

  /**
   * Returns true if an element in this state is worth keeping even without a name or actions.
   *
   * @return true for notable states
   */
  public boolean isNotable() {
    return notable;
  }

  public static State fromWireName(String wireName) {
    if (wireName == null) {
      return null;
    }
    return BY_WIRE_NAME.get(wireName);
  }
}
