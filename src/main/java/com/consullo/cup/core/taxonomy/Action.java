package com.consullo.cup.core.taxonomy;

import java.util.HashMap;
import java.util.Map;

/**
 * Canonical actions an element can support.
 *
 * @since 1.0
 */
public enum Action {
  CLICK("click", "clk"),
  COLLAPSE("collapse", "col"),
  DECREMENT("decrement", "dec"),
  DISMISS("dismiss", "dsm"),
  DOUBLECLICK("doubleclick", "dbl"),
  EXPAND("expand", "exp"),
  FOCUS("focus", "foc"),
  INCREMENT("increment", "inc"),
  LONGPRESS("longpress", "lp"),
  RIGHTCLICK("rightclick", "rclk"),
  SCROLL("scroll", "scr"),
  SELECT("select", "sel"),
  SETVALUE("setvalue", "sv"),
  TOGGLE("toggle", "tog"),
  TYPE("type", "typ");

  private static final Map<String, Action> BY_WIRE_NAME = new HashMap<>();

  static {
    for (Action a : values()) {
      BY_WIRE_NAME.put(a.wireName, a);
    }
  }

  private final String wireName;
  private final String code;

  Action(String wireName, String code) {
    this.wireName = wireName;
    this.code = code;
  }

  public String wireName() {
    return wireName;
  }

  public String code() {
    return code;
  }

  /**
   * Returns true for actions that make an element interactive. Focus alone does not.
   *
   * @return true unless this is {@link #FOCUS}
   */
  public boolean isActionable() {
    return this != FOCUS;
  }

  public static Action fromWireName(String wireName) {
    if (wireName == null) {
      return null;
    }
    return BY_WIRE_NAME.get(wireName);
  }
}
