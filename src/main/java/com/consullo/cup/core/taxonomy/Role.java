package com.consullo.cup.core.taxonomy;

import java.util.HashMap;
import java.util.Map;

/**
 * Canonical, platform-independent role vocabulary.
 *
 * <p>Every role carries exactly one wire name (used in structured output and search) and exactly one
 * abbreviation (used in compact text). Unmapped native roles fall back to {@link #GENERIC}.
 *
 * @since 1.0
 */
public enum Role {
  ALERT("alert", "alrt"),
  ALERTDIALOG("alertdialog", "adlg"),
  APPLICATION("application", "app"),
  BANNER("banner", "bnr"),
  BUTTON("button", "btn"),
  CELL("cell", "cel"),
  CHECKBOX("checkbox", "chk"),
  COLUMNHEADER("columnheader", "colh"),
  COMBOBOX("combobox", "cmb"),
  COMPLEMENTARY("complementary", "cmp"),
  CONTENTINFO("contentinfo", "ci"),
  DIALOG("dialog", "dlg"),
  DOCUMENT("document", "doc"),
  FORM("form", "frm"),
  GENERIC("generic", "gen"),
  GRID("grid", "grd"),
  GROUP("group", "grp"),
  HEADING("heading", "hdg"),
  IMG("img", "img"),
  LINK("link", "lnk"),
  LIST("list", "lst"),
  LISTITEM("listitem", "li"),
  LOG("log", "log"),
  MAIN("main", "main"),
  MARQUEE("marquee", "mrq"),
  MENU("menu", "mnu"),
  MENUBAR("menubar", "mnub"),
  MENUITEM("menuitem", "mi"),
  MENUITEMCHECKBOX("menuitemcheckbox", "mic"),
  MENUITEMRADIO("menuitemradio", "mir"),
  NAVIGATION("navigation", "nav"),
  NONE("none", "none"),
  OPTION("option", "opt"),
  PROGRESSBAR("progressbar", "pbar"),
  RADIO("radio", "rad"),
  REGION("region", "rgn"),
  ROW("row", "row"),
  ROWHEADER("rowheader", "rowh"),
  SCROLLBAR("scrollbar", "sb"),
  SEARCH("search", "srch"),
  SEARCHBOX("searchbox", "sbx"),
  SEPARATOR("separator", "sep"),
  SLIDER("slider", "sld"),
  SPINBUTTON("spinbutton", "spn"),
  STATUS("status", "sts"),
  SWITCH("switch", "sw"),
  TAB("tab", "tab"),
  TABLE("table", "tbl"),
  TABLIST("tablist", "tabs"),
  TABPANEL("tabpanel", "tpnl"),
  TEXT("text", "txt"),
  TEXTBOX("textbox", "tbx"),
  TIMER("timer", "tmr"),
  TITLEBAR("titlebar", "ttlb"),
  TOOLBAR("toolbar", "tlbr"),
  TOOLTIP("tooltip", "ttp"),
  TREE("tree", "tre"),
  TREEITEM("treeitem", "ti"),
  WINDOW("window", "win");

  private static final Map<String, Role> BY_WIRE_NAME = new HashMap<>();

  static {
    for (Role r : values()) {
      BY_WIRE_NAME.put(r.wireName, r);
    }
  }

  private final String wireName;
  private final String code;

  Role(String wireName, String code) {
    this.wireName = wireName;
    this.code = code;
  }

  /**
   * Returns the lowercase name used in structured output.
   *
   * @return wire name
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Returns the compact-text abbreviation.
   *
   * @return abbreviation
   */
  public String code() {
    return code;
  }

  /**
   * Looks up a role by its exact wire name.
   *
   * @param wireName wire name (lowercase)
   * @return role or null if unknown
   */
  public static Role fromWireName(String wireName) {
    if (wireName == null) {
      return null;
    }
    return BY_WIRE_NAME.get(wireName);
  }
}
