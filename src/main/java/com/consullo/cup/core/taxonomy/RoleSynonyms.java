package com.consullo.cup.core.taxonomy;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Natural-language phrases that name one or more canonical roles ("search bar", "dropdown").
 *
 * <p>Every role's wire name maps to the role itself, so exact role names resolve through the same table.
 * Phrases are matched after lowercasing and collapsing whitespace.
 *
 * @since 1.0
 */
public final class RoleSynonyms {

  private static final Map<String, Set<Role>> SYNONYMS = new HashMap<>();

  static {
    // text input
    put("input", Role.TEXTBOX, Role.COMBOBOX, Role.SEARCHBOX, Role.SPINBUTTON, Role.SLIDER);
    put("text input", Role.TEXTBOX, Role.SEARCHBOX, Role.COMBOBOX);
    put("text field", Role.TEXTBOX, Role.SEARCHBOX, Role.COMBOBOX);
    put("text box", Role.TEXTBOX, Role.SEARCHBOX);
    put("textarea", Role.TEXTBOX, Role.DOCUMENT);
    put("edit", Role.TEXTBOX, Role.SEARCHBOX, Role.COMBOBOX, Role.DOCUMENT);
    put("editor", Role.TEXTBOX, Role.DOCUMENT);
    // search
    put("search", Role.SEARCH, Role.SEARCHBOX, Role.TEXTBOX, Role.COMBOBOX);
    put("search bar", Role.SEARCH, Role.SEARCHBOX, Role.TEXTBOX, Role.COMBOBOX);
    put("search box", Role.SEARCH, Role.SEARCHBOX, Role.TEXTBOX, Role.COMBOBOX);
    put("search field", Role.SEARCH, Role.SEARCHBOX, Role.TEXTBOX, Role.COMBOBOX);
    put("search input", Role.SEARCH, Role.SEARCHBOX, Role.TEXTBOX, Role.COMBOBOX);
    // buttons and links
    put("btn", Role.BUTTON);
    put("clickable", Role.BUTTON, Role.LINK, Role.MENUITEM, Role.TAB, Role.TREEITEM, Role.LISTITEM);
    put("hyperlink", Role.LINK);
    put("anchor", Role.LINK);
    // dropdowns
    put("dropdown", Role.COMBOBOX, Role.MENU, Role.LIST);
    put("select", Role.COMBOBOX, Role.LIST, Role.LISTITEM);
    put("combo", Role.COMBOBOX);
    put("combo box", Role.COMBOBOX);
    // toggles
    put("check", Role.CHECKBOX, Role.SWITCH, Role.MENUITEMCHECKBOX);
    put("toggle", Role.SWITCH, Role.CHECKBOX);
    put("radio button", Role.RADIO, Role.MENUITEMRADIO);
    put("option", Role.OPTION, Role.RADIO, Role.LISTITEM, Role.MENUITEMRADIO);
    // ranges
    put("range", Role.SLIDER, Role.PROGRESSBAR, Role.SPINBUTTON);
    put("progress", Role.PROGRESSBAR);
    put("progress bar", Role.PROGRESSBAR);
    put("spinner", Role.SPINBUTTON);
    // tabs and menus
    put("tab bar", Role.TABLIST);
    put("tab list", Role.TABLIST);
    put("tabs", Role.TABLIST, Role.TAB);
    put("tab panel", Role.TABPANEL);
    put("menu bar", Role.MENUBAR);
    put("menu item", Role.MENUITEM, Role.MENUITEMCHECKBOX, Role.MENUITEMRADIO);
    // dialogs and notices
    put("modal", Role.DIALOG, Role.ALERTDIALOG);
    put("popup", Role.DIALOG, Role.ALERTDIALOG, Role.TOOLTIP, Role.MENU);
    put("notification", Role.ALERT, Role.STATUS, Role.LOG);
    put("message", Role.ALERT, Role.STATUS, Role.LOG);
    // headings and images
    put("title", Role.HEADING, Role.TITLEBAR);
    put("header", Role.HEADING, Role.BANNER, Role.COLUMNHEADER, Role.ROWHEADER);
    put("image", Role.IMG);
    put("picture", Role.IMG);
    put("icon", Role.IMG, Role.BUTTON);
    // trees, lists, tables
    put("tree item", Role.TREEITEM);
    put("list item", Role.LISTITEM);
    put("table", Role.TABLE, Role.GRID);
    // landmarks and containers
    put("nav", Role.NAVIGATION);
    put("sidebar", Role.COMPLEMENTARY, Role.NAVIGATION);
    put("panel", Role.REGION, Role.GROUP, Role.TABPANEL);
    put("section", Role.REGION, Role.GROUP, Role.MAIN);
    put("container", Role.REGION, Role.GROUP, Role.GENERIC);
    put("divider", Role.SEPARATOR);
    put("scroll", Role.SCROLLBAR);
    put("status bar", Role.STATUS);
    put("tool bar", Role.TOOLBAR);

    for (Role r : Role.values()) {
      SYNONYMS.putIfAbsent(r.wireName(), Collections.unmodifiableSet(EnumSet.of(r)));
    }
  }

  private RoleSynonyms() {
  }

  /**
   * Returns the roles named by a phrase.
   *
   * @param phrase free-text phrase such as "Search Bar"
   * @return unmodifiable role set, or null if the phrase is not a known synonym
   */
  public static Set<Role> lookup(String phrase) {
    return SYNONYMS.get(normalizePhrase(phrase));
  }

  /**
   * Returns true if the phrase is a known synonym.
   *
   * @param phrase phrase
   * @return true if {@link #lookup(String)} would return a role set
   */
  public static boolean contains(String phrase) {
    return SYNONYMS.containsKey(normalizePhrase(phrase));
  }

  /**
   * Resolves a role filter to the roles it names.
   *
   * <p>Tries the whole phrase, then each whitespace-separated word, then (for filters of three or more
   * characters) every role whose wire name contains the filter.
   *
   * @param filter role filter such as "button" or "search bar"
   * @return unmodifiable role set, or null if the filter names no role
   */
  public static Set<Role> resolve(String filter) {
    String q = normalizePhrase(filter);
    if (q.isEmpty()) {
      return null;
    }
    Set<Role> direct = SYNONYMS.get(q);
    if (direct != null) {
      return direct;
    }
    for (String word : q.split(" ")) {
      Set<Role> byWord = SYNONYMS.get(word);
      if (byWord != null) {
        return byWord;
      }
    }
    if (q.length() >= 3) {
      Set<Role> matches = EnumSet.noneOf(Role.class);
      for (Role r : Role.values()) {
        if (r.wireName().contains(q)) {
          matches.add(r);
        }
      }
      if (!matches.isEmpty()) {
        return Collections.unmodifiableSet(matches);
      }
    }
    return null;
  }

  private static void put(String phrase, Role first, Role... rest) {
    SYNONYMS.put(phrase, Collections.unmodifiableSet(EnumSet.of(first, rest)));
  }

  private static String normalizePhrase(String phrase) {
    if (phrase == null) {
      return "";
    }
    StringBuilder sb = new StringBuilder(phrase.length());
    boolean pendingSpace = false;
    for (int i = 0; i < phrase.length(); i++) {
      char c = phrase.charAt(i);
      if (Character.isWhitespace(c)) {
        pendingSpace = sb.length() > 0;
        continue;
      }
      if (pendingSpace) {
        sb.append(' ');
        pendingSpace = false;
      }
      sb.append(Character.toLowerCase(c));
    }
    return sb.toString();
  }
}
