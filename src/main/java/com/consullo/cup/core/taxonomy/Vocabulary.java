package com.consullo.cup.core.taxonomy;

import com.consullo.cup.core.Platform;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Read-only mapping from platform-native accessibility vocabulary to the canonical {@link Role},
 * {@link State} and {@link Action} enums.
 *
 * <p>Lookups are case-insensitive and ignore whitespace, dashes and underscores, so "push button",
 * "push-button" and "PushButton" resolve identically. The platform table is consulted first; canonical
 * wire names and abbreviations are accepted on every platform after that.
 *
 * @since 1.0
 */
public final class Vocabulary {

  private static final Map<Platform, Map<String, Role>> NATIVE_ROLES = new EnumMap<>(Platform.class);
  private static final Map<Platform, Map<String, State>> NATIVE_STATES = new EnumMap<>(Platform.class);
  private static final Map<Platform, Map<String, Action>> NATIVE_ACTIONS = new EnumMap<>(Platform.class);

  private static final Map<String, Role> CANONICAL_ROLES = new HashMap<>();
  private static final Map<String, State> CANONICAL_STATES = new HashMap<>();
  private static final Map<String, Action> CANONICAL_ACTIONS = new HashMap<>();

  static {
    for (Platform p : Platform.values()) {
      NATIVE_ROLES.put(p, new HashMap<>());
      NATIVE_STATES.put(p, new HashMap<>());
      NATIVE_ACTIONS.put(p, new HashMap<>());
    }
    // Abbreviations first so that wire names win on any collision.
    for (Role r : Role.values()) {
      CANONICAL_ROLES.put(normalize(r.code()), r);
    }
    for (Role r : Role.values()) {
      CANONICAL_ROLES.put(normalize(r.wireName()), r);
    }
    for (State s : State.values()) {
      CANONICAL_STATES.put(normalize(s.code()), s);
    }
    for (State s : State.values()) {
      CANONICAL_STATES.put(normalize(s.wireName()), s);
    }
    for (Action a : Action.values()) {
      CANONICAL_ACTIONS.put(normalize(a.code()), a);
    }
    for (Action a : Action.values()) {
      CANONICAL_ACTIONS.put(normalize(a.wireName()), a);
    }

    windowsRoles();
    macosRoles();
    linuxRoles();
    webRoles();
    nativeStates();
    nativeActions();
  }

  private Vocabulary() {
  }

  /**
   * Maps a native role string to a canonical role.
   *
   * @param platform source platform
   * @param nativeRole native role string (may be null)
   * @return canonical role, {@link Role#GENERIC} when unmapped
   */
  public static Role role(Platform platform, String nativeRole) {
    String key = normalize(nativeRole);
    if (key.isEmpty()) {
      return Role.GENERIC;
    }
    Role r = platform == null ? null : NATIVE_ROLES.get(platform).get(key);
    if (r == null) {
      r = CANONICAL_ROLES.get(key);
    }
    return r == null ? Role.GENERIC : r;
  }

  /**
   * Maps a native state token to a canonical state.
   *
   * @param platform source platform
   * @param token native token
   * @return canonical state or null if unrecognized
   */
  public static State state(Platform platform, String token) {
    String key = normalize(token);
    if (key.isEmpty()) {
      return null;
    }
    State s = platform == null ? null : NATIVE_STATES.get(platform).get(key);
    return s != null ? s : CANONICAL_STATES.get(key);
  }

  /**
   * Maps a native action token to a canonical action.
   *
   * @param platform source platform
   * @param token native token
   * @return canonical action or null if unrecognized
   */
  public static Action action(Platform platform, String token) {
    String key = normalize(token);
    if (key.isEmpty()) {
      return null;
    }
    Action a = platform == null ? null : NATIVE_ACTIONS.get(platform).get(key);
    return a != null ? a : CANONICAL_ACTIONS.get(key);
  }

  /**
   * Normalizes a vocabulary token for lookup: lowercase, without whitespace, dashes or underscores.
   *
   * @param token raw token (may be null)
   * @return normalized token, never null
   */
  public static String normalize(String token) {
    if (token == null) {
      return "";
    }
    StringBuilder sb = new StringBuilder(token.length());
    for (int i = 0; i < token.length(); i++) {
      char c = token.charAt(i);
      if (Character.isWhitespace(c) || c == '-' || c == '_') {
        continue;
      }
      sb.append(Character.toLowerCase(c));
    }
    return sb.toString();
  }

  private static void role(Platform p, String nativeRole, Role role) {
    NATIVE_ROLES.get(p).put(normalize(nativeRole), role);
  }

  private static void state(Platform p, String token, State state) {
    NATIVE_STATES.get(p).put(normalize(token), state);
  }

  private static void action(Platform p, String token, Action action) {
    NATIVE_ACTIONS.get(p).put(normalize(token), action);
  }

  // UI Automation control type names.
  private static void windowsRoles() {
    Platform p = Platform.WINDOWS;
    role(p, "Button", Role.BUTTON);
    role(p, "Calendar", Role.GRID);
    role(p, "CheckBox", Role.CHECKBOX);
    role(p, "ComboBox", Role.COMBOBOX);
    role(p, "Edit", Role.TEXTBOX);
    role(p, "Hyperlink", Role.LINK);
    role(p, "Image", Role.IMG);
    role(p, "ListItem", Role.LISTITEM);
    role(p, "List", Role.LIST);
    role(p, "Menu", Role.MENU);
    role(p, "MenuBar", Role.MENUBAR);
    role(p, "MenuItem", Role.MENUITEM);
    role(p, "ProgressBar", Role.PROGRESSBAR);
    role(p, "RadioButton", Role.RADIO);
    role(p, "ScrollBar", Role.SCROLLBAR);
    role(p, "Slider", Role.SLIDER);
    role(p, "Spinner", Role.SPINBUTTON);
    role(p, "StatusBar", Role.STATUS);
    role(p, "Tab", Role.TABLIST);
    role(p, "TabItem", Role.TAB);
    role(p, "Text", Role.TEXT);
    role(p, "ToolBar", Role.TOOLBAR);
    role(p, "ToolTip", Role.TOOLTIP);
    role(p, "Tree", Role.TREE);
    role(p, "TreeItem", Role.TREEITEM);
    role(p, "Custom", Role.GENERIC);
    role(p, "Group", Role.GROUP);
    role(p, "Thumb", Role.GENERIC);
    role(p, "DataGrid", Role.GRID);
    role(p, "DataItem", Role.ROW);
    role(p, "Document", Role.DOCUMENT);
    role(p, "SplitButton", Role.BUTTON);
    role(p, "Window", Role.WINDOW);
    role(p, "Pane", Role.GENERIC);
    role(p, "Header", Role.GROUP);
    role(p, "HeaderItem", Role.COLUMNHEADER);
    role(p, "Table", Role.TABLE);
    role(p, "TitleBar", Role.TITLEBAR);
    role(p, "Separator", Role.SEPARATOR);
    role(p, "SemanticZoom", Role.GENERIC);
    role(p, "AppBar", Role.TOOLBAR);
  }

  // AXRole names.
  private static void macosRoles() {
    Platform p = Platform.MACOS;
    role(p, "AXApplication", Role.APPLICATION);
    role(p, "AXWindow", Role.WINDOW);
    role(p, "AXButton", Role.BUTTON);
    role(p, "AXCheckBox", Role.CHECKBOX);
    role(p, "AXRadioButton", Role.RADIO);
    role(p, "AXComboBox", Role.COMBOBOX);
    role(p, "AXPopUpButton", Role.COMBOBOX);
    role(p, "AXTextField", Role.TEXTBOX);
    role(p, "AXTextArea", Role.TEXTBOX);
    role(p, "AXStaticText", Role.TEXT);
    role(p, "AXImage", Role.IMG);
    role(p, "AXLink", Role.LINK);
    role(p, "AXList", Role.LIST);
    role(p, "AXOutline", Role.TREE);
    role(p, "AXTable", Role.TABLE);
    role(p, "AXTabGroup", Role.TABLIST);
    role(p, "AXSlider", Role.SLIDER);
    role(p, "AXProgressIndicator", Role.PROGRESSBAR);
    role(p, "AXMenu", Role.MENU);
    role(p, "AXMenuBar", Role.MENUBAR);
    role(p, "AXMenuBarItem", Role.MENUITEM);
    role(p, "AXMenuItem", Role.MENUITEM);
    role(p, "AXToolbar", Role.TOOLBAR);
    role(p, "AXScrollBar", Role.SCROLLBAR);
    role(p, "AXScrollArea", Role.GENERIC);
    role(p, "AXGroup", Role.GROUP);
    role(p, "AXSplitGroup", Role.GROUP);
    role(p, "AXSplitter", Role.SEPARATOR);
    role(p, "AXHeading", Role.HEADING);
    role(p, "AXWebArea", Role.DOCUMENT);
    role(p, "AXCell", Role.CELL);
    role(p, "AXRow", Role.ROW);
    role(p, "AXColumn", Role.COLUMNHEADER);
    role(p, "AXSheet", Role.ALERTDIALOG);
    role(p, "AXDrawer", Role.COMPLEMENTARY);
    role(p, "AXIncrementor", Role.SPINBUTTON);
    role(p, "AXHelpTag", Role.TOOLTIP);
    role(p, "AXColorWell", Role.BUTTON);
    role(p, "AXDisclosureTriangle", Role.BUTTON);
    role(p, "AXDateField", Role.TEXTBOX);
    role(p, "AXBrowser", Role.TREE);
    role(p, "AXBusyIndicator", Role.PROGRESSBAR);
    role(p, "AXRelevanceIndicator", Role.PROGRESSBAR);
    role(p, "AXLevelIndicator", Role.SLIDER);
    role(p, "AXLayoutArea", Role.GROUP);
    role(p, "AXListMarker", Role.TEXT);
    role(p, "AXMenuButton", Role.BUTTON);
    role(p, "AXRadioGroup", Role.GROUP);
    role(p, "AXUnknown", Role.GENERIC);
  }

  // AT-SPI role names.
  private static void linuxRoles() {
    Platform p = Platform.LINUX;
    role(p, "push-button", Role.BUTTON);
    role(p, "toggle-button", Role.BUTTON);
    role(p, "check-box", Role.CHECKBOX);
    role(p, "radio-button", Role.RADIO);
    role(p, "combo-box", Role.COMBOBOX);
    role(p, "text", Role.TEXTBOX);
    role(p, "password-text", Role.TEXTBOX);
    role(p, "entry", Role.TEXTBOX);
    role(p, "spin-button", Role.SPINBUTTON);
    role(p, "scroll-bar", Role.SCROLLBAR);
    role(p, "progress-bar", Role.PROGRESSBAR);
    role(p, "menu-bar", Role.MENUBAR);
    role(p, "menu-item", Role.MENUITEM);
    role(p, "check-menu-item", Role.MENUITEMCHECKBOX);
    role(p, "radio-menu-item", Role.MENUITEMRADIO);
    role(p, "frame", Role.WINDOW);
    role(p, "file-chooser", Role.DIALOG);
    role(p, "color-chooser", Role.DIALOG);
    role(p, "font-chooser", Role.DIALOG);
    role(p, "panel", Role.GROUP);
    role(p, "filler", Role.GENERIC);
    role(p, "grouping", Role.GROUP);
    role(p, "split-pane", Role.GROUP);
    role(p, "viewport", Role.GROUP);
    role(p, "scroll-pane", Role.GROUP);
    role(p, "layered-pane", Role.GROUP);
    role(p, "internal-frame", Role.GROUP);
    role(p, "root-pane", Role.GROUP);
    role(p, "table-cell", Role.CELL);
    role(p, "table-row", Role.ROW);
    role(p, "table-column-header", Role.COLUMNHEADER);
    role(p, "table-row-header", Role.ROWHEADER);
    role(p, "tree-table", Role.TREE);
    role(p, "list-item", Role.LISTITEM);
    role(p, "tree-item", Role.TREEITEM);
    role(p, "page-tab-list", Role.TABLIST);
    role(p, "page-tab", Role.TAB);
    role(p, "label", Role.TEXT);
    role(p, "static", Role.TEXT);
    role(p, "caption", Role.TEXT);
    role(p, "paragraph", Role.TEXT);
    role(p, "section", Role.GENERIC);
    role(p, "block-quote", Role.GENERIC);
    role(p, "image", Role.IMG);
    role(p, "icon", Role.IMG);
    role(p, "animation", Role.IMG);
    role(p, "canvas", Role.IMG);
    role(p, "chart", Role.IMG);
    role(p, "document-frame", Role.DOCUMENT);
    role(p, "document-web", Role.DOCUMENT);
    role(p, "document-text", Role.DOCUMENT);
    role(p, "document-email", Role.DOCUMENT);
    role(p, "document-spreadsheet", Role.DOCUMENT);
    role(p, "document-presentation", Role.DOCUMENT);
    role(p, "article", Role.REGION);
    role(p, "tool-bar", Role.TOOLBAR);
    role(p, "tool-tip", Role.TOOLTIP);
    role(p, "status-bar", Role.STATUS);
    role(p, "info-bar", Role.STATUS);
    role(p, "notification", Role.ALERT);
    role(p, "landmark", Role.REGION);
    role(p, "footer", Role.CONTENTINFO);
    role(p, "description-list", Role.LIST);
    role(p, "page", Role.REGION);
    role(p, "autocomplete", Role.COMBOBOX);
    role(p, "editbar", Role.TOOLBAR);
    role(p, "unknown", Role.GENERIC);
  }

  // ARIA and Chromium accessibility roles that differ from the canonical names.
  private static void webRoles() {
    Platform p = Platform.WEB;
    role(p, "RootWebArea", Role.DOCUMENT);
    role(p, "WebArea", Role.DOCUMENT);
    role(p, "StaticText", Role.TEXT);
    role(p, "LabelText", Role.TEXT);
    role(p, "paragraph", Role.TEXT);
    role(p, "image", Role.IMG);
    role(p, "presentation", Role.NONE);
    role(p, "article", Role.REGION);
    role(p, "listbox", Role.LIST);
    role(p, "treegrid", Role.TREE);
    role(p, "gridcell", Role.CELL);
    role(p, "textfield", Role.TEXTBOX);
    role(p, "figure", Role.GROUP);
    role(p, "term", Role.TEXT);
    role(p, "definition", Role.TEXT);
  }

  private static void nativeStates() {
    state(Platform.WINDOWS, "HasKeyboardFocus", State.FOCUSED);
    state(Platform.WINDOWS, "IsSelected", State.SELECTED);
    state(Platform.WINDOWS, "IsOffscreen", State.OFFSCREEN);
    state(Platform.WINDOWS, "IsReadOnly", State.READONLY);
    state(Platform.WINDOWS, "IsRequiredForForm", State.REQUIRED);
    state(Platform.WINDOWS, "IsModal", State.MODAL);
    state(Platform.WINDOWS, "ToggleOn", State.CHECKED);
    state(Platform.WINDOWS, "ToggleIndeterminate", State.MIXED);
    state(Platform.WINDOWS, "NotEnabled", State.DISABLED);

    state(Platform.MACOS, "AXFocused", State.FOCUSED);
    state(Platform.MACOS, "AXSelected", State.SELECTED);
    state(Platform.MACOS, "AXExpanded", State.EXPANDED);
    state(Platform.MACOS, "AXRequired", State.REQUIRED);
    state(Platform.MACOS, "AXModal", State.MODAL);
    state(Platform.MACOS, "AXDisabled", State.DISABLED);

    state(Platform.LINUX, "indeterminate", State.MIXED);
    state(Platform.LINUX, "multi-selectable", State.MULTISELECTABLE);
    state(Platform.LINUX, "read-only", State.READONLY);
    state(Platform.LINUX, "insensitive", State.DISABLED);

    state(Platform.WEB, "invisible", State.HIDDEN);
    state(Platform.WEB, "indeterminate", State.MIXED);
  }

  private static void nativeActions() {
    action(Platform.WINDOWS, "Invoke", Action.CLICK);
    action(Platform.WINDOWS, "Toggle", Action.TOGGLE);
    action(Platform.WINDOWS, "ExpandCollapse", Action.EXPAND);
    action(Platform.WINDOWS, "Value", Action.SETVALUE);
    action(Platform.WINDOWS, "RangeValue", Action.SETVALUE);
    action(Platform.WINDOWS, "Scroll", Action.SCROLL);
    action(Platform.WINDOWS, "SelectionItem", Action.SELECT);

    action(Platform.MACOS, "AXPress", Action.CLICK);
    action(Platform.MACOS, "AXConfirm", Action.CLICK);
    action(Platform.MACOS, "AXIncrement", Action.INCREMENT);
    action(Platform.MACOS, "AXDecrement", Action.DECREMENT);
    action(Platform.MACOS, "AXShowMenu", Action.RIGHTCLICK);
    action(Platform.MACOS, "AXCancel", Action.DISMISS);
    action(Platform.MACOS, "AXPick", Action.SELECT);
    action(Platform.MACOS, "AXRaise", Action.FOCUS);

    action(Platform.LINUX, "press", Action.CLICK);
    action(Platform.LINUX, "activate", Action.CLICK);
    action(Platform.LINUX, "jump", Action.CLICK);
    action(Platform.LINUX, "menu", Action.CLICK);
    action(Platform.LINUX, "expand or contract", Action.EXPAND);

    action(Platform.WEB, "dblclick", Action.DOUBLECLICK);
    action(Platform.WEB, "contextmenu", Action.RIGHTCLICK);
    action(Platform.WEB, "fill", Action.TYPE);
  }
}
