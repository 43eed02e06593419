package com.github.jscodemod.javascript;

import com.github.jscodemod.CodemodDiagnostics;
import com.github.jscodemod.CodemodException;
import com.google.javascript.rhino.IR;
import com.google.javascript.rhino.Node;
import com.google.javascript.rhino.Token;

/**
 * A shorthand ({@code name}) or spread ({@code ...name}) entry of an object
 * literal. The key of a spread entry keeps the {@code ...} marker, so the two
 * kinds never compare equal.
 */
final class PropertyEntry {

  enum Kind {
    SHORTHAND, SPREAD
  }

  static final String SPREAD_MARKER = "...";

  private final Kind kind;

  private final String name;


  private PropertyEntry(Kind kind, String name) {
    this.kind = kind;
    this.name = name;
  }


  /**
   * Reads {@code "...Hooks"} as a spread of Hooks and anything else as a
   * shorthand entry.
   *
   * @throws CodemodException when no name is left after the marker
   */
  static PropertyEntry parse(String text) throws CodemodException {
    String trimmed = text.trim();
    Kind kind = Kind.SHORTHAND;
    String name = trimmed;
    if (trimmed.startsWith(SPREAD_MARKER)) {
      kind = Kind.SPREAD;
      name = trimmed.substring(SPREAD_MARKER.length()).trim();
    }
    if (name.isEmpty()) {
      throw new CodemodException(CodemodDiagnostics.INVALID_PROPERTY_NAME, text);
    }
    return new PropertyEntry(kind, name);
  }


  /**
   * @return the key of an object literal child, or null when it has none we can
   *         compare against.
   */
  static String keyOf(Node property) {
    switch (property.getToken()) {
      case STRING_KEY:
      case MEMBER_FUNCTION_DEF:
      case GETTER_DEF:
      case SETTER_DEF:
        return property.getString();
      case OBJECT_SPREAD:
        Node argument = property.getFirstChild();
        if (argument != null && argument.isName()) {
          return SPREAD_MARKER + argument.getString();
        }
        return null;
      default:
        return null;
    }
  }


  /**
   * @return true for the entries a removal may delete, shorthand keys and
   *         spreads of a plain name.
   */
  static boolean isRemovable(Node property) {
    if (property.isStringKey()) {
      return property.isShorthandProperty();
    }
    return property.getToken() == Token.OBJECT_SPREAD && property.getFirstChild().isName();
  }


  Kind getKind() {
    return kind;
  }


  String getName() {
    return name;
  }


  String getKey() {
    return kind == Kind.SPREAD ? SPREAD_MARKER + name : name;
  }


  Node toNode() {
    if (kind == Kind.SPREAD) {
      return new Node(Token.OBJECT_SPREAD, IR.name(name));
    }
    Node key = IR.stringKey(name, IR.name(name));
    key.setShorthandProperty(true);
    return key;
  }


  @Override
  public String toString() {
    return getKey();
  }
}
