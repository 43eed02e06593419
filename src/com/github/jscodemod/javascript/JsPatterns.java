package com.github.jscodemod.javascript;

import com.google.javascript.jscomp.NodeUtil;
import com.google.javascript.rhino.Node;

/**
 * Structural predicates over the closure AST. Names are compared as plain
 * strings, there is no scope resolution.
 */
final class JsPatterns {

  private JsPatterns() {}


  static boolean isImportOf(Node n, String specifier) {
    return n.isImport() && specifier.equals(importSpecifier(n));
  }


  /**
   * @return the module specifier of an IMPORT node.
   */
  static String importSpecifier(Node importNode) {
    return importNode.getLastChild().getString();
  }


  /**
   * @return the NAME node binding {@code name} in a var, let or const
   *         declaration, or null.
   */
  static Node declaredName(Node n, String name) {
    if (!NodeUtil.isNameDeclaration(n)) {
      return null;
    }
    for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
      if (child.isName() && child.getString().equals(name)) {
        return child;
      }
    }
    return null;
  }


  static boolean isNewCallTo(Node n, String constructorName) {
    if (n == null || !n.isNew()) {
      return false;
    }
    Node callee = n.getFirstChild();
    return callee.isName() && callee.getString().equals(constructorName);
  }


  /**
   * @return the last argument of a NEW node if it is an object literal.
   */
  static Node trailingObjectLiteralArgument(Node newCall) {
    if (newCall.getChildCount() < 2) {
      return null;
    }
    Node last = newCall.getLastChild();
    return last.isObjectLit() ? last : null;
  }


  /**
   * @return the STRING_KEY with the given key, or null.
   */
  static Node findStringKey(Node objectLit, String key) {
    for (Node property = objectLit.getFirstChild(); property != null; property = property.getNext()) {
      if (property.isStringKey() && property.getString().equals(key)) {
        return property;
      }
    }
    return null;
  }
}
