package com.github.jscodemod.css;

import com.google.common.base.Preconditions;

/**
 * A comment exactly as written in the source, delimiters included.
 */
final class CssComment {

  private final String text;


  CssComment(String text) {
    Preconditions.checkArgument(text.startsWith("/*"), "Not a comment: %s", text);
    this.text = text;
  }


  String getText() {
    return text;
  }


  @Override
  public String toString() {
    return text;
  }
}
