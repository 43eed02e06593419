package com.github.jscodemod.css;

import com.helger.css.decl.CascadingStyleSheet;

/**
 * A parsed stylesheet and the comments read from its text.
 */
public final class CssTree {

  private final CascadingStyleSheet sheet;

  private final CssTrivia trivia;


  CssTree(CascadingStyleSheet sheet, CssTrivia trivia) {
    this.sheet = sheet;
    this.trivia = trivia;
  }


  public CascadingStyleSheet getSheet() {
    return sheet;
  }


  CssTrivia getTrivia() {
    return trivia;
  }
}
