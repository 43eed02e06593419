package com.github.jscodemod.javascript;

import com.github.jscodemod.CodemodException;

final class JsFormatter {

  private final JsTreeAdapter adapter;


  JsFormatter(JsTreeAdapter adapter) {
    this.adapter = adapter;
  }


  String format(String source) throws CodemodException {
    return adapter.emit(adapter.parse(source));
  }


  /**
   * @return true when formatting would not change the source beyond leading
   *         and trailing whitespace.
   */
  boolean isFormatted(String source) throws CodemodException {
    return format(source).trim().equals(source.trim());
  }
}
