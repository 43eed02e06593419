package com.github.jscodemod;

import com.google.javascript.jscomp.DiagnosticType;
import com.google.javascript.jscomp.JSError;

/**
 * Raised when an edit cannot be applied. The message is the rendered
 * description of the {@link DiagnosticType} that caused it.
 */
public class CodemodException extends Exception {

  private static final long serialVersionUID = 1L;

  private final transient DiagnosticType type;


  public CodemodException(DiagnosticType type, String... arguments) {
    super(JSError.make(type, arguments).getDescription());
    this.type = type;
  }


  public DiagnosticType getType() {
    return type;
  }
}
