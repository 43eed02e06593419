package com.github.jscodemod.javascript;

import com.github.jscodemod.CodemodException;
import com.google.common.base.Preconditions;
import com.google.javascript.jscomp.DiagnosticType;

/**
 * The state of a targeted search. A search starts as NOT_FOUND and is settled at
 * most once, to FOUND or to FOUND_ERROR when the target exists in an
 * unexpected shape.
 */
final class FindCondition {

  enum Kind {
    FOUND, NOT_FOUND, FOUND_ERROR
  }

  private Kind kind = Kind.NOT_FOUND;

  private boolean settled = false;

  private DiagnosticType reason;

  private String[] arguments;


  FindCondition(DiagnosticType notFoundReason, String... arguments) {
    this.reason = notFoundReason;
    this.arguments = arguments;
  }


  boolean isSettled() {
    return settled;
  }


  Kind getKind() {
    return kind;
  }


  void found() {
    settle(Kind.FOUND, null);
  }


  void foundError(DiagnosticType reason, String... arguments) {
    settle(Kind.FOUND_ERROR, Preconditions.checkNotNull(reason), arguments);
  }


  private void settle(Kind kind, DiagnosticType reason, String... arguments) {
    if (settled) {
      return;
    }
    this.settled = true;
    this.kind = kind;
    this.reason = reason;
    this.arguments = arguments;
  }


  /**
   * @throws CodemodException carrying the reason, unless the target was found.
   */
  void checkFound() throws CodemodException {
    if (kind != Kind.FOUND) {
      throw new CodemodException(reason, arguments);
    }
  }
}
