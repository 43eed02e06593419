package com.github.jscodemod;

import com.google.javascript.jscomp.DiagnosticType;

/**
 * Every failure a codemod operation can report.
 */
public final class CodemodDiagnostics {

  private CodemodDiagnostics() {}

  public static final DiagnosticType JS_PARSE_FAILURE = DiagnosticType
      .error(
          "JSC_CODEMOD_JS_PARSE_FAILURE",
          "Failed to parse JavaScript content: {0}");

  public static final DiagnosticType IMPORT_LINE_PARSE_FAILURE = DiagnosticType
      .error(
          "JSC_CODEMOD_IMPORT_LINE_PARSE_FAILURE",
          "Failed to parse import line: {0}");

  public static final DiagnosticType IMPORT_LINE_WITHOUT_IMPORT = DiagnosticType
      .error(
          "JSC_CODEMOD_IMPORT_LINE_WITHOUT_IMPORT",
          "No import declaration found in parsed import line: {0}");

  public static final DiagnosticType VARIABLE_NOT_FOUND = DiagnosticType
      .error(
          "JSC_CODEMOD_VARIABLE_NOT_FOUND",
          "{0} not found.");

  public static final DiagnosticType NOT_A_CONSTRUCTOR_CALL = DiagnosticType
      .error(
          "JSC_CODEMOD_NOT_A_CONSTRUCTOR_CALL",
          "{0} is not initialized by a {1} constructor call.");

  public static final DiagnosticType MISSING_OPTIONS_OBJECT = DiagnosticType
      .error(
          "JSC_CODEMOD_MISSING_OPTIONS_OBJECT",
          "The {1} call assigned to {0} has no trailing object literal argument.");

  public static final DiagnosticType NOT_AN_OBJECT_LITERAL = DiagnosticType
      .error(
          "JSC_CODEMOD_NOT_AN_OBJECT_LITERAL",
          "{0} is not initialized by an object literal.");

  public static final DiagnosticType HOOKS_NOT_AN_OBJECT_LITERAL = DiagnosticType
      .error(
          "JSC_CODEMOD_HOOKS_NOT_AN_OBJECT_LITERAL",
          "The {0} property of the {1} options is not an object literal.");

  public static final DiagnosticType INVALID_PROPERTY_NAME = DiagnosticType
      .error(
          "JSC_CODEMOD_INVALID_PROPERTY_NAME",
          "Invalid property name \"{0}\".");

  public static final DiagnosticType CSS_PARSE_FAILURE = DiagnosticType
      .error(
          "JSC_CODEMOD_CSS_PARSE_FAILURE",
          "Failed to parse CSS content: {0}");

  public static final DiagnosticType CSS_IMPORT_LINE_PARSE_FAILURE = DiagnosticType
      .error(
          "JSC_CODEMOD_CSS_IMPORT_LINE_PARSE_FAILURE",
          "Failed to parse CSS import line: {0}");

  public static final DiagnosticType CSS_IMPORT_LINE_WITHOUT_IMPORT = DiagnosticType
      .error(
          "JSC_CODEMOD_CSS_IMPORT_LINE_WITHOUT_IMPORT",
          "No @import rule found in parsed import line: {0}");

  public static final DiagnosticType INVALID_SELECTOR = DiagnosticType
      .error(
          "JSC_CODEMOD_INVALID_SELECTOR",
          "Failed to parse selector: {0}");

  public static final DiagnosticType INVALID_DECLARATION = DiagnosticType
      .error(
          "JSC_CODEMOD_INVALID_DECLARATION",
          "Failed to parse declaration: {0}");

  public static final DiagnosticType RULE_NOT_FOUND = DiagnosticType
      .error(
          "JSC_CODEMOD_RULE_NOT_FOUND",
          "No style rule matches selector {0}.");
}
