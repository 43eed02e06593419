package com.github.jscodemod.javascript;

import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.github.jscodemod.CodemodDiagnostics;
import com.github.jscodemod.CodemodException;
import com.google.common.base.Preconditions;
import com.google.javascript.jscomp.Compiler;
import com.google.javascript.jscomp.CompilerOptions;
import com.google.javascript.jscomp.CompilerOptions.LanguageMode;
import com.google.javascript.jscomp.JSError;
import com.google.javascript.jscomp.JsAst;
import com.google.javascript.jscomp.SourceFile;
import com.google.javascript.jscomp.parsing.Config;
import com.google.javascript.rhino.Node;

/**
 * Parses source text into a {@link JsTree} and prints a tree back to text
 * through the closure code printer.
 */
public class JsTreeAdapter {

  private static final Logger logger = Logger.getLogger(JsTreeAdapter.class.getName());

  static final String DEFAULT_FILE_NAME = "input.js";

  /**
   * A printed import with a binding clause, {@code import{a, b}from "x";}.
   * Groups are the clause, the specifier literal and the rest of the line.
   */
  private static final Pattern IMPORT_LINE = Pattern.compile(
      "^import\\b(?!\\s*\\()(.*?)\\bfrom\\s*(\"(?:[^\"\\\\]|\\\\.)*\"|'(?:[^'\\\\]|\\\\.)*')\\s*;(.*)$",
      Pattern.MULTILINE);

  private static final Pattern CLAUSE_TOKEN = Pattern.compile("[{}*,]|[^\\s{}*,]+");


  public JsTree parse(String source) throws CodemodException {
    return parse(DEFAULT_FILE_NAME, source);
  }


  public JsTree parse(String fileName, String source) throws CodemodException {
    Preconditions.checkNotNull(source);
    Compiler compiler = createCompiler();
    SourceFile sourceFile = SourceFile.fromCode(fileName, source);
    Node root = new JsAst(sourceFile).getAstRoot(compiler);

    if (root == null || !compiler.getErrors().isEmpty()) {
      String description = "unknown error";
      for (JSError error : compiler.getErrors()) {
        description = error.getDescription();
        break;
      }
      logger.fine("Parse of " + fileName + " failed: " + description);
      throw new CodemodException(CodemodDiagnostics.JS_PARSE_FAILURE, description);
    }

    if (logger.isLoggable(Level.FINEST)) {
      logger.finest("Parsed " + fileName + ":\n" + root.toStringTree());
    }
    return new JsTree(compiler, root);
  }


  /**
   * @return the printed tree, newline terminated unless it is empty. Import
   *         declarations read {@code import { a, b as c } from "x";}.
   */
  public String emit(JsTree tree) {
    String code = formatImports(tree.getCompiler().toSource(tree.getRoot()));
    if (code.isEmpty() || code.endsWith("\n")) {
      return code;
    }
    return code + "\n";
  }


  static String formatImports(String code) {
    Matcher matcher = IMPORT_LINE.matcher(code);
    StringBuffer buffer = new StringBuffer();
    while (matcher.find()) {
      String line = "import " + formatClause(matcher.group(1)) + " from " + matcher.group(2) + ";"
          + matcher.group(3);
      matcher.appendReplacement(buffer, Matcher.quoteReplacement(line));
    }
    matcher.appendTail(buffer);
    return buffer.toString();
  }


  private static String formatClause(String clause) {
    StringBuilder builder = new StringBuilder();
    Matcher tokens = CLAUSE_TOKEN.matcher(clause);
    while (tokens.find()) {
      String token = tokens.group();
      if (token.equals(",")) {
        builder.append(", ");
      } else if (token.equals("{")) {
        builder.append("{ ");
      } else if (token.equals("}")) {
        while (builder.length() > 0 && builder.charAt(builder.length() - 1) == ' ') {
          builder.setLength(builder.length() - 1);
        }
        builder.append(" }");
      } else {
        if (builder.length() > 0 && builder.charAt(builder.length() - 1) != ' ') {
          builder.append(' ');
        }
        builder.append(token);
      }
    }
    return builder.toString();
  }


  protected Compiler createCompiler() {
    Compiler compiler = new Compiler();
    compiler.initOptions(createOptions());
    return compiler;
  }


  protected CompilerOptions createOptions() {
    CompilerOptions options = new CompilerOptions();
    options.setLanguageIn(LanguageMode.ECMASCRIPT_2021);
    options.setPrettyPrint(true);
    options.setEmitUseStrict(false);
    options.setParseJsDocDocumentation(Config.JsDocParsing.INCLUDE_ALL_COMMENTS);
    options.setPreserveNonJSDocComments(true);
    return options;
  }
}
