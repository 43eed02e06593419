package com.github.jscodemod.css;

import java.util.List;
import java.util.Locale;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * Reads the comments of a stylesheet from its raw text and groups them by the
 * top level statement and declaration they belong to. The statements are
 * later paired with the parsed rules in source order.
 *
 * <p>A comment on its own line is leading trivia of the next statement or
 * declaration, a comment on the line a statement or declaration ends on is
 * trailing trivia of it. Comments inside at-rule blocks are not kept.
 */
final class CssTriviaScanner {

  enum Kind {
    CHARSET, IMPORT, NAMESPACE, RULE
  }


  static final class Declaration {
    final String property;

    final NodeComments comments = new NodeComments();


    Declaration(String property) {
      this.property = property;
    }
  }


  static final class Statement {
    final Kind kind;

    final boolean styleRule;

    final NodeComments comments = new NodeComments();

    final List<Declaration> declarations = Lists.newArrayList();


    Statement(Kind kind, boolean styleRule) {
      this.kind = kind;
      this.styleRule = styleRule;
    }
  }


  static final class Result {
    final List<Statement> statements;

    /** Comments after the last statement. */
    final List<CssComment> dangling;


    Result(List<Statement> statements, List<CssComment> dangling) {
      this.statements = ImmutableList.copyOf(statements);
      this.dangling = ImmutableList.copyOf(dangling);
    }


    List<Statement> statementsOf(Kind kind) {
      List<Statement> result = Lists.newArrayList();
      for (Statement statement : statements) {
        if (statement.kind == kind) {
          result.add(statement);
        }
      }
      return result;
    }
  }

  private final String text;

  private int pos = 0;

  private int contentEnd = 0;


  private CssTriviaScanner(String text) {
    this.text = text;
  }


  static Result scan(String text) {
    return new CssTriviaScanner(text).scanSheet();
  }


  private Result scanSheet() {
    List<Statement> statements = Lists.newArrayList();
    List<CssComment> pending = Lists.newArrayList();
    Statement previous = null;
    int previousEnd = 0;

    while (true) {
      skipWhitespace();
      if (atEnd()) {
        break;
      }
      if (startsWith("/*")) {
        int start = pos;
        CssComment comment = readComment();
        if (previous != null && !hasNewline(previousEnd, start)) {
          previous.comments.trailing.add(comment);
        } else {
          pending.add(comment);
        }
        continue;
      }
      if (startsWith("<!--")) {
        pos += 4;
        continue;
      }
      if (startsWith("-->")) {
        pos += 3;
        continue;
      }

      Statement statement = readStatement();
      statement.comments.leading.addAll(pending);
      pending.clear();
      statements.add(statement);
      previous = statement;
      previousEnd = pos;
    }
    return new Result(statements, pending);
  }


  private Statement readStatement() {
    Kind kind = Kind.RULE;
    boolean styleRule = true;
    if (text.charAt(pos) == '@') {
      styleRule = false;
      int start = ++pos;
      while (!atEnd() && isNameChar(text.charAt(pos))) {
        pos++;
      }
      String name = text.substring(start, pos).toLowerCase(Locale.ROOT);
      if (name.equals("charset")) {
        kind = Kind.CHARSET;
      } else if (name.equals("import")) {
        kind = Kind.IMPORT;
      } else if (name.equals("namespace")) {
        kind = Kind.NAMESPACE;
      }
    }

    Statement statement = new Statement(kind, styleRule);
    int parens = 0;
    while (!atEnd()) {
      char c = text.charAt(pos);
      if (c == '"' || c == '\'') {
        skipString();
        continue;
      }
      if (startsWith("/*")) {
        statement.comments.selectorTrailing.add(readComment());
        continue;
      }
      pos++;
      if (c == '(') {
        parens++;
      } else if (c == ')' && parens > 0) {
        parens--;
      } else if (parens == 0 && (c == ';' || c == '}')) {
        return statement;
      } else if (parens == 0 && c == '{') {
        if (styleRule) {
          readDeclarations(statement);
        } else {
          skipBlock();
        }
        return statement;
      }
    }
    return statement;
  }


  private void readDeclarations(Statement statement) {
    List<CssComment> pending = Lists.newArrayList();
    Declaration previous = null;
    int previousEnd = pos;

    while (true) {
      skipWhitespace();
      if (atEnd()) {
        break;
      }
      char c = text.charAt(pos);
      if (c == '}') {
        pos++;
        break;
      }
      if (startsWith("/*")) {
        int start = pos;
        CssComment comment = readComment();
        if (hasNewline(previousEnd, start)) {
          pending.add(comment);
        } else if (previous == null) {
          statement.comments.selectorTrailing.add(comment);
        } else {
          previous.comments.trailing.add(comment);
        }
        continue;
      }
      if (c == ';') {
        pos++;
        previousEnd = pos;
        continue;
      }

      Declaration declaration = readDeclaration();
      declaration.comments.leading.addAll(pending);
      pending.clear();
      statement.declarations.add(declaration);
      previous = declaration;
      previousEnd = contentEnd;
    }
    statement.comments.bodyEnd.addAll(pending);
  }


  /**
   * Reads one declaration up to and including its semicolon. A comment on its
   * own line ends a declaration that has no semicolon, other comments inside a
   * value are skipped. Sets {@link #contentEnd} to the end of the last
   * character that belongs to the declaration.
   */
  private Declaration readDeclaration() {
    StringBuilder raw = new StringBuilder();
    int parens = 0;
    contentEnd = pos;
    while (!atEnd()) {
      char c = text.charAt(pos);
      if (c == '"' || c == '\'') {
        int start = pos;
        skipString();
        raw.append(text, start, pos);
        contentEnd = pos;
        continue;
      }
      if (startsWith("/*")) {
        if (hasNewline(contentEnd, pos)) {
          break;
        }
        readComment();
        continue;
      }
      if (c == '(') {
        parens++;
      } else if (c == ')' && parens > 0) {
        parens--;
      } else if (parens == 0 && c == ';') {
        pos++;
        contentEnd = pos;
        break;
      } else if (parens == 0 && c == '}') {
        break;
      }
      raw.append(c);
      pos++;
      if (!Character.isWhitespace(c)) {
        contentEnd = pos;
      }
    }
    String body = raw.toString();
    int colon = body.indexOf(':');
    String property = colon < 0 ? body : body.substring(0, colon);
    return new Declaration(property.trim().toLowerCase(Locale.ROOT));
  }


  private void skipBlock() {
    int depth = 1;
    while (!atEnd() && depth > 0) {
      char c = text.charAt(pos);
      if (c == '"' || c == '\'') {
        skipString();
        continue;
      }
      if (startsWith("/*")) {
        readComment();
        continue;
      }
      if (c == '{') {
        depth++;
      } else if (c == '}') {
        depth--;
      }
      pos++;
    }
  }


  private void skipString() {
    char quote = text.charAt(pos++);
    while (!atEnd()) {
      char c = text.charAt(pos);
      if (c == '\\') {
        pos += 2;
        continue;
      }
      if (c == '\n') {
        return;
      }
      pos++;
      if (c == quote) {
        return;
      }
    }
  }


  private CssComment readComment() {
    int start = pos;
    int end = text.indexOf("*/", pos + 2);
    pos = end < 0 ? text.length() : end + 2;
    return new CssComment(text.substring(start, pos));
  }


  private void skipWhitespace() {
    while (!atEnd() && Character.isWhitespace(text.charAt(pos))) {
      pos++;
    }
  }


  private boolean hasNewline(int from, int to) {
    return text.substring(from, to).indexOf('\n') >= 0;
  }


  private boolean startsWith(String token) {
    return text.startsWith(token, pos);
  }


  private boolean atEnd() {
    return pos >= text.length();
  }


  private static boolean isNameChar(char c) {
    return Character.isLetterOrDigit(c) || c == '-' || c == '_';
  }
}
