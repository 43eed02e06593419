package com.github.jscodemod.css;

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;
import com.helger.css.decl.CSSDeclaration;
import com.helger.css.decl.CSSImportRule;
import com.helger.css.decl.CSSMediaQuery;
import com.helger.css.decl.CSSNamespaceRule;
import com.helger.css.decl.CSSStyleRule;
import com.helger.css.decl.CascadingStyleSheet;
import com.helger.css.decl.ICSSTopLevelRule;
import com.helger.css.writer.CSSWriterSettings;

/**
 * Prints a stylesheet and places its comments. Imports come first, then
 * namespaces, then the remaining rules, each block separated by an empty line.
 * Style rules are laid out as
 *
 * <pre>
 * selector {
 *   property: value;
 * }
 * </pre>
 *
 * other at-rules are printed by ph-css.
 */
final class StylesheetPrinter {

  static final String INDENT = "  ";

  private final CSSWriterSettings settings;


  StylesheetPrinter(CSSWriterSettings settings) {
    this.settings = settings;
  }


  String print(CascadingStyleSheet sheet, CssTrivia trivia) {
    List<String> blocks = Lists.newArrayList();

    List<String> imports = Lists.newArrayList();
    for (CSSImportRule rule : sheet.getAllImportRules()) {
      imports.add(printImport(rule, trivia.commentsOf(rule)));
    }
    addBlock(blocks, imports);

    List<String> namespaces = Lists.newArrayList();
    for (CSSNamespaceRule rule : sheet.getAllNamespaceRules()) {
      namespaces.add(printAtRule(rule.getAsCSSString(settings, 0), trivia.commentsOf(rule)));
    }
    addBlock(blocks, namespaces);

    for (ICSSTopLevelRule rule : sheet.getAllRules()) {
      if (rule instanceof CSSStyleRule) {
        blocks.add(printStyleRule((CSSStyleRule) rule, trivia));
      } else {
        blocks.add(printAtRule(rule.getAsCSSString(settings, 0), trivia.commentsOf(rule)));
      }
    }

    List<String> dangling = Lists.newArrayList();
    for (CssComment comment : trivia.getDangling()) {
      dangling.add(comment.getText());
    }
    addBlock(blocks, dangling);

    if (blocks.isEmpty()) {
      return "";
    }
    return Joiner.on("\n\n").join(blocks) + "\n";
  }


  String printDeclaration(CSSDeclaration declaration) {
    StringBuilder builder = new StringBuilder();
    builder.append(declaration.getProperty()).append(": ");
    builder.append(declaration.getExpression().getAsCSSString(settings, 0));
    if (declaration.isImportant()) {
      builder.append(" !important");
    }
    return builder.append(';').toString();
  }


  private String printImport(CSSImportRule rule, NodeComments comments) {
    StringBuilder builder = new StringBuilder("@import \"");
    builder.append(rule.getLocationString().replace("\"", "\\\"")).append('"');
    List<String> media = Lists.newArrayList();
    for (CSSMediaQuery query : rule.getAllMediaQueries()) {
      media.add(query.getAsCSSString(settings, 0));
    }
    if (!media.isEmpty()) {
      builder.append(' ').append(Joiner.on(", ").join(media));
    }
    builder.append(';');
    return printAtRule(builder.toString(), comments);
  }


  private String printAtRule(String rendered, NodeComments comments) {
    CommentPlacer placer = new CommentPlacer(rendered.trim());
    placer.placeTrailing(comments.selectorTrailing, 0, "@");
    placer.placeTrailing(comments.trailing, placer.lastLine(), "@");
    placer.placeLeading(comments.leading, 0, "", "@");
    return placer.getText();
  }


  private String printStyleRule(CSSStyleRule rule, CssTrivia trivia) {
    String selector = CssSelectors.render(rule, settings);
    List<String> lines = Lists.newArrayList();
    lines.add(selector + " {");
    for (CSSDeclaration declaration : rule.getAllDeclarations()) {
      lines.add(INDENT + printDeclaration(declaration));
    }
    lines.add("}");

    CommentPlacer placer = new CommentPlacer(Joiner.on('\n').join(lines));
    NodeComments comments = trivia.commentsOf(rule);
    placer.placeTrailing(comments.selectorTrailing, placer.findLine(selector, 0), selector);

    int from = 1;
    for (CSSDeclaration declaration : rule.getAllDeclarations()) {
      String anchor = declaration.getProperty() + ":";
      int line = placer.findLine(anchor, from);
      NodeComments declarationComments = trivia.commentsOf(declaration);
      if (line >= 0) {
        line += placer.placeLeading(declarationComments.leading, line, INDENT, anchor);
        from = line + 1;
      } else {
        placer.placeLeading(declarationComments.leading, line, INDENT, anchor);
      }
      placer.placeTrailing(declarationComments.trailing, line, anchor);
    }

    int close = placer.findLastLine("}");
    close += placer.placeLeading(comments.bodyEnd, close, INDENT, "}");
    placer.placeTrailing(comments.trailing, close, "}");
    placer.placeLeading(comments.leading, 0, "", selector);
    return placer.getText();
  }


  private static void addBlock(List<String> blocks, List<String> lines) {
    if (!lines.isEmpty()) {
      blocks.add(Joiner.on('\n').join(lines));
    }
  }
}
