package com.github.jscodemod.css;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

import com.github.jscodemod.css.CssTriviaScanner.Declaration;
import com.github.jscodemod.css.CssTriviaScanner.Kind;
import com.github.jscodemod.css.CssTriviaScanner.Statement;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import com.google.common.collect.Multiset;
import com.helger.css.decl.CSSDeclaration;
import com.helger.css.decl.CSSStyleRule;
import com.helger.css.decl.CascadingStyleSheet;

/**
 * Comments of a stylesheet keyed by the parsed node they annotate. Nodes are
 * compared by identity, so comments follow their rule or declaration through
 * edits and vanish with it when it is removed.
 */
final class CssTrivia {

  private static final Logger logger = Logger.getLogger(CssTrivia.class.getName());

  private final Map<Object, NodeComments> comments = Maps.newIdentityHashMap();

  private final List<CssComment> dangling;


  private CssTrivia(List<CssComment> dangling) {
    this.dangling = ImmutableList.copyOf(dangling);
  }


  static CssTrivia bind(CascadingStyleSheet sheet, CssTriviaScanner.Result scanned) {
    CssTrivia trivia = new CssTrivia(scanned.dangling);
    for (Statement charset : scanned.statementsOf(Kind.CHARSET)) {
      logger.fine("The @charset rule is not printed"
          + (charset.comments.isEmpty() ? "." : ", nor are its comments."));
    }
    trivia.bindStatements("@import", sheet.getAllImportRules(), scanned.statementsOf(Kind.IMPORT));
    trivia.bindStatements("@namespace", sheet.getAllNamespaceRules(), scanned.statementsOf(Kind.NAMESPACE));
    trivia.bindStatements("rule", sheet.getAllRules(), scanned.statementsOf(Kind.RULE));
    return trivia;
  }


  NodeComments commentsOf(Object node) {
    NodeComments nodeComments = comments.get(node);
    return nodeComments == null ? NodeComments.NONE : nodeComments;
  }


  List<CssComment> getDangling() {
    return dangling;
  }


  private void bindStatements(String category, List<?> nodes, List<Statement> statements) {
    if (nodes.size() != statements.size()) {
      logger.warning("Found " + statements.size() + " " + category + " statements in the text but "
          + nodes.size() + " were parsed, their comments are not kept.");
      return;
    }
    for (int i = 0; i < nodes.size(); i++) {
      Object node = nodes.get(i);
      Statement statement = statements.get(i);
      put(node, statement.comments);
      if (node instanceof CSSStyleRule && statement.styleRule) {
        bindDeclarations((CSSStyleRule) node, statement.declarations);
      }
    }
  }


  private void bindDeclarations(CSSStyleRule rule, List<Declaration> scanned) {
    List<CSSDeclaration> declarations = rule.getAllDeclarations();
    if (declarations.size() == scanned.size()) {
      for (int i = 0; i < declarations.size(); i++) {
        put(declarations.get(i), scanned.get(i).comments);
      }
      return;
    }

    // Counts differ, pair the n-th declaration of a property with the n-th parsed one.
    Map<String, CSSDeclaration> byKey = Maps.newHashMap();
    Multiset<String> seen = HashMultiset.create();
    for (CSSDeclaration declaration : declarations) {
      String property = declaration.getProperty().toLowerCase(Locale.ROOT);
      byKey.put(property + "#" + seen.add(property, 1), declaration);
    }
    seen.clear();
    for (Declaration declaration : scanned) {
      CSSDeclaration match = byKey.get(declaration.property + "#" + seen.add(declaration.property, 1));
      if (match != null) {
        put(match, declaration.comments);
      } else if (!declaration.comments.isEmpty()) {
        logger.fine("No parsed declaration for " + declaration.property + ", its comments are not kept.");
      }
    }
  }


  private void put(Object node, NodeComments nodeComments) {
    if (!nodeComments.isEmpty()) {
      comments.put(node, nodeComments);
    }
  }
}
