package com.github.jscodemod.javascript;

import java.util.Collection;
import java.util.List;
import java.util.logging.Logger;

import com.github.jscodemod.CodemodDiagnostics;
import com.github.jscodemod.CodemodException;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.javascript.rhino.Node;

/**
 * Queries, inserts and removes top level import declarations. Two imports are
 * the same iff their module specifiers are equal strings.
 */
final class ImportManager {

  private static final Logger logger = Logger.getLogger(ImportManager.class.getName());

  private final JsTreeAdapter adapter;


  ImportManager(JsTreeAdapter adapter) {
    this.adapter = adapter;
  }


  boolean isImported(JsTree tree, String specifier) {
    return findImport(tree.statementContainer(), specifier) != null;
  }


  /**
   * Inserts the imports given one per line in {@code candidateText}, a line
   * may hold several. Each new
   * import goes right after the last import declaration, or first when there
   * is none. An import of an already imported module is skipped. Nothing is
   * inserted if any line fails.
   */
  void insert(JsTree tree, String candidateText) throws CodemodException {
    List<Node> candidates = parseCandidates(candidateText);
    Node container = tree.statementContainer();

    for (Node candidate : candidates) {
      String specifier = JsPatterns.importSpecifier(candidate);
      if (findImport(container, specifier) != null) {
        logger.fine("Skip import of " + specifier + ", it is already imported.");
        continue;
      }
      Node lastImport = findLastImport(container);
      if (lastImport == null) {
        container.addChildToFront(candidate);
      } else {
        candidate.insertAfter(lastImport);
      }
    }
  }


  /**
   * Removes every top level import of the given modules.
   */
  void remove(JsTree tree, Collection<String> specifiers) {
    ImmutableSet<String> removals = ImmutableSet.copyOf(specifiers);
    Node container = tree.statementContainer();
    List<Node> targets = Lists.newArrayList();
    for (Node statement = container.getFirstChild(); statement != null; statement = statement.getNext()) {
      if (statement.isImport() && removals.contains(JsPatterns.importSpecifier(statement))) {
        targets.add(statement);
      }
    }
    for (Node target : targets) {
      target.detach();
    }
  }


  private List<Node> parseCandidates(String candidateText) throws CodemodException {
    List<Node> candidates = Lists.newArrayList();
    for (String line : Splitter.on('\n').trimResults().omitEmptyStrings().split(candidateText)) {
      JsTree parsed;
      try {
        parsed = adapter.parse("import-line.js", line);
      } catch (CodemodException e) {
        throw new CodemodException(CodemodDiagnostics.IMPORT_LINE_PARSE_FAILURE, line);
      }
      List<Node> imports = Lists.newArrayList();
      for (Node statement = parsed.statementContainer().getFirstChild(); statement != null;
          statement = statement.getNext()) {
        if (statement.isImport()) {
          imports.add(statement);
        }
      }
      if (imports.isEmpty()) {
        throw new CodemodException(CodemodDiagnostics.IMPORT_LINE_WITHOUT_IMPORT, line);
      }
      for (Node importNode : imports) {
        candidates.add(importNode.detach());
      }
    }
    return candidates;
  }


  private static Node findImport(Node container, String specifier) {
    for (Node statement = container.getFirstChild(); statement != null; statement = statement.getNext()) {
      if (JsPatterns.isImportOf(statement, specifier)) {
        return statement;
      }
    }
    return null;
  }


  private static Node findLastImport(Node container) {
    Node last = null;
    for (Node statement = container.getFirstChild(); statement != null; statement = statement.getNext()) {
      if (statement.isImport()) {
        last = statement;
      }
    }
    return last;
  }
}
