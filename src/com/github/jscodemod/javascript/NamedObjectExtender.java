package com.github.jscodemod.javascript;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import com.github.jscodemod.CodemodDiagnostics;
import com.github.jscodemod.CodemodException;
import com.google.common.collect.Sets;
import com.google.javascript.jscomp.NodeTraversal;
import com.google.javascript.jscomp.NodeTraversal.AbstractPreOrderCallback;
import com.google.javascript.rhino.Node;

/**
 * Edits the object literal a named variable is initialized with.
 *
 * <pre>
 * <code>const Hooks = {A, ...Shared}</code>
 * </pre>
 *
 * extended by {@code ["B", "...Shared"]} becomes
 *
 * <pre>
 * <code>const Hooks = {A, ...Shared, B}</code>
 * </pre>
 */
final class NamedObjectExtender {

  private static final Logger logger = Logger.getLogger(NamedObjectExtender.class.getName());

  private final JsTree tree;


  NamedObjectExtender(JsTree tree) {
    this.tree = tree;
  }


  boolean containsVariable(String variableName) {
    DeclarationCollector collector = new DeclarationCollector(variableName);
    NodeTraversal.traverse(tree.getCompiler(), tree.getRoot(), collector);
    return collector.condition.isSettled();
  }


  void extend(String variableName, List<String> names) throws CodemodException {
    Node objectLit = findObjectLiteral(variableName);
    Set<String> keys = ObjectLiterals.keysOf(objectLit);
    int appended = ObjectLiterals.append(objectLit, ObjectLiterals.parseEntries(names), keys, true);
    logger.fine("Appended " + appended + " entries to " + variableName);
  }


  void remove(String variableName, Collection<String> names) throws CodemodException {
    Node objectLit = findObjectLiteral(variableName);
    Set<String> keys = Sets.newHashSet();
    for (PropertyEntry entry : ObjectLiterals.parseEntries(names)) {
      keys.add(entry.getKey());
    }
    int removed = ObjectLiterals.remove(objectLit, keys);
    logger.fine("Removed " + removed + " entries from " + variableName);
  }


  private Node findObjectLiteral(String variableName) throws CodemodException {
    DeclarationCollector collector = new DeclarationCollector(variableName);
    NodeTraversal.traverse(tree.getCompiler(), tree.getRoot(), collector);
    collector.condition.checkFound();
    return collector.objectLit;
  }


  private static final class DeclarationCollector extends AbstractPreOrderCallback {

    private final String variableName;

    private final FindCondition condition;

    private Node objectLit;


    DeclarationCollector(String variableName) {
      this.variableName = variableName;
      this.condition = new FindCondition(CodemodDiagnostics.VARIABLE_NOT_FOUND, variableName);
    }


    @Override
    public boolean shouldTraverse(NodeTraversal t, Node n, Node parent) {
      // Declarations are matched before their initializers, in source order.
      if (condition.isSettled()) {
        return false;
      }
      Node name = JsPatterns.declaredName(n, variableName);
      if (name == null) {
        return true;
      }
      Node initializer = name.getFirstChild();
      if (initializer != null && initializer.isObjectLit()) {
        objectLit = initializer;
        condition.found();
      } else {
        condition.foundError(CodemodDiagnostics.NOT_AN_OBJECT_LITERAL, variableName);
      }
      return false;
    }
  }
}
