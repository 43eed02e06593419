package com.github.jscodemod.javascript;

import com.google.javascript.jscomp.NodeTraversal;
import com.google.javascript.jscomp.NodeTraversal.AbstractPostOrderCallback;
import com.google.javascript.rhino.Node;

/**
 * Counts functions, classes, debugger statements, imports, try and throw
 * statements in one read only traversal.
 */
final class StatisticsCollector extends AbstractPostOrderCallback {

  private int functions = 0;

  private int classes = 0;

  private int debuggers = 0;

  private int imports = 0;

  private int trys = 0;

  private int throwStatements = 0;


  private StatisticsCollector() {}


  static Statistics collect(JsTree tree) {
    StatisticsCollector collector = new StatisticsCollector();
    NodeTraversal.traverse(tree.getCompiler(), tree.getRoot(), collector);
    return new Statistics(collector.functions, collector.classes, collector.debuggers,
        collector.imports, collector.trys, collector.throwStatements);
  }


  @Override
  public void visit(NodeTraversal t, Node n, Node parent) {
    switch (n.getToken()) {
      case FUNCTION:
        if (!n.isArrowFunction()) {
          functions++;
        }
        break;
      case CLASS:
        classes++;
        break;
      case DEBUGGER:
        debuggers++;
        break;
      case IMPORT:
        imports++;
        break;
      case TRY:
        trys++;
        break;
      case THROW:
        throwStatements++;
        break;
      default:
        break;
    }
  }
}
