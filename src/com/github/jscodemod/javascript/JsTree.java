package com.github.jscodemod.javascript;

import com.google.common.base.Preconditions;
import com.google.javascript.jscomp.Compiler;
import com.google.javascript.rhino.Node;

/**
 * A parsed JavaScript source together with the compiler that owns it. The tree
 * is mutated in place by one pass and then emitted.
 */
public final class JsTree {

  private final Compiler compiler;

  private final Node root;


  JsTree(Compiler compiler, Node root) {
    Preconditions.checkArgument(root.isScript());
    this.compiler = compiler;
    this.root = root;
  }


  public Compiler getCompiler() {
    return compiler;
  }


  public Node getRoot() {
    return root;
  }


  /**
   * @return the node holding top level statements, the MODULE_BODY of an ES
   *         module or the SCRIPT itself.
   */
  Node statementContainer() {
    Node first = root.getFirstChild();
    if (first != null && first.isModuleBody()) {
      return first;
    }
    return root;
  }
}
