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
import com.google.javascript.rhino.IR;
import com.google.javascript.rhino.Node;

/**
 * Edits the hooks object passed to a socket constructor.
 *
 * <pre>
 * <code>let liveSocket = new LiveSocket("/live", Socket, {hooks: {...Hooks, A}, x: 1});</code>
 * </pre>
 *
 * extended by {@code ["A", "B"]} becomes
 *
 * <pre>
 * <code>let liveSocket = new LiveSocket("/live", Socket, {hooks: {...Hooks, A, B}, x: 1});</code>
 * </pre>
 *
 * A missing hooks property is appended to the options object first.
 */
final class HookObjectExtender {

  private static final Logger logger = Logger.getLogger(HookObjectExtender.class.getName());

  private final JsTree tree;

  private final HookTarget target;


  HookObjectExtender(JsTree tree, HookTarget target) {
    this.tree = tree;
    this.target = target;
  }


  private interface Rewriter {
    public void rewrite(Node hooks);
  }


  /**
   * @return whether the target variable is initialized by a constructor call
   *         with an options object. The tree is left untouched.
   */
  boolean findMarker() {
    return collect().condition.getKind() == FindCondition.Kind.FOUND;
  }


  void extend(List<String> names) throws CodemodException {
    rewrite(new ExtendRewriter(ObjectLiterals.parseEntries(names)), true);
  }


  void remove(Collection<String> names) throws CodemodException {
    Set<String> keys = Sets.newHashSet();
    for (PropertyEntry entry : ObjectLiterals.parseEntries(names)) {
      keys.add(entry.getKey());
    }
    rewrite(new RemoveRewriter(keys), false);
  }


  private SocketCollector collect() {
    SocketCollector collector = new SocketCollector();
    NodeTraversal.traverse(tree.getCompiler(), tree.getRoot(), collector);
    return collector;
  }


  private void rewrite(Rewriter rewriter, boolean createHooks) throws CodemodException {
    SocketCollector collector = collect();
    collector.condition.checkFound();
    Node options = collector.options;

    Node hooksKey = JsPatterns.findStringKey(options, target.getHooksKey());
    if (hooksKey == null) {
      if (!createHooks) {
        logger.fine("No " + target.getHooksKey() + " property, nothing to remove.");
        return;
      }
      hooksKey = IR.stringKey(target.getHooksKey(), IR.objectlit());
      options.addChildToBack(hooksKey);
    }

    Node hooks = hooksKey.getFirstChild();
    if (!hooks.isObjectLit()) {
      throw new CodemodException(CodemodDiagnostics.HOOKS_NOT_AN_OBJECT_LITERAL,
          target.getHooksKey(), target.getConstructorName());
    }
    rewriter.rewrite(hooks);
  }


  private final class SocketCollector extends AbstractPreOrderCallback {

    private final FindCondition condition =
        new FindCondition(CodemodDiagnostics.VARIABLE_NOT_FOUND, target.getVariableName());

    private Node options;


    @Override
    public boolean shouldTraverse(NodeTraversal t, Node n, Node parent) {
      // Declarations are matched before their initializers, in source order.
      if (condition.isSettled()) {
        return false;
      }
      Node name = JsPatterns.declaredName(n, target.getVariableName());
      if (name == null) {
        return true;
      }
      Node initializer = name.getFirstChild();
      if (!JsPatterns.isNewCallTo(initializer, target.getConstructorName())) {
        condition.foundError(CodemodDiagnostics.NOT_A_CONSTRUCTOR_CALL,
            target.getVariableName(), target.getConstructorName());
        return false;
      }
      Node objectLit = JsPatterns.trailingObjectLiteralArgument(initializer);
      if (objectLit == null) {
        condition.foundError(CodemodDiagnostics.MISSING_OPTIONS_OBJECT,
            target.getVariableName(), target.getConstructorName());
        return false;
      }
      options = objectLit;
      condition.found();
      return false;
    }
  }


  private static final class ExtendRewriter implements Rewriter {

    private final List<PropertyEntry> entries;


    ExtendRewriter(List<PropertyEntry> entries) {
      this.entries = entries;
    }


    @Override
    public void rewrite(Node hooks) {
      // Keys present before this call, appended entries are not recorded.
      Set<String> existing = ObjectLiterals.keysOf(hooks);
      int appended = ObjectLiterals.append(hooks, entries, existing, false);
      logger.fine("Appended " + appended + " hooks.");
    }
  }


  private static final class RemoveRewriter implements Rewriter {

    private final Set<String> keys;


    RemoveRewriter(Set<String> keys) {
      this.keys = keys;
    }


    @Override
    public void rewrite(Node hooks) {
      int removed = ObjectLiterals.remove(hooks, keys);
      logger.fine("Removed " + removed + " hooks.");
    }
  }
}
