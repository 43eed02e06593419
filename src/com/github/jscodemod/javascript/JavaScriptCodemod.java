package com.github.jscodemod.javascript;

import java.util.Collection;
import java.util.List;
import java.util.logging.Logger;

import com.github.jscodemod.CodemodException;
import com.github.jscodemod.Response;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Entry point for JavaScript edits. Every call parses its own tree, applies one
 * operation and answers with a {@link Response}; a failed call never yields
 * partially edited text.
 */
public final class JavaScriptCodemod {

  private static final Logger logger = Logger.getLogger(JavaScriptCodemod.class.getName());

  private final JsTreeAdapter adapter;

  private final HookTarget hookTarget;


  public JavaScriptCodemod() {
    this(new JsTreeAdapter(), HookTarget.LIVE_SOCKET);
  }


  public JavaScriptCodemod(JsTreeAdapter adapter, HookTarget hookTarget) {
    this.adapter = Preconditions.checkNotNull(adapter);
    this.hookTarget = Preconditions.checkNotNull(hookTarget);
  }


  public Response<Boolean> isModuleImported(String source, String specifier) {
    try {
      JsTree tree = adapter.parse(source);
      return Response.ok(JsOperation.MODULE_IMPORTED,
          new ImportManager(adapter).isImported(tree, specifier));
    } catch (CodemodException e) {
      return failure(JsOperation.MODULE_IMPORTED, e);
    }
  }


  /**
   * @param importLines one import declaration per line.
   */
  public Response<String> insertImports(String source, String importLines) {
    try {
      JsTree tree = adapter.parse(source);
      new ImportManager(adapter).insert(tree, importLines);
      return Response.ok(JsOperation.INSERT_IMPORTS, adapter.emit(tree));
    } catch (CodemodException e) {
      return failure(JsOperation.INSERT_IMPORTS, e);
    }
  }


  public Response<String> removeImports(String source, Collection<String> specifiers) {
    try {
      JsTree tree = adapter.parse(source);
      new ImportManager(adapter).remove(tree, specifiers);
      return Response.ok(JsOperation.REMOVE_IMPORTS, adapter.emit(tree));
    } catch (CodemodException e) {
      return failure(JsOperation.REMOVE_IMPORTS, e);
    }
  }


  public Response<Boolean> existLiveSocket(String source) {
    try {
      JsTree tree = adapter.parse(source);
      return Response.ok(JsOperation.EXIST_LIVE_SOCKET,
          new HookObjectExtender(tree, hookTarget).findMarker());
    } catch (CodemodException e) {
      return failure(JsOperation.EXIST_LIVE_SOCKET, e);
    }
  }


  /**
   * @param names hook names, a name with a leading {@code ...} is added as a
   *        spread entry.
   */
  public Response<String> extendHookObject(String source, List<String> names) {
    try {
      JsTree tree = adapter.parse(source);
      new HookObjectExtender(tree, hookTarget).extend(ImmutableList.copyOf(names));
      return Response.ok(JsOperation.EXTEND_HOOK_OBJECT, adapter.emit(tree));
    } catch (CodemodException e) {
      return failure(JsOperation.EXTEND_HOOK_OBJECT, e);
    }
  }


  public Response<String> removeObjectsFromHooks(String source, Collection<String> names) {
    try {
      JsTree tree = adapter.parse(source);
      new HookObjectExtender(tree, hookTarget).remove(names);
      return Response.ok(JsOperation.REMOVE_OBJECTS_FROM_HOOKS, adapter.emit(tree));
    } catch (CodemodException e) {
      return failure(JsOperation.REMOVE_OBJECTS_FROM_HOOKS, e);
    }
  }


  public Response<Statistics> statistics(String source) {
    try {
      return Response.ok(JsOperation.STATISTICS, StatisticsCollector.collect(adapter.parse(source)));
    } catch (CodemodException e) {
      return failure(JsOperation.STATISTICS, e);
    }
  }


  public Response<String> extendVarObject(String source, String variableName, List<String> names) {
    try {
      JsTree tree = adapter.parse(source);
      new NamedObjectExtender(tree).extend(variableName, ImmutableList.copyOf(names));
      return Response.ok(JsOperation.EXTEND_VAR_OBJECT, adapter.emit(tree));
    } catch (CodemodException e) {
      return failure(JsOperation.EXTEND_VAR_OBJECT, e);
    }
  }


  public Response<String> removeVarObject(String source, String variableName, Collection<String> names) {
    try {
      JsTree tree = adapter.parse(source);
      new NamedObjectExtender(tree).remove(variableName, names);
      return Response.ok(JsOperation.REMOVE_VAR_OBJECT, adapter.emit(tree));
    } catch (CodemodException e) {
      return failure(JsOperation.REMOVE_VAR_OBJECT, e);
    }
  }


  public Response<Boolean> existVar(String source, String variableName) {
    try {
      JsTree tree = adapter.parse(source);
      return Response.ok(JsOperation.EXIST_VAR, new NamedObjectExtender(tree).containsVariable(variableName));
    } catch (CodemodException e) {
      return failure(JsOperation.EXIST_VAR, e);
    }
  }


  public Response<String> format(String source) {
    try {
      return Response.ok(JsOperation.FORMAT, new JsFormatter(adapter).format(source));
    } catch (CodemodException e) {
      return failure(JsOperation.FORMAT, e);
    }
  }


  public Response<Boolean> isFormatted(String source) {
    try {
      return Response.ok(JsOperation.IS_FORMATTED, new JsFormatter(adapter).isFormatted(source));
    } catch (CodemodException e) {
      return failure(JsOperation.IS_FORMATTED, e);
    }
  }


  private static <T> Response<T> failure(JsOperation operation, CodemodException e) {
    logger.fine(operation.getName() + " failed: " + e.getMessage());
    return Response.error(operation, e.getMessage());
  }
}
