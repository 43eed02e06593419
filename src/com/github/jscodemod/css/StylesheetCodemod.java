package com.github.jscodemod.css;

import java.util.Collection;
import java.util.List;
import java.util.logging.Logger;

import com.github.jscodemod.CodemodException;
import com.github.jscodemod.Response;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Entry point for stylesheet edits. Every call parses its own stylesheet,
 * applies one operation and answers with a {@link Response}.
 */
public final class StylesheetCodemod {

  private static final Logger logger = Logger.getLogger(StylesheetCodemod.class.getName());

  private final CssTreeAdapter adapter;


  public StylesheetCodemod() {
    this(new CssTreeAdapter());
  }


  public StylesheetCodemod(CssTreeAdapter adapter) {
    this.adapter = Preconditions.checkNotNull(adapter);
  }


  public Response<Boolean> isImported(String source, String url) {
    try {
      CssTree tree = adapter.parse(source);
      return Response.ok(CssOperation.IMPORTED, new CssImportManager(adapter).isImported(tree.getSheet(), url));
    } catch (CodemodException e) {
      return failure(CssOperation.IMPORTED, e);
    }
  }


  /**
   * @param importLines one {@code @import} rule per line.
   */
  public Response<String> insertImports(String source, String importLines) {
    try {
      CssTree tree = adapter.parse(source);
      new CssImportManager(adapter).insert(tree, importLines);
      return Response.ok(CssOperation.INSERT_IMPORTS, adapter.emit(tree));
    } catch (CodemodException e) {
      return failure(CssOperation.INSERT_IMPORTS, e);
    }
  }


  public Response<String> removeImports(String source, Collection<String> urls) {
    try {
      CssTree tree = adapter.parse(source);
      new CssImportManager(adapter).remove(tree, urls);
      return Response.ok(CssOperation.REMOVE_IMPORTS, adapter.emit(tree));
    } catch (CodemodException e) {
      return failure(CssOperation.REMOVE_IMPORTS, e);
    }
  }


  /**
   * @param declarations declarations such as {@code "display: none"}.
   */
  public Response<String> extendRule(String source, String selector, List<String> declarations) {
    try {
      CssTree tree = adapter.parse(source);
      new CssRuleExtender(adapter).extend(tree, selector, ImmutableList.copyOf(declarations));
      return Response.ok(CssOperation.EXTEND_RULE, adapter.emit(tree));
    } catch (CodemodException e) {
      return failure(CssOperation.EXTEND_RULE, e);
    }
  }


  public Response<String> removeDeclarations(String source, String selector, Collection<String> properties) {
    try {
      CssTree tree = adapter.parse(source);
      new CssRuleExtender(adapter).removeDeclarations(tree, selector, properties);
      return Response.ok(CssOperation.REMOVE_DECLARATIONS, adapter.emit(tree));
    } catch (CodemodException e) {
      return failure(CssOperation.REMOVE_DECLARATIONS, e);
    }
  }


  public Response<String> format(String source) {
    try {
      return Response.ok(CssOperation.FORMAT, adapter.emit(adapter.parse(source)));
    } catch (CodemodException e) {
      return failure(CssOperation.FORMAT, e);
    }
  }


  public Response<Boolean> isFormatted(String source) {
    try {
      String formatted = adapter.emit(adapter.parse(source));
      return Response.ok(CssOperation.IS_FORMATTED, formatted.trim().equals(source.trim()));
    } catch (CodemodException e) {
      return failure(CssOperation.IS_FORMATTED, e);
    }
  }


  private static <T> Response<T> failure(CssOperation operation, CodemodException e) {
    logger.fine(operation.getName() + " failed: " + e.getMessage());
    return Response.error(operation, e.getMessage());
  }
}
