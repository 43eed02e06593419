package com.github.jscodemod.css;

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * The comments attached to one rule or declaration.
 */
final class NodeComments {

  /** Shared by every node without comments, so it cannot be added to. */
  static final NodeComments NONE = new NodeComments(ImmutableList.<CssComment>of(),
      ImmutableList.<CssComment>of(), ImmutableList.<CssComment>of(), ImmutableList.<CssComment>of());

  /** Own line comments right before the node. */
  final List<CssComment> leading;

  /** Comments after the node on its last line. */
  final List<CssComment> trailing;

  /** Comments after a selector, up to the end of the line holding the opening brace. */
  final List<CssComment> selectorTrailing;

  /** Own line comments after the last declaration of a rule body. */
  final List<CssComment> bodyEnd;


  NodeComments() {
    this(Lists.<CssComment>newArrayList(), Lists.<CssComment>newArrayList(),
        Lists.<CssComment>newArrayList(), Lists.<CssComment>newArrayList());
  }


  private NodeComments(List<CssComment> leading, List<CssComment> trailing,
      List<CssComment> selectorTrailing, List<CssComment> bodyEnd) {
    this.leading = leading;
    this.trailing = trailing;
    this.selectorTrailing = selectorTrailing;
    this.bodyEnd = bodyEnd;
  }


  boolean isEmpty() {
    return leading.isEmpty() && trailing.isEmpty() && selectorTrailing.isEmpty() && bodyEnd.isEmpty();
  }
}
