package com.github.jscodemod.css;

import java.util.List;
import java.util.logging.Logger;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.Lists;

/**
 * Puts comments back into regenerated text. A comment is placed relative to the
 * line that holds its anchor text; when no line does, it is dropped.
 */
final class CommentPlacer {

  private static final Logger logger = Logger.getLogger(CommentPlacer.class.getName());

  private final List<String> lines;


  CommentPlacer(String rendered) {
    this.lines = Lists.newArrayList(Splitter.on('\n').split(rendered));
  }


  /**
   * @return the index of the first line at or after {@code from} that starts
   *         with {@code anchor} once indentation is stripped, or -1.
   */
  int findLine(String anchor, int from) {
    for (int i = Math.max(from, 0); i < lines.size(); i++) {
      if (lines.get(i).trim().startsWith(anchor)) {
        return i;
      }
    }
    return -1;
  }


  int findLastLine(String anchor) {
    for (int i = lines.size() - 1; i >= 0; i--) {
      if (lines.get(i).trim().startsWith(anchor)) {
        return i;
      }
    }
    return -1;
  }


  int lastLine() {
    return lines.size() - 1;
  }


  /**
   * Inserts each comment on its own line before {@code line}.
   *
   * @return the number of inserted lines.
   */
  int placeLeading(List<CssComment> comments, int line, String indent, String anchor) {
    if (comments.isEmpty()) {
      return 0;
    }
    if (line < 0) {
      drop(comments, anchor);
      return 0;
    }
    for (int i = 0; i < comments.size(); i++) {
      lines.add(line + i, indent + comments.get(i).getText());
    }
    return comments.size();
  }


  /**
   * Appends each comment to {@code line} unless the line already holds it.
   */
  void placeTrailing(List<CssComment> comments, int line, String anchor) {
    if (comments.isEmpty()) {
      return;
    }
    if (line < 0) {
      drop(comments, anchor);
      return;
    }
    for (CssComment comment : comments) {
      String current = lines.get(line);
      if (!current.contains(comment.getText())) {
        lines.set(line, current + " " + comment.getText());
      }
    }
  }


  String getText() {
    return Joiner.on('\n').join(lines);
  }


  private static void drop(List<CssComment> comments, String anchor) {
    logger.fine("Dropped " + comments + ", no line starts with " + anchor);
  }
}
