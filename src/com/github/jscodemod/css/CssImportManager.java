package com.github.jscodemod.css;

import java.util.Collection;
import java.util.List;
import java.util.logging.Logger;

import com.github.jscodemod.CodemodDiagnostics;
import com.github.jscodemod.CodemodException;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.helger.css.decl.CSSImportRule;
import com.helger.css.decl.CascadingStyleSheet;

/**
 * Queries, inserts and removes {@code @import} rules. Two imports are the same
 * iff their URLs are equal strings, whether written as {@code "x"} or
 * {@code url("x")}.
 */
final class CssImportManager {

  private static final Logger logger = Logger.getLogger(CssImportManager.class.getName());

  private final CssTreeAdapter adapter;


  CssImportManager(CssTreeAdapter adapter) {
    this.adapter = adapter;
  }


  boolean isImported(CascadingStyleSheet sheet, String url) {
    return findImport(sheet, url) != null;
  }


  /**
   * Adds the imports given one per line after the existing ones. Nothing is
   * added if any line fails.
   */
  void insert(CssTree tree, String candidateText) throws CodemodException {
    List<CSSImportRule> candidates = parseCandidates(candidateText);
    CascadingStyleSheet sheet = tree.getSheet();
    for (CSSImportRule candidate : candidates) {
      if (findImport(sheet, candidate.getLocationString()) != null) {
        logger.fine("Skip import of " + candidate.getLocationString() + ", it is already imported.");
        continue;
      }
      sheet.addImportRule(candidate);
    }
  }


  void remove(CssTree tree, Collection<String> urls) {
    ImmutableSet<String> removals = ImmutableSet.copyOf(urls);
    CascadingStyleSheet sheet = tree.getSheet();
    List<CSSImportRule> targets = Lists.newArrayList();
    for (CSSImportRule rule : sheet.getAllImportRules()) {
      if (removals.contains(rule.getLocationString())) {
        targets.add(rule);
      }
    }
    for (CSSImportRule target : targets) {
      sheet.removeImportRule(target);
    }
  }


  private List<CSSImportRule> parseCandidates(String candidateText) throws CodemodException {
    List<CSSImportRule> candidates = Lists.newArrayList();
    for (String line : Splitter.on('\n').trimResults().omitEmptyStrings().split(candidateText)) {
      CascadingStyleSheet parsed;
      try {
        parsed = adapter.read(line);
      } catch (CodemodException e) {
        throw new CodemodException(CodemodDiagnostics.CSS_IMPORT_LINE_PARSE_FAILURE, line);
      }
      if (parsed.getAllImportRules().isEmpty()) {
        throw new CodemodException(CodemodDiagnostics.CSS_IMPORT_LINE_WITHOUT_IMPORT, line);
      }
      candidates.addAll(parsed.getAllImportRules());
    }
    return candidates;
  }


  private static CSSImportRule findImport(CascadingStyleSheet sheet, String url) {
    for (CSSImportRule rule : sheet.getAllImportRules()) {
      if (rule.getLocationString().equals(url)) {
        return rule;
      }
    }
    return null;
  }
}
