package com.github.jscodemod.css;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Logger;

import com.github.jscodemod.CodemodDiagnostics;
import com.github.jscodemod.CodemodException;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import com.helger.css.decl.CSSDeclaration;
import com.helger.css.decl.CSSStyleRule;
import com.helger.css.decl.CascadingStyleSheet;
import com.helger.css.decl.ICSSTopLevelRule;

/**
 * Adds declarations to and removes declarations from the top level style rule
 * with a given selector. Properties compare case insensitively.
 */
final class CssRuleExtender {

  private static final Logger logger = Logger.getLogger(CssRuleExtender.class.getName());

  private final CssTreeAdapter adapter;


  CssRuleExtender(CssTreeAdapter adapter) {
    this.adapter = adapter;
  }


  /**
   * Adds every declaration whose property the rule does not have yet. A missing
   * rule is appended to the stylesheet.
   */
  void extend(CssTree tree, String selector, List<String> declarations) throws CodemodException {
    CSSStyleRule parsedRule = parseSelector(selector);
    List<CSSDeclaration> additions = parseDeclarations(declarations);

    CascadingStyleSheet sheet = tree.getSheet();
    CSSStyleRule rule = findRule(sheet, CssSelectors.render(parsedRule, adapter.getWriterSettings()));
    if (rule == null) {
      logger.fine("No rule for " + selector + ", appending one.");
      rule = parsedRule;
      sheet.addRule(rule);
    }

    Set<String> properties = propertiesOf(rule);
    for (CSSDeclaration declaration : additions) {
      if (properties.add(declaration.getProperty().toLowerCase(Locale.ROOT))) {
        rule.addDeclaration(declaration);
      }
    }
  }


  /**
   * Removes the declarations of the given properties.
   *
   * @throws CodemodException if no rule has the selector.
   */
  void removeDeclarations(CssTree tree, String selector, Collection<String> properties)
      throws CodemodException {
    CSSStyleRule parsedRule = parseSelector(selector);
    CSSStyleRule rule = findRule(tree.getSheet(), CssSelectors.render(parsedRule, adapter.getWriterSettings()));
    if (rule == null) {
      throw new CodemodException(CodemodDiagnostics.RULE_NOT_FOUND, selector);
    }

    Set<String> removals = Sets.newHashSet();
    for (String property : properties) {
      removals.add(property.trim().toLowerCase(Locale.ROOT));
    }
    List<CSSDeclaration> targets = Lists.newArrayList();
    for (CSSDeclaration declaration : rule.getAllDeclarations()) {
      if (removals.contains(declaration.getProperty().toLowerCase(Locale.ROOT))) {
        targets.add(declaration);
      }
    }
    for (CSSDeclaration target : targets) {
      rule.removeDeclaration(target);
    }
  }


  CSSStyleRule findRule(CascadingStyleSheet sheet, String selector) {
    String normalized = CssSelectors.normalize(selector);
    for (ICSSTopLevelRule candidate : sheet.getAllRules()) {
      if (candidate instanceof CSSStyleRule) {
        CSSStyleRule rule = (CSSStyleRule) candidate;
        if (CssSelectors.normalize(CssSelectors.render(rule, adapter.getWriterSettings())).equals(normalized)) {
          return rule;
        }
      }
    }
    return null;
  }


  private CSSStyleRule parseSelector(String selector) throws CodemodException {
    List<CSSStyleRule> rules;
    try {
      rules = styleRulesOf(adapter.read(selector + " {}"));
    } catch (CodemodException e) {
      throw new CodemodException(CodemodDiagnostics.INVALID_SELECTOR, selector);
    }
    if (rules.size() != 1) {
      throw new CodemodException(CodemodDiagnostics.INVALID_SELECTOR, selector);
    }
    return rules.get(0);
  }


  private List<CSSDeclaration> parseDeclarations(List<String> declarations) throws CodemodException {
    List<CSSDeclaration> result = Lists.newArrayList();
    for (String declaration : declarations) {
      List<CSSStyleRule> rules;
      try {
        rules = styleRulesOf(adapter.read("x { " + declaration + " }"));
      } catch (CodemodException e) {
        throw new CodemodException(CodemodDiagnostics.INVALID_DECLARATION, declaration);
      }
      if (rules.size() != 1 || rules.get(0).getAllDeclarations().isEmpty()) {
        throw new CodemodException(CodemodDiagnostics.INVALID_DECLARATION, declaration);
      }
      result.addAll(rules.get(0).getAllDeclarations());
    }
    return result;
  }


  private static Set<String> propertiesOf(CSSStyleRule rule) {
    Set<String> properties = Sets.newHashSet();
    for (CSSDeclaration declaration : rule.getAllDeclarations()) {
      properties.add(declaration.getProperty().toLowerCase(Locale.ROOT));
    }
    return properties;
  }


  private static List<CSSStyleRule> styleRulesOf(CascadingStyleSheet sheet) {
    List<CSSStyleRule> rules = Lists.newArrayList();
    for (ICSSTopLevelRule rule : sheet.getAllRules()) {
      if (rule instanceof CSSStyleRule) {
        rules.add((CSSStyleRule) rule);
      }
    }
    return rules;
  }
}
