package com.github.jscodemod.css;

import java.util.List;
import java.util.regex.Pattern;

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;
import com.helger.css.decl.CSSSelector;
import com.helger.css.decl.CSSStyleRule;
import com.helger.css.writer.CSSWriterSettings;

final class CssSelectors {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private static final Pattern COMBINATOR = Pattern.compile(" ?([>+~,]) ?");


  private CssSelectors() {}


  /**
   * Collapses whitespace and drops the spaces around combinators and commas,
   * {@code "ul  >li , a"} becomes {@code "ul>li,a"}.
   */
  static String normalize(String selector) {
    String collapsed = WHITESPACE.matcher(selector.trim()).replaceAll(" ");
    return COMBINATOR.matcher(collapsed).replaceAll("$1");
  }


  /**
   * @return the selector list of a rule as ph-css prints it.
   */
  static String render(CSSStyleRule rule, CSSWriterSettings settings) {
    List<String> selectors = Lists.newArrayList();
    for (CSSSelector selector : rule.getAllSelectors()) {
      selectors.add(selector.getAsCSSString(settings, 0));
    }
    return Joiner.on(", ").join(selectors);
  }
}
