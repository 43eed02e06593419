package com.github.jscodemod.css;

import java.util.List;

import junit.framework.TestCase;

import com.github.jscodemod.css.CssTriviaScanner.Kind;
import com.github.jscodemod.css.CssTriviaScanner.Result;
import com.github.jscodemod.css.CssTriviaScanner.Statement;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

public class CssTriviaScannerTest extends TestCase {

  private String code(String... codes) {
    StringBuilder builder = new StringBuilder();
    for (String code : codes) {
      builder.append(code + "\n");
    }
    return builder.toString();
  }


  private List<String> texts(List<CssComment> comments) {
    List<String> texts = Lists.newArrayList();
    for (CssComment comment : comments) {
      texts.add(comment.getText());
    }
    return texts;
  }


  public void testStatementKinds() {
    Result result = CssTriviaScanner.scan(code(
        "@charset \"utf-8\";",
        "@import \"a.css\";",
        "@import url(\"b.css\") screen;",
        "@namespace svg url(http://www.w3.org/2000/svg);",
        "a { color: red; }",
        "@media screen { a { color: blue; } }"));
    assertEquals(1, result.statementsOf(Kind.CHARSET).size());
    assertEquals(2, result.statementsOf(Kind.IMPORT).size());
    assertEquals(1, result.statementsOf(Kind.NAMESPACE).size());
    List<Statement> rules = result.statementsOf(Kind.RULE);
    assertEquals(2, rules.size());
    assertTrue(rules.get(0).styleRule);
    assertFalse(rules.get(1).styleRule);
  }


  public void testLeadingAndTrailingRuleComments() {
    Result result = CssTriviaScanner.scan(code(
        "/* one */",
        "/* two */",
        "a { color: red; } /* after a */",
        "b { color: blue; }"));
    Statement a = result.statements.get(0);
    Statement b = result.statements.get(1);
    assertEquals(ImmutableList.of("/* one */", "/* two */"), texts(a.comments.leading));
    assertEquals(ImmutableList.of("/* after a */"), texts(a.comments.trailing));
    assertTrue(b.comments.isEmpty());
  }


  public void testDeclarationComments() {
    Result result = CssTriviaScanner.scan(code(
        "a { /* selector note */",
        "  /* lead */",
        "  color: red; /* why */",
        "  margin: 0",
        "  /* end */",
        "}"));
    Statement a = result.statements.get(0);
    assertEquals(ImmutableList.of("/* selector note */"), texts(a.comments.selectorTrailing));
    assertEquals(2, a.declarations.size());
    assertEquals("color", a.declarations.get(0).property);
    assertEquals(ImmutableList.of("/* lead */"), texts(a.declarations.get(0).comments.leading));
    assertEquals(ImmutableList.of("/* why */"), texts(a.declarations.get(0).comments.trailing));
    assertEquals("margin", a.declarations.get(1).property);
    assertTrue(a.declarations.get(1).comments.isEmpty());
    assertEquals(ImmutableList.of("/* end */"), texts(a.comments.bodyEnd));
  }


  public void testCommentMarkersInStringsAreNotComments() {
    Result result = CssTriviaScanner.scan(code(
        "a::before { content: \"/* not a comment */\"; }",
        "b { background: url(/*not*/x.png); }"));
    assertEquals(2, result.statements.size());
    assertTrue(result.statements.get(0).comments.isEmpty());
    assertTrue(result.statements.get(0).declarations.get(0).comments.isEmpty());
    assertEquals("background", result.statements.get(1).declarations.get(0).property);
  }


  public void testCommentsInAtRuleBlocksAreDropped() {
    Result result = CssTriviaScanner.scan(code(
        "@media screen {",
        "  /* inside */",
        "  a { color: red; }",
        "}",
        "b { color: blue; }"));
    assertEquals(2, result.statements.size());
    assertTrue(result.statements.get(0).comments.isEmpty());
    assertTrue(result.statements.get(1).comments.isEmpty());
  }


  public void testDanglingComments() {
    Result result = CssTriviaScanner.scan(code(
        "a { color: red; }",
        "/* the end */"));
    assertEquals(ImmutableList.of("/* the end */"), texts(result.dangling));
    assertTrue(result.statements.get(0).comments.isEmpty());
  }


  public void testUnterminatedComment() {
    Result result = CssTriviaScanner.scan("a { color: red; }\n/* open");
    assertEquals(ImmutableList.of("/* open"), texts(result.dangling));
  }
}
