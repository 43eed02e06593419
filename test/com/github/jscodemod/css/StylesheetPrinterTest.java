package com.github.jscodemod.css;

import junit.framework.TestCase;

import com.github.jscodemod.CodemodException;

public class StylesheetPrinterTest extends TestCase {

  private CssTreeAdapter adapter;


  @Override
  protected void setUp() throws Exception {
    super.setUp();
    adapter = new CssTreeAdapter();
  }


  private String code(String... codes) {
    StringBuilder builder = new StringBuilder();
    for (String code : codes) {
      builder.append(code + "\n");
    }
    return builder.toString();
  }


  private String format(String source) throws CodemodException {
    return adapter.emit(adapter.parse(source));
  }


  public void testStyleRuleLayout() throws CodemodException {
    assertEquals(
        code(
            "a {",
            "  color: red;",
            "  margin: 0;",
            "}"),
        format("a{color:red;margin:0}"));
  }


  public void testImportant() throws CodemodException {
    assertEquals(
        code(
            "a {",
            "  color: red !important;",
            "}"),
        format("a { color: red !important }"));
  }


  public void testImportsComeFirst() throws CodemodException {
    assertEquals(
        code(
            "@import \"a.css\";",
            "@import \"b.css\";",
            "",
            "b {",
            "  color: blue;",
            "}"),
        format("@import \"a.css\";\n@import url(\"b.css\");\nb { color: blue; }"));
  }


  public void testRulesAreSeparatedByEmptyLines() throws CodemodException {
    assertEquals(
        code(
            "a {",
            "  color: red;",
            "}",
            "",
            "b {",
            "  color: blue;",
            "}"),
        format("a { color: red; } b { color: blue; }"));
  }


  public void testCommentsKeepTheirPlace() throws CodemodException {
    String source = code(
        "/* header */",
        "a {",
        "  /* lead */",
        "  color: red; /* why */",
        "  /* end */",
        "} /* after */");
    assertEquals(source, format(source));
  }


  public void testSelectorComment() throws CodemodException {
    String source = code(
        ".scroll { /* hide the bar */",
        "  display: none;",
        "}");
    assertEquals(source, format(source));
  }


  public void testCommentsOnOneLineRule() throws CodemodException {
    assertEquals(
        code(
            "a {",
            "  color: red; /* why */",
            "}"),
        format("a { color: red; /* why */ }"));
  }


  public void testDanglingComments() throws CodemodException {
    assertEquals(
        code(
            "a {",
            "  color: red;",
            "}",
            "",
            "/* the end */"),
        format("a { color: red; }\n/* the end */"));
  }


  public void testEmptyStylesheet() throws CodemodException {
    assertEquals("", format("   "));
  }
}
