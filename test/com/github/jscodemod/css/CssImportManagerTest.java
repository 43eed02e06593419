package com.github.jscodemod.css;

import java.util.List;

import junit.framework.TestCase;

import com.github.jscodemod.CodemodException;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.helger.css.decl.CSSImportRule;

public class CssImportManagerTest extends TestCase {

  private CssTreeAdapter adapter;

  private CssImportManager importManager;


  @Override
  protected void setUp() throws Exception {
    super.setUp();
    adapter = new CssTreeAdapter();
    importManager = new CssImportManager(adapter);
  }


  private List<String> importsOf(String source) throws CodemodException {
    List<String> urls = Lists.newArrayList();
    for (CSSImportRule rule : adapter.parse(source).getSheet().getAllImportRules()) {
      urls.add(rule.getLocationString());
    }
    return urls;
  }


  private String insert(String source, String candidates) throws CodemodException {
    CssTree tree = adapter.parse(source);
    importManager.insert(tree, candidates);
    return adapter.emit(tree);
  }


  public void testIsImported() throws CodemodException {
    CssTree tree = adapter.parse("@import \"tailwindcss/base\";\n@import url(\"./components.css\");\n");
    assertTrue(importManager.isImported(tree.getSheet(), "tailwindcss/base"));
    assertTrue(importManager.isImported(tree.getSheet(), "./components.css"));
    assertFalse(importManager.isImported(tree.getSheet(), "tailwindcss/utilities"));
  }


  public void testInsertAfterExistingImports() throws CodemodException {
    String output = insert(
        "@import \"a.css\";\nbody { margin: 0; }\n",
        "@import \"b.css\";\n\n@import url(\"a.css\");\n@import \"c.css\";");
    assertEquals(ImmutableList.of("a.css", "b.css", "c.css"), importsOf(output));
    assertTrue(output.startsWith("@import \"a.css\";\n@import \"b.css\";\n@import \"c.css\";\n"));
  }


  public void testInsertIsIdempotent() throws CodemodException {
    String once = insert("body { margin: 0; }", "@import \"a.css\";");
    assertEquals(once, insert(once, "@import \"a.css\";"));
  }


  public void testInsertKeepsImportComments() throws CodemodException {
    String output = insert("/* base */\n@import \"a.css\"; /* reset */\n", "@import \"b.css\";");
    assertEquals("/* base */\n@import \"a.css\"; /* reset */\n@import \"b.css\";\n", output);
  }


  public void testInsertFailsOnLineWithoutImport() throws CodemodException {
    CssTree tree = adapter.parse("@import \"a.css\";");
    try {
      importManager.insert(tree, "@import \"b.css\";\nbody { margin: 0; }");
      fail("Expected a CodemodException");
    } catch (CodemodException e) {
      assertEquals("No @import rule found in parsed import line: body { margin: 0; }", e.getMessage());
    }
    assertEquals(ImmutableList.of("a.css"), importsOf(adapter.emit(tree)));
  }


  public void testRemove() throws CodemodException {
    CssTree tree = adapter.parse("@import \"a.css\";\n@import \"b.css\";\n@import \"c.css\";\n");
    importManager.remove(tree, ImmutableList.of("b.css", "missing.css"));
    assertEquals(ImmutableList.of("a.css", "c.css"), importsOf(adapter.emit(tree)));
  }
}
