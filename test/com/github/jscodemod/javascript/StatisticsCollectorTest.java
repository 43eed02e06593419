package com.github.jscodemod.javascript;

import junit.framework.TestCase;

import com.github.jscodemod.CodemodException;

public class StatisticsCollectorTest extends TestCase {

  private JsTreeAdapter adapter;


  @Override
  protected void setUp() throws Exception {
    super.setUp();
    adapter = new JsTreeAdapter();
  }


  private String code(String... codes) {
    StringBuilder builder = new StringBuilder();
    for (String code : codes) {
      builder.append(code + "\n");
    }
    return builder.toString();
  }


  private Statistics collect(String source) throws CodemodException {
    return StatisticsCollector.collect(adapter.parse(source));
  }


  public void testCounts() throws CodemodException {
    Statistics statistics = collect(code(
        "import a from \"a\";",
        "import {b} from \"b\";",
        "class Foo {}",
        "function bar() {",
        "  debugger;",
        "}",
        "debugger;"));
    assertEquals(new Statistics(1, 1, 2, 2, 0, 0), statistics);
    assertEquals(2, statistics.getImports());
    assertEquals(1, statistics.getClasses());
    assertEquals(2, statistics.getDebuggers());
    assertEquals(1, statistics.getFunctions());
    assertEquals(0, statistics.getTrys());
    assertEquals(0, statistics.getThrows());
  }


  public void testConstructorsAndMethodsAreFunctions() throws CodemodException {
    Statistics statistics = collect(code(
        "class Point {",
        "  constructor(x) { this.x = x; }",
        "}",
        "function origin() { return new Point(0); }"));
    assertEquals(2, statistics.getFunctions());
    assertEquals(1, statistics.getClasses());
  }


  public void testArrowFunctionsAreNotCounted() throws CodemodException {
    Statistics statistics = collect(code(
        "const f = () => 1;",
        "const g = function() { return [1].map(x => x); };"));
    assertEquals(1, statistics.getFunctions());
  }


  public void testNestedTryAndThrow() throws CodemodException {
    Statistics statistics = collect(code(
        "function run() {",
        "  try {",
        "    try { throw new Error(\"inner\"); } catch (e) { throw e; }",
        "  } finally {",
        "    const Local = class {};",
        "  }",
        "}"));
    assertEquals(new Statistics(1, 1, 0, 0, 2, 2), statistics);
  }


  public void testEmptySource() throws CodemodException {
    assertEquals(new Statistics(0, 0, 0, 0, 0, 0), collect(""));
  }


  public void testNegativeCountIsRejected() {
    try {
      new Statistics(0, -1, 0, 0, 0, 0);
      fail("Expected an IllegalArgumentException");
    } catch (IllegalArgumentException expected) {
    }
  }
}
