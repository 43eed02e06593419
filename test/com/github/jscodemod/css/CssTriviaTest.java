package com.github.jscodemod.css;

import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import junit.framework.TestCase;

import com.github.jscodemod.CodemodException;
import com.google.common.collect.Lists;

public class CssTriviaTest extends TestCase {

  private final Logger logger = Logger.getLogger(CssTrivia.class.getName());

  private final List<String> messages = Lists.newArrayList();

  private final Handler handler = new Handler() {
    @Override
    public void publish(LogRecord record) {
      messages.add(record.getMessage());
    }

    @Override
    public void flush() {}

    @Override
    public void close() {}
  };

  private Level previousLevel;

  private CssTreeAdapter adapter;


  @Override
  protected void setUp() throws Exception {
    super.setUp();
    adapter = new CssTreeAdapter();
    previousLevel = logger.getLevel();
    logger.setLevel(Level.FINE);
    handler.setLevel(Level.ALL);
    logger.addHandler(handler);
  }


  @Override
  protected void tearDown() throws Exception {
    logger.removeHandler(handler);
    logger.setLevel(previousLevel);
    super.tearDown();
  }


  public void testCharsetDropIsLogged() throws CodemodException {
    String output = adapter.emit(adapter.parse("@charset \"utf-8\";\nbody {\n  margin: 0;\n}\n"));
    assertFalse(output, output.contains("@charset"));
    assertEquals(1, messages.size());
    assertEquals("The @charset rule is not printed.", messages.get(0));
  }


  public void testNothingLoggedWithoutCharset() throws CodemodException {
    adapter.emit(adapter.parse("body {\n  margin: 0;\n}\n"));
    assertTrue(messages.toString(), messages.isEmpty());
  }


  public void testCommentsOfUnboundNodeCannotBeAddedTo() throws CodemodException {
    CssTree tree = adapter.parse("body {\n  margin: 0;\n}\n");
    NodeComments comments = tree.getTrivia().commentsOf(new Object());
    assertSame(NodeComments.NONE, comments);
    try {
      comments.leading.add(new CssComment("/* x */"));
      fail("Expected an UnsupportedOperationException");
    } catch (UnsupportedOperationException expected) {
    }
    assertTrue(NodeComments.NONE.isEmpty());
  }
}
