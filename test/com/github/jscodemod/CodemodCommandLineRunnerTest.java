package com.github.jscodemod;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;

import junit.framework.TestCase;

import com.google.common.base.Charsets;
import com.google.common.io.Files;

public class CodemodCommandLineRunnerTest extends TestCase {

  private File directory;

  private ByteArrayOutputStream out;

  private ByteArrayOutputStream err;


  @Override
  protected void setUp() throws Exception {
    super.setUp();
    directory = java.nio.file.Files.createTempDirectory("codemod").toFile();
    out = new ByteArrayOutputStream();
    err = new ByteArrayOutputStream();
  }


  @Override
  protected void tearDown() throws Exception {
    for (File file : directory.listFiles()) {
      file.delete();
    }
    directory.delete();
    super.tearDown();
  }


  private String write(String name, String content) throws IOException {
    File file = new File(directory, name);
    Files.asCharSink(file, Charsets.UTF_8).write(content);
    return file.getPath();
  }


  private int run(String... args) throws UnsupportedEncodingException {
    PrintStream outStream = new PrintStream(out, true, "UTF-8");
    PrintStream errStream = new PrintStream(err, true, "UTF-8");
    return new CodemodCommandLineRunner(outStream, errStream).run(args);
  }


  private String out() throws UnsupportedEncodingException {
    return out.toString("UTF-8");
  }


  private String err() throws UnsupportedEncodingException {
    return err.toString("UTF-8");
  }


  public void testExtendHookObject() throws IOException {
    String path = write("app.js", "let liveSocket = new LiveSocket(\"/live\", Socket, {x: 1});\n");
    assertEquals(0, run("--file", path, "--operation", "extend_hook_object", "--name", "CopyHook", "--name", "...Hooks"));
    assertTrue(out().contains("CopyHook"));
    assertTrue(out().contains("...Hooks"));
    assertEquals("", err());
  }


  public void testInsertImports() throws IOException {
    String path = write("app.js", "console.log(1);\n");
    assertEquals(0, run("--file", path, "--operation", "insert_imports", "--import", "import a from \"a\";"));
    assertTrue(out().startsWith("import a from"));
  }


  public void testStatistics() throws IOException {
    String path = write("app.mjs", "function f() { debugger; }\n");
    assertEquals(0, run("--file", path, "--operation", "statistics"));
    assertTrue(out().contains("functions=1"));
    assertTrue(out().contains("debuggers=1"));
  }


  public void testExtendRule() throws IOException {
    String path = write("app.css", "body { margin: 0; }\n");
    assertEquals(0, run("--file", path, "--operation", "extend_rule",
        "--selector", ".hide-scrollbar", "--declaration", "display: none"));
    assertTrue(out().contains(".hide-scrollbar {\n  display: none;\n}"));
  }


  public void testFailureGoesToStandardError() throws IOException {
    String path = write("app.js", "let x = 1;\n");
    assertEquals(1, run("--file", path, "--operation", "extend_hook_object", "--name", "A"));
    assertEquals("", out());
    assertTrue(err().contains("liveSocket not found."));
  }


  public void testUnknownOperation() throws IOException {
    String path = write("app.css", "body { margin: 0; }\n");
    assertEquals(-1, run("--file", path, "--operation", "extend_hook_object"));
    assertTrue(err().contains("Unknown operation: extend_hook_object"));
  }


  public void testUnsupportedFile() throws IOException {
    String path = write("app.txt", "text");
    assertEquals(-1, run("--file", path, "--operation", "format"));
    assertTrue(err().contains("Unsupported file type"));
  }


  public void testMissingFile() throws IOException {
    assertEquals(1, run("--file", new File(directory, "missing.js").getPath(), "--operation", "format"));
    assertTrue(err().startsWith("Cannot read"));
  }


  public void testMissingRequiredOption() throws IOException {
    assertEquals(-1, run("--operation", "format"));
    assertTrue(err().contains("--file"));
  }
}
