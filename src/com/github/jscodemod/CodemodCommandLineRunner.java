package com.github.jscodemod;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.Locale;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

import com.github.jscodemod.css.CssOperation;
import com.github.jscodemod.css.StylesheetCodemod;
import com.github.jscodemod.javascript.JavaScriptCodemod;
import com.github.jscodemod.javascript.JsOperation;
import com.google.common.base.Charsets;
import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.Lists;
import com.google.common.io.Files;

/**
 * Runs one codemod operation on a file and prints the result.
 *
 * <pre>
 * --file assets/js/app.js --operation extend_hook_object --name CopyHook --name ...Hooks
 * --file assets/css/app.css --operation extend_rule --selector .hide-scrollbar --declaration "display: none"
 * </pre>
 *
 * The transformed text or the query result goes to stdout, the failure message
 * to stderr.
 */
public class CodemodCommandLineRunner {

  static final int SUCCESS = 0;

  static final int FAILURE = 1;

  static final int USAGE_ERROR = -1;


  private static final class CommandLineOptions {
    @Option(name = "--file", required = true, usage = "the .js, .mjs, .ts or .css file to read.")
    private String file;

    @Option(name = "--operation", required = true, usage = "the operation to run, e.g. insert_imports.")
    private String operation;

    @Option(name = "--name", usage = "a module, hook, object entry, url or property name. May be repeated.")
    private List<String> names = Lists.newArrayList();

    @Option(name = "--var", usage = "the variable whose object literal is edited.")
    private String variable;

    @Option(name = "--import", usage = "an import line to insert. May be repeated.")
    private List<String> imports = Lists.newArrayList();

    @Option(name = "--selector", usage = "the selector of the style rule to edit.")
    private String selector;

    @Option(name = "--declaration", usage = "a declaration such as \"display: none\". May be repeated.")
    private List<String> declarations = Lists.newArrayList();
  }

  private final PrintStream out;

  private final PrintStream err;


  public CodemodCommandLineRunner(PrintStream out, PrintStream err) {
    this.out = out;
    this.err = err;
  }


  public int run(String[] args) {
    CommandLineOptions options = new CommandLineOptions();
    CmdLineParser parser = new CmdLineParser(options);
    try {
      parser.parseArgument(args);
    } catch (CmdLineException e) {
      err.println(e.getMessage());
      parser.printUsage(err);
      return USAGE_ERROR;
    }

    String source;
    try {
      source = Files.asCharSource(new File(options.file), Charsets.UTF_8).read();
    } catch (IOException e) {
      err.println("Cannot read " + options.file + ": " + e.getMessage());
      return FAILURE;
    }

    Response<?> response;
    String fileName = options.file.toLowerCase(Locale.ROOT);
    if (fileName.endsWith(".css")) {
      response = runStylesheet(options, source);
    } else if (fileName.endsWith(".js") || fileName.endsWith(".mjs") || fileName.endsWith(".ts")) {
      response = runJavaScript(options, source);
    } else {
      err.println("Unsupported file type: " + options.file);
      return USAGE_ERROR;
    }

    if (response == null) {
      err.println("Unknown operation: " + options.operation);
      return USAGE_ERROR;
    }
    if (!response.isOk()) {
      err.println(response.getMessage());
      return FAILURE;
    }
    Object payload = response.getPayload();
    if (payload instanceof String) {
      out.print(payload);
    } else {
      out.println(payload);
    }
    return SUCCESS;
  }


  private Response<?> runJavaScript(CommandLineOptions options, String source) {
    JsOperation operation = JsOperation.fromName(options.operation);
    if (operation == null) {
      return null;
    }
    JavaScriptCodemod codemod = new JavaScriptCodemod();
    switch (operation) {
      case MODULE_IMPORTED:
        return codemod.isModuleImported(source, firstName(options));
      case INSERT_IMPORTS:
        return codemod.insertImports(source, Joiner.on('\n').join(options.imports));
      case REMOVE_IMPORTS:
        return codemod.removeImports(source, options.names);
      case EXIST_LIVE_SOCKET:
        return codemod.existLiveSocket(source);
      case EXTEND_HOOK_OBJECT:
        return codemod.extendHookObject(source, options.names);
      case REMOVE_OBJECTS_FROM_HOOKS:
        return codemod.removeObjectsFromHooks(source, options.names);
      case STATISTICS:
        return codemod.statistics(source);
      case EXTEND_VAR_OBJECT:
        return codemod.extendVarObject(source, Strings.nullToEmpty(options.variable), options.names);
      case REMOVE_VAR_OBJECT:
        return codemod.removeVarObject(source, Strings.nullToEmpty(options.variable), options.names);
      case EXIST_VAR:
        return codemod.existVar(source, Strings.nullToEmpty(options.variable));
      case FORMAT:
        return codemod.format(source);
      case IS_FORMATTED:
        return codemod.isFormatted(source);
      default:
        return null;
    }
  }


  private Response<?> runStylesheet(CommandLineOptions options, String source) {
    CssOperation operation = CssOperation.fromName(options.operation);
    if (operation == null) {
      return null;
    }
    StylesheetCodemod codemod = new StylesheetCodemod();
    switch (operation) {
      case IMPORTED:
        return codemod.isImported(source, firstName(options));
      case INSERT_IMPORTS:
        return codemod.insertImports(source, Joiner.on('\n').join(options.imports));
      case REMOVE_IMPORTS:
        return codemod.removeImports(source, options.names);
      case EXTEND_RULE:
        return codemod.extendRule(source, Strings.nullToEmpty(options.selector), options.declarations);
      case REMOVE_DECLARATIONS:
        return codemod.removeDeclarations(source, Strings.nullToEmpty(options.selector), options.names);
      case FORMAT:
        return codemod.format(source);
      case IS_FORMATTED:
        return codemod.isFormatted(source);
      default:
        return null;
    }
  }


  private static String firstName(CommandLineOptions options) {
    return options.names.isEmpty() ? "" : options.names.get(0);
  }


  public static void main(String[] args) {
    System.exit(new CodemodCommandLineRunner(System.out, System.err).run(args));
  }
}
