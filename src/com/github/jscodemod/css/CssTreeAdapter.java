package com.github.jscodemod.css;

import java.util.List;
import java.util.logging.Logger;

import com.github.jscodemod.CodemodDiagnostics;
import com.github.jscodemod.CodemodException;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.Lists;
import com.helger.css.ECSSVersion;
import com.helger.css.decl.CascadingStyleSheet;
import com.helger.css.handler.ICSSParseExceptionCallback;
import com.helger.css.parser.ParseException;
import com.helger.css.reader.CSSReader;
import com.helger.css.reader.CSSReaderSettings;
import com.helger.css.reader.errorhandler.CollectingCSSParseErrorHandler;
import com.helger.css.writer.CSSWriterSettings;

/**
 * Parses stylesheet text with ph-css and prints a stylesheet back with its
 * comments.
 */
public class CssTreeAdapter {

  private static final Logger logger = Logger.getLogger(CssTreeAdapter.class.getName());

  private final CSSWriterSettings writerSettings;


  public CssTreeAdapter() {
    this.writerSettings = createWriterSettings();
  }


  public CssTree parse(String source) throws CodemodException {
    CascadingStyleSheet sheet = read(source);
    CssTrivia trivia = CssTrivia.bind(sheet, CssTriviaScanner.scan(source));
    return new CssTree(sheet, trivia);
  }


  public String emit(CssTree tree) {
    return new StylesheetPrinter(writerSettings).print(tree.getSheet(), tree.getTrivia());
  }


  CSSWriterSettings getWriterSettings() {
    return writerSettings;
  }


  /**
   * Parses {@code css} without reading its comments.
   *
   * @throws CodemodException if ph-css reports any error.
   */
  CascadingStyleSheet read(String css) throws CodemodException {
    Preconditions.checkNotNull(css);
    CollectingCSSParseErrorHandler errors = new CollectingCSSParseErrorHandler();
    final List<String> failures = Lists.newArrayList();

    CSSReaderSettings settings = createReaderSettings();
    settings.setCustomErrorHandler(errors);
    settings.setCustomExceptionHandler(new ICSSParseExceptionCallback() {
      @Override
      public void onException(ParseException e) {
        failures.add(firstLine(e.getMessage()));
      }
    });

    CascadingStyleSheet sheet = CSSReader.readFromStringReader(css, settings);
    if (errors.hasParseErrors()) {
      failures.add(firstLine(errors.getAllParseErrors().get(0).getErrorMessage()));
    }
    if (sheet == null || !failures.isEmpty()) {
      String description = failures.isEmpty() ? "unknown error" : failures.get(0);
      logger.fine("CSS parse failed: " + description);
      throw new CodemodException(CodemodDiagnostics.CSS_PARSE_FAILURE, description);
    }
    return sheet;
  }


  protected CSSReaderSettings createReaderSettings() {
    CSSReaderSettings settings = new CSSReaderSettings();
    settings.setCSSVersion(ECSSVersion.CSS30);
    return settings;
  }


  protected CSSWriterSettings createWriterSettings() {
    return new CSSWriterSettings(ECSSVersion.CSS30, false);
  }


  private static String firstLine(String message) {
    if (message == null) {
      return "unknown error";
    }
    return Splitter.on('\n').trimResults().split(message).iterator().next();
  }
}
