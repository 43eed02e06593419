package com.github.jscodemod.javascript;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * Structural counts of one JavaScript source.
 */
public final class Statistics {

  private final int functions;

  private final int classes;

  private final int debuggers;

  private final int imports;

  private final int trys;

  private final int throwStatements;


  public Statistics(int functions, int classes, int debuggers, int imports, int trys, int throwStatements) {
    Preconditions.checkArgument(functions >= 0 && classes >= 0 && debuggers >= 0
        && imports >= 0 && trys >= 0 && throwStatements >= 0, "Negative count.");
    this.functions = functions;
    this.classes = classes;
    this.debuggers = debuggers;
    this.imports = imports;
    this.trys = trys;
    this.throwStatements = throwStatements;
  }


  /** Function declarations, expressions and methods. Arrow functions are not counted. */
  public int getFunctions() {
    return functions;
  }


  public int getClasses() {
    return classes;
  }


  public int getDebuggers() {
    return debuggers;
  }


  public int getImports() {
    return imports;
  }


  public int getTrys() {
    return trys;
  }


  public int getThrows() {
    return throwStatements;
  }


  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Statistics)) {
      return false;
    }
    Statistics other = (Statistics) obj;
    return functions == other.functions
        && classes == other.classes
        && debuggers == other.debuggers
        && imports == other.imports
        && trys == other.trys
        && throwStatements == other.throwStatements;
  }


  @Override
  public int hashCode() {
    return Objects.hashCode(functions, classes, debuggers, imports, trys, throwStatements);
  }


  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("functions", functions)
        .add("classes", classes)
        .add("debuggers", debuggers)
        .add("imports", imports)
        .add("trys", trys)
        .add("throws", throwStatements)
        .toString();
  }
}
