package com.github.jscodemod.css;

import com.github.jscodemod.Operation;

public enum CssOperation implements Operation {
  IMPORTED("imported"),
  INSERT_IMPORTS("insert_imports"),
  REMOVE_IMPORTS("remove_imports"),
  EXTEND_RULE("extend_rule"),
  REMOVE_DECLARATIONS("remove_declarations"),
  FORMAT("format"),
  IS_FORMATTED("is_formatted");

  private final String name;


  private CssOperation(String name) {
    this.name = name;
  }


  @Override
  public String getName() {
    return name;
  }


  /**
   * @return the operation with the given name or null.
   */
  public static CssOperation fromName(String name) {
    for (CssOperation operation : values()) {
      if (operation.name.equals(name)) {
        return operation;
      }
    }
    return null;
  }
}
