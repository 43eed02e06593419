package com.github.jscodemod.javascript;

import com.github.jscodemod.Operation;

public enum JsOperation implements Operation {
  MODULE_IMPORTED("module_imported"),
  INSERT_IMPORTS("insert_imports"),
  REMOVE_IMPORTS("remove_imports"),
  EXIST_LIVE_SOCKET("exist_live_socket"),
  EXTEND_HOOK_OBJECT("extend_hook_object"),
  REMOVE_OBJECTS_FROM_HOOKS("remove_objects_from_hooks"),
  STATISTICS("statistics"),
  EXTEND_VAR_OBJECT("extend_var_object_property_by_names"),
  REMOVE_VAR_OBJECT("remove_var_object_property_by_names"),
  EXIST_VAR("exist_var"),
  FORMAT("format"),
  IS_FORMATTED("is_formatted");

  private final String name;


  private JsOperation(String name) {
    this.name = name;
  }


  @Override
  public String getName() {
    return name;
  }


  /**
   * @return the operation with the given name or null.
   */
  public static JsOperation fromName(String name) {
    for (JsOperation operation : values()) {
      if (operation.name.equals(name)) {
        return operation;
      }
    }
    return null;
  }
}
