package com.github.jscodemod.javascript;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * Names the declaration the hook object extender looks for:
 * {@code let <variable> = new <constructor>(..., {<hooks>: {...}})}.
 */
public final class HookTarget {

  public static final String LIVE_SOCKET_VARIABLE = "liveSocket";

  public static final String LIVE_SOCKET_CONSTRUCTOR = "LiveSocket";

  public static final String HOOKS_KEY = "hooks";

  public static final HookTarget LIVE_SOCKET =
      new HookTarget(LIVE_SOCKET_VARIABLE, LIVE_SOCKET_CONSTRUCTOR, HOOKS_KEY);

  private final String variableName;

  private final String constructorName;

  private final String hooksKey;


  public HookTarget(String variableName, String constructorName, String hooksKey) {
    this.variableName = Preconditions.checkNotNull(variableName);
    this.constructorName = Preconditions.checkNotNull(constructorName);
    this.hooksKey = Preconditions.checkNotNull(hooksKey);
  }


  public String getVariableName() {
    return variableName;
  }


  public String getConstructorName() {
    return constructorName;
  }


  public String getHooksKey() {
    return hooksKey;
  }


  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("variableName", variableName)
        .add("constructorName", constructorName)
        .add("hooksKey", hooksKey)
        .toString();
  }
}
