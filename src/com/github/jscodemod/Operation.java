package com.github.jscodemod;

/**
 * A named operation of one of the codemod facades. The name is the one a host
 * passes on the command line and the one reported back in a {@link Response}.
 */
public interface Operation {
  public String getName();
}
