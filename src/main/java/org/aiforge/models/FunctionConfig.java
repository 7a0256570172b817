package org.aiforge.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** The name of a load or predict function and the ordered tokens describing its arguments */
public class FunctionConfig {
  private final String name;
  private final List<ArgumentToken> args;

  public FunctionConfig(String name, List<ArgumentToken> args) {
    this.name = name;
    this.args = Collections.unmodifiableList(new ArrayList<>(args));
  }

  public String getName() {
    return name;
  }

  public List<ArgumentToken> getArgs() {
    return args;
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof FunctionConfig)) {
      return false;
    }
    FunctionConfig config = (FunctionConfig) other;
    return name.equals(config.name) && args.equals(config.args);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, args);
  }

  @Override
  public String toString() {
    return String.format("%s%s", name, ArgumentToken.toValues(args));
  }
}
