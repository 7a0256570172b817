package org.aiforge.serving;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import org.aiforge.ModelLoadingException;

/** A function declared by the manifest is not defined by the bound entry point */
public class EntryPointFunctionNotFoundException extends ModelLoadingException {
  private final String function;
  private final List<String> availableFunctions;

  public EntryPointFunctionNotFoundException(String function, Set<String> availableFunctions) {
    super(
        String.format(
            "The entry point does not define the function `%s`. Available functions: %s",
            function, availableFunctions));
    this.function = function;
    this.availableFunctions = Collections.unmodifiableList(new ArrayList<>(availableFunctions));
  }

  public String getFunction() {
    return function;
  }

  public List<String> getAvailableFunctions() {
    return availableFunctions;
  }
}
