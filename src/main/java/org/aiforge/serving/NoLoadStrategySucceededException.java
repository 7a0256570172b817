package org.aiforge.serving;

import java.util.List;
import org.aiforge.ModelLoadingException;

/** Every load tier was inapplicable or failed, ending with a failure of the built-in adapters */
public class NoLoadStrategySucceededException extends ModelLoadingException {
  private final List<ResolutionTrace.Entry> trace;

  public NoLoadStrategySucceededException(
      List<ResolutionTrace.Entry> trace, ModelLoadingException cause) {
    super(
        String.format(
            "No load strategy succeeded after %d attempted steps. Last failure: %s",
            trace.size(), cause.getMessage()),
        cause);
    this.trace = trace;
  }

  /** @return The resolution trace at the time of the failure */
  public List<ResolutionTrace.Entry> getTrace() {
    return trace;
  }
}
