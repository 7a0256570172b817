package org.aiforge.serving;

import java.util.Optional;
import org.aiforge.scripting.ExecutableUnit;

/**
 * The predict routine a model committed to when it was loaded. Bindings whose invocation is not
 * safe for concurrent use serialize calls on a per-binding lock
 */
public abstract class ModelBinding {
  private final Object invocationLock = new Object();

  /** @return The opaque model handle produced by the load step */
  public abstract Object getHandle();

  /** @return The entry point the model was loaded from, for script-based bindings */
  public Optional<ExecutableUnit> getEntryPoint() {
    return Optional.empty();
  }

  /** @return `true` if {@link #predict(Object)} may run concurrently */
  public abstract boolean isThreadSafe();

  /** Runs a prediction on the raw input and returns the raw, unnormalized output */
  public final Object predict(Object input) throws PredictorEvaluationException {
    if (isThreadSafe()) {
      return doPredict(input);
    }
    synchronized (invocationLock) {
      return doPredict(input);
    }
  }

  protected abstract Object doPredict(Object input) throws PredictorEvaluationException;
}
