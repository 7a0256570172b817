package org.aiforge.serving;

import java.nio.file.Path;
import org.aiforge.FrameworkAdapter;

/** Predicts through a built-in framework adapter */
public class AdapterBinding<H> extends ModelBinding {
  private final FrameworkAdapter<H> adapter;
  private final H handle;

  AdapterBinding(FrameworkAdapter<H> adapter, H handle) {
    this.adapter = adapter;
    this.handle = handle;
  }

  /**
   * Loads the model file through the adapter
   *
   * @throws org.aiforge.AdapterLoadException If the adapter cannot load the file
   */
  public static <H> AdapterBinding<H> load(FrameworkAdapter<H> adapter, Path modelPath) {
    return new AdapterBinding<>(adapter, adapter.load(modelPath));
  }

  @Override
  protected Object doPredict(Object input) throws PredictorEvaluationException {
    try {
      return adapter.predict(handle, input);
    } catch (Exception e) {
      throw new PredictInvocationException(
          String.format("%s.predict", adapter.getFramework().getValue()), e);
    }
  }

  @Override
  public H getHandle() {
    return handle;
  }

  @Override
  public boolean isThreadSafe() {
    return adapter.isThreadSafe();
  }
}
