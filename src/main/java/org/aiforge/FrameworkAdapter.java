package org.aiforge;

import java.nio.file.Path;

/**
 * A built-in integration for one serialized-model format. By extending {@link FrameworkAdapter},
 * a model file of a specific framework can be deserialized into an opaque handle and invoked
 * through a uniform predict routine
 *
 * @param <H> The type of the loaded model handle
 */
public abstract class FrameworkAdapter<H> {

  /** @return The framework served by this adapter */
  public abstract Framework getFramework();

  /**
   * @return `true` if the path's suffix or directory layout belongs to this adapter's framework,
   *     `false` otherwise
   */
  public boolean canHandle(Path modelPath) {
    return FrameworkAdapters.matches(getFramework(), modelPath);
  }

  /**
   * Loads the model at the specified path
   *
   * @throws AdapterLoadException For any failure encountered while deserializing the model,
   *     including a framework runtime that is missing or cannot be linked
   */
  public final H load(Path modelPath) {
    try {
      return loadHandle(modelPath);
    } catch (AdapterLoadException e) {
      throw e;
    } catch (Exception | LinkageError e) {
      throw new AdapterLoadException(getFramework(), modelPath, e);
    }
  }

  /**
   * Deserializes the model. Implementations may throw any exception; {@link #load(Path)} reports
   * it as an {@link AdapterLoadException}
   */
  protected abstract H loadHandle(Path modelPath) throws Exception;

  /** Performs inference on the specified raw input with a handle created by {@link #load(Path)} */
  public abstract Object predict(H handle, Object input) throws Exception;

  /**
   * @return `true` if {@link #predict(Object, Object)} may be invoked concurrently on a single
   *     handle. Callers serialize predictions on handles that are not thread-safe
   */
  public boolean isThreadSafe() {
    return false;
  }
}
