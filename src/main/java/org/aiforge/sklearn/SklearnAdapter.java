package org.aiforge.sklearn;

import java.io.InputStream;
import java.io.ObjectInputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.aiforge.Framework;
import org.aiforge.FrameworkAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads Java-serialized {@link Estimator Estimators}. Estimators are arbitrary user code, so
 * predictions on a single handle are serialized by the caller
 */
public class SklearnAdapter extends FrameworkAdapter<Estimator> {
  private static final Logger logger = LoggerFactory.getLogger(SklearnAdapter.class);

  @Override
  public Framework getFramework() {
    return Framework.SKLEARN;
  }

  @Override
  protected Estimator loadHandle(Path modelPath) throws Exception {
    Object loaded;
    try (InputStream fileStream = Files.newInputStream(modelPath);
        ObjectInputStream objectStream = new ObjectInputStream(fileStream)) {
      loaded = objectStream.readObject();
    }
    if (!(loaded instanceof Estimator)) {
      throw new IllegalArgumentException(
          String.format(
              "Expected the serialized object to implement %s, but found: %s",
              Estimator.class.getName(),
              loaded == null ? "null" : loaded.getClass().getName()));
    }
    logger.info(
        String.format("Loaded estimator of type %s from %s", loaded.getClass().getName(), modelPath));
    return (Estimator) loaded;
  }

  @Override
  public Object predict(Estimator estimator, Object input) throws Exception {
    return estimator.predict(TextAwareInputCoercion.coerce(input));
  }
}
