package org.aiforge.djl;

import org.aiforge.Framework;

/**
 * Loads TensorFlow SavedModel directories through the DJL TensorFlow engine. Keras `.h5` and
 * `.keras` files are detected as TensorFlow but cannot be read by the engine, so loading them fails
 * with an {@link org.aiforge.AdapterLoadException}
 */
public class TensorFlowAdapter extends DjlAdapter {
  @Override
  public Framework getFramework() {
    return Framework.TENSORFLOW;
  }

  @Override
  protected String getEngineName() {
    return "TensorFlow";
  }
}
