package org.aiforge.serving;

import java.util.Optional;
import org.aiforge.Framework;

/** A read-only view of a gateway's session, for health reporting */
public class ModelStatus {
  private final boolean loaded;
  private final Framework framework;
  private final String modelIdentifier;

  ModelStatus(boolean loaded, Framework framework, String modelIdentifier) {
    this.loaded = loaded;
    this.framework = framework;
    this.modelIdentifier = modelIdentifier;
  }

  public boolean isLoaded() {
    return loaded;
  }

  public Optional<Framework> getFramework() {
    return Optional.ofNullable(framework);
  }

  public Optional<String> getModelIdentifier() {
    return Optional.ofNullable(modelIdentifier);
  }
}
