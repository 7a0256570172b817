package org.aiforge.serving;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds at most one {@link LoadedModel}. A session is either loaded or unloaded; the snapshot is
 * replaced atomically, so readers never observe a partially loaded model
 */
public class ModelSession {
  private final AtomicReference<LoadedModel> loadedModel = new AtomicReference<>();
  private final AtomicReference<LoadFailureReport> lastFailure = new AtomicReference<>();

  public Optional<LoadedModel> getLoadedModel() {
    return Optional.ofNullable(loadedModel.get());
  }

  public boolean isLoaded() {
    return loadedModel.get() != null;
  }

  /** Installs a freshly loaded model, replacing any prior one */
  void install(LoadedModel model) {
    loadedModel.set(model);
    lastFailure.set(null);
  }

  /** Records a fatal load failure. Any previously installed model stays authoritative */
  void recordFailure(LoadFailureReport report) {
    lastFailure.set(report);
  }

  /** @return The report of the most recent fatal load failure, if no load has succeeded since */
  public Optional<LoadFailureReport> getLastFailure() {
    return Optional.ofNullable(lastFailure.get());
  }
}
