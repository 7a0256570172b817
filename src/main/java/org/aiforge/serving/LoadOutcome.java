package org.aiforge.serving;

import java.util.List;
import java.util.Optional;

/** The result of {@link ModelGateway#loadOnStartup}: either a loaded model or a failure report */
public class LoadOutcome {
  private final LoadedModel loadedModel;
  private final LoadFailureReport failureReport;
  private final List<ResolutionTrace.Entry> trace;

  private LoadOutcome(
      LoadedModel loadedModel, LoadFailureReport failureReport, List<ResolutionTrace.Entry> trace) {
    this.loadedModel = loadedModel;
    this.failureReport = failureReport;
    this.trace = trace;
  }

  static LoadOutcome loaded(LoadedModel loadedModel) {
    return new LoadOutcome(loadedModel, null, loadedModel.getResolutionTrace());
  }

  static LoadOutcome failed(LoadFailureReport failureReport) {
    return new LoadOutcome(null, failureReport, failureReport.getTrace());
  }

  public boolean isLoaded() {
    return loadedModel != null;
  }

  public Optional<LoadedModel> getLoadedModel() {
    return Optional.ofNullable(loadedModel);
  }

  public Optional<LoadFailureReport> getFailureReport() {
    return Optional.ofNullable(failureReport);
  }

  public List<ResolutionTrace.Entry> getTrace() {
    return trace;
  }
}
