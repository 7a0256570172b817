package org.aiforge.serving;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Every candidate predict function of a script-loaded model is missing or failed */
public class NoPredictStrategyFoundException extends PredictorEvaluationException {
  private final List<String> triedCandidates;
  private final List<String> undefinedCandidates;
  private final Map<String, String> failures;

  /**
   * @param failures The failure reason of each tried candidate, keyed and ordered by name
   * @param undefinedCandidates The candidate names the entry point does not define
   */
  public NoPredictStrategyFoundException(
      Map<String, String> failures, List<String> undefinedCandidates) {
    super(
        String.format(
            "No predict function succeeded. Tried: [%s]. Not defined: [%s]. Failures: %s",
            String.join(", ", failures.keySet()),
            String.join(", ", undefinedCandidates),
            failures));
    this.triedCandidates = Collections.unmodifiableList(new ArrayList<>(failures.keySet()));
    this.undefinedCandidates = Collections.unmodifiableList(new ArrayList<>(undefinedCandidates));
    this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
  }

  /** @return Every candidate name that was defined and invoked, in order */
  public List<String> getTriedCandidates() {
    return triedCandidates;
  }

  /** @return Every candidate name that was skipped because it is not defined, in order */
  public List<String> getUndefinedCandidates() {
    return undefinedCandidates;
  }

  /** @return The failure reason of each tried candidate */
  public Map<String, String> getFailures() {
    return failures;
  }
}
