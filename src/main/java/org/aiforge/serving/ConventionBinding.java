package org.aiforge.serving;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.aiforge.scripting.CallableIntrospectionException;
import org.aiforge.scripting.ExecutableUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Predicts through the first conventionally-named function of a script that succeeds. Used for
 * models loaded from an explicit custom script or an auto-detected one
 */
public class ConventionBinding extends ModelBinding {
  private static final Logger logger = LoggerFactory.getLogger(ConventionBinding.class);

  /** Predict function names, in preference order */
  public static final List<String> PREDICT_CANDIDATES =
      Collections.unmodifiableList(Arrays.asList("predict", "inference", "run", "forward", "call"));

  private final ExecutableUnit entryPoint;
  private final Object handle;

  public ConventionBinding(ExecutableUnit entryPoint, Object handle) {
    this.entryPoint = entryPoint;
    this.handle = handle;
  }

  @Override
  protected Object doPredict(Object input) throws PredictorEvaluationException {
    Map<String, String> failures = new LinkedHashMap<>();
    List<String> undefined = new ArrayList<>();
    for (String candidate : PREDICT_CANDIDATES) {
      if (!entryPoint.hasCallable(candidate)) {
        undefined.add(candidate);
        continue;
      }
      try {
        return invokeCandidate(candidate, input);
      } catch (Exception e) {
        logger.warn(
            String.format(
                "Predict candidate `%s` of %s failed: %s",
                candidate, entryPoint.getSource(), e.getMessage()));
        failures.put(candidate, String.format("%s: %s", e.getClass().getSimpleName(),
            e.getMessage()));
      }
    }
    throw new NoPredictStrategyFoundException(failures, undefined);
  }

  private Object invokeCandidate(String candidate, Object input) throws Exception {
    CallingConvention convention;
    try {
      convention = CallingConvention.forPredict(entryPoint.arity(candidate));
    } catch (CallableIntrospectionException e) {
      logger.debug(
          String.format(
              "Could not introspect `%s`, trying input-only then model-and-input: %s",
              candidate, e.getMessage()));
      try {
        return entryPoint.invoke(candidate, input);
      } catch (Exception inputOnlyFailure) {
        return entryPoint.invoke(candidate, handle, input);
      }
    }
    return entryPoint.invoke(candidate, convention.predictArguments(handle, input));
  }

  @Override
  public Object getHandle() {
    return handle;
  }

  @Override
  public Optional<ExecutableUnit> getEntryPoint() {
    return Optional.of(entryPoint);
  }

  @Override
  public boolean isThreadSafe() {
    return false;
  }
}
