package org.aiforge.serving;

/**
 * The single mapping from a callable's arity to the positional arguments it is invoked with, for
 * both load candidates and predict candidates of script-based entry points
 */
public enum CallingConvention {
  /** Invoked with no arguments */
  NO_ARGUMENTS,
  /** Load: invoked with the model path */
  MODEL_PATH,
  /** Load: invoked with the model path and the model directory */
  MODEL_PATH_AND_DIRECTORY,
  /** Predict: invoked with the raw input */
  INPUT,
  /** Predict: invoked with the model handle, then the raw input */
  MODEL_AND_INPUT;

  /**
   * Arity 0 takes no arguments, 1 takes the model path, 2 takes the model path and directory.
   * Larger arities receive the model path only
   */
  public static CallingConvention forLoad(int arity) {
    requireNonNegative(arity);
    switch (arity) {
      case 0:
        return NO_ARGUMENTS;
      case 2:
        return MODEL_PATH_AND_DIRECTORY;
      default:
        return MODEL_PATH;
    }
  }

  /** Arity 0 takes no arguments, 1 takes the input, 2 or more take the handle and the input */
  public static CallingConvention forPredict(int arity) {
    requireNonNegative(arity);
    if (arity == 0) {
      return NO_ARGUMENTS;
    }
    return arity == 1 ? INPUT : MODEL_AND_INPUT;
  }

  private static void requireNonNegative(int arity) {
    if (arity < 0) {
      throw new IllegalArgumentException(String.format("Invalid arity: %d", arity));
    }
  }

  /** @throws IllegalStateException If this is a predict convention */
  public Object[] loadArguments(String modelPath, String modelDirectory) {
    switch (this) {
      case NO_ARGUMENTS:
        return new Object[0];
      case MODEL_PATH:
        return new Object[] {modelPath};
      case MODEL_PATH_AND_DIRECTORY:
        return new Object[] {modelPath, modelDirectory};
      default:
        throw new IllegalStateException(String.format("%s is not a load convention", this));
    }
  }

  /** @throws IllegalStateException If this is a load convention */
  public Object[] predictArguments(Object handle, Object input) {
    switch (this) {
      case NO_ARGUMENTS:
        return new Object[0];
      case INPUT:
        return new Object[] {input};
      case MODEL_AND_INPUT:
        return new Object[] {handle, input};
      default:
        throw new IllegalStateException(String.format("%s is not a predict convention", this));
    }
  }
}
