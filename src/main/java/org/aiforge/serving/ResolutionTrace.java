package org.aiforge.serving;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The append-only record of every step taken while resolving a model. A trace is frozen once the
 * load completes, after which it can no longer change
 */
public class ResolutionTrace {

  /** The result of one resolution step */
  public enum Outcome {
    SUCCEEDED,
    FAILED,
    SKIPPED
  }

  /** A single resolution step */
  @JsonAutoDetect(
      fieldVisibility = JsonAutoDetect.Visibility.ANY,
      getterVisibility = JsonAutoDetect.Visibility.NONE,
      isGetterVisibility = JsonAutoDetect.Visibility.NONE)
  public static class Entry {
    @JsonProperty("strategy")
    private final LoadStrategy strategy;

    @JsonProperty("step")
    private final String step;

    @JsonProperty("outcome")
    private final Outcome outcome;

    @JsonProperty("reason")
    private final String reason;

    Entry(LoadStrategy strategy, String step, Outcome outcome, String reason) {
      this.strategy = strategy;
      this.step = step;
      this.outcome = outcome;
      this.reason = reason;
    }

    public LoadStrategy getStrategy() {
      return strategy;
    }

    /** @return The step within the strategy, e.g. a candidate function or file name */
    public String getStep() {
      return step;
    }

    public Outcome getOutcome() {
      return outcome;
    }

    public String getReason() {
      return reason;
    }

    @Override
    public String toString() {
      return String.format("[%s] %s %s: %s", strategy, step, outcome, reason);
    }
  }

  private final List<Entry> entries = new ArrayList<>();
  private boolean frozen = false;

  public void succeeded(LoadStrategy strategy, String step, String reason) {
    append(new Entry(strategy, step, Outcome.SUCCEEDED, reason));
  }

  public void failed(LoadStrategy strategy, String step, String reason) {
    append(new Entry(strategy, step, Outcome.FAILED, reason));
  }

  public void skipped(LoadStrategy strategy, String step, String reason) {
    append(new Entry(strategy, step, Outcome.SKIPPED, reason));
  }

  private synchronized void append(Entry entry) {
    if (frozen) {
      throw new IllegalStateException(
          String.format("Attempted to record `%s` in a frozen resolution trace", entry));
    }
    entries.add(entry);
  }

  /** Prevents any further entries from being recorded */
  public synchronized void freeze() {
    frozen = true;
  }

  public synchronized boolean isFrozen() {
    return frozen;
  }

  /** @return A snapshot of the entries recorded so far, in order */
  public synchronized List<Entry> getEntries() {
    return Collections.unmodifiableList(new ArrayList<>(entries));
  }
}
