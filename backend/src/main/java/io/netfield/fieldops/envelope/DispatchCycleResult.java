package io.netfield.fieldops.envelope;

/** Counts for one dispatch cycle. {@code rateLimited} envelopes were not attempted. */
public record DispatchCycleResult(
    int selected, int sent, int retryScheduled, int failed, int rateLimited) {

  public static DispatchCycleResult empty() {
    return new DispatchCycleResult(0, 0, 0, 0, 0);
  }

  public boolean didWork() {
    return selected > 0;
  }
}
