package ai.mab;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.ImmutableDoubleArray;
import com.google.common.primitives.ImmutableIntArray;

/**
 * A point-in-time copy of a policy's bookkeeping. Nothing here aliases the
 * policy's own state.
 */
public record PolicyMetrics(int totalPulls, double totalReward, ImmutableIntArray pullCounts,
    ImmutableDoubleArray valueEstimates, ImmutableList<Pull> history) {

  public double averageReward() {
    return totalReward / Math.max(1, totalPulls);
  }
}
