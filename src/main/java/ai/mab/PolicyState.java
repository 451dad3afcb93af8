package ai.mab;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.ImmutableDoubleArray;
import com.google.common.primitives.ImmutableIntArray;

import lombok.Getter;

/**
 * Per-arm pull counts and running-mean value estimates, shared by composition
 * across policies. Only {@link #record(int, double)} and {@link #reset()}
 * mutate it; readers receive copies.
 * <p>
 * Invariants: the pull counts sum to {@link #getTotalPulls()}, and each value
 * estimate is the arithmetic mean of the rewards recorded for that arm, or 0 if
 * the arm was never pulled.
 */
public class PolicyState {
  private final int[] pullCounts;
  private final double[] valueEstimates;
  @Getter
  private int totalPulls;
  @Getter
  private double totalReward;
  private final List<Pull> history = new ArrayList<>();

  public PolicyState(final int armCount) {
    InvalidParameterException.check(armCount > 0, "arm count must be positive, got %s", armCount);
    pullCounts = new int[armCount];
    valueEstimates = new double[armCount];
  }

  public int getArmCount() {
    return pullCounts.length;
  }

  public void record(final int arm, final double reward) {
    InvalidArmException.check(arm, pullCounts.length);

    ++pullCounts[arm];
    ++totalPulls;
    totalReward += reward;
    // Incremental mean; avoids the drift of a running sum divided on demand.
    valueEstimates[arm] += (reward - valueEstimates[arm]) / pullCounts[arm];
    history.add(new Pull(arm, reward));
  }

  public void reset() {
    Arrays.fill(pullCounts, 0);
    Arrays.fill(valueEstimates, 0);
    totalPulls = 0;
    totalReward = 0;
    history.clear();
  }

  public int getPullCount(final int arm) {
    return pullCounts[InvalidArmException.check(arm, pullCounts.length)];
  }

  public double getValueEstimate(final int arm) {
    return valueEstimates[InvalidArmException.check(arm, valueEstimates.length)];
  }

  public double[] getValueEstimates() {
    return valueEstimates.clone();
  }

  public int[] getPullCounts() {
    return pullCounts.clone();
  }

  public PolicyMetrics snapshot() {
    return new PolicyMetrics(totalPulls, totalReward, ImmutableIntArray.copyOf(pullCounts),
        ImmutableDoubleArray.copyOf(valueEstimates), ImmutableList.copyOf(history));
  }
}
