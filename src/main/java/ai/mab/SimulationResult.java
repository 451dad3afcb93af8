package ai.mab;

import com.google.common.primitives.ImmutableDoubleArray;
import com.google.common.primitives.ImmutableIntArray;

/**
 * Per-round series of one simulation run, all of equal length.
 * {@code cumulativeRegret} is non-negative and non-decreasing.
 */
public record SimulationResult(ImmutableDoubleArray rewards, ImmutableIntArray arms,
    ImmutableDoubleArray cumulativeRegret, ImmutableDoubleArray runningCtr) {

  public SimulationResult {
    if (arms.length() != rewards.length() || cumulativeRegret.length() != rewards.length()
        || runningCtr.length() != rewards.length()) {
      throw new IllegalArgumentException(String.format("Series lengths differ: %d rewards, %d arms, %d regret, %d CTR",
          rewards.length(), arms.length(), cumulativeRegret.length(), runningCtr.length()));
    }
  }

  public int rounds() {
    return rewards.length();
  }

  public double totalReward() {
    return rewards.stream().sum();
  }

  public double finalRegret() {
    return cumulativeRegret.isEmpty() ? 0 : cumulativeRegret.get(cumulativeRegret.length() - 1);
  }

  /**
   * How many times each arm was selected.
   */
  public ImmutableIntArray selectionCounts(final int armCount) {
    final int[] counts = new int[armCount];
    arms.forEach(arm -> ++counts[InvalidArmException.check(arm, armCount)]);
    return ImmutableIntArray.copyOf(counts);
  }
}
