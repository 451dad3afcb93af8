package ai.mab;

import ai.mab.util.Util;
import lombok.Getter;

/**
 * UCB1: pulls every arm once in index order, then picks the arm maximizing
 * {@code value + c * sqrt(ln(totalPulls) / pulls)}.
 */
public class Ucb implements Policy {
  public static final double DEFAULT_C = 2, MIN_C = .1;

  private final PolicyState state;
  private RandomSource random;
  @Getter
  private double c;

  public Ucb(final int armCount, final double c, final RandomSource random) {
    state = new PolicyState(armCount);
    this.random = random;
    setC(c);
  }

  public Ucb(final int armCount, final RandomSource random) {
    this(armCount, DEFAULT_C, random);
  }

  /**
   * Values below {@link #MIN_C} are raised to it so the bonus never vanishes.
   */
  public void setC(final double c) {
    this.c = Math.max(MIN_C, c);
  }

  @Override
  public int getArmCount() {
    return state.getArmCount();
  }

  @Override
  public int select() {
    for (int arm = 0; arm < state.getArmCount(); ++arm) {
      if (state.getPullCount(arm) == 0) {
        return arm;
      }
    }

    return Util.argmax(getUcbValues(), random);
  }

  /**
   * Upper confidence bounds per arm; {@code +∞} for arms that have not been
   * pulled, which are always selected next.
   */
  public double[] getUcbValues() {
    final double logTotal = Math.log(state.getTotalPulls());
    final double[] values = new double[state.getArmCount()];
    for (int arm = 0; arm < values.length; ++arm) {
      final int pulls = state.getPullCount(arm);
      values[arm] = pulls == 0
          ? Double.POSITIVE_INFINITY
          : state.getValueEstimate(arm) + c * Math.sqrt(logTotal / pulls);
    }
    return values;
  }

  @Override
  public void update(final int arm, final double reward) {
    state.record(arm, reward);
  }

  @Override
  public void reset() {
    state.reset();
  }

  @Override
  public void reset(final RandomSource random) {
    this.random = random;
    reset();
  }

  @Override
  public PolicyMetrics getMetrics() {
    return state.snapshot();
  }

  @Override
  public String toString() {
    return String.format("UCB1(c = %.2f)", c);
  }
}
