package ai.mab;

import com.google.common.primitives.Doubles;

import ai.mab.util.Util;
import lombok.Getter;

/**
 * Explores a uniformly random arm with probability epsilon and otherwise
 * exploits the arm with the highest value estimate, breaking ties at random.
 */
public class EpsilonGreedy implements Policy {
  public static final double DEFAULT_EPSILON = .1;

  private final PolicyState state;
  private RandomSource random;
  @Getter
  private double epsilon;
  @Getter
  private int explorations, exploitations;

  public EpsilonGreedy(final int armCount, final double epsilon, final RandomSource random) {
    state = new PolicyState(armCount);
    this.random = random;
    setEpsilon(epsilon);
  }

  public EpsilonGreedy(final int armCount, final RandomSource random) {
    this(armCount, DEFAULT_EPSILON, random);
  }

  /**
   * Out-of-range values are clamped into [0, 1].
   */
  public void setEpsilon(final double epsilon) {
    this.epsilon = Doubles.constrainToRange(epsilon, 0, 1);
  }

  public double getExplorationRatio() {
    return (double) explorations / Math.max(1, explorations + exploitations);
  }

  @Override
  public int getArmCount() {
    return state.getArmCount();
  }

  @Override
  public int select() {
    if (random.nextUniform() < epsilon) {
      ++explorations;
      return random.nextInt(state.getArmCount());
    } else {
      ++exploitations;
      return Util.argmax(state.getValueEstimates(), random);
    }
  }

  @Override
  public void update(final int arm, final double reward) {
    state.record(arm, reward);
  }

  @Override
  public void reset() {
    state.reset();
    explorations = exploitations = 0;
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
    return String.format("epsilon-greedy(epsilon = %.2f)", epsilon);
  }
}
