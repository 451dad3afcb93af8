package ai.mab;

/**
 * A policy that scores arms against a per-interaction context vector.
 */
public interface ContextualPolicy extends BanditPolicy {
  int getDimension();

  int select(double[] context, boolean useExplorationBonus);

  default int select(final double[] context) {
    return select(context, true);
  }

  /**
   * @throws InvalidArmException       if {@code arm} is outside
   *                                   {@code [0, getArmCount())}
   * @throws InvalidParameterException if the context length differs from
   *                                   {@link #getDimension()}
   */
  void update(int arm, double[] context, double reward);
}
