package ai.mab;

/**
 * A context-free policy.
 */
public interface Policy extends BanditPolicy {
  int select();

  /**
   * @throws InvalidArmException if {@code arm} is outside
   *                             {@code [0, getArmCount())}
   */
  void update(int arm, double reward);
}
