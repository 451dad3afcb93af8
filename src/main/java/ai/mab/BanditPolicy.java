package ai.mab;

/**
 * Common surface of every arm-selection policy. Whether a policy consumes
 * context is declared by its type: see {@link Policy} and
 * {@link ContextualPolicy}.
 * <p>
 * Policies are single-threaded. A caller must not run a policy while resetting
 * it.
 */
public interface BanditPolicy {
  int getArmCount();

  /**
   * Returns the policy to its freshly constructed state, ready for an
   * independent trial.
   */
  void reset();

  /**
   * Like {@link #reset()}, and the policy draws from {@code random} from then
   * on. A trial that starts this way does not depend on what ran before it.
   */
  void reset(RandomSource random);

  PolicyMetrics getMetrics();
}
