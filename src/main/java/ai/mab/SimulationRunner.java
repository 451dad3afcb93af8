package ai.mab;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.primitives.ImmutableDoubleArray;
import com.google.common.primitives.ImmutableIntArray;

import io.reactivex.Observable;
import io.reactivex.subjects.PublishSubject;
import io.reactivex.subjects.Subject;
import lombok.Getter;
import lombok.val;

/**
 * Drives one policy against one environment for a fixed number of rounds.
 * <p>
 * Each round: draw a reader if running contextually, ask the policy for an
 * arm, sample the reward along the same path, update the policy, and record the
 * round. Regret is computed from the recorded arm sequence once the loop ends.
 */
public class SimulationRunner {
  private static final Logger log = LogManager.getLogger(SimulationRunner.class);

  /**
   * Source of environment-side draws: readers and rewards. Policies hold their
   * own.
   */
  @Getter
  private final RandomSource random;
  private final Subject<Round> rxRounds = PublishSubject.create();

  public SimulationRunner(final RandomSource random) {
    this.random = random;
  }

  /**
   * Rounds as they complete. Emission is synchronous with the simulation loop.
   */
  public Observable<Round> rxRounds() {
    return rxRounds;
  }

  @FunctionalInterface
  private interface Interaction {
    Pull play();
  }

  public SimulationResult run(final Policy policy, final RewardEnvironment environment, final int rounds,
      final boolean useContext) {
    checkArms(policy, environment);
    if (useContext) {
      return loop(policy, environment, rounds, () -> {
        final Reader reader = environment.generateReader(random);
        final int arm = policy.select();
        final double reward = environment.sampleWithContext(arm, reader, random);
        policy.update(arm, reward);
        return new Pull(arm, reward);
      });
    } else {
      return loop(policy, environment, rounds, () -> {
        final int arm = policy.select();
        final double reward = environment.sample(arm, random);
        policy.update(arm, reward);
        return new Pull(arm, reward);
      });
    }
  }

  public SimulationResult run(final Policy policy, final RewardEnvironment environment, final int rounds) {
    return run(policy, environment, rounds, false);
  }

  /**
   * Contextual policies always run on the contextual path.
   */
  public SimulationResult run(final ContextualPolicy policy, final RewardEnvironment environment, final int rounds) {
    checkArms(policy, environment);
    InvalidParameterException.check(policy.getDimension() == RewardEnvironment.FEATURE_DIMENSION,
        "policy expects context dimension %s but readers have %s", policy.getDimension(),
        RewardEnvironment.FEATURE_DIMENSION);

    return loop(policy, environment, rounds, () -> {
      final Reader reader = environment.generateReader(random);
      final double[] context = reader.context();
      final int arm = policy.select(context);
      final double reward = environment.sampleWithContext(arm, reader, random);
      policy.update(arm, context, reward);
      return new Pull(arm, reward);
    });
  }

  /**
   * Dispatches on the policy's declared capability: {@link ContextualPolicy}
   * instances always run contextually, other {@link Policy} instances honor
   * {@code useContext}.
   */
  public SimulationResult run(final BanditPolicy policy, final RewardEnvironment environment, final int rounds,
      final boolean useContext) {
    if (policy instanceof ContextualPolicy) {
      return run((ContextualPolicy) policy, environment, rounds);
    } else if (policy instanceof Policy) {
      return run((Policy) policy, environment, rounds, useContext);
    } else {
      throw new IllegalArgumentException("Unsupported policy type " + policy.getClass().getName());
    }
  }

  private static void checkArms(final BanditPolicy policy, final RewardEnvironment environment) {
    InvalidParameterException.check(policy.getArmCount() == environment.getArmCount(),
        "policy has %s arms but the environment has %s", policy.getArmCount(), environment.getArmCount());
  }

  private SimulationResult loop(final BanditPolicy policy, final RewardEnvironment environment, final int rounds,
      final Interaction interaction) {
    InvalidParameterException.check(rounds > 0, "round count must be positive, got %s", rounds);

    val rewards = ImmutableDoubleArray.builder(rounds);
    val arms = ImmutableIntArray.builder(rounds);
    val runningCtr = ImmutableDoubleArray.builder(rounds);
    double cumulativeReward = 0;

    for (int t = 0; t < rounds; ++t) {
      val pull = interaction.play();
      cumulativeReward += pull.reward();
      final double ctr = cumulativeReward / (t + 1);

      rewards.add(pull.reward());
      arms.add(pull.arm());
      runningCtr.add(ctr);
      rxRounds.onNext(new Round(t, pull.arm(), pull.reward(), ctr));
    }

    val armSequence = arms.build();
    val result = new SimulationResult(rewards.build(), armSequence, environment.regretOf(armSequence),
        runningCtr.build());
    log.debug("{}: {} rounds, total reward {}, final regret {}", policy, rounds, result.totalReward(),
        String.format("%.3f", result.finalRegret()));
    return result;
  }
}
