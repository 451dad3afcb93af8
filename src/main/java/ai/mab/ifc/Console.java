package ai.mab.ifc;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import ai.mab.BanditPolicy;
import ai.mab.ComparisonRow;
import ai.mab.ComparisonRunner;
import ai.mab.EpsilonGreedy;
import ai.mab.LinUcb;
import ai.mab.RandomSource;
import ai.mab.RewardEnvironment;
import ai.mab.SimulationResult;
import ai.mab.SimulationRunner;
import ai.mab.ThompsonSampling;
import ai.mab.Ucb;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.val;

/**
 * Runs a session from the command line: one simulation per configured policy,
 * then a multi-trial comparison. Takes an optional path to a YAML
 * {@link SessionConfig}.
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class Console {
  private static final Logger log = LogManager.getLogger(Console.class);
  private static final int PROGRESS_STEPS = 10;

  public static void main(final String[] args) throws IOException {
    val config = args.length > 0 ? SessionConfig.load(Path.of(args[0])) : new SessionConfig();
    log.info("Starting session {}", config);

    val random = RandomSource.of(config.seed);
    val environment = RewardEnvironment.generate(config.articles, random);
    environment.getArms().forEach(arm -> log.info("  {}", arm));

    val policies = buildPolicies(config, environment.getArmCount(), random);

    for (val entry : policies.entrySet()) {
      val result = simulate(entry.getKey(), entry.getValue(), environment, config, random);
      log.info("{}: total reward {}, final regret {}, CTR {}", entry.getKey(), result.totalReward(),
          String.format("%.3f", result.finalRegret()), String.format("%.4f", result.totalReward() / result.rounds()));
    }

    val rows = new ComparisonRunner(random.child("comparison"))
        .compare(policies, environment, config.rounds, config.trials, config.contextual);
    System.out.printf("%-20s %23s %23s %s%n", "Policy", "Total reward", "Final regret", "CTR");
    for (final ComparisonRow row : rows) {
      System.out.println(row);
    }
    System.out.printf("Optimal CTR: %.4f (arm %d)%n", environment.getOptimalRate(), environment.getOptimalArm());
  }

  static Map<String, BanditPolicy> buildPolicies(final SessionConfig config, final int armCount,
      final RandomSource random) {
    final Map<String, BanditPolicy> policies = new LinkedHashMap<>();
    for (final String name : config.policies) {
      final RandomSource policyRandom = random.child(name);
      switch (name) {
        case SessionConfig.EPSILON_GREEDY:
          policies.put("Epsilon-Greedy", new EpsilonGreedy(armCount, config.epsilon, policyRandom));
          break;
        case SessionConfig.UCB:
          policies.put("UCB", new Ucb(armCount, config.c, policyRandom));
          break;
        case SessionConfig.THOMPSON:
          policies.put("Thompson Sampling",
              new ThompsonSampling(armCount, config.alphaPrior, config.betaPrior, policyRandom));
          break;
        case SessionConfig.LINUCB:
          policies.put("LinUCB", new LinUcb(armCount, RewardEnvironment.FEATURE_DIMENSION, config.linUcbAlpha,
              config.linUcbRegularization, policyRandom));
          break;
        default:
          throw new IllegalArgumentException("Unknown policy " + name);
      }
    }
    return policies;
  }

  private static SimulationResult simulate(final String name, final BanditPolicy policy,
      final RewardEnvironment environment, final SessionConfig config, final RandomSource random) {
    final int every = Math.max(1, config.rounds / PROGRESS_STEPS);
    val runner = new SimulationRunner(random.child("single/" + name));
    val subscription = runner.rxRounds()
        .filter(round -> (round.index() + 1) % every == 0)
        .subscribe(round -> log.debug("{} round {}: running CTR {}", name, round.index() + 1,
            String.format("%.4f", round.runningCtr())));
    try {
      policy.reset(random.child("single/" + name + "/policy"));
      return runner.run(policy, environment, config.rounds, config.contextual);
    } finally {
      subscription.dispose();
    }
  }
}
