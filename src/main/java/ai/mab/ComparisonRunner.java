package ai.mab;

import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.collect.ImmutableList;

import lombok.RequiredArgsConstructor;
import lombok.val;

/**
 * Runs each policy through repeated independent trials against a shared
 * environment and summarizes total reward and final regret.
 * <p>
 * Each trial reseeds its policy and its environment draws from streams derived
 * from the policy name and trial index, so the outcome does not depend on the
 * order in which policies or trials run, nor on earlier use of the policy.
 */
@RequiredArgsConstructor
public class ComparisonRunner {
  private static final Logger log = LogManager.getLogger(ComparisonRunner.class);

  private final RandomSource random;

  public ImmutableList<ComparisonRow> compare(final Map<String, ? extends BanditPolicy> policies,
      final RewardEnvironment environment, final int rounds, final int trials, final boolean useContext) {
    InvalidParameterException.check(!policies.isEmpty(), "no policies to compare");
    InvalidParameterException.check(rounds > 0, "round count must be positive, got %s", rounds);
    InvalidParameterException.check(trials > 0, "trial count must be positive, got %s", trials);

    val rows = ImmutableList.<ComparisonRow>builder();
    for (final Map.Entry<String, ? extends BanditPolicy> entry : policies.entrySet()) {
      final String name = entry.getKey();
      final BanditPolicy policy = entry.getValue();
      final double[] totalRewards = new double[trials], finalRegrets = new double[trials];

      for (int trial = 0; trial < trials; ++trial) {
        val trialRandom = random.child(name + "#" + trial);
        policy.reset(trialRandom.child("policy"));
        val result = new SimulationRunner(trialRandom.child("environment"))
            .run(policy, environment, rounds, useContext);
        totalRewards[trial] = result.totalReward();
        finalRegrets[trial] = result.finalRegret();
        log.debug("{} trial {}/{}: reward {}, regret {}", name, trial + 1, trials, totalRewards[trial],
            finalRegrets[trial]);
      }

      val row = ComparisonRow.summarize(name, totalRewards, finalRegrets, rounds);
      log.info("Compared {}: mean reward {}, mean regret {}", name, String.format("%.2f", row.meanTotalReward()),
          String.format("%.3f", row.meanFinalRegret()));
      rows.add(row);
    }
    return rows.build();
  }

  public ImmutableList<ComparisonRow> compare(final Map<String, ? extends BanditPolicy> policies,
      final RewardEnvironment environment, final int rounds, final int trials) {
    return compare(policies, environment, rounds, trials, false);
  }
}
