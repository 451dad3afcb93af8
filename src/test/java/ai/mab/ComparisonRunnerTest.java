package ai.mab;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableMap;

import lombok.val;

public class ComparisonRunnerTest {
  private final RewardEnvironment environment = RewardEnvironment.generate(5, 42L);

  private static Map<String, BanditPolicy> policies() {
    final Map<String, BanditPolicy> policies = new LinkedHashMap<>();
    policies.put("Epsilon-Greedy", new EpsilonGreedy(5, new RandomSource(1)));
    policies.put("UCB", new Ucb(5, new RandomSource(2)));
    policies.put("Thompson Sampling", new ThompsonSampling(5, new RandomSource(3)));
    return policies;
  }

  @Test
  public void testRows() {
    val rows = new ComparisonRunner(new RandomSource(7)).compare(policies(), environment, 100, 3);
    assertThat(rows).extracting(ComparisonRow::policy).containsExactly("Epsilon-Greedy", "UCB", "Thompson Sampling");
    for (final ComparisonRow row : rows) {
      assertThat(row.meanCtr()).isEqualTo(row.meanTotalReward() / 100);
      assertThat(row.meanTotalReward()).isBetween(0., 100.);
      assertThat(row.stdTotalReward()).isGreaterThanOrEqualTo(0);
      assertThat(row.meanFinalRegret()).isGreaterThanOrEqualTo(0);
      assertThat(row.stdFinalRegret()).isGreaterThanOrEqualTo(0);
    }
  }

  @Test
  public void testResetsBetweenTrials() {
    val policy = new EpsilonGreedy(5, new RandomSource(1));
    new ComparisonRunner(new RandomSource(7)).compare(ImmutableMap.of("e", policy), environment, 50, 4);
    assertThat(policy.getMetrics().totalPulls()).isEqualTo(50);
  }

  @Test
  public void testEnvironmentDrawsIndependentOfOrder() {
    val forward = new ComparisonRunner(new RandomSource(7)).compare(
        ImmutableMap.of("UCB", new Ucb(5, new RandomSource(2)), "TS", new ThompsonSampling(5, new RandomSource(3))),
        environment, 100, 2);
    val reversed = new ComparisonRunner(new RandomSource(7)).compare(
        ImmutableMap.of("TS", new ThompsonSampling(5, new RandomSource(3)), "UCB", new Ucb(5, new RandomSource(2))),
        environment, 100, 2);
    assertThat(reversed.get(1)).isEqualTo(forward.get(0));
    assertThat(reversed.get(0)).isEqualTo(forward.get(1));
  }

  @Test
  public void testRepeatableOnSamePolicies() {
    val policies = policies();
    policies.put("LinUCB", new LinUcb(5, RewardEnvironment.FEATURE_DIMENSION, new RandomSource(4)));
    val runner = new ComparisonRunner(new RandomSource(7));

    val first = runner.compare(policies, environment, 200, 2, true);
    val second = runner.compare(policies, environment, 200, 2, true);
    assertThat(second).isEqualTo(first);
  }

  @Test
  public void testIndependentOfPolicyConstructionSeed() {
    val first = new ComparisonRunner(new RandomSource(7))
        .compare(ImmutableMap.of("e", new EpsilonGreedy(5, new RandomSource(1))), environment, 200, 2);
    val second = new ComparisonRunner(new RandomSource(7))
        .compare(ImmutableMap.of("e", new EpsilonGreedy(5, new RandomSource(99))), environment, 200, 2);
    assertThat(second).isEqualTo(first);
  }

  @Test
  public void testContextual() {
    val rows = new ComparisonRunner(new RandomSource(7)).compare(
        ImmutableMap.of("LinUCB", new LinUcb(5, RewardEnvironment.FEATURE_DIMENSION, new RandomSource(4))),
        environment, 50, 2, true);
    assertThat(rows).hasSize(1);
    assertThat(rows.get(0).meanCtr()).isEqualTo(rows.get(0).meanTotalReward() / 50);
  }

  @Test
  public void testInvalidArguments() {
    val runner = new ComparisonRunner(new RandomSource(7));
    assertThatThrownBy(() -> runner.compare(Map.of(), environment, 100, 2))
        .isInstanceOf(InvalidParameterException.class);
    assertThatThrownBy(() -> runner.compare(policies(), environment, 100, 0))
        .isInstanceOf(InvalidParameterException.class);
    assertThatThrownBy(() -> runner.compare(policies(), environment, 0, 2))
        .isInstanceOf(InvalidParameterException.class);
  }
}
