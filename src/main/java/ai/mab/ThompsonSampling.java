package ai.mab;

import java.util.Arrays;

import org.apache.commons.math3.distribution.BetaDistribution;

import com.google.common.primitives.ImmutableDoubleArray;

import ai.mab.util.Util;
import lombok.Getter;

/**
 * Bayesian selection over Beta posteriors: samples each arm's posterior and
 * picks the largest draw.
 * <p>
 * With a (1, 1) prior, an arm with {@code k} successes and {@code m} failures
 * has posterior Beta(k + 1, m + 1).
 */
public class ThompsonSampling implements Policy {
  public static final double DEFAULT_PRIOR = 1, DEFAULT_CONFIDENCE = .95;

  public record BetaParameters(ImmutableDoubleArray successes, ImmutableDoubleArray failures) {
  }

  public record Intervals(ImmutableDoubleArray lower, ImmutableDoubleArray upper) {
  }

  private final PolicyState state;
  private RandomSource random;
  @Getter
  private final double alphaPrior, betaPrior;
  private final double[] successes, failures;

  public ThompsonSampling(final int armCount, final double alphaPrior, final double betaPrior,
      final RandomSource random) {
    InvalidParameterException.check(alphaPrior > 0 && betaPrior > 0, "Beta prior must be positive, got (%s, %s)",
        alphaPrior, betaPrior);
    state = new PolicyState(armCount);
    this.random = random;
    this.alphaPrior = alphaPrior;
    this.betaPrior = betaPrior;
    successes = Util.filled(armCount, alphaPrior);
    failures = Util.filled(armCount, betaPrior);
  }

  public ThompsonSampling(final int armCount, final RandomSource random) {
    this(armCount, DEFAULT_PRIOR, DEFAULT_PRIOR, random);
  }

  @Override
  public int getArmCount() {
    return state.getArmCount();
  }

  @Override
  public int select() {
    final double[] samples = new double[successes.length];
    for (int arm = 0; arm < samples.length; ++arm) {
      samples[arm] = random.nextBeta(successes[arm], failures[arm]);
    }
    return Util.argmax(samples, random);
  }

  /**
   * Counts the reward as a success if positive, otherwise as a failure. The
   * empirical value estimate is tracked as well, independent of the posterior.
   */
  @Override
  public void update(final int arm, final double reward) {
    state.record(arm, reward);
    if (reward > 0) {
      ++successes[arm];
    } else {
      ++failures[arm];
    }
  }

  @Override
  public void reset() {
    state.reset();
    Arrays.fill(successes, alphaPrior);
    Arrays.fill(failures, betaPrior);
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

  public BetaParameters getDistributionParameters() {
    return new BetaParameters(ImmutableDoubleArray.copyOf(successes), ImmutableDoubleArray.copyOf(failures));
  }

  private BetaDistribution posterior(final int arm) {
    InvalidArmException.check(arm, successes.length);
    return new BetaDistribution(random.generator(), successes[arm], failures[arm]);
  }

  public double getPosteriorDensity(final int arm, final double x) {
    return posterior(arm).density(x);
  }

  /**
   * Equal-tailed credible intervals of each arm's posterior.
   *
   * @throws InvalidParameterException if {@code confidence} is outside (0, 1)
   */
  public Intervals getConfidenceIntervals(final double confidence) {
    InvalidParameterException.check(confidence > 0 && confidence < 1, "confidence must be in (0, 1), got %s",
        confidence);

    final double tail = (1 - confidence) / 2;
    final ImmutableDoubleArray.Builder lower = ImmutableDoubleArray.builder(successes.length),
        upper = ImmutableDoubleArray.builder(successes.length);
    for (int arm = 0; arm < successes.length; ++arm) {
      final BetaDistribution posterior = posterior(arm);
      lower.add(posterior.inverseCumulativeProbability(tail));
      upper.add(posterior.inverseCumulativeProbability(1 - tail));
    }
    return new Intervals(lower.build(), upper.build());
  }

  public Intervals getConfidenceIntervals() {
    return getConfidenceIntervals(DEFAULT_CONFIDENCE);
  }

  @Override
  public String toString() {
    return String.format("Thompson(Beta(%.2f, %.2f))", alphaPrior, betaPrior);
  }
}
