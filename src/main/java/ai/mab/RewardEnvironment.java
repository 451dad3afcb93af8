package ai.mab;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.stream.Collectors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.Doubles;
import com.google.common.primitives.ImmutableDoubleArray;
import com.google.common.primitives.ImmutableIntArray;

import lombok.Getter;
import lombok.val;

/**
 * Synthetic news-recommendation ground truth: a fixed set of articles with
 * hidden click-through rates. Instances are immutable; sampling consumes the
 * caller's {@link RandomSource} so one environment can be shared by any number
 * of runs.
 */
public class RewardEnvironment {
  private static final Logger log = LogManager.getLogger(RewardEnvironment.class);

  public static final double MIN_RATE = .05, RATE_SPAN = .25;
  public static final double RATE_SHAPE_ALPHA = 2, RATE_SHAPE_BETA = 5;
  public static final int FEATURE_DIMENSION = 5;

  public static final double PREFERENCE_BONUS = .1, DEMOGRAPHIC_BONUS = .05, MAX_CLICK_PROBABILITY = .95;
  public static final int YOUNG_BELOW = 35, SENIOR_FROM = 55, PREFERRED_CATEGORY_COUNT = 3, MAX_READER_ID = 100000;

  public static final ImmutableList<String> CATEGORIES = ImmutableList.of("Politics", "Technology", "Sports",
      "Entertainment", "Business", "Science", "Health", "World");
  public static final ImmutableSet<String> YOUNG_CATEGORIES = ImmutableSet.of("Technology", "Entertainment"),
      SENIOR_CATEGORIES = ImmutableSet.of("Health", "Business");
  public static final ImmutableList<Integer> AGES = ImmutableList.of(18, 25, 35, 45, 55, 65);
  public static final ImmutableList<String> LOCATIONS = ImmutableList.of("US-East", "US-West", "Europe", "Asia",
      "Other");

  private static final ImmutableList<String> TITLES = ImmutableList.of(
      "Breaking: Major Policy Changes Announced",
      "Tech Giant Unveils Revolutionary AI System",
      "Championship Game Ends in Dramatic Fashion",
      "Celebrity Interview: Exclusive Insights",
      "Market Analysis: What Investors Need to Know",
      "Scientific Breakthrough in Climate Research",
      "Health Tips: Expert Recommendations",
      "Global Summit Addresses Critical Issues",
      "Innovation in Renewable Energy Sector",
      "Sports Star Makes Historic Achievement",
      "Entertainment Industry Trends 2025",
      "Economic Forecast for Next Quarter",
      "Medical Advances in Treatment Options",
      "International Relations Update",
      "Startup Success Story Inspires Many");

  @Getter
  private final ImmutableList<Arm> arms;
  @Getter
  private final int optimalArm;
  @Getter
  private final double optimalRate;
  private final double[] trueRates;

  public RewardEnvironment(final List<Arm> arms) {
    InvalidParameterException.check(!arms.isEmpty(), "an environment needs at least one arm");
    final int dimension = arms.get(0).features().length();
    for (int i = 0; i < arms.size(); ++i) {
      final Arm arm = arms.get(i);
      InvalidParameterException.check(arm.id() == i, "arm at index %s has id %s", i, arm.id());
      InvalidParameterException.check(arm.trueSuccessRate() >= 0 && arm.trueSuccessRate() <= 1,
          "arm %s has success rate %s outside [0, 1]", i, arm.trueSuccessRate());
      InvalidParameterException.check(arm.features().length() == dimension,
          "arm %s has %s features, expected %s", i, arm.features().length(), dimension);
    }
    this.arms = ImmutableList.copyOf(arms);
    trueRates = arms.stream().mapToDouble(Arm::trueSuccessRate).toArray();

    int best = 0;
    for (int i = 1; i < trueRates.length; ++i) {
      if (trueRates[i] > trueRates[best]) {
        best = i;
      }
    }
    optimalArm = best;
    optimalRate = trueRates[best];
  }

  public static RewardEnvironment generate(final int armCount, final Long seed) {
    return generate(armCount, RandomSource.of(seed));
  }

  /**
   * Draws {@code armCount} success rates from Beta(2, 5), rescales them into
   * [0.05, 0.30] and assigns them in descending order, so arm 0 is the best.
   */
  public static RewardEnvironment generate(final int armCount, final RandomSource random) {
    InvalidParameterException.check(armCount > 0, "arm count must be positive, got %s", armCount);

    final double[] rates = new double[armCount];
    for (int i = 0; i < armCount; ++i) {
      rates[i] = MIN_RATE + random.nextBeta(RATE_SHAPE_ALPHA, RATE_SHAPE_BETA) * RATE_SPAN;
    }
    Arrays.sort(rates);
    Doubles.reverse(rates);

    val arms = new ArrayList<Arm>(armCount);
    for (int i = 0; i < armCount; ++i) {
      final String category = CATEGORIES.get(i % CATEGORIES.size());
      final String title = i < TITLES.size() ? TITLES.get(i) : String.format("Article %d: %s News", i + 1, category);
      arms.add(new Arm(i, title, category, rates[i], unitGaussian(FEATURE_DIMENSION, random)));
    }

    val environment = new RewardEnvironment(arms);
    log.info("Generated {} articles (seed {}); optimal arm {} at {}", armCount, random.getSeed(),
        environment.optimalArm, String.format("%.4f", environment.optimalRate));
    return environment;
  }

  private static ImmutableDoubleArray unitGaussian(final int dimension, final RandomSource random) {
    final double[] v = new double[dimension];
    double norm = 0;
    for (int i = 0; i < dimension; ++i) {
      v[i] = random.nextGaussian();
      norm += v[i] * v[i];
    }
    norm = Math.sqrt(norm);
    for (int i = 0; i < dimension; ++i) {
      v[i] /= norm;
    }
    return ImmutableDoubleArray.copyOf(v);
  }

  public int getArmCount() {
    return trueRates.length;
  }

  public ImmutableDoubleArray getTrueRates() {
    return ImmutableDoubleArray.copyOf(trueRates);
  }

  public double getTrueRate(final int arm) {
    return trueRates[InvalidArmException.check(arm, trueRates.length)];
  }

  /**
   * A Bernoulli draw at the arm's true rate: 1 for a click, 0 otherwise.
   */
  public double sample(final int arm, final RandomSource random) {
    return random.nextBernoulli(getTrueRate(arm)) ? 1 : 0;
  }

  /**
   * The click probability for {@code reader}: the arm's true rate plus the
   * preference and demographic bonuses, capped at
   * {@link #MAX_CLICK_PROBABILITY}.
   */
  public double clickProbability(final int arm, final Reader reader) {
    final double base = getTrueRate(arm);
    final String category = arms.get(arm).category();

    double bonus = reader.preferredCategories().contains(category) ? PREFERENCE_BONUS : 0;
    if (reader.age() < YOUNG_BELOW && YOUNG_CATEGORIES.contains(category)) {
      bonus += DEMOGRAPHIC_BONUS;
    } else if (reader.age() >= SENIOR_FROM && SENIOR_CATEGORIES.contains(category)) {
      bonus += DEMOGRAPHIC_BONUS;
    }

    return Math.min(MAX_CLICK_PROBABILITY, base + bonus);
  }

  public double sampleWithContext(final int arm, final Reader reader, final RandomSource random) {
    return random.nextBernoulli(clickProbability(arm, reader)) ? 1 : 0;
  }

  /**
   * Draws a reader whose preferred categories are sampled without replacement
   * from the categories present in this environment.
   */
  public Reader generateReader(final RandomSource random) {
    final int id = random.nextInt(MAX_READER_ID);
    final int age = random.choose(AGES);
    final int locationIndex = random.nextInt(LOCATIONS.size());

    val categories = new ArrayList<String>(arms.stream()
        .map(Arm::category)
        .collect(Collectors.toCollection(LinkedHashSet::new)));
    val preferred = ImmutableSet.<String>builder();
    final int count = Math.min(PREFERRED_CATEGORY_COUNT, categories.size());
    for (int i = 0; i < count; ++i) {
      preferred.add(categories.remove(random.nextInt(categories.size())));
    }

    val features = ImmutableDoubleArray.of(age / 100., (double) locationIndex / LOCATIONS.size(), .5, .5, .5);
    return new Reader(id, age, LOCATIONS.get(locationIndex), preferred.build(), features);
  }

  /**
   * Cumulative regret of an arm sequence against this environment's fixed ground
   * truth: {@code regret[t] = sum over i <= t of (optimalRate - trueRate[arms[i]])}.
   */
  public ImmutableDoubleArray regretOf(final ImmutableIntArray armSequence) {
    val regret = ImmutableDoubleArray.builder(armSequence.length());
    double cumulative = 0;
    for (int i = 0; i < armSequence.length(); ++i) {
      cumulative += optimalRate - getTrueRate(armSequence.get(i));
      regret.add(cumulative);
    }
    return regret.build();
  }
}
