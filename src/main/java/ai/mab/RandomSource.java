package ai.mab;

import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.math3.distribution.BetaDistribution;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;

import com.google.common.hash.Hashing;

import lombok.Getter;

/**
 * An explicit, seedable stream of random draws. Every stochastic operation in
 * this package consumes one of these rather than hidden global state, so a run
 * is reproducible from its seeds alone.
 * <p>
 * Instances are not thread-safe. Independent streams should be obtained with
 * {@link #child(String)}.
 */
public class RandomSource {
  @Getter
  private final long seed;
  private final RandomGenerator generator;

  public RandomSource(final long seed) {
    this.seed = seed;
    generator = new MersenneTwister(seed);
  }

  /**
   * Creates a source seeded from the system clock, for callers that did not ask
   * for reproducibility.
   */
  public static RandomSource unseeded() {
    return new RandomSource(System.nanoTime());
  }

  public static RandomSource of(final Long seed) {
    return seed == null ? unseeded() : new RandomSource(seed);
  }

  /**
   * Derives an independent stream from this source's seed and a name. The
   * derivation does not consume draws from this source, so children are the same
   * regardless of the order in which they are requested.
   */
  public RandomSource child(final String name) {
    return new RandomSource(Hashing.murmur3_128()
        .newHasher()
        .putLong(seed)
        .putString(name, StandardCharsets.UTF_8)
        .hash()
        .asLong());
  }

  /**
   * The underlying generator, for library distributions that sample from it.
   */
  RandomGenerator generator() {
    return generator;
  }

  /** Uniform on [0, 1). */
  public double nextUniform() {
    return generator.nextDouble();
  }

  /** Uniform on [0, bound). */
  public int nextInt(final int bound) {
    return generator.nextInt(bound);
  }

  public double nextGaussian() {
    return generator.nextGaussian();
  }

  public boolean nextBernoulli(final double p) {
    return generator.nextDouble() < p;
  }

  public double nextBeta(final double alpha, final double beta) {
    return new BetaDistribution(generator, alpha, beta).sample();
  }

  public <T> T choose(final List<T> options) {
    return options.get(nextInt(options.size()));
  }
}
