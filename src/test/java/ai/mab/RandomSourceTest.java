package ai.mab;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import lombok.val;

public class RandomSourceTest {
  @Test
  public void testSameSeedSameStream() {
    val a = new RandomSource(42);
    val b = new RandomSource(42);
    for (int i = 0; i < 100; ++i) {
      assertThat(a.nextUniform()).isEqualTo(b.nextUniform());
      assertThat(a.nextGaussian()).isEqualTo(b.nextGaussian());
      assertThat(a.nextBeta(2, 5)).isEqualTo(b.nextBeta(2, 5));
    }
  }

  @Test
  public void testChildIgnoresParentDraws() {
    val a = new RandomSource(7);
    val b = new RandomSource(7);
    for (int i = 0; i < 10; ++i) {
      b.nextUniform();
    }
    assertThat(a.child("trial").nextUniform()).isEqualTo(b.child("trial").nextUniform());
  }

  @Test
  public void testChildrenDiffer() {
    val random = new RandomSource(7);
    assertThat(random.child("a").getSeed()).isNotEqualTo(random.child("b").getSeed());
    assertThat(random.child("a").getSeed()).isNotEqualTo(random.getSeed());
  }

  @Test
  public void testRanges() {
    val random = new RandomSource(1);
    for (int i = 0; i < 1000; ++i) {
      assertThat(random.nextUniform()).isGreaterThanOrEqualTo(0).isLessThan(1);
      assertThat(random.nextInt(5)).isBetween(0, 4);
      assertThat(random.nextBeta(1, 1)).isBetween(0., 1.);
    }
  }

  @Test
  public void testBernoulliExtremes() {
    val random = new RandomSource(1);
    for (int i = 0; i < 100; ++i) {
      assertThat(random.nextBernoulli(0)).isFalse();
      assertThat(random.nextBernoulli(1)).isTrue();
    }
  }
}
