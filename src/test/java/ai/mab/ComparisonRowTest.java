package ai.mab;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

import lombok.val;

public class ComparisonRowTest {
  @Test
  public void testSummarize() {
    val row = ComparisonRow.summarize("p", new double[] { 1, 3 }, new double[] { 2, 2 }, 10);
    assertThat(row.policy()).isEqualTo("p");
    assertThat(row.meanTotalReward()).isEqualTo(2);
    assertThat(row.stdTotalReward()).isCloseTo(1, within(1e-12));
    assertThat(row.meanFinalRegret()).isEqualTo(2);
    assertThat(row.stdFinalRegret()).isZero();
    assertThat(row.meanCtr()).isCloseTo(.2, within(1e-12));
  }

  @Test
  public void testSingleTrial() {
    val row = ComparisonRow.summarize("p", new double[] { 5 }, new double[] { 1.5 }, 5);
    assertThat(row.stdTotalReward()).isZero();
    assertThat(row.stdFinalRegret()).isZero();
    assertThat(row.meanCtr()).isEqualTo(1);
  }

  @Test
  public void testToString() {
    assertThat(ComparisonRow.summarize("UCB", new double[] { 1, 3 }, new double[] { 2, 2 }, 10).toString())
        .startsWith("UCB").contains("+/-").matches("\\p{ASCII}*");
  }
}
