package ai.mab;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

/**
 * Summary of one policy over repeated independent trials. Standard deviations
 * are population standard deviations; {@code meanCtr} is
 * {@code meanTotalReward / rounds}.
 */
public record ComparisonRow(String policy, double meanTotalReward, double stdTotalReward, double meanFinalRegret,
    double stdFinalRegret, double meanCtr) {

  public static ComparisonRow summarize(final String policy, final double[] totalRewards,
      final double[] finalRegrets, final int rounds) {
    final StandardDeviation std = new StandardDeviation(false);
    final double meanTotalReward = StatUtils.mean(totalRewards);
    return new ComparisonRow(policy, meanTotalReward, std.evaluate(totalRewards), StatUtils.mean(finalRegrets),
        std.evaluate(finalRegrets), meanTotalReward / rounds);
  }

  @Override
  public String toString() {
    return String.format("%-20s %10.2f +/- %-8.2f %10.3f +/- %-8.3f %.4f", policy, meanTotalReward, stdTotalReward,
        meanFinalRegret, stdFinalRegret, meanCtr);
  }
}
