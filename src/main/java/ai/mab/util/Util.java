package ai.mab.util;

import java.util.Arrays;

import ai.mab.RandomSource;
import lombok.experimental.UtilityClass;

@UtilityClass
public final class Util {
  /**
   * Returns the index of the maximum value, choosing uniformly at random among
   * all indices that share it. NaN ranks below every other value; if every
   * value is NaN, any index may be returned.
   */
  public int argmax(final double[] values, final RandomSource random) {
    double max = Double.NEGATIVE_INFINITY;
    int ties = 0;
    for (final double value : values) {
      if (Double.isNaN(value)) {
        continue;
      }
      if (ties == 0 || value > max) {
        max = value;
        ties = 1;
      } else if (value == max) {
        ++ties;
      }
    }

    if (ties == 0) {
      return random.nextInt(values.length);
    }

    int pick = ties == 1 ? 0 : random.nextInt(ties);
    for (int i = 0; i < values.length; ++i) {
      if (values[i] == max && pick-- == 0) {
        return i;
      }
    }
    throw new AssertionError("argmax fell through");
  }

  public double[] filled(final int length, final double value) {
    final double[] array = new double[length];
    Arrays.fill(array, value);
    return array;
  }
}
