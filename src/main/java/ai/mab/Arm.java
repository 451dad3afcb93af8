package ai.mab;

import com.google.common.primitives.ImmutableDoubleArray;

/**
 * One selectable article. The title and category are descriptive; only the
 * category participates in reward generation, through the contextual bonus.
 */
public record Arm(int id, String title, String category, double trueSuccessRate, ImmutableDoubleArray features) {
  @Override
  public String toString() {
    return String.format("%d: %s [%s] (%.4f)", id, title, category, trueSuccessRate);
  }
}
