package ai.mab;

import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.ImmutableDoubleArray;

/**
 * A simulated reader, drawn once per contextual interaction. {@link #features()}
 * is the context vector handed to contextual policies.
 */
public record Reader(int id, int age, String location, ImmutableSet<String> preferredCategories,
    ImmutableDoubleArray features) {

  public double[] context() {
    return features.toArray();
  }
}
