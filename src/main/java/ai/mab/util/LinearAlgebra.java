package ai.mab.util;

import java.util.Optional;

import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;

import lombok.experimental.UtilityClass;
import lombok.val;

@UtilityClass
public final class LinearAlgebra {
  /**
   * An LU solver for {@code a}, or empty if {@code a} is numerically singular.
   */
  public Optional<DecompositionSolver> solver(final RealMatrix a) {
    val solver = new LUDecomposition(a).getSolver();
    return solver.isNonSingular() ? Optional.of(solver) : Optional.empty();
  }

  /**
   * Moore-Penrose pseudo-inverse. Defined for every matrix, singular or not.
   */
  public RealMatrix pseudoInverse(final RealMatrix a) {
    return new SingularValueDecomposition(a).getSolver().getInverse();
  }

  /** {@code xᵀ·m·x} */
  public double quadraticForm(final RealMatrix m, final RealVector x) {
    return x.dotProduct(m.operate(x));
  }
}
