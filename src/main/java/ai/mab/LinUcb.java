package ai.mab;

import java.util.Optional;

import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.ImmutableDoubleArray;

import ai.mab.util.LinearAlgebra;
import ai.mab.util.Util;
import lombok.Getter;
import lombok.val;

/**
 * LinUCB with disjoint per-arm ridge regressions. Each arm keeps a design
 * matrix {@code A} (initially {@code λI}) and a response vector {@code b}
 * (initially zero); its score for context {@code x} is
 * {@code θ·x + α·sqrt(xᵀA⁻¹x)} with {@code θ = A⁻¹b}.
 * <p>
 * Selection costs one d×d factorization per arm per round.
 */
public class LinUcb implements ContextualPolicy {
  private static final Logger log = LogManager.getLogger(LinUcb.class);

  public static final double DEFAULT_ALPHA = 1, DEFAULT_REGULARIZATION = 1;

  @Getter
  private final int dimension;
  @Getter
  private final double alpha, regularization;
  private RandomSource random;
  private final PolicyState state;
  private final RealMatrix[] designMatrices;
  private final RealVector[] responseVectors;

  public LinUcb(final int armCount, final int dimension, final double alpha, final double regularization,
      final RandomSource random) {
    InvalidParameterException.check(dimension > 0, "context dimension must be positive, got %s", dimension);
    InvalidParameterException.check(regularization > 0, "regularization must be positive, got %s", regularization);
    state = new PolicyState(armCount);
    this.dimension = dimension;
    this.alpha = alpha;
    this.regularization = regularization;
    this.random = random;
    designMatrices = new RealMatrix[armCount];
    responseVectors = new RealVector[armCount];
    reset();
  }

  public LinUcb(final int armCount, final int dimension, final RandomSource random) {
    this(armCount, dimension, DEFAULT_ALPHA, DEFAULT_REGULARIZATION, random);
  }

  @Override
  public int getArmCount() {
    return state.getArmCount();
  }

  private RealVector contextVector(final double[] context) {
    InvalidParameterException.check(context.length == dimension, "context has dimension %s, expected %s",
        context.length, dimension);
    for (final double value : context) {
      InvalidParameterException.check(Double.isFinite(value), "context entries must be finite, got %s", value);
    }
    return new ArrayRealVector(context);
  }

  @Override
  public int select(final double[] context, final boolean useExplorationBonus) {
    val x = contextVector(context);
    final double[] scores = new double[designMatrices.length];
    for (int arm = 0; arm < scores.length; ++arm) {
      scores[arm] = score(designMatrices[arm], responseVectors[arm], x, alpha, useExplorationBonus);
    }
    return Util.argmax(scores, random);
  }

  /**
   * {@code θ·x}, plus {@code α·sqrt(xᵀA⁻¹x)} if {@code useExplorationBonus}. A
   * singular {@code A} scores with zero coefficients and takes its bonus from
   * the pseudo-inverse.
   */
  @VisibleForTesting
  static double score(final RealMatrix designMatrix, final RealVector responseVector, final RealVector x,
      final double alpha, final boolean useExplorationBonus) {
    final Optional<DecompositionSolver> solver = LinearAlgebra.solver(designMatrix);
    if (solver.isEmpty()) {
      log.debug("Singular design matrix; scoring with zero coefficients");
    }

    final double estimate = coefficients(solver, responseVector).dotProduct(x);
    if (!useExplorationBonus) {
      return estimate;
    }

    final RealMatrix inverse = solver.map(DecompositionSolver::getInverse)
        .orElseGet(() -> LinearAlgebra.pseudoInverse(designMatrix));
    return estimate + alpha * Math.sqrt(Math.max(0, LinearAlgebra.quadraticForm(inverse, x)));
  }

  /**
   * {@code θ = A⁻¹b}, or the zero vector if {@code A} is singular.
   */
  @VisibleForTesting
  static RealVector coefficients(final RealMatrix designMatrix, final RealVector responseVector) {
    return coefficients(LinearAlgebra.solver(designMatrix), responseVector);
  }

  private static RealVector coefficients(final Optional<DecompositionSolver> solver,
      final RealVector responseVector) {
    return solver.map(s -> s.solve(responseVector))
        .orElseGet(() -> new ArrayRealVector(responseVector.getDimension()));
  }

  @Override
  public void update(final int arm, final double[] context, final double reward) {
    InvalidArmException.check(arm, designMatrices.length);
    val x = contextVector(context);

    designMatrices[arm] = designMatrices[arm].add(x.outerProduct(x));
    responseVectors[arm] = responseVectors[arm].add(x.mapMultiply(reward));
    state.record(arm, reward);
  }

  /**
   * Per-arm coefficient estimates, solved on demand.
   */
  public ImmutableList<ImmutableDoubleArray> getCoefficientEstimates() {
    val estimates = ImmutableList.<ImmutableDoubleArray>builder();
    for (int arm = 0; arm < designMatrices.length; ++arm) {
      estimates.add(ImmutableDoubleArray.copyOf(coefficients(designMatrices[arm], responseVectors[arm]).toArray()));
    }
    return estimates.build();
  }

  public RealMatrix getDesignMatrix(final int arm) {
    return designMatrices[InvalidArmException.check(arm, designMatrices.length)].copy();
  }

  public RealVector getResponseVector(final int arm) {
    return responseVectors[InvalidArmException.check(arm, responseVectors.length)].copy();
  }

  @Override
  public void reset() {
    state.reset();
    for (int arm = 0; arm < designMatrices.length; ++arm) {
      designMatrices[arm] = MatrixUtils.createRealIdentityMatrix(dimension).scalarMultiply(regularization);
      responseVectors[arm] = new ArrayRealVector(dimension);
    }
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

  @Override
  public String toString() {
    return String.format("LinUCB(alpha = %.2f, lambda = %.2f, d = %d)", alpha, regularization, dimension);
  }
}
