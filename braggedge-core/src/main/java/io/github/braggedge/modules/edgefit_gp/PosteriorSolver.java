/*
 * Copyright (c) 2020-2025 The braggedge Development Team
 *
 * Permission is hereby granted, free of charge, to any person
 * obtaining a copy of this software and associated documentation
 * files (the "Software"), to deal in the Software without
 * restriction, including without limitation the rights to use,
 * copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the
 * Software is furnished to do so, subject to the following
 * conditions:
 *
 * The above copyright notice and this permission notice shall be
 * included in all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
 * EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES
 * OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND
 * NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT
 * HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY,
 * WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING
 * FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR
 * OTHER DEALINGS IN THE SOFTWARE.
 */

package io.github.braggedge.modules.edgefit_gp;

import io.github.braggedge.modules.edgefit_gp.covariance.CovarianceBackend;
import io.github.braggedge.modules.edgefit_gp.covariance.ReducedRankBackend;
import io.github.braggedge.util.LinAlgUtils;
import io.github.braggedge.util.MathUtils;
import io.github.braggedge.util.exceptions.NumericalFailureException;
import java.util.logging.Logger;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.jetbrains.annotations.NotNull;

/**
 * GP regression of the transition residual {@code y = Tr - g1(tof)}. Produces the posterior of
 * the derivative of the transition function on a test grid and the transition estimate at the
 * observations.
 */
public class PosteriorSolver {

  private static final Logger logger = Logger.getLogger(PosteriorSolver.class.getName());

  private final double jitter;

  public PosteriorSolver(double jitter) {
    if (!(jitter >= 0d)) {
      throw new IllegalArgumentException("Jitter must not be negative, got " + jitter);
    }
    this.jitter = jitter;
  }

  /**
   * Function-space solution, valid for any backend. Cost is cubic in the number of
   * observations.
   */
  public @NotNull DerivativePosterior solve(@NotNull CovarianceBackend backend,
      @NotNull double[] y, double noiseVariance, @NotNull double[] testTof)
      throws NumericalFailureException {
    checkInput(backend.getNumberOfObservations(), y, noiseVariance);

    final RealMatrix kyy = LinAlgUtils.symmetrize(
        LinAlgUtils.addToDiagonal(backend.covariance(), noiseVariance));
    final CholeskyDecomposition chol = factorize(kyy, "observation covariance");

    final RealVector weights = chol.getSolver().solve(new ArrayRealVector(y, false));
    final RealMatrix dKfy = backend.derivativeCrossCovariance(testTof);
    final double[] festp = backend.transitionCrossCovariance().operate(weights).toArray();
    final double[] g = dKfy.operate(weights).toArray();

    // alpha = L^-1 dKfy^T, V = ddKff - alpha^T alpha
    final RealMatrix alpha = LinAlgUtils.solveLowerTriangular(chol.getL(), dKfy.transpose());
    final RealMatrix v = LinAlgUtils.symmetrize(
        backend.derivativeCovariance(testTof).subtract(alpha.transpose().multiply(alpha)));

    checkFinite(g, festp, v);
    return new DerivativePosterior(testTof, g, v, festp, null);
  }

  /**
   * Weight-space solution for reduced-rank backends, linear in the number of observations and
   * cubic in the number of basis functions. With {@code B = Phi diag(sqrt(S))} and
   * {@code M = B^T B / s^2 + I = L L^T} the weight posterior has mean
   * {@code sqrt(S) M^-1 B^T y / s^2} and covariance {@code sqrt(S) M^-1 sqrt(S)}.
   */
  public @NotNull DerivativePosterior solveReducedRank(@NotNull ReducedRankBackend backend,
      @NotNull double[] y, double noiseVariance, @NotNull double[] testTof)
      throws NumericalFailureException {
    checkInput(backend.getNumberOfObservations(), y, noiseVariance);
    if (!(noiseVariance > 0d)) {
      throw new NumericalFailureException(
          "Weight-space solution needs a positive noise variance, got " + noiseVariance);
    }

    final double[] sqrtS = backend.spectralDensities();
    for (int j = 0; j < sqrtS.length; j++) {
      sqrtS[j] = Math.sqrt(sqrtS[j]);
    }
    final RealMatrix b = LinAlgUtils.scaleColumns(backend.observationBasis(), sqrtS);
    final RealMatrix m = LinAlgUtils.symmetrize(
        LinAlgUtils.addToDiagonal(b.transpose().multiply(b).scalarMultiply(1d / noiseVariance), 1d));
    final CholeskyDecomposition chol = factorize(m, "basis weight precision");

    final RealVector by = b.transpose().operate(new ArrayRealVector(y, false))
        .mapDivide(noiseVariance);
    final RealVector weightMean = chol.getSolver().solve(by)
        .ebeMultiply(new ArrayRealVector(sqrtS, false));

    final RealMatrix dPhi = backend.derivativeBasis(testTof);
    final double[] g = dPhi.operate(weightMean).toArray();
    final double[] festp = backend.transitionBasis().operate(weightMean).toArray();

    // F^T = L^-1 (dPhi sqrt(S))^T, V = F F^T
    final RealMatrix ft = LinAlgUtils.solveLowerTriangular(chol.getL(),
        LinAlgUtils.scaleColumns(dPhi, sqrtS).transpose());
    final RealMatrix factor = ft.transpose();
    final RealMatrix v = LinAlgUtils.symmetrize(factor.multiply(ft));

    checkFinite(g, festp, v);
    return new DerivativePosterior(testTof, g, v, festp, CovarianceSquareRoot.lowRank(factor));
  }

  /**
   * Cholesky with a single jittered retry.
   */
  private CholeskyDecomposition factorize(RealMatrix matrix, String name)
      throws NumericalFailureException {
    if (!MathUtils.allFinite(matrix)) {
      throw new NumericalFailureException("The " + name + " holds non-finite values");
    }
    try {
      return new CholeskyDecomposition(matrix,
          CholeskyDecomposition.DEFAULT_RELATIVE_SYMMETRY_THRESHOLD, 0d);
    } catch (NonPositiveDefiniteMatrixException e) {
      logger.fine(() -> "Cholesky of the " + name + " failed, retrying with jitter " + jitter);
    }
    try {
      return new CholeskyDecomposition(LinAlgUtils.addToDiagonal(matrix, jitter),
          CholeskyDecomposition.DEFAULT_RELATIVE_SYMMETRY_THRESHOLD, 0d);
    } catch (NonPositiveDefiniteMatrixException e) {
      throw new NumericalFailureException(
          "The " + name + " is not positive definite even with jitter " + jitter, e);
    }
  }

  private static void checkInput(int observations, double[] y, double noiseVariance)
      throws NumericalFailureException {
    if (y.length != observations) {
      throw new IllegalArgumentException(
          "Residual has " + y.length + " values, backend " + observations + " observations");
    }
    if (!MathUtils.allFinite(y) || !Double.isFinite(noiseVariance)) {
      throw new NumericalFailureException("Non-finite residual or noise variance");
    }
  }

  private static void checkFinite(double[] g, double[] festp, RealMatrix v)
      throws NumericalFailureException {
    if (!MathUtils.allFinite(g) || !MathUtils.allFinite(festp) || !MathUtils.allFinite(v)) {
      throw new NumericalFailureException("Posterior of the transition is not finite");
    }
  }
}
