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

import io.github.braggedge.util.LinAlgUtils;
import io.github.braggedge.util.MathUtils;
import io.github.braggedge.util.exceptions.NumericalFailureException;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.RealMatrix;
import org.jetbrains.annotations.NotNull;

/**
 * Sampling transform F of a covariance matrix C with {@code F * F^T = C}, so {@code F * z} with
 * standard normal z has covariance C. The lower Cholesky factor is used when C is numerically
 * positive definite, otherwise the symmetric square root from an eigen-decomposition. The
 * symmetric root is its own transpose, so both factors are applied the same way. Reduced-rank
 * posteriors supply a rectangular n x m factor directly.
 */
public final class CovarianceSquareRoot {

  private static final Logger logger = Logger.getLogger(CovarianceSquareRoot.class.getName());

  public enum Method {
    CHOLESKY, SYMMETRIC_SQRT, LOW_RANK
  }

  private final double[][] factor;
  private final Method method;

  private CovarianceSquareRoot(double[][] factor, Method method) {
    this.factor = factor;
    this.method = method;
  }

  /**
   * Factorises {@code covariance + jitter * I}, falling back to the symmetric square root if
   * Cholesky fails.
   *
   * @throws NumericalFailureException if the matrix holds non-finite values or the fallback
   *                                   fails as well
   */
  public static CovarianceSquareRoot of(@NotNull RealMatrix covariance, double jitter)
      throws NumericalFailureException {
    if (!MathUtils.allFinite(covariance)) {
      throw new NumericalFailureException("Covariance matrix holds non-finite values");
    }
    final RealMatrix jittered = LinAlgUtils.symmetrize(
        LinAlgUtils.addToDiagonal(covariance, jitter));
    try {
      return cholesky(jittered);
    } catch (NonPositiveDefiniteMatrixException e) {
      logger.warning(() -> "Covariance is not positive definite after adding jitter " + jitter
          + ", sampling with the symmetric matrix square root instead of Cholesky");
      return symmetricSqrt(jittered);
    }
  }

  /**
   * @throws NonPositiveDefiniteMatrixException if a pivot is not strictly positive
   */
  public static CovarianceSquareRoot cholesky(@NotNull RealMatrix covariance) {
    final CholeskyDecomposition chol = new CholeskyDecomposition(covariance,
        CholeskyDecomposition.DEFAULT_RELATIVE_SYMMETRY_THRESHOLD, 0d);
    return new CovarianceSquareRoot(chol.getL().getData(), Method.CHOLESKY);
  }

  public static CovarianceSquareRoot symmetricSqrt(@NotNull RealMatrix covariance)
      throws NumericalFailureException {
    final EigenDecomposition eigen;
    try {
      eigen = new EigenDecomposition(LinAlgUtils.symmetrize(covariance));
    } catch (MathIllegalStateException e) {
      throw new NumericalFailureException(
          "Eigen-decomposition of the covariance failed: " + e.getMessage(), e);
    }
    final double[] values = eigen.getRealEigenvalues();
    final double[] roots = new double[values.length];
    double clipped = 0d;
    for (int i = 0; i < values.length; i++) {
      // round-off may leave eigenvalues of a semi-definite matrix slightly negative
      if (values[i] < 0d) {
        clipped = Math.min(clipped, values[i]);
      }
      roots[i] = Math.sqrt(Math.max(values[i], 0d));
    }
    if (clipped < 0d) {
      final double mostNegative = clipped;
      logger.fine(() -> "Clipped negative eigenvalues down to " + mostNegative);
    }
    final RealMatrix v = eigen.getV();
    final RealMatrix sqrt = LinAlgUtils.scaleColumns(v, roots).multiply(v.transpose());
    if (!MathUtils.allFinite(sqrt)) {
      throw new NumericalFailureException("Matrix square root of the covariance is not finite");
    }
    logger.log(Level.FINEST, "Symmetric square root computed for {0}x{0} covariance",
        values.length);
    return new CovarianceSquareRoot(LinAlgUtils.symmetrize(sqrt).getData(),
        Method.SYMMETRIC_SQRT);
  }

  /**
   * Wraps a known n x m factor.
   */
  public static CovarianceSquareRoot lowRank(@NotNull RealMatrix factor) {
    return new CovarianceSquareRoot(factor.getData(), Method.LOW_RANK);
  }

  public Method getMethod() {
    return method;
  }

  public int getDimension() {
    return factor.length;
  }

  /**
   * @return length of the standard normal vectors {@link #transform(double[])} expects
   */
  public int getRank() {
    return factor.length == 0 ? 0 : factor[0].length;
  }

  /**
   * @return {@code F * z}
   */
  public double[] transform(@NotNull double[] z) {
    final int n = factor.length;
    final double[] out = new double[n];
    final boolean lower = method == Method.CHOLESKY;
    for (int i = 0; i < n; i++) {
      final double[] row = factor[i];
      final int limit = lower ? i + 1 : row.length;
      double sum = 0d;
      for (int j = 0; j < limit; j++) {
        sum += row[j] * z[j];
      }
      out[i] = sum;
    }
    return out;
  }

  /**
   * @return copy of F
   */
  public double[][] getFactor() {
    final double[][] copy = new double[factor.length][];
    for (int i = 0; i < factor.length; i++) {
      copy[i] = factor[i].clone();
    }
    return copy;
  }
}
