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

import io.github.braggedge.modules.edgefit_gp.covariance.InputScaler;
import io.github.braggedge.util.exceptions.NumericalFailureException;
import java.util.logging.Logger;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleValueChecker;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunctionGradient;
import org.apache.commons.math3.optim.nonlinear.scalar.gradient.NonLinearConjugateGradientOptimizer;
import org.apache.commons.math3.optim.nonlinear.scalar.gradient.NonLinearConjugateGradientOptimizer.Formula;
import org.jetbrains.annotations.NotNull;

/**
 * Chooses the lengthscale of the squared-exponential transition kernel by minimising the
 * negative log marginal likelihood over {@code theta = log(l)}, starting at {@code l = 1}. The
 * result is floored at ten observation sampling intervals (in rescaled input units), below which
 * the kernel starts fitting the noise.
 */
public class HyperparameterOptimizer {

  private static final Logger logger = Logger.getLogger(HyperparameterOptimizer.class.getName());

  public static final double FLOOR_SAMPLING_INTERVALS = 10d;

  private static final int MAX_ITERATIONS = 200;
  private static final int MAX_EVALUATIONS = 2000;
  private static final double MIN_LENGTHSCALE = 1e-12;
  private static final double MAX_LENGTHSCALE = 1e12;

  private final double[] x;
  private final double[] envelope;
  private final double[] y;
  private final double sigF2;
  private final double noiseVariance;

  /**
   * @param tof           observation time-of-flight
   * @param envelope      g2 - g1 at the observations
   * @param y             transition residual {@code Tr - g1}
   * @param noiseVariance measurement noise variance
   */
  public HyperparameterOptimizer(@NotNull double[] tof, @NotNull double[] envelope,
      @NotNull double[] y, double sigF, double noiseVariance) {
    if (tof.length != envelope.length || tof.length != y.length) {
      throw new IllegalArgumentException("Inputs differ in length");
    }
    this.x = InputScaler.fromObservations(tof).scale(tof);
    this.envelope = envelope.clone();
    this.y = y.clone();
    this.sigF2 = sigF * sigF;
    this.noiseVariance = noiseVariance;
  }

  /**
   * @return optimised lengthscale, at least {@link #lengthscaleFloor()}
   */
  public double optimise() throws NumericalFailureException {
    final NonLinearConjugateGradientOptimizer optimizer = new NonLinearConjugateGradientOptimizer(
        Formula.POLAK_RIBIERE, new SimpleValueChecker(1e-10, 1e-10));
    final PointValuePair optimum;
    try {
      optimum = optimizer.optimize(new MaxEval(MAX_EVALUATIONS), new MaxIter(MAX_ITERATIONS),
          GoalType.MINIMIZE, new InitialGuess(new double[]{0d}),
          new ObjectiveFunction(theta -> evaluate(theta[0], false)[0]),
          new ObjectiveFunctionGradient(theta -> new double[]{evaluate(theta[0], true)[1]}));
    } catch (MathIllegalStateException | MathIllegalArgumentException e) {
      throw new NumericalFailureException(
          "Lengthscale optimisation failed: " + e.getMessage(), e);
    }
    final double optimised = Math.exp(optimum.getPoint()[0]);
    final double floor = lengthscaleFloor();
    logger.fine(() -> "Optimised lengthscale " + optimised + " (floor " + floor + "), nlml "
        + optimum.getValue());
    if (!Double.isFinite(optimised)) {
      throw new NumericalFailureException("Optimised lengthscale is not finite");
    }
    return Math.max(floor, optimised);
  }

  public double lengthscaleFloor() {
    return FLOOR_SAMPLING_INTERVALS * (x[1] - x[0]);
  }

  public double negativeLogMarginalLikelihood(double logLengthscale)
      throws NumericalFailureException {
    return evaluateChecked(logLengthscale, false)[0];
  }

  /**
   * @return derivative of the negative log marginal likelihood with respect to log(l)
   */
  public double gradient(double logLengthscale) throws NumericalFailureException {
    return evaluateChecked(logLengthscale, true)[1];
  }

  private double[] evaluateChecked(double theta, boolean withGradient)
      throws NumericalFailureException {
    try {
      return evaluate(theta, withGradient);
    } catch (MathIllegalArgumentException e) {
      throw new NumericalFailureException(
          "Marginal likelihood not defined at log(l) = " + theta + ": " + e.getMessage(), e);
    }
  }

  /**
   * @return {nlml, d nlml / d theta}, the gradient entry is NaN unless requested
   */
  private double[] evaluate(double theta, boolean withGradient) {
    final double l = Math.min(MAX_LENGTHSCALE, Math.max(MIN_LENGTHSCALE, Math.exp(theta)));
    final int n = x.length;
    final double[][] k = new double[n][n];
    final double[][] scaledDist = new double[n][n];
    for (int i = 0; i < n; i++) {
      for (int j = 0; j <= i; j++) {
        final double d = (x[i] - x[j]) / l;
        final double v = sigF2 * Math.exp(-0.5 * d * d) * envelope[i] * envelope[j];
        k[i][j] = v;
        k[j][i] = v;
        scaledDist[i][j] = d * d;
        scaledDist[j][i] = d * d;
      }
    }
    final RealMatrix kyy = new Array2DRowRealMatrix(k, true);
    for (int i = 0; i < n; i++) {
      kyy.addToEntry(i, i, noiseVariance);
    }
    final CholeskyDecomposition chol = new CholeskyDecomposition(kyy,
        CholeskyDecomposition.DEFAULT_RELATIVE_SYMMETRY_THRESHOLD, 0d);
    final RealVector alpha = chol.getSolver().solve(new ArrayRealVector(y, false));

    double logDet = 0d;
    final RealMatrix lower = chol.getL();
    for (int i = 0; i < n; i++) {
      logDet += Math.log(lower.getEntry(i, i));
    }
    final double nlml = 0.5 * alpha.dotProduct(new ArrayRealVector(y, false)) + logDet
        + 0.5 * n * Math.log(2d * Math.PI);
    if (!withGradient) {
      return new double[]{nlml, Double.NaN};
    }

    // dK/dtheta = K .* d^2, gradient = 0.5 tr(Kyy^-1 dK) - 0.5 alpha^T dK alpha
    final RealMatrix inverse = chol.getSolver().getInverse();
    final double[] a = alpha.toArray();
    double trace = 0d;
    double quad = 0d;
    for (int i = 0; i < n; i++) {
      for (int j = 0; j < n; j++) {
        final double dk = k[i][j] * scaledDist[i][j];
        trace += inverse.getEntry(j, i) * dk;
        quad += a[i] * dk * a[j];
      }
    }
    return new double[]{nlml, 0.5 * trace - 0.5 * quad};
  }
}
