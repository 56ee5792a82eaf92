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

package io.github.braggedge.modules.edgefit_baseline;

import io.github.braggedge.datamodel.BaselineParameters;
import io.github.braggedge.datamodel.FitWindow;
import io.github.braggedge.datamodel.TransmissionCurve;
import io.github.braggedge.util.MathUtils;
import io.github.braggedge.util.exceptions.NumericalFailureException;
import java.util.function.DoubleUnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.math3.analysis.MultivariateMatrixFunction;
import org.apache.commons.math3.analysis.MultivariateVectorFunction;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer.Optimum;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.jetbrains.annotations.NotNull;

/**
 * Fits the attenuation asymptotes on both sides of a Bragg edge in two sequential
 * Levenberg-Marquardt fits. Right of the edge only {@code exp(-(a0 + b0*t))} applies, left of
 * the edge the hkl term {@code exp(-(aHkl + bHkl*t))} is fitted with a0, b0 held fixed.
 * <p>
 * No analytic Jacobian is used, it is estimated by central differences.
 */
public class BaselineFitter {

  private static final Logger logger = Logger.getLogger(BaselineFitter.class.getName());

  private static final int MAX_ITERATIONS = 400;
  private static final int MAX_EVALUATIONS = 2000;
  // cube root of machine epsilon, optimal for central differences
  private static final double DIFF_STEP = 6.055454452393343e-6;

  private final double a00;
  private final double b00;
  private final double aHkl0;
  private final double bHkl0;

  public BaselineFitter() {
    this(0.5, 0.5, 0.5, 0.5);
  }

  public BaselineFitter(double a00, double b00, double aHkl0, double bHkl0) {
    this.a00 = a00;
    this.b00 = b00;
    this.aHkl0 = aHkl0;
    this.bHkl0 = bHkl0;
  }

  public @NotNull BaselineParameters fit(@NotNull TransmissionCurve curve,
      @NotNull FitWindow window) throws NumericalFailureException {
    window.validate(curve);

    // 1) right of the edge the hkl reflection does not attenuate
    final double[] postTof = slice(curve.getTofValues(), window.postEdgeStart(),
        window.postEdgeEnd());
    final double[] postTr = slice(curve.getTransmissionValues(), window.postEdgeStart(),
        window.postEdgeEnd());
    final double[] p1 = fitExponential(postTof, postTr, new double[]{a00, b00},
        t -> 1d, "post-edge");
    final double a0 = p1[0];
    final double b0 = p1[1];

    // 2) left of the edge, attenuation of everything else held fixed
    final double[] preTof = slice(curve.getTofValues(), window.preEdgeStart(),
        window.preEdgeEnd());
    final double[] preTr = slice(curve.getTransmissionValues(), window.preEdgeStart(),
        window.preEdgeEnd());
    final double[] p2 = fitExponential(preTof, preTr, new double[]{aHkl0, bHkl0},
        t -> Math.exp(-(a0 + b0 * t)), "pre-edge");

    final BaselineParameters baseline = new BaselineParameters(a0, b0, p2[0], p2[1]);
    logger.finest(() -> "Baseline fit: " + baseline);
    return baseline;
  }

  /**
   * Standard deviation of the residuals of both flat regions against their asymptote, used as
   * the measurement noise estimate.
   */
  public static double estimateNoiseStd(@NotNull TransmissionCurve curve,
      @NotNull FitWindow window, @NotNull BaselineParameters baseline) {
    final double[] residuals = new double[window.postEdgeSize() + window.preEdgeSize()];
    int k = 0;
    for (int i = window.postEdgeStart(); i <= window.postEdgeEnd(); i++) {
      final double t = curve.getTof(i);
      residuals[k++] = curve.getTransmission(i) - baseline.postEdgeAsymptote(t);
    }
    for (int i = window.preEdgeStart(); i <= window.preEdgeEnd(); i++) {
      final double t = curve.getTof(i);
      residuals[k++] = curve.getTransmission(i) - baseline.preEdgeAsymptote(t);
    }
    return MathUtils.std(residuals);
  }

  /**
   * Fits {@code fixed(t) * exp(-(p0 + p1*t))} to the data.
   */
  private double[] fitExponential(double[] tof, double[] transmission, double[] start,
      DoubleUnaryOperator fixedFactor, String region) throws NumericalFailureException {
    if (!MathUtils.allFinite(transmission)) {
      throw new NumericalFailureException("Non-finite transmission in the " + region + " range");
    }
    final MultivariateVectorFunction model = p -> {
      final double[] values = new double[tof.length];
      for (int i = 0; i < tof.length; i++) {
        values[i] = fixedFactor.applyAsDouble(tof[i]) * Math.exp(-(p[0] + p[1] * tof[i]));
      }
      return values;
    };
    final MultivariateMatrixFunction jacobian = p -> centralDifferences(model, p, tof.length);

    final LeastSquaresProblem problem = new LeastSquaresBuilder().start(start)
        .model(model, jacobian).target(transmission).maxIterations(MAX_ITERATIONS)
        .maxEvaluations(MAX_EVALUATIONS).lazyEvaluation(false).build();

    final double[] point;
    try {
      final Optimum optimum = new LevenbergMarquardtOptimizer().optimize(problem);
      point = optimum.getPoint().toArray();
      logger.finest(() -> region + " fit converged after " + optimum.getIterations()
          + " iterations, rms " + optimum.getRMS());
    } catch (MathIllegalStateException | MathIllegalArgumentException e) {
      logger.log(Level.FINE, "Baseline fit of the " + region + " range failed", e);
      throw new NumericalFailureException(
          "Baseline fit of the " + region + " range did not converge: " + e.getMessage(), e);
    }
    if (!MathUtils.allFinite(point)) {
      throw new NumericalFailureException(
          "Baseline fit of the " + region + " range produced non-finite parameters");
    }
    return point;
  }

  private static double[][] centralDifferences(MultivariateVectorFunction model, double[] p,
      int rows) {
    final double[][] jac = new double[rows][p.length];
    for (int j = 0; j < p.length; j++) {
      final double h = DIFF_STEP * Math.max(1d, Math.abs(p[j]));
      final double[] up = p.clone();
      final double[] down = p.clone();
      up[j] += h;
      down[j] -= h;
      final double[] fUp = model.value(up);
      final double[] fDown = model.value(down);
      for (int i = 0; i < rows; i++) {
        jac[i][j] = (fUp[i] - fDown[i]) / (2d * h);
      }
    }
    return jac;
  }

  private static double[] slice(double[] values, int from, int toInclusive) {
    final double[] out = new double[toInclusive - from + 1];
    System.arraycopy(values, from, out, 0, out.length);
    return out;
  }
}
