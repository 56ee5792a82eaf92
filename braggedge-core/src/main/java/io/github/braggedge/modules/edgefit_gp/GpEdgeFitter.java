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

import io.github.braggedge.datamodel.BaselineParameters;
import io.github.braggedge.datamodel.EdgeEstimate;
import io.github.braggedge.datamodel.FitDiagnostics;
import io.github.braggedge.datamodel.FitWindow;
import io.github.braggedge.datamodel.GpHyperparameters;
import io.github.braggedge.datamodel.TransmissionCurve;
import io.github.braggedge.modules.edgefit_baseline.BaselineFitter;
import io.github.braggedge.modules.edgefit_gp.covariance.HilbertSpaceCovariance;
import io.github.braggedge.modules.edgefit_gp.covariance.InputScaler;
import io.github.braggedge.modules.edgefit_gp.covariance.SquaredExponentialCovariance;
import io.github.braggedge.util.MathUtils;
import io.github.braggedge.util.exceptions.NumericalFailureException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Estimates the position of a Bragg edge and its uncertainty from a single transmission curve.
 * <ol>
 *   <li>exponential asymptotes are fitted to both flat regions of the fit window</li>
 *   <li>the transition between them is regressed as a GP scaled by the edge height</li>
 *   <li>the derivative posterior of the transition is sampled, the edge of every realisation
 *   is its maximum derivative</li>
 * </ol>
 * Fits never throw for numerical problems or a window not matching the curve, a failure result
 * with NaN values is returned instead.
 */
public class GpEdgeFitter {

  private static final Logger logger = Logger.getLogger(GpEdgeFitter.class.getName());

  private final GpEdgeFitParameters parameters;

  public GpEdgeFitter() {
    this(GpEdgeFitParameters.defaults());
  }

  public GpEdgeFitter(@NotNull GpEdgeFitParameters parameters) {
    this.parameters = parameters;
  }

  public GpEdgeFitParameters getParameters() {
    return parameters;
  }

  public @NotNull EdgeFitResult fit(@NotNull TransmissionCurve curve, @NotNull FitWindow window) {
    return fit(curve, window, parameters.getHyperparameters(), parameters);
  }

  /**
   * @param hyperparameters used instead of the hyperparameters held by {@code config}
   */
  public @NotNull EdgeFitResult fit(@NotNull TransmissionCurve curve, @NotNull FitWindow window,
      @NotNull GpHyperparameters hyperparameters, @NotNull GpEdgeFitParameters config) {
    final int n = curve.getNumberOfValues();
    try {
      window.validate(curve);
    } catch (IllegalArgumentException e) {
      return failed(FitFailureReason.INVALID_INPUT, e.getMessage(), n);
    }
    if (!MathUtils.allFinite(curve.getTransmissionValues())) {
      return failed(FitFailureReason.INVALID_INPUT, "Transmission holds non-finite values", n);
    }

    final BaselineParameters baseline;
    try {
      baseline = new BaselineFitter(config.getA00(), config.getB00(), config.getAHkl0(),
          config.getBHkl0()).fit(curve, window);
    } catch (NumericalFailureException e) {
      return failed(FitFailureReason.BASELINE_FIT, e.getMessage(), n);
    }

    try {
      return fitTransition(curve, window, baseline, hyperparameters, config);
    } catch (NumericalFailureException e) {
      return failed(FitFailureReason.NUMERICAL, e.getMessage(), n);
    }
  }

  /**
   * Fits every curve with the same window. A failure of one curve does not stop the others.
   */
  public @NotNull List<EdgeFitResult> fitAll(@NotNull List<TransmissionCurve> curves,
      @NotNull FitWindow window) {
    final List<EdgeFitResult> results = new ArrayList<>(curves.size());
    for (TransmissionCurve curve : curves) {
      results.add(fit(curve, window));
    }
    final long failed = results.stream().filter(r -> !r.isSuccess()).count();
    logger.fine(() -> "Fitted " + curves.size() + " curves, " + failed + " failed");
    return results;
  }

  private EdgeFitResult fitTransition(TransmissionCurve curve, FitWindow window,
      BaselineParameters baseline, GpHyperparameters hyperparameters, GpEdgeFitParameters config)
      throws NumericalFailureException {
    final int n = curve.getNumberOfValues();
    final double[] tof = curve.getTofValues();
    final double[] y = new double[n];
    final double[] envelope = new double[n];
    for (int i = 0; i < n; i++) {
      y[i] = curve.getTransmission(i) - baseline.preEdgeAsymptote(tof[i]);
      envelope[i] = baseline.edgeHeight(tof[i]);
    }
    final double noiseStd = BaselineFitter.estimateNoiseStd(curve, window, baseline);
    final double noiseVariance = noiseStd * noiseStd;
    if (!Double.isFinite(noiseVariance)) {
      throw new NumericalFailureException("Measurement noise estimate is not finite");
    }

    double lengthscale = hyperparameters.lengthscale();
    if (config.getOptimization() == HyperparameterOptimization.ALL) {
      lengthscale = new HyperparameterOptimizer(tof, envelope, y, hyperparameters.sigF(),
          noiseVariance).optimise();
    }
    final double l = lengthscale;
    logger.fine(() -> "Baseline " + baseline + ", noise std " + noiseStd + ", lengthscale " + l);

    // the edge lies between the end of the pre-edge and the start of the post-edge range
    final double gridStart = curve.getTof(window.preEdgeEnd());
    final double gridEnd = curve.getTof(window.postEdgeStart());
    final int nx = hyperparameters.testPoints();
    final InputScaler scaler = InputScaler.fromObservations(tof);
    final PosteriorSolver solver = new PosteriorSolver(config.getJitter());

    final double[] testTof;
    final @Nullable double[] fineGrid;
    final DerivativePosterior posterior;
    switch (config.getScheme()) {
      case FULL -> {
        testTof = MathUtils.linspace(gridStart, gridEnd, nx);
        fineGrid = null;
        posterior = solver.solve(new SquaredExponentialCovariance(scaler, tof, envelope,
            hyperparameters.sigF(), l), y, noiseVariance, testTof);
      }
      case INTERP -> {
        testTof = MathUtils.linspace(gridStart, gridEnd, n);
        fineGrid = MathUtils.linspace(gridStart, gridEnd, nx);
        posterior = solver.solve(new SquaredExponentialCovariance(scaler, tof, envelope,
            hyperparameters.sigF(), l), y, noiseVariance, testTof);
      }
      case HILBERT_SPACE -> {
        testTof = MathUtils.linspace(gridStart, gridEnd, nx);
        fineGrid = null;
        posterior = solver.solveReducedRank(new HilbertSpaceCovariance(scaler, tof, envelope,
                hyperparameters.sigF(), l, config.getBasisFunctions(), config.getDomainHalfWidth()),
            y, noiseVariance, testTof);
      }
      default -> throw new IllegalStateException("Unhandled GP scheme " + config.getScheme());
    }

    final EdgeEstimate estimate = new MonteCarloEdgeLocator(hyperparameters.samples(),
        config.getJitter()).locate(posterior, fineGrid, createRandom(config));

    final FitResultAssembler assembler = new FitResultAssembler();
    final double[] fitCurve = assembler.reconstruct(curve, baseline,
        posterior.getTransitionEstimate());
    final FitDiagnostics diagnostics = assembler.assemble(curve, fitCurve, noiseStd, l, testTof,
        posterior.getMean());
    logger.fine(() -> "Edge at " + estimate.edgePosition() + " +- " + estimate.sigma());
    return EdgeFitResult.success(estimate, fitCurve, diagnostics, baseline);
  }

  private static RandomGenerator createRandom(GpEdgeFitParameters config) {
    final Long seed = config.getSeed();
    return seed == null ? new Well19937c() : new Well19937c(seed);
  }

  private static EdgeFitResult failed(FitFailureReason reason, String message, int n) {
    logger.warning(() -> "Error during edge fit (" + reason + "): " + message);
    return EdgeFitResult.failure(reason, message == null ? reason.toString() : message, n);
  }
}
