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

import io.github.braggedge.datamodel.EdgeEstimate;
import io.github.braggedge.util.MathUtils;
import io.github.braggedge.util.exceptions.NumericalFailureException;
import java.util.logging.Logger;
import org.apache.commons.math3.analysis.interpolation.SplineInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.random.RandomGenerator;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Propagates the derivative posterior into a distribution of edge locations. The edge of each
 * realisation is the location of its maximum derivative; the estimate is the mean and standard
 * deviation over the posterior mean and {@code samples} posterior realisations.
 * <p>
 * With a fine grid, every realisation is interpolated by a natural cubic spline from the
 * kernel test grid onto the fine grid before taking the maximum.
 */
public class MonteCarloEdgeLocator {

  private static final Logger logger = Logger.getLogger(MonteCarloEdgeLocator.class.getName());

  private final int samples;
  private final double jitter;

  public MonteCarloEdgeLocator(int samples, double jitter) {
    if (samples < 1) {
      throw new IllegalArgumentException("Number of samples must be positive, got " + samples);
    }
    this.samples = samples;
    this.jitter = jitter;
  }

  public @NotNull EdgeEstimate locate(@NotNull DerivativePosterior posterior,
      @NotNull RandomGenerator random) throws NumericalFailureException {
    return locate(posterior, null, random);
  }

  /**
   * @param fineGrid target grid for spline interpolation, or null to use the test grid directly
   */
  public @NotNull EdgeEstimate locate(@NotNull DerivativePosterior posterior,
      @Nullable double[] fineGrid, @NotNull RandomGenerator random)
      throws NumericalFailureException {
    final double[] locations = sampleLocations(posterior, fineGrid, random);
    final EdgeEstimate estimate = new EdgeEstimate(MathUtils.mean(locations),
        MathUtils.std(locations));
    if (!estimate.isDefined()) {
      throw new NumericalFailureException("Edge location samples are not finite");
    }
    return estimate;
  }

  /**
   * @return edge location of the posterior mean followed by the location of each sample
   */
  public double[] sampleLocations(@NotNull DerivativePosterior posterior,
      @Nullable double[] fineGrid, @NotNull RandomGenerator random)
      throws NumericalFailureException {
    final double[] grid = posterior.getTestTof();
    final double[] mean = posterior.getMean();
    final CovarianceSquareRoot transform = posterior.samplingTransform(jitter);
    if (fineGrid != null && (fineGrid[0] < grid[0]
        || fineGrid[fineGrid.length - 1] > grid[grid.length - 1])) {
      throw new IllegalArgumentException("Fine grid exceeds the test grid");
    }
    logger.finest(() -> "Sampling " + samples + " derivative realisations on " + grid.length
        + " test points, " + transform.getMethod() + " transform");

    final double[] locations = new double[samples + 1];
    locations[0] = locateMaximum(grid, mean, fineGrid);
    final double[] z = new double[transform.getRank()];
    for (int s = 1; s <= samples; s++) {
      for (int i = 0; i < z.length; i++) {
        z[i] = random.nextGaussian();
      }
      final double[] realisation = transform.transform(z);
      for (int i = 0; i < realisation.length; i++) {
        realisation[i] += mean[i];
      }
      locations[s] = locateMaximum(grid, realisation, fineGrid);
    }
    return locations;
  }

  private static double locateMaximum(double[] grid, double[] values,
      @Nullable double[] fineGrid) {
    if (fineGrid == null) {
      return grid[MathUtils.argMax(values)];
    }
    final PolynomialSplineFunction spline = new SplineInterpolator().interpolate(grid, values);
    int best = 0;
    double max = Double.NEGATIVE_INFINITY;
    for (int i = 0; i < fineGrid.length; i++) {
      final double v = spline.value(fineGrid[i]);
      if (v > max) {
        max = v;
        best = i;
      }
    }
    return fineGrid[best];
  }
}
