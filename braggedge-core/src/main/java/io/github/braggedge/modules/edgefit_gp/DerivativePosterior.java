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

import io.github.braggedge.util.exceptions.NumericalFailureException;
import org.apache.commons.math3.linear.RealMatrix;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Posterior of the derivative of the transition function on a test grid, together with the
 * posterior mean of the transition function itself at the observation inputs.
 */
public final class DerivativePosterior {

  private final double[] testTof;
  private final double[] mean;
  private final RealMatrix covariance;
  private final double[] transitionEstimate;
  private final @Nullable CovarianceSquareRoot knownFactor;

  public DerivativePosterior(@NotNull double[] testTof, @NotNull double[] mean,
      @NotNull RealMatrix covariance, @NotNull double[] transitionEstimate,
      @Nullable CovarianceSquareRoot knownFactor) {
    if (testTof.length != mean.length || covariance.getRowDimension() != mean.length) {
      throw new IllegalArgumentException("Test grid, mean and covariance differ in size");
    }
    this.testTof = testTof.clone();
    this.mean = mean.clone();
    this.covariance = covariance;
    this.transitionEstimate = transitionEstimate.clone();
    this.knownFactor = knownFactor;
  }

  public double[] getTestTof() {
    return testTof.clone();
  }

  /**
   * @return posterior mean of dB/dx on the test grid (g)
   */
  public double[] getMean() {
    return mean.clone();
  }

  /**
   * @return posterior covariance of dB/dx on the test grid (V)
   */
  public RealMatrix getCovariance() {
    return covariance.copy();
  }

  /**
   * @return posterior mean of B at the observation inputs (festp)
   */
  public double[] getTransitionEstimate() {
    return transitionEstimate.clone();
  }

  /**
   * @return a factor F with {@code F F^T = V}; computed from V with the given jitter unless the
   * solver already provided one
   */
  public @NotNull CovarianceSquareRoot samplingTransform(double jitter)
      throws NumericalFailureException {
    if (knownFactor != null) {
      return knownFactor;
    }
    return CovarianceSquareRoot.of(covariance, jitter);
  }
}
