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

package io.github.braggedge.modules.edgefit_gp.covariance;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.jetbrains.annotations.NotNull;

/**
 * Exact squared-exponential kernel {@code sigF^2 * exp(-0.5 * (dx / l)^2)} over rescaled inputs.
 */
public class SquaredExponentialCovariance implements CovarianceBackend {

  private final InputScaler scaler;
  private final double[] x;
  private final double[] envelope;
  private final double sigF2;
  private final double l;

  /**
   * @param tof      observation time-of-flight, defines the input scaling
   * @param envelope g2 - g1 at each observation
   */
  public SquaredExponentialCovariance(@NotNull double[] tof, @NotNull double[] envelope,
      double sigF, double lengthscale) {
    this(InputScaler.fromObservations(tof), tof, envelope, sigF, lengthscale);
  }

  public SquaredExponentialCovariance(@NotNull InputScaler scaler, @NotNull double[] tof,
      @NotNull double[] envelope, double sigF, double lengthscale) {
    if (tof.length != envelope.length) {
      throw new IllegalArgumentException("Envelope and observations differ in length");
    }
    this.scaler = scaler;
    this.x = scaler.scale(tof);
    this.envelope = envelope.clone();
    this.sigF2 = sigF * sigF;
    this.l = lengthscale;
  }

  @Override
  public @NotNull RealMatrix covariance() {
    final int n = x.length;
    final double[][] k = new double[n][n];
    for (int i = 0; i < n; i++) {
      for (int j = 0; j <= i; j++) {
        final double v = kernel(x[i], x[j]) * (envelope[i] * envelope[j]);
        k[i][j] = v;
        k[j][i] = v;
      }
    }
    return new Array2DRowRealMatrix(k, false);
  }

  @Override
  public @NotNull RealMatrix crossCovariance(@NotNull double[] testTof) {
    return weightedCross(scaler.scale(testTof));
  }

  @Override
  public @NotNull RealMatrix transitionCrossCovariance() {
    return weightedCross(x);
  }

  @Override
  public @NotNull RealMatrix derivativeCrossCovariance(@NotNull double[] testTof) {
    final double[] xt = scaler.scale(testTof);
    final double[][] k = new double[xt.length][x.length];
    final double l2 = l * l;
    for (int i = 0; i < xt.length; i++) {
      for (int j = 0; j < x.length; j++) {
        k[i][j] = -(xt[i] - x[j]) / l2 * kernel(xt[i], x[j]) * envelope[j];
      }
    }
    return new Array2DRowRealMatrix(k, false);
  }

  @Override
  public @NotNull RealMatrix derivativeCovariance(@NotNull double[] testTof) {
    final double[] xt = scaler.scale(testTof);
    final int n = xt.length;
    final double l2 = l * l;
    final double[][] k = new double[n][n];
    for (int i = 0; i < n; i++) {
      for (int j = 0; j <= i; j++) {
        final double d = xt[i] - xt[j];
        final double v = (1d - d * d / l2) / l2 * kernel(xt[i], xt[j]);
        k[i][j] = v;
        k[j][i] = v;
      }
    }
    return new Array2DRowRealMatrix(k, false);
  }

  @Override
  public int getNumberOfObservations() {
    return x.length;
  }

  public double getLengthscale() {
    return l;
  }

  private RealMatrix weightedCross(double[] xt) {
    final double[][] k = new double[xt.length][x.length];
    for (int i = 0; i < xt.length; i++) {
      for (int j = 0; j < x.length; j++) {
        k[i][j] = kernel(xt[i], x[j]) * envelope[j];
      }
    }
    return new Array2DRowRealMatrix(k, false);
  }

  private double kernel(double a, double b) {
    final double d = (a - b) / l;
    return sigF2 * Math.exp(-0.5 * d * d);
  }
}
