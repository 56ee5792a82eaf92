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

import io.github.braggedge.util.LinAlgUtils;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.jetbrains.annotations.NotNull;

/**
 * Reduced-rank approximation of the squared-exponential kernel by the Laplacian eigenfunctions
 * of the domain [-L, L] (Hilbert-space GP). With {@code lambda_j = pi * j / (2L)}
 * <pre>
 *   phi_j(x) = sin(lambda_j * (x + L)) / sqrt(L)
 *   S(w)     = sigF^2 * l * sqrt(2 pi) * exp(-w^2 l^2 / 2)
 *   k(x, x') ~ sum_{j=1..m} S(lambda_j) phi_j(x) phi_j(x')
 * </pre>
 * Inputs are rescaled to [0, 1], so L must exceed 1 and the approximation needs
 * {@code m >> 2L / (pi * l)} basis functions to resolve the lengthscale.
 */
public class HilbertSpaceCovariance implements ReducedRankBackend {

  private final InputScaler scaler;
  private final double[] x;
  private final double[] envelope;
  private final double halfWidth;
  private final double[] lambdas;
  private final double[] spectrum;

  public HilbertSpaceCovariance(@NotNull double[] tof, @NotNull double[] envelope, double sigF,
      double lengthscale, int basisFunctions, double halfWidth) {
    this(InputScaler.fromObservations(tof), tof, envelope, sigF, lengthscale, basisFunctions,
        halfWidth);
  }

  public HilbertSpaceCovariance(@NotNull InputScaler scaler, @NotNull double[] tof,
      @NotNull double[] envelope, double sigF, double lengthscale, int basisFunctions,
      double halfWidth) {
    if (tof.length != envelope.length) {
      throw new IllegalArgumentException("Envelope and observations differ in length");
    }
    if (basisFunctions < 1) {
      throw new IllegalArgumentException("At least one basis function required");
    }
    if (!(halfWidth > 1d)) {
      throw new IllegalArgumentException(
          "Domain half width must exceed the rescaled input range [0, 1], got " + halfWidth);
    }
    this.scaler = scaler;
    this.x = scaler.scale(tof);
    this.envelope = envelope.clone();
    this.halfWidth = halfWidth;
    this.lambdas = new double[basisFunctions];
    this.spectrum = new double[basisFunctions];
    final double sigF2 = sigF * sigF;
    for (int j = 0; j < basisFunctions; j++) {
      lambdas[j] = Math.PI * (j + 1) / (2d * halfWidth);
      final double wl = lambdas[j] * lengthscale;
      spectrum[j] = sigF2 * lengthscale * Math.sqrt(2d * Math.PI) * Math.exp(-0.5 * wl * wl);
    }
  }

  @Override
  public int getNumberOfBasisFunctions() {
    return lambdas.length;
  }

  @Override
  public @NotNull double[] spectralDensities() {
    return spectrum.clone();
  }

  public @NotNull double[] frequencies() {
    return lambdas.clone();
  }

  @Override
  public @NotNull RealMatrix observationBasis() {
    final double[][] phi = basis(x).getData();
    for (int i = 0; i < phi.length; i++) {
      for (int j = 0; j < phi[i].length; j++) {
        phi[i][j] *= envelope[i];
      }
    }
    return new Array2DRowRealMatrix(phi, false);
  }

  @Override
  public @NotNull RealMatrix transitionBasis() {
    return basis(x);
  }

  /**
   * @return nt x m basis at the test points
   */
  public @NotNull RealMatrix testBasis(@NotNull double[] testTof) {
    return basis(scaler.scale(testTof));
  }

  @Override
  public @NotNull RealMatrix derivativeBasis(@NotNull double[] testTof) {
    final double[] xt = scaler.scale(testTof);
    final double norm = 1d / Math.sqrt(halfWidth);
    final double[][] d = new double[xt.length][lambdas.length];
    for (int i = 0; i < xt.length; i++) {
      for (int j = 0; j < lambdas.length; j++) {
        d[i][j] = lambdas[j] * Math.cos(lambdas[j] * (xt[i] + halfWidth)) * norm;
      }
    }
    return new Array2DRowRealMatrix(d, false);
  }

  @Override
  public @NotNull RealMatrix covariance() {
    return weightedProduct(observationBasis(), observationBasis());
  }

  @Override
  public @NotNull RealMatrix crossCovariance(@NotNull double[] testTof) {
    return weightedProduct(testBasis(testTof), observationBasis());
  }

  @Override
  public @NotNull RealMatrix transitionCrossCovariance() {
    return weightedProduct(transitionBasis(), observationBasis());
  }

  @Override
  public @NotNull RealMatrix derivativeCrossCovariance(@NotNull double[] testTof) {
    return weightedProduct(derivativeBasis(testTof), observationBasis());
  }

  @Override
  public @NotNull RealMatrix derivativeCovariance(@NotNull double[] testTof) {
    final RealMatrix d = derivativeBasis(testTof);
    return weightedProduct(d, d);
  }

  @Override
  public int getNumberOfObservations() {
    return x.length;
  }

  private RealMatrix basis(double[] inputs) {
    final double norm = 1d / Math.sqrt(halfWidth);
    final double[][] phi = new double[inputs.length][lambdas.length];
    for (int i = 0; i < inputs.length; i++) {
      for (int j = 0; j < lambdas.length; j++) {
        phi[i][j] = Math.sin(lambdas[j] * (inputs[i] + halfWidth)) * norm;
      }
    }
    return new Array2DRowRealMatrix(phi, false);
  }

  /**
   * @return {@code a * diag(S) * b^T}
   */
  private RealMatrix weightedProduct(RealMatrix a, RealMatrix b) {
    return LinAlgUtils.scaleColumns(a, spectrum).multiply(b.transpose());
  }
}
