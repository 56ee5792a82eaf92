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

import org.apache.commons.math3.linear.RealMatrix;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SquaredExponentialCovarianceTest {

  private final double[] tof = {10, 12, 15, 20};
  private final double[] envelope = {0.5, 0.4, 0.3, 0.2};

  @Test
  void testInputsAreRescaled() {
    final InputScaler scaler = InputScaler.fromObservations(tof);
    Assertions.assertEquals(0d, scaler.scale(10d));
    Assertions.assertEquals(1d, scaler.scale(20d));
    Assertions.assertEquals(0.5, scaler.scale(15d));
    Assertions.assertEquals(10d, scaler.getRange());
  }

  @Test
  void testCovariance() {
    final SquaredExponentialCovariance kernel = new SquaredExponentialCovariance(tof, envelope,
        2d, 0.5);
    final RealMatrix k = kernel.covariance();
    Assertions.assertEquals(4d * 0.25, k.getEntry(0, 0), 1e-15);
    // x = 0 and x = 0.5
    Assertions.assertEquals(4d * Math.exp(-0.5) * 0.5 * 0.3, k.getEntry(0, 2), 1e-15);
    Assertions.assertEquals(k.getEntry(0, 2), k.getEntry(2, 0));
  }

  @Test
  void testDerivativeKernelsMatchFiniteDifferences() {
    final double l = 0.3;
    final SquaredExponentialCovariance kernel = new SquaredExponentialCovariance(tof, envelope,
        1.5, l);
    final double h = 1e-6;
    final double t = 13d;
    final double range = 10d;
    final double[] up = kernel.crossCovariance(new double[]{t + h * range}).getRow(0);
    final double[] down = kernel.crossCovariance(new double[]{t - h * range}).getRow(0);
    final double[] derivative = kernel.derivativeCrossCovariance(new double[]{t}).getRow(0);
    for (int j = 0; j < tof.length; j++) {
      Assertions.assertEquals((up[j] - down[j]) / (2 * h), derivative[j], 1e-6);
    }

    final RealMatrix dd = kernel.derivativeCovariance(new double[]{t, t + 1});
    Assertions.assertEquals(1.5 * 1.5 / (l * l), dd.getEntry(0, 0), 1e-12);
    final double d = 0.1;
    Assertions.assertEquals(2.25 * (1 - d * d / (l * l)) / (l * l)
        * Math.exp(-0.5 * d * d / (l * l)), dd.getEntry(0, 1), 1e-12);
  }
}
