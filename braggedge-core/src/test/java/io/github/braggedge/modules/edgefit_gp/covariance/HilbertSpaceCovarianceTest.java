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

import io.github.braggedge.util.MathUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class HilbertSpaceCovarianceTest {

  private static final double SIG_F = 1.3;
  private static final double L = 0.1;

  private final double[] tof = MathUtils.linspace(1d, 3d, 50);
  private final double[] envelope = envelope(tof);
  private final double[] testTof = MathUtils.linspace(1.4, 2.6, 30);

  private static double[] envelope(double[] tof) {
    final double[] d = new double[tof.length];
    for (int i = 0; i < d.length; i++) {
      d[i] = 0.3 + 0.05 * tof[i];
    }
    return d;
  }

  @Test
  void testMatchesExactKernel() {
    final SquaredExponentialCovariance exact = new SquaredExponentialCovariance(tof, envelope,
        SIG_F, L);
    final HilbertSpaceCovariance approx = new HilbertSpaceCovariance(tof, envelope, SIG_F, L,
        128, 1.5);

    assertClose(exact.covariance(), approx.covariance(), 1e-6);
    assertClose(exact.crossCovariance(testTof), approx.crossCovariance(testTof), 1e-6);
    assertClose(exact.transitionCrossCovariance(), approx.transitionCrossCovariance(), 1e-6);
    // derivative kernels scale with 1 / l^2
    assertClose(exact.derivativeCrossCovariance(testTof),
        approx.derivativeCrossCovariance(testTof), 1e-4);
    assertClose(exact.derivativeCovariance(testTof), approx.derivativeCovariance(testTof), 1e-4);
  }

  @Test
  void testBasisShapes() {
    final HilbertSpaceCovariance approx = new HilbertSpaceCovariance(tof, envelope, SIG_F, L,
        64, 1.5);
    Assertions.assertEquals(64, approx.getNumberOfBasisFunctions());
    Assertions.assertEquals(50, approx.observationBasis().getRowDimension());
    Assertions.assertEquals(64, approx.observationBasis().getColumnDimension());
    Assertions.assertEquals(30, approx.derivativeBasis(testTof).getRowDimension());
    Assertions.assertEquals(Math.PI / 3d, approx.frequencies()[0], 1e-15);

    final double[] s = approx.spectralDensities();
    for (int j = 1; j < s.length; j++) {
      Assertions.assertTrue(s[j] < s[j - 1]);
    }
  }

  @Test
  void testRejectsNarrowDomain() {
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new HilbertSpaceCovariance(tof, envelope, SIG_F, L, 64, 1d));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new HilbertSpaceCovariance(tof, envelope, SIG_F, L, 0, 1.5));
  }

  static void assertClose(RealMatrix expected, RealMatrix actual, double tolerance) {
    Assertions.assertEquals(expected.getRowDimension(), actual.getRowDimension());
    Assertions.assertEquals(expected.getColumnDimension(), actual.getColumnDimension());
    for (int i = 0; i < expected.getRowDimension(); i++) {
      Assertions.assertArrayEquals(expected.getRow(i), actual.getRow(i), tolerance,
          "row " + i);
    }
  }
}
