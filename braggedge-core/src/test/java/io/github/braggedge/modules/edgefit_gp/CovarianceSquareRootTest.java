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

import io.github.braggedge.modules.edgefit_gp.CovarianceSquareRoot.Method;
import io.github.braggedge.util.exceptions.NumericalFailureException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class CovarianceSquareRootTest {

  private static final double[] V = {1, 2, 3};

  /**
   * v v^T, rank one
   */
  private static RealMatrix singular() {
    final double[][] m = new double[3][3];
    for (int i = 0; i < 3; i++) {
      for (int j = 0; j < 3; j++) {
        m[i][j] = V[i] * V[j];
      }
    }
    return new Array2DRowRealMatrix(m, false);
  }

  private static RealMatrix positiveDefinite() {
    final RealMatrix m = singular();
    for (int i = 0; i < 3; i++) {
      m.addToEntry(i, i, 1e-3);
    }
    return m;
  }

  @Test
  void testCholeskyForPositiveDefinite() throws NumericalFailureException {
    final CovarianceSquareRoot root = CovarianceSquareRoot.of(positiveDefinite(), 0d);
    Assertions.assertEquals(Method.CHOLESKY, root.getMethod());
    assertReproduces(positiveDefinite(), root);
    // lower triangular
    Assertions.assertEquals(0d, root.getFactor()[0][2]);
  }

  @Test
  void testFallbackForSingular() throws NumericalFailureException {
    final CovarianceSquareRoot root = CovarianceSquareRoot.of(singular(), 0d);
    Assertions.assertEquals(Method.SYMMETRIC_SQRT, root.getMethod());
    assertReproduces(singular(), root);
    final double[][] f = root.getFactor();
    Assertions.assertEquals(f[0][2], f[2][0], 1e-12);
  }

  @Test
  void testNonFiniteFails() {
    final RealMatrix m = positiveDefinite();
    m.setEntry(1, 1, Double.NaN);
    Assertions.assertThrows(NumericalFailureException.class, () -> CovarianceSquareRoot.of(m, 0d));
  }

  @Test
  void testSampleCovarianceOfBothPathsMatches() throws NumericalFailureException {
    final CovarianceSquareRoot primary = CovarianceSquareRoot.of(positiveDefinite(), 0d);
    final CovarianceSquareRoot fallback = CovarianceSquareRoot.of(singular(), 0d);
    Assertions.assertEquals(Method.CHOLESKY, primary.getMethod());
    Assertions.assertEquals(Method.SYMMETRIC_SQRT, fallback.getMethod());

    final double[][] c1 = sampleCovariance(primary, new Well19937c(1L), 20000);
    final double[][] c2 = sampleCovariance(fallback, new Well19937c(2L), 20000);
    // largest entry is 9, Monte-Carlo error of each entry is about 1 %
    for (int i = 0; i < 3; i++) {
      Assertions.assertArrayEquals(c1[i], c2[i], 0.45);
      for (int j = 0; j < 3; j++) {
        Assertions.assertEquals(V[i] * V[j], c2[i][j], 0.45);
      }
    }
  }

  private static void assertReproduces(RealMatrix expected, CovarianceSquareRoot root) {
    final RealMatrix f = new Array2DRowRealMatrix(root.getFactor(), false);
    final RealMatrix product = f.multiply(f.transpose());
    Assertions.assertEquals(0d, product.subtract(expected).getNorm(), 1e-9);
  }

  private static double[][] sampleCovariance(CovarianceSquareRoot root, RandomGenerator random,
      int n) {
    final double[][] sum = new double[3][3];
    final double[] z = new double[root.getRank()];
    for (int s = 0; s < n; s++) {
      for (int i = 0; i < z.length; i++) {
        z[i] = random.nextGaussian();
      }
      final double[] x = root.transform(z);
      for (int i = 0; i < 3; i++) {
        for (int j = 0; j < 3; j++) {
          sum[i][j] += x[i] * x[j] / n;
        }
      }
    }
    return sum;
  }
}
