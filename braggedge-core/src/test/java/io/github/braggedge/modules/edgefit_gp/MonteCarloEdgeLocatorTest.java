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
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class MonteCarloEdgeLocatorTest {

  private static DerivativePosterior posterior(double peak, double variance) {
    final double[] grid = MathUtils.linspace(0d, 10d, 11);
    final double[] mean = new double[grid.length];
    for (int i = 0; i < grid.length; i++) {
      mean[i] = -(grid[i] - peak) * (grid[i] - peak);
    }
    final RealMatrix cov = MatrixUtils.createRealIdentityMatrix(grid.length)
        .scalarMultiply(variance);
    return new DerivativePosterior(grid, mean, cov, new double[]{0d}, null);
  }

  @Test
  void testExactGridLocation() throws NumericalFailureException {
    final EdgeEstimate estimate = new MonteCarloEdgeLocator(200, 0d).locate(
        posterior(4d, 1e-6), new Well19937c(3L));
    Assertions.assertEquals(4d, estimate.edgePosition(), 1e-12);
    Assertions.assertEquals(0d, estimate.sigma(), 1e-12);
  }

  @Test
  void testFineGridResolvesOffGridPeak() throws NumericalFailureException {
    final double[] fine = MathUtils.linspace(0d, 10d, 1001);
    final EdgeEstimate estimate = new MonteCarloEdgeLocator(200, 0d).locate(
        posterior(4.3, 1e-12), fine, new Well19937c(3L));
    Assertions.assertEquals(4.3, estimate.edgePosition(), 0.02);
  }

  @Test
  void testSampleSpread() throws NumericalFailureException {
    // neighbours of the peak differ by 1, unit variance moves the maximum
    final double[] locations = new MonteCarloEdgeLocator(1000, 0d).sampleLocations(
        posterior(5d, 1d), null, new Well19937c(5L));
    Assertions.assertEquals(1001, locations.length);
    Assertions.assertEquals(5d, locations[0]);
    Assertions.assertTrue(MathUtils.std(locations) > 0.3);
    Assertions.assertEquals(5d, MathUtils.mean(locations), 0.15);
  }

  @Test
  void testSeededSamplingIsDeterministic() throws NumericalFailureException {
    final MonteCarloEdgeLocator locator = new MonteCarloEdgeLocator(300, 1e-10);
    final EdgeEstimate first = locator.locate(posterior(5d, 1d), new Well19937c(9L));
    final EdgeEstimate second = locator.locate(posterior(5d, 1d), new Well19937c(9L));
    Assertions.assertEquals(first, second);
  }

  @Test
  void testFineGridOutsideTestGrid() {
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new MonteCarloEdgeLocator(10, 0d).locate(posterior(5d, 1d),
            MathUtils.linspace(-1d, 10d, 50), new Well19937c(1L)));
  }
}
