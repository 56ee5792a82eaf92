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
import org.jetbrains.annotations.NotNull;

/**
 * Covariance backend of the form {@code k(x, x') = sum_j S_j phi_j(x) phi_j(x')}. Exposes the
 * basis so the posterior can be solved in the m dimensional weight space.
 */
public interface ReducedRankBackend extends CovarianceBackend {

  int getNumberOfBasisFunctions();

  /**
   * @return spectral weight S_j of each basis function
   */
  @NotNull double[] spectralDensities();

  /**
   * @return ny x m basis at the observations, rows scaled by the envelope
   */
  @NotNull RealMatrix observationBasis();

  /**
   * @return ny x m basis at the observation inputs without envelope
   */
  @NotNull RealMatrix transitionBasis();

  /**
   * @return nt x m derivative of the basis at the test points
   */
  @NotNull RealMatrix derivativeBasis(@NotNull double[] testTof);
}
