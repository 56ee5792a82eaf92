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
 * Prior covariances of the edge transition function for one transmission curve. The GP prior is
 * placed on the unscaled transition function B; observations see it through the envelope
 * {@code D = g2 - g1}, so every covariance involving an observation carries that weight on the
 * observation side. Test inputs are given in time-of-flight and rescaled by the backend.
 * <p>
 * Derivatives are taken with respect to the rescaled test input.
 */
public interface CovarianceBackend {

  /**
   * @return K, ny x ny covariance of the envelope weighted transition at the observations
   */
  @NotNull RealMatrix covariance();

  /**
   * @return Kfy, covariance between B at the test points and the observations
   */
  @NotNull RealMatrix crossCovariance(@NotNull double[] testTof);

  /**
   * @return Kfyp, covariance between B at the observation inputs and the observations, used to
   * reconstruct the transition estimate
   */
  @NotNull RealMatrix transitionCrossCovariance();

  /**
   * @return dKfy, covariance between dB/dx at the test points and the observations
   */
  @NotNull RealMatrix derivativeCrossCovariance(@NotNull double[] testTof);

  /**
   * @return ddKff, covariance of dB/dx between test points
   */
  @NotNull RealMatrix derivativeCovariance(@NotNull double[] testTof);

  int getNumberOfObservations();
}
