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

package io.github.braggedge.tools.edgesim;

import io.github.braggedge.datamodel.BaselineParameters;
import io.github.braggedge.datamodel.FitWindow;
import io.github.braggedge.datamodel.TransmissionCurve;
import io.github.braggedge.util.MathUtils;
import org.apache.commons.math3.random.RandomGenerator;
import org.jetbrains.annotations.NotNull;

/**
 * Generates Bragg edges with a known position. The transition is a logistic step
 * {@code 1 / (1 + exp(-(t - t0) / width))} between the two exponential asymptotes of
 * {@link BaselineParameters}, with optional additive Gaussian noise.
 */
public final class SyntheticEdgeCurves {

  private final double[] tof;
  private final BaselineParameters baseline;
  private final double edgePosition;
  private final double edgeWidth;

  public SyntheticEdgeCurves(@NotNull double[] tof, @NotNull BaselineParameters baseline,
      double edgePosition, double edgeWidth) {
    if (!(edgeWidth > 0d)) {
      throw new IllegalArgumentException("Edge width must be positive, got " + edgeWidth);
    }
    this.tof = tof.clone();
    this.baseline = baseline;
    this.edgePosition = edgePosition;
    this.edgeWidth = edgeWidth;
  }

  /**
   * 100 points over [1, 3] with the edge at 2, between index 49 and 50.
   */
  public static SyntheticEdgeCurves standard() {
    return new SyntheticEdgeCurves(MathUtils.linspace(1d, 3d, 100),
        new BaselineParameters(0.1, 0.05, 0.3, 0.1), 2d, 0.06);
  }

  /**
   * Flat regions of {@link #standard()}: [0, 19] and [79, 99].
   */
  public static FitWindow standardWindow() {
    return FitWindow.of(0, 19, 79, 99);
  }

  public double transition(double t) {
    return 1d / (1d + Math.exp(-(t - edgePosition) / edgeWidth));
  }

  public TransmissionCurve noiseFree() {
    final double[] tr = new double[tof.length];
    for (int i = 0; i < tof.length; i++) {
      tr[i] = baseline.reconstruct(tof[i], transition(tof[i]));
    }
    return new TransmissionCurve(tof, tr);
  }

  public TransmissionCurve noisy(double noiseStd, @NotNull RandomGenerator random) {
    final double[] tr = noiseFree().getTransmissionValues();
    for (int i = 0; i < tr.length; i++) {
      tr[i] += noiseStd * random.nextGaussian();
    }
    return new TransmissionCurve(tof, tr);
  }

  public double getEdgePosition() {
    return edgePosition;
  }

  public double getEdgeWidth() {
    return edgeWidth;
  }

  public BaselineParameters getBaseline() {
    return baseline;
  }
}
