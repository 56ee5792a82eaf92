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

import org.jetbrains.annotations.NotNull;

/**
 * Affine map of time-of-flight onto [0, 1] using the extremes of the observations. The same map
 * is applied to every test grid so observation and test inputs share one coordinate system.
 */
public final class InputScaler {

  private final double min;
  private final double max;

  private InputScaler(double min, double max) {
    if (!(max > min)) {
      throw new IllegalArgumentException("Input range is empty: [" + min + ", " + max + "]");
    }
    this.min = min;
    this.max = max;
  }

  public static InputScaler fromObservations(@NotNull double[] tof) {
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (double t : tof) {
      min = Math.min(min, t);
      max = Math.max(max, t);
    }
    return new InputScaler(min, max);
  }

  public double scale(double tof) {
    return (tof - min) / (max - min);
  }

  public double[] scale(@NotNull double[] tof) {
    final double[] scaled = new double[tof.length];
    for (int i = 0; i < tof.length; i++) {
      scaled[i] = scale(tof[i]);
    }
    return scaled;
  }

  public double getRange() {
    return max - min;
  }
}
