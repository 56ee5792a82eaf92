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

package io.github.braggedge.util;

import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.jetbrains.annotations.NotNull;

public final class MathUtils {

  private MathUtils() {
  }

  /**
   * {@code n} equally spaced values from {@code start} to {@code end}, both included exactly.
   */
  public static double[] linspace(double start, double end, int n) {
    if (n < 2) {
      throw new IllegalArgumentException("linspace needs at least two points, got " + n);
    }
    final double[] values = new double[n];
    final double step = (end - start) / (n - 1);
    for (int i = 0; i < n; i++) {
      values[i] = start + i * step;
    }
    values[n - 1] = end;
    return values;
  }

  /**
   * @return index of the first maximum, -1 for an empty array
   */
  public static int argMax(double[] values) {
    int best = -1;
    double max = Double.NEGATIVE_INFINITY;
    for (int i = 0; i < values.length; i++) {
      if (values[i] > max || best < 0) {
        max = values[i];
        best = i;
      }
    }
    return best;
  }

  public static double max(double[] values) {
    double max = Double.NEGATIVE_INFINITY;
    for (double v : values) {
      max = Math.max(max, v);
    }
    return max;
  }

  public static double mean(double[] values) {
    return new Mean().evaluate(values);
  }

  /**
   * Bias corrected (n - 1) standard deviation.
   */
  public static double std(double[] values) {
    return new StandardDeviation(true).evaluate(values);
  }

  public static double rms(double[] values) {
    double sum = 0d;
    for (double v : values) {
      sum += v * v;
    }
    return Math.sqrt(sum / values.length);
  }

  public static boolean allFinite(double[] values) {
    for (double v : values) {
      if (!Double.isFinite(v)) {
        return false;
      }
    }
    return true;
  }

  public static boolean allFinite(@NotNull RealMatrix matrix) {
    for (int r = 0; r < matrix.getRowDimension(); r++) {
      for (int c = 0; c < matrix.getColumnDimension(); c++) {
        if (!Double.isFinite(matrix.getEntry(r, c))) {
          return false;
        }
      }
    }
    return true;
  }

  /**
   * Intersections of the polyline {@code (x[i], y[i])} with the horizontal line {@code y = level}
   * between {@code x[0]} and {@code x[n-1]}. Segments crossing the level contribute their linear
   * interpolation point, vertices lying exactly on the level are reported once. Segments lying
   * entirely on the level contribute their end points.
   */
  public static double[] levelCrossings(double[] x, double[] y, double level) {
    if (x.length != y.length) {
      throw new IllegalArgumentException("x and y differ in length");
    }
    final List<Double> crossings = new ArrayList<>();
    for (int i = 0; i < x.length; i++) {
      final double d0 = y[i] - level;
      if (d0 == 0d) {
        addDistinct(crossings, x[i]);
        continue;
      }
      if (i + 1 < x.length) {
        final double d1 = y[i + 1] - level;
        if (d1 != 0d && (d0 < 0d) != (d1 < 0d)) {
          final double t = d0 / (d0 - d1);
          addDistinct(crossings, x[i] + t * (x[i + 1] - x[i]));
        }
      }
    }
    return crossings.stream().mapToDouble(Double::doubleValue).toArray();
  }

  private static void addDistinct(List<Double> values, double value) {
    if (values.isEmpty() || values.get(values.size() - 1) != value) {
      values.add(value);
    }
  }
}
