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

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.jetbrains.annotations.NotNull;

/**
 * Dense helpers that the commons-math matrix API only offers per vector.
 */
public final class LinAlgUtils {

  private LinAlgUtils() {
  }

  /**
   * Solves {@code L X = B} for lower triangular {@code L}, all columns of {@code B} at once.
   */
  public static RealMatrix solveLowerTriangular(@NotNull RealMatrix lower, @NotNull RealMatrix b) {
    final int n = lower.getRowDimension();
    if (lower.getColumnDimension() != n || b.getRowDimension() != n) {
      throw new IllegalArgumentException(
          "Dimension mismatch: L is " + n + "x" + lower.getColumnDimension() + ", B has "
              + b.getRowDimension() + " rows");
    }
    final double[][] l = lower.getData();
    final double[][] x = b.getData();
    final int cols = b.getColumnDimension();
    for (int i = 0; i < n; i++) {
      final double[] xi = x[i];
      for (int k = 0; k < i; k++) {
        final double lik = l[i][k];
        if (lik == 0d) {
          continue;
        }
        final double[] xk = x[k];
        for (int c = 0; c < cols; c++) {
          xi[c] -= lik * xk[c];
        }
      }
      final double diag = l[i][i];
      for (int c = 0; c < cols; c++) {
        xi[c] /= diag;
      }
    }
    return new Array2DRowRealMatrix(x, false);
  }

  /**
   * @return {@code matrix + value * I}
   */
  public static RealMatrix addToDiagonal(@NotNull RealMatrix matrix, double value) {
    final RealMatrix copy = matrix.copy();
    for (int i = 0; i < copy.getRowDimension(); i++) {
      copy.addToEntry(i, i, value);
    }
    return copy;
  }

  /**
   * Scales column {@code j} of {@code matrix} by {@code factors[j]}.
   */
  public static RealMatrix scaleColumns(@NotNull RealMatrix matrix, double[] factors) {
    final double[][] data = matrix.getData();
    for (double[] row : data) {
      for (int j = 0; j < row.length; j++) {
        row[j] *= factors[j];
      }
    }
    return new Array2DRowRealMatrix(data, false);
  }

  /**
   * @return {@code (matrix + matrix^T) / 2}, removes round-off asymmetry before factorisation
   */
  public static RealMatrix symmetrize(@NotNull RealMatrix matrix) {
    final int n = matrix.getRowDimension();
    final double[][] data = matrix.getData();
    for (int i = 0; i < n; i++) {
      for (int j = 0; j < i; j++) {
        final double v = 0.5 * (data[i][j] + data[j][i]);
        data[i][j] = v;
        data[j][i] = v;
      }
    }
    return new Array2DRowRealMatrix(data, false);
  }
}
