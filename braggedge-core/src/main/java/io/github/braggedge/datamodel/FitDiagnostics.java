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

package io.github.braggedge.datamodel;

/**
 * Descriptive fit quality numbers.
 *
 * @param lengthscale       lengthscale used for the transition GP
 * @param stdResidual       standard deviation of measured minus fitted transmission
 * @param rmsResidual       root mean square of measured minus fitted transmission
 * @param fitQuality        measurement noise std divided by {@code stdResidual}
 * @param widthAtHalfHeight width of the derivative peak at half its height, NaN if not defined
 */
public record FitDiagnostics(double lengthscale, double stdResidual, double rmsResidual,
                             double fitQuality, double widthAtHalfHeight) {

  private static final FitDiagnostics UNDEFINED = new FitDiagnostics(Double.NaN, Double.NaN,
      Double.NaN, Double.NaN, Double.NaN);

  public static FitDiagnostics undefined() {
    return UNDEFINED;
  }
}
