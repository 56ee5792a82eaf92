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

/**
 * Classification of the ratio {@code sigma_noise / std(residual)}. A ratio near one means the
 * residual looks like measurement noise.
 */
public enum FitQuality {

  ACCEPTABLE(null),
  /**
   * Residual smaller than the noise, the transition fits the noise.
   */
  LIKELY_OVERFIT("indicating that the data may have been overfit. Consider increasing the "
      + "lengthscale"),
  /**
   * Residual larger than the noise, the transition misses structure of the data.
   */
  LIKELY_UNDERFIT("indicating that the data may have been underfit. Consider decreasing the "
      + "lengthscale"),
  UNDEFINED(null);

  public static final double LOWER_BOUND = 0.5;
  public static final double UPPER_BOUND = 2d;

  private final String advice;

  FitQuality(String advice) {
    this.advice = advice;
  }

  /**
   * Values strictly inside (0.5, 2) are acceptable, the bounds themselves are not.
   */
  public static FitQuality classify(double ratio) {
    if (Double.isNaN(ratio)) {
      return UNDEFINED;
    }
    if (ratio >= UPPER_BOUND) {
      return LIKELY_OVERFIT;
    }
    if (ratio <= LOWER_BOUND) {
      return LIKELY_UNDERFIT;
    }
    return ACCEPTABLE;
  }

  public boolean isWarning() {
    return this == LIKELY_OVERFIT || this == LIKELY_UNDERFIT;
  }

  public String getAdvice() {
    return advice == null ? "" : advice;
  }
}
