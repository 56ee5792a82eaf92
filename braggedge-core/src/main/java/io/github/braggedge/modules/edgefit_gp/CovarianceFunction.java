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

import io.github.braggedge.util.exceptions.ConfigurationException;
import org.jetbrains.annotations.NotNull;

/**
 * Covariance function of the transition GP. Only the squared-exponential kernel is implemented,
 * for every {@link GpScheme}; other option values are rejected by {@link #parse(String)}.
 */
public enum CovarianceFunction {

  SQUARED_EXPONENTIAL("se");

  private final String optionValue;

  CovarianceFunction(String optionValue) {
    this.optionValue = optionValue;
  }

  public String getOptionValue() {
    return optionValue;
  }

  public static @NotNull CovarianceFunction parse(@NotNull String value) {
    for (CovarianceFunction function : values()) {
      if (function.optionValue.equalsIgnoreCase(value.trim())) {
        return function;
      }
    }
    throw new ConfigurationException("Covariance function '" + value
        + "' is not implemented, only the squared-exponential covariance function 'se' is");
  }
}
