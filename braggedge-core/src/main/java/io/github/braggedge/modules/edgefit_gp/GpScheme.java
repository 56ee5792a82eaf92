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
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;
import org.jetbrains.annotations.NotNull;

/**
 * How the derivative posterior is computed and evaluated.
 */
public enum GpScheme {

  /**
   * Exact kernel evaluated directly on the full test grid.
   */
  FULL("full"),
  /**
   * Exact kernel on an observation sized grid, cubic spline interpolated onto the test grid.
   */
  INTERP("interp"),
  /**
   * Reduced-rank Hilbert-space kernel on the full test grid.
   */
  HILBERT_SPACE("hilbertspace");

  private final String optionValue;

  GpScheme(String optionValue) {
    this.optionValue = optionValue;
  }

  public String getOptionValue() {
    return optionValue;
  }

  public static @NotNull GpScheme parse(@NotNull String value) {
    for (GpScheme scheme : values()) {
      if (scheme.optionValue.equalsIgnoreCase(value.trim())) {
        return scheme;
      }
    }
    throw new ConfigurationException("Invalid GP scheme '" + value + "', should be one of "
        + Arrays.stream(values()).map(GpScheme::getOptionValue)
        .collect(Collectors.joining(", ")));
  }

  @Override
  public String toString() {
    return optionValue.toUpperCase(Locale.ROOT);
  }
}
