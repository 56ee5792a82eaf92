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
 * Location of a Bragg edge and the standard deviation of that location.
 */
public record EdgeEstimate(double edgePosition, double sigma) {

  private static final EdgeEstimate UNDEFINED = new EdgeEstimate(Double.NaN, Double.NaN);

  public static EdgeEstimate undefined() {
    return UNDEFINED;
  }

  public boolean isDefined() {
    return Double.isFinite(edgePosition) && Double.isFinite(sigma);
  }

  /**
   * Lattice strain relative to the unstrained edge position {@code d0}.
   */
  public double strain(double d0) {
    return (edgePosition - d0) / d0;
  }

  public double strainSigma(double d0) {
    return sigma / Math.abs(d0);
  }
}
