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
 * Coefficients of the two exponential asymptotes around a Bragg edge. Right of the edge the
 * transmission approaches {@code exp(-(a0 + b0*t))}, left of it the additional hkl attenuation
 * {@code exp(-(aHkl + bHkl*t))} applies.
 */
public record BaselineParameters(double a0, double b0, double aHkl, double bHkl) {

  /**
   * g2: asymptote right of the edge.
   */
  public double postEdgeAsymptote(double t) {
    return Math.exp(-(a0 + b0 * t));
  }

  /**
   * Attenuation of the hkl reflection alone.
   */
  public double hklAttenuation(double t) {
    return Math.exp(-(aHkl + bHkl * t));
  }

  /**
   * g1: asymptote left of the edge.
   */
  public double preEdgeAsymptote(double t) {
    return postEdgeAsymptote(t) * hklAttenuation(t);
  }

  /**
   * g2 - g1, the envelope that scales the transition function.
   */
  public double edgeHeight(double t) {
    return postEdgeAsymptote(t) - preEdgeAsymptote(t);
  }

  /**
   * Transmission for a transition function value {@code transition} (0 left, 1 right of the
   * edge).
   */
  public double reconstruct(double t, double transition) {
    final double hkl = hklAttenuation(t);
    return postEdgeAsymptote(t) * (hkl + (1d - hkl) * transition);
  }

  public boolean isFinite() {
    return Double.isFinite(a0) && Double.isFinite(b0) && Double.isFinite(aHkl)
        && Double.isFinite(bHkl);
  }
}
