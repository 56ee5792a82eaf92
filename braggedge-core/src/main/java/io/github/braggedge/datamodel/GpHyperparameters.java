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
 * Squared-exponential kernel hyperparameters and Monte-Carlo sizes.
 *
 * @param sigF        output scale of the kernel
 * @param lengthscale kernel lengthscale in rescaled [0, 1] input units
 * @param samples     number of posterior samples (ns)
 * @param testPoints  number of test grid points (nx)
 */
public record GpHyperparameters(double sigF, double lengthscale, int samples, int testPoints) {

  public static final GpHyperparameters DEFAULT = new GpHyperparameters(1d, 1e-4, 3000, 2500);

  public GpHyperparameters {
    if (!(sigF > 0d) || !Double.isFinite(sigF)) {
      throw new IllegalArgumentException("sig_f must be positive and finite, got " + sigF);
    }
    if (!(lengthscale > 0d) || !Double.isFinite(lengthscale)) {
      throw new IllegalArgumentException(
          "Lengthscale must be positive and finite, got " + lengthscale);
    }
    if (samples < 1) {
      throw new IllegalArgumentException("Number of samples must be positive, got " + samples);
    }
    if (testPoints < 2) {
      throw new IllegalArgumentException("At least two test points required, got " + testPoints);
    }
  }

  public GpHyperparameters withLengthscale(double newLengthscale) {
    return new GpHyperparameters(sigF, newLengthscale, samples, testPoints);
  }
}
