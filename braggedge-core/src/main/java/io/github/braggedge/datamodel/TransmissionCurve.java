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

import com.google.common.collect.Range;
import java.util.Arrays;
import org.jetbrains.annotations.NotNull;

/**
 * Normalised neutron transmission over time-of-flight (or wavelength) for a single projection
 * or macro pixel. Time-of-flight values are strictly increasing. Instances are immutable, all
 * array accessors return copies.
 */
public final class TransmissionCurve {

  private final double[] tof;
  private final double[] transmission;

  public TransmissionCurve(@NotNull double[] tof, @NotNull double[] transmission) {
    if (tof.length != transmission.length) {
      throw new IllegalArgumentException(
          "Time-of-flight and transmission differ in length: " + tof.length + " vs "
              + transmission.length);
    }
    if (tof.length < 3) {
      throw new IllegalArgumentException(
          "A transmission curve needs at least 3 points, got " + tof.length);
    }
    for (int i = 0; i < tof.length; i++) {
      if (!Double.isFinite(tof[i])) {
        throw new IllegalArgumentException("Non-finite time-of-flight at index " + i);
      }
      if (i > 0 && tof[i] <= tof[i - 1]) {
        throw new IllegalArgumentException(
            "Time-of-flight must be strictly increasing, violated at index " + i);
      }
    }
    this.tof = tof.clone();
    this.transmission = transmission.clone();
  }

  public int getNumberOfValues() {
    return tof.length;
  }

  public double getTof(int index) {
    return tof[index];
  }

  public double getTransmission(int index) {
    return transmission[index];
  }

  public double[] getTofValues() {
    return tof.clone();
  }

  public double[] getTransmissionValues() {
    return transmission.clone();
  }

  /**
   * @return the smallest closed index range holding every time-of-flight inside the given range.
   * @throws IllegalArgumentException if no point lies inside the range
   */
  public Range<Integer> indexRange(@NotNull Range<Double> tofRange) {
    int first = -1;
    int last = -1;
    for (int i = 0; i < tof.length; i++) {
      if (tofRange.contains(tof[i])) {
        if (first < 0) {
          first = i;
        }
        last = i;
      }
    }
    if (first < 0) {
      throw new IllegalArgumentException("No time-of-flight value inside " + tofRange);
    }
    return Range.closed(first, last);
  }

  @Override
  public String toString() {
    return "TransmissionCurve{n=" + tof.length + ", tof=[" + tof[0] + ", " + tof[tof.length - 1]
        + "]}";
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TransmissionCurve that)) {
      return false;
    }
    return Arrays.equals(tof, that.tof) && Arrays.equals(transmission, that.transmission);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(tof) + Arrays.hashCode(transmission);
  }
}
