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
import io.github.braggedge.util.MathUtils;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class TransmissionCurveTest {

  private static TransmissionCurve curve() {
    final double[] tof = MathUtils.linspace(1d, 3d, 100);
    return new TransmissionCurve(tof, new double[100]);
  }

  @Test
  void testRejectsInvalidTof() {
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new TransmissionCurve(new double[]{1, 2, 2}, new double[3]));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new TransmissionCurve(new double[]{1, 2, 3}, new double[2]));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new TransmissionCurve(new double[]{1, 2}, new double[2]));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new TransmissionCurve(new double[]{1, Double.NaN, 3}, new double[3]));
  }

  @Test
  void testDefensiveCopies() {
    final double[] tof = {1, 2, 3};
    final double[] tr = {0.5, 0.6, 0.7};
    final TransmissionCurve curve = new TransmissionCurve(tof, tr);
    tr[0] = 5d;
    curve.getTransmissionValues()[1] = 5d;
    Assertions.assertEquals(0.5, curve.getTransmission(0));
    Assertions.assertEquals(0.6, curve.getTransmission(1));
    Assertions.assertEquals(new TransmissionCurve(tof, new double[]{0.5, 0.6, 0.7}), curve);
  }

  @Test
  void testIndexRange() {
    final TransmissionCurve curve = curve();
    Assertions.assertEquals(Range.closed(0, 19), curve.indexRange(Range.closed(1d, 1.39)));
    Assertions.assertEquals(Range.closed(80, 99), curve.indexRange(Range.closed(2.6, 3d)));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> curve.indexRange(Range.closed(5d, 6d)));
  }

  @Test
  void testFitWindowFromTofRanges() {
    final TransmissionCurve curve = curve();
    final FitWindow window = FitWindow.fromTofRanges(curve, Range.closed(1d, 1.39),
        Range.closed(2.6, 3d));
    Assertions.assertEquals(FitWindow.of(0, 19, 80, 99), window);
    Assertions.assertEquals(20, window.preEdgeSize());
    Assertions.assertEquals(20, window.postEdgeSize());
  }

  @Test
  void testFitWindowValidation() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> FitWindow.of(0, 50, 40, 99));
    Assertions.assertThrows(IllegalArgumentException.class, () -> FitWindow.of(0, 0, 40, 99));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new FitWindow(Range.closedOpen(0, 19), Range.closed(79, 99)));

    final FitWindow outOfBounds = FitWindow.of(0, 19, 79, 100);
    Assertions.assertThrows(IllegalArgumentException.class, () -> outOfBounds.validate(curve()));
    Assertions.assertDoesNotThrow(() -> FitWindow.of(0, 19, 79, 99).validate(curve()));
  }
}
