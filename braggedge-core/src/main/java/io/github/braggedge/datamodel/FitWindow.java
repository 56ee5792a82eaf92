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

import com.google.common.collect.BoundType;
import com.google.common.collect.Range;
import org.jetbrains.annotations.NotNull;

/**
 * Two closed, zero based index ranges over a {@link TransmissionCurve}: the flat region before
 * the edge (used for the hkl attenuation fit) and the flat region after it (used for the
 * attenuation of all other reflections).
 *
 * @param preEdge  indices left of the edge (startIdx)
 * @param postEdge indices right of the edge (endIdx)
 */
public record FitWindow(@NotNull Range<Integer> preEdge, @NotNull Range<Integer> postEdge) {

  public FitWindow {
    checkClosed(preEdge, "pre-edge");
    checkClosed(postEdge, "post-edge");
    if (preEdge.upperEndpoint() - preEdge.lowerEndpoint() < 1
        || postEdge.upperEndpoint() - postEdge.lowerEndpoint() < 1) {
      throw new IllegalArgumentException("Each fit range must span at least two points");
    }
    if (preEdge.upperEndpoint() >= postEdge.lowerEndpoint()) {
      throw new IllegalArgumentException(
          "Pre-edge range " + preEdge + " must end before post-edge range " + postEdge);
    }
  }

  public static FitWindow of(int preStart, int preEnd, int postStart, int postEnd) {
    return new FitWindow(Range.closed(preStart, preEnd), Range.closed(postStart, postEnd));
  }

  /**
   * Resolves both ranges given in time-of-flight units to index ranges on the curve.
   */
  public static FitWindow fromTofRanges(@NotNull TransmissionCurve curve,
      @NotNull Range<Double> preEdgeTof, @NotNull Range<Double> postEdgeTof) {
    return new FitWindow(curve.indexRange(preEdgeTof), curve.indexRange(postEdgeTof));
  }

  /**
   * @throws IllegalArgumentException if a range exceeds the bounds of the curve
   */
  public void validate(@NotNull TransmissionCurve curve) {
    final int n = curve.getNumberOfValues();
    if (preEdge.lowerEndpoint() < 0 || postEdge.upperEndpoint() >= n) {
      throw new IllegalArgumentException(
          "Fit window " + this + " exceeds curve bounds [0, " + (n - 1) + "]");
    }
  }

  public int preEdgeStart() {
    return preEdge.lowerEndpoint();
  }

  public int preEdgeEnd() {
    return preEdge.upperEndpoint();
  }

  public int postEdgeStart() {
    return postEdge.lowerEndpoint();
  }

  public int postEdgeEnd() {
    return postEdge.upperEndpoint();
  }

  public int preEdgeSize() {
    return preEdgeEnd() - preEdgeStart() + 1;
  }

  public int postEdgeSize() {
    return postEdgeEnd() - postEdgeStart() + 1;
  }

  private static void checkClosed(Range<Integer> range, String name) {
    if (!range.hasLowerBound() || !range.hasUpperBound()
        || range.lowerBoundType() != BoundType.CLOSED
        || range.upperBoundType() != BoundType.CLOSED) {
      throw new IllegalArgumentException("The " + name + " range must be closed: " + range);
    }
  }
}
