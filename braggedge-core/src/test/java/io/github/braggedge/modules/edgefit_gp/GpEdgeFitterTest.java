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

import io.github.braggedge.datamodel.FitWindow;
import io.github.braggedge.datamodel.GpHyperparameters;
import io.github.braggedge.datamodel.TransmissionCurve;
import io.github.braggedge.tools.edgesim.SyntheticEdgeCurves;
import java.util.List;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class GpEdgeFitterTest {

  private static final double TRUE_EDGE = 2d;

  private final SyntheticEdgeCurves edge = SyntheticEdgeCurves.standard();
  private final FitWindow window = SyntheticEdgeCurves.standardWindow();

  private static GpEdgeFitParameters.Builder interp() {
    return GpEdgeFitParameters.builder().lengthscale(0.04).samples(300).testPoints(400)
        .seed(42L);
  }

  @Test
  void testInterpConvergesToTrueEdge() {
    final TransmissionCurve curve = edge.noisy(1e-3, new Well19937c(1L));
    final EdgeFitResult result = new GpEdgeFitter(interp().build()).fit(curve, window);

    Assertions.assertTrue(result.isSuccess(), result::toString);
    Assertions.assertEquals(TRUE_EDGE, result.getEdgePosition(), 0.02);
    Assertions.assertTrue(result.getSigma() < 0.02);
    Assertions.assertEquals(0.04, result.getDiagnostics().lengthscale());
    Assertions.assertEquals(100, result.getFitCurve().length);
    Assertions.assertNotNull(result.getBaseline());
    Assertions.assertNull(result.getFailureReason());
    Assertions.assertTrue(result.getDiagnostics().widthAtHalfHeight() > 0d);
    Assertions.assertTrue(result.getDiagnostics().rmsResidual() < 0.01);
  }

  @Test
  void testSigmaShrinksWithNoise() {
    final GpEdgeFitter fitter = new GpEdgeFitter(interp().build());
    final double[] noise = {0.02, 0.005, 0.001};
    final double[] sigma = new double[noise.length];
    for (int i = 0; i < noise.length; i++) {
      final EdgeFitResult result = fitter.fit(edge.noisy(noise[i], new Well19937c(5L)), window);
      Assertions.assertTrue(result.isSuccess(), result::toString);
      sigma[i] = result.getSigma();
    }
    Assertions.assertTrue(sigma[0] > sigma[1], () -> sigma[0] + " <= " + sigma[1]);
    Assertions.assertTrue(sigma[1] > sigma[2], () -> sigma[1] + " <= " + sigma[2]);
  }

  @Test
  void testSeededFitIsDeterministic() {
    final TransmissionCurve curve = edge.noisy(0.01, new Well19937c(2L));
    final GpEdgeFitter fitter = new GpEdgeFitter(interp().build());
    final EdgeFitResult first = fitter.fit(curve, window);
    final EdgeFitResult second = fitter.fit(curve, window);
    Assertions.assertEquals(first.getEstimate(), second.getEstimate());
    Assertions.assertArrayEquals(first.getFitCurve(), second.getFitCurve());
  }

  @Test
  void testFullScheme() {
    final TransmissionCurve curve = edge.noisy(1e-3, new Well19937c(3L));
    final GpEdgeFitParameters params = interp().scheme(GpScheme.FULL).testPoints(200).build();
    final EdgeFitResult result = new GpEdgeFitter(params).fit(curve, window);
    Assertions.assertTrue(result.isSuccess(), result::toString);
    Assertions.assertEquals(TRUE_EDGE, result.getEdgePosition(), 0.03);
  }

  @Test
  void testHilbertSpaceScheme() {
    final TransmissionCurve curve = edge.noisy(1e-3, new Well19937c(4L));
    final GpEdgeFitParameters params = interp().scheme(GpScheme.HILBERT_SPACE).testPoints(300)
        .build();
    final EdgeFitResult result = new GpEdgeFitter(params).fit(curve, window);
    Assertions.assertTrue(result.isSuccess(), result::toString);
    Assertions.assertEquals(TRUE_EDGE, result.getEdgePosition(), 0.03);
  }

  @Test
  void testOptimisedLengthscale() {
    final TransmissionCurve curve = edge.noisy(5e-3, new Well19937c(6L));
    final GpEdgeFitParameters params = interp()
        .optimization(HyperparameterOptimization.ALL).build();
    final EdgeFitResult result = new GpEdgeFitter(params).fit(curve, window);
    Assertions.assertTrue(result.isSuccess(), result::toString);
    Assertions.assertTrue(result.getDiagnostics().lengthscale() >= 10d / 99d - 1e-12);
    Assertions.assertEquals(TRUE_EDGE, result.getEdgePosition(), 0.05);
  }

  @Test
  void testHyperparametersOverrideConfiguration() {
    final TransmissionCurve curve = edge.noisy(1e-3, new Well19937c(7L));
    final GpEdgeFitParameters params = interp().build();
    final EdgeFitResult result = new GpEdgeFitter(params).fit(curve, window,
        new GpHyperparameters(1d, 0.05, 100, 200), params);
    Assertions.assertTrue(result.isSuccess(), result::toString);
    Assertions.assertEquals(0.05, result.getDiagnostics().lengthscale());
  }

  @Test
  void testInvalidInputGivesFailureSentinel() {
    final double[] tr = edge.noiseFree().getTransmissionValues();
    tr[50] = Double.NaN;
    final TransmissionCurve nan = new TransmissionCurve(edge.noiseFree().getTofValues(), tr);
    final GpEdgeFitter fitter = new GpEdgeFitter(interp().build());

    final EdgeFitResult result = fitter.fit(nan, window);
    Assertions.assertFalse(result.isSuccess());
    Assertions.assertEquals(FitFailureReason.INVALID_INPUT, result.getFailureReason());
    Assertions.assertTrue(Double.isNaN(result.getEdgePosition()));
    Assertions.assertTrue(Double.isNaN(result.getSigma()));
    Assertions.assertTrue(Double.isNaN(result.getDiagnostics().fitQuality()));
    Assertions.assertTrue(Double.isNaN(result.getFitCurve()[0]));

    final EdgeFitResult outOfBounds = fitter.fit(edge.noiseFree(), FitWindow.of(0, 19, 79, 120));
    Assertions.assertEquals(FitFailureReason.INVALID_INPUT, outOfBounds.getFailureReason());
    Assertions.assertNotNull(outOfBounds.getFailureMessage());
  }

  @Test
  void testFitAllContinuesAfterFailure() {
    final double[] tr = edge.noiseFree().getTransmissionValues();
    tr[90] = Double.POSITIVE_INFINITY;
    final TransmissionCurve broken = new TransmissionCurve(edge.noiseFree().getTofValues(), tr);
    final List<TransmissionCurve> curves = List.of(edge.noisy(1e-3, new Well19937c(8L)), broken,
        edge.noisy(1e-3, new Well19937c(9L)));

    final List<EdgeFitResult> results = new GpEdgeFitter(interp().build()).fitAll(curves, window);
    Assertions.assertEquals(3, results.size());
    Assertions.assertTrue(results.get(0).isSuccess());
    Assertions.assertFalse(results.get(1).isSuccess());
    Assertions.assertTrue(results.get(2).isSuccess());
  }

  @Test
  void testCoverageOfRepeatedFits() {
    final GpEdgeFitter fitter = new GpEdgeFitter(interp().samples(500).testPoints(500).build());
    final Well19937c noise = new Well19937c(2024L);
    final int reps = 100;
    int inside = 0;
    for (int r = 0; r < reps; r++) {
      final EdgeFitResult result = fitter.fit(edge.noisy(0.01, noise), window);
      Assertions.assertTrue(result.isSuccess(), result::toString);
      if (Math.abs(result.getEdgePosition() - TRUE_EDGE) <= 3 * result.getSigma()) {
        inside++;
      }
    }
    Assertions.assertTrue(inside >= 95, inside + " of " + reps + " within 3 sigma");
  }
}
