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

import io.github.braggedge.datamodel.FitDiagnostics;
import io.github.braggedge.datamodel.TransmissionCurve;
import io.github.braggedge.tools.edgesim.SyntheticEdgeCurves;
import io.github.braggedge.util.MathUtils;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class FitResultAssemblerTest {

  private static final double[] GRID = {0, 1, 2, 3, 4};

  @Test
  void testWidthWithTwoCrossings() {
    Assertions.assertEquals(2d,
        FitResultAssembler.widthAtHalfHeight(GRID, new double[]{0, 1, 2, 1, 0}), 1e-15);
    Assertions.assertEquals(3d,
        FitResultAssembler.widthAtHalfHeight(GRID, new double[]{0, 2, 2, 2, 0}), 1e-15);
  }

  @Test
  void testWidthUndefinedOtherwise() {
    // no crossing
    Assertions.assertTrue(Double.isNaN(
        FitResultAssembler.widthAtHalfHeight(GRID, new double[]{1, 1.2, 1.4, 1.6, 1.8})));
    // one crossing
    Assertions.assertTrue(Double.isNaN(
        FitResultAssembler.widthAtHalfHeight(GRID, new double[]{0, 1, 2, 3, 4})));
    // four crossings
    Assertions.assertTrue(Double.isNaN(
        FitResultAssembler.widthAtHalfHeight(GRID, new double[]{0, 2, 0, 2, 0})));
    // three crossings
    Assertions.assertTrue(Double.isNaN(
        FitResultAssembler.widthAtHalfHeight(GRID, new double[]{0, 2, 0, 2, 2})));
  }

  @Test
  void testReconstructAndDiagnostics() {
    final SyntheticEdgeCurves edge = SyntheticEdgeCurves.standard();
    final TransmissionCurve curve = edge.noiseFree();
    final double[] tof = curve.getTofValues();
    final double[] transition = new double[tof.length];
    for (int i = 0; i < tof.length; i++) {
      transition[i] = edge.transition(tof[i]);
    }

    final FitResultAssembler assembler = new FitResultAssembler();
    final double[] fit = assembler.reconstruct(curve, edge.getBaseline(), transition);
    Assertions.assertArrayEquals(curve.getTransmissionValues(), fit, 1e-14);

    final double[] shifted = fit.clone();
    for (int i = 0; i < shifted.length; i++) {
      shifted[i] += (i % 2 == 0 ? 1 : -1) * 0.01;
    }
    final FitDiagnostics diagnostics = assembler.assemble(curve, shifted, 0.01, 0.04,
        GRID, new double[]{0, 1, 2, 1, 0});
    Assertions.assertEquals(0.04, diagnostics.lengthscale());
    Assertions.assertEquals(0.01, diagnostics.rmsResidual(), 1e-12);
    Assertions.assertEquals(0.01 / diagnostics.stdResidual(), diagnostics.fitQuality(), 1e-12);
    Assertions.assertEquals(FitQuality.ACCEPTABLE, FitQuality.classify(diagnostics.fitQuality()));
    Assertions.assertEquals(2d, diagnostics.widthAtHalfHeight(), 1e-15);
  }

  @Test
  void testQualityWarningLoggedAtBoundsOnly() {
    final SyntheticEdgeCurves edge = SyntheticEdgeCurves.standard();
    final TransmissionCurve curve = edge.noiseFree();
    final double[] fit = curve.getTransmissionValues();
    final double[] residual = new double[fit.length];
    for (int i = 0; i < fit.length; i++) {
      final double offset = (i % 3 - 1) * 0.01;
      fit[i] += offset;
      residual[i] = curve.getTransmission(i) - fit[i];
    }
    final double std = MathUtils.std(residual);

    Assertions.assertEquals(1, warningsFor(curve, fit, 0.5 * std));
    Assertions.assertEquals(1, warningsFor(curve, fit, 2d * std));
    Assertions.assertEquals(0, warningsFor(curve, fit, std));
    Assertions.assertEquals(0, warningsFor(curve, fit, 0.51 * std));
    Assertions.assertEquals(0, warningsFor(curve, fit, 1.99 * std));
    Assertions.assertEquals(1, warningsFor(curve, fit, 0.1 * std));
    Assertions.assertEquals(1, warningsFor(curve, fit, 5d * std));
  }

  private static int warningsFor(TransmissionCurve curve, double[] fit, double noiseStd) {
    final Logger logger = Logger.getLogger(FitResultAssembler.class.getName());
    final List<LogRecord> records = new ArrayList<>();
    final Handler handler = new Handler() {
      @Override
      public void publish(LogRecord record) {
        records.add(record);
      }

      @Override
      public void flush() {
      }

      @Override
      public void close() {
      }
    };
    handler.setLevel(Level.ALL);
    logger.addHandler(handler);
    try {
      new FitResultAssembler().assemble(curve, fit, noiseStd, 0.04, GRID,
          new double[]{0, 1, 2, 1, 0});
    } finally {
      logger.removeHandler(handler);
    }
    return (int) records.stream().filter(r -> r.getLevel() == Level.WARNING).count();
  }
}
