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

import io.github.braggedge.datamodel.BaselineParameters;
import io.github.braggedge.datamodel.FitDiagnostics;
import io.github.braggedge.datamodel.TransmissionCurve;
import io.github.braggedge.util.MathUtils;
import java.util.Locale;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Recombines the baseline with the transition estimate and derives the fit diagnostics.
 */
public class FitResultAssembler {

  private static final Logger logger = Logger.getLogger(FitResultAssembler.class.getName());

  /**
   * @param transitionEstimate posterior mean of the transition function at each observation
   * @return fitted transmission at each observation
   */
  public double[] reconstruct(@NotNull TransmissionCurve curve,
      @NotNull BaselineParameters baseline, @NotNull double[] transitionEstimate) {
    final double[] fit = new double[curve.getNumberOfValues()];
    for (int i = 0; i < fit.length; i++) {
      fit[i] = baseline.reconstruct(curve.getTof(i), transitionEstimate[i]);
    }
    return fit;
  }

  public @NotNull FitDiagnostics assemble(@NotNull TransmissionCurve curve,
      @NotNull double[] fittedTransmission, double noiseStd, double lengthscale,
      @NotNull double[] testTof, @NotNull double[] derivativeMean) {
    final double[] residual = new double[fittedTransmission.length];
    for (int i = 0; i < residual.length; i++) {
      residual[i] = curve.getTransmission(i) - fittedTransmission[i];
    }
    final double std = MathUtils.std(residual);
    final double rms = MathUtils.rms(residual);
    final double fitQuality = noiseStd / std;

    final FitQuality quality = FitQuality.classify(fitQuality);
    if (quality.isWarning()) {
      logger.warning(() -> String.format(Locale.US,
          "The ratio of sig_m/std(residual) is %s (%.4g), %s", quality == FitQuality.LIKELY_OVERFIT
              ? "high" : "low", fitQuality, quality.getAdvice()));
    }
    return new FitDiagnostics(lengthscale, std, rms, fitQuality,
        widthAtHalfHeight(testTof, derivativeMean));
  }

  /**
   * Distance between the two points where the derivative curve crosses half its maximum. NaN
   * unless there are exactly two crossings.
   */
  public static double widthAtHalfHeight(@NotNull double[] grid, @NotNull double[] derivative) {
    final double halfHeight = MathUtils.max(derivative) / 2d;
    final double[] crossings = MathUtils.levelCrossings(grid, derivative, halfHeight);
    if (crossings.length != 2) {
      return Double.NaN;
    }
    return Math.abs(crossings[1] - crossings[0]);
  }
}
