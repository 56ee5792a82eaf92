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
import io.github.braggedge.datamodel.EdgeEstimate;
import io.github.braggedge.datamodel.FitDiagnostics;
import java.util.Arrays;
import java.util.Objects;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Outcome of a single edge fit. A failed fit carries NaN in every numeric field together with
 * the reason, so batches of curves can be processed without exception handling per curve.
 */
public final class EdgeFitResult {

  private final @NotNull EdgeEstimate estimate;
  private final double[] fitCurve;
  private final @NotNull FitDiagnostics diagnostics;
  private final @Nullable BaselineParameters baseline;
  private final @Nullable FitFailureReason failureReason;
  private final @Nullable String failureMessage;

  private EdgeFitResult(@NotNull EdgeEstimate estimate, double[] fitCurve,
      @NotNull FitDiagnostics diagnostics, @Nullable BaselineParameters baseline,
      @Nullable FitFailureReason failureReason, @Nullable String failureMessage) {
    this.estimate = estimate;
    this.fitCurve = fitCurve;
    this.diagnostics = diagnostics;
    this.baseline = baseline;
    this.failureReason = failureReason;
    this.failureMessage = failureMessage;
  }

  public static EdgeFitResult success(@NotNull EdgeEstimate estimate, @NotNull double[] fitCurve,
      @NotNull FitDiagnostics diagnostics, @NotNull BaselineParameters baseline) {
    return new EdgeFitResult(Objects.requireNonNull(estimate), fitCurve.clone(),
        Objects.requireNonNull(diagnostics), Objects.requireNonNull(baseline), null, null);
  }

  /**
   * @param numberOfValues length of the NaN filled fit curve
   */
  public static EdgeFitResult failure(@NotNull FitFailureReason reason, @NotNull String message,
      int numberOfValues) {
    final double[] nan = new double[Math.max(0, numberOfValues)];
    Arrays.fill(nan, Double.NaN);
    return new EdgeFitResult(EdgeEstimate.undefined(), nan, FitDiagnostics.undefined(), null,
        Objects.requireNonNull(reason), message);
  }

  public boolean isSuccess() {
    return failureReason == null;
  }

  public @NotNull EdgeEstimate getEstimate() {
    return estimate;
  }

  public double getEdgePosition() {
    return estimate.edgePosition();
  }

  public double getSigma() {
    return estimate.sigma();
  }

  /**
   * @return fitted transmission at every observation (TrFit)
   */
  public double[] getFitCurve() {
    return fitCurve.clone();
  }

  public @NotNull FitDiagnostics getDiagnostics() {
    return diagnostics;
  }

  public @Nullable BaselineParameters getBaseline() {
    return baseline;
  }

  public @Nullable FitFailureReason getFailureReason() {
    return failureReason;
  }

  public @Nullable String getFailureMessage() {
    return failureMessage;
  }

  @Override
  public String toString() {
    if (!isSuccess()) {
      return "EdgeFitResult{failed " + failureReason + ": " + failureMessage + "}";
    }
    return "EdgeFitResult{edgePosition=" + estimate.edgePosition() + ", sigma="
        + estimate.sigma() + ", " + diagnostics + "}";
  }
}
