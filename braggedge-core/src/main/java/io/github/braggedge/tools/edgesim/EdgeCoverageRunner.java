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

package io.github.braggedge.tools.edgesim;

import io.github.braggedge.datamodel.FitWindow;
import io.github.braggedge.datamodel.TransmissionCurve;
import io.github.braggedge.modules.edgefit_gp.EdgeFitResult;
import io.github.braggedge.modules.edgefit_gp.GpEdgeFitParameters;
import io.github.braggedge.modules.edgefit_gp.GpEdgeFitter;
import io.github.braggedge.modules.edgefit_gp.GpScheme;
import io.github.braggedge.modules.edgefit_gp.HyperparameterOptimization;
import io.github.braggedge.util.MathUtils;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;
import org.apache.commons.math3.random.Well19937c;

/**
 * Standalone runner that fits repeated noisy realisations of the standard synthetic edge and
 * reports how often the true edge lies within 1, 2 and 3 sigma of the estimate.
 * <p>
 * Usage:
 * <pre>
 *   -Dreps=100 -DnoiseGrid=0.02,0.005,0.001 -Dscheme=interp -DoptimiseHP=none -Dl=0.04
 *   -Dns=500 -Dnx=500 -Dseed=42 -DoutDir=/absolute/output/path
 * </pre>
 * Without {@code -DoutDir} the summary is only printed.
 */
public class EdgeCoverageRunner {

  private static final Logger logger = Logger.getLogger(EdgeCoverageRunner.class.getName());

  public static void main(String[] args) throws Exception {
    final int reps = Integer.parseInt(System.getProperty("reps", "100"));
    final List<Double> noiseGrid = listOrDefault("noiseGrid", new String[]{"0.02", "0.005",
        "0.001"}).stream().map(Double::parseDouble).toList();
    final long seed = Long.parseLong(System.getProperty("seed", "42"));
    final String outDirArg = System.getProperty("outDir", "").trim();

    final GpEdgeFitParameters parameters = GpEdgeFitParameters.builder()
        .scheme(GpScheme.parse(System.getProperty("scheme", "interp")))
        .optimization(HyperparameterOptimization.parse(System.getProperty("optimiseHP", "none")))
        .lengthscale(Double.parseDouble(System.getProperty("l", "0.04")))
        .samples(Integer.parseInt(System.getProperty("ns", "500")))
        .testPoints(Integer.parseInt(System.getProperty("nx", "500"))).seed(seed).build();
    System.out.printf(Locale.US, "Coverage of %d repetitions, %s%n", reps, parameters);

    final SyntheticEdgeCurves edge = SyntheticEdgeCurves.standard();
    final FitWindow window = SyntheticEdgeCurves.standardWindow();
    final GpEdgeFitter fitter = new GpEdgeFitter(parameters);
    final Well19937c noise = new Well19937c(seed);

    final List<String> rows = new ArrayList<>();
    rows.add("noise\treps\tfailed\tmean_error\tmean_sigma\twithin_1sigma\twithin_2sigma"
        + "\twithin_3sigma");
    for (double noiseStd : noiseGrid) {
      final List<TransmissionCurve> curves = new ArrayList<>(reps);
      for (int r = 0; r < reps; r++) {
        curves.add(edge.noisy(noiseStd, noise));
      }
      final List<EdgeFitResult> results = fitter.fitAll(curves, window);
      final CoverageSummary summary = CoverageSummary.of(noiseStd, edge.getEdgePosition(),
          results);
      System.out.printf(Locale.US,
          "noise %.4g: %d failed, mean error %.4g, mean sigma %.4g, coverage %.2f/%.2f/%.2f%n",
          noiseStd, summary.failed(), summary.meanError(), summary.meanSigma(),
          summary.coverage()[0], summary.coverage()[1], summary.coverage()[2]);
      rows.add(summary.toRow());
    }

    if (!outDirArg.isEmpty()) {
      final Path outDir = Paths.get(outDirArg).toAbsolutePath().normalize();
      Files.createDirectories(outDir);
      final Path out = outDir.resolve("edge_coverage.tsv");
      Files.writeString(out, String.join("\n", rows) + "\n", StandardCharsets.UTF_8);
      logger.info(() -> "Wrote coverage summary to " + out);
    }
  }

  private static List<String> listOrDefault(String key, String[] def) {
    final String v = System.getProperty(key, "");
    if (v == null || v.isBlank()) {
      return Arrays.asList(def);
    }
    return Arrays.stream(v.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
  }

  /**
   * @param coverage fraction of successful fits with the true edge within 1, 2 and 3 sigma
   */
  record CoverageSummary(double noiseStd, int reps, int failed, double meanError,
                         double meanSigma, double[] coverage) {

    static CoverageSummary of(double noiseStd, double trueEdge, List<EdgeFitResult> results) {
      final List<EdgeFitResult> ok = results.stream().filter(EdgeFitResult::isSuccess).toList();
      final double[] errors = ok.stream().mapToDouble(r -> r.getEdgePosition() - trueEdge)
          .toArray();
      final double[] sigmas = ok.stream().mapToDouble(EdgeFitResult::getSigma).toArray();
      final double[] coverage = new double[3];
      for (int k = 0; k < coverage.length; k++) {
        int inside = 0;
        for (int i = 0; i < errors.length; i++) {
          if (Math.abs(errors[i]) <= (k + 1) * sigmas[i]) {
            inside++;
          }
        }
        coverage[k] = ok.isEmpty() ? Double.NaN : inside / (double) ok.size();
      }
      return new CoverageSummary(noiseStd, results.size(), results.size() - ok.size(),
          ok.isEmpty() ? Double.NaN : MathUtils.mean(errors),
          ok.isEmpty() ? Double.NaN : MathUtils.mean(sigmas), coverage);
    }

    String toRow() {
      return String.format(Locale.US, "%.6g\t%d\t%d\t%.6g\t%.6g\t%.3f\t%.3f\t%.3f", noiseStd,
          reps, failed, meanError, meanSigma, coverage[0], coverage[1], coverage[2]);
    }
  }
}
