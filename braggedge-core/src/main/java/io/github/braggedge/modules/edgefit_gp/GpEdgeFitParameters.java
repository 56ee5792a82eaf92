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

import io.github.braggedge.datamodel.GpHyperparameters;
import io.github.braggedge.util.exceptions.ConfigurationException;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Immutable configuration of the GP edge fit. All values are validated once when the
 * configuration is built, invalid combinations fail with a {@link ConfigurationException}
 * before any computation.
 */
public final class GpEdgeFitParameters {

  public static final double DEFAULT_INITIAL_GUESS = 0.5;
  public static final double DEFAULT_JITTER = 1e-10;
  public static final int DEFAULT_BASIS_FUNCTIONS = 128;
  public static final double DEFAULT_DOMAIN_HALF_WIDTH = 1.5;

  /**
   * Option names accepted by {@link #fromOptions(Map)}.
   */
  public static final Set<String> OPTION_NAMES = Set.of("a00", "b00", "a_hkl0", "b_hkl0",
      "sig_f", "l", "ns", "nx", "GPscheme", "optimiseHP", "covfunc", "jitter", "m", "L", "seed");

  private final double a00;
  private final double b00;
  private final double aHkl0;
  private final double bHkl0;
  private final GpHyperparameters hyperparameters;
  private final GpScheme scheme;
  private final HyperparameterOptimization optimization;
  private final CovarianceFunction covarianceFunction;
  private final double jitter;
  private final int basisFunctions;
  private final double domainHalfWidth;
  private final @Nullable Long seed;

  private GpEdgeFitParameters(Builder b) {
    this.a00 = b.a00;
    this.b00 = b.b00;
    this.aHkl0 = b.aHkl0;
    this.bHkl0 = b.bHkl0;
    this.scheme = Objects.requireNonNull(b.scheme, "scheme");
    this.optimization = Objects.requireNonNull(b.optimization, "optimization");
    this.covarianceFunction = Objects.requireNonNull(b.covarianceFunction, "covarianceFunction");
    this.jitter = b.jitter;
    this.basisFunctions = b.basisFunctions;
    this.domainHalfWidth = b.domainHalfWidth;
    this.seed = b.seed;

    for (double guess : new double[]{a00, b00, aHkl0, bHkl0}) {
      if (!Double.isFinite(guess)) {
        throw new ConfigurationException("Baseline initial guesses must be finite");
      }
    }
    try {
      this.hyperparameters = new GpHyperparameters(b.sigF, b.lengthscale, b.samples,
          b.testPoints);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException(e.getMessage(), e);
    }
    if (!(jitter >= 0d) || !Double.isFinite(jitter)) {
      throw new ConfigurationException("Jitter must be finite and not negative, got " + jitter);
    }
    if (basisFunctions < 1) {
      throw new ConfigurationException(
          "Number of basis functions must be positive, got " + basisFunctions);
    }
    if (!(domainHalfWidth > 1d) || !Double.isFinite(domainHalfWidth)) {
      throw new ConfigurationException(
          "Hilbert-space domain half width must exceed 1, got " + domainHalfWidth);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public static GpEdgeFitParameters defaults() {
    return builder().build();
  }

  /**
   * Builds parameters from a loosely typed option map using the option names of
   * {@link #OPTION_NAMES}. Numbers may be given as {@link Number} or {@link String}.
   *
   * @throws ConfigurationException for unknown option names or invalid values
   */
  public static GpEdgeFitParameters fromOptions(@NotNull Map<String, ?> options) {
    final Builder b = builder();
    for (Map.Entry<String, ?> e : options.entrySet()) {
      final String key = e.getKey();
      final Object value = e.getValue();
      switch (key) {
        case "a00" -> b.a00 = toDouble(key, value);
        case "b00" -> b.b00 = toDouble(key, value);
        case "a_hkl0" -> b.aHkl0 = toDouble(key, value);
        case "b_hkl0" -> b.bHkl0 = toDouble(key, value);
        case "sig_f" -> b.sigF = toDouble(key, value);
        case "l" -> b.lengthscale = toDouble(key, value);
        case "ns" -> b.samples = toInt(key, value);
        case "nx" -> b.testPoints = toInt(key, value);
        case "GPscheme" -> b.scheme = GpScheme.parse(String.valueOf(value));
        case "optimiseHP" -> b.optimization = HyperparameterOptimization.parse(
            String.valueOf(value));
        case "covfunc" -> b.covarianceFunction = CovarianceFunction.parse(String.valueOf(value));
        case "jitter" -> b.jitter = toDouble(key, value);
        case "m" -> b.basisFunctions = toInt(key, value);
        case "L" -> b.domainHalfWidth = toDouble(key, value);
        case "seed" -> b.seed = (long) toDouble(key, value);
        default -> throw new ConfigurationException(
            "Unknown option '" + key + "', known options are " + OPTION_NAMES);
      }
    }
    return b.build();
  }

  private static double toDouble(String key, Object value) {
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    try {
      return Double.parseDouble(String.valueOf(value).trim());
    } catch (NumberFormatException ex) {
      throw new ConfigurationException("Option " + key + " is not a number: " + value, ex);
    }
  }

  private static int toInt(String key, Object value) {
    final double d = toDouble(key, value);
    if (d != Math.rint(d) || Math.abs(d) > Integer.MAX_VALUE) {
      throw new ConfigurationException("Option " + key + " must be an integer, got " + value);
    }
    return (int) d;
  }

  public double getA00() {
    return a00;
  }

  public double getB00() {
    return b00;
  }

  public double getAHkl0() {
    return aHkl0;
  }

  public double getBHkl0() {
    return bHkl0;
  }

  public GpHyperparameters getHyperparameters() {
    return hyperparameters;
  }

  public GpScheme getScheme() {
    return scheme;
  }

  public HyperparameterOptimization getOptimization() {
    return optimization;
  }

  public CovarianceFunction getCovarianceFunction() {
    return covarianceFunction;
  }

  public double getJitter() {
    return jitter;
  }

  public int getBasisFunctions() {
    return basisFunctions;
  }

  public double getDomainHalfWidth() {
    return domainHalfWidth;
  }

  public @Nullable Long getSeed() {
    return seed;
  }

  /**
   * @return a builder initialised with these values
   */
  public Builder toBuilder() {
    final Builder b = new Builder();
    b.a00 = a00;
    b.b00 = b00;
    b.aHkl0 = aHkl0;
    b.bHkl0 = bHkl0;
    b.sigF = hyperparameters.sigF();
    b.lengthscale = hyperparameters.lengthscale();
    b.samples = hyperparameters.samples();
    b.testPoints = hyperparameters.testPoints();
    b.scheme = scheme;
    b.optimization = optimization;
    b.covarianceFunction = covarianceFunction;
    b.jitter = jitter;
    b.basisFunctions = basisFunctions;
    b.domainHalfWidth = domainHalfWidth;
    b.seed = seed;
    return b;
  }

  @Override
  public String toString() {
    return "GpEdgeFitParameters{scheme=" + scheme.getOptionValue() + ", optimiseHP="
        + optimization.getOptionValue() + ", covfunc=" + covarianceFunction.getOptionValue()
        + ", " + hyperparameters + ", initial=[" + a00 + ", " + b00 + ", " + aHkl0 + ", "
        + bHkl0 + "], jitter=" + jitter + ", m=" + basisFunctions + ", L=" + domainHalfWidth
        + ", seed=" + seed + "}";
  }

  public static final class Builder {

    private double a00 = DEFAULT_INITIAL_GUESS;
    private double b00 = DEFAULT_INITIAL_GUESS;
    private double aHkl0 = DEFAULT_INITIAL_GUESS;
    private double bHkl0 = DEFAULT_INITIAL_GUESS;
    private double sigF = GpHyperparameters.DEFAULT.sigF();
    private double lengthscale = GpHyperparameters.DEFAULT.lengthscale();
    private int samples = GpHyperparameters.DEFAULT.samples();
    private int testPoints = GpHyperparameters.DEFAULT.testPoints();
    private GpScheme scheme = GpScheme.INTERP;
    private HyperparameterOptimization optimization = HyperparameterOptimization.NONE;
    private CovarianceFunction covarianceFunction = CovarianceFunction.SQUARED_EXPONENTIAL;
    private double jitter = DEFAULT_JITTER;
    private int basisFunctions = DEFAULT_BASIS_FUNCTIONS;
    private double domainHalfWidth = DEFAULT_DOMAIN_HALF_WIDTH;
    private @Nullable Long seed;

    private Builder() {
    }

    public Builder initialGuess(double a00, double b00, double aHkl0, double bHkl0) {
      this.a00 = a00;
      this.b00 = b00;
      this.aHkl0 = aHkl0;
      this.bHkl0 = bHkl0;
      return this;
    }

    public Builder hyperparameters(@NotNull GpHyperparameters hyperparameters) {
      this.sigF = hyperparameters.sigF();
      this.lengthscale = hyperparameters.lengthscale();
      this.samples = hyperparameters.samples();
      this.testPoints = hyperparameters.testPoints();
      return this;
    }

    public Builder sigF(double sigF) {
      this.sigF = sigF;
      return this;
    }

    public Builder lengthscale(double lengthscale) {
      this.lengthscale = lengthscale;
      return this;
    }

    public Builder samples(int samples) {
      this.samples = samples;
      return this;
    }

    public Builder testPoints(int testPoints) {
      this.testPoints = testPoints;
      return this;
    }

    public Builder scheme(@NotNull GpScheme scheme) {
      this.scheme = scheme;
      return this;
    }

    public Builder optimization(@NotNull HyperparameterOptimization optimization) {
      this.optimization = optimization;
      return this;
    }

    public Builder covarianceFunction(@NotNull CovarianceFunction covarianceFunction) {
      this.covarianceFunction = covarianceFunction;
      return this;
    }

    public Builder jitter(double jitter) {
      this.jitter = jitter;
      return this;
    }

    public Builder basisFunctions(int basisFunctions) {
      this.basisFunctions = basisFunctions;
      return this;
    }

    public Builder domainHalfWidth(double domainHalfWidth) {
      this.domainHalfWidth = domainHalfWidth;
      return this;
    }

    public Builder seed(@Nullable Long seed) {
      this.seed = seed;
      return this;
    }

    /**
     * @throws ConfigurationException if a value or combination is invalid
     */
    public GpEdgeFitParameters build() {
      return new GpEdgeFitParameters(this);
    }
  }
}
