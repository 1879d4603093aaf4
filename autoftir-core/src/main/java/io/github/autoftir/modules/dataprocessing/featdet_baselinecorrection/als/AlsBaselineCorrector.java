/*
 * Copyright (c) 2025 The AutoFTIR Development Team
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

package io.github.autoftir.modules.dataprocessing.featdet_baselinecorrection.als;

import io.github.autoftir.datamodel.Spectrum;
import io.github.autoftir.modules.dataprocessing.featdet_baselinecorrection.BaselineCorrector;
import io.github.autoftir.modules.dataprocessing.featdet_baselinecorrection.anchor.AnchorLinearCorrector;
import io.github.autoftir.util.exceptions.NumericalException;
import io.github.autoftir.util.linalg.BandedSymmetricSolver;
import java.util.Arrays;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

public class AlsBaselineCorrector implements BaselineCorrector {

  private static final Logger logger = Logger.getLogger(AlsBaselineCorrector.class.getName());

  private final double lambda;
  private final double ratio;
  private final int iterations;
  private final AnchorLinearCorrector anchorCorrector = new AnchorLinearCorrector();

  public AlsBaselineCorrector() {
    this(AlsBaselineCorrectorParameters.defaults());
  }

  public AlsBaselineCorrector(@NotNull AlsBaselineCorrectorParameters parameters) {
    this.lambda = parameters.lambda();
    this.ratio = parameters.ratio();
    this.iterations = parameters.iterations();
  }

  @Override
  public @NotNull String getName() {
    return "Asymmetric least squares baseline corrector";
  }

  @Override
  public @NotNull Spectrum correct(@NotNull Spectrum spectrum) {
    final double[] y = spectrum.getAbsorbances();
    final double[] baseline = computeBaseline(y);
    final double[] corrected = new double[y.length];
    for (int i = 0; i < y.length; i++) {
      corrected[i] = y[i] - baseline[i];
    }
    return spectrum.withAbsorbances(corrected);
  }

  /**
   * Smoothing followed by the linear correction through the deepest points of the remaining
   * negative artifacts.
   */
  public @NotNull Spectrum correctWithAnchors(@NotNull Spectrum spectrum) {
    return anchorCorrector.correct(correct(spectrum));
  }

  /**
   * Eilers & Boelens asymmetric least squares smoothing. Solves
   * {@code (W + lambda * D * D^T) z = W y} repeatedly, with D the second order difference
   * operator, and reweights every point by ratio (above z) or 1 - ratio (below z).
   *
   * @return the baseline estimate z
   * @throws NumericalException if less than 3 values are given or the system is singular
   */
  public double[] computeBaseline(double[] y) {
    final int n = y.length;
    if (n < 3) {
      throw new NumericalException(
          "ALS smoothing needs at least 3 values for the difference operator, got " + n);
    }
    for (double v : y) {
      if (!Double.isFinite(v)) {
        throw new NumericalException("ALS smoothing input contains non-finite values");
      }
    }

    // bands of lambda * D * D^T, each column of D holds [1, -2, 1]
    final double[] h0 = new double[n];
    final double[] h1 = new double[n - 1];
    final double[] h2 = new double[n - 2];
    final double[] stencil = {1d, -2d, 1d};
    for (int j = 0; j < n - 2; j++) {
      for (int a = 0; a < 3; a++) {
        h0[j + a] += lambda * stencil[a] * stencil[a];
        if (a < 2) {
          h1[j + a] += lambda * stencil[a] * stencil[a + 1];
        }
      }
      h2[j] += lambda * stencil[0] * stencil[2];
    }

    final double[] w = new double[n];
    Arrays.fill(w, 1d);
    final double[] d0 = new double[n];
    final double[] wy = new double[n];
    double[] z = y.clone();

    for (int iter = 0; iter < iterations; iter++) {
      for (int i = 0; i < n; i++) {
        d0[i] = w[i] + h0[i];
        wy[i] = w[i] * y[i];
      }
      z = BandedSymmetricSolver.solve(d0, h1, h2, wy);
      for (int i = 0; i < n; i++) {
        w[i] = y[i] > z[i] ? ratio : 1d - ratio;
      }
    }
    final double[] baseline = z;
    logger.finest(() -> "ALS baseline computed for %d points (lambda=%g, p=%g, %d iterations)".formatted(
        baseline.length, lambda, ratio, iterations));
    return z;
  }

  @Override
  public @NotNull String getDescription() {
    return "Asymmetric least squares smoothing with a fixed number of reweighting passes. "
        + "Points above the baseline are down-weighted so the baseline stays below absorption bands.";
  }
}
