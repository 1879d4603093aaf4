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

package io.github.autoftir.util.fitting;

import io.github.autoftir.datamodel.GaussianComponent;
import io.github.autoftir.util.exceptions.GaussianFitFailedException;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.GaussianCurveFitter;
import org.apache.commons.math3.fitting.WeightedObservedPoint;
import org.jetbrains.annotations.NotNull;

/**
 * Least-squares Gaussian fits on band flanks.
 */
public final class GaussianFitting {

  private static final int MAX_ITERATIONS = 1000;

  private GaussianFitting() {
  }

  /**
   * Fits height, mean and sigma.
   *
   * @param startPoint {@code [height, mean, sigma]}
   * @throws GaussianFitFailedException if fewer than three points are given or the optimizer does
   *                                    not converge
   */
  public static @NotNull GaussianComponent fitGaussian(double[] x, double[] y,
      double[] startPoint) {
    if (x.length < 3) {
      throw new GaussianFitFailedException(
          "At least 3 points are needed to fit a Gaussian, got " + x.length);
    }
    final List<WeightedObservedPoint> points = new ArrayList<>(x.length);
    for (int i = 0; i < x.length; i++) {
      points.add(new WeightedObservedPoint(1d, x[i], y[i]));
    }
    try {
      final double[] p = GaussianCurveFitter.create().withStartPoint(startPoint)
          .withMaxIterations(MAX_ITERATIONS).fit(points);
      return new GaussianComponent(p[1], p[2], p[0]);
    } catch (MathIllegalStateException | MathIllegalArgumentException e) {
      throw new GaussianFitFailedException("Gaussian fit did not converge: " + e.getMessage(), e);
    }
  }

  /**
   * Fits mean and sigma of a Gaussian with fixed height. Each residual is weighted with the
   * observed value, so points close to the band maximum dominate the fit.
   *
   * @param startPoint {@code [mean, sigma]}
   * @throws GaussianFitFailedException if the optimizer does not converge
   */
  public static @NotNull GaussianComponent fitWithFixedAmplitude(double[] x, double[] y,
      double amplitude, double[] startPoint) {
    if (x.length < 2) {
      throw new GaussianFitFailedException(
          "At least 2 points are needed to fit mean and sigma, got " + x.length);
    }
    final List<WeightedObservedPoint> points = new ArrayList<>(x.length);
    for (int i = 0; i < x.length; i++) {
      points.add(new WeightedObservedPoint(y[i] * y[i], x[i], y[i]));
    }
    try {
      final double[] p = FixedAmplitudeGaussianFitter.create(amplitude, startPoint)
          .withMaxIterations(MAX_ITERATIONS).fit(points);
      return new GaussianComponent(p[0], p[1], amplitude);
    } catch (MathIllegalStateException | MathIllegalArgumentException e) {
      throw new GaussianFitFailedException("Gaussian fit did not converge: " + e.getMessage(), e);
    }
  }
}
