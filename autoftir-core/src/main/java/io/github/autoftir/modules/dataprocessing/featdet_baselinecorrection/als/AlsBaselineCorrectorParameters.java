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

import com.google.common.base.Preconditions;
import org.jetbrains.annotations.NotNull;

/**
 * Settings of the asymmetric least squares smoother.
 *
 * @param lambda     smoothing weight, see {@link #LAMBDA_DESCRIPTION}
 * @param ratio      asymmetry, see {@link #RATIO_DESCRIPTION}
 * @param iterations number of reweighting passes, see {@link #ITERATIONS_DESCRIPTION}
 */
public record AlsBaselineCorrectorParameters(double lambda, double ratio, int iterations) {

  public static final double MIN_LAMBDA = 10d;
  public static final double MAX_LAMBDA = 1e10;
  public static final double DEFAULT_LAMBDA = 1e6;

  public static final double MIN_RATIO = 1e-4;
  public static final double MAX_RATIO = 0.5;
  public static final double DEFAULT_RATIO = 0.1;

  public static final int MIN_ITERATIONS = 1;
  public static final int MAX_ITERATIONS = 1000;
  public static final int DEFAULT_ITERATIONS = 150;

  public static final String LAMBDA_DESCRIPTION = """
      Smoothing parameter that controls the trade-off between fidelity to the data and
      smoothness of the baseline. Larger values give a stiffer baseline that ignores narrow
      bands, smaller values let the baseline follow faster variations.
      Typical values range from 1e4 to 1e10.
      """;

  public static final String RATIO_DESCRIPTION = """
      Weight of points above the current baseline estimate. Points below the baseline get the
      weight 1 - ratio. Small values push the baseline below the absorption bands.
      Typical values range from 0.001 to 0.1.
      """;

  public static final String ITERATIONS_DESCRIPTION = """
      Number of reweighting passes. The smoother does not test for convergence and always
      performs exactly this many passes.
      Typical values range from 100 to 1000.
      """;

  public AlsBaselineCorrectorParameters {
    Preconditions.checkArgument(lambda >= MIN_LAMBDA && lambda <= MAX_LAMBDA,
        "ALS lambda must be within [%s, %s] but was %s", MIN_LAMBDA, MAX_LAMBDA, lambda);
    Preconditions.checkArgument(ratio >= MIN_RATIO && ratio <= MAX_RATIO,
        "ALS ratio must be within [%s, %s] but was %s", MIN_RATIO, MAX_RATIO, ratio);
    Preconditions.checkArgument(iterations >= MIN_ITERATIONS && iterations <= MAX_ITERATIONS,
        "ALS iterations must be within [%s, %s] but was %s", MIN_ITERATIONS, MAX_ITERATIONS,
        iterations);
  }

  public static @NotNull AlsBaselineCorrectorParameters defaults() {
    return new AlsBaselineCorrectorParameters(DEFAULT_LAMBDA, DEFAULT_RATIO, DEFAULT_ITERATIONS);
  }
}
