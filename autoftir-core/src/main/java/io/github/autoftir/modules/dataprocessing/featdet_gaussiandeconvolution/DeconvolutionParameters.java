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

package io.github.autoftir.modules.dataprocessing.featdet_gaussiandeconvolution;

import com.google.common.base.Preconditions;
import com.google.common.collect.Range;
import org.jetbrains.annotations.NotNull;

/**
 * Windows and stop criteria of the greedy Gaussian deconvolution. The defaults assume a spectrum
 * normalized to a band maximum of 0.15 in the aliphatic region.
 *
 * @param fitRange           the spectrum is cut to this range before fitting
 * @param generalWindow      initial window for the biggest peak search
 * @param generalThreshold   the general search stops once the residual maximum in the general
 *                           window is below this value
 * @param windowShrinkStep   the general window is narrowed by this amount on each side after
 *                           every carbonyl phase
 * @param carbonylWindow     window of the carbonyl phase
 * @param carbonylThreshold  the carbonyl phase stops once the residual maximum in its window is
 *                           below this value
 * @param maxComponents      the run stops after this many components
 */
public record DeconvolutionParameters(@NotNull Range<Double> fitRange,
                                      @NotNull Range<Double> generalWindow,
                                      double generalThreshold, double windowShrinkStep,
                                      @NotNull Range<Double> carbonylWindow,
                                      double carbonylThreshold, int maxComponents) {

  public static final Range<Double> DEFAULT_FIT_RANGE = Range.closed(550d, 2000d);
  public static final Range<Double> DEFAULT_GENERAL_WINDOW = Range.closed(600d, 2000d);
  public static final double DEFAULT_GENERAL_THRESHOLD = 0.008;
  public static final double DEFAULT_WINDOW_SHRINK_STEP = 20d;
  public static final Range<Double> DEFAULT_CARBONYL_WINDOW = Range.closed(1600d, 1800d);
  public static final double DEFAULT_CARBONYL_THRESHOLD = 0.0015;
  public static final int DEFAULT_MAX_COMPONENTS = 200;

  public static final String GENERAL_THRESHOLD_DESCRIPTION = """
      Residual maximum below which no further components are fitted in the general window.
      Relative to a spectrum normalized to 0.15, bands smaller than this are treated as noise.
      """;

  public static final String CARBONYL_THRESHOLD_DESCRIPTION = """
      Residual maximum below which no further components are fitted between 1600 and 1800 cm^-1.
      Lower than the general threshold so the weak carbonyl band of unaged binders is captured.
      """;

  public static final String MAX_COMPONENTS_DESCRIPTION = """
      Upper limit of fitted components per spectrum. Reaching it ends the run.
      """;

  public DeconvolutionParameters {
    Preconditions.checkArgument(generalThreshold > 0d, "General threshold must be positive");
    Preconditions.checkArgument(carbonylThreshold > 0d, "Carbonyl threshold must be positive");
    Preconditions.checkArgument(windowShrinkStep > 0d, "Window shrink step must be positive");
    Preconditions.checkArgument(maxComponents > 0, "Maximum number of components must be > 0");
  }

  public static @NotNull DeconvolutionParameters defaults() {
    return new DeconvolutionParameters(DEFAULT_FIT_RANGE, DEFAULT_GENERAL_WINDOW,
        DEFAULT_GENERAL_THRESHOLD, DEFAULT_WINDOW_SHRINK_STEP, DEFAULT_CARBONYL_WINDOW,
        DEFAULT_CARBONYL_THRESHOLD, DEFAULT_MAX_COMPONENTS);
  }

  public @NotNull DeconvolutionParameters withThresholds(double general, double carbonyl) {
    return new DeconvolutionParameters(fitRange, generalWindow, general, windowShrinkStep,
        carbonylWindow, carbonyl, maxComponents);
  }

  public @NotNull DeconvolutionParameters withMaxComponents(int max) {
    return new DeconvolutionParameters(fitRange, generalWindow, generalThreshold, windowShrinkStep,
        carbonylWindow, carbonylThreshold, max);
  }
}
