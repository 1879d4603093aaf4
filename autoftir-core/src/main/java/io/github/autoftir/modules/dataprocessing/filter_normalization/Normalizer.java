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

package io.github.autoftir.modules.dataprocessing.filter_normalization;

import io.github.autoftir.datamodel.Spectrum;
import io.github.autoftir.util.SpectrumUtils;
import io.github.autoftir.util.exceptions.NumericalException;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Multiplies a whole spectrum with the factor that brings its reference value (band maximum or
 * area) to the target of a {@link NormalizationMethod}.
 */
public class Normalizer {

  private static final Logger logger = Logger.getLogger(Normalizer.class.getName());

  public @NotNull NormalizedSpectrum normalize(@NotNull Spectrum spectrum,
      @NotNull NormalizationMethod method) {
    final double beta = computeScaleFactor(spectrum, method);
    final double[] y = spectrum.getAbsorbances();
    for (int i = 0; i < y.length; i++) {
      y[i] *= beta;
    }
    logger.finest(() -> "Normalized %s with method %s, beta=%g".formatted(spectrum, method.name(),
        beta));
    return new NormalizedSpectrum(spectrum.withAbsorbances(y), beta, method);
  }

  /**
   * @throws NumericalException if the reference region holds too few points or the reference value
   *                            is not a positive number
   */
  public double computeScaleFactor(@NotNull Spectrum spectrum,
      @NotNull NormalizationMethod method) {
    final double reference;
    if (method.isAreaBased()) {
      reference = SpectrumUtils.area(spectrum, method.getReferenceRange());
    } else {
      reference = spectrum.maxAbsorbance(method.getReferenceRange());
      if (Double.isNaN(reference)) {
        throw new NumericalException(
            "No data points within the normalization range " + method.getReferenceRange());
      }
    }
    if (!Double.isFinite(reference) || reference <= 0d) {
      throw new NumericalException(
          "Cannot normalize with method %s, reference value is %g".formatted(method.name(),
              reference));
    }
    return method.getTarget() / reference;
  }
}
