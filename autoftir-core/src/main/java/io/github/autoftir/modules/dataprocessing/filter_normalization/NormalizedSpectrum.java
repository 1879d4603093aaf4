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
import org.jetbrains.annotations.NotNull;

/**
 * @param spectrum the scaled spectrum
 * @param beta     factor the input was multiplied with
 * @param method   normalization convention that produced beta
 */
public record NormalizedSpectrum(@NotNull Spectrum spectrum, double beta,
                                 @NotNull NormalizationMethod method) {

  /**
   * @return the spectrum on its original scale, used to overlay raw and processed curves.
   */
  public @NotNull Spectrum denormalize() {
    final double[] y = spectrum.getAbsorbances();
    for (int i = 0; i < y.length; i++) {
      y[i] /= beta;
    }
    return spectrum.withAbsorbances(y);
  }
}
