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

package io.github.autoftir.util;

import com.google.common.collect.Range;
import io.github.autoftir.datamodel.Spectrum;
import io.github.autoftir.util.exceptions.NumericalException;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

public final class SpectrumUtils {

  private static final Logger logger = Logger.getLogger(SpectrumUtils.class.getName());

  /**
   * Absorbance spectra of binders stay well below this mean value, percent transmittance spectra
   * well above it.
   */
  public static final double TRANSMITTANCE_MEAN_THRESHOLD = 20d;

  private SpectrumUtils() {
  }

  /**
   * Trapezoidal area of all samples within the range.
   *
   * @throws NumericalException if less than two samples are inside the range.
   */
  public static double area(@NotNull Spectrum spectrum, @NotNull Range<Double> range) {
    final int[] idx = spectrum.indicesWithin(range);
    if (idx == null || idx[1] - idx[0] < 1) {
      throw new NumericalException("Less than two data points within " + range);
    }
    return MathUtils.trapz(spectrum.getWavenumbers(), spectrum.getAbsorbances(), idx[0], idx[1]);
  }

  public static boolean isPercentTransmittance(@NotNull Spectrum spectrum) {
    final double[] y = spectrum.getAbsorbances();
    return MathUtils.mean(y, 0, y.length - 1) > TRANSMITTANCE_MEAN_THRESHOLD;
  }

  /**
   * Converts a percent transmittance spectrum to absorbance {@code A = -log10(T / 100)}. Absorbance
   * spectra are returned as they are.
   */
  public static @NotNull Spectrum toAbsorbanceIfTransmittance(@NotNull Spectrum spectrum) {
    if (!isPercentTransmittance(spectrum)) {
      return spectrum;
    }
    logger.fine(() -> "Converting percent transmittance to absorbance for " + spectrum);
    final double[] y = spectrum.getAbsorbances();
    for (int i = 0; i < y.length; i++) {
      if (y[i] <= 0d) {
        throw new NumericalException(
            "Transmittance must be positive for conversion, found %f at %f cm^-1".formatted(y[i],
                spectrum.getWavenumber(i)));
      }
      y[i] = -Math.log10(y[i] / 100d);
    }
    return spectrum.withAbsorbances(y);
  }
}
