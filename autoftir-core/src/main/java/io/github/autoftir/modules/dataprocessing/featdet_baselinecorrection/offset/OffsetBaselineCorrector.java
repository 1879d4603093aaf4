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

package io.github.autoftir.modules.dataprocessing.featdet_baselinecorrection.offset;

import com.google.common.base.Preconditions;
import com.google.common.collect.Range;
import io.github.autoftir.datamodel.Spectrum;
import io.github.autoftir.modules.dataprocessing.featdet_baselinecorrection.BaselineCorrector;
import io.github.autoftir.util.SpectrumUtils;
import io.github.autoftir.util.exceptions.NumericalException;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Shifts the whole spectrum vertically so that its integral over a band-free reference region is
 * zero (Hofko et al., 2018). Binders do not absorb between 2000 and 2500 cm^-1.
 */
public class OffsetBaselineCorrector implements BaselineCorrector {

  private static final Logger logger = Logger.getLogger(OffsetBaselineCorrector.class.getName());

  public static final Range<Double> DEFAULT_REFERENCE_RANGE = Range.closed(2000d, 2500d);

  private final Range<Double> referenceRange;

  public OffsetBaselineCorrector() {
    this(DEFAULT_REFERENCE_RANGE);
  }

  public OffsetBaselineCorrector(@NotNull Range<Double> referenceRange) {
    Preconditions.checkArgument(referenceRange.hasLowerBound() && referenceRange.hasUpperBound(),
        "Reference range must be bounded");
    this.referenceRange = referenceRange;
  }

  @Override
  public @NotNull String getName() {
    return "Offset baseline corrector (Hofko)";
  }

  @Override
  public @NotNull Spectrum correct(@NotNull Spectrum spectrum) {
    final double offset = computeOffset(spectrum);
    final double[] y = spectrum.getAbsorbances();
    for (int i = 0; i < y.length; i++) {
      y[i] -= offset;
    }
    return spectrum.withAbsorbances(y);
  }

  /**
   * The integral of {@code y - c} over the reference region is linear in c, so the offset is the
   * mean absorbance of the region.
   *
   * @throws NumericalException if the region holds less than two data points
   */
  public double computeOffset(@NotNull Spectrum spectrum) {
    final int[] idx = spectrum.indicesWithin(referenceRange);
    if (idx == null || idx[1] <= idx[0]) {
      throw new NumericalException(
          "Offset correction needs at least two data points within " + referenceRange);
    }
    final double width = spectrum.getWavenumber(idx[1]) - spectrum.getWavenumber(idx[0]);
    final double offset = SpectrumUtils.area(spectrum, referenceRange) / width;
    logger.finest(() -> "Offset baseline %g for %s".formatted(offset, spectrum));
    return offset;
  }

  @Override
  public @NotNull String getDescription() {
    return "Vertical shift so that the integral between %.0f and %.0f cm^-1 is zero.".formatted(
        referenceRange.lowerEndpoint(), referenceRange.upperEndpoint());
  }
}
