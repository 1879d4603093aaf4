/*
 * Copyright (c) 2025 The AutoFTIR Development Team
 */

package io.github.autoftir.modules.dataprocessing.featdet_baselinecorrection.offset;

import com.google.common.collect.Range;
import io.github.autoftir.datamodel.Spectrum;
import io.github.autoftir.util.SpectrumUtils;
import io.github.autoftir.util.SyntheticSpectra;
import io.github.autoftir.util.exceptions.NumericalException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class OffsetBaselineCorrectorTest {

  private final OffsetBaselineCorrector corrector = new OffsetBaselineCorrector();

  @Test
  void testReferenceRegionIntegratesToZero() {
    final double[] x = SyntheticSpectra.axis(600, 4000, 2);
    final double[] y = new double[x.length];
    for (int i = 0; i < x.length; i++) {
      y[i] = 0.05 + 1e-5 * (x[i] - 600);
    }
    final Spectrum corrected = corrector.correct(Spectrum.of(x, y));

    Assertions.assertEquals(0d, SpectrumUtils.area(corrected,
        OffsetBaselineCorrector.DEFAULT_REFERENCE_RANGE), 1e-10);
    // linear curve, the offset is its value in the middle of the region
    Assertions.assertEquals(0.05 + 1e-5 * 1650, corrector.computeOffset(Spectrum.of(x, y)), 1e-12);
    Assertions.assertEquals(y[0] - corrector.computeOffset(Spectrum.of(x, y)),
        corrected.getAbsorbance(0), 1e-12);
  }

  @Test
  void testMissingReferenceRegionFails() {
    final Spectrum spectrum = SyntheticSpectra.agedBinder();
    Assertions.assertThrows(NumericalException.class, () -> corrector.correct(spectrum));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new OffsetBaselineCorrector(Range.atLeast(2000d)));
  }
}
