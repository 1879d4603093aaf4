/*
 * Copyright (c) 2025 The AutoFTIR Development Team
 */

package io.github.autoftir.util;

import com.google.common.collect.Range;
import io.github.autoftir.datamodel.Spectrum;
import io.github.autoftir.util.exceptions.NumericalException;
import java.util.Arrays;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SpectrumUtilsTest {

  private static final double[] X = SyntheticSpectra.axis(600, 610, 1);

  @Test
  void testTransmittanceIsConvertedToAbsorbance() {
    final double[] t = new double[X.length];
    Arrays.fill(t, 100d);
    t[3] = 10d;
    t[4] = 1d;
    final Spectrum converted = SpectrumUtils.toAbsorbanceIfTransmittance(Spectrum.of(X, t));
    Assertions.assertEquals(0d, converted.getAbsorbance(0), 1e-12);
    Assertions.assertEquals(1d, converted.getAbsorbance(3), 1e-12);
    Assertions.assertEquals(2d, converted.getAbsorbance(4), 1e-12);
  }

  @Test
  void testAbsorbanceIsReturnedUnchanged() {
    final Spectrum absorbance = SyntheticSpectra.agedBinder();
    Assertions.assertFalse(SpectrumUtils.isPercentTransmittance(absorbance));
    Assertions.assertSame(absorbance, SpectrumUtils.toAbsorbanceIfTransmittance(absorbance));
  }

  @Test
  void testArea() {
    final double[] y = new double[X.length];
    Arrays.fill(y, 2d);
    final Spectrum flat = Spectrum.of(X, y);
    Assertions.assertEquals(8d, SpectrumUtils.area(flat, Range.closed(601d, 605d)), 1e-12);
    Assertions.assertThrows(NumericalException.class,
        () -> SpectrumUtils.area(flat, Range.closed(601.2d, 601.8d)));
  }
}
