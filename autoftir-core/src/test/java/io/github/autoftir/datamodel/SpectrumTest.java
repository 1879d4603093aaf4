/*
 * Copyright (c) 2025 The AutoFTIR Development Team
 */

package io.github.autoftir.datamodel;

import com.google.common.collect.Range;
import io.github.autoftir.util.exceptions.InvalidSpectrumException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SpectrumTest {

  private static final double[] X = {600, 601, 602, 603, 604, 605, 606, 607, 608, 609};
  private static final double[] Y = {0, 1, 2, 3, 4, 5, 4, 3, 2, 1};

  @Test
  void testRejectsInvalidInput() {
    Assertions.assertThrows(InvalidSpectrumException.class,
        () -> Spectrum.of(X, new double[]{1, 2, 3}));
    Assertions.assertThrows(InvalidSpectrumException.class,
        () -> Spectrum.of(new double[]{1, 2, 3, 4}, new double[]{1, 2, 3, 4}));

    final double[] unsorted = X.clone();
    unsorted[4] = unsorted[3];
    Assertions.assertThrows(InvalidSpectrumException.class, () -> Spectrum.of(unsorted, Y));

    final double[] nan = Y.clone();
    nan[2] = Double.NaN;
    Assertions.assertThrows(InvalidSpectrumException.class, () -> Spectrum.of(X, nan));
  }

  @Test
  void testIsImmutable() {
    final double[] y = Y.clone();
    final Spectrum spectrum = Spectrum.of(X, y);
    y[0] = 100;
    spectrum.getAbsorbances()[1] = 100;
    Assertions.assertEquals(0, spectrum.getAbsorbance(0));
    Assertions.assertEquals(1, spectrum.getAbsorbance(1));

    final Spectrum shifted = spectrum.withAbsorbances(new double[X.length]);
    Assertions.assertNotEquals(spectrum, shifted);
    Assertions.assertEquals(5, spectrum.getAbsorbance(5));
  }

  @Test
  void testLookups() {
    final Spectrum spectrum = Spectrum.of(X, Y);
    Assertions.assertArrayEquals(new int[]{2, 4}, spectrum.indicesWithin(Range.closed(601.5, 604.2)));
    Assertions.assertNull(spectrum.indicesWithin(Range.closed(700d, 800d)));
    Assertions.assertEquals(0, spectrum.nearestIndex(100));
    Assertions.assertEquals(9, spectrum.nearestIndex(1000));
    Assertions.assertEquals(3, spectrum.nearestIndex(603.4));
    Assertions.assertEquals(4, spectrum.nearestIndex(603.6));
    Assertions.assertEquals(5, spectrum.maxAbsorbance(Range.closed(600d, 609d)));
    Assertions.assertTrue(Double.isNaN(spectrum.maxAbsorbance(Range.closed(700d, 800d))));
  }
}
