/*
 * Copyright (c) 2025 The AutoFTIR Development Team
 */

package io.github.autoftir.modules.dataprocessing.featdet_peaklocator;

import com.google.common.collect.Range;
import io.github.autoftir.datamodel.Spectrum;
import io.github.autoftir.util.SyntheticSpectra;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class PeakLocatorTest {

  private final PeakLocator locator = new PeakLocator();

  @Test
  void testPlateauMaximumIsItsMidpoint() {
    Assertions.assertEquals(List.of(3),
        PeakLocator.findLocalMaxima(new double[]{0, 1, 2, 2, 2, 1, 0}));
    Assertions.assertEquals(List.of(2),
        PeakLocator.findLocalMaxima(new double[]{0, 1, 2, 2, 1, 0}));
    // a rising edge at the end is no maximum
    Assertions.assertEquals(List.of(), PeakLocator.findLocalMaxima(new double[]{0, 1, 2, 2}));
  }

  @Test
  void testProminenceFilter() {
    final double[] y = {0, 1, 0.5, 0.6, 0.5, 2, 0};
    Assertions.assertArrayEquals(new int[]{1, 3, 5}, locator.findPeakIndices(y, 0.05));
    Assertions.assertArrayEquals(new int[]{1, 5}, locator.findPeakIndices(y, 0.5));
    Assertions.assertArrayEquals(new int[]{5}, locator.findPeakIndices(y, 1.5));

    final PeakLocator.PeakIndices small = PeakLocator.measureProminence(y, 3);
    Assertions.assertEquals(0.1, small.prominence(), 1e-12);
    Assertions.assertEquals(2, small.leftBase());
    Assertions.assertEquals(4, small.rightBase());
  }

  @Test
  void testNegativeMaximaAreIgnored() {
    final double[] y = {-3, -1, -3, -3, -3};
    Assertions.assertEquals(0, locator.findPeakIndices(y, 0).length);
  }

  @Test
  void testLocateCarbonylBand() {
    final Spectrum spectrum = SyntheticSpectra.agedBinder();
    final List<DetectedPeak> peaks = locator.locate(spectrum, Range.closed(1620d, 1800d));
    Assertions.assertEquals(1, peaks.size());
    final DetectedPeak peak = peaks.get(0);
    Assertions.assertEquals(1700, peak.wavenumber());
    Assertions.assertEquals(0.01, peak.height(), 1e-12);
    Assertions.assertEquals(0.01, peak.prominence(), 1e-9);
    // bases are limited by the prominence window of 200 samples
    Assertions.assertEquals(1600, peak.leftBase());
    Assertions.assertEquals(1800, peak.rightBase());
  }

  @Test
  void testLocateAliphaticBands() {
    final List<DetectedPeak> peaks = locator.locate(SyntheticSpectra.agedBinder(),
        Range.closed(1350d, 1525d));
    Assertions.assertEquals(2, peaks.size());
    Assertions.assertEquals(1376, peaks.get(0).wavenumber());
    Assertions.assertEquals(1460, peaks.get(1).wavenumber());
    Assertions.assertEquals(1276, peaks.get(0).leftBase());
    Assertions.assertEquals(1560, peaks.get(1).rightBase());
  }

  @Test
  void testNoPeakGivesEmptyList() {
    final Spectrum spectrum = SyntheticSpectra.of(SyntheticSpectra.CH2);
    Assertions.assertTrue(locator.locate(spectrum, Range.closed(970d, 1070d)).isEmpty());
    Assertions.assertTrue(
        locator.locate(spectrum, Range.closed(1350d, 1525d), 0.1).isEmpty());
  }
}
