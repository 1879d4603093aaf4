/*
 * Copyright (c) 2025 The AutoFTIR Development Team
 */

package io.github.autoftir.modules.dataprocessing.featdet_groupintegration;

import com.google.common.collect.Range;
import io.github.autoftir.datamodel.FunctionalGroup;
import io.github.autoftir.datamodel.GaussianComponent;
import io.github.autoftir.datamodel.IntegrationWindow;
import io.github.autoftir.datamodel.Spectrum;
import io.github.autoftir.modules.dataprocessing.featdet_peaklocator.DetectedPeak;
import io.github.autoftir.modules.dataprocessing.featdet_peaklocator.PeakLocator;
import io.github.autoftir.util.SyntheticSpectra;
import io.github.autoftir.util.exceptions.GaussianFitFailedException;
import java.util.Comparator;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class BoundaryRefinerTest {

  private static final double[] X = SyntheticSpectra.axis(0, 100, 1);
  private static final GaussianComponent BAND = new GaussianComponent(50, 5, 1);

  private final BoundaryRefiner refiner = new BoundaryRefiner();
  private final PeakLocator locator = new PeakLocator();

  @Test
  void testMonotonicFlankKeepsBound() {
    final double[] y = new double[X.length];
    for (int i = 0; i < X.length; i++) {
      y[i] = BAND.value(X[i]);
    }
    Assertions.assertArrayEquals(new double[]{0, 100}, BoundaryRefiner.flatten(X, y, 0, 100));
    Assertions.assertArrayEquals(new double[]{40, 100}, BoundaryRefiner.flatten(X, y, 40, 100));
  }

  @Test
  void testFlatFloorIsCut() {
    final double[] y = new double[X.length];
    for (int i = 0; i < X.length; i++) {
      y[i] = 0.01 + BAND.value(X[i]);
    }
    final double[] bounds = BoundaryRefiner.flatten(X, y, 0, 100);
    Assertions.assertTrue(bounds[0] > 25 && bounds[0] < 40, "left bound " + bounds[0]);
    Assertions.assertTrue(bounds[1] > 60 && bounds[1] < 75, "right bound " + bounds[1]);
    Assertions.assertEquals(50 - bounds[0], bounds[1] - 50, 1e-9);
  }

  @Test
  void testSnapToMinima() {
    final double[] x = SyntheticSpectra.axis(0, 10, 1);
    final double[] y = {0.5, 0.2, 0.3, 0.6, 1.0, 0.6, 0.3, 0.1, 0.2, 0.4, 0.5};
    Assertions.assertArrayEquals(new double[]{1, 7},
        BoundaryRefiner.snapToMinima(x, y, 0, 10, 4, 4));
    Assertions.assertArrayEquals(new double[]{1, 7},
        BoundaryRefiner.snapToMinima(x, y, 1, 7, 4, 4));
  }

  @Test
  void testClusterClosestToPeak() {
    final double[] x = SyntheticSpectra.axis(0, 20, 1);
    final List<Integer> selected = List.of(1, 2, 3, 10, 11, 12, 13);
    Assertions.assertEquals(List.of(10, 11, 12, 13),
        BoundaryRefiner.clusterClosestTo(x, selected, 11.2));
    Assertions.assertEquals(List.of(1, 2, 3), BoundaryRefiner.clusterClosestTo(x, selected, 2));
  }

  @Test
  void testSingleBandIsClippedToGaussianTails() {
    final Spectrum spectrum = SyntheticSpectra.agedBinder();
    final DetectedPeak peak = locator.locate(spectrum, FunctionalGroup.CARBONYL.getSearchRange())
        .get(0);
    final IntegrationWindow window = refiner.refineSingle(spectrum, FunctionalGroup.CARBONYL,
        peak);

    final double tail = SyntheticSpectra.CARBONYL.halfWidthAt(BoundaryRefiner.TAIL_FRACTION);
    Assertions.assertEquals(1700 - tail, window.left(), 0.05);
    Assertions.assertEquals(1700 + tail, window.right(), 0.05);
    Assertions.assertFalse(window.hasMid());
  }

  @Test
  void testDoubleBandKeepsValley() {
    final Spectrum spectrum = SyntheticSpectra.agedBinder();
    final List<DetectedPeak> peaks = locator.locate(spectrum,
        FunctionalGroup.ALIPHATIC.getSearchRange());
    final IntegrationWindow window = refiner.refineDouble(spectrum, peaks.get(0), peaks.get(1),
        peaks.get(0).leftBase(), peaks.get(1).rightBase());

    Assertions.assertEquals(1376 - SyntheticSpectra.CH3.halfWidthAt(0.05), window.left(), 0.05);
    Assertions.assertEquals(1460 + SyntheticSpectra.CH2.halfWidthAt(0.05), window.right(), 0.05);
    Assertions.assertTrue(window.hasMid());
    Assertions.assertTrue(window.mid() > 1390 && window.mid() < 1450, "valley " + window.mid());
  }

  @Test
  void testFitFailsWithoutUpperBandPoints() {
    // a single raised point has no neighbours above 60 % of its height
    final double[] x = SyntheticSpectra.axis(600, 700, 1);
    final double[] y = new double[x.length];
    y[50] = 1;
    final Spectrum spectrum = Spectrum.of(x, y);
    final DetectedPeak peak = locator.locate(spectrum, Range.closed(600d, 700d)).get(0);
    Assertions.assertThrows(GaussianFitFailedException.class,
        () -> refiner.refineSingle(spectrum, FunctionalGroup.SULFOXIDE, peak));
  }

  @Test
  void testShoulderAboveMainBandIsCut() {
    final GaussianComponent main = new GaussianComponent(1680, 15, 0.02);
    final Spectrum spectrum = SyntheticSpectra.of(main, new GaussianComponent(1705, 2, 0.01));
    final IntegrationWindow window = refineNearestToCenter(spectrum, FunctionalGroup.CARBONYL);

    Assertions.assertEquals(1680 - main.halfWidthAt(BoundaryRefiner.TAIL_FRACTION),
        window.left(), 0.05);
    // valley between the main band and the shoulder
    Assertions.assertEquals(1700, window.right());
  }

  @Test
  void testShoulderBelowMainBandIsCut() {
    final GaussianComponent main = new GaussianComponent(1680, 15, 0.02);
    final Spectrum spectrum = SyntheticSpectra.of(main, new GaussianComponent(1655, 2, 0.01));
    final IntegrationWindow window = refineNearestToCenter(spectrum, FunctionalGroup.CARBONYL);

    Assertions.assertEquals(1660, window.left());
    Assertions.assertEquals(1680 + main.halfWidthAt(BoundaryRefiner.TAIL_FRACTION),
        window.right(), 0.05);
  }

  @Test
  void testWeakShoulderIsKept() {
    final GaussianComponent main = new GaussianComponent(1680, 15, 0.02);
    final Spectrum spectrum = SyntheticSpectra.of(main, new GaussianComponent(1705, 2, 0.006));
    final IntegrationWindow window = refineNearestToCenter(spectrum, FunctionalGroup.CARBONYL);

    Assertions.assertEquals(1680 + main.halfWidthAt(BoundaryRefiner.TAIL_FRACTION),
        window.right(), 0.05);
  }

  @Test
  void testSulfoxideShoulderIsCut() {
    final Spectrum spectrum = SyntheticSpectra.of(SyntheticSpectra.SULFOXIDE,
        new GaussianComponent(1045, 1.5, 0.006));
    final IntegrationWindow window = refineNearestToCenter(spectrum, FunctionalGroup.SULFOXIDE);

    Assertions.assertEquals(
        1030 - SyntheticSpectra.SULFOXIDE.halfWidthAt(BoundaryRefiner.TAIL_FRACTION),
        window.left(), 0.05);
    Assertions.assertEquals(1042, window.right());
  }

  private IntegrationWindow refineNearestToCenter(Spectrum spectrum, FunctionalGroup group) {
    final DetectedPeak peak = locator.locate(spectrum, group.getSearchRange()).stream().min(
        Comparator.comparingDouble(p -> Math.abs(p.wavenumber() - group.getCenterWavenumber())))
        .orElseThrow();
    return refiner.refineSingle(spectrum, group, peak);
  }
}
