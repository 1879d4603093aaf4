/*
 * Copyright (c) 2025 The AutoFTIR Development Team
 */

package io.github.autoftir.modules.dataprocessing.featdet_baselinecorrection.anchor;

import io.github.autoftir.datamodel.Spectrum;
import io.github.autoftir.util.SyntheticSpectra;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class AnchorLinearCorrectorTest {

  private static final double[] X = SyntheticSpectra.axis(600, 700, 1);

  private final AnchorLinearCorrector corrector = new AnchorLinearCorrector();

  private static double[] withDips(boolean secondDip) {
    final double[] y = new double[X.length];
    for (int i = 0; i < y.length; i++) {
      y[i] = 0.02;
    }
    for (int i = 20; i <= 27; i++) {
      y[i] = -0.05 + 0.01 * Math.abs(i - 23);
    }
    if (secondDip) {
      for (int i = 60; i <= 66; i++) {
        y[i] = -0.03 + 0.005 * Math.abs(i - 63);
      }
    }
    return y;
  }

  @Test
  void testZeroCurveIsUnchanged() {
    final Spectrum zero = Spectrum.of(X, new double[X.length]);
    Assertions.assertEquals(zero, corrector.correct(zero));
  }

  @Test
  void testTwoArtifactsBecomeAnchors() {
    final Spectrum spectrum = Spectrum.of(X, withDips(true));
    Assertions.assertArrayEquals(new double[]{600, 623, 663, 700},
        corrector.findAnchorWavenumbers(spectrum));

    final Spectrum corrected = corrector.correct(spectrum);
    Assertions.assertEquals(0d, corrected.getAbsorbance(0), 1e-12);
    Assertions.assertEquals(0d, corrected.getAbsorbance(23), 1e-12);
    Assertions.assertEquals(0d, corrected.getAbsorbance(63), 1e-12);
    Assertions.assertEquals(0d, corrected.getAbsorbance(100), 1e-12);
    Assertions.assertTrue(corrected.getAbsorbance(40) > 0d);
  }

  @Test
  void testSingleArtifactFallsBackToEndPoints() {
    final double[] y = withDips(false);
    final Spectrum spectrum = Spectrum.of(X, y);
    Assertions.assertArrayEquals(new double[]{600, 700}, corrector.findAnchorWavenumbers(spectrum));

    final Spectrum corrected = corrector.correct(spectrum);
    for (int i = 0; i < y.length; i++) {
      Assertions.assertEquals(y[i] - 0.02, corrected.getAbsorbance(i), 1e-12);
    }
  }

  @Test
  void testShortNegativeRunsAreNoise() {
    final double[] y = {1, -1, -1, -1, 1, -1, -1, -1, -1, 1, -2, -2, -2, -2, -2};
    final List<int[]> runs = AnchorLinearCorrector.findNegativeRuns(y, 4);
    Assertions.assertEquals(2, runs.size());
    Assertions.assertArrayEquals(new int[]{5, 8}, runs.get(0));
    Assertions.assertArrayEquals(new int[]{10, 14}, runs.get(1));
  }
}
