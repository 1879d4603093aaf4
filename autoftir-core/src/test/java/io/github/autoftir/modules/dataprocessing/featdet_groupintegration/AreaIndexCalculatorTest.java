/*
 * Copyright (c) 2025 The AutoFTIR Development Team
 */

package io.github.autoftir.modules.dataprocessing.featdet_groupintegration;

import com.google.common.collect.Range;
import io.github.autoftir.datamodel.AgingIndices;
import io.github.autoftir.datamodel.FunctionalGroup;
import io.github.autoftir.datamodel.FunctionalGroupResult;
import io.github.autoftir.datamodel.IntegrationMethod;
import io.github.autoftir.datamodel.Spectrum;
import io.github.autoftir.util.MathUtils;
import io.github.autoftir.util.SyntheticSpectra;
import io.github.autoftir.util.exceptions.PeakNotFoundException;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class AreaIndexCalculatorTest {

  private final AreaIndexCalculator calculator = new AreaIndexCalculator();

  @Test
  void testCarbonylArea() {
    final Spectrum spectrum = SyntheticSpectra.agedBinder();
    final FunctionalGroupResult carbonyl = calculator.analyze(spectrum, FunctionalGroup.CARBONYL);

    Assertions.assertEquals(1700, carbonyl.getPeakWavenumber());
    Assertions.assertEquals(List.of(0.01), carbonyl.peakAbsorbances());
    // window covers the samples from 1676 to 1724 cm^-1
    final double[] x = carbonyl.xValues();
    final double[] y = carbonyl.yValues();
    Assertions.assertEquals(1676, x[0]);
    Assertions.assertEquals(1724, x[x.length - 1]);
    Assertions.assertEquals(MathUtils.trapz(x, y), carbonyl.areaBaseline(), 1e-12);
    Assertions.assertEquals(0.2466, carbonyl.areaBaseline(), 0.2466 * 0.01);

    final double chord = (x[x.length - 1] - x[0]) * 0.5 * (y[0] + y[y.length - 1]);
    Assertions.assertEquals(carbonyl.areaBaseline() - chord, carbonyl.areaTangential(), 1e-12);
    Assertions.assertTrue(carbonyl.areaTangential() < carbonyl.areaBaseline());
  }

  @Test
  void testAliphaticDoubleBand() {
    final FunctionalGroupResult aliphatic = calculator.analyze(SyntheticSpectra.agedBinder(),
        FunctionalGroup.ALIPHATIC);
    Assertions.assertEquals(List.of(1376d, 1460d), aliphatic.peakWavenumbers());
    Assertions.assertTrue(aliphatic.window().hasMid());
    Assertions.assertTrue(aliphatic.areaTangential() < aliphatic.areaBaseline());
    Assertions.assertTrue(aliphatic.areaTangential() > 0);

    final double expected = SyntheticSpectra.CH3.area() + SyntheticSpectra.CH2.area();
    Assertions.assertEquals(expected, aliphatic.areaBaseline(), expected * 0.03);
  }

  @Test
  void testIndices() {
    final AgingIndices indices = calculator.computeIndices(SyntheticSpectra.agedBinder());
    Assertions.assertEquals(1030, indices.sulfoxide().getPeakWavenumber());
    Assertions.assertEquals(
        indices.carbonyl().areaBaseline() / indices.aliphatic().areaBaseline(),
        indices.icoBaseline(), 1e-12);
    Assertions.assertEquals(
        indices.sulfoxide().areaTangential() / indices.aliphatic().areaTangential(),
        indices.getIso(IntegrationMethod.TANGENTIAL), 1e-12);
    for (FunctionalGroupResult result : List.of(indices.carbonyl(), indices.sulfoxide(),
        indices.aliphatic())) {
      Assertions.assertTrue(result.areaBaseline() >= result.areaTangential(),
          result.group().toString());
    }
  }

  @Test
  void testMissingBandIsReported() {
    final Spectrum spectrum = SyntheticSpectra.of(SyntheticSpectra.CARBONYL, SyntheticSpectra.CH3,
        SyntheticSpectra.CH2);
    final PeakNotFoundException e = Assertions.assertThrows(PeakNotFoundException.class,
        () -> calculator.analyze(spectrum, FunctionalGroup.SULFOXIDE));
    Assertions.assertEquals(FunctionalGroup.SULFOXIDE, e.getGroup());
    Assertions.assertEquals(1030, e.getCenterWavenumber());
    Assertions.assertEquals(Range.closed(970d, 1070d), e.getHintRange());
  }

  @Test
  void testFixedWindowSnapsToDataPoints() {
    final Spectrum spectrum = SyntheticSpectra.agedBinder();
    final FunctionalGroupResult result = calculator.integrate(spectrum, FunctionalGroup.CARBONYL,
        Range.closed(1670.3, 1689.6));
    Assertions.assertEquals(1670, result.window().left());
    Assertions.assertEquals(1690, result.window().right());
    Assertions.assertEquals(21, result.xValues().length);
    Assertions.assertEquals(1690, result.getPeakWavenumber());
    Assertions.assertEquals(MathUtils.trapz(result.xValues(), result.yValues()),
        result.areaBaseline(), 1e-12);
  }
}
