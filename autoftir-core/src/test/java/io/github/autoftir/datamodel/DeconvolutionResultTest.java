/*
 * Copyright (c) 2025 The AutoFTIR Development Team
 */

package io.github.autoftir.datamodel;

import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class DeconvolutionResultTest {

  @Test
  void testComponentsAreSortedAndIndicesComputed() {
    final GaussianComponent carbonyl = new GaussianComponent(1700, 10, 0.01);
    final GaussianComponent sulfoxide = new GaussianComponent(1030, 8, 0.02);
    final GaussianComponent ch3 = new GaussianComponent(1376, 8, 0.05);
    final DeconvolutionResult result = new DeconvolutionResult(
        List.of(carbonyl, ch3, sulfoxide), List.of(carbonyl), List.of(sulfoxide), List.of(ch3));

    Assertions.assertEquals(List.of(sulfoxide, ch3, carbonyl), result.components());
    Assertions.assertEquals(carbonyl.area() / ch3.area(), result.ico(), 1e-12);
    Assertions.assertEquals(sulfoxide.area() / ch3.area(), result.iso(), 1e-12);
    Assertions.assertEquals(ch3.area(), result.getArea(FunctionalGroup.ALIPHATIC), 1e-12);
    Assertions.assertEquals(0.05 + sulfoxide.value(1376) + carbonyl.value(1376),
        result.modelValue(1376), 1e-12);
  }

  @Test
  void testIndicesAreNaNWithoutAliphaticComponents() {
    final DeconvolutionResult result = new DeconvolutionResult(List.of(), List.of(), List.of(),
        List.of());
    Assertions.assertTrue(Double.isNaN(result.ico()));
    Assertions.assertTrue(Double.isNaN(result.iso()));
    Assertions.assertEquals(0d, result.carbonylArea());
  }
}
