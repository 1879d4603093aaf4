/*
 * Copyright (c) 2025 The AutoFTIR Development Team
 */

package io.github.autoftir.modules.dataprocessing.ftir_agingindices;

import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ReplicateSelectorTest {

  private final ReplicateSelector selector = new ReplicateSelector();

  @Test
  void testOutlierIsDropped() {
    final List<Double> ico = List.of(1.0, 1.1, 5.0, 1.05);
    Assertions.assertEquals(List.of(1.0, 1.1, 1.05),
        selector.selectMostConsistent(ico, Double::doubleValue));
  }

  @Test
  void testFewReplicatesAreKept() {
    final List<String> names = List.of("a", "bb");
    Assertions.assertEquals(names, selector.selectMostConsistent(names, String::length));
  }

  @Test
  void testTieKeepsFirstSubset() {
    final List<Double> values = List.of(1d, 2d, 3d, 4d);
    Assertions.assertEquals(List.of(1d, 2d), selector.selectMostConsistent(values,
        Double::doubleValue, 2));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> selector.selectMostConsistent(values, Double::doubleValue, 0));
  }

  @Test
  void testTieIsResolvedLexicographically() {
    // {0, 3} and {1, 2} both have a standard deviation of 0.5
    final List<Double> values = List.of(0d, 5d, 6d, 1d);
    Assertions.assertEquals(List.of(0d, 1d), selector.selectMostConsistent(values,
        Double::doubleValue, 2));
  }
}
