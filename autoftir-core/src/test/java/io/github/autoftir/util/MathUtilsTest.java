/*
 * Copyright (c) 2025 The AutoFTIR Development Team
 */

package io.github.autoftir.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class MathUtilsTest {

  @Test
  void testTrapz() {
    final double[] x = {0, 1, 2, 4};
    final double[] y = {0, 1, 2, 4};
    Assertions.assertEquals(8d, MathUtils.trapz(x, y), 1e-12);
    Assertions.assertEquals(1.5, MathUtils.trapz(x, y, 1, 2), 1e-12);
    Assertions.assertEquals(0d, MathUtils.trapz(x, y, 2, 2));
  }

  @Test
  void testInterpolateAndExtrapolate() {
    final double[] xs = {0, 10, 20};
    final double[] ys = {0, 1, 3};
    Assertions.assertEquals(0.5, MathUtils.interpolate(xs, ys, 5), 1e-12);
    Assertions.assertEquals(2d, MathUtils.interpolate(xs, ys, 15), 1e-12);
    Assertions.assertEquals(-1d, MathUtils.interpolate(xs, ys, -10), 1e-12);
    Assertions.assertEquals(5d, MathUtils.interpolate(xs, ys, 30), 1e-12);
    Assertions.assertEquals(1d, MathUtils.interpolate(xs, ys, 10), 1e-12);
  }

  @Test
  void testLinspace() {
    Assertions.assertArrayEquals(new double[]{1, 1.5, 2, 2.5, 3}, MathUtils.linspace(1, 3, 5),
        1e-12);
    Assertions.assertArrayEquals(new double[]{4}, MathUtils.linspace(4, 9, 1));
  }

  @Test
  void testArgExtremaReturnFirstOccurrence() {
    final double[] y = {1, 3, 3, 0, 0, 2};
    Assertions.assertEquals(1, MathUtils.argMax(y, 0, 5));
    Assertions.assertEquals(3, MathUtils.argMin(y, 0, 5));
    Assertions.assertEquals(5, MathUtils.argMax(y, 3, 5));
    Assertions.assertEquals(1.5, MathUtils.mean(y, 0, 3), 1e-12);
    Assertions.assertEquals(1.5, MathUtils.median(new double[]{3, 1, 2, 0}), 1e-12);
  }
}
