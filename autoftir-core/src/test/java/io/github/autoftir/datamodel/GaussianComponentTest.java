/*
 * Copyright (c) 2025 The AutoFTIR Development Team
 */

package io.github.autoftir.datamodel;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class GaussianComponentTest {

  @Test
  void testAreaUsesAbsoluteSigma() {
    final double expected = 0.02 * 8 * Math.sqrt(2 * Math.PI);
    Assertions.assertEquals(expected, new GaussianComponent(1030, 8, 0.02).area(), 1e-12);
    Assertions.assertEquals(expected, new GaussianComponent(1030, -8, 0.02).area(), 1e-12);
  }

  @Test
  void testValue() {
    final GaussianComponent c = new GaussianComponent(1400, 10, 0.05);
    Assertions.assertEquals(0.05, c.value(1400), 1e-15);
    Assertions.assertEquals(0.05 * Math.exp(-0.5), c.value(1410), 1e-15);
    Assertions.assertEquals(c.value(1390), c.value(1410), 1e-15);
  }

  @Test
  void testPhysicalValidity() {
    Assertions.assertTrue(new GaussianComponent(400, 99.9, 1).isPhysicallyValid());
    Assertions.assertTrue(new GaussianComponent(2100, -50, 1).isPhysicallyValid());
    Assertions.assertFalse(new GaussianComponent(399.9, 10, 1).isPhysicallyValid());
    Assertions.assertFalse(new GaussianComponent(2100.1, 10, 1).isPhysicallyValid());
    Assertions.assertFalse(new GaussianComponent(1000, 100, 1).isPhysicallyValid());
    Assertions.assertFalse(new GaussianComponent(Double.NaN, 10, 1).isPhysicallyValid());
  }

  @Test
  void testHalfWidth() {
    final GaussianComponent c = new GaussianComponent(1700, 10, 0.01);
    final double halfWidth = c.halfWidthAt(0.05);
    Assertions.assertEquals(24.477, halfWidth, 1e-3);
    Assertions.assertEquals(0.05 * c.amplitude(), c.value(c.mean() + halfWidth), 1e-12);
  }
}
