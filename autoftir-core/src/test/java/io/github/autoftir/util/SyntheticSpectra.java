/*
 * Copyright (c) 2025 The AutoFTIR Development Team
 */

package io.github.autoftir.util;

import io.github.autoftir.datamodel.GaussianComponent;
import io.github.autoftir.datamodel.Spectrum;
import java.util.List;

/**
 * Spectra built from known Gaussian bands for tests.
 */
public final class SyntheticSpectra {

  public static final GaussianComponent CARBONYL = new GaussianComponent(1700, 10, 0.01);
  public static final GaussianComponent SULFOXIDE = new GaussianComponent(1030, 8, 0.02);
  public static final GaussianComponent CH3 = new GaussianComponent(1376, 8, 0.05);
  public static final GaussianComponent CH2 = new GaussianComponent(1460, 10, 0.08);

  private SyntheticSpectra() {
  }

  public static double[] axis(double from, double to, double step) {
    final int n = (int) Math.round((to - from) / step) + 1;
    final double[] x = new double[n];
    for (int i = 0; i < n; i++) {
      x[i] = from + i * step;
    }
    return x;
  }

  /**
   * Sum of the components sampled every 1 cm^-1 between 600 and 2000 cm^-1.
   */
  public static Spectrum of(GaussianComponent... components) {
    return of(axis(600, 2000, 1), List.of(components));
  }

  public static Spectrum of(double[] x, List<GaussianComponent> components) {
    final double[] y = new double[x.length];
    for (int i = 0; i < x.length; i++) {
      for (GaussianComponent c : components) {
        y[i] += c.value(x[i]);
      }
    }
    return Spectrum.of(x, y);
  }

  /**
   * Carbonyl, sulfoxide and both aliphatic bands of an aged binder.
   */
  public static Spectrum agedBinder() {
    return of(CARBONYL, SULFOXIDE, CH3, CH2);
  }
}
