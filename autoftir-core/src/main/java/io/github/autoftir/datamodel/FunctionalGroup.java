/*
 * Copyright (c) 2025 The AutoFTIR Development Team
 *
 * Permission is hereby granted, free of charge, to any person
 * obtaining a copy of this software and associated documentation
 * files (the "Software"), to deal in the Software without
 * restriction, including without limitation the rights to use,
 * copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the
 * Software is furnished to do so, subject to the following
 * conditions:
 *
 * The above copyright notice and this permission notice shall be
 * included in all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
 * EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES
 * OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND
 * NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT
 * HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY,
 * WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING
 * FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR
 * OTHER DEALINGS IN THE SOFTWARE.
 */

package io.github.autoftir.datamodel;

import com.google.common.collect.Range;
import org.jetbrains.annotations.NotNull;

/**
 * Functional groups used to describe oxidative aging of asphalt binders. Each group knows where
 * its absorption band is searched for, where its Gaussian components are collected after
 * deconvolution and which window is integrated when the band cannot be located automatically.
 */
public enum FunctionalGroup {

  /**
   * C=O stretching around 1680 cm^-1.
   */
  CARBONYL("Carbonyl", Range.closed(1620d, 1800d), 1680d, Range.open(1660d, 1720d),
      Range.closed(1670d, 1690d), 5d),

  /**
   * S=O stretching around 1030 cm^-1.
   */
  SULFOXIDE("Sulfoxide", Range.closed(970d, 1070d), 1030d, Range.open(970d, 1070d),
      Range.closed(1020d, 1040d), 10d),

  /**
   * CH3 and CH2 bending, two bands around 1376 and 1460 cm^-1. Reference band of both indices.
   */
  ALIPHATIC("Aliphatic", Range.closed(1350d, 1525d), 1437.5d, Range.open(1350d, 1525d),
      Range.closed(1350d, 1450d), 0d);

  private final String label;
  private final Range<Double> searchRange;
  private final double centerWavenumber;
  private final Range<Double> deconvolutionRange;
  private final Range<Double> fallbackWindow;
  private final double splitProminenceDivisor;

  FunctionalGroup(String label, Range<Double> searchRange, double centerWavenumber,
      Range<Double> deconvolutionRange, Range<Double> fallbackWindow,
      double splitProminenceDivisor) {
    this.label = label;
    this.searchRange = searchRange;
    this.centerWavenumber = centerWavenumber;
    this.deconvolutionRange = deconvolutionRange;
    this.fallbackWindow = fallbackWindow;
    this.splitProminenceDivisor = splitProminenceDivisor;
  }

  /**
   * @return wavenumber range (cm^-1) in which the band maximum is searched.
   */
  public @NotNull Range<Double> getSearchRange() {
    return searchRange;
  }

  public double getCenterWavenumber() {
    return centerWavenumber;
  }

  /**
   * @return open range of component means that belong to this group after deconvolution.
   */
  public @NotNull Range<Double> getDeconvolutionRange() {
    return deconvolutionRange;
  }

  public @NotNull Range<Double> getFallbackWindow() {
    return fallbackWindow;
  }

  /**
   * @return divisor of the absorbance range used as minimum prominence when checking an
   * integration window for a second maximum. 0 if the group is not checked for double peaks.
   */
  public double getSplitProminenceDivisor() {
    return splitProminenceDivisor;
  }

  public boolean isDoubleBand() {
    return this == ALIPHATIC;
  }

  @Override
  public String toString() {
    return label;
  }
}
