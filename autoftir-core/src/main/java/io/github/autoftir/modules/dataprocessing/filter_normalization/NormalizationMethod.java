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

package io.github.autoftir.modules.dataprocessing.filter_normalization;

import com.google.common.collect.Range;
import org.jetbrains.annotations.NotNull;

/**
 * Scaling conventions for binder spectra. Height based methods scale the band maximum in the
 * reference region to a target value, area based methods scale the integral of the region.
 */
public enum NormalizationMethod {

  A("Maximum 600-4000 cm^-1 to 0.25", Range.closed(600d, 4000d), 0.25d, false),

  B("Maximum 1300-1600 cm^-1 to 0.15", Range.closed(1300d, 1600d), 0.15d, false),

  C("Area 600-4000 cm^-1 to 50", Range.closed(600d, 4000d), 50d, true),

  D("Area 600-1800 cm^-1 to 25", Range.closed(600d, 1800d), 25d, true);

  private final String description;
  private final Range<Double> referenceRange;
  private final double target;
  private final boolean areaBased;

  NormalizationMethod(String description, Range<Double> referenceRange, double target,
      boolean areaBased) {
    this.description = description;
    this.referenceRange = referenceRange;
    this.target = target;
    this.areaBased = areaBased;
  }

  public @NotNull String getDescription() {
    return description;
  }

  public @NotNull Range<Double> getReferenceRange() {
    return referenceRange;
  }

  public double getTarget() {
    return target;
  }

  public boolean isAreaBased() {
    return areaBased;
  }

  @Override
  public String toString() {
    return name() + ": " + description;
  }
}
