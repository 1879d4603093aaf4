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
import io.github.autoftir.util.exceptions.InvalidSpectrumException;
import java.util.Arrays;
import org.jetbrains.annotations.NotNull;

/**
 * Immutable infrared spectrum: strictly increasing wavenumbers (cm^-1) and the absorbance measured
 * at each of them. Every processing step creates a new instance.
 */
public final class Spectrum {

  /**
   * Second-difference operators need at least this many points.
   */
  public static final int MIN_NUMBER_OF_POINTS = 8;

  private final double[] wavenumbers;
  private final double[] absorbances;

  private Spectrum(double[] wavenumbers, double[] absorbances) {
    this.wavenumbers = wavenumbers;
    this.absorbances = absorbances;
  }

  /**
   * Validates and copies the given arrays.
   *
   * @throws InvalidSpectrumException if the arrays differ in length, contain less than
   *                                  {@link #MIN_NUMBER_OF_POINTS} values, non-finite values or
   *                                  wavenumbers that are not strictly increasing.
   */
  public static @NotNull Spectrum of(double[] wavenumbers, double[] absorbances) {
    if (wavenumbers == null || absorbances == null) {
      throw new InvalidSpectrumException("Wavenumbers and absorbances must not be null");
    }
    if (wavenumbers.length != absorbances.length) {
      throw new InvalidSpectrumException(
          "Number of wavenumbers (%d) does not match number of absorbances (%d)".formatted(
              wavenumbers.length, absorbances.length));
    }
    if (wavenumbers.length < MIN_NUMBER_OF_POINTS) {
      throw new InvalidSpectrumException(
          "Spectrum needs at least %d points but has %d".formatted(MIN_NUMBER_OF_POINTS,
              wavenumbers.length));
    }
    for (int i = 0; i < wavenumbers.length; i++) {
      if (!Double.isFinite(wavenumbers[i]) || !Double.isFinite(absorbances[i])) {
        throw new InvalidSpectrumException("Non-finite value at index " + i);
      }
      if (i > 0 && wavenumbers[i] <= wavenumbers[i - 1]) {
        throw new InvalidSpectrumException(
            "Wavenumbers must be strictly increasing, violated at index %d (%f <= %f)".formatted(i,
                wavenumbers[i], wavenumbers[i - 1]));
      }
    }
    return new Spectrum(wavenumbers.clone(), absorbances.clone());
  }

  /**
   * @return a spectrum on the same wavenumber axis with new absorbances.
   */
  public @NotNull Spectrum withAbsorbances(double[] newAbsorbances) {
    if (newAbsorbances.length != absorbances.length) {
      throw new InvalidSpectrumException(
          "Expected %d absorbances but got %d".formatted(absorbances.length,
              newAbsorbances.length));
    }
    for (int i = 0; i < newAbsorbances.length; i++) {
      if (!Double.isFinite(newAbsorbances[i])) {
        throw new InvalidSpectrumException("Non-finite absorbance at index " + i);
      }
    }
    return new Spectrum(wavenumbers, newAbsorbances.clone());
  }

  public int getNumberOfValues() {
    return wavenumbers.length;
  }

  public double getWavenumber(int index) {
    return wavenumbers[index];
  }

  public double getAbsorbance(int index) {
    return absorbances[index];
  }

  public double[] getWavenumbers() {
    return wavenumbers.clone();
  }

  public double[] getAbsorbances() {
    return absorbances.clone();
  }

  public double getFirstWavenumber() {
    return wavenumbers[0];
  }

  public double getLastWavenumber() {
    return wavenumbers[wavenumbers.length - 1];
  }

  /**
   * @return first and last index (inclusive) of all wavenumbers within the range or null if no
   * value is within the range.
   */
  public int[] indicesWithin(@NotNull Range<Double> range) {
    int first = -1;
    int last = -1;
    for (int i = 0; i < wavenumbers.length; i++) {
      if (range.contains(wavenumbers[i])) {
        if (first == -1) {
          first = i;
        }
        last = i;
      }
    }
    return first == -1 ? null : new int[]{first, last};
  }

  /**
   * @return index of the wavenumber closest to the given value.
   */
  public int nearestIndex(double wavenumber) {
    final int pos = Arrays.binarySearch(wavenumbers, wavenumber);
    if (pos >= 0) {
      return pos;
    }
    final int insertion = -pos - 1;
    if (insertion == 0) {
      return 0;
    }
    if (insertion >= wavenumbers.length) {
      return wavenumbers.length - 1;
    }
    return wavenumber - wavenumbers[insertion - 1] <= wavenumbers[insertion] - wavenumber
        ? insertion - 1 : insertion;
  }

  /**
   * @return maximum absorbance within the range or NaN if the range contains no wavenumber.
   */
  public double maxAbsorbance(@NotNull Range<Double> range) {
    final int[] idx = indicesWithin(range);
    if (idx == null) {
      return Double.NaN;
    }
    double max = absorbances[idx[0]];
    for (int i = idx[0] + 1; i <= idx[1]; i++) {
      max = Math.max(max, absorbances[i]);
    }
    return max;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Spectrum that)) {
      return false;
    }
    return Arrays.equals(wavenumbers, that.wavenumbers) && Arrays.equals(absorbances,
        that.absorbances);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(wavenumbers) + Arrays.hashCode(absorbances);
  }

  @Override
  public String toString() {
    return "Spectrum{%d points, %.1f-%.1f cm^-1}".formatted(wavenumbers.length, wavenumbers[0],
        wavenumbers[wavenumbers.length - 1]);
  }
}
