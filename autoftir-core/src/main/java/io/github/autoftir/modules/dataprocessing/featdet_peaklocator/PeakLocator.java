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

package io.github.autoftir.modules.dataprocessing.featdet_peaklocator;

import com.google.common.collect.Range;
import io.github.autoftir.datamodel.Spectrum;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Finds local maxima with a minimum topographic prominence. Prominence and bases are measured
 * within {@link #PROMINENCE_WINDOW} samples centred on the peak, so wide spectra do not connect
 * distant bands.
 */
public class PeakLocator {

  private static final Logger logger = Logger.getLogger(PeakLocator.class.getName());

  public static final double DEFAULT_MIN_PROMINENCE = 0.001;

  /**
   * The search window is widened by this amount (cm^-1) on each side so bases of peaks close to the
   * window edges are found.
   */
  public static final double SEARCH_MARGIN = 100d;

  public static final int PROMINENCE_WINDOW = 200;

  /**
   * @param window        peaks outside this range are dropped
   * @param minProminence minimum prominence in absorbance units
   * @return detected peaks in ascending wavenumber order, empty if none qualifies
   */
  public @NotNull List<DetectedPeak> locate(@NotNull Spectrum spectrum,
      @NotNull Range<Double> window, double minProminence) {
    final Range<Double> widened = Range.closed(window.lowerEndpoint() - SEARCH_MARGIN,
        window.upperEndpoint() + SEARCH_MARGIN);
    final int[] idx = spectrum.indicesWithin(widened);
    if (idx == null) {
      return List.of();
    }
    final int n = idx[1] - idx[0] + 1;
    final double[] x = new double[n];
    final double[] y = new double[n];
    for (int i = 0; i < n; i++) {
      x[i] = spectrum.getWavenumber(idx[0] + i);
      y[i] = spectrum.getAbsorbance(idx[0] + i);
    }

    final List<DetectedPeak> peaks = new ArrayList<>();
    for (PeakIndices p : detect(y, minProminence)) {
      if (window.contains(x[p.peak()])) {
        peaks.add(new DetectedPeak(x[p.peak()], y[p.peak()], p.prominence(), x[p.leftBase()],
            x[p.rightBase()]));
      }
    }
    logger.finest(() -> "Found %d peaks within %s".formatted(peaks.size(), window));
    return peaks;
  }

  public @NotNull List<DetectedPeak> locate(@NotNull Spectrum spectrum,
      @NotNull Range<Double> window) {
    return locate(spectrum, window, DEFAULT_MIN_PROMINENCE);
  }

  /**
   * @return indices of all non-negative local maxima with at least the given prominence.
   */
  public int[] findPeakIndices(double[] y, double minProminence) {
    return detect(y, minProminence).stream().mapToInt(PeakIndices::peak).toArray();
  }

  @NotNull List<PeakIndices> detect(double[] y, double minProminence) {
    final List<PeakIndices> result = new ArrayList<>();
    for (int peak : findLocalMaxima(y)) {
      if (y[peak] < 0d) {
        continue;
      }
      final PeakIndices p = measureProminence(y, peak);
      if (p.prominence() >= minProminence) {
        result.add(p);
      }
    }
    return result;
  }

  /**
   * Strict local maxima. Flat tops count once, at their midpoint (rounded down), if both sides
   * drop.
   */
  static @NotNull List<Integer> findLocalMaxima(double[] y) {
    final List<Integer> maxima = new ArrayList<>();
    int i = 1;
    final int last = y.length - 1;
    while (i < last) {
      if (y[i - 1] < y[i]) {
        int ahead = i + 1;
        while (ahead < last && y[ahead] == y[i]) {
          ahead++;
        }
        if (y[ahead] < y[i]) {
          maxima.add((i + ahead - 1) / 2);
          i = ahead;
        }
      }
      i++;
    }
    return maxima;
  }

  static @NotNull PeakIndices measureProminence(double[] y, int peak) {
    final int half = PROMINENCE_WINDOW / 2;
    final int iMin = Math.max(peak - half, 0);
    final int iMax = Math.min(peak + half, y.length - 1);

    int leftBase = peak;
    double leftMin = y[peak];
    for (int i = peak; i >= iMin && y[i] <= y[peak]; i--) {
      if (y[i] < leftMin) {
        leftMin = y[i];
        leftBase = i;
      }
    }

    int rightBase = peak;
    double rightMin = y[peak];
    for (int i = peak; i <= iMax && y[i] <= y[peak]; i++) {
      if (y[i] < rightMin) {
        rightMin = y[i];
        rightBase = i;
      }
    }
    return new PeakIndices(peak, y[peak] - Math.max(leftMin, rightMin), leftBase, rightBase);
  }

  record PeakIndices(int peak, double prominence, int leftBase, int rightBase) {

  }
}
