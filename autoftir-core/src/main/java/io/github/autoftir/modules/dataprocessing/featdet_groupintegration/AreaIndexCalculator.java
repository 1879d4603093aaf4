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

package io.github.autoftir.modules.dataprocessing.featdet_groupintegration;

import com.google.common.collect.Range;
import io.github.autoftir.datamodel.AgingIndices;
import io.github.autoftir.datamodel.FunctionalGroup;
import io.github.autoftir.datamodel.FunctionalGroupResult;
import io.github.autoftir.datamodel.IntegrationWindow;
import io.github.autoftir.datamodel.Spectrum;
import io.github.autoftir.modules.dataprocessing.featdet_peaklocator.DetectedPeak;
import io.github.autoftir.modules.dataprocessing.featdet_peaklocator.PeakLocator;
import io.github.autoftir.util.MathUtils;
import io.github.autoftir.util.exceptions.GaussianFitFailedException;
import io.github.autoftir.util.exceptions.NumericalException;
import io.github.autoftir.util.exceptions.PeakNotFoundException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Integrates the carbonyl, sulfoxide and aliphatic bands of a baseline corrected and normalized
 * spectrum and computes the carbonyl (ICO) and sulfoxide (ISO) indices.
 * <p>
 * Two areas are reported per band. The baseline area is the integral against zero absorbance.
 * The tangential area additionally removes the trapezoid below the chord between both window
 * ends, or below the two chords from the window ends to the valley for the aliphatic double
 * band.
 */
public class AreaIndexCalculator {

  private static final Logger logger = Logger.getLogger(AreaIndexCalculator.class.getName());

  private final PeakLocator peakLocator;
  private final BoundaryRefiner boundaryRefiner;
  private final double minProminence;

  public AreaIndexCalculator() {
    this(new PeakLocator(), PeakLocator.DEFAULT_MIN_PROMINENCE);
  }

  public AreaIndexCalculator(@NotNull PeakLocator peakLocator, double minProminence) {
    this.peakLocator = peakLocator;
    this.boundaryRefiner = new BoundaryRefiner(peakLocator);
    this.minProminence = minProminence;
  }

  /**
   * @throws PeakNotFoundException      if no band maximum is found in the search range of a group
   * @throws GaussianFitFailedException if a window cannot be refined
   */
  public @NotNull AgingIndices computeIndices(@NotNull Spectrum spectrum) {
    return new AgingIndices(analyze(spectrum, FunctionalGroup.CARBONYL),
        analyze(spectrum, FunctionalGroup.SULFOXIDE), analyze(spectrum, FunctionalGroup.ALIPHATIC));
  }

  /**
   * Locates the band of the group, refines its window and integrates it.
   *
   * @throws PeakNotFoundException      if no band maximum is found in the search range
   * @throws GaussianFitFailedException if the window cannot be refined
   */
  public @NotNull FunctionalGroupResult analyze(@NotNull Spectrum spectrum,
      @NotNull FunctionalGroup group) {
    final List<DetectedPeak> peaks = peakLocator.locate(spectrum, group.getSearchRange(),
        minProminence);
    if (peaks.isEmpty()) {
      throw new PeakNotFoundException(group);
    }

    if (group.isDoubleBand() && peaks.size() > 1) {
      final List<DetectedPeak> highest = peaks.stream()
          .sorted(Comparator.comparingDouble(DetectedPeak::height).reversed()).limit(2)
          .sorted(Comparator.comparingDouble(DetectedPeak::wavenumber)).toList();
      final double left = peaks.stream().mapToDouble(DetectedPeak::leftBase).min().orElseThrow();
      final double right = peaks.stream().mapToDouble(DetectedPeak::rightBase).max()
          .orElseThrow();
      final IntegrationWindow window = boundaryRefiner.refineDouble(spectrum, highest.get(0),
          highest.get(1), left, right);
      return integrate(spectrum, group, window, highest);
    }

    final DetectedPeak peak = peaks.stream().min(Comparator.comparingDouble(
        p -> Math.abs(p.wavenumber() - group.getCenterWavenumber()))).orElseThrow();
    final IntegrationWindow window = boundaryRefiner.refineSingle(spectrum, group, peak);
    return integrate(spectrum, group, window, List.of(peak));
  }

  /**
   * Integrates a fixed window, for example a manually corrected one or the fallback window of a
   * group. Both bounds are moved to the nearest data point.
   */
  public @NotNull FunctionalGroupResult integrate(@NotNull Spectrum spectrum,
      @NotNull FunctionalGroup group, @NotNull Range<Double> range) {
    final double left = spectrum.getWavenumber(spectrum.nearestIndex(range.lowerEndpoint()));
    final double right = spectrum.getWavenumber(spectrum.nearestIndex(range.upperEndpoint()));
    final IntegrationWindow window = IntegrationWindow.single(left, right);
    final int[] idx = requireIndices(spectrum, window);
    final int max = MathUtils.argMax(spectrum.getAbsorbances(), idx[0], idx[1]);
    final DetectedPeak apex = new DetectedPeak(spectrum.getWavenumber(max),
        spectrum.getAbsorbance(max), Double.NaN, left, right);
    return integrate(spectrum, group, window, List.of(apex));
  }

  private @NotNull FunctionalGroupResult integrate(@NotNull Spectrum spectrum,
      @NotNull FunctionalGroup group, @NotNull IntegrationWindow window,
      @NotNull List<DetectedPeak> peaks) {
    final double[] x = spectrum.getWavenumbers();
    final double[] y = spectrum.getAbsorbances();
    final int[] idx = requireIndices(spectrum, window);
    final int first = idx[0];
    final int last = idx[1];

    final double areaBaseline = MathUtils.trapz(x, y, first, last);
    final double areaTangential;
    if (window.hasMid()) {
      final int mid = spectrum.nearestIndex(window.mid());
      areaTangential = areaBaseline - chordArea(x, y, first, mid) - chordArea(x, y, last, mid);
    } else {
      areaTangential = areaBaseline - chordArea(x, y, first, last);
    }

    final double[] xs = new double[last - first + 1];
    final double[] ys = new double[xs.length];
    System.arraycopy(x, first, xs, 0, xs.length);
    System.arraycopy(y, first, ys, 0, ys.length);

    final List<Double> peakWavenumbers = new ArrayList<>(peaks.size());
    final List<Double> peakAbsorbances = new ArrayList<>(peaks.size());
    for (DetectedPeak p : peaks) {
      peakWavenumbers.add(p.wavenumber());
      peakAbsorbances.add(p.height());
    }
    logger.fine(() -> "%s area between %.2f and %.2f cm^-1: baseline %g, tangential %g".formatted(
        group, window.left(), window.right(), areaBaseline, areaTangential));
    return new FunctionalGroupResult(group, areaBaseline, areaTangential, xs, ys, peakWavenumbers,
        peakAbsorbances, window);
  }

  /**
   * Area of the trapezoid below the straight line between two data points.
   */
  private static double chordArea(double[] x, double[] y, int a, int b) {
    return Math.abs(x[a] - x[b]) * 0.5 * (y[a] + y[b]);
  }

  private static int[] requireIndices(@NotNull Spectrum spectrum,
      @NotNull IntegrationWindow window) {
    final int[] idx = spectrum.indicesWithin(window.toRange());
    if (idx == null || idx[1] <= idx[0]) {
      throw new NumericalException(
          "Less than two data points between %.2f and %.2f cm^-1".formatted(window.left(),
              window.right()));
    }
    return idx;
  }
}
