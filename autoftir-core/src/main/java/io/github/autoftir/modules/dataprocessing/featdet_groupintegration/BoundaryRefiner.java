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
import io.github.autoftir.datamodel.FunctionalGroup;
import io.github.autoftir.datamodel.GaussianComponent;
import io.github.autoftir.datamodel.IntegrationWindow;
import io.github.autoftir.datamodel.Spectrum;
import io.github.autoftir.modules.dataprocessing.featdet_peaklocator.DetectedPeak;
import io.github.autoftir.modules.dataprocessing.featdet_peaklocator.PeakLocator;
import io.github.autoftir.util.MathUtils;
import io.github.autoftir.util.exceptions.GaussianFitFailedException;
import io.github.autoftir.util.fitting.GaussianFitting;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Narrows the coarse bases reported by the {@link PeakLocator} to the integration window of a
 * band. Steps:
 * <ol>
 *   <li>flattening: cut flat noise floor from both ends</li>
 *   <li>Gaussian tail clipping: a Gaussian is fitted to the upper 40 % of the band and the window
 *   is limited to where it has decayed to 5 %</li>
 *   <li>minimum snap: both ends are moved to the lowest point on their side of the band</li>
 *   <li>flattening</li>
 *   <li>for single bands only: if a second sub-band remains in the window, the window is cut at
 *   the valley next to the sub-band closest to the group centre, then flattened once more</li>
 * </ol>
 * Bounds are only ever tightened.
 */
public class BoundaryRefiner {

  private static final Logger logger = Logger.getLogger(BoundaryRefiner.class.getName());

  /**
   * Points below this fraction of the band height are not used for the tail fit.
   */
  public static final double FIT_LOWER_FRACTION = 0.6;

  /**
   * The window ends where the fitted Gaussian has decayed to this fraction of its height.
   */
  public static final double TAIL_FRACTION = 0.05;

  /**
   * Relative change (percent) of the running mean that marks the end of a flat region.
   */
  public static final double FLATNESS_PERCENT = 1d;

  public static final double CLUSTER_GAP_FACTOR = 1.2;

  private final PeakLocator peakLocator;

  public BoundaryRefiner() {
    this(new PeakLocator());
  }

  public BoundaryRefiner(@NotNull PeakLocator peakLocator) {
    this.peakLocator = peakLocator;
  }

  /**
   * Refines the window of a single band.
   *
   * @throws GaussianFitFailedException if the tail fit does not converge or yields an unphysical
   *                                    component
   */
  public @NotNull IntegrationWindow refineSingle(@NotNull Spectrum spectrum,
      @NotNull FunctionalGroup group, @NotNull DetectedPeak peak) {
    final double[] x = spectrum.getWavenumbers();
    final double[] y = spectrum.getAbsorbances();
    final double xPeak = peak.wavenumber();
    final double yPeak = peak.height();

    double[] bounds = flatten(x, y, peak.leftBase(), peak.rightBase());

    final GaussianComponent fit = fitFlank(x, y, bounds[0], bounds[1], yPeak, xPeak,
        Double.NEGATIVE_INFINITY, 0.5 * (bounds[1] - bounds[0]));
    final double tail = fit.halfWidthAt(TAIL_FRACTION);
    bounds[0] = Math.max(bounds[0], fit.mean() - tail);
    bounds[1] = Math.min(bounds[1], fit.mean() + tail);

    bounds = snapToMinima(x, y, bounds[0], bounds[1], xPeak, xPeak);
    bounds = flatten(x, y, bounds[0], bounds[1]);

    if (group.getSplitProminenceDivisor() > 0d) {
      bounds = splitAtSecondaryPeak(x, y, bounds, group);
    }

    final IntegrationWindow window = IntegrationWindow.single(bounds[0], bounds[1]);
    logger.finest(() -> "%s window refined from [%.2f, %.2f] to [%.2f, %.2f]".formatted(group,
        peak.leftBase(), peak.rightBase(), window.left(), window.right()));
    return window;
  }

  /**
   * Refines the window of two overlapping bands. Each outer flank is fitted on its own, limited by
   * the valley between both maxima.
   *
   * @param first  band with the lower wavenumber
   * @param second band with the higher wavenumber
   * @param left   coarse left bound
   * @param right  coarse right bound
   * @return window with the valley wavenumber as mid point
   * @throws GaussianFitFailedException if one of the tail fits fails
   */
  public @NotNull IntegrationWindow refineDouble(@NotNull Spectrum spectrum,
      @NotNull DetectedPeak first, @NotNull DetectedPeak second, double left, double right) {
    final double[] x = spectrum.getWavenumbers();
    final double[] y = spectrum.getAbsorbances();

    final int[] between = spectrum.indicesWithin(
        Range.closed(first.wavenumber(), second.wavenumber()));
    if (between == null) {
      throw new GaussianFitFailedException(
          "No data points between the peaks at %.2f and %.2f cm^-1".formatted(first.wavenumber(),
              second.wavenumber()));
    }
    final int midIndex = MathUtils.argMin(y, between[0], between[1]);
    final double xMid = x[midIndex];
    final double yMid = y[midIndex];

    double[] bounds = flatten(x, y, left, right);

    final GaussianComponent leftFit = fitFlank(x, y, bounds[0], xMid, first.height(),
        first.wavenumber(), Double.NEGATIVE_INFINITY, 0.5 * (xMid - bounds[0]));
    bounds[0] = Math.max(bounds[0], leftFit.mean() - leftFit.halfWidthAt(TAIL_FRACTION));

    final GaussianComponent rightFit = fitFlank(x, y, xMid, bounds[1], second.height(),
        second.wavenumber(), yMid, 0.5 * (bounds[1] - xMid));
    bounds[1] = Math.min(bounds[1], rightFit.mean() + rightFit.halfWidthAt(TAIL_FRACTION));

    bounds = snapToMinima(x, y, bounds[0], bounds[1], first.wavenumber(), second.wavenumber());
    bounds = flatten(x, y, bounds[0], bounds[1]);

    final IntegrationWindow window = new IntegrationWindow(bounds[0], bounds[1], xMid);
    logger.finest(
        () -> "Double band window refined from [%.2f, %.2f] to [%.2f, %.2f], valley at %.2f".formatted(
            left, right, window.left(), window.right(), xMid));
    return window;
  }

  /**
   * Moves both bounds inward over regions where the running mean, started with three points at
   * the bound, changes by less than {@link #FLATNESS_PERCENT} percent per added point. A bound
   * stays where it is if the first added point already changes the mean or no change is found.
   */
  static double[] flatten(double[] x, double[] y, double left, double right) {
    final int[] idx = indicesWithin(x, left, right);
    if (idx == null) {
      return new double[]{left, right};
    }
    final int from = idx[0];
    final int to = idx[1];
    final int n = to - from + 1;

    double newLeft = left;
    final int leftStop = firstSignificantChange(y, from, n, 1);
    if (leftStop > 0) {
      newLeft = x[from + leftStop + 2];
    }
    double newRight = right;
    final int rightStop = firstSignificantChange(y, to, n, -1);
    if (rightStop > 0) {
      newRight = x[to - rightStop - 2];
    }
    if (newLeft >= newRight) {
      return new double[]{left, right};
    }
    return new double[]{newLeft, newRight};
  }

  /**
   * Running means of the first 3, 4, ... n - 1 values, walking from start in the given direction.
   *
   * @return index of the first step whose relative change is at least {@link #FLATNESS_PERCENT},
   * or -1 if there is none
   */
  private static int firstSignificantChange(double[] y, int start, int n, int direction) {
    if (n < 5) {
      return -1;
    }
    double sum = y[start] + y[start + direction] + y[start + 2 * direction];
    final double first = Math.abs(sum / 3d);
    double previous = first;
    for (int count = 4; count < n; count++) {
      sum += y[start + (count - 1) * direction];
      final double current = Math.abs(sum / count);
      final double diff = current - previous;
      final boolean significant =
          first > 0d ? diff / first * 100d >= FLATNESS_PERCENT : diff > 0d;
      if (significant) {
        return count - 4;
      }
      previous = current;
    }
    return -1;
  }

  /**
   * Fits a Gaussian to the contiguous cluster of points between {@link #FIT_LOWER_FRACTION} and
   * 100 % of the band height that lies closest to the maximum.
   *
   * @param minY points below this absorbance are ignored as well
   */
  private static @NotNull GaussianComponent fitFlank(double[] x, double[] y, double left,
      double right, double yPeak, double xPeak, double minY, double sigmaGuess) {
    final List<Integer> selected = new ArrayList<>();
    for (int i = 0; i < x.length; i++) {
      if (x[i] >= left && x[i] <= right && y[i] <= yPeak && y[i] >= FIT_LOWER_FRACTION * yPeak
          && y[i] >= minY) {
        selected.add(i);
      }
    }
    if (selected.isEmpty()) {
      throw new GaussianFitFailedException(
          "No points above %.0f %% of the band at %.2f cm^-1".formatted(FIT_LOWER_FRACTION * 100,
              xPeak));
    }
    final List<Integer> cluster = clusterClosestTo(x, selected, xPeak);
    final double[] xs = new double[cluster.size()];
    final double[] ys = new double[cluster.size()];
    for (int i = 0; i < xs.length; i++) {
      xs[i] = x[cluster.get(i)];
      ys[i] = y[cluster.get(i)];
    }

    final GaussianComponent fit = GaussianFitting.fitGaussian(xs, ys,
        new double[]{yPeak, xPeak, sigmaGuess});
    if (!fit.isPhysicallyValid()) {
      throw new GaussianFitFailedException(
          "Tail fit of the band at %.2f cm^-1 is not physically valid: %s".formatted(xPeak, fit));
    }
    logger.finest(() -> "Tail fit at %.2f cm^-1: %s".formatted(xPeak, fit));
    return fit;
  }

  /**
   * Splits the selected indices where the wavenumber gap exceeds {@link #CLUSTER_GAP_FACTOR}
   * times the median gap and returns the part that contains the point nearest to xPeak.
   */
  static @NotNull List<Integer> clusterClosestTo(double[] x, List<Integer> selected,
      double xPeak) {
    if (selected.size() < 3) {
      return selected;
    }
    final double[] gaps = new double[selected.size() - 1];
    for (int i = 0; i < gaps.length; i++) {
      gaps[i] = x[selected.get(i + 1)] - x[selected.get(i)];
    }
    final double maxGap = CLUSTER_GAP_FACTOR * MathUtils.median(gaps);

    int nearest = 0;
    for (int i = 1; i < selected.size(); i++) {
      if (Math.abs(x[selected.get(i)] - xPeak) < Math.abs(x[selected.get(nearest)] - xPeak)) {
        nearest = i;
      }
    }
    int start = nearest;
    while (start > 0 && gaps[start - 1] <= maxGap) {
      start--;
    }
    int end = nearest;
    while (end < gaps.length && gaps[end] <= maxGap) {
      end++;
    }
    return selected.subList(start, end + 1);
  }

  /**
   * Moves each bound to the lowest point between the bound and the adjacent maximum if the bound
   * is not already that point.
   */
  static double[] snapToMinima(double[] x, double[] y, double left, double right,
      double xPeakLeft, double xPeakRight) {
    final int[] idx = indicesWithin(x, left, right);
    if (idx == null) {
      return new double[]{left, right};
    }
    double newLeft = left;
    final int[] leftSide = indicesWithin(x, left, Math.min(right, xPeakLeft));
    if (leftSide != null) {
      final int min = MathUtils.argMin(y, leftSide[0], leftSide[1]);
      if (y[idx[0]] != y[min]) {
        newLeft = x[min];
      }
    }
    double newRight = right;
    final int[] rightSide = indicesWithin(x, Math.max(left, xPeakRight), right);
    if (rightSide != null) {
      final int min = MathUtils.argMin(y, rightSide[0], rightSide[1]);
      if (y[idx[1]] != y[min]) {
        newRight = x[min];
      }
    }
    return new double[]{newLeft, newRight};
  }

  private double[] splitAtSecondaryPeak(double[] x, double[] y, double[] bounds,
      FunctionalGroup group) {
    final int[] idx = indicesWithin(x, bounds[0], bounds[1]);
    if (idx == null) {
      return bounds;
    }
    final int from = idx[0];
    final double[] yy = new double[idx[1] - from + 1];
    System.arraycopy(y, from, yy, 0, yy.length);
    final double range = yy[MathUtils.argMax(yy, 0, yy.length - 1)] - yy[MathUtils.argMin(yy, 0,
        yy.length - 1)];
    final int[] subPeaks = peakLocator.findPeakIndices(yy,
        range / group.getSplitProminenceDivisor());
    if (subPeaks.length < 2) {
      return bounds;
    }

    int chosen = 0;
    for (int i = 1; i < subPeaks.length; i++) {
      if (Math.abs(x[from + subPeaks[i]] - group.getCenterWavenumber()) < Math.abs(
          x[from + subPeaks[chosen]] - group.getCenterWavenumber())) {
        chosen = i;
      }
    }
    double left = bounds[0];
    double right = bounds[1];
    if (chosen > 0) {
      left = x[from + MathUtils.argMin(yy, subPeaks[chosen - 1], subPeaks[chosen])];
    }
    if (chosen < subPeaks.length - 1) {
      right = x[from + MathUtils.argMin(yy, subPeaks[chosen], subPeaks[chosen + 1])];
    }
    final double splitLeft = left;
    final double splitRight = right;
    logger.fine(() -> "%s window contains %d bands, cut to [%.2f, %.2f]".formatted(group,
        subPeaks.length, splitLeft, splitRight));
    return flatten(x, y, left, right);
  }

  /**
   * @return first and last index of x within [left, right] or null.
   */
  static int[] indicesWithin(double[] x, double left, double right) {
    int first = -1;
    int last = -1;
    for (int i = 0; i < x.length; i++) {
      if (x[i] >= left && x[i] <= right) {
        if (first == -1) {
          first = i;
        }
        last = i;
      }
    }
    return first == -1 ? null : new int[]{first, last};
  }
}
