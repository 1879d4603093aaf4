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

package io.github.autoftir.modules.dataprocessing.featdet_gaussiandeconvolution;

import com.google.common.collect.Range;
import io.github.autoftir.datamodel.DeconvolutionResult;
import io.github.autoftir.datamodel.FunctionalGroup;
import io.github.autoftir.datamodel.GaussianComponent;
import io.github.autoftir.datamodel.Spectrum;
import io.github.autoftir.util.MathUtils;
import io.github.autoftir.util.exceptions.GaussianFitFailedException;
import io.github.autoftir.util.fitting.GaussianFitting;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Greedy decomposition of the mid-infrared region into Gaussian bands. The highest point of the
 * residual is fitted with a Gaussian of the same height, the Gaussian is subtracted and the search
 * repeats. Once the general search stalls or the residual is exhausted, a dedicated search with a
 * lower threshold collects weak carbonyl bands. Components are then assigned to the functional
 * groups by their position.
 */
public class DeconvolutionEngine {

  private static final Logger logger = Logger.getLogger(DeconvolutionEngine.class.getName());

  /**
   * Fitted points are limited to the part of the envelope above this fraction of the peak.
   */
  public static final double ENVELOPE_FRACTION = 0.6;

  public static final int MAX_FIT_ATTEMPTS = 3;

  private final DeconvolutionParameters parameters;

  public DeconvolutionEngine() {
    this(DeconvolutionParameters.defaults());
  }

  public DeconvolutionEngine(@NotNull DeconvolutionParameters parameters) {
    this.parameters = parameters;
  }

  public @NotNull DeconvolutionResult run(@NotNull Spectrum spectrum) {
    final int[] idx = spectrum.indicesWithin(parameters.fitRange());
    if (idx == null) {
      logger.warning(() -> "No data points of %s within %s, nothing to deconvolve".formatted(
          spectrum, parameters.fitRange()));
      return partition(List.of());
    }
    final int n = idx[1] - idx[0] + 1;
    final double[] x = new double[n];
    double[] residual = new double[n];
    for (int i = 0; i < n; i++) {
      x[i] = spectrum.getWavenumber(idx[0] + i);
      residual[i] = spectrum.getAbsorbance(idx[0] + i);
    }

    final List<GaussianComponent> components = new ArrayList<>();
    double generalMin = parameters.generalWindow().lowerEndpoint();
    double generalMax = parameters.generalWindow().upperEndpoint();
    boolean generalConverged = false;
    boolean carbonylPhaseDone = false;

    while (true) {
      final double generalPeak = maxWithin(x, residual, generalMin, generalMax);
      if (generalMin >= generalMax || Double.isNaN(generalPeak)
          || generalPeak < parameters.generalThreshold()) {
        generalConverged = true;
      }
      if (components.size() >= parameters.maxComponents()) {
        logger.warning("Deconvolution stopped after reaching %d components".formatted(
            components.size()));
        break;
      }
      if (generalConverged && carbonylPhaseDone) {
        break;
      }

      if (!generalConverged) {
        final FitOutcome outcome = fitBiggestPeak(x, residual,
            Range.open(generalMin, generalMax));
        if (outcome instanceof FitOutcome.Success success) {
          components.add(success.component());
          residual = success.newResidual();
          continue;
        }
        final String reason = ((FitOutcome.Failed) outcome).reason();
        logger.fine(() -> "General search stalled: " + reason);
      }

      residual = runCarbonylPhase(x, residual, components);
      carbonylPhaseDone = true;
      generalMin += parameters.windowShrinkStep();
      generalMax -= parameters.windowShrinkStep();
    }

    final DeconvolutionResult result = partition(components);
    logger.fine(() -> "Deconvolution of %s finished with %d components, ICO=%g, ISO=%g".formatted(
        spectrum, result.components().size(), result.ico(), result.iso()));
    return result;
  }

  private double[] runCarbonylPhase(double[] x, double[] residual,
      List<GaussianComponent> components) {
    final Range<Double> window = parameters.carbonylWindow();
    double[] current = residual;
    while (components.size() < parameters.maxComponents()) {
      final double peak = maxWithin(x, current, window.lowerEndpoint(), window.upperEndpoint());
      if (Double.isNaN(peak) || peak < parameters.carbonylThreshold()) {
        break;
      }
      final FitOutcome outcome = fitBiggestPeak(x, current,
          Range.open(window.lowerEndpoint(), window.upperEndpoint()));
      if (!(outcome instanceof FitOutcome.Success success)) {
        break;
      }
      components.add(success.component());
      current = success.newResidual();
    }
    return current;
  }

  /**
   * Fits a Gaussian to the highest point of the residual within the window. The height of the
   * Gaussian is fixed to the observed maximum, mean and sigma are fitted to the points of the
   * local envelope above {@link #ENVELOPE_FRACTION} of the maximum.
   *
   * @param x        wavenumbers
   * @param residual current residual, not modified
   * @param window   search window, usually open
   */
  public @NotNull FitOutcome fitBiggestPeak(double[] x, double[] residual,
      @NotNull Range<Double> window) {
    final List<Integer> inWindow = new ArrayList<>();
    for (int i = 0; i < x.length; i++) {
      if (window.contains(x[i])) {
        inWindow.add(i);
      }
    }
    if (inWindow.size() < 3) {
      return new FitOutcome.Failed("Less than 3 data points within " + window);
    }
    final int offset = inWindow.get(0);
    final int n = inWindow.size();
    final double[] wx = new double[n];
    final double[] wy = new double[n];
    for (int i = 0; i < n; i++) {
      wx[i] = x[offset + i];
      wy[i] = residual[offset + i];
    }

    final int peak = MathUtils.argMax(wy, 0, n - 1);
    final double xPeak = wx[peak];
    final double amplitude = wy[peak];
    if (amplitude <= 0d) {
      return new FitOutcome.Failed("Residual within %s is not positive".formatted(window));
    }

    final int[] envelope = envelope(wy, peak);
    final List<Double> leftX = new ArrayList<>();
    final List<Double> leftY = new ArrayList<>();
    final List<Double> rightX = new ArrayList<>();
    final List<Double> rightY = new ArrayList<>();
    double envelopeMax = 0d;
    for (int i = envelope[0]; i < envelope[1]; i++) {
      envelopeMax = Math.max(envelopeMax, wy[i]);
    }
    for (int i = envelope[0]; i < envelope[1]; i++) {
      if (i == peak || wy[i] <= ENVELOPE_FRACTION * envelopeMax) {
        continue;
      }
      if (wx[i] < xPeak) {
        leftX.add(wx[i]);
        leftY.add(wy[i]);
      } else {
        rightX.add(wx[i]);
        rightY.add(wy[i]);
      }
    }
    if (Math.abs(leftX.size() - rightX.size()) >= 2) {
      if (leftX.isEmpty() || rightX.isEmpty()) {
        return new FitOutcome.Failed(
            "One flank of the peak at %.2f cm^-1 has no points above %.0f %%".formatted(xPeak,
                ENVELOPE_FRACTION * 100));
      }
      if (leftX.size() < rightX.size()) {
        resample(leftX, leftY, rightX.size());
      } else {
        resample(rightX, rightY, leftX.size());
      }
    }

    final int m = leftX.size() + 1 + rightX.size();
    final double[] fx = new double[m];
    final double[] fy = new double[m];
    int k = 0;
    for (int i = 0; i < leftX.size(); i++, k++) {
      fx[k] = leftX.get(i);
      fy[k] = leftY.get(i);
    }
    fx[k] = xPeak;
    fy[k++] = amplitude;
    for (int i = 0; i < rightX.size(); i++, k++) {
      fx[k] = rightX.get(i);
      fy[k] = rightY.get(i);
    }

    double sigmaGuess = fx[m - 1] - fx[0];
    if (sigmaGuess <= 0d) {
      return new FitOutcome.Failed(
          "Envelope of the peak at %.2f cm^-1 contains a single point".formatted(xPeak));
    }
    String lastProblem = "";
    for (int attempt = 0; attempt < MAX_FIT_ATTEMPTS; attempt++) {
      try {
        final GaussianComponent fit = GaussianFitting.fitWithFixedAmplitude(fx, fy, amplitude,
            new double[]{xPeak, sigmaGuess});
        if (fit.isPhysicallyValid()) {
          logger.finest(() -> "Fitted " + fit);
          return new FitOutcome.Success(fit, subtract(x, residual, fit));
        }
        lastProblem = "fitted component " + fit + " is not physically valid";
      } catch (GaussianFitFailedException e) {
        logger.log(Level.FINEST, "Fit attempt %d at %.2f cm^-1 failed".formatted(attempt + 1,
            xPeak), e);
        lastProblem = e.getMessage();
      }
      sigmaGuess /= 2d;
    }
    return new FitOutcome.Failed(
        "No valid Gaussian at %.2f cm^-1 after %d attempts, %s".formatted(xPeak, MAX_FIT_ATTEMPTS,
            lastProblem));
  }

  /**
   * Local envelope of the peak from a three point moving average. To the right it ends before
   * the moving average stops decreasing, to the left at the last point where it does not
   * increase. Without such a point the envelope extends to the window edge.
   *
   * @return start (inclusive) and end (exclusive) index
   */
  static int[] envelope(double[] y, int peak) {
    int end = y.length;
    final int rightMeans = y.length - peak - 2;
    for (int j = 0; j + 1 < rightMeans; j++) {
      if (movingMean(y, peak + j + 1) - movingMean(y, peak + j) >= 0d) {
        end = peak + j + 1;
        break;
      }
    }
    int start = 0;
    final int leftMeans = peak - 2;
    for (int j = leftMeans - 2; j >= 0; j--) {
      if (movingMean(y, j + 1) - movingMean(y, j) <= 0d) {
        start = j;
        break;
      }
    }
    return new int[]{start, end};
  }

  private static double movingMean(double[] y, int from) {
    return (y[from] + y[from + 1] + y[from + 2]) / 3d;
  }

  /**
   * Replaces the points by count evenly spaced, linearly interpolated points over the same range.
   */
  private static void resample(List<Double> xs, List<Double> ys, int count) {
    final double[] x = xs.stream().mapToDouble(Double::doubleValue).toArray();
    final double[] y = ys.stream().mapToDouble(Double::doubleValue).toArray();
    final double[] dense = MathUtils.linspace(x[0], x[x.length - 1], count);
    xs.clear();
    ys.clear();
    for (double d : dense) {
      xs.add(d);
      ys.add(MathUtils.interpolate(x, y, d));
    }
  }

  private static double[] subtract(double[] x, double[] residual, GaussianComponent component) {
    final double[] result = new double[residual.length];
    for (int i = 0; i < residual.length; i++) {
      result[i] = Math.max(0d, residual[i] - component.value(x[i]));
    }
    return result;
  }

  private static double maxWithin(double[] x, double[] y, double from, double to) {
    double max = Double.NaN;
    for (int i = 0; i < x.length; i++) {
      if (x[i] >= from && x[i] <= to && !(y[i] <= max)) {
        max = y[i];
      }
    }
    return max;
  }

  /**
   * Assigns components to functional groups. Aliphatic takes the two largest components of its
   * range, sulfoxide the largest one, carbonyl all of its range.
   */
  static @NotNull DeconvolutionResult partition(@NotNull List<GaussianComponent> components) {
    final Comparator<GaussianComponent> byAmplitude = Comparator.comparingDouble(
        GaussianComponent::amplitude).reversed();
    final List<GaussianComponent> aliphatic = inRange(components, FunctionalGroup.ALIPHATIC)
        .stream().sorted(byAmplitude).limit(2).toList();
    final List<GaussianComponent> sulfoxide = inRange(components, FunctionalGroup.SULFOXIDE)
        .stream().sorted(byAmplitude).limit(1).toList();
    final List<GaussianComponent> carbonyl = inRange(components, FunctionalGroup.CARBONYL);
    return new DeconvolutionResult(components, carbonyl, sulfoxide, aliphatic);
  }

  private static List<GaussianComponent> inRange(List<GaussianComponent> components,
      FunctionalGroup group) {
    return components.stream().filter(c -> group.getDeconvolutionRange().contains(c.mean()))
        .toList();
  }
}
