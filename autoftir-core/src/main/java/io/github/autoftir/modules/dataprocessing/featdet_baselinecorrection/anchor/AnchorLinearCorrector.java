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

package io.github.autoftir.modules.dataprocessing.featdet_baselinecorrection.anchor;

import io.github.autoftir.datamodel.Spectrum;
import io.github.autoftir.modules.dataprocessing.featdet_baselinecorrection.BaselineCorrector;
import io.github.autoftir.util.MathUtils;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Second baseline pass after smoothing. The smoother tends to over-subtract in broad regions
 * without bands, which leaves runs of negative absorbance. The deepest point of each such run is
 * used as an anchor of a piecewise linear baseline.
 */
public class AnchorLinearCorrector implements BaselineCorrector {

  private static final Logger logger = Logger.getLogger(AnchorLinearCorrector.class.getName());

  /**
   * Shorter negative runs are noise.
   */
  public static final int MIN_BATCH_LENGTH = 4;

  @Override
  public @NotNull String getName() {
    return "Anchor point linear baseline corrector";
  }

  @Override
  public @NotNull Spectrum correct(@NotNull Spectrum spectrum) {
    final double[] anchors = findAnchorWavenumbers(spectrum);
    final double[] x = spectrum.getWavenumbers();
    final double[] y = spectrum.getAbsorbances();

    final double[] anchorY = new double[anchors.length];
    for (int i = 0; i < anchors.length; i++) {
      anchorY[i] = MathUtils.interpolate(x, y, anchors[i]);
    }

    final double[] corrected = new double[y.length];
    for (int i = 0; i < y.length; i++) {
      corrected[i] = y[i] - MathUtils.interpolate(anchors, anchorY, x[i]);
    }
    return spectrum.withAbsorbances(corrected);
  }

  /**
   * @return sorted, distinct anchor wavenumbers. Always contains the first and last wavenumber of
   * the spectrum. The deepest point of each negative run is added only if there are at least two
   * runs.
   */
  public double[] findAnchorWavenumbers(@NotNull Spectrum spectrum) {
    final double[] y = spectrum.getAbsorbances();
    final List<int[]> batches = findNegativeRuns(y, MIN_BATCH_LENGTH);

    final TreeSet<Double> anchors = new TreeSet<>();
    anchors.add(spectrum.getFirstWavenumber());
    anchors.add(spectrum.getLastWavenumber());
    if (batches.size() >= 2) {
      for (int[] batch : batches) {
        anchors.add(spectrum.getWavenumber(MathUtils.argMin(y, batch[0], batch[1])));
      }
    }
    logger.finest(() -> "Found %d negative artifact runs, using %d anchors".formatted(
        batches.size(), anchors.size()));
    return anchors.stream().mapToDouble(Double::doubleValue).toArray();
  }

  /**
   * @return first and last index (inclusive) of every maximal run of negative values that has at
   * least minLength values.
   */
  static @NotNull List<int[]> findNegativeRuns(double[] y, int minLength) {
    final List<int[]> runs = new ArrayList<>();
    int start = -1;
    for (int i = 0; i <= y.length; i++) {
      final boolean negative = i < y.length && y[i] < 0d;
      if (negative && start == -1) {
        start = i;
      } else if (!negative && start != -1) {
        if (i - start >= minLength) {
          runs.add(new int[]{start, i - 1});
        }
        start = -1;
      }
    }
    return runs;
  }

  @Override
  public @NotNull String getDescription() {
    return "Subtracts a piecewise linear baseline through the spectrum ends and the minima of "
        + "negative artifact regions.";
  }
}
