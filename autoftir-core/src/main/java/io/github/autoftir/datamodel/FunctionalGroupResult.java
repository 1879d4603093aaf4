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

import java.util.List;
import org.jetbrains.annotations.NotNull;

/**
 * Integrated band of one functional group.
 *
 * @param areaBaseline    trapezoidal area against zero absorbance
 * @param areaTangential  area above the chord(s) connecting the window end points
 * @param xValues         wavenumbers inside the integration window
 * @param yValues         absorbances inside the integration window
 * @param peakWavenumbers one or two band maxima
 * @param peakAbsorbances absorbances at the band maxima
 * @param window          integration window
 */
public record FunctionalGroupResult(@NotNull FunctionalGroup group, double areaBaseline,
                                    double areaTangential, double[] xValues, double[] yValues,
                                    @NotNull List<Double> peakWavenumbers,
                                    @NotNull List<Double> peakAbsorbances,
                                    @NotNull IntegrationWindow window) {

  public FunctionalGroupResult {
    xValues = xValues.clone();
    yValues = yValues.clone();
    peakWavenumbers = List.copyOf(peakWavenumbers);
    peakAbsorbances = List.copyOf(peakAbsorbances);
  }

  @Override
  public double[] xValues() {
    return xValues.clone();
  }

  @Override
  public double[] yValues() {
    return yValues.clone();
  }

  public double getArea(@NotNull IntegrationMethod method) {
    return method == IntegrationMethod.BASELINE ? areaBaseline : areaTangential;
  }

  /**
   * @return the first (or only) band maximum.
   */
  public double getPeakWavenumber() {
    return peakWavenumbers.isEmpty() ? Double.NaN : peakWavenumbers.get(0);
  }
}
