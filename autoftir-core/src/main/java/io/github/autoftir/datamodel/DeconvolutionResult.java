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

import java.util.Comparator;
import java.util.List;
import org.jetbrains.annotations.NotNull;

/**
 * Outcome of one deconvolution run. Never patched, a re-run creates a new instance.
 *
 * @param components all fitted components sorted by mean
 * @param carbonyl   components assigned to the carbonyl band
 * @param sulfoxide  the sulfoxide component, empty if none was fitted in its range
 * @param aliphatic  up to two aliphatic components
 */
public record DeconvolutionResult(@NotNull List<GaussianComponent> components,
                                  @NotNull List<GaussianComponent> carbonyl,
                                  @NotNull List<GaussianComponent> sulfoxide,
                                  @NotNull List<GaussianComponent> aliphatic) {

  public DeconvolutionResult {
    components = components.stream().sorted(Comparator.comparingDouble(GaussianComponent::mean))
        .toList();
    carbonyl = List.copyOf(carbonyl);
    sulfoxide = List.copyOf(sulfoxide);
    aliphatic = List.copyOf(aliphatic);
  }

  public static double totalArea(@NotNull List<GaussianComponent> components) {
    double area = 0d;
    for (GaussianComponent c : components) {
      area += c.area();
    }
    return area;
  }

  public @NotNull List<GaussianComponent> getComponents(@NotNull FunctionalGroup group) {
    return switch (group) {
      case CARBONYL -> carbonyl;
      case SULFOXIDE -> sulfoxide;
      case ALIPHATIC -> aliphatic;
    };
  }

  public double getArea(@NotNull FunctionalGroup group) {
    return totalArea(getComponents(group));
  }

  public double carbonylArea() {
    return totalArea(carbonyl);
  }

  public double sulfoxideArea() {
    return totalArea(sulfoxide);
  }

  public double aliphaticArea() {
    return totalArea(aliphatic);
  }

  /**
   * @return carbonyl index or NaN if no aliphatic component was fitted.
   */
  public double ico() {
    final double ref = aliphaticArea();
    return ref > 0d ? carbonylArea() / ref : Double.NaN;
  }

  /**
   * @return sulfoxide index or NaN if no aliphatic component was fitted.
   */
  public double iso() {
    final double ref = aliphaticArea();
    return ref > 0d ? sulfoxideArea() / ref : Double.NaN;
  }

  /**
   * @return sum of all components at the given wavenumber.
   */
  public double modelValue(double wavenumber) {
    double sum = 0d;
    for (GaussianComponent c : components) {
      sum += c.value(wavenumber);
    }
    return sum;
  }
}
