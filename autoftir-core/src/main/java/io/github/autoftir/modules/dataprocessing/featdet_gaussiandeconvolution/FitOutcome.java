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

import io.github.autoftir.datamodel.GaussianComponent;
import java.util.Arrays;
import org.jetbrains.annotations.NotNull;

/**
 * Result of fitting the biggest peak of a residual curve.
 */
public sealed interface FitOutcome {

  /**
   * The residual array is copied on construction and on access.
   *
   * @param component   the fitted component
   * @param newResidual residual with the component subtracted and negative values set to zero
   */
  record Success(@NotNull GaussianComponent component, double[] newResidual) implements
      FitOutcome {

    public Success {
      newResidual = newResidual.clone();
    }

    @Override
    public double[] newResidual() {
      return newResidual.clone();
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Success other && component.equals(other.component) && Arrays.equals(
          newResidual, other.newResidual);
    }

    @Override
    public int hashCode() {
      return 31 * component.hashCode() + Arrays.hashCode(newResidual);
    }

    @Override
    public String toString() {
      return "Success[component=" + component + ", residual points=" + newResidual.length + "]";
    }
  }

  /**
   * The residual is left unchanged.
   */
  record Failed(@NotNull String reason) implements FitOutcome {

  }
}
