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

import com.google.common.base.Preconditions;
import com.google.common.collect.Range;
import org.jetbrains.annotations.NotNull;

/**
 * Wavenumber interval that is integrated for a functional group. Two-band groups additionally
 * carry the valley between both bands, which is the common end point of the tangential chords.
 *
 * @param left  lower bound in cm^-1
 * @param right upper bound in cm^-1
 * @param mid   valley wavenumber between two bands or NaN for single bands
 */
public record IntegrationWindow(double left, double right, double mid) {

  public IntegrationWindow {
    Preconditions.checkArgument(left <= right, "Window bounds are reversed: %s > %s", left, right);
  }

  public static @NotNull IntegrationWindow single(double left, double right) {
    return new IntegrationWindow(left, right, Double.NaN);
  }

  public boolean hasMid() {
    return !Double.isNaN(mid);
  }

  public @NotNull Range<Double> toRange() {
    return Range.closed(left, right);
  }
}
