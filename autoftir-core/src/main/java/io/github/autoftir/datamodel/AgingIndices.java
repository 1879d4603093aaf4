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

import org.jetbrains.annotations.NotNull;

/**
 * Carbonyl (ICO) and sulfoxide (ISO) indices from directly integrated bands, for both integration
 * conventions.
 */
public record AgingIndices(@NotNull FunctionalGroupResult carbonyl,
                           @NotNull FunctionalGroupResult sulfoxide,
                           @NotNull FunctionalGroupResult aliphatic) {

  public double getIco(@NotNull IntegrationMethod method) {
    return carbonyl.getArea(method) / aliphatic.getArea(method);
  }

  public double getIso(@NotNull IntegrationMethod method) {
    return sulfoxide.getArea(method) / aliphatic.getArea(method);
  }

  public double icoBaseline() {
    return getIco(IntegrationMethod.BASELINE);
  }

  public double icoTangential() {
    return getIco(IntegrationMethod.TANGENTIAL);
  }

  public double isoBaseline() {
    return getIso(IntegrationMethod.BASELINE);
  }

  public double isoTangential() {
    return getIso(IntegrationMethod.TANGENTIAL);
  }
}
