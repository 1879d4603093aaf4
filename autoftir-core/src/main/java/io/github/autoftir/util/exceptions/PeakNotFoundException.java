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

package io.github.autoftir.util.exceptions;

import com.google.common.collect.Range;
import io.github.autoftir.datamodel.FunctionalGroup;
import org.jetbrains.annotations.NotNull;

/**
 * No peak with sufficient prominence was found in the search range of a functional group. The
 * caller may integrate {@link FunctionalGroup#getFallbackWindow()} instead or mark the sample for
 * manual review.
 */
public class PeakNotFoundException extends FtirProcessingException {

  private final @NotNull FunctionalGroup group;

  public PeakNotFoundException(@NotNull FunctionalGroup group) {
    super("Peak was not found in the range of %.0f to %.0f cm^-1 (expected around %.0f cm^-1)".formatted(
        group.getSearchRange().lowerEndpoint(), group.getSearchRange().upperEndpoint(),
        group.getCenterWavenumber()));
    this.group = group;
  }

  public @NotNull FunctionalGroup getGroup() {
    return group;
  }

  public double getCenterWavenumber() {
    return group.getCenterWavenumber();
  }

  public @NotNull Range<Double> getHintRange() {
    return group.getSearchRange();
  }
}
