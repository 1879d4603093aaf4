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

package io.github.autoftir.modules.dataprocessing.ftir_agingindices;

import io.github.autoftir.datamodel.AgingIndices;
import io.github.autoftir.datamodel.DeconvolutionResult;
import io.github.autoftir.datamodel.FunctionalGroup;
import io.github.autoftir.datamodel.FunctionalGroupResult;
import io.github.autoftir.datamodel.Spectrum;
import io.github.autoftir.modules.dataprocessing.filter_normalization.NormalizedSpectrum;
import java.util.Set;
import org.jetbrains.annotations.NotNull;

/**
 * Everything derived from one spectrum.
 *
 * @param raw           the input spectrum
 * @param processed     baseline corrected and normalized spectrum with its scale factor
 * @param indices       band areas and indices from direct integration
 * @param deconvolution Gaussian decomposition of the processed spectrum
 * @param reviewGroups  groups integrated over their fallback window, these need a manual check
 */
public record FtirAnalysisResult(@NotNull Spectrum raw, @NotNull NormalizedSpectrum processed,
                                 @NotNull AgingIndices indices,
                                 @NotNull DeconvolutionResult deconvolution,
                                 @NotNull Set<FunctionalGroup> reviewGroups) {

  public FtirAnalysisResult {
    reviewGroups = Set.copyOf(reviewGroups);
  }

  public double getBeta() {
    return processed.beta();
  }

  public @NotNull FunctionalGroupResult getGroupResult(@NotNull FunctionalGroup group) {
    return switch (group) {
      case CARBONYL -> indices.carbonyl();
      case SULFOXIDE -> indices.sulfoxide();
      case ALIPHATIC -> indices.aliphatic();
    };
  }

  public boolean requiresReview() {
    return !reviewGroups.isEmpty();
  }
}
