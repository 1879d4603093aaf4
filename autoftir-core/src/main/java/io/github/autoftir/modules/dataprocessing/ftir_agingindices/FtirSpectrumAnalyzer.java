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
import io.github.autoftir.modules.dataprocessing.featdet_gaussiandeconvolution.DeconvolutionEngine;
import io.github.autoftir.modules.dataprocessing.featdet_groupintegration.AreaIndexCalculator;
import io.github.autoftir.modules.dataprocessing.featdet_baselinecorrection.als.AlsBaselineCorrector;
import io.github.autoftir.modules.dataprocessing.filter_normalization.NormalizedSpectrum;
import io.github.autoftir.modules.dataprocessing.filter_normalization.Normalizer;
import io.github.autoftir.util.SpectrumUtils;
import io.github.autoftir.util.exceptions.GaussianFitFailedException;
import io.github.autoftir.util.exceptions.NumericalException;
import io.github.autoftir.util.exceptions.PeakNotFoundException;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Runs the complete workflow on one spectrum: absorbance conversion, baseline correction,
 * normalization, band integration and deconvolution. A band that cannot be located or refined is
 * integrated over the fallback window of its group and reported for manual review.
 */
public class FtirSpectrumAnalyzer {

  private static final Logger logger = Logger.getLogger(FtirSpectrumAnalyzer.class.getName());

  private final FtirAnalysisParameters parameters;
  private final AlsBaselineCorrector baselineCorrector;
  private final Normalizer normalizer = new Normalizer();
  private final AreaIndexCalculator areaIndexCalculator = new AreaIndexCalculator();
  private final DeconvolutionEngine deconvolutionEngine;

  public FtirSpectrumAnalyzer() {
    this(FtirAnalysisParameters.defaults());
  }

  public FtirSpectrumAnalyzer(@NotNull FtirAnalysisParameters parameters) {
    this.parameters = parameters;
    this.baselineCorrector = new AlsBaselineCorrector(parameters.als());
    this.deconvolutionEngine = new DeconvolutionEngine(parameters.deconvolution());
  }

  public @NotNull FtirAnalysisResult analyze(@NotNull Spectrum raw) {
    final Spectrum absorbance = SpectrumUtils.toAbsorbanceIfTransmittance(raw);
    final Spectrum corrected = baselineCorrector.correctWithAnchors(absorbance);
    final NormalizedSpectrum processed = normalizer.normalize(corrected,
        parameters.normalizationMethod());
    final Spectrum spectrum = processed.spectrum();

    final Map<FunctionalGroup, FunctionalGroupResult> groups = new EnumMap<>(
        FunctionalGroup.class);
    final Set<FunctionalGroup> review = EnumSet.noneOf(FunctionalGroup.class);
    for (FunctionalGroup group : FunctionalGroup.values()) {
      try {
        groups.put(group, areaIndexCalculator.analyze(spectrum, group));
      } catch (PeakNotFoundException | GaussianFitFailedException | NumericalException e) {
        logger.warning(() -> "%s band of %s integrated over fallback window %s: %s".formatted(
            group, raw, group.getFallbackWindow(), e.getMessage()));
        groups.put(group,
            areaIndexCalculator.integrate(spectrum, group, group.getFallbackWindow()));
        review.add(group);
      }
    }
    final AgingIndices indices = new AgingIndices(groups.get(FunctionalGroup.CARBONYL),
        groups.get(FunctionalGroup.SULFOXIDE), groups.get(FunctionalGroup.ALIPHATIC));

    final DeconvolutionResult deconvolution = deconvolutionEngine.run(spectrum);
    return new FtirAnalysisResult(raw, processed, indices, deconvolution, review);
  }
}
