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

import io.github.autoftir.modules.dataprocessing.featdet_gaussiandeconvolution.DeconvolutionParameters;
import io.github.autoftir.modules.dataprocessing.featdet_baselinecorrection.als.AlsBaselineCorrectorParameters;
import io.github.autoftir.modules.dataprocessing.filter_normalization.NormalizationMethod;
import io.github.autoftir.util.exceptions.FtirProcessingException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * All settings of the aging index workflow.
 */
public record FtirAnalysisParameters(@NotNull AlsBaselineCorrectorParameters als,
                                     @NotNull NormalizationMethod normalizationMethod,
                                     @NotNull DeconvolutionParameters deconvolution) {

  private static final Logger logger = Logger.getLogger(FtirAnalysisParameters.class.getName());

  public static final String DEFAULTS_RESOURCE = "/io/github/autoftir/ftir-analysis-defaults.properties";

  public static final String ALS_LAMBDA = "als.lambda";
  public static final String ALS_RATIO = "als.ratio";
  public static final String ALS_ITERATIONS = "als.iterations";
  public static final String NORMALIZATION_METHOD = "normalization.method";
  public static final String GENERAL_THRESHOLD = "deconvolution.generalThreshold";
  public static final String CARBONYL_THRESHOLD = "deconvolution.carbonylThreshold";
  public static final String MAX_COMPONENTS = "deconvolution.maxComponents";

  public static @NotNull FtirAnalysisParameters defaults() {
    return new FtirAnalysisParameters(AlsBaselineCorrectorParameters.defaults(),
        NormalizationMethod.B, DeconvolutionParameters.defaults());
  }

  /**
   * Reads {@link #DEFAULTS_RESOURCE} from the class path.
   *
   * @throws FtirProcessingException if the resource is missing or cannot be read
   */
  public static @NotNull FtirAnalysisParameters loadDefaults() {
    final Properties properties = new Properties();
    try (InputStream in = FtirAnalysisParameters.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
      if (in == null) {
        throw new FtirProcessingException("Missing class path resource " + DEFAULTS_RESOURCE);
      }
      properties.load(in);
    } catch (IOException e) {
      throw new FtirProcessingException("Cannot read " + DEFAULTS_RESOURCE, e);
    }
    return fromProperties(properties);
  }

  /**
   * Values missing in the properties keep their built-in default.
   *
   * @throws FtirProcessingException  if a value cannot be parsed
   * @throws IllegalArgumentException if a value is out of its allowed range
   */
  public static @NotNull FtirAnalysisParameters fromProperties(@NotNull Properties properties) {
    final FtirAnalysisParameters defaults = defaults();
    final AlsBaselineCorrectorParameters als = new AlsBaselineCorrectorParameters(
        getDouble(properties, ALS_LAMBDA, defaults.als().lambda(),
            AlsBaselineCorrectorParameters.LAMBDA_DESCRIPTION),
        getDouble(properties, ALS_RATIO, defaults.als().ratio(),
            AlsBaselineCorrectorParameters.RATIO_DESCRIPTION),
        getInt(properties, ALS_ITERATIONS, defaults.als().iterations(),
            AlsBaselineCorrectorParameters.ITERATIONS_DESCRIPTION));

    final String method = properties.getProperty(NORMALIZATION_METHOD);
    NormalizationMethod normalization = defaults.normalizationMethod();
    if (method != null) {
      try {
        normalization = NormalizationMethod.valueOf(method.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        throw new FtirProcessingException(
            "Unknown normalization method '%s' for key %s".formatted(method,
                NORMALIZATION_METHOD), e);
      }
    }

    final DeconvolutionParameters deconvolution = defaults.deconvolution()
        .withThresholds(
            getDouble(properties, GENERAL_THRESHOLD, defaults.deconvolution().generalThreshold(),
                DeconvolutionParameters.GENERAL_THRESHOLD_DESCRIPTION),
            getDouble(properties, CARBONYL_THRESHOLD,
                defaults.deconvolution().carbonylThreshold(),
                DeconvolutionParameters.CARBONYL_THRESHOLD_DESCRIPTION))
        .withMaxComponents(
            getInt(properties, MAX_COMPONENTS, defaults.deconvolution().maxComponents(),
                DeconvolutionParameters.MAX_COMPONENTS_DESCRIPTION));

    final FtirAnalysisParameters parameters = new FtirAnalysisParameters(als, normalization,
        deconvolution);
    logger.fine(() -> "Loaded analysis parameters " + parameters);
    return parameters;
  }

  /**
   * @param description appended to the error message of an unparsable value
   */
  private static double getDouble(Properties properties, String key, double defaultValue,
      String description) {
    final String value = properties.getProperty(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException e) {
      throw new FtirProcessingException(
          "Value '%s' of %s is not a number. %s".formatted(value, key, description.strip()), e);
    }
  }

  private static int getInt(Properties properties, String key, int defaultValue,
      String description) {
    final String value = properties.getProperty(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new FtirProcessingException(
          "Value '%s' of %s is not an integer. %s".formatted(value, key, description.strip()), e);
    }
  }
}
