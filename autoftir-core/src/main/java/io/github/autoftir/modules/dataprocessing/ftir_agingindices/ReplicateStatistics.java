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

import com.google.common.base.Preconditions;
import java.util.Collection;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.jetbrains.annotations.NotNull;

/**
 * Summary of one quantity over the replicates of a sample. The standard deviation is the
 * population standard deviation.
 *
 * @param cov coefficient of variation, std / mean
 */
public record ReplicateStatistics(int n, double mean, double std, double cov, double min,
                                  double max) {

  public static @NotNull ReplicateStatistics of(double... values) {
    Preconditions.checkArgument(values.length > 0, "At least one value is required");
    final DescriptiveStatistics stats = new DescriptiveStatistics(values);
    final double mean = stats.getMean();
    final double std = Math.sqrt(stats.getPopulationVariance());
    return new ReplicateStatistics(values.length, mean, std, std / mean, stats.getMin(),
        stats.getMax());
  }

  public static @NotNull ReplicateStatistics of(@NotNull Collection<Double> values) {
    return of(values.stream().mapToDouble(Double::doubleValue).toArray());
  }
}
