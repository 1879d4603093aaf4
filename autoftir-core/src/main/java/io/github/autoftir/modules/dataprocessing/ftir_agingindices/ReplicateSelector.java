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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.function.ToDoubleFunction;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.util.CombinatoricsUtils;
import org.jetbrains.annotations.NotNull;

/**
 * Picks the most consistent replicates of a sample. All subsets of the requested size are
 * compared by the population standard deviation of a metric, usually the baseline ICO. The
 * remaining replicates are considered outliers.
 */
public class ReplicateSelector {

  public static final int DEFAULT_SUBSET_SIZE = 3;

  /**
   * @return the subset with the lowest standard deviation in input order, or all items if there
   * are not more than subsetSize. Ties keep the subset whose sorted indices come first in
   * lexicographic order, independent of the enumeration order of the combinations.
   */
  public <T> @NotNull List<T> selectMostConsistent(@NotNull List<T> items,
      @NotNull ToDoubleFunction<T> metric, int subsetSize) {
    Preconditions.checkArgument(subsetSize > 0, "Subset size must be positive");
    if (items.size() <= subsetSize) {
      return List.copyOf(items);
    }
    final double[] values = items.stream().mapToDouble(metric).toArray();
    final StandardDeviation std = new StandardDeviation(false);

    int[] best = null;
    double bestStd = Double.POSITIVE_INFINITY;
    final double[] subset = new double[subsetSize];
    final Iterator<int[]> combinations = CombinatoricsUtils.combinationsIterator(items.size(),
        subsetSize);
    while (combinations.hasNext()) {
      final int[] combination = combinations.next();
      for (int i = 0; i < subsetSize; i++) {
        subset[i] = values[combination[i]];
      }
      final double s = std.evaluate(subset);
      if (best == null || s < bestStd || (s == bestStd && Arrays.compare(combination, best) < 0)) {
        best = combination.clone();
        bestStd = s;
      }
    }

    final List<T> selected = new ArrayList<>(subsetSize);
    for (int i : best) {
      selected.add(items.get(i));
    }
    return selected;
  }

  public <T> @NotNull List<T> selectMostConsistent(@NotNull List<T> items,
      @NotNull ToDoubleFunction<T> metric) {
    return selectMostConsistent(items, metric, DEFAULT_SUBSET_SIZE);
  }
}
