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

package io.github.autoftir.util;

import org.apache.commons.math3.stat.descriptive.rank.Median;

/**
 * Array helpers shared by the spectrum processing steps. All index ranges are inclusive.
 */
public final class MathUtils {

  private MathUtils() {
  }

  /**
   * Trapezoidal integral of y over x between two indices.
   */
  public static double trapz(double[] x, double[] y, int from, int to) {
    double area = 0d;
    for (int i = from + 1; i <= to; i++) {
      area += (x[i] - x[i - 1]) * (y[i] + y[i - 1]) * 0.5;
    }
    return area;
  }

  public static double trapz(double[] x, double[] y) {
    return trapz(x, y, 0, x.length - 1);
  }

  /**
   * Linear interpolation in sorted support points. Values outside the support are extrapolated
   * from the first or last segment.
   */
  public static double interpolate(double[] xs, double[] ys, double x) {
    final int n = xs.length;
    if (n == 1) {
      return ys[0];
    }
    int seg;
    if (x <= xs[0]) {
      seg = 0;
    } else if (x >= xs[n - 1]) {
      seg = n - 2;
    } else {
      int lo = 0;
      int hi = n - 1;
      while (hi - lo > 1) {
        final int m = (lo + hi) >>> 1;
        if (xs[m] <= x) {
          lo = m;
        } else {
          hi = m;
        }
      }
      seg = lo;
    }
    final double slope = (ys[seg + 1] - ys[seg]) / (xs[seg + 1] - xs[seg]);
    return ys[seg] + slope * (x - xs[seg]);
  }

  /**
   * @return n evenly spaced values from start to end (both included).
   */
  public static double[] linspace(double start, double end, int n) {
    final double[] values = new double[n];
    if (n == 1) {
      values[0] = start;
      return values;
    }
    final double step = (end - start) / (n - 1);
    for (int i = 0; i < n; i++) {
      values[i] = start + i * step;
    }
    values[n - 1] = end;
    return values;
  }

  /**
   * @return index of the first maximum between from and to.
   */
  public static int argMax(double[] y, int from, int to) {
    int idx = from;
    double best = y[from];
    for (int i = from + 1; i <= to; i++) {
      if (y[i] > best) {
        best = y[i];
        idx = i;
      }
    }
    return idx;
  }

  /**
   * @return index of the first minimum between from and to.
   */
  public static int argMin(double[] y, int from, int to) {
    int idx = from;
    double best = y[from];
    for (int i = from + 1; i <= to; i++) {
      if (y[i] < best) {
        best = y[i];
        idx = i;
      }
    }
    return idx;
  }

  public static double mean(double[] y, int from, int to) {
    double sum = 0d;
    for (int i = from; i <= to; i++) {
      sum += y[i];
    }
    return sum / (to - from + 1);
  }

  public static double median(double[] values) {
    return new Median().evaluate(values);
  }
}
