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

package io.github.autoftir.util.linalg;

import io.github.autoftir.util.exceptions.NumericalException;

/**
 * Solves symmetric positive definite pentadiagonal systems by a banded LDL^T factorization. The
 * matrix is given by its main diagonal and the first and second super diagonals. Runs in O(n)
 * time and memory.
 */
public final class BandedSymmetricSolver {

  private BandedSymmetricSolver() {
  }

  /**
   * @param d0 main diagonal, length n
   * @param d1 first off diagonal, {@code d1[i] = A[i][i+1]}, length n-1
   * @param d2 second off diagonal, {@code d2[i] = A[i][i+2]}, length n-2
   * @param b  right hand side, length n
   * @return solution of A z = b
   * @throws NumericalException if a pivot is not positive or not finite
   */
  public static double[] solve(double[] d0, double[] d1, double[] d2, double[] b) {
    final int n = d0.length;
    final double[] diag = new double[n];
    final double[] l1 = new double[n]; // L[i][i-1]
    final double[] l2 = new double[n]; // L[i][i-2]

    for (int i = 0; i < n; i++) {
      double d = d0[i];
      if (i >= 2) {
        l2[i] = d2[i - 2] / diag[i - 2];
        d -= l2[i] * l2[i] * diag[i - 2];
      }
      if (i >= 1) {
        double a = d1[i - 1];
        if (i >= 2) {
          a -= l2[i] * diag[i - 2] * l1[i - 1];
        }
        l1[i] = a / diag[i - 1];
        d -= l1[i] * l1[i] * diag[i - 1];
      }
      if (!(d > 0d) || !Double.isFinite(d)) {
        throw new NumericalException(
            "Singular or indefinite system, pivot %g at row %d".formatted(d, i));
      }
      diag[i] = d;
    }

    final double[] z = new double[n];
    for (int i = 0; i < n; i++) {
      double u = b[i];
      if (i >= 1) {
        u -= l1[i] * z[i - 1];
      }
      if (i >= 2) {
        u -= l2[i] * z[i - 2];
      }
      z[i] = u;
    }
    for (int i = 0; i < n; i++) {
      z[i] /= diag[i];
    }
    for (int i = n - 1; i >= 0; i--) {
      if (i + 1 < n) {
        z[i] -= l1[i + 1] * z[i + 1];
      }
      if (i + 2 < n) {
        z[i] -= l2[i + 2] * z[i + 2];
      }
    }
    for (double v : z) {
      if (!Double.isFinite(v)) {
        throw new NumericalException("Solution of banded system is not finite");
      }
    }
    return z;
  }
}
