/*
 * Copyright (c) 2025 The AutoFTIR Development Team
 */

package io.github.autoftir.util.linalg;

import io.github.autoftir.util.exceptions.NumericalException;
import java.util.Random;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class BandedSymmetricSolverTest {

  @Test
  void testMatchesDenseSolution() {
    final int n = 30;
    final Random random = new Random(42);
    final double[] d0 = new double[n];
    final double[] d1 = new double[n - 1];
    final double[] d2 = new double[n - 2];
    final double[] b = new double[n];
    for (int i = 0; i < n; i++) {
      d0[i] = 10 + random.nextDouble();
      b[i] = random.nextDouble() - 0.5;
    }
    for (int i = 0; i < n - 1; i++) {
      d1[i] = random.nextDouble() - 0.5;
    }
    for (int i = 0; i < n - 2; i++) {
      d2[i] = random.nextDouble() - 0.5;
    }

    final RealMatrix dense = new Array2DRowRealMatrix(n, n);
    for (int i = 0; i < n; i++) {
      dense.setEntry(i, i, d0[i]);
      if (i + 1 < n) {
        dense.setEntry(i, i + 1, d1[i]);
        dense.setEntry(i + 1, i, d1[i]);
      }
      if (i + 2 < n) {
        dense.setEntry(i, i + 2, d2[i]);
        dense.setEntry(i + 2, i, d2[i]);
      }
    }
    final double[] expected = new LUDecomposition(dense).getSolver()
        .solve(new ArrayRealVector(b)).toArray();

    Assertions.assertArrayEquals(expected, BandedSymmetricSolver.solve(d0, d1, d2, b), 1e-10);
  }

  @Test
  void testSingularSystemFails() {
    final double[] d0 = {1, 1, 1, 1};
    final double[] d1 = {1, 1, 1};
    final double[] d2 = {0, 0};
    Assertions.assertThrows(NumericalException.class,
        () -> BandedSymmetricSolver.solve(d0, d1, d2, new double[]{1, 2, 3, 4}));
  }
}
