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

package io.github.autoftir.util.fitting;

import java.util.Collection;
import org.apache.commons.math3.analysis.ParametricUnivariateFunction;
import org.apache.commons.math3.fitting.AbstractCurveFitter;
import org.apache.commons.math3.fitting.WeightedObservedPoint;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.linear.DiagonalMatrix;

/**
 * Fits mean and sigma of a Gaussian {@code a * exp(-(x - mean)^2 / (2 * sigma^2))} whose height
 * {@code a} is fixed. Returns {@code [mean, sigma]}.
 */
public class FixedAmplitudeGaussianFitter extends AbstractCurveFitter {

  private final double amplitude;
  private final double[] initialGuess;
  private final int maxIter;

  private FixedAmplitudeGaussianFitter(double amplitude, double[] initialGuess, int maxIter) {
    this.amplitude = amplitude;
    this.initialGuess = initialGuess;
    this.maxIter = maxIter;
  }

  /**
   * @param amplitude    fixed height of the Gaussian
   * @param initialGuess start values {@code [mean, sigma]}
   */
  public static FixedAmplitudeGaussianFitter create(double amplitude, double[] initialGuess) {
    return new FixedAmplitudeGaussianFitter(amplitude, initialGuess.clone(), 1000);
  }

  public FixedAmplitudeGaussianFitter withMaxIterations(int newMaxIter) {
    return new FixedAmplitudeGaussianFitter(amplitude, initialGuess, newMaxIter);
  }

  @Override
  protected LeastSquaresProblem getProblem(Collection<WeightedObservedPoint> observations) {
    final int len = observations.size();
    final double[] target = new double[len];
    final double[] weights = new double[len];

    int i = 0;
    for (final WeightedObservedPoint obs : observations) {
      target[i] = obs.getY();
      weights[i] = obs.getWeight();
      ++i;
    }

    final AbstractCurveFitter.TheoreticalValuesFunction model = new AbstractCurveFitter.TheoreticalValuesFunction(
        new Parametric(amplitude), observations);

    return new LeastSquaresBuilder().maxEvaluations(Integer.MAX_VALUE).maxIterations(maxIter)
        .start(initialGuess).target(target).weight(new DiagonalMatrix(weights))
        .model(model.getModelFunction(), model.getModelFunctionJacobian()).build();
  }

  /**
   * Gaussian with fixed height, parameters {@code [mean, sigma]}.
   */
  static class Parametric implements ParametricUnivariateFunction {

    private final double amplitude;

    Parametric(double amplitude) {
      this.amplitude = amplitude;
    }

    @Override
    public double value(double x, double... parameters) {
      final double d = (x - parameters[0]) / parameters[1];
      return amplitude * Math.exp(-0.5 * d * d);
    }

    @Override
    public double[] gradient(double x, double... parameters) {
      final double mean = parameters[0];
      final double sigma = parameters[1];
      final double diff = x - mean;
      final double f = value(x, parameters);
      final double sigma2 = sigma * sigma;
      return new double[]{f * diff / sigma2, f * diff * diff / (sigma2 * sigma)};
    }
  }
}
