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

package io.github.autoftir.datamodel;

/**
 * One Gaussian band {@code a * exp(-(x - mean)^2 / (2 * sigma^2))}. The sign of sigma is not
 * meaningful, a fit may return negative values.
 *
 * @param mean      band position in cm^-1
 * @param sigma     standard deviation in cm^-1
 * @param amplitude band height in absorbance units
 */
public record GaussianComponent(double mean, double sigma, double amplitude) {

  public static final double MIN_VALID_MEAN = 400d;
  public static final double MAX_VALID_MEAN = 2100d;
  public static final double MAX_VALID_SIGMA = 100d;

  private static final double SQRT_TWO_PI = Math.sqrt(2 * Math.PI);

  public double value(double x) {
    final double d = (x - mean) / sigma;
    return amplitude * Math.exp(-0.5 * d * d);
  }

  /**
   * @return integral of the band over all wavenumbers.
   */
  public double area() {
    return amplitude * Math.abs(sigma) * SQRT_TWO_PI;
  }

  /**
   * Components outside the mid-infrared fingerprint region or broader than a background drift are
   * artifacts of the fit.
   */
  public boolean isPhysicallyValid() {
    return Double.isFinite(mean) && Double.isFinite(sigma) && mean >= MIN_VALID_MEAN
        && mean <= MAX_VALID_MEAN && Math.abs(sigma) < MAX_VALID_SIGMA && sigma != 0d;
  }

  /**
   * Half width of the band where it has dropped to the given fraction of its amplitude.
   */
  public double halfWidthAt(double fractionOfAmplitude) {
    return Math.abs(sigma) * Math.sqrt(-2d * Math.log(fractionOfAmplitude));
  }
}
