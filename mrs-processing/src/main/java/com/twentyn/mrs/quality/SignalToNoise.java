/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.twentyn.mrs.quality;

import com.twentyn.mrs.signal.PpmAxis;
import com.twentyn.mrs.signal.Spectrum;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.fitting.PolynomialCurveFitter;
import org.apache.commons.math3.fitting.WeightedObservedPoints;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Peak height over noise.  The signal is the maximum of the real spectrum inside the signal window; the noise is
 * the standard deviation of the real spectrum in a signal-free region after removing a quadratic trend.
 */
public class SignalToNoise {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SignalToNoise.class);

  public static final double[] DEFAULT_NOISE_WINDOW = {-2.0, 0.0};
  private static final int DETREND_DEGREE = 2;

  private final double[] noiseWindow;

  public SignalToNoise() {
    this(DEFAULT_NOISE_WINDOW);
  }

  public SignalToNoise(double[] noiseWindow) {
    this.noiseWindow = noiseWindow.clone();
  }

  /** NaN when either window holds no points. */
  public double compute(Spectrum spectrum, double[] signalWindow) {
    double signal = signal(spectrum, signalWindow);
    double noise = noise(spectrum);
    if (Double.isNaN(signal) || Double.isNaN(noise) || noise == 0.0) {
      LOGGER.warn("SNR undefined for signal window %.2f-%.2f ppm (signal %g, noise %g)", signalWindow[0],
          signalWindow[1], signal, noise);
      return Double.NaN;
    }
    return signal / noise;
  }

  public double signal(Spectrum spectrum, double[] signalWindow) {
    int[] range = spectrum.ppmAxis().indexRange(signalWindow[0], signalWindow[1]);
    if (range[0] > range[1]) {
      return Double.NaN;
    }
    double[] real = spectrum.realSpectrum();
    double max = Double.NEGATIVE_INFINITY;
    for (int i = range[0]; i <= range[1]; i++) {
      max = Math.max(max, real[i]);
    }
    return max;
  }

  public double noise(Spectrum spectrum) {
    PpmAxis axis = spectrum.ppmAxis();
    int[] range = axis.indexRange(noiseWindow[0], noiseWindow[1]);
    int count = range[1] - range[0] + 1;
    if (count <= DETREND_DEGREE + 1) {
      return Double.NaN;
    }
    double[] real = spectrum.realSpectrum();
    WeightedObservedPoints points = new WeightedObservedPoints();
    for (int i = range[0]; i <= range[1]; i++) {
      points.add(axis.ppm(i), real[i]);
    }
    PolynomialFunction trend = new PolynomialFunction(
        PolynomialCurveFitter.create(DETREND_DEGREE).fit(points.toList()));
    double[] detrended = new double[count];
    for (int i = range[0]; i <= range[1]; i++) {
      detrended[i - range[0]] = real[i] - trend.value(axis.ppm(i));
    }
    return new StandardDeviation().evaluate(detrended);
  }
}
