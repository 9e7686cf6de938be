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
import com.twentyn.mrs.signal.SpectralOps;
import com.twentyn.mrs.signal.Spectrum;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.interpolation.SplineInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.analysis.solvers.BrentSolver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Full width at half maximum of the tallest real peak in a window, measured on an 8x zero-filled spectrum.  The
 * half-maximum crossings either side of the peak are located on a cubic spline through the samples.
 */
public class Linewidth {
  private static final Logger LOGGER = LogManager.getFormatterLogger(Linewidth.class);

  public static final int ZERO_FILL = 8;
  private static final double ABSOLUTE_ACCURACY_PPM = 1e-7;
  private static final int MAX_SOLVER_EVALUATIONS = 100;

  /** FWHM in Hz, NaN when the peak does not fall to half height within the spectrum. */
  public double measure(Spectrum spectrum, double[] window) {
    Spectrum filled = spectrum.zeroFill(ZERO_FILL);
    PpmAxis axis = filled.ppmAxis();
    int[] range = axis.indexRange(window[0], window[1]);
    if (range[0] > range[1]) {
      return Double.NaN;
    }
    double[] real = filled.realSpectrum();
    int peak = SpectralOps.argMax(real, range[0], range[1]);
    double half = real[peak] / 2.0;
    if (!(half > 0.0)) {
      return Double.NaN;
    }

    int left = peak;
    while (left > 0 && real[left] > half) {
      left--;
    }
    int right = peak;
    while (right < real.length - 1 && real[right] > half) {
      right++;
    }
    if (real[left] > half || real[right] > half) {
      LOGGER.warn("Peak at %.3f ppm never drops to half height", axis.ppm(peak));
      return Double.NaN;
    }
    double lowPpm = crossing(axis, real, left, half);
    double highPpm = crossing(axis, real, right - 1, half);
    return filled.getHeader().ppmToHz(highPpm - lowPpm);
  }

  public double measurePpm(Spectrum spectrum, double[] window) {
    return spectrum.getHeader().hzToPpm(measure(spectrum, window));
  }

  // ppm where the spectrum crosses the level between samples from and from + 1.
  private static double crossing(PpmAxis axis, double[] real, int from, double level) {
    int lo = Math.max(0, from - 2);
    int hi = Math.min(real.length - 1, from + 3);
    double[] x = axis.ppmValues(lo, hi);
    double[] y = new double[hi - lo + 1];
    System.arraycopy(real, lo, y, 0, y.length);
    final PolynomialSplineFunction spline = new SplineInterpolator().interpolate(x, y);
    final double target = level;
    UnivariateFunction offset = new UnivariateFunction() {
      @Override
      public double value(double ppm) {
        return spline.value(ppm) - target;
      }
    };
    double a = axis.ppm(from);
    double b = axis.ppm(from + 1);
    if (Math.signum(offset.value(a)) == Math.signum(offset.value(b))) {
      double fraction = (level - real[from]) / (real[from + 1] - real[from]);
      return a + fraction * (b - a);
    }
    return new BrentSolver(ABSOLUTE_ACCURACY_PPM).solve(MAX_SOLVER_EVALUATIONS, offset, a, b);
  }
}
