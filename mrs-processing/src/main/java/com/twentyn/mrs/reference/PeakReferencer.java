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

package com.twentyn.mrs.reference;

import com.twentyn.mrs.signal.AcquisitionHeader;
import com.twentyn.mrs.signal.PpmAxis;
import com.twentyn.mrs.signal.SpectralOps;
import com.twentyn.mrs.signal.Spectrum;
import com.twentyn.mrs.util.LeastSquaresSolver;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Lineshape referencing.  A complex Lorentzian (or a pair sharing linewidth and phase) plus a constant offset is
 * fitted to the landmark window; the fitted centre minus the canonical shift is the reference shift.
 *
 * The model is the discrete transform of a sampled damped exponential,
 * A e^(i phi) / (1 - exp((i 2 pi (f0 - f) - gamma) dt)), so that the fitted FWHM gamma / pi is exact for
 * synthetic data.
 */
public class PeakReferencer {
  private static final Logger LOGGER = LogManager.getFormatterLogger(PeakReferencer.class);

  // Linewidth prior in ppm, converted to Hz with the transmitter frequency.
  public static final double LINEWIDTH_PRIOR_PPM = 0.04;
  private static final int MAX_ITERATIONS = 200;
  private static final int MAX_EVALUATIONS = 2000;

  private final CrossCorrelationReferencer coarse;

  public PeakReferencer() {
    this(new CrossCorrelationReferencer(0.2, LINEWIDTH_PRIOR_PPM));
  }

  public PeakReferencer(CrossCorrelationReferencer coarse) {
    this.coarse = coarse;
  }

  public ReferenceResult reference(Spectrum spectrum, Landmark landmark) {
    final AcquisitionHeader header = spectrum.getHeader();
    final PpmAxis axis = spectrum.ppmAxis();
    final int[] window = axis.indexRange(landmark.getLowPpm(), landmark.getHighPpm());
    if (window[0] > window[1]) {
      LOGGER.warn("Landmark window %.2f-%.2f ppm lies outside the spectral range", landmark.getLowPpm(),
          landmark.getHighPpm());
      return new ReferenceResult(landmark, 0.0, 0.0, Double.NaN, 0.0, false);
    }
    final Complex[] values = spectrum.getSpectrum();
    final double dt = header.getDwellTime();
    final boolean doublet = landmark.isDoublet();
    final double separationHz = header.ppmToHz(landmark.getSeparationPpm());
    final double canonicalHz = header.ppmToHz(landmark.getPpm() - AcquisitionHeader.CENTER_PPM);
    final double lowHz = axis.hz(window[0]);
    final double highHz = axis.hz(window[1]);

    double startShift = coarse.estimateShift(spectrum, landmark);
    double f0 = Math.max(lowHz, Math.min(highHz, canonicalHz + startShift));
    double gamma = Math.PI * header.ppmToHz(LINEWIDTH_PRIOR_PPM);
    double scale = 1.0 - Math.exp(-gamma * dt);
    Complex atPrimary = values[nearest(axis, f0)];
    double offsetScale = 0.0;
    for (int i = window[0]; i <= window[1]; i++) {
      offsetScale = Math.max(offsetScale, values[i].abs());
    }

    final double[] start;
    final double[] typical;
    if (doublet) {
      Complex atSecondary = values[nearest(axis, f0 + separationHz)];
      start = new double[]{atPrimary.abs() * scale, atSecondary.abs() * scale, atPrimary.getArgument(), f0, gamma,
          0.0, 0.0};
      typical = new double[]{start[0], start[0], 1.0, 1.0, gamma, offsetScale, offsetScale};
    } else {
      start = new double[]{atPrimary.abs() * scale, atPrimary.getArgument(), f0, gamma, 0.0, 0.0};
      typical = new double[]{start[0], 1.0, 1.0, gamma, offsetScale, offsetScale};
    }
    final int centreIndex = doublet ? 3 : 2;
    final int gammaIndex = centreIndex + 1;
    final double maxGamma = 20.0 * gamma;

    LeastSquaresSolver.Residuals residuals = new LeastSquaresSolver.Residuals() {
      @Override
      public double[] value(double[] p) {
        int count = window[1] - window[0] + 1;
        double[] r = new double[2 * count];
        for (int i = 0; i < count; i++) {
          int idx = window[0] + i;
          double f = axis.hz(idx);
          Complex model = doublet
              ? peak(p[0], p[2], p[3], p[4], f, dt).add(peak(p[1], p[2], p[3] + separationHz, p[4], f, dt))
              : peak(p[0], p[1], p[2], p[3], f, dt);
          model = model.add(new Complex(p[p.length - 2], p[p.length - 1]));
          r[2 * i] = model.getReal() - values[idx].getReal();
          r[2 * i + 1] = model.getImaginary() - values[idx].getImaginary();
        }
        return r;
      }
    };
    ParameterValidator validator = new ParameterValidator() {
      @Override
      public RealVector validate(RealVector params) {
        double[] p = params.toArray();
        p[0] = Math.abs(p[0]);
        if (doublet) {
          p[1] = Math.abs(p[1]);
        }
        p[centreIndex] = Math.max(lowHz, Math.min(highHz, p[centreIndex]));
        p[gammaIndex] = Math.max(0.1, Math.min(maxGamma, Math.abs(p[gammaIndex])));
        return new ArrayRealVector(p, false);
      }
    };

    LeastSquaresSolver.Solution solution = new LeastSquaresSolver(MAX_ITERATIONS, MAX_EVALUATIONS)
        .withValidator(validator)
        .withTypicalScale(typical)
        .minimize(residuals, start);

    if (!solution.isFinite()) {
      LOGGER.warn("Lineshape fit on %s failed, falling back to magnitude maximum", landmark);
      return peakSearch(spectrum, landmark, window);
    }
    double[] p = solution.getPoint();
    double centreHz = p[centreIndex];
    double centrePpm = AcquisitionHeader.CENTER_PPM + header.hzToPpm(centreHz);
    double shiftPpm = centrePpm - landmark.getPpm();
    double phase = doublet ? p[2] : p[1];
    ReferenceResult result = new ReferenceResult(landmark, header.ppmToHz(shiftPpm), shiftPpm, p[gammaIndex] / Math.PI,
        phase, solution.isConverged());
    LOGGER.debug("Referenced on %s: %s", landmark, result);
    return result;
  }

  /**
   * Phases the spectrum with the negative phase of a double-Lorentzian fit to the creatine/choline resonances.
   * @return the phased spectrum and the fitted phase in radians
   */
  public Pair<Spectrum, Double> phaseOnCrCho(Spectrum spectrum) {
    ReferenceResult fit = reference(spectrum, Landmark.CR_CHO);
    return Pair.of(spectrum.phaseShift(-fit.getPhaseRad()), fit.getPhaseRad());
  }

  /** References the spectrum on a landmark and returns the shifted spectrum with the result that produced it. */
  public Pair<Spectrum, ReferenceResult> apply(Spectrum spectrum, Landmark landmark) {
    ReferenceResult result = reference(spectrum, landmark);
    return Pair.of(spectrum.freqShift(-result.getShiftHz()), result);
  }

  private static ReferenceResult peakSearch(Spectrum spectrum, Landmark landmark, int[] window) {
    double[] magnitude = spectrum.magnitudeSpectrum();
    int best = SpectralOps.argMax(magnitude, window[0], window[1]);
    double ppm = spectrum.ppmAxis().ppmAt(SpectralOps.parabolicPeak(magnitude, best));
    double shiftPpm = ppm - landmark.getPpm();
    double phase = spectrum.getSpectrum()[best].getArgument();
    return new ReferenceResult(landmark, spectrum.getHeader().ppmToHz(shiftPpm), shiftPpm, Double.NaN, phase, false);
  }

  private static int nearest(PpmAxis axis, double hz) {
    int idx = (int) Math.round(hz / axis.hzPerPoint() + axis.size() / 2);
    return Math.max(0, Math.min(axis.size() - 1, idx));
  }

  static Complex peak(double amplitude, double phase, double centreHz, double gamma, double f, double dt) {
    double angle = 2.0 * Math.PI * (centreHz - f) * dt;
    double decay = Math.exp(-gamma * dt);
    Complex denominator = new Complex(1.0 - decay * Math.cos(angle), -decay * Math.sin(angle));
    return new Complex(amplitude * Math.cos(phase), amplitude * Math.sin(phase)).divide(denominator);
  }
}
