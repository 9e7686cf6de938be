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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Coarse frequency referencing.  The magnitude spectrum is cross-correlated with a synthetic comb of Lorentzian
 * peaks at canonical landmark positions; the lag of the correlation maximum, refined with a parabola, is the shift.
 */
public class CrossCorrelationReferencer {
  private static final Logger LOGGER = LogManager.getFormatterLogger(CrossCorrelationReferencer.class);

  public static final double DEFAULT_SEARCH_PPM = 0.5;
  public static final double DEFAULT_LINEWIDTH_PPM = 0.04;
  // Extra ppm either side of the comb included in the correlation window.
  private static final double COMB_MARGIN_PPM = 0.15;

  private final double searchPpm;
  private final double linewidthPpm;

  public CrossCorrelationReferencer() {
    this(DEFAULT_SEARCH_PPM, DEFAULT_LINEWIDTH_PPM);
  }

  public CrossCorrelationReferencer(double searchPpm, double linewidthPpm) {
    this.searchPpm = searchPpm;
    this.linewidthPpm = linewidthPpm;
  }

  /**
   * Estimates by how much the resonances in the spectrum sit above the given canonical positions.
   * @return observed minus canonical, in Hz
   */
  public double estimateShift(Spectrum spectrum, double[] landmarkPpm) {
    AcquisitionHeader header = spectrum.getHeader();
    PpmAxis axis = spectrum.ppmAxis();
    double[] data = spectrum.magnitudeSpectrum();
    double[] comb = comb(header, landmarkPpm);

    double low = Double.POSITIVE_INFINITY;
    double high = Double.NEGATIVE_INFINITY;
    for (double ppm : landmarkPpm) {
      low = Math.min(low, ppm);
      high = Math.max(high, ppm);
    }
    int[] window = axis.indexRange(low - COMB_MARGIN_PPM, high + COMB_MARGIN_PPM);
    int maxLag = (int) Math.ceil(searchPpm / axis.ppmPerPoint());
    double[] correlation = new double[2 * maxLag + 1];
    for (int lag = -maxLag; lag <= maxLag; lag++) {
      double sum = 0.0;
      for (int i = window[0]; i <= window[1]; i++) {
        int j = i + lag;
        if (j >= 0 && j < data.length) {
          sum += comb[i] * data[j];
        }
      }
      correlation[lag + maxLag] = sum;
    }
    int best = SpectralOps.argMax(correlation, 0, correlation.length - 1);
    double refined = SpectralOps.parabolicPeak(correlation, best) - maxLag;
    double shiftHz = refined * axis.hzPerPoint();
    LOGGER.debug("Cross-correlation shift %.3f Hz (%.4f ppm)", shiftHz, header.hzToPpm(shiftHz));
    return shiftHz;
  }

  public double estimateShift(Spectrum spectrum, Landmark landmark) {
    return estimateShift(spectrum, landmark.getCanonicalPpm());
  }

  /** References the spectrum: shifts it so that the landmark comb lines up with its canonical positions. */
  public Spectrum reference(Spectrum spectrum, double[] landmarkPpm) {
    return spectrum.freqShift(-estimateShift(spectrum, landmarkPpm));
  }

  private double[] comb(AcquisitionHeader header, double[] landmarkPpm) {
    double fwhmHz = header.ppmToHz(linewidthPpm);
    Spectrum synthetic = null;
    for (double ppm : landmarkPpm) {
      Spectrum peak = new Spectrum(header, SpectralOps.lorentzian(header, ppm, fwhmHz, 1.0, 0.0));
      synthetic = synthetic == null ? peak : synthetic.add(peak);
    }
    return synthetic.magnitudeSpectrum();
  }
}
