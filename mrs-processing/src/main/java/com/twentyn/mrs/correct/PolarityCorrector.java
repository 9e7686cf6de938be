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

package com.twentyn.mrs.correct;

import com.twentyn.mrs.signal.PpmAxis;
import com.twentyn.mrs.signal.Spectrum;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Detects inverted spectra (as produced by some water-suppression schemes) from the shape of a known resonance and
 * flips them.
 */
public class PolarityCorrector {
  private static final Logger LOGGER = LogManager.getFormatterLogger(PolarityCorrector.class);

  public static final double NAA_LOW_PPM = 1.9;
  public static final double NAA_HIGH_PPM = 2.1;
  public static final double CR_LOW_PPM = 2.8;
  public static final double CR_HIGH_PPM = 3.2;

  /**
   * |max(real)| - |min(real)| of the spectrum in the window; negative means the resonance points down.
   */
  public static double polarityResidual(Spectrum spectrum, double lowPpm, double highPpm) {
    PpmAxis axis = spectrum.ppmAxis();
    int[] range = axis.indexRange(lowPpm, highPpm);
    if (range[0] > range[1]) {
      return 0.0;
    }
    double[] real = spectrum.realSpectrum();
    double max = Double.NEGATIVE_INFINITY;
    double min = Double.POSITIVE_INFINITY;
    for (int i = range[0]; i <= range[1]; i++) {
      max = Math.max(max, real[i]);
      min = Math.min(min, real[i]);
    }
    return Math.abs(max) - Math.abs(min);
  }

  public static boolean isInverted(Spectrum spectrum, double lowPpm, double highPpm) {
    return polarityResidual(spectrum, lowPpm, highPpm) < 0.0;
  }

  /**
   * @return the corrected spectrum and whether it was flipped
   */
  public Pair<Spectrum, Boolean> correct(Spectrum spectrum, double lowPpm, double highPpm) {
    if (isInverted(spectrum, lowPpm, highPpm)) {
      LOGGER.info("Negative polarity detected in %.2f-%.2f ppm, scaling spectrum by -1", lowPpm, highPpm);
      return Pair.of(spectrum.scale(-1.0), Boolean.TRUE);
    }
    return Pair.of(spectrum, Boolean.FALSE);
  }
}
