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

import com.twentyn.mrs.exceptions.DataInconsistencyException;
import com.twentyn.mrs.signal.PpmAxis;
import com.twentyn.mrs.signal.Spectrum;
import com.twentyn.mrs.signal.TimeDomainSignal;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.math3.complex.Complex;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Klose eddy-current correction.  The unwrapped phase trajectory of a water-unsuppressed reference FID is removed
 * from the metabolite FIDs and from the reference itself.
 */
public class EddyCurrentCorrector {
  private static final Logger LOGGER = LogManager.getFormatterLogger(EddyCurrentCorrector.class);

  // Window holding the landmark whose phase decides whether the correction is kept.
  public static final double SAFEGUARD_LOW_PPM = 1.8;
  public static final double SAFEGUARD_HIGH_PPM = 2.2;

  /**
   * Corrects every FID of a signal.  The reference must already be a single spectrum (one sub-spectrum, one average,
   * one coil).
   * @return the corrected signal and the corrected reference
   */
  public Pair<TimeDomainSignal, Spectrum> correct(TimeDomainSignal signal, TimeDomainSignal reference) {
    reference.requireCombined("Eddy-current reference");
    final Complex[] conjugatePhase = conjugatePhase(reference.singleSpectrum().getFid(), signal.getHeader()
        .getSampleCount());
    TimeDomainSignal corrected = signal.transform(fid -> applyPhase(fid, conjugatePhase));
    Spectrum correctedReference = reference.singleSpectrum().withFid(
        applyPhase(reference.singleSpectrum().getFid(), conjugatePhase));
    return Pair.of(corrected, correctedReference);
  }

  public Pair<Spectrum, Spectrum> correct(Spectrum spectrum, Spectrum reference) {
    Complex[] conjugatePhase = conjugatePhase(reference.getFid(), spectrum.size());
    return Pair.of(spectrum.withFid(applyPhase(spectrum.getFid(), conjugatePhase)),
        reference.withFid(applyPhase(reference.getFid(), conjugatePhase)));
  }

  /**
   * Decision rule for un-edited data: the correction is kept when twice the landmark phase before correction exceeds
   * the landmark phase after it.  Phases are taken at the magnitude maximum of 1.8-2.2 ppm.
   */
  public static boolean shouldKeep(Spectrum before, Spectrum after) {
    double phaseBefore = landmarkPhaseDegrees(before);
    double phaseAfter = landmarkPhaseDegrees(after);
    boolean keep = 2.0 * Math.abs(phaseBefore) > Math.abs(phaseAfter);
    LOGGER.debug("Landmark phase %.2f deg before, %.2f deg after eddy-current correction: %s",
        phaseBefore, phaseAfter, keep ? "keeping" : "reverting");
    return keep;
  }

  static double landmarkPhaseDegrees(Spectrum spectrum) {
    PpmAxis axis = spectrum.ppmAxis();
    int[] range = axis.indexRange(SAFEGUARD_LOW_PPM, SAFEGUARD_HIGH_PPM);
    Complex[] values = spectrum.getSpectrum();
    int best = range[0];
    for (int i = range[0]; i <= range[1]; i++) {
      if (values[i].abs() > values[best].abs()) {
        best = i;
      }
    }
    return -Math.toDegrees(values[best].getArgument());
  }

  /** exp(-i * unwrap(angle(reference))) for the first n samples. */
  static Complex[] conjugatePhase(Complex[] reference, int n) {
    if (reference.length != n) {
      throw new DataInconsistencyException(String.format(
          "Eddy-current reference has %d samples, signal has %d", reference.length, n));
    }
    double[] phase = unwrap(reference);
    Complex[] out = new Complex[n];
    for (int i = 0; i < n; i++) {
      out[i] = new Complex(Math.cos(-phase[i]), Math.sin(-phase[i]));
    }
    return out;
  }

  static double[] unwrap(Complex[] values) {
    double[] phase = new double[values.length];
    double offset = 0.0;
    double previous = 0.0;
    for (int i = 0; i < values.length; i++) {
      double raw = values[i].getArgument();
      if (i > 0) {
        double delta = raw - previous;
        if (delta > Math.PI) {
          offset -= 2.0 * Math.PI;
        } else if (delta < -Math.PI) {
          offset += 2.0 * Math.PI;
        }
      }
      previous = raw;
      phase[i] = raw + offset;
    }
    return phase;
  }

  private static Complex[] applyPhase(Complex[] fid, Complex[] conjugatePhase) {
    Complex[] out = new Complex[fid.length];
    for (int i = 0; i < fid.length; i++) {
      out[i] = fid[i].multiply(conjugatePhase[i]);
    }
    return out;
  }
}
