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

package com.twentyn.mrs.test.util;

import com.twentyn.mrs.fit.BasisFunction;
import com.twentyn.mrs.fit.BasisSet;
import com.twentyn.mrs.signal.AcquisitionHeader;
import com.twentyn.mrs.signal.SpectralOps;
import com.twentyn.mrs.signal.Spectrum;
import com.twentyn.mrs.signal.TimeDomainSignal;
import org.apache.commons.math3.complex.Complex;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Noise-free synthetic FIDs and spectra shared by the tests.  All signals use a 3 T header with a 2000 Hz spectral
 * width unless a sample count is given.
 */
public class SyntheticSignals {
  public static final double FIELD_T = 3.0;
  public static final double SPECTRAL_WIDTH_HZ = 2000.0;
  public static final int SAMPLES = 2048;

  public static final double NAA_PPM = 2.008;
  public static final double CR_PPM = 3.027;
  public static final double CHO_PPM = 3.20;

  public static AcquisitionHeader header() {
    return header(SAMPLES);
  }

  public static AcquisitionHeader header(int samples) {
    return AcquisitionHeader.forField(FIELD_T, SPECTRAL_WIDTH_HZ, samples, 30.0, 2000.0);
  }

  /** Sum of Lorentzians; each peak is {ppm, fwhm Hz, amplitude}. */
  public static Complex[] lorentzians(AcquisitionHeader header, double[]... peaks) {
    Complex[] fid = zeros(header.getSampleCount());
    for (double[] peak : peaks) {
      fid = SpectralOps.add(fid, SpectralOps.lorentzian(header, peak[0], peak[1], peak[2], 0.0));
    }
    return fid;
  }

  /** NAA, creatine and choline singlets with 4 Hz linewidth. */
  public static Complex[] brain(AcquisitionHeader header) {
    return lorentzians(header, new double[]{NAA_PPM, 4.0, 3.0}, new double[]{CR_PPM, 4.0, 2.0},
        new double[]{CHO_PPM, 4.0, 1.5});
  }

  public static Spectrum spectrum(AcquisitionHeader header, double[]... peaks) {
    return new Spectrum(header, lorentzians(header, peaks));
  }

  public static Complex[] zeros(int n) {
    Complex[] out = new Complex[n];
    Arrays.fill(out, Complex.ZERO);
    return out;
  }

  /** A single non-zero sample; its spectrum is a unit-magnitude phase ramp. */
  public static Complex[] spike(int n, int index, double amplitude) {
    Complex[] out = zeros(n);
    out[index] = new Complex(amplitude, 0.0);
    return out;
  }

  /** Copies of one FID, each moved by a random frequency offset (uniform in +/- maxDriftHz). */
  public static List<Complex[]> driftingAverages(AcquisitionHeader header, Complex[] fid, int count,
                                                 double maxDriftHz, long seed) {
    Random random = new Random(seed);
    List<Complex[]> averages = new ArrayList<>(count);
    for (int k = 0; k < count; k++) {
      double drift = (2.0 * random.nextDouble() - 1.0) * maxDriftHz;
      averages.add(SpectralOps.freqShift(fid, header.getDwellTime(), drift));
    }
    return averages;
  }

  public static List<Complex[]> copies(Complex[] fid, int count) {
    List<Complex[]> averages = new ArrayList<>(count);
    for (int k = 0; k < count; k++) {
      averages.add(fid.clone());
    }
    return averages;
  }

  public static TimeDomainSignal averages(AcquisitionHeader header, Complex[] fid, int count) {
    return TimeDomainSignal.ofAverages(header, copies(fid, count));
  }

  public static TimeDomainSignal empty(AcquisitionHeader header) {
    return new TimeDomainSignal(header, new Complex[1][0][][], false);
  }

  /** Basis set of 2 Hz Lorentzian singlets named NAA, Cr and Cho. */
  public static BasisSet singletBasis(AcquisitionHeader header) {
    return BasisSet.of(header, Arrays.asList(
        new BasisFunction("NAA", header, SpectralOps.lorentzian(header, NAA_PPM, 2.0, 1.0, 0.0)),
        new BasisFunction("Cr", header, SpectralOps.lorentzian(header, CR_PPM, 2.0, 1.0, 0.0)),
        new BasisFunction("Cho", header, SpectralOps.lorentzian(header, CHO_PPM, 2.0, 1.0, 0.0))));
  }

  public static double maxAbsDifference(Complex[] a, Complex[] b) {
    double max = 0.0;
    for (int i = 0; i < a.length; i++) {
      max = Math.max(max, a[i].subtract(b[i]).abs());
    }
    return max;
  }

  public static double maxAbs(Complex[] values) {
    double max = 0.0;
    for (Complex c : values) {
      max = Math.max(max, c.abs());
    }
    return max;
  }

  /** ppm of the largest real value in the window, refined with a parabola. */
  public static double peakPpm(Spectrum spectrum, double lowPpm, double highPpm) {
    int[] range = spectrum.ppmAxis().indexRange(lowPpm, highPpm);
    double[] real = spectrum.realSpectrum();
    int best = SpectralOps.argMax(real, range[0], range[1]);
    return spectrum.ppmAxis().ppmAt(SpectralOps.parabolicPeak(real, best));
  }
}
