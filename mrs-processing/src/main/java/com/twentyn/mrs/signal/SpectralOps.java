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

package com.twentyn.mrs.signal;

import com.twentyn.mrs.exceptions.PreconditionViolationException;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;

import java.util.Arrays;
import java.util.List;

/**
 * Array-level spectral primitives.  All methods return new arrays and never modify their arguments.
 */
public class SpectralOps {
  private static final FastFourierTransformer FFT = new FastFourierTransformer(DftNormalization.STANDARD);
  // pi^2 / (4 ln 2): converts a Gaussian FWHM in Hz into the t^2 decay coefficient.
  public static final double FWHM_TO_GAUSS = Math.PI * Math.PI / (4.0 * Math.log(2.0));

  private SpectralOps() {
  }

  /** fftshift(fft(fid)). */
  public static Complex[] toSpectrum(Complex[] fid) {
    Complex[] transformed = FFT.transform(fid, TransformType.FORWARD);
    return shift(transformed, transformed.length / 2);
  }

  /** ifft(ifftshift(spectrum)). */
  public static Complex[] toFid(Complex[] spectrum) {
    Complex[] unshifted = shift(spectrum, spectrum.length - spectrum.length / 2);
    return FFT.transform(unshifted, TransformType.INVERSE);
  }

  private static Complex[] shift(Complex[] values, int by) {
    int n = values.length;
    Complex[] out = new Complex[n];
    for (int i = 0; i < n; i++) {
      out[(i + by) % n] = values[i];
    }
    return out;
  }

  /** Multiplies the FID by exp(i 2 pi hz t), moving every resonance up by hz. */
  public static Complex[] freqShift(Complex[] fid, double dwellTime, double hz) {
    Complex[] out = new Complex[fid.length];
    for (int i = 0; i < fid.length; i++) {
      double angle = 2.0 * Math.PI * hz * i * dwellTime;
      out[i] = fid[i].multiply(new Complex(Math.cos(angle), Math.sin(angle)));
    }
    return out;
  }

  public static Complex[] phaseShift(Complex[] values, double radians) {
    Complex rotation = new Complex(Math.cos(radians), Math.sin(radians));
    Complex[] out = new Complex[values.length];
    for (int i = 0; i < values.length; i++) {
      out[i] = values[i].multiply(rotation);
    }
    return out;
  }

  /** Frequency and zero-order phase correction in one pass. */
  public static Complex[] freqPhaseShift(Complex[] fid, double dwellTime, double hz, double radians) {
    Complex[] out = new Complex[fid.length];
    for (int i = 0; i < fid.length; i++) {
      double angle = 2.0 * Math.PI * hz * i * dwellTime + radians;
      out[i] = fid[i].multiply(new Complex(Math.cos(angle), Math.sin(angle)));
    }
    return out;
  }

  public static Complex[] scale(Complex[] values, double factor) {
    Complex[] out = new Complex[values.length];
    for (int i = 0; i < values.length; i++) {
      out[i] = values[i].multiply(factor);
    }
    return out;
  }

  public static Complex[] add(Complex[] a, Complex[] b) {
    requireSameLength(a, b);
    Complex[] out = new Complex[a.length];
    for (int i = 0; i < a.length; i++) {
      out[i] = a[i].add(b[i]);
    }
    return out;
  }

  public static Complex[] subtract(Complex[] a, Complex[] b) {
    requireSameLength(a, b);
    Complex[] out = new Complex[a.length];
    for (int i = 0; i < a.length; i++) {
      out[i] = a[i].subtract(b[i]);
    }
    return out;
  }

  /** Appends zeros so that the result has factor times the original length. */
  public static Complex[] zeroFill(Complex[] fid, int factor) {
    if (factor < 1 || Integer.bitCount(factor) != 1) {
      throw new PreconditionViolationException(
          String.format("Zero-fill factor must be a positive power of two, got %d", factor));
    }
    Complex[] out = new Complex[fid.length * factor];
    System.arraycopy(fid, 0, out, 0, fid.length);
    for (int i = fid.length; i < out.length; i++) {
      out[i] = Complex.ZERO;
    }
    return out;
  }

  /**
   * Frequency-domain DC correction: subtracts the mean of the spectrum taken over the outermost percentage of points
   * (split evenly between both edges).  100 uses every point.
   */
  public static Complex[] dcCorrect(Complex[] fid, double percentage) {
    if (!(percentage > 0.0) || percentage > 100.0) {
      throw new PreconditionViolationException(
          String.format("DC correction percentage must be in (0, 100], got %f", percentage));
    }
    Complex[] spectrum = toSpectrum(fid);
    int n = spectrum.length;
    int perEdge = Math.max(1, (int) Math.round(n * percentage / 200.0));
    double re = 0.0;
    double im = 0.0;
    int count = 0;
    for (int i = 0; i < n; i++) {
      if (i < perEdge || i >= n - perEdge) {
        re += spectrum[i].getReal();
        im += spectrum[i].getImaginary();
        count++;
      }
    }
    Complex offset = new Complex(re / count, im / count);
    Complex[] corrected = new Complex[n];
    for (int i = 0; i < n; i++) {
      corrected[i] = spectrum[i].subtract(offset);
    }
    return toFid(corrected);
  }

  /** Weighted mean of several FIDs; weights need not be normalised. */
  public static Complex[] weightedAverage(List<Complex[]> fids, double[] weights) {
    if (fids.isEmpty()) {
      throw new PreconditionViolationException("Cannot average an empty list of FIDs");
    }
    if (weights.length != fids.size()) {
      throw new PreconditionViolationException(
          String.format("Got %d weights for %d FIDs", weights.length, fids.size()));
    }
    int n = fids.get(0).length;
    double[] re = new double[n];
    double[] im = new double[n];
    double total = 0.0;
    for (int k = 0; k < fids.size(); k++) {
      Complex[] fid = fids.get(k);
      requireSameLength(fids.get(0), fid);
      double w = weights[k];
      total += w;
      for (int i = 0; i < n; i++) {
        re[i] += w * fid[i].getReal();
        im[i] += w * fid[i].getImaginary();
      }
    }
    if (!(total > 0.0)) {
      throw new PreconditionViolationException("Averaging weights must sum to a positive value");
    }
    Complex[] out = new Complex[n];
    for (int i = 0; i < n; i++) {
      out[i] = new Complex(re[i] / total, im[i] / total);
    }
    return out;
  }

  public static Complex[] average(List<Complex[]> fids) {
    double[] weights = new double[fids.size()];
    Arrays.fill(weights, 1.0);
    return weightedAverage(fids, weights);
  }

  /**
   * A Lorentzian resonance: amplitude * exp(i phase) * exp(i 2 pi f t) * exp(-pi fwhm t), f relative to 4.68 ppm.
   */
  public static Complex[] lorentzian(AcquisitionHeader header, double ppm, double fwhmHz, double amplitude,
                                     double phase) {
    return lineshape(header, ppm, fwhmHz, 0.0, amplitude, phase);
  }

  /** A Gaussian resonance whose spectral FWHM is fwhmHz. */
  public static Complex[] gaussian(AcquisitionHeader header, double ppm, double fwhmHz, double amplitude,
                                   double phase) {
    return lineshape(header, ppm, 0.0, fwhmHz, amplitude, phase);
  }

  /** Voigt-type resonance combining Lorentzian and Gaussian decay. */
  public static Complex[] lineshape(AcquisitionHeader header, double ppm, double lorentzFwhmHz, double gaussFwhmHz,
                                    double amplitude, double phase) {
    int n = header.getSampleCount();
    double dt = header.getDwellTime();
    double hz = header.ppmToHz(ppm - AcquisitionHeader.CENTER_PPM);
    Complex[] fid = new Complex[n];
    for (int i = 0; i < n; i++) {
      double t = i * dt;
      double decay = Math.exp(-Math.PI * lorentzFwhmHz * t - FWHM_TO_GAUSS * gaussFwhmHz * gaussFwhmHz * t * t);
      double angle = 2.0 * Math.PI * hz * t + phase;
      fid[i] = new Complex(amplitude * decay * Math.cos(angle), amplitude * decay * Math.sin(angle));
    }
    return fid;
  }

  public static double[] real(Complex[] values) {
    double[] out = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      out[i] = values[i].getReal();
    }
    return out;
  }

  public static double[] magnitude(Complex[] values) {
    double[] out = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      out[i] = values[i].abs();
    }
    return out;
  }

  public static boolean allFinite(Complex[] values) {
    for (Complex c : values) {
      if (c == null || c.isNaN() || c.isInfinite()) {
        return false;
      }
    }
    return true;
  }

  /** Index of the largest value in [from, to]. */
  public static int argMax(double[] values, int from, int to) {
    int best = from;
    for (int i = from + 1; i <= to; i++) {
      if (values[i] > values[best]) {
        best = i;
      }
    }
    return best;
  }

  /**
   * Sub-sample position of a maximum using a parabola through the neighbouring points.
   */
  public static double parabolicPeak(double[] values, int index) {
    if (index <= 0 || index >= values.length - 1) {
      return index;
    }
    double left = values[index - 1];
    double mid = values[index];
    double right = values[index + 1];
    double denominator = left - 2.0 * mid + right;
    if (denominator == 0.0) {
      return index;
    }
    double offset = 0.5 * (left - right) / denominator;
    if (Math.abs(offset) > 1.0) {
      return index;
    }
    return index + offset;
  }

  private static void requireSameLength(Complex[] a, Complex[] b) {
    if (a.length != b.length) {
      throw new PreconditionViolationException(
          String.format("Sample counts differ: %d vs %d", a.length, b.length));
    }
  }
}
