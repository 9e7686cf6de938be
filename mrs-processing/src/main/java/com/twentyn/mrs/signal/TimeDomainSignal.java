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

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Raw complex FID samples organised as [sub-spectrum][average][coil][time].  The axis order is fixed and every FID
 * has the header's sample count.  Instances are immutable; operations that combine or select data return new
 * signals.
 */
public class TimeDomainSignal {
  private final AcquisitionHeader header;
  private final Complex[][][][] data;
  private final boolean preAveraged;

  public TimeDomainSignal(AcquisitionHeader header, Complex[][][][] data, boolean preAveraged) {
    if (header == null || data == null) {
      throw new PreconditionViolationException("Signal header and data must be supplied");
    }
    if (data.length == 0) {
      throw new PreconditionViolationException("A signal needs at least one sub-spectrum");
    }
    int averages = data[0].length;
    int coils = averages == 0 ? 0 : data[0][0].length;
    for (int s = 0; s < data.length; s++) {
      if (data[s].length != averages) {
        throw new PreconditionViolationException(String.format(
            "Sub-spectrum %d has %d averages, expected %d", s, data[s].length, averages));
      }
      for (int a = 0; a < averages; a++) {
        if (data[s][a].length != coils || coils == 0) {
          throw new PreconditionViolationException(String.format(
              "Average %d of sub-spectrum %d has %d coils, expected %d", a, s, data[s][a].length, coils));
        }
        for (int c = 0; c < coils; c++) {
          if (data[s][a][c].length != header.getSampleCount()) {
            throw new PreconditionViolationException(String.format(
                "FID [%d][%d][%d] has %d samples, header declares %d",
                s, a, c, data[s][a][c].length, header.getSampleCount()));
          }
        }
      }
    }
    this.header = header;
    this.data = deepCopy(data);
    this.preAveraged = preAveraged;
  }

  /** One sub-spectrum, one coil, one FID per average. */
  public static TimeDomainSignal ofAverages(AcquisitionHeader header, List<Complex[]> averages) {
    Complex[][][][] data = new Complex[1][averages.size()][1][];
    for (int a = 0; a < averages.size(); a++) {
      data[0][a][0] = averages.get(a);
    }
    return new TimeDomainSignal(header, data, false);
  }

  /** Sub-spectra, each holding one coil and one FID per average. */
  public static TimeDomainSignal ofSubSpectra(AcquisitionHeader header, List<List<Complex[]>> subSpectra) {
    Complex[][][][] data = new Complex[subSpectra.size()][][][];
    for (int s = 0; s < subSpectra.size(); s++) {
      List<Complex[]> averages = subSpectra.get(s);
      data[s] = new Complex[averages.size()][1][];
      for (int a = 0; a < averages.size(); a++) {
        data[s][a][0] = averages.get(a);
      }
    }
    return new TimeDomainSignal(header, data, false);
  }

  /** A signal whose averages were already combined upstream. */
  public static TimeDomainSignal preAveraged(AcquisitionHeader header, Complex[] fid) {
    return new TimeDomainSignal(header, new Complex[][][][]{{{fid}}}, true);
  }

  public AcquisitionHeader getHeader() {
    return header;
  }

  public int getSubSpectrumCount() {
    return data.length;
  }

  public int getAverageCount() {
    return data[0].length;
  }

  public int getCoilCount() {
    return data[0].length == 0 ? 0 : data[0][0].length;
  }

  public boolean isPreAveraged() {
    return preAveraged;
  }

  public boolean isEmpty() {
    return getAverageCount() == 0;
  }

  public Complex[] getFid(int subSpectrum, int average, int coil) {
    return data[subSpectrum][average][coil].clone();
  }

  /** FIDs of every average of a sub-spectrum, for a coil-combined signal. */
  public List<Complex[]> averagesOf(int subSpectrum) {
    requireSingleCoil();
    List<Complex[]> fids = new ArrayList<>(getAverageCount());
    for (Complex[][] average : data[subSpectrum]) {
      fids.add(average[0].clone());
    }
    return fids;
  }

  public void requireNonEmpty() {
    if (isEmpty()) {
      throw new PreconditionViolationException("Signal has zero averages; nothing to process");
    }
  }

  private void requireSingleCoil() {
    if (getCoilCount() > 1) {
      throw new PreconditionViolationException(String.format(
          "Signal still has %d receiver coils; combine coils first", getCoilCount()));
    }
  }

  /**
   * Fails unless the signal holds exactly one FID: one sub-spectrum, one average and one coil.
   */
  public void requireCombined(String role) {
    requireNonEmpty();
    if (getSubSpectrumCount() != 1 || getAverageCount() != 1 || getCoilCount() != 1) {
      throw new PreconditionViolationException(String.format(
          "%s must be combined to a single spectrum first (sub-spectra=%d, averages=%d, coils=%d)",
          role, getSubSpectrumCount(), getAverageCount(), getCoilCount()));
    }
  }

  public Spectrum singleSpectrum() {
    requireCombined("Signal");
    return new Spectrum(header, data[0][0][0]);
  }

  public TimeDomainSignal subSpectrum(int index) {
    return new TimeDomainSignal(header, new Complex[][][][]{data[index]}, preAveraged);
  }

  /** Selects the averages at the given indices from every sub-spectrum. */
  public TimeDomainSignal selectAverages(int[] indices) {
    Complex[][][][] selected = new Complex[data.length][indices.length][][];
    for (int s = 0; s < data.length; s++) {
      for (int i = 0; i < indices.length; i++) {
        selected[s][i] = data[s][indices[i]];
      }
    }
    return new TimeDomainSignal(header, selected, preAveraged);
  }

  /** Applies an FID-level operation to every FID of the signal. */
  public TimeDomainSignal transform(UnaryOperator<Complex[]> operation) {
    Complex[][][][] out = new Complex[data.length][][][];
    for (int s = 0; s < data.length; s++) {
      out[s] = new Complex[data[s].length][][];
      for (int a = 0; a < data[s].length; a++) {
        out[s][a] = new Complex[data[s][a].length][];
        for (int c = 0; c < data[s][a].length; c++) {
          out[s][a][c] = operation.apply(data[s][a][c]);
        }
      }
    }
    return new TimeDomainSignal(header, out, preAveraged);
  }

  public TimeDomainSignal scale(final double factor) {
    return transform(fid -> SpectralOps.scale(fid, factor));
  }

  /** Mean FID over all averages of one sub-spectrum of a coil-combined signal. */
  public Spectrum averageOf(int subSpectrum) {
    requireNonEmpty();
    return new Spectrum(header, SpectralOps.average(averagesOf(subSpectrum)));
  }

  /**
   * Combines receiver coils.  Each coil is phased by its first FID point (taken from the coil's mean over all
   * averages of the first sub-spectrum) and weighted by that point's magnitude, weights normalised to unit
   * Euclidean norm.
   */
  public TimeDomainSignal combineCoils() {
    requireNonEmpty();
    int coils = getCoilCount();
    if (coils == 1) {
      return this;
    }
    double[] phase = new double[coils];
    double[] weight = new double[coils];
    double norm = 0.0;
    for (int c = 0; c < coils; c++) {
      Complex first = Complex.ZERO;
      for (Complex[][] average : data[0]) {
        first = first.add(average[c][0]);
      }
      phase[c] = first.getArgument();
      weight[c] = first.abs();
      norm += weight[c] * weight[c];
    }
    norm = Math.sqrt(norm);
    for (int c = 0; c < coils; c++) {
      weight[c] = norm > 0.0 ? weight[c] / norm : 1.0 / Math.sqrt(coils);
    }

    int n = header.getSampleCount();
    Complex[][][][] combined = new Complex[data.length][getAverageCount()][1][];
    for (int s = 0; s < data.length; s++) {
      for (int a = 0; a < getAverageCount(); a++) {
        Complex[] sum = new Complex[n];
        for (int i = 0; i < n; i++) {
          sum[i] = Complex.ZERO;
        }
        for (int c = 0; c < coils; c++) {
          Complex factor = new Complex(Math.cos(-phase[c]), Math.sin(-phase[c])).multiply(weight[c]);
          Complex[] fid = data[s][a][c];
          for (int i = 0; i < n; i++) {
            sum[i] = sum[i].add(fid[i].multiply(factor));
          }
        }
        combined[s][a][0] = sum;
      }
    }
    return new TimeDomainSignal(header, combined, preAveraged);
  }

  private static Complex[][][][] deepCopy(Complex[][][][] source) {
    Complex[][][][] copy = new Complex[source.length][][][];
    for (int s = 0; s < source.length; s++) {
      copy[s] = new Complex[source[s].length][][];
      for (int a = 0; a < source[s].length; a++) {
        copy[s][a] = new Complex[source[s][a].length][];
        for (int c = 0; c < source[s][a].length; c++) {
          copy[s][a][c] = source[s][a][c].clone();
        }
      }
    }
    return copy;
  }
}
