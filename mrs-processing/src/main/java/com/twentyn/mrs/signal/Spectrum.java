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
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.math3.complex.Complex;

/**
 * A single combined FID together with its acquisition header.  Instances are immutable: every operation returns a new
 * Spectrum.  The frequency-domain representation is computed on first use and cached.
 */
public class Spectrum {
  private final AcquisitionHeader header;
  private final Complex[] fid;
  private Complex[] spectrum;

  public Spectrum(AcquisitionHeader header, Complex[] fid) {
    if (fid.length != header.getSampleCount()) {
      throw new PreconditionViolationException(String.format(
          "FID has %d samples but header declares %d", fid.length, header.getSampleCount()));
    }
    this.header = header;
    this.fid = fid.clone();
  }

  public static Spectrum fromFrequencyDomain(AcquisitionHeader header, Complex[] spectrum) {
    return new Spectrum(header, SpectralOps.toFid(spectrum));
  }

  public AcquisitionHeader getHeader() {
    return header;
  }

  public int size() {
    return fid.length;
  }

  public PpmAxis ppmAxis() {
    return header.ppmAxis();
  }

  public Complex[] getFid() {
    return fid.clone();
  }

  public Complex[] getSpectrum() {
    return frequencyDomain().clone();
  }

  public double[] realSpectrum() {
    return SpectralOps.real(frequencyDomain());
  }

  public double[] magnitudeSpectrum() {
    return SpectralOps.magnitude(frequencyDomain());
  }

  private synchronized Complex[] frequencyDomain() {
    if (spectrum == null) {
      spectrum = SpectralOps.toSpectrum(fid);
    }
    return spectrum;
  }

  /**
   * Extracts the spectral points whose chemical shift lies in [lowPpm, highPpm] as (ppm values, spectral values).
   */
  public Pair<double[], Complex[]> freqRange(double lowPpm, double highPpm) {
    PpmAxis axis = ppmAxis();
    int[] range = axis.indexRange(lowPpm, highPpm);
    int count = Math.max(0, range[1] - range[0] + 1);
    Complex[] values = new Complex[count];
    System.arraycopy(frequencyDomain(), range[0], values, 0, count);
    return Pair.of(axis.ppmValues(range[0], range[1]), values);
  }

  public Spectrum withFid(Complex[] newFid) {
    return new Spectrum(header, newFid);
  }

  public Spectrum freqShift(double hz) {
    return withFid(SpectralOps.freqShift(fid, header.getDwellTime(), hz));
  }

  public Spectrum phaseShift(double radians) {
    return withFid(SpectralOps.phaseShift(fid, radians));
  }

  public Spectrum freqPhaseShift(double hz, double radians) {
    return withFid(SpectralOps.freqPhaseShift(fid, header.getDwellTime(), hz, radians));
  }

  public Spectrum scale(double factor) {
    return withFid(SpectralOps.scale(fid, factor));
  }

  public Spectrum add(Spectrum other) {
    requireSameGrid(other);
    return withFid(SpectralOps.add(fid, other.fid));
  }

  public Spectrum subtract(Spectrum other) {
    requireSameGrid(other);
    return withFid(SpectralOps.subtract(fid, other.fid));
  }

  public Spectrum zeroFill(int factor) {
    Complex[] filled = SpectralOps.zeroFill(fid, factor);
    return new Spectrum(header.withSampleCount(filled.length), filled);
  }

  public Spectrum dcCorrect(double percentage) {
    return withFid(SpectralOps.dcCorrect(fid, percentage));
  }

  public boolean isFinite() {
    return SpectralOps.allFinite(fid);
  }

  private void requireSameGrid(Spectrum other) {
    if (!header.sameGrid(other.header)) {
      throw new PreconditionViolationException(String.format(
          "Spectra live on different grids: %s vs %s", header, other.header));
    }
  }
}
