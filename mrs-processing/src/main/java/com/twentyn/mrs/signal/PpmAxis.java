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

/**
 * Frequency axis of an fftshift-ed spectrum.  Index k maps to (k - n/2) * sw / n Hz, and ppm increases with index:
 * ppm = 4.68 + Hz / txMHz.
 */
public class PpmAxis {
  private final int size;
  private final double hzPerPoint;
  private final double hzPerPpm;

  public PpmAxis(AcquisitionHeader header) {
    this.size = header.getSampleCount();
    this.hzPerPoint = header.getSpectralWidthHz() / size;
    this.hzPerPpm = header.getHzPerPpm();
  }

  public int size() {
    return size;
  }

  public double hzPerPoint() {
    return hzPerPoint;
  }

  public double ppmPerPoint() {
    return hzPerPoint / hzPerPpm;
  }

  public double hz(int index) {
    return (index - size / 2) * hzPerPoint;
  }

  public double ppm(int index) {
    return AcquisitionHeader.CENTER_PPM + hz(index) / hzPerPpm;
  }

  /** Chemical shift at a fractional index. */
  public double ppmAt(double fractionalIndex) {
    return AcquisitionHeader.CENTER_PPM + (fractionalIndex - size / 2) * hzPerPoint / hzPerPpm;
  }

  /** Fractional index of a ppm value; may fall outside [0, size). */
  public double fractionalIndex(double ppm) {
    return (ppm - AcquisitionHeader.CENTER_PPM) * hzPerPpm / hzPerPoint + size / 2;
  }

  public int nearestIndex(double ppm) {
    long idx = Math.round(fractionalIndex(ppm));
    return (int) Math.max(0, Math.min(size - 1, idx));
  }

  /**
   * Inclusive index bounds of all points whose ppm lies in [lowPpm, highPpm].  Returns an empty range ({1, 0}) when
   * the window misses the axis.
   */
  public int[] indexRange(double lowPpm, double highPpm) {
    double lo = Math.min(lowPpm, highPpm);
    double hi = Math.max(lowPpm, highPpm);
    int from = (int) Math.ceil(fractionalIndex(lo) - 1e-9);
    int to = (int) Math.floor(fractionalIndex(hi) + 1e-9);
    from = Math.max(0, from);
    to = Math.min(size - 1, to);
    if (from > to) {
      return new int[]{1, 0};
    }
    return new int[]{from, to};
  }

  public double[] ppmValues() {
    double[] values = new double[size];
    for (int i = 0; i < size; i++) {
      values[i] = ppm(i);
    }
    return values;
  }

  public double[] ppmValues(int from, int to) {
    double[] values = new double[Math.max(0, to - from + 1)];
    for (int i = from; i <= to; i++) {
      values[i - from] = ppm(i);
    }
    return values;
  }
}
