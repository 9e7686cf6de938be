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

package com.twentyn.mrs.align;

import com.twentyn.mrs.signal.AcquisitionHeader;
import com.twentyn.mrs.signal.PpmAxis;
import com.twentyn.mrs.signal.SpectralOps;
import org.apache.commons.math3.complex.Complex;

import java.util.List;

/**
 * Tracks the position of a landmark resonance (creatine by default) over the averages of an acquisition.
 */
public class DriftMeter {
  public static final double CR_LOW_PPM = 2.9;
  public static final double CR_HIGH_PPM = 3.1;
  public static final double CR_NOMINAL_PPM = 3.02;

  private final double lowPpm;
  private final double highPpm;

  public DriftMeter() {
    this(CR_LOW_PPM, CR_HIGH_PPM);
  }

  public DriftMeter(double lowPpm, double highPpm) {
    this.lowPpm = lowPpm;
    this.highPpm = highPpm;
  }

  /** Landmark position in ppm for every FID, from the magnitude maximum refined with a parabola. */
  public double[] measureDrift(List<Complex[]> fids, AcquisitionHeader header) {
    PpmAxis axis = header.ppmAxis();
    int[] range = axis.indexRange(lowPpm, highPpm);
    double[] drift = new double[fids.size()];
    for (int k = 0; k < fids.size(); k++) {
      if (range[0] > range[1]) {
        drift[k] = Double.NaN;
        continue;
      }
      double[] magnitude = SpectralOps.magnitude(SpectralOps.toSpectrum(fids.get(k)));
      int best = SpectralOps.argMax(magnitude, range[0], range[1]);
      drift[k] = axis.ppmAt(SpectralOps.parabolicPeak(magnitude, best));
    }
    return drift;
  }

  /** Mean deviation of a drift series from the nominal creatine position. */
  public static double meanDeviation(double[] drift) {
    if (drift.length == 0) {
      return Double.NaN;
    }
    double sum = 0.0;
    for (double d : drift) {
      sum += d - CR_NOMINAL_PPM;
    }
    return sum / drift.length;
  }

  /** Interleaves two drift series a0, b0, a1, b1, ... as acquired in alternating sub-experiments. */
  public static double[] interleave(double[] a, double[] b) {
    double[] out = new double[a.length + b.length];
    int i = 0;
    int ia = 0;
    int ib = 0;
    while (ia < a.length || ib < b.length) {
      if (ia < a.length) {
        out[i++] = a[ia++];
      }
      if (ib < b.length) {
        out[i++] = b[ib++];
      }
    }
    return out;
  }
}
