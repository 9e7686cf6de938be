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

package com.twentyn.mrs.fit;

import com.twentyn.mrs.exceptions.PreconditionViolationException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Uniform cubic B-spline design matrix over a ppm window.  The window is split into m = ceil(range / spacing)
 * intervals of equal width and the m + 3 cubic B-splines whose support touches it form the baseline basis; a smaller
 * knot spacing gives a more flexible baseline.
 */
public class BSplineBaseline {
  public static final double DEFAULT_KNOT_SPACING_PPM = 0.4;

  private final double lowPpm;
  private final double highPpm;
  private final int intervals;
  private final double width;

  public BSplineBaseline(double lowPpm, double highPpm, double knotSpacingPpm) {
    if (!(highPpm > lowPpm) || !(knotSpacingPpm > 0.0)) {
      throw new PreconditionViolationException(String.format(
          "Invalid baseline definition: %.3f-%.3f ppm with knot spacing %.3f", lowPpm, highPpm, knotSpacingPpm));
    }
    this.lowPpm = lowPpm;
    this.highPpm = highPpm;
    this.intervals = Math.max(1, (int) Math.ceil((highPpm - lowPpm) / knotSpacingPpm - 1e-9));
    this.width = (highPpm - lowPpm) / intervals;
  }

  public int getFunctionCount() {
    return intervals + 3;
  }

  public double getLowPpm() {
    return lowPpm;
  }

  public double getHighPpm() {
    return highPpm;
  }

  /** Rows follow the given ppm values, one column per spline. */
  public RealMatrix designMatrix(double[] ppm) {
    RealMatrix design = new Array2DRowRealMatrix(ppm.length, getFunctionCount());
    for (int i = 0; i < ppm.length; i++) {
      double x = (ppm[i] - lowPpm) / width;
      for (int j = 0; j < getFunctionCount(); j++) {
        design.setEntry(i, j, cardinal(x - j + 3.0));
      }
    }
    return design;
  }

  public double[] evaluate(double[] ppm, double[] coefficients) {
    RealMatrix design = designMatrix(ppm);
    return design.operate(coefficients);
  }

  // Cardinal cubic B-spline supported on [0, 4).
  static double cardinal(double t) {
    if (t < 0.0 || t >= 4.0) {
      return 0.0;
    }
    if (t < 1.0) {
      return t * t * t / 6.0;
    }
    if (t < 2.0) {
      double u = t - 1.0;
      return (-3.0 * u * u * u + 3.0 * u * u + 3.0 * u + 1.0) / 6.0;
    }
    if (t < 3.0) {
      double u = t - 2.0;
      return (3.0 * u * u * u - 6.0 * u * u + 4.0) / 6.0;
    }
    double u = 4.0 - t;
    return u * u * u / 6.0;
  }
}
