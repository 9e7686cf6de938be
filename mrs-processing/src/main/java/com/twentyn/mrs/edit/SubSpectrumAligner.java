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

package com.twentyn.mrs.edit;

import com.twentyn.mrs.signal.Spectrum;
import com.twentyn.mrs.util.LeastSquaresSolver;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Aligns edited sub-spectra to each other by minimising the difference of a reporter resonance that the editing
 * pulse leaves untouched.
 */
public class SubSpectrumAligner {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SubSpectrumAligner.class);

  public static final double[] CHO_REPORTER = {3.1, 3.3};
  public static final double[] NAA_REPORTER = {1.85, 2.25};
  private static final int MAX_ITERATIONS = 100;
  private static final int MAX_EVALUATIONS = 600;

  public static double[] reporterWindow(EditTarget target) {
    return target == EditTarget.GSH ? NAA_REPORTER.clone() : CHO_REPORTER.clone();
  }

  /**
   * Frequency- and phase-shifts moving so that its reporter matches the reference.
   * @return the aligned spectrum and the applied {frequency Hz, phase rad}
   */
  public Pair<Spectrum, double[]> align(final Spectrum reference, final Spectrum moving, EditTarget target) {
    double[] window = reporterWindow(target);
    final int[] range = reference.ppmAxis().indexRange(window[0], window[1]);
    final double[] referenceReal = reference.realSpectrum();

    LeastSquaresSolver.Residuals residuals = new LeastSquaresSolver.Residuals() {
      @Override
      public double[] value(double[] p) {
        double[] shifted = moving.freqPhaseShift(p[0], p[1]).realSpectrum();
        double[] r = new double[range[1] - range[0] + 1];
        for (int i = range[0]; i <= range[1]; i++) {
          r[i - range[0]] = shifted[i] - referenceReal[i];
        }
        return r;
      }
    };
    LeastSquaresSolver.Solution solution = new LeastSquaresSolver(MAX_ITERATIONS, MAX_EVALUATIONS)
        .withTypicalScale(new double[]{1.0, 1.0})
        .minimize(residuals, new double[]{0.0, 0.0});
    if (!solution.isFinite()) {
      LOGGER.warn("Sub-spectrum alignment on %.2f-%.2f ppm failed, leaving spectrum unaligned", window[0], window[1]);
      return Pair.of(moving, new double[]{0.0, 0.0});
    }
    double[] p = solution.getPoint();
    LOGGER.debug("Sub-spectrum alignment: %.3f Hz, %.4f rad", p[0], p[1]);
    return Pair.of(moving.freqPhaseShift(p[0], p[1]), p);
  }
}
