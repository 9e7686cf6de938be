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

import com.twentyn.mrs.exceptions.DataInconsistencyException;
import com.twentyn.mrs.signal.AcquisitionHeader;
import com.twentyn.mrs.signal.PpmAxis;
import com.twentyn.mrs.signal.SpectralOps;
import com.twentyn.mrs.signal.Spectrum;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import java.util.List;

/**
 * Linear combination model of one spectrum over a ppm window:
 * Re[ e^(i(ph0 + ph1 (ppm - 4.68))) * FFT( sum_j a_j b_j(t) e^(-pi l_j t - K g^2 t^2) e^(i 2 pi s_j t) ) ] + B c.
 *
 * Amplitudes a (non-negative) and baseline coefficients c are linear and are eliminated for every choice of the
 * nonlinear parameters: the data and basis columns are projected onto the orthogonal complement of the baseline, the
 * amplitudes solved there by NNLS, and the baseline fitted to what remains.
 */
class SpectralModel {
  static class Evaluation {
    private final double[] amplitudes;
    private final double[] baseline;
    private final double[] residual;
    private final double[] fitted;

    Evaluation(double[] amplitudes, double[] baseline, double[] residual, double[] fitted) {
      this.amplitudes = amplitudes;
      this.baseline = baseline;
      this.residual = residual;
      this.fitted = fitted;
    }

    double[] getAmplitudes() {
      return amplitudes;
    }

    double[] getBaseline() {
      return baseline;
    }

    double[] getResidual() {
      return residual;
    }

    double[] getFitted() {
      return fitted;
    }
  }

  private final BasisSet basis;
  private final List<String> names;
  private final Complex[][] basisFids;
  private final double[] time;
  private final int[] window;
  private final double[] windowPpm;
  private final double[] data;
  private final RealMatrix baselineDesign;
  private final RealMatrix baselineQ;
  private final DecompositionSolver baselineSolver;
  private final NonNegativeLeastSquares nnls = new NonNegativeLeastSquares();

  SpectralModel(Spectrum spectrum, BasisSet basis, double lowPpm, double highPpm, double knotSpacingPpm,
                int zeroFill) {
    AcquisitionHeader header = spectrum.getHeader();
    if (!header.sameGrid(basis.getHeader())) {
      throw new DataInconsistencyException(String.format(
          "Basis set on %s does not match data on %s; resample it first", basis.getHeader(), header));
    }
    Spectrum filled = spectrum.zeroFill(zeroFill);
    PpmAxis axis = filled.ppmAxis();
    this.basis = basis;
    this.names = basis.names();
    this.window = axis.indexRange(lowPpm, highPpm);
    if (window[1] - window[0] + 1 < 2) {
      throw new DataInconsistencyException(String.format(
          "Fit range %.2f-%.2f ppm holds no data points", lowPpm, highPpm));
    }
    this.windowPpm = axis.ppmValues(window[0], window[1]);
    double[] real = filled.realSpectrum();
    this.data = new double[windowPpm.length];
    System.arraycopy(real, window[0], data, 0, data.length);

    this.basisFids = new Complex[names.size()][];
    for (int j = 0; j < names.size(); j++) {
      basisFids[j] = SpectralOps.zeroFill(basis.get(names.get(j)).getFid(), zeroFill);
    }
    AcquisitionHeader filledHeader = filled.getHeader();
    this.time = new double[filledHeader.getSampleCount()];
    for (int i = 0; i < time.length; i++) {
      time[i] = filledHeader.timeAt(i);
    }

    this.baselineDesign = new BSplineBaseline(lowPpm, highPpm, knotSpacingPpm).designMatrix(windowPpm);
    QRDecomposition qr = new QRDecomposition(baselineDesign);
    int k = baselineDesign.getColumnDimension();
    this.baselineQ = qr.getQ().getSubMatrix(0, windowPpm.length - 1, 0, k - 1);
    this.baselineSolver = qr.getSolver();
  }

  List<String> getNames() {
    return names;
  }

  BasisSet getBasis() {
    return basis;
  }

  double[] getWindowPpm() {
    return windowPpm.clone();
  }

  double[] getData() {
    return data.clone();
  }

  int getBaselineSize() {
    return baselineDesign.getColumnDimension();
  }

  /** Real model columns over the fit window for the given nonlinear parameters. */
  RealMatrix basisColumns(double[] p, ParameterLayout layout) {
    double ph0 = p[ParameterLayout.PH0];
    double ph1 = p[ParameterLayout.PH1];
    double gauss = p[ParameterLayout.GAUSS];
    RealMatrix columns = new Array2DRowRealMatrix(windowPpm.length, names.size());
    for (int j = 0; j < names.size(); j++) {
      String name = names.get(j);
      double lorentz = layout.lorentz(p, name);
      double shift = layout.shift(p, name);
      Complex[] fid = basisFids[j];
      Complex[] modulated = new Complex[fid.length];
      for (int i = 0; i < fid.length; i++) {
        double t = time[i];
        double decay = Math.exp(-Math.PI * lorentz * t - SpectralOps.FWHM_TO_GAUSS * gauss * gauss * t * t);
        double angle = 2.0 * Math.PI * shift * t;
        modulated[i] = fid[i].multiply(new Complex(decay * Math.cos(angle), decay * Math.sin(angle)));
      }
      Complex[] spectrum = SpectralOps.toSpectrum(modulated);
      for (int i = 0; i < windowPpm.length; i++) {
        double phase = ph0 + ph1 * (windowPpm[i] - AcquisitionHeader.CENTER_PPM);
        Complex value = spectrum[window[0] + i];
        columns.setEntry(i, j, value.getReal() * Math.cos(phase) - value.getImaginary() * Math.sin(phase));
      }
    }
    return columns;
  }

  Evaluation evaluate(double[] p, ParameterLayout layout) {
    RealMatrix columns = basisColumns(p, layout);
    RealVector y = new ArrayRealVector(data, false);
    RealMatrix projectedColumns = columns.subtract(baselineQ.multiply(baselineQ.transpose().multiply(columns)));
    RealVector projectedData = y.subtract(baselineQ.operate(baselineQ.transpose().operate(y)));

    double[] amplitudes = nnls.solve(projectedColumns, projectedData.toArray());
    RealVector metabolites = columns.operate(new ArrayRealVector(amplitudes, false));
    RealVector baseline = baselineSolver.solve(y.subtract(metabolites));
    RealVector fitted = metabolites.add(baselineDesign.operate(baseline));
    return new Evaluation(amplitudes, baseline.toArray(), y.subtract(fitted).toArray(), fitted.toArray());
  }
}
