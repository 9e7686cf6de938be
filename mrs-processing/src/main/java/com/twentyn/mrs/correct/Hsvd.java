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

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Hankel singular value decomposition of an FID into a sum of exponentially damped complex sinusoids.
 *
 * Complex matrices are handled through their real embedding [[Re, -Im], [Im, Re]], whose singular values are those
 * of the complex matrix, each repeated twice, and whose eigenvalues are the complex eigenvalues together with their
 * conjugates.
 */
public class Hsvd {
  private static final Logger LOGGER = LogManager.getFormatterLogger(Hsvd.class);
  private static final double RANK_TOLERANCE = 1e-10;
  private static final double REAL_EIGENVALUE_TOLERANCE = 1e-12;

  /** One damped sinusoid amplitude * pole^n. */
  public static class Component {
    private final Complex pole;
    private final Complex amplitude;
    private final double frequencyHz;
    private final double dampingPerSecond;

    Component(Complex pole, Complex amplitude, double dwellTime) {
      this.pole = pole;
      this.amplitude = amplitude;
      this.frequencyHz = pole.getArgument() / (2.0 * Math.PI * dwellTime);
      this.dampingPerSecond = -Math.log(pole.abs()) / dwellTime;
    }

    public Complex getPole() {
      return pole;
    }

    public Complex getAmplitude() {
      return amplitude;
    }

    public double getFrequencyHz() {
      return frequencyHz;
    }

    public double getDampingPerSecond() {
      return dampingPerSecond;
    }

    public Complex[] synthesize(int n) {
      Complex[] out = new Complex[n];
      Complex current = amplitude;
      for (int i = 0; i < n; i++) {
        out[i] = current;
        current = current.multiply(pole);
      }
      return out;
    }

    @Override
    public String toString() {
      return String.format("Component{f=%.3f Hz, damping=%.3f 1/s, |a|=%g}", frequencyHz, dampingPerSecond,
          amplitude.abs());
    }
  }

  /**
   * Decomposes the first min(n, pointLimit) points of the FID into at most order components.  The model order is
   * reduced to the numerical rank of the Hankel matrix when that is smaller.
   */
  public List<Component> decompose(Complex[] fid, double dwellTime, int order, int pointLimit) {
    int points = Math.min(fid.length, pointLimit);
    int rows = points / 2;
    int cols = points - rows + 1;

    RealMatrix hankel = new Array2DRowRealMatrix(2 * rows, 2 * cols);
    for (int i = 0; i < rows; i++) {
      for (int j = 0; j < cols; j++) {
        Complex h = fid[i + j];
        hankel.setEntry(i, j, h.getReal());
        hankel.setEntry(i, cols + j, -h.getImaginary());
        hankel.setEntry(rows + i, j, h.getImaginary());
        hankel.setEntry(rows + i, cols + j, h.getReal());
      }
    }
    SingularValueDecomposition svd = new SingularValueDecomposition(hankel);
    double[] singular = svd.getSingularValues();
    int numericalRank = 0;
    for (double s : singular) {
      if (s > singular[0] * RANK_TOLERANCE) {
        numericalRank++;
      }
    }
    int rank = Math.min(order, numericalRank / 2);
    if (rank == 0) {
      return Collections.emptyList();
    }

    double[][][] basis = complexBasis(svd.getU(), rows, rank);
    rank = basis.length;
    double[][] re = new double[rows][rank];
    double[][] im = new double[rows][rank];
    for (int k = 0; k < rank; k++) {
      for (int i = 0; i < rows; i++) {
        re[i][k] = basis[k][0][i];
        im[i][k] = basis[k][1][i];
      }
    }

    // Shift invariance: U without its last row, times Z, equals U without its first row.
    RealMatrix down = embed(re, im, 0, rows - 1, rank);
    RealMatrix up = embed(re, im, 1, rows - 1, rank);
    RealMatrix zEmbedded = new QRDecomposition(down).getSolver().solve(up);

    List<Complex> poles = poles(zEmbedded, rank);
    List<Component> components = amplitudes(fid, points, poles, dwellTime);
    LOGGER.debug("HSVD with order %d (rank %d) on %d points found %d components", order, rank, points,
        components.size());
    return components;
  }

  /**
   * Orthonormal complex basis of the dominant left singular subspace.  Each complex singular vector appears twice in
   * the embedded SVD (as v and i*v), so columns are converted to complex vectors and kept only when they add a new
   * complex direction.
   */
  private static double[][][] complexBasis(RealMatrix u, int rows, int rank) {
    List<double[][]> accepted = new ArrayList<>();
    for (int col = 0; col < u.getColumnDimension() && accepted.size() < rank; col++) {
      double[] re = new double[rows];
      double[] im = new double[rows];
      for (int i = 0; i < rows; i++) {
        re[i] = u.getEntry(i, col);
        im[i] = u.getEntry(rows + i, col);
      }
      for (double[][] q : accepted) {
        // <q, v> = sum conj(q) v
        double dotRe = 0.0;
        double dotIm = 0.0;
        for (int i = 0; i < rows; i++) {
          dotRe += q[0][i] * re[i] + q[1][i] * im[i];
          dotIm += q[0][i] * im[i] - q[1][i] * re[i];
        }
        for (int i = 0; i < rows; i++) {
          re[i] -= dotRe * q[0][i] - dotIm * q[1][i];
          im[i] -= dotRe * q[1][i] + dotIm * q[0][i];
        }
      }
      double norm = 0.0;
      for (int i = 0; i < rows; i++) {
        norm += re[i] * re[i] + im[i] * im[i];
      }
      norm = Math.sqrt(norm);
      if (norm > 0.5) {
        for (int i = 0; i < rows; i++) {
          re[i] /= norm;
          im[i] /= norm;
        }
        accepted.add(new double[][]{re, im});
      }
    }
    return accepted.toArray(new double[accepted.size()][][]);
  }

  private static RealMatrix embed(double[][] re, double[][] im, int firstRow, int rowCount, int cols) {
    RealMatrix m = new Array2DRowRealMatrix(2 * rowCount, 2 * cols);
    for (int i = 0; i < rowCount; i++) {
      for (int k = 0; k < cols; k++) {
        double a = re[firstRow + i][k];
        double b = im[firstRow + i][k];
        m.setEntry(i, k, a);
        m.setEntry(i, cols + k, -b);
        m.setEntry(rowCount + i, k, b);
        m.setEntry(rowCount + i, cols + k, a);
      }
    }
    return m;
  }

  /**
   * Eigenvalues of the complex matrix Z from those of its embedding.  Every embedded eigenvalue mu is tested for
   * membership in the spectrum of Z via the smallest singular value of Z - mu I; the better of each conjugate pair is
   * kept.  Real eigenvalues appear twice in the embedding and are taken once.
   */
  private static List<Complex> poles(RealMatrix zEmbedded, int rank) {
    EigenDecomposition eigen = new EigenDecomposition(zEmbedded);
    double[] realParts = eigen.getRealEigenvalues();
    double[] imagParts = eigen.getImagEigenvalues();

    List<Complex> realCandidates = new ArrayList<>();
    final List<Complex> selected = new ArrayList<>();
    final List<Double> residuals = new ArrayList<>();
    for (int i = 0; i < realParts.length; i++) {
      Complex mu = new Complex(realParts[i], imagParts[i]);
      if (Math.abs(imagParts[i]) <= REAL_EIGENVALUE_TOLERANCE * Math.max(1.0, mu.abs())) {
        realCandidates.add(new Complex(realParts[i], 0.0));
        continue;
      }
      double own = smallestSingularValue(zEmbedded, rank, mu);
      double mirrored = smallestSingularValue(zEmbedded, rank, mu.conjugate());
      if (own <= mirrored) {
        selected.add(mu);
        residuals.add(own);
      }
    }
    Collections.sort(realCandidates, new Comparator<Complex>() {
      @Override
      public int compare(Complex a, Complex b) {
        return Double.compare(a.getReal(), b.getReal());
      }
    });
    for (int i = 0; i < realCandidates.size(); i += 2) {
      selected.add(realCandidates.get(i));
      residuals.add(0.0);
    }

    if (selected.size() <= rank) {
      return selected;
    }
    List<Integer> order = new ArrayList<>();
    for (int i = 0; i < selected.size(); i++) {
      order.add(i);
    }
    Collections.sort(order, new Comparator<Integer>() {
      @Override
      public int compare(Integer a, Integer b) {
        return Double.compare(residuals.get(a), residuals.get(b));
      }
    });
    List<Complex> trimmed = new ArrayList<>(rank);
    for (int i = 0; i < rank; i++) {
      trimmed.add(selected.get(order.get(i)));
    }
    return trimmed;
  }

  private static double smallestSingularValue(RealMatrix zEmbedded, int rank, Complex mu) {
    RealMatrix shifted = zEmbedded.copy();
    for (int k = 0; k < rank; k++) {
      shifted.addToEntry(k, k, -mu.getReal());
      shifted.addToEntry(rank + k, rank + k, -mu.getReal());
      shifted.addToEntry(k, rank + k, mu.getImaginary());
      shifted.addToEntry(rank + k, k, -mu.getImaginary());
    }
    double[] singular = new SingularValueDecomposition(shifted).getSingularValues();
    return singular[singular.length - 1];
  }

  /** Least-squares amplitudes of the poles against the first points of the FID. */
  private static List<Component> amplitudes(Complex[] fid, int points, List<Complex> poles, double dwellTime) {
    int k = poles.size();
    if (k == 0) {
      return Collections.<Component>emptyList();
    }
    RealMatrix vandermonde = new Array2DRowRealMatrix(2 * points, 2 * k);
    for (int j = 0; j < k; j++) {
      Complex power = Complex.ONE;
      for (int n = 0; n < points; n++) {
        vandermonde.setEntry(n, j, power.getReal());
        vandermonde.setEntry(n, k + j, -power.getImaginary());
        vandermonde.setEntry(points + n, j, power.getImaginary());
        vandermonde.setEntry(points + n, k + j, power.getReal());
        power = power.multiply(poles.get(j));
      }
    }
    RealVector target = new ArrayRealVector(2 * points);
    for (int n = 0; n < points; n++) {
      target.setEntry(n, fid[n].getReal());
      target.setEntry(points + n, fid[n].getImaginary());
    }
    RealVector solution = new QRDecomposition(vandermonde).getSolver().solve(target);
    List<Component> components = new ArrayList<>(k);
    for (int j = 0; j < k; j++) {
      Complex amplitude = new Complex(solution.getEntry(j), solution.getEntry(k + j));
      components.add(new Component(poles.get(j), amplitude, dwellTime));
    }
    return components;
  }
}
