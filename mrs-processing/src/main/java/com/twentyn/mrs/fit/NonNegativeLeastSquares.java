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

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.linear.SingularValueDecomposition;

import java.util.ArrayList;
import java.util.List;

/**
 * Lawson-Hanson active set solver for min ||A x - b|| subject to x >= 0.
 */
public class NonNegativeLeastSquares {
  private static final double TOLERANCE = 1e-12;

  private final int maxIterations;

  public NonNegativeLeastSquares() {
    this(500);
  }

  public NonNegativeLeastSquares(int maxIterations) {
    this.maxIterations = maxIterations;
  }

  public double[] solve(RealMatrix a, double[] b) {
    int n = a.getColumnDimension();
    RealVector target = new ArrayRealVector(b, false);
    double[] x = new double[n];
    boolean[] passive = new boolean[n];
    double scale = a.getFrobeniusNorm() * Math.max(1.0, target.getNorm());

    for (int iteration = 0; iteration < maxIterations; iteration++) {
      RealVector gradient = a.transpose().operate(target.subtract(a.operate(new ArrayRealVector(x, false))));
      int entering = -1;
      double best = TOLERANCE * scale;
      for (int j = 0; j < n; j++) {
        if (!passive[j] && gradient.getEntry(j) > best) {
          best = gradient.getEntry(j);
          entering = j;
        }
      }
      if (entering < 0) {
        break;
      }
      passive[entering] = true;

      while (true) {
        double[] z = passiveSolution(a, target, passive);
        boolean feasible = true;
        for (int j = 0; j < n; j++) {
          if (passive[j] && z[j] <= 0.0) {
            feasible = false;
            break;
          }
        }
        if (feasible) {
          x = z;
          break;
        }
        double alpha = Double.POSITIVE_INFINITY;
        for (int j = 0; j < n; j++) {
          if (passive[j] && z[j] <= 0.0) {
            double denominator = x[j] - z[j];
            double ratio = denominator > 0.0 ? x[j] / denominator : 0.0;
            alpha = Math.min(alpha, ratio);
          }
        }
        for (int j = 0; j < n; j++) {
          x[j] += alpha * (z[j] - x[j]);
          if (passive[j] && x[j] <= TOLERANCE) {
            passive[j] = false;
            x[j] = 0.0;
          }
        }
      }
    }
    return x;
  }

  private static double[] passiveSolution(RealMatrix a, RealVector target, boolean[] passive) {
    List<Integer> columns = new ArrayList<>();
    for (int j = 0; j < passive.length; j++) {
      if (passive[j]) {
        columns.add(j);
      }
    }
    double[] z = new double[passive.length];
    if (columns.isEmpty()) {
      return z;
    }
    RealMatrix reduced = new Array2DRowRealMatrix(a.getRowDimension(), columns.size());
    for (int k = 0; k < columns.size(); k++) {
      reduced.setColumnVector(k, a.getColumnVector(columns.get(k)));
    }
    RealVector solution;
    try {
      solution = new QRDecomposition(reduced).getSolver().solve(target);
    } catch (SingularMatrixException e) {
      solution = new SingularValueDecomposition(reduced).getSolver().solve(target);
    }
    for (int k = 0; k < columns.size(); k++) {
      z[columns.get(k)] = solution.getEntry(k);
    }
    return z;
  }
}
