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

package com.twentyn.mrs.util;

import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Levenberg-Marquardt minimisation of a residual vector with a forward-difference Jacobian.  The solver keeps the
 * best point seen so far, so that hitting the iteration or evaluation cap (or any numerical breakdown inside the
 * optimizer) yields the best-so-far estimate instead of an exception.
 */
public class LeastSquaresSolver {
  private static final Logger LOGGER = LogManager.getFormatterLogger(LeastSquaresSolver.class);
  private static final double RELATIVE_STEP = 1e-6;
  private static final double TOLERANCE = 1e-10;

  /** Residuals r(p); the solver minimises sum(r^2). */
  public interface Residuals {
    double[] value(double[] parameters);
  }

  public static class Solution {
    private final double[] point;
    private final double cost;
    private final boolean converged;
    private final int evaluations;

    Solution(double[] point, double cost, boolean converged, int evaluations) {
      this.point = point;
      this.cost = cost;
      this.converged = converged;
      this.evaluations = evaluations;
    }

    public double[] getPoint() {
      return point == null ? null : point.clone();
    }

    /** Sum of squared residuals at the returned point, NaN when no finite point was ever evaluated. */
    public double getCost() {
      return cost;
    }

    public boolean isConverged() {
      return converged;
    }

    public boolean isFinite() {
      return point != null && !Double.isNaN(cost) && !Double.isInfinite(cost);
    }

    public int getEvaluations() {
      return evaluations;
    }
  }

  private final int maxIterations;
  private final int maxEvaluations;
  private ParameterValidator validator;
  private double[] typicalScale;

  public LeastSquaresSolver(int maxIterations, int maxEvaluations) {
    this.maxIterations = maxIterations;
    this.maxEvaluations = maxEvaluations;
  }

  public LeastSquaresSolver withValidator(ParameterValidator validator) {
    this.validator = validator;
    return this;
  }

  /** Per-parameter magnitudes used to size finite-difference steps for parameters near zero. */
  public LeastSquaresSolver withTypicalScale(double[] typicalScale) {
    this.typicalScale = typicalScale.clone();
    return this;
  }

  public Solution minimize(final Residuals residuals, double[] start) {
    final BestSoFar best = new BestSoFar();
    final double[] scale = typicalScale != null ? typicalScale : defaultScale(start.length);
    final int residualCount = residuals.value(start).length;

    MultivariateJacobianFunction model = new MultivariateJacobianFunction() {
      @Override
      public org.apache.commons.math3.util.Pair<RealVector, RealMatrix> value(RealVector point) {
        double[] p = point.toArray();
        double[] r = residuals.value(p);
        best.offer(p, r);
        RealMatrix jacobian = new Array2DRowRealMatrix(r.length, p.length);
        for (int j = 0; j < p.length; j++) {
          double h = RELATIVE_STEP * Math.max(Math.abs(p[j]), scale[j]);
          double[] stepped = p.clone();
          stepped[j] += h;
          double[] rs = residuals.value(stepped);
          for (int i = 0; i < r.length; i++) {
            jacobian.setEntry(i, j, (rs[i] - r[i]) / h);
          }
        }
        return new org.apache.commons.math3.util.Pair<RealVector, RealMatrix>(new ArrayRealVector(r, false), jacobian);
      }
    };

    LeastSquaresBuilder builder = new LeastSquaresBuilder()
        .start(start)
        .model(model)
        .target(new double[residualCount])
        .lazyEvaluation(false)
        .maxIterations(maxIterations)
        .maxEvaluations(maxEvaluations);
    if (validator != null) {
      builder.parameterValidator(validator);
    }
    LeastSquaresProblem problem = builder.build();

    LevenbergMarquardtOptimizer optimizer = new LevenbergMarquardtOptimizer()
        .withCostRelativeTolerance(TOLERANCE)
        .withParameterRelativeTolerance(TOLERANCE);
    try {
      LeastSquaresOptimizer.Optimum optimum = optimizer.optimize(problem);
      double[] point = optimum.getPoint().toArray();
      double cost = optimum.getCost() * optimum.getCost();
      if (Double.isNaN(cost) || Double.isInfinite(cost)) {
        return best.toSolution(false);
      }
      if (best.point != null && best.cost < cost) {
        return best.toSolution(true);
      }
      return new Solution(point, cost, true, optimum.getEvaluations());
    } catch (TooManyEvaluationsException | TooManyIterationsException e) {
      LOGGER.debug("Least-squares cap reached, returning best point so far (cost %g)", best.cost);
      return best.toSolution(false);
    } catch (RuntimeException e) {
      LOGGER.debug("Least-squares optimisation broke down: %s", e.getMessage());
      return best.toSolution(false);
    }
  }

  private static double[] defaultScale(int size) {
    double[] scale = new double[size];
    for (int i = 0; i < size; i++) {
      scale[i] = 1.0;
    }
    return scale;
  }

  public static double sumOfSquares(double[] values) {
    double total = 0.0;
    for (double v : values) {
      total += v * v;
    }
    return total;
  }

  private static class BestSoFar {
    private double[] point;
    private double cost = Double.POSITIVE_INFINITY;
    private int evaluations;

    void offer(double[] p, double[] residuals) {
      evaluations++;
      double c = sumOfSquares(residuals);
      if (!Double.isNaN(c) && c < cost) {
        cost = c;
        point = p.clone();
      }
    }

    Solution toSolution(boolean converged) {
      return new Solution(point, point == null ? Double.NaN : cost, converged, evaluations);
    }
  }
}
