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
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;

public class NonNegativeLeastSquaresTest {

  @Test
  public void testFeasibleSolutionMatchesLeastSquares() throws Exception {
    double[] x = new NonNegativeLeastSquares().solve(
        new Array2DRowRealMatrix(new double[][]{{1, 0}, {0, 1}, {1, 1}}), new double[]{2, 3, 5});
    assertArrayEquals(new double[]{2, 3}, x, 1e-10);
  }

  @Test
  public void testNegativeComponentIsClampedToZero() throws Exception {
    double[] x = new NonNegativeLeastSquares().solve(
        new Array2DRowRealMatrix(new double[][]{{1, 0}, {0, 1}, {1, 1}}), new double[]{1, -1, 0});
    assertArrayEquals(new double[]{0.5, 0.0}, x, 1e-10);
  }

  @Test
  public void testAllNegativeTargetGivesZero() throws Exception {
    double[] x = new NonNegativeLeastSquares().solve(
        new Array2DRowRealMatrix(new double[][]{{1, 0}, {0, 2}}), new double[]{-1, -3});
    assertArrayEquals(new double[]{0.0, 0.0}, x, 0.0);
  }
}
