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
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertEquals;

public class BSplineBaselineTest {

  @Test
  public void testSplinesSumToOneInsideWindow() throws Exception {
    BSplineBaseline baseline = new BSplineBaseline(0.2, 4.2, 0.4);
    double[] ppm = new double[101];
    for (int i = 0; i < ppm.length; i++) {
      ppm[i] = 0.2 + 4.0 * i / (ppm.length - 1);
    }

    RealMatrix design = baseline.designMatrix(ppm);

    assertEquals(13, baseline.getFunctionCount());
    for (int i = 0; i < ppm.length; i++) {
      double total = 0.0;
      for (int j = 0; j < design.getColumnDimension(); j++) {
        total += design.getEntry(i, j);
      }
      assertEquals("at " + ppm[i] + " ppm", 1.0, total, 1e-12);
    }
  }

  @Test
  public void testConstantCoefficientsGiveConstantBaseline() throws Exception {
    BSplineBaseline baseline = new BSplineBaseline(1.0, 3.0, 0.3);
    double[] coefficients = new double[baseline.getFunctionCount()];
    Arrays.fill(coefficients, 2.5);

    double[] values = baseline.evaluate(new double[]{1.0, 1.7, 2.99}, coefficients);

    for (double v : values) {
      assertEquals(2.5, v, 1e-12);
    }
  }

  @Test
  public void testCardinalSplineMatchesKnownValues() throws Exception {
    assertEquals(1.0 / 6.0, BSplineBaseline.cardinal(1.0), 1e-15);
    assertEquals(2.0 / 3.0, BSplineBaseline.cardinal(2.0), 1e-15);
    assertEquals(0.0, BSplineBaseline.cardinal(4.0), 0.0);
  }

  @Test(expected = PreconditionViolationException.class)
  public void testRejectsEmptyWindow() throws Exception {
    new BSplineBaseline(3.0, 3.0, 0.4);
  }
}
