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

import com.twentyn.mrs.exceptions.PreconditionViolationException;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.function.Function;
import java.util.function.Predicate;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class DegradationTest {

  private static final Predicate<Double> FINITE = new Predicate<Double>() {
    @Override
    public boolean test(Double value) {
      return !value.isNaN() && !value.isInfinite();
    }
  };

  @Test
  public void testStopsAtFirstAcceptableResult() throws Exception {
    Function<Integer, Double> operation = new Function<Integer, Double>() {
      @Override
      public Double apply(Integer order) {
        return order > 3 ? Double.NaN : order * 10.0;
      }
    };

    DegradationOutcome<Integer, Double> outcome =
        Degradation.retryWithDegradation(operation, Degradation.descending(5, 1), FINITE);

    assertTrue(outcome.succeeded());
    assertEquals(Integer.valueOf(3), outcome.getParameter());
    assertEquals(30.0, outcome.getValue(), 0.0);
    assertEquals(Arrays.asList(5, 4, 3), outcome.getAttempted());
    assertNull(outcome.getFailureReason());
  }

  @Test
  public void testNumericalExceptionsAreRetried() throws Exception {
    Function<Integer, Double> operation = new Function<Integer, Double>() {
      @Override
      public Double apply(Integer order) {
        if (order == 2) {
          throw new ArithmeticException("singular");
        }
        return 1.0;
      }
    };

    DegradationOutcome<Integer, Double> outcome =
        Degradation.retryWithDegradation(operation, Arrays.asList(2, 1), FINITE);

    assertTrue(outcome.succeeded());
    assertEquals(Integer.valueOf(1), outcome.getParameter());
  }

  @Test
  public void testExhaustionReportsEveryAttempt() throws Exception {
    Function<Integer, Double> operation = new Function<Integer, Double>() {
      @Override
      public Double apply(Integer order) {
        return Double.POSITIVE_INFINITY;
      }
    };

    DegradationOutcome<Integer, Double> outcome =
        Degradation.retryWithDegradation(operation, Degradation.descending(3, 1), FINITE);

    assertFalse(outcome.succeeded());
    assertEquals(Arrays.asList(3, 2, 1), outcome.getAttempted());
    assertTrue(outcome.getFailureReason().contains("1"));
  }

  @Test(expected = PreconditionViolationException.class)
  public void testPreconditionViolationsPropagate() throws Exception {
    Function<Integer, Double> operation = new Function<Integer, Double>() {
      @Override
      public Double apply(Integer order) {
        throw new PreconditionViolationException("bad input");
      }
    };
    Degradation.retryWithDegradation(operation, Collections.singletonList(1), FINITE);
  }

  @Test
  public void testDescendingIsEmptyBelowFloor() throws Exception {
    assertEquals(Arrays.asList(4, 3, 2), Degradation.descending(4, 2));
    assertTrue(Degradation.descending(1, 2).isEmpty());
  }
}
