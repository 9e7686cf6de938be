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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Bounded retry combinator.  An operation is tried with each parameter of a finite, progressively simpler sequence
 * until it produces an acceptable result.  Numerical exceptions count as unacceptable results; precondition
 * violations are programming errors and propagate.
 */
public class Degradation {
  private static final Logger LOGGER = LogManager.getFormatterLogger(Degradation.class);

  private Degradation() {
  }

  public static <P, R> DegradationOutcome<P, R> retryWithDegradation(
      Function<P, R> operation, Iterable<P> parameters, Predicate<R> acceptable) {
    List<P> attempted = new ArrayList<>();
    String lastReason = "no parameters to try";
    for (P parameter : parameters) {
      attempted.add(parameter);
      R result;
      try {
        result = operation.apply(parameter);
      } catch (PreconditionViolationException e) {
        throw e;
      } catch (RuntimeException e) {
        lastReason = String.format("%s at %s: %s", e.getClass().getSimpleName(), parameter, e.getMessage());
        LOGGER.debug("Attempt with %s threw %s", parameter, e.getMessage());
        continue;
      }
      if (result != null && acceptable.test(result)) {
        return DegradationOutcome.success(parameter, result, attempted);
      }
      lastReason = String.format("unacceptable result at %s", parameter);
      LOGGER.debug("Attempt with %s produced an unacceptable result", parameter);
    }
    return DegradationOutcome.failure(attempted, lastReason);
  }

  /** from, from - 1, ..., floor.  Empty when from is below floor. */
  public static List<Integer> descending(int from, int floor) {
    List<Integer> values = new ArrayList<>();
    for (int v = from; v >= floor; v--) {
      values.add(v);
    }
    return values;
  }
}
