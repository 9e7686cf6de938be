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

import java.util.Collections;
import java.util.List;

/**
 * Result of a bounded retry: either the first acceptable value together with the parameter that produced it, or a
 * failure listing every parameter that was tried.
 */
public class DegradationOutcome<P, R> {
  private final P parameter;
  private final R value;
  private final List<P> attempted;
  private final String failureReason;

  private DegradationOutcome(P parameter, R value, List<P> attempted, String failureReason) {
    this.parameter = parameter;
    this.value = value;
    this.attempted = Collections.unmodifiableList(attempted);
    this.failureReason = failureReason;
  }

  static <P, R> DegradationOutcome<P, R> success(P parameter, R value, List<P> attempted) {
    return new DegradationOutcome<>(parameter, value, attempted, null);
  }

  static <P, R> DegradationOutcome<P, R> failure(List<P> attempted, String reason) {
    return new DegradationOutcome<>(null, null, attempted, reason);
  }

  public boolean succeeded() {
    return failureReason == null;
  }

  public P getParameter() {
    return parameter;
  }

  public R getValue() {
    return value;
  }

  public List<P> getAttempted() {
    return attempted;
  }

  public String getFailureReason() {
    return failureReason;
  }

  @Override
  public String toString() {
    return succeeded()
        ? String.format("success with %s after %d attempt(s)", parameter, attempted.size())
        : String.format("failure after %d attempt(s): %s", attempted.size(), failureReason);
  }
}
