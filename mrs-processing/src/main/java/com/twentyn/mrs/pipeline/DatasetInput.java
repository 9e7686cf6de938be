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

package com.twentyn.mrs.pipeline;

import com.twentyn.mrs.exceptions.DataInconsistencyException;
import com.twentyn.mrs.exceptions.PreconditionViolationException;
import com.twentyn.mrs.signal.TimeDomainSignal;

import java.util.ArrayList;
import java.util.List;

/**
 * The signals of one dataset: the metabolite acquisition and its optional water reference, short-TE water and
 * macromolecule acquisitions.
 */
public class DatasetInput {
  private final String id;
  private final TimeDomainSignal metabolite;
  private final TimeDomainSignal reference;
  private final TimeDomainSignal water;
  private final TimeDomainSignal macromolecule;

  public DatasetInput(String id, TimeDomainSignal metabolite, TimeDomainSignal reference, TimeDomainSignal water,
                      TimeDomainSignal macromolecule) {
    if (id == null || metabolite == null) {
      throw new PreconditionViolationException("A dataset needs an id and a metabolite signal");
    }
    this.id = id;
    this.metabolite = metabolite;
    this.reference = reference;
    this.water = water;
    this.macromolecule = macromolecule;
  }

  public DatasetInput(String id, TimeDomainSignal metabolite) {
    this(id, metabolite, null, null, null);
  }

  /**
   * Zips paired signal lists into datasets.  Optional lists may be null or empty; otherwise they must have one entry
   * per metabolite signal.
   * @throws DataInconsistencyException when list lengths differ
   */
  public static List<DatasetInput> pair(List<String> ids, List<TimeDomainSignal> metabolites,
                                        List<TimeDomainSignal> references, List<TimeDomainSignal> waters,
                                        List<TimeDomainSignal> macromolecules) {
    int n = metabolites.size();
    requirePaired("dataset ids", ids, n);
    requirePaired("reference signals", references, n);
    requirePaired("short-TE water signals", waters, n);
    requirePaired("macromolecule signals", macromolecules, n);
    List<DatasetInput> inputs = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      inputs.add(new DatasetInput(ids.get(i), metabolites.get(i), entry(references, i), entry(waters, i),
          entry(macromolecules, i)));
    }
    return inputs;
  }

  private static void requirePaired(String what, List<?> list, int expected) {
    if (list != null && !list.isEmpty() && list.size() != expected) {
      throw new DataInconsistencyException(String.format(
          "Got %d %s for %d metabolite signals", list.size(), what, expected));
    }
  }

  private static TimeDomainSignal entry(List<TimeDomainSignal> list, int i) {
    return list == null || list.isEmpty() ? null : list.get(i);
  }

  public String getId() {
    return id;
  }

  public TimeDomainSignal getMetabolite() {
    return metabolite;
  }

  /** Null when the dataset has no water-unsuppressed reference. */
  public TimeDomainSignal getReference() {
    return reference;
  }

  public TimeDomainSignal getWater() {
    return water;
  }

  public TimeDomainSignal getMacromolecule() {
    return macromolecule;
  }

  public boolean hasReference() {
    return reference != null;
  }

  public boolean hasWater() {
    return water != null;
  }

  public boolean hasMacromolecule() {
    return macromolecule != null;
  }
}
