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
import com.twentyn.mrs.signal.AcquisitionHeader;
import com.twentyn.mrs.signal.TimeDomainSignal;
import com.twentyn.mrs.test.util.SyntheticSignals;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class DatasetInputTest {

  private final AcquisitionHeader header = SyntheticSignals.header();

  private TimeDomainSignal signal() {
    return SyntheticSignals.averages(header, SyntheticSignals.brain(header), 2);
  }

  @Test
  public void testPairsSignalsByPosition() throws Exception {
    TimeDomainSignal firstReference = signal();
    List<DatasetInput> inputs = DatasetInput.pair(Arrays.asList("a", "b"), Arrays.asList(signal(), signal()),
        Arrays.asList(firstReference, signal()), null, Collections.<TimeDomainSignal>emptyList());

    assertEquals(2, inputs.size());
    assertEquals("b", inputs.get(1).getId());
    assertSame(firstReference, inputs.get(0).getReference());
    assertTrue(inputs.get(0).hasReference());
    assertFalse(inputs.get(0).hasWater());
    assertFalse(inputs.get(1).hasMacromolecule());
  }

  @Test(expected = DataInconsistencyException.class)
  public void testMismatchedListLengthsAreRejected() throws Exception {
    DatasetInput.pair(Arrays.asList("a", "b"), Arrays.asList(signal(), signal()),
        Collections.singletonList(signal()), null, null);
  }

  @Test(expected = PreconditionViolationException.class)
  public void testMetaboliteSignalIsRequired() throws Exception {
    new DatasetInput("a", null);
  }
}
