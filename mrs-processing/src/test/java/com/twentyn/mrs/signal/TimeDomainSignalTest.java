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

package com.twentyn.mrs.signal;

import com.twentyn.mrs.exceptions.PreconditionViolationException;
import com.twentyn.mrs.test.util.SyntheticSignals;
import org.apache.commons.math3.complex.Complex;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class TimeDomainSignalTest {

  @Test(expected = PreconditionViolationException.class)
  public void testZeroAveragesAreRejectedBeforeAveraging() throws Exception {
    TimeDomainSignal empty = SyntheticSignals.empty(SyntheticSignals.header(64));
    empty.averageOf(0);
  }

  @Test(expected = PreconditionViolationException.class)
  public void testHeaderRejectsNonPowerOfTwoSampleCount() throws Exception {
    AcquisitionHeader.forField(3.0, 2000.0, 1000, 30.0, 2000.0);
  }

  @Test(expected = PreconditionViolationException.class)
  public void testFidLengthMustMatchHeader() throws Exception {
    AcquisitionHeader header = SyntheticSignals.header(64);
    TimeDomainSignal.ofAverages(header, Collections.singletonList(SyntheticSignals.zeros(32)));
  }

  @Test
  public void testCombineCoilsRemovesCoilPhase() throws Exception {
    AcquisitionHeader header = SyntheticSignals.header(64);
    Complex[] fid = SyntheticSignals.lorentzians(header, new double[]{2.0, 5.0, 1.0});
    Complex[] rotated = SpectralOps.phaseShift(fid, 1.2);
    TimeDomainSignal signal = new TimeDomainSignal(header, new Complex[][][][]{{{fid, rotated}}}, false);

    TimeDomainSignal combined = signal.combineCoils();

    assertEquals(1, combined.getCoilCount());
    Complex[] out = combined.getFid(0, 0, 0);
    // Two equally weighted coils in phase: sqrt(2) times the original.
    for (int i = 0; i < fid.length; i++) {
      assertEquals(Math.sqrt(2.0) * fid[i].getReal(), out[i].getReal(), 1e-9);
      assertEquals(Math.sqrt(2.0) * fid[i].getImaginary(), out[i].getImaginary(), 1e-9);
    }
  }

  @Test
  public void testSingleCoilIsReturnedAsIs() throws Exception {
    TimeDomainSignal signal = SyntheticSignals.averages(SyntheticSignals.header(64), SyntheticSignals.zeros(64), 2);
    assertSame(signal, signal.combineCoils());
  }

  @Test(expected = PreconditionViolationException.class)
  public void testRequireCombinedRejectsSeveralAverages() throws Exception {
    TimeDomainSignal signal = SyntheticSignals.averages(SyntheticSignals.header(64), SyntheticSignals.zeros(64), 2);
    signal.requireCombined("Reference");
  }

  @Test
  public void testSelectAveragesKeepsOrder() throws Exception {
    AcquisitionHeader header = SyntheticSignals.header(8);
    TimeDomainSignal signal = TimeDomainSignal.ofAverages(header, Arrays.asList(
        SyntheticSignals.spike(8, 0, 1.0), SyntheticSignals.spike(8, 0, 2.0), SyntheticSignals.spike(8, 0, 3.0)));
    TimeDomainSignal selected = signal.selectAverages(new int[]{2, 0});
    assertEquals(2, selected.getAverageCount());
    assertEquals(3.0, selected.getFid(0, 0, 0)[0].getReal(), 0.0);
    assertEquals(1.0, selected.getFid(0, 1, 0)[0].getReal(), 0.0);
    assertTrue(selected.getFid(0, 1, 0)[1].equals(Complex.ZERO));
  }
}
