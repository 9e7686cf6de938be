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

import com.twentyn.mrs.exceptions.DataInconsistencyException;
import com.twentyn.mrs.exceptions.PreconditionViolationException;
import com.twentyn.mrs.signal.AcquisitionHeader;
import com.twentyn.mrs.signal.SpectralOps;
import com.twentyn.mrs.test.util.SyntheticSignals;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class BasisSetTest {

  private AcquisitionHeader header;

  @Before
  public void setUp() throws Exception {
    header = SyntheticSignals.header();
  }

  @Test
  public void testNormalisesByLargestRealValue() throws Exception {
    BasisSet basis = SyntheticSignals.singletBasis(header);

    double max = 0.0;
    for (BasisFunction function : basis.functions()) {
      for (double v : function.getSpectrum().realSpectrum()) {
        max = Math.max(max, Math.abs(v));
      }
    }
    assertEquals(1.0, max, 1e-12);
    assertTrue(basis.getNormalization() > 1.0);
    assertEquals(Arrays.asList("NAA", "Cr", "Cho"), basis.names());
  }

  @Test(expected = PreconditionViolationException.class)
  public void testRejectsDuplicateNames() throws Exception {
    BasisSet.of(header, Arrays.asList(
        new BasisFunction("Cr", header, SpectralOps.lorentzian(header, 3.027, 2.0, 1.0, 0.0)),
        new BasisFunction("Cr", header, SpectralOps.lorentzian(header, 3.9, 2.0, 1.0, 0.0))));
  }

  @Test(expected = PreconditionViolationException.class)
  public void testRejectsEmptyList() throws Exception {
    BasisSet.of(header, Collections.<BasisFunction>emptyList());
  }

  @Test
  public void testSubsetKeepsOrderAndNormalisation() throws Exception {
    BasisSet basis = SyntheticSignals.singletBasis(header);

    BasisSet subset = basis.subset(Arrays.asList("Cho", "NAA", "GABA"));

    assertEquals(Arrays.asList("NAA", "Cho"), subset.names());
    assertEquals(basis.getNormalization(), subset.getNormalization(), 0.0);
  }

  @Test(expected = PreconditionViolationException.class)
  public void testUnknownFunctionIsRejected() throws Exception {
    SyntheticSignals.singletBasis(header).get("GABA");
  }

  @Test
  public void testResampleOntoSameGridIsIdentity() throws Exception {
    BasisSet basis = SyntheticSignals.singletBasis(header);
    assertSame(basis, basis.resampleTo(SyntheticSignals.header()));
  }

  @Test
  public void testResampleOntoDifferentDwellTimeKeepsPeakPosition() throws Exception {
    BasisSet basis = SyntheticSignals.singletBasis(header);
    AcquisitionHeader data = AcquisitionHeader.forField(3.0, 2200.0, SyntheticSignals.SAMPLES, 30.0, 2000.0);

    BasisSet resampled = basis.resampleTo(data);

    assertTrue(resampled.getHeader().sameGrid(data));
    assertEquals(SyntheticSignals.CR_PPM,
        SyntheticSignals.peakPpm(resampled.get("Cr").getSpectrum(), 2.9, 3.1), 0.005);
  }

  @Test(expected = DataInconsistencyException.class)
  public void testResampleRejectsDifferentSampleCount() throws Exception {
    SyntheticSignals.singletBasis(header).resampleTo(SyntheticSignals.header(1024));
  }
}
