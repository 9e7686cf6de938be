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
import com.twentyn.mrs.signal.AcquisitionHeader;
import com.twentyn.mrs.signal.SpectralOps;
import com.twentyn.mrs.test.util.SyntheticSignals;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class MacromoleculeBasisTest {

  private AcquisitionHeader header;
  private BasisSet basis;

  @Before
  public void setUp() throws Exception {
    header = SyntheticSignals.header();
    basis = SyntheticSignals.singletBasis(header);
  }

  @Test
  public void testAppendsAllMacromoleculeAndLipidSignals() throws Exception {
    BasisSet augmented = new MacromoleculeBasis().augment(basis);

    List<String> expected = new ArrayList<>(basis.names());
    expected.addAll(MacromoleculeBasis.names());
    assertEquals(expected, augmented.names());
    assertEquals(11, augmented.size());
    assertEquals(basis.getNormalization(), augmented.getNormalization(), 0.0);
  }

  @Test
  public void testThreeProtonSignalMatchesCreatineArea() throws Exception {
    BasisSet augmented = new MacromoleculeBasis().augment(basis);

    double creatine = MacromoleculeBasis.area(augmented.get("Cr").getSpectrum(), 3.027 - 0.4, 3.027 + 0.4);
    double mm09 = MacromoleculeBasis.area(augmented.get("MM09").getSpectrum(), Double.NEGATIVE_INFINITY,
        Double.POSITIVE_INFINITY);
    assertEquals(creatine, mm09, 1e-9 * Math.abs(creatine));
    assertTrue(SyntheticSignals.peakPpm(augmented.get("MM09").getSpectrum(), 0.7, 1.1) > 0.89);
  }

  @Test
  public void testExistingNamesAreLeftAlone() throws Exception {
    BasisSet withMm = BasisSet.of(header, Arrays.asList(
        new BasisFunction("Cr", header, SpectralOps.lorentzian(header, 3.027, 2.0, 1.0, 0.0)),
        new BasisFunction("MM09", header, SpectralOps.lorentzian(header, 0.9, 20.0, 1.0, 0.0))));

    BasisSet augmented = new MacromoleculeBasis().augment(withMm);

    assertEquals(2 + MacromoleculeBasis.names().size() - 1, augmented.size());
  }

  @Test(expected = PreconditionViolationException.class)
  public void testNeedsCreatineToScaleAgainst() throws Exception {
    new MacromoleculeBasis().augment(basis.subset(Collections.singletonList("NAA")));
  }
}
