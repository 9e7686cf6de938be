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

package com.twentyn.mrs.reference;

import com.twentyn.mrs.signal.AcquisitionHeader;
import com.twentyn.mrs.signal.Spectrum;
import com.twentyn.mrs.test.util.SyntheticSignals;
import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class CrossCorrelationReferencerTest {

  @Test
  public void testEstimatesShiftOfCreatineCholineComb() throws Exception {
    AcquisitionHeader header = SyntheticSignals.header();
    double shiftHz = header.ppmToHz(0.05);
    Spectrum spectrum = new Spectrum(header, SyntheticSignals.brain(header)).freqShift(shiftHz);

    double estimate = new CrossCorrelationReferencer().estimateShift(spectrum, Landmark.CR_CHO);

    assertEquals(shiftHz, estimate, 0.5);
  }

  @Test
  public void testReferenceRestoresCanonicalPosition() throws Exception {
    AcquisitionHeader header = SyntheticSignals.header();
    Spectrum spectrum = new Spectrum(header, SyntheticSignals.brain(header)).freqShift(-header.ppmToHz(0.1));

    Spectrum referenced = new CrossCorrelationReferencer().reference(spectrum, Landmark.CR.getCanonicalPpm());

    assertEquals(SyntheticSignals.CR_PPM, SyntheticSignals.peakPpm(referenced, 2.9, 3.1), 0.005);
  }
}
