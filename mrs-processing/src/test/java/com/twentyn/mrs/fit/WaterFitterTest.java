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

import com.twentyn.mrs.signal.AcquisitionHeader;
import com.twentyn.mrs.signal.SpectralOps;
import com.twentyn.mrs.signal.Spectrum;
import com.twentyn.mrs.test.util.SyntheticSignals;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class WaterFitterTest {

  @Test
  public void testFitsUnsuppressedWater() throws Exception {
    AcquisitionHeader header = SyntheticSignals.header();
    double offsetHz = header.ppmToHz(0.02);
    Spectrum water = new Spectrum(header, SpectralOps.lorentzian(header, 4.70, 8.0, 50.0, 0.0));

    FitParameters fit = new WaterFitter().fit(water);

    assertFalse(fit.isFailed());
    assertEquals(8.0, fit.getReferenceFwhmHz(), 0.2);
    assertEquals(offsetHz, fit.getReferenceShiftHz() + fit.getShiftHz().get(WaterFitter.WATER), 0.2);
    assertTrue(fit.amplitudeOf(WaterFitter.WATER) > 0.0);
    assertEquals(FitOptions.WATER_RANGE_PPM[0], fit.getFitRangePpm()[0], 0.0);
  }

  @Test
  public void testWaterBasisPeaksAtWaterFrequency() throws Exception {
    AcquisitionHeader header = SyntheticSignals.header();
    BasisSet basis = WaterFitter.waterBasis(header);

    assertEquals(1, basis.size());
    assertEquals(AcquisitionHeader.CENTER_PPM,
        SyntheticSignals.peakPpm(basis.get(WaterFitter.WATER).getSpectrum(), 4.4, 5.0), 0.002);
  }
}
