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

package com.twentyn.mrs.quality;

import com.twentyn.mrs.signal.AcquisitionHeader;
import com.twentyn.mrs.signal.SpectralOps;
import com.twentyn.mrs.signal.Spectrum;
import com.twentyn.mrs.test.util.SyntheticSignals;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class LinewidthTest {

  private final AcquisitionHeader header = SyntheticSignals.header();

  @Test
  public void testLorentzianFullWidthAtHalfMaximum() throws Exception {
    Spectrum spectrum = new Spectrum(header, SpectralOps.lorentzian(header, SyntheticSignals.CR_PPM, 6.0, 1.0, 0.0));

    assertEquals(6.0, new Linewidth().measure(spectrum, QualityWindow.CR), 0.1);
    assertEquals(header.hzToPpm(6.0), new Linewidth().measurePpm(spectrum, QualityWindow.CR), 1e-3);
  }

  @Test
  public void testGaussianFullWidthAtHalfMaximum() throws Exception {
    Spectrum spectrum = new Spectrum(header, SpectralOps.gaussian(header, SyntheticSignals.CR_PPM, 10.0, 1.0, 0.0));

    assertEquals(10.0, new Linewidth().measure(spectrum, QualityWindow.CR), 0.2);
  }

  @Test
  public void testUndefinedWithoutPositivePeak() throws Exception {
    Spectrum inverted = new Spectrum(header,
        SpectralOps.lorentzian(header, SyntheticSignals.CR_PPM, 6.0, 1.0, Math.PI));
    assertTrue(Double.isNaN(new Linewidth().measure(inverted, QualityWindow.CR)));
    assertTrue(Double.isNaN(new Linewidth().measure(inverted, new double[]{20.0, 21.0})));
  }
}
