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

package com.twentyn.mrs.correct;

import com.twentyn.mrs.signal.AcquisitionHeader;
import com.twentyn.mrs.signal.Spectrum;
import com.twentyn.mrs.test.util.SyntheticSignals;
import org.apache.commons.lang3.tuple.Pair;
import org.junit.Test;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class PolarityCorrectorTest {
  private final PolarityCorrector corrector = new PolarityCorrector();

  @Test
  public void testCorrectionIsInvolutive() throws Exception {
    AcquisitionHeader header = SyntheticSignals.header();
    Spectrum spectrum = new Spectrum(header, SyntheticSignals.brain(header));

    Pair<Spectrum, Boolean> upright = corrector.correct(spectrum, PolarityCorrector.NAA_LOW_PPM,
        PolarityCorrector.NAA_HIGH_PPM);
    Pair<Spectrum, Boolean> fromNegated = corrector.correct(spectrum.scale(-1.0), PolarityCorrector.NAA_LOW_PPM,
        PolarityCorrector.NAA_HIGH_PPM);

    assertFalse(upright.getRight());
    assertTrue(fromNegated.getRight());
    assertTrue(PolarityCorrector.polarityResidual(upright.getLeft(), 1.9, 2.1) > 0.0);
    assertTrue(PolarityCorrector.polarityResidual(fromNegated.getLeft(), 1.9, 2.1) > 0.0);
    assertTrue(SyntheticSignals.maxAbsDifference(upright.getLeft().getFid(), fromNegated.getLeft().getFid()) < 1e-12);
  }

  @Test
  public void testEmptyWindowIsNotInverted() throws Exception {
    AcquisitionHeader header = SyntheticSignals.header();
    Spectrum spectrum = new Spectrum(header, SyntheticSignals.brain(header));
    assertFalse(PolarityCorrector.isInverted(spectrum, 40.0, 41.0));
  }
}
