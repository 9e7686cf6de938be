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

import com.twentyn.mrs.exceptions.PreconditionViolationException;
import com.twentyn.mrs.signal.AcquisitionHeader;
import com.twentyn.mrs.signal.Spectrum;
import com.twentyn.mrs.test.util.SyntheticSignals;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class CohortOverviewTest {

  private final AcquisitionHeader header = SyntheticSignals.header();

  private Spectrum naaAt(double ppm) {
    return SyntheticSignals.spectrum(header, new double[]{ppm, 4.0, 1.0});
  }

  @Test
  public void testAlignsCohortOnNaa() throws Exception {
    CohortOverview.Summary summary = new CohortOverview().summarize(Arrays.asList(naaAt(1.98), naaAt(2.04)));

    assertEquals(2, summary.getCount());
    double[] ppm = summary.getPpm();
    double[] mean = summary.getMean();
    int best = 0;
    for (int i = 1; i < mean.length; i++) {
      if (mean[i] > mean[best]) {
        best = i;
      }
    }
    assertEquals(CohortOverview.NAA_TARGET_PPM, ppm[best], 0.01);
    assertTrue(summary.getStandardDeviation()[best] < 0.05 * mean[best]);
  }

  @Test
  public void testSingleSpectrumHasNoSpread() throws Exception {
    CohortOverview.Summary summary = new CohortOverview().summarize(Collections.singletonList(naaAt(2.0)));

    for (double sd : summary.getStandardDeviation()) {
      assertEquals(0.0, sd, 0.0);
    }
  }

  @Test(expected = PreconditionViolationException.class)
  public void testEmptyCohortIsRejected() throws Exception {
    new CohortOverview().summarize(Collections.<Spectrum>emptyList());
  }
}
