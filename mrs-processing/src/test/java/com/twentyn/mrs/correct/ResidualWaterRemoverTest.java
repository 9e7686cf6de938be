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
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.stat.StatUtils;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ResidualWaterRemoverTest {
  private AcquisitionHeader header;

  @Before
  public void setUp() throws Exception {
    header = SyntheticSignals.header(1024);
  }

  private static double windowMax(Spectrum spectrum, double low, double high) {
    int[] range = spectrum.ppmAxis().indexRange(low, high);
    double[] magnitude = spectrum.magnitudeSpectrum();
    return StatUtils.max(magnitude, range[0], range[1] - range[0] + 1);
  }

  @Test
  public void testFixedOrderFilterPreservesSignalsOutsideBand() throws Exception {
    Spectrum spectrum = new Spectrum(header, SyntheticSignals.brain(header));

    Spectrum filtered = new ResidualWaterRemover().filter(spectrum, 20);

    double scale = SyntheticSignals.maxAbs(spectrum.getSpectrum());
    double difference = SyntheticSignals.maxAbsDifference(spectrum.getSpectrum(), filtered.getSpectrum());
    assertTrue("Relative change " + difference / scale, difference / scale < 1e-6);
  }

  @Test
  public void testRemovesWaterAndKeepsMetabolites() throws Exception {
    double[] naa = {SyntheticSignals.NAA_PPM, 4.0, 3.0};
    double[] cr = {SyntheticSignals.CR_PPM, 4.0, 2.0};
    Spectrum spectrum = SyntheticSignals.spectrum(header, new double[]{4.68, 8.0, 50.0}, naa, cr);
    // The water tail under NAA goes away with the water, so compare against the water-free signal.
    Spectrum waterFree = SyntheticSignals.spectrum(header, naa, cr)
        .dcCorrect(ResidualWaterRemover.DEFAULT_DC_PERCENTAGE);

    ResidualWaterRemover.Result result = new ResidualWaterRemover().remove(spectrum);

    assertFalse(result.isFailed());
    assertEquals(ResidualWaterRemover.DEFAULT_ORDER, result.getOrder());
    double waterBefore = windowMax(spectrum, 4.55, 4.8);
    double waterAfter = windowMax(result.getSpectrum(), 4.55, 4.8);
    assertTrue("Water reduced from " + waterBefore + " to " + waterAfter, waterAfter < waterBefore / 10.0);
    double naaExpected = windowMax(waterFree, 1.9, 2.1);
    double naaAfter = windowMax(result.getSpectrum(), 1.9, 2.1);
    assertEquals(naaExpected, naaAfter, 0.02 * naaExpected);
    double crExpected = windowMax(waterFree, 2.9, 3.1);
    assertEquals(crExpected, windowMax(result.getSpectrum(), 2.9, 3.1), 0.02 * crExpected);
  }

  @Test
  public void testOrderIsReducedUntilResultIsFinite() throws Exception {
    final List<Integer> attempted = new ArrayList<>();
    ResidualWaterRemover remover = new ResidualWaterRemover(4.5, 4.9, 6, 1, 256, 100.0) {
      @Override
      public Spectrum filter(Spectrum spectrum, int order) {
        attempted.add(order);
        if (order > 3) {
          Complex[] broken = spectrum.getFid();
          broken[0] = new Complex(Double.NaN, 0.0);
          return spectrum.withFid(broken);
        }
        return spectrum;
      }
    };

    ResidualWaterRemover.Result result = remover.remove(new Spectrum(header, SyntheticSignals.brain(header)));

    assertFalse(result.isFailed());
    assertEquals(3, result.getOrder());
    assertEquals(Arrays.asList(6, 5, 4, 3), attempted);
  }

  @Test
  public void testExhaustedRetriesFlagFailureAndKeepInput() throws Exception {
    ResidualWaterRemover remover = new ResidualWaterRemover(4.5, 4.9, 3, 1, 256, 100.0) {
      @Override
      public Spectrum filter(Spectrum spectrum, int order) {
        Complex[] broken = spectrum.getFid();
        broken[1] = new Complex(0.0, Double.POSITIVE_INFINITY);
        return spectrum.withFid(broken);
      }
    };

    ResidualWaterRemover.Result result = remover.remove(new Spectrum(header, SyntheticSignals.brain(header)));

    assertTrue(result.isFailed());
    assertEquals(-1, result.getOrder());
    assertTrue(result.getSpectrum().isFinite());
  }
}
