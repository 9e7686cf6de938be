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

package com.twentyn.mrs.align;

import com.twentyn.mrs.signal.AcquisitionHeader;
import com.twentyn.mrs.signal.SpectralOps;
import com.twentyn.mrs.signal.Spectrum;
import com.twentyn.mrs.signal.TimeDomainSignal;
import com.twentyn.mrs.test.util.SyntheticSignals;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.stat.StatUtils;
import org.junit.Before;
import org.junit.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class SpectralRegistrationTest {
  private static final double[] CR_CHO = {3.027, 3.20};

  private AcquisitionHeader header;
  private SpectralRegistration registration;

  @Before
  public void setUp() throws Exception {
    header = SyntheticSignals.header();
    registration = new SpectralRegistration();
  }

  @Test
  public void testSingleAverageIsANoOp() throws Exception {
    Complex[] fid = SyntheticSignals.brain(header);
    TimeDomainSignal signal = TimeDomainSignal.ofAverages(header, Collections.singletonList(fid));

    AlignmentResult result = registration.align(signal, 0, CR_CHO);

    Complex[] expected = SpectralOps.toSpectrum(fid);
    Complex[] actual = result.getAveraged().getSpectrum();
    for (int i = 0; i < expected.length; i++) {
      assertEquals("Spectrum point " + i + " is unchanged", expected[i], actual[i]);
    }
    assertArrayEquals(new double[]{1.0}, result.getWeights(), 0.0);
    assertArrayEquals(new double[]{0.0}, result.getFrequencyShiftsHz(), 0.0);
    assertArrayEquals(new double[]{0.0}, result.getPhaseShiftsDeg(), 0.0);
    assertFalse(result.isAligned());
  }

  @Test
  public void testDriftingAveragesAreBroughtTogether() throws Exception {
    Complex[] fid = SyntheticSignals.brain(header);
    List<Complex[]> averages = SyntheticSignals.driftingAverages(header, fid, 16, 4.0, 42L);
    TimeDomainSignal signal = TimeDomainSignal.ofAverages(header, averages);

    AlignmentResult result = registration.align(signal, 0, CR_CHO);

    double spreadPre = StatUtils.max(result.getDriftPre()) - StatUtils.min(result.getDriftPre());
    double spreadPost = StatUtils.max(result.getDriftPost()) - StatUtils.min(result.getDriftPost());
    assertTrue("Creatine positions spread before alignment: " + spreadPre, spreadPre > 0.02);
    assertTrue("Creatine positions agree after alignment: " + spreadPost, spreadPost < 0.005);
    assertTrue(result.isAligned());
    assertFalse(result.isDegraded());

    // Coherent averaging keeps the peak height of a single transient.
    Spectrum single = new Spectrum(header, fid);
    double expected = StatUtils.max(single.magnitudeSpectrum());
    double actual = StatUtils.max(result.getAveraged().magnitudeSpectrum());
    assertEquals(expected, actual, 0.05 * expected);
  }

  @Test
  public void testWeightsAreBoundedAndHalfAreFull() throws Exception {
    double[] residual = {1.0, 0.5, 1.0, 2.0, 4.0, Double.NaN};
    double[] weights = SpectralRegistration.weights(residual, 100.0);
    assertEquals(1.0, weights[0], 0.0);
    assertEquals(1.0, weights[1], 0.0);
    assertEquals(1.0, weights[2], 0.0);
    assertEquals(0.25, weights[3], 1e-12);
    assertEquals(1.0 / 16.0, weights[4], 1e-12);
    assertEquals(0.0, weights[5], 0.0);
  }

  @Test
  public void testCoarseGuessIsSharedWithinPackage() throws Exception {
    Complex[] fid = SyntheticSignals.brain(header);
    List<Complex[]> averages = SyntheticSignals.driftingAverages(header, fid, 20, 3.0, 7L);

    double[] guess = registration.coarseFrequencyGuess(averages, header, CR_CHO);

    assertEquals(20, guess.length);
    for (int k = 0; k < 20; k += 2) {
      assertEquals(guess[k], guess[k + 1], 0.0);
    }
  }
}
