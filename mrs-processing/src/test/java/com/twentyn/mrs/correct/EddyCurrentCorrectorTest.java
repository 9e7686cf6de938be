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

import com.twentyn.mrs.exceptions.PreconditionViolationException;
import com.twentyn.mrs.signal.AcquisitionHeader;
import com.twentyn.mrs.signal.Spectrum;
import com.twentyn.mrs.signal.TimeDomainSignal;
import com.twentyn.mrs.test.util.SyntheticSignals;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.math3.complex.Complex;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class EddyCurrentCorrectorTest {
  private AcquisitionHeader header;
  private EddyCurrentCorrector corrector;
  private Complex[] eddyPhase;

  @Before
  public void setUp() throws Exception {
    header = SyntheticSignals.header(1024);
    corrector = new EddyCurrentCorrector();
    // Exponentially decaying phase error as left behind by gradient eddy currents.
    eddyPhase = new Complex[header.getSampleCount()];
    for (int i = 0; i < eddyPhase.length; i++) {
      double phi = 1.5 * Math.exp(-header.timeAt(i) / 0.05) + 0.3;
      eddyPhase[i] = new Complex(Math.cos(phi), Math.sin(phi));
    }
  }

  private Complex[] distort(Complex[] fid) {
    Complex[] out = new Complex[fid.length];
    for (int i = 0; i < fid.length; i++) {
      out[i] = fid[i].multiply(eddyPhase[i]);
    }
    return out;
  }

  @Test
  public void testRemovesReferencePhaseFromMetabolites() throws Exception {
    Complex[] clean = SyntheticSignals.brain(header);
    Complex[] water = SyntheticSignals.lorentzians(header, new double[]{4.68, 6.0, 100.0});
    TimeDomainSignal metabolite = SyntheticSignals.averages(header, distort(clean), 2);
    TimeDomainSignal reference = TimeDomainSignal.preAveraged(header, distort(water));

    Pair<TimeDomainSignal, Spectrum> corrected = corrector.correct(metabolite, reference);

    Complex[] out = corrected.getLeft().getFid(0, 1, 0);
    assertTrue(SyntheticSignals.maxAbsDifference(clean, out) < 1e-9);
    assertTrue(SyntheticSignals.maxAbsDifference(water, corrected.getRight().getFid()) < 1e-9);
  }

  @Test
  public void testSecondApplicationWithCorrectedReferenceChangesNothing() throws Exception {
    Spectrum metabolite = new Spectrum(header, distort(SyntheticSignals.brain(header)));
    Spectrum reference = new Spectrum(header,
        distort(SyntheticSignals.lorentzians(header, new double[]{4.68, 6.0, 100.0})));

    Pair<Spectrum, Spectrum> once = corrector.correct(metabolite, reference);
    Pair<Spectrum, Spectrum> twice = corrector.correct(once.getLeft(), once.getRight());

    assertTrue(SyntheticSignals.maxAbsDifference(once.getLeft().getFid(), twice.getLeft().getFid()) < 1e-9);
  }

  @Test(expected = PreconditionViolationException.class)
  public void testReferenceMustBeCombined() throws Exception {
    TimeDomainSignal metabolite = SyntheticSignals.averages(header, SyntheticSignals.brain(header), 2);
    TimeDomainSignal reference = SyntheticSignals.averages(header, SyntheticSignals.brain(header), 2);
    corrector.correct(metabolite, reference);
  }

  @Test
  public void testSafeguardKeepsCorrectionThatReducesLandmarkPhase() throws Exception {
    Spectrum clean = new Spectrum(header, SyntheticSignals.lorentzians(header, new double[]{2.008, 4.0, 1.0}));
    Spectrum dephased = clean.phaseShift(1.2);
    assertTrue(EddyCurrentCorrector.shouldKeep(dephased, clean));
    assertFalse(EddyCurrentCorrector.shouldKeep(clean, dephased));
  }
}
