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
import com.twentyn.mrs.signal.SpectralOps;
import com.twentyn.mrs.test.util.SyntheticSignals;
import org.apache.commons.math3.complex.Complex;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertEquals;

public class HsvdTest {

  @Test
  public void testRecoversSingleDampedSinusoid() throws Exception {
    AcquisitionHeader header = SyntheticSignals.header(512);
    double hz = header.ppmToHz(2.008 - AcquisitionHeader.CENTER_PPM);
    Complex[] fid = SpectralOps.lorentzian(header, 2.008, 5.0, 2.0, 0.4);

    List<Hsvd.Component> components = new Hsvd().decompose(fid, header.getDwellTime(), 10, 256);

    assertEquals(1, components.size());
    Hsvd.Component component = components.get(0);
    assertEquals(hz, component.getFrequencyHz(), 1e-3);
    assertEquals(Math.PI * 5.0, component.getDampingPerSecond(), 1e-3);
    assertEquals(2.0, component.getAmplitude().abs(), 1e-6);
    assertEquals(0.4, component.getAmplitude().getArgument(), 1e-6);
  }

  @Test
  public void testOrderCapsComponentCount() throws Exception {
    AcquisitionHeader header = SyntheticSignals.header(512);
    Complex[] fid = SyntheticSignals.brain(header);
    List<Hsvd.Component> components = new Hsvd().decompose(fid, header.getDwellTime(), 2, 256);
    assertEquals(2, components.size());
  }

  @Test
  public void testSynthesizedComponentsReproduceSignal() throws Exception {
    AcquisitionHeader header = SyntheticSignals.header(512);
    Complex[] fid = SyntheticSignals.brain(header);
    List<Hsvd.Component> components = new Hsvd().decompose(fid, header.getDwellTime(), 20, 256);

    Complex[] model = SyntheticSignals.zeros(fid.length);
    for (Hsvd.Component component : components) {
      model = SpectralOps.add(model, component.synthesize(fid.length));
    }
    assertEquals(3, components.size());
    assertEquals(0.0, SyntheticSignals.maxAbsDifference(fid, model), 1e-6);
  }
}
