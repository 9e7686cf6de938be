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

package com.twentyn.mrs.edit;

import com.twentyn.mrs.correct.PolarityCorrector;
import com.twentyn.mrs.exceptions.UnsupportedEditTargetException;
import com.twentyn.mrs.reference.Landmark;
import com.twentyn.mrs.signal.ConditionKind;
import com.twentyn.mrs.signal.PpmAxis;
import com.twentyn.mrs.signal.Spectrum;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * MEGA difference editing with two interleaved sub-experiments.
 *
 * For GABA the editing pulse at 1.9 ppm partially saturates NAA, so the OFF spectrum is the one whose magnitude
 * exceeds the other by the larger margin in 1.7-2.3 ppm.
 */
public class MegaProtocol extends AbstractAcquisitionProtocol {
  public static final double GABA_CLASSIFY_LOW_PPM = 1.7;
  public static final double GABA_CLASSIFY_HIGH_PPM = 2.3;

  public MegaProtocol(EditTarget target) {
    super(AcquisitionType.MEGA, target, 2);
    if (target != EditTarget.GABA) {
      throw new UnsupportedEditTargetException(String.format(
          "Automatic ON/OFF classification of MEGA data is only available for GABA, not %s", target));
    }
  }

  @Override
  public double[] getPolarityWindow() {
    return new double[]{PolarityCorrector.CR_LOW_PPM, PolarityCorrector.CR_HIGH_PPM};
  }

  @Override
  public double[] getAlignmentLandmarks() {
    return Landmark.CR_CHO.getCanonicalPpm();
  }

  /**
   * The first sub-spectrum is OFF only when its margin over the second is strictly larger than the reverse margin.
   * Equal margins, as for identical sub-spectra, classify the second sub-spectrum as OFF and report a switched order
   * whichever way round the two are passed.
   */
  @Override
  public EditClassification classify(List<Spectrum> subSpectra) {
    requireCount(subSpectra);
    Spectrum a = subSpectra.get(0);
    Spectrum b = subSpectra.get(1);
    PpmAxis axis = a.ppmAxis();
    int[] range = axis.indexRange(GABA_CLASSIFY_LOW_PPM, GABA_CLASSIFY_HIGH_PPM);
    double[] magA = a.magnitudeSpectrum();
    double[] magB = b.magnitudeSpectrum();
    boolean aIsOff = maxDifference(magA, magB, range) > maxDifference(magB, magA, range);

    Map<ConditionKind, Spectrum> spectra = new EnumMap<>(ConditionKind.class);
    Map<ConditionKind, Integer> index = new EnumMap<>(ConditionKind.class);
    spectra.put(ConditionKind.OFF, aIsOff ? a : b);
    spectra.put(ConditionKind.ON, aIsOff ? b : a);
    index.put(ConditionKind.OFF, aIsOff ? 0 : 1);
    index.put(ConditionKind.ON, aIsOff ? 1 : 0);
    return new EditClassification(spectra, index, !aIsOff);
  }

  /** SUM = OFF + ON, DIFF1 = ON - OFF. */
  @Override
  public Map<ConditionKind, Spectrum> combine(EditClassification classification) {
    Spectrum off = classification.get(ConditionKind.OFF);
    Spectrum on = classification.get(ConditionKind.ON);
    Map<ConditionKind, Spectrum> derived = new EnumMap<>(ConditionKind.class);
    derived.put(ConditionKind.DIFF1, on.subtract(off));
    derived.put(ConditionKind.SUM, off.add(on));
    return derived;
  }

  @Override
  public List<ConditionKind> getAcquiredConditions() {
    return Arrays.asList(ConditionKind.OFF, ConditionKind.ON);
  }

  @Override
  public List<ConditionKind> getDerivedConditions() {
    return Arrays.asList(ConditionKind.DIFF1, ConditionKind.SUM);
  }
}
