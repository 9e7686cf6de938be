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
import com.twentyn.mrs.reference.Landmark;
import com.twentyn.mrs.signal.ConditionKind;
import com.twentyn.mrs.signal.Spectrum;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Un-edited (PRESS, STEAM, sLASER) acquisitions: one condition, nothing to classify or combine. */
public class UneditedProtocol extends AbstractAcquisitionProtocol {
  private final Landmark alignmentLandmark;

  public UneditedProtocol() {
    this(Landmark.CR_CHO);
  }

  public UneditedProtocol(Landmark alignmentLandmark) {
    super(AcquisitionType.UNEDITED, EditTarget.NONE, 1);
    this.alignmentLandmark = alignmentLandmark;
  }

  @Override
  public double[] getPolarityWindow() {
    return new double[]{PolarityCorrector.NAA_LOW_PPM, PolarityCorrector.NAA_HIGH_PPM};
  }

  @Override
  public double[] getAlignmentLandmarks() {
    return alignmentLandmark.getCanonicalPpm();
  }

  @Override
  public EditClassification classify(List<Spectrum> subSpectra) {
    requireCount(subSpectra);
    Map<ConditionKind, Spectrum> spectra = new EnumMap<>(ConditionKind.class);
    spectra.put(ConditionKind.OFF, subSpectra.get(0));
    Map<ConditionKind, Integer> index = new EnumMap<>(ConditionKind.class);
    index.put(ConditionKind.OFF, 0);
    return new EditClassification(spectra, index, false);
  }

  @Override
  public Map<ConditionKind, Spectrum> combine(EditClassification classification) {
    return Collections.emptyMap();
  }

  @Override
  public List<ConditionKind> getAcquiredConditions() {
    return Collections.singletonList(ConditionKind.OFF);
  }

  @Override
  public List<ConditionKind> getDerivedConditions() {
    return Collections.emptyList();
  }
}
