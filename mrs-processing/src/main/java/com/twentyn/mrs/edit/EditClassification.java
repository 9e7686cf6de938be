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

import com.twentyn.mrs.signal.ConditionKind;
import com.twentyn.mrs.signal.Spectrum;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Sub-spectra labelled with their edit condition.  The switch-order flag records that the acquisition order
 * differed from the semantic OFF, ON (, ON2, ON12) order; it travels with every spectrum derived from these.
 */
public class EditClassification {
  private final Map<ConditionKind, Spectrum> spectra;
  private final Map<ConditionKind, Integer> acquisitionIndex;
  private final boolean switchOrder;

  public EditClassification(Map<ConditionKind, Spectrum> spectra, Map<ConditionKind, Integer> acquisitionIndex,
                            boolean switchOrder) {
    Map<ConditionKind, Spectrum> spectraCopy = new EnumMap<>(ConditionKind.class);
    spectraCopy.putAll(spectra);
    Map<ConditionKind, Integer> indexCopy = new EnumMap<>(ConditionKind.class);
    indexCopy.putAll(acquisitionIndex);
    this.spectra = Collections.unmodifiableMap(spectraCopy);
    this.acquisitionIndex = Collections.unmodifiableMap(indexCopy);
    this.switchOrder = switchOrder;
  }

  public Spectrum get(ConditionKind kind) {
    Spectrum spectrum = spectra.get(kind);
    if (spectrum == null) {
      throw new IllegalStateException(String.format("No %s spectrum in this classification", kind));
    }
    return spectrum;
  }

  public Map<ConditionKind, Spectrum> getSpectra() {
    return spectra;
  }

  /** Position of the labelled spectrum in the list that was classified. */
  public int getAcquisitionIndex(ConditionKind kind) {
    return acquisitionIndex.get(kind);
  }

  public boolean isSwitchOrder() {
    return switchOrder;
  }

  /** A copy with the spectrum of one condition replaced. */
  public EditClassification with(ConditionKind kind, Spectrum spectrum) {
    Map<ConditionKind, Spectrum> copy = new EnumMap<>(ConditionKind.class);
    copy.putAll(spectra);
    copy.put(kind, spectrum);
    return new EditClassification(copy, acquisitionIndex, switchOrder);
  }
}
