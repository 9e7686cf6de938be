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

import com.twentyn.mrs.exceptions.PreconditionViolationException;
import com.twentyn.mrs.quality.QualityWindow;
import com.twentyn.mrs.signal.ConditionKind;
import com.twentyn.mrs.signal.Spectrum;
import com.twentyn.mrs.signal.TimeDomainSignal;

import java.util.ArrayList;
import java.util.List;

public abstract class AbstractAcquisitionProtocol implements AcquisitionProtocol {
  private final AcquisitionType type;
  private final EditTarget target;
  private final int subExperimentCount;

  protected AbstractAcquisitionProtocol(AcquisitionType type, EditTarget target, int subExperimentCount) {
    this.type = type;
    this.target = target;
    this.subExperimentCount = subExperimentCount;
  }

  @Override
  public AcquisitionType getType() {
    return type;
  }

  @Override
  public EditTarget getTarget() {
    return target;
  }

  @Override
  public int getSubExperimentCount() {
    return subExperimentCount;
  }

  @Override
  public List<TimeDomainSignal> splitSubExperiments(TimeDomainSignal signal) {
    signal.requireNonEmpty();
    List<TimeDomainSignal> parts = new ArrayList<>(subExperimentCount);
    if (signal.getSubSpectrumCount() == subExperimentCount) {
      for (int s = 0; s < subExperimentCount; s++) {
        parts.add(signal.subSpectrum(s));
      }
      return parts;
    }
    if (signal.getSubSpectrumCount() == 1 && signal.getAverageCount() % subExperimentCount == 0) {
      int perPart = signal.getAverageCount() / subExperimentCount;
      for (int s = 0; s < subExperimentCount; s++) {
        int[] indices = new int[perPart];
        for (int k = 0; k < perPart; k++) {
          indices[k] = s + k * subExperimentCount;
        }
        parts.add(signal.selectAverages(indices));
      }
      return parts;
    }
    throw new PreconditionViolationException(String.format(
        "%s data needs %d sub-spectra (or a multiple of %d interleaved averages), got %d sub-spectra with %d averages",
        type, subExperimentCount, subExperimentCount, signal.getSubSpectrumCount(), signal.getAverageCount()));
  }

  @Override
  public QualityWindow qualityWindow(ConditionKind kind) {
    return QualityWindow.forCondition(kind);
  }

  protected void requireCount(List<Spectrum> subSpectra) {
    if (subSpectra.size() != subExperimentCount) {
      throw new PreconditionViolationException(String.format(
          "%s classification needs %d sub-spectra, got %d", type, subExperimentCount, subSpectra.size()));
    }
  }

  /** Largest value of a - b over the index range. */
  protected static double maxDifference(double[] a, double[] b, int[] range) {
    double max = Double.NEGATIVE_INFINITY;
    for (int i = range[0]; i <= range[1]; i++) {
      max = Math.max(max, a[i] - b[i]);
    }
    return max;
  }

  @Override
  public String toString() {
    return String.format("%s(%s)", type, target);
  }
}
