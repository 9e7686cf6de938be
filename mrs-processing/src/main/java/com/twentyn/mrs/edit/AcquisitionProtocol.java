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

import com.twentyn.mrs.quality.QualityWindow;
import com.twentyn.mrs.signal.ConditionKind;
import com.twentyn.mrs.signal.Spectrum;
import com.twentyn.mrs.signal.TimeDomainSignal;

import java.util.List;
import java.util.Map;

/**
 * Acquisition-type specific behaviour of the processing pipeline, selected once per configuration.
 */
public interface AcquisitionProtocol {
  AcquisitionType getType();

  EditTarget getTarget();

  /** Number of interleaved sub-experiments: 1 for un-edited data, 2 for MEGA, 4 for HERMES and HERCULES. */
  int getSubExperimentCount();

  /**
   * Separates a raw signal into its sub-experiments, either along the sub-spectrum axis or, when the sub-experiments
   * were stored as interleaved averages, by taking every n-th average.
   */
  List<TimeDomainSignal> splitSubExperiments(TimeDomainSignal signal);

  /** ppm window whose resonance decides whether spectra are inverted. */
  double[] getPolarityWindow();

  /** Canonical ppm positions of the synthetic comb used for coarse frequency estimates. */
  double[] getAlignmentLandmarks();

  /** Labels the sub-experiment spectra; the list is in acquisition order. */
  EditClassification classify(List<Spectrum> subSpectra);

  /** Derived spectra (sums and differences) of a classification.  Empty for un-edited data. */
  Map<ConditionKind, Spectrum> combine(EditClassification classification);

  QualityWindow qualityWindow(ConditionKind kind);

  /** Conditions produced by classification, in semantic order. */
  List<ConditionKind> getAcquiredConditions();

  /** Conditions produced by combination. */
  List<ConditionKind> getDerivedConditions();
}
