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

import com.twentyn.mrs.signal.Spectrum;

/**
 * Averaged spectrum of one sub-spectrum plus the per-average corrections that produced it.
 */
public class AlignmentResult {
  private final Spectrum averaged;
  private final double[] frequencyShiftsHz;
  private final double[] phaseShiftsDeg;
  private final double[] weights;
  private final double[] driftPre;
  private final double[] driftPost;
  private final boolean aligned;
  private final boolean degraded;

  public AlignmentResult(Spectrum averaged, double[] frequencyShiftsHz, double[] phaseShiftsDeg, double[] weights,
                         double[] driftPre, double[] driftPost, boolean aligned, boolean degraded) {
    this.averaged = averaged;
    this.frequencyShiftsHz = frequencyShiftsHz.clone();
    this.phaseShiftsDeg = phaseShiftsDeg.clone();
    this.weights = weights.clone();
    this.driftPre = driftPre.clone();
    this.driftPost = driftPost.clone();
    this.aligned = aligned;
    this.degraded = degraded;
  }

  public Spectrum getAveraged() {
    return averaged;
  }

  public double[] getFrequencyShiftsHz() {
    return frequencyShiftsHz.clone();
  }

  public double[] getPhaseShiftsDeg() {
    return phaseShiftsDeg.clone();
  }

  /** In [0, 1] with maximum 1. */
  public double[] getWeights() {
    return weights.clone();
  }

  public double[] getDriftPre() {
    return driftPre.clone();
  }

  public double[] getDriftPost() {
    return driftPost.clone();
  }

  /** False when the input was a single or pre-combined average and no registration ran. */
  public boolean isAligned() {
    return aligned;
  }

  /** True when registration fell back to the coarse estimate for at least one average. */
  public boolean isDegraded() {
    return degraded;
  }
}
