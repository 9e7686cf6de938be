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

package com.twentyn.mrs.reference;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of referencing one spectrum on a landmark.  The shift is the observed position minus the canonical one, so
 * applying freqShift(-shiftHz) references the spectrum.
 */
public class ReferenceResult {
  @JsonProperty("landmark")
  private final Landmark landmark;

  @JsonProperty("shift_hz")
  private final double shiftHz;

  @JsonProperty("shift_ppm")
  private final double shiftPpm;

  @JsonProperty("linewidth_hz")
  private final double linewidthHz;

  @JsonProperty("phase_rad")
  private final double phaseRad;

  @JsonProperty("converged")
  private final boolean converged;

  public ReferenceResult(Landmark landmark, double shiftHz, double shiftPpm, double linewidthHz, double phaseRad,
                         boolean converged) {
    this.landmark = landmark;
    this.shiftHz = shiftHz;
    this.shiftPpm = shiftPpm;
    this.linewidthHz = linewidthHz;
    this.phaseRad = phaseRad;
    this.converged = converged;
  }

  public Landmark getLandmark() {
    return landmark;
  }

  public double getShiftHz() {
    return shiftHz;
  }

  public double getShiftPpm() {
    return shiftPpm;
  }

  /** Full width at half maximum of the fitted landmark, NaN when only a peak search was possible. */
  public double getLinewidthHz() {
    return linewidthHz;
  }

  public double getPhaseRad() {
    return phaseRad;
  }

  public boolean isConverged() {
    return converged;
  }

  @Override
  public String toString() {
    return String.format("ReferenceResult{%s, shift=%.3f Hz (%.4f ppm), fwhm=%.2f Hz, phase=%.3f rad, converged=%s}",
        landmark, shiftHz, shiftPpm, linewidthHz, phaseRad, converged);
  }
}
