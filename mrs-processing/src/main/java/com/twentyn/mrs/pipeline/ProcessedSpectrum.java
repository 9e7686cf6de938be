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

package com.twentyn.mrs.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.twentyn.mrs.align.AlignmentResult;
import com.twentyn.mrs.signal.ConditionKind;
import com.twentyn.mrs.signal.Spectrum;

/**
 * One processed condition of a dataset together with the provenance of every correction applied to it.  Each
 * processing step returns a new instance.
 */
public class ProcessedSpectrum {

  @JsonIgnore
  private Spectrum spectrum;

  @JsonProperty("condition")
  private ConditionKind condition;

  @JsonProperty("frequency_shifts_hz")
  private double[] frequencyShiftsHz;

  @JsonProperty("phase_shifts_deg")
  private double[] phaseShiftsDeg;

  @JsonProperty("weights")
  private double[] weights;

  @JsonProperty("drift_pre")
  private double[] driftPre;

  @JsonProperty("drift_post")
  private double[] driftPost;

  @JsonProperty("reference_shift_hz")
  private double referenceShiftHz;

  @JsonProperty("applied_phase_rad")
  private double appliedPhaseRad;

  @JsonProperty("switch_order")
  private boolean switchOrder;

  @JsonProperty("eddy_current_corrected")
  private boolean eddyCurrentCorrected;

  @JsonProperty("polarity_flipped")
  private boolean polarityFlipped;

  @JsonProperty("water_removal_order")
  private int waterRemovalOrder = -1;

  @JsonProperty("water_removal_failed")
  private boolean waterRemovalFailed;

  @JsonProperty("alignment_degraded")
  private boolean alignmentDegraded;

  private ProcessedSpectrum() {
  }

  public ProcessedSpectrum(ConditionKind condition, Spectrum spectrum) {
    this.condition = condition;
    this.spectrum = spectrum;
    this.frequencyShiftsHz = new double[0];
    this.phaseShiftsDeg = new double[0];
    this.weights = new double[0];
    this.driftPre = new double[0];
    this.driftPost = new double[0];
  }

  public static ProcessedSpectrum fromAlignment(ConditionKind condition, AlignmentResult alignment) {
    ProcessedSpectrum processed = new ProcessedSpectrum(condition, alignment.getAveraged());
    processed.frequencyShiftsHz = alignment.getFrequencyShiftsHz();
    processed.phaseShiftsDeg = alignment.getPhaseShiftsDeg();
    processed.weights = alignment.getWeights();
    processed.driftPre = alignment.getDriftPre();
    processed.driftPost = alignment.getDriftPost();
    processed.alignmentDegraded = alignment.isDegraded();
    return processed;
  }

  private ProcessedSpectrum copy() {
    ProcessedSpectrum copy = new ProcessedSpectrum();
    copy.spectrum = spectrum;
    copy.condition = condition;
    copy.frequencyShiftsHz = frequencyShiftsHz.clone();
    copy.phaseShiftsDeg = phaseShiftsDeg.clone();
    copy.weights = weights.clone();
    copy.driftPre = driftPre.clone();
    copy.driftPost = driftPost.clone();
    copy.referenceShiftHz = referenceShiftHz;
    copy.appliedPhaseRad = appliedPhaseRad;
    copy.switchOrder = switchOrder;
    copy.eddyCurrentCorrected = eddyCurrentCorrected;
    copy.polarityFlipped = polarityFlipped;
    copy.waterRemovalOrder = waterRemovalOrder;
    copy.waterRemovalFailed = waterRemovalFailed;
    copy.alignmentDegraded = alignmentDegraded;
    return copy;
  }

  public ProcessedSpectrum withSpectrum(Spectrum newSpectrum) {
    ProcessedSpectrum copy = copy();
    copy.spectrum = newSpectrum;
    return copy;
  }

  public ProcessedSpectrum withCondition(ConditionKind newCondition) {
    ProcessedSpectrum copy = copy();
    copy.condition = newCondition;
    return copy;
  }

  /** Shifts the spectrum by -shiftHz and accumulates the reference shift. */
  public ProcessedSpectrum referenced(double shiftHz) {
    ProcessedSpectrum copy = copy();
    copy.spectrum = spectrum.freqShift(-shiftHz);
    copy.referenceShiftHz += shiftHz;
    return copy;
  }

  /**
   * Adds a zero-order phase to the spectrum.  The applied phase is accumulated and folded into the per-average phases.
   */
  public ProcessedSpectrum phased(double radians) {
    ProcessedSpectrum copy = copy();
    copy.spectrum = spectrum.phaseShift(radians);
    copy.appliedPhaseRad += radians;
    for (int k = 0; k < copy.phaseShiftsDeg.length; k++) {
      copy.phaseShiftsDeg[k] += Math.toDegrees(radians);
    }
    return copy;
  }

  /** Records a shift and phase that the spectrum already carries, without touching the spectrum. */
  ProcessedSpectrum withAppliedCorrections(double shiftHz, double radians) {
    ProcessedSpectrum copy = copy();
    copy.referenceShiftHz += shiftHz;
    copy.appliedPhaseRad += radians;
    for (int k = 0; k < copy.phaseShiftsDeg.length; k++) {
      copy.phaseShiftsDeg[k] += Math.toDegrees(radians);
    }
    return copy;
  }

  public ProcessedSpectrum withSwitchOrder(boolean newSwitchOrder) {
    ProcessedSpectrum copy = copy();
    copy.switchOrder = newSwitchOrder;
    return copy;
  }

  public ProcessedSpectrum withEddyCurrentCorrection(boolean applied) {
    ProcessedSpectrum copy = copy();
    copy.eddyCurrentCorrected = applied;
    return copy;
  }

  public ProcessedSpectrum withPolarityFlipped(boolean flipped) {
    ProcessedSpectrum copy = copy();
    copy.polarityFlipped = flipped;
    return copy;
  }

  public ProcessedSpectrum withWaterRemoval(Spectrum filtered, int order, boolean failed) {
    ProcessedSpectrum copy = copy();
    copy.spectrum = filtered;
    copy.waterRemovalOrder = order;
    copy.waterRemovalFailed = failed;
    return copy;
  }

  public ProcessedSpectrum withDrift(double[] pre, double[] post) {
    ProcessedSpectrum copy = copy();
    copy.driftPre = pre.clone();
    copy.driftPost = post.clone();
    return copy;
  }

  public Spectrum getSpectrum() {
    return spectrum;
  }

  public ConditionKind getCondition() {
    return condition;
  }

  public double[] getFrequencyShiftsHz() {
    return frequencyShiftsHz.clone();
  }

  public double[] getPhaseShiftsDeg() {
    return phaseShiftsDeg.clone();
  }

  public double[] getWeights() {
    return weights.clone();
  }

  public double[] getDriftPre() {
    return driftPre.clone();
  }

  public double[] getDriftPost() {
    return driftPost.clone();
  }

  public double getReferenceShiftHz() {
    return referenceShiftHz;
  }

  public double getAppliedPhaseRad() {
    return appliedPhaseRad;
  }

  public boolean isSwitchOrder() {
    return switchOrder;
  }

  public boolean isEddyCurrentCorrected() {
    return eddyCurrentCorrected;
  }

  public boolean isPolarityFlipped() {
    return polarityFlipped;
  }

  public int getWaterRemovalOrder() {
    return waterRemovalOrder;
  }

  public boolean isWaterRemovalFailed() {
    return waterRemovalFailed;
  }

  public boolean isAlignmentDegraded() {
    return alignmentDegraded;
  }
}
