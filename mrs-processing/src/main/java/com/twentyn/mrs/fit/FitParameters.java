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

package com.twentyn.mrs.fit;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a model fit.  A failed fit carries NaN in every numeric field, the stage it failed in and the reason.
 */
public class FitParameters {

  @JsonProperty("stage")
  private FitStage stage;

  @JsonProperty("failed_stage")
  private FitStage failedStage;

  @JsonProperty("failure_reason")
  private String failureReason;

  @JsonProperty("amplitudes")
  private Map<String, Double> amplitudes;

  @JsonProperty("lorentzian_linewidth_hz")
  private Map<String, Double> lorentzianHz;

  @JsonProperty("frequency_shift_hz")
  private Map<String, Double> shiftHz;

  @JsonProperty("baseline_coefficients")
  private double[] baselineCoefficients;

  @JsonProperty("ph0_rad")
  private double ph0Rad;

  @JsonProperty("ph1_rad_per_ppm")
  private double ph1RadPerPpm;

  @JsonProperty("gaussian_linewidth_hz")
  private double gaussianHz;

  @JsonProperty("global_shift_hz")
  private double globalShiftHz;

  @JsonProperty("reference_shift_hz")
  private double referenceShiftHz;

  @JsonProperty("reference_fwhm_hz")
  private double referenceFwhmHz;

  @JsonProperty("residual_sum_of_squares")
  private double residualSumOfSquares;

  @JsonProperty("fit_range_ppm")
  private double[] fitRangePpm;

  @JsonProperty("basis_normalization")
  private double basisNormalization;

  // Jackson only.
  private FitParameters() {
  }

  FitParameters(Map<String, Double> amplitudes, Map<String, Double> lorentzianHz, Map<String, Double> shiftHz,
                double[] baselineCoefficients, double ph0Rad, double ph1RadPerPpm, double gaussianHz,
                double globalShiftHz, double referenceShiftHz, double referenceFwhmHz, double residualSumOfSquares,
                double[] fitRangePpm, double basisNormalization) {
    this.stage = FitStage.COMPLETE;
    this.amplitudes = new LinkedHashMap<>(amplitudes);
    this.lorentzianHz = new LinkedHashMap<>(lorentzianHz);
    this.shiftHz = new LinkedHashMap<>(shiftHz);
    this.baselineCoefficients = baselineCoefficients.clone();
    this.ph0Rad = ph0Rad;
    this.ph1RadPerPpm = ph1RadPerPpm;
    this.gaussianHz = gaussianHz;
    this.globalShiftHz = globalShiftHz;
    this.referenceShiftHz = referenceShiftHz;
    this.referenceFwhmHz = referenceFwhmHz;
    this.residualSumOfSquares = residualSumOfSquares;
    this.fitRangePpm = fitRangePpm.clone();
    this.basisNormalization = basisNormalization;
  }

  /** The sentinel recorded when a stage produced a non-finite objective or threw. */
  public static FitParameters failed(FitStage failedStage, String reason, double[] fitRangePpm) {
    FitParameters failed = new FitParameters();
    failed.stage = FitStage.FAILED;
    failed.failedStage = failedStage;
    failed.failureReason = reason;
    failed.amplitudes = Collections.emptyMap();
    failed.lorentzianHz = Collections.emptyMap();
    failed.shiftHz = Collections.emptyMap();
    failed.baselineCoefficients = new double[0];
    failed.ph0Rad = Double.NaN;
    failed.ph1RadPerPpm = Double.NaN;
    failed.gaussianHz = Double.NaN;
    failed.globalShiftHz = Double.NaN;
    failed.referenceShiftHz = Double.NaN;
    failed.referenceFwhmHz = Double.NaN;
    failed.residualSumOfSquares = Double.NaN;
    failed.fitRangePpm = fitRangePpm.clone();
    failed.basisNormalization = Double.NaN;
    return failed;
  }

  public FitStage getStage() {
    return stage;
  }

  @JsonIgnore
  public boolean isFailed() {
    return stage == FitStage.FAILED;
  }

  public FitStage getFailedStage() {
    return failedStage;
  }

  public String getFailureReason() {
    return failureReason;
  }

  public Map<String, Double> getAmplitudes() {
    return Collections.unmodifiableMap(amplitudes);
  }

  /** NaN for a failed fit or a name that was not fitted. */
  public double amplitudeOf(String name) {
    Double amplitude = amplitudes.get(name);
    return amplitude == null ? Double.NaN : amplitude;
  }

  public Map<String, Double> getLorentzianHz() {
    return Collections.unmodifiableMap(lorentzianHz);
  }

  public Map<String, Double> getShiftHz() {
    return Collections.unmodifiableMap(shiftHz);
  }

  public double[] getBaselineCoefficients() {
    return baselineCoefficients.clone();
  }

  public double getPh0Rad() {
    return ph0Rad;
  }

  public double getPh1RadPerPpm() {
    return ph1RadPerPpm;
  }

  public double getGaussianHz() {
    return gaussianHz;
  }

  public double getGlobalShiftHz() {
    return globalShiftHz;
  }

  public double getReferenceShiftHz() {
    return referenceShiftHz;
  }

  public double getReferenceFwhmHz() {
    return referenceFwhmHz;
  }

  public double getResidualSumOfSquares() {
    return residualSumOfSquares;
  }

  public double[] getFitRangePpm() {
    return fitRangePpm.clone();
  }

  /** Factor the basis set was divided by; amplitude / normalization is in units of the original basis. */
  public double getBasisNormalization() {
    return basisNormalization;
  }

  @Override
  public String toString() {
    if (isFailed()) {
      return String.format("FitParameters{FAILED in %s: %s}", failedStage, failureReason);
    }
    return String.format("FitParameters{ph0=%.3f, ph1=%.4f, gauss=%.2f Hz, shift=%.2f Hz, amplitudes=%s}",
        ph0Rad, ph1RadPerPpm, gaussianHz, globalShiftHz, amplitudes);
  }
}
