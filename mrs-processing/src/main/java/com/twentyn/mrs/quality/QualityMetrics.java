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

package com.twentyn.mrs.quality;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.twentyn.mrs.align.DriftMeter;
import com.twentyn.mrs.signal.ConditionKind;
import com.twentyn.mrs.signal.Spectrum;

/**
 * SNR, linewidth and drift summary of one processed condition.
 */
public class QualityMetrics {

  @JsonProperty("condition")
  private final ConditionKind condition;

  @JsonProperty("snr")
  private final double snr;

  @JsonProperty("fwhm_hz")
  private final double fwhmHz;

  @JsonProperty("fwhm_ppm")
  private final double fwhmPpm;

  @JsonProperty("drift_pre")
  private final double[] driftPre;

  @JsonProperty("drift_post")
  private final double[] driftPost;

  @JsonProperty("mean_delta_cr_pre")
  private final double meanDeltaCrPre;

  @JsonProperty("mean_delta_cr_post")
  private final double meanDeltaCrPost;

  @JsonCreator
  public QualityMetrics(@JsonProperty("condition") ConditionKind condition,
                        @JsonProperty("snr") double snr,
                        @JsonProperty("fwhm_hz") double fwhmHz,
                        @JsonProperty("fwhm_ppm") double fwhmPpm,
                        @JsonProperty("drift_pre") double[] driftPre,
                        @JsonProperty("drift_post") double[] driftPost,
                        @JsonProperty("mean_delta_cr_pre") double meanDeltaCrPre,
                        @JsonProperty("mean_delta_cr_post") double meanDeltaCrPost) {
    this.condition = condition;
    this.snr = snr;
    this.fwhmHz = fwhmHz;
    this.fwhmPpm = fwhmPpm;
    this.driftPre = driftPre == null ? new double[0] : driftPre.clone();
    this.driftPost = driftPost == null ? new double[0] : driftPost.clone();
    this.meanDeltaCrPre = meanDeltaCrPre;
    this.meanDeltaCrPost = meanDeltaCrPost;
  }

  /** Measures a spectrum in the windows that belong to its condition. */
  public static QualityMetrics measure(ConditionKind condition, Spectrum spectrum, QualityWindow window,
                                       double[] driftPre, double[] driftPost) {
    double snr = new SignalToNoise().compute(spectrum, window.getSnrWindow());
    double fwhmHz = new Linewidth().measure(spectrum, window.getLinewidthWindow());
    double fwhmPpm = spectrum.getHeader().hzToPpm(fwhmHz);
    return new QualityMetrics(condition, snr, fwhmHz, fwhmPpm, driftPre, driftPost,
        DriftMeter.meanDeviation(driftPre), DriftMeter.meanDeviation(driftPost));
  }

  public ConditionKind getCondition() {
    return condition;
  }

  public double getSnr() {
    return snr;
  }

  public double getFwhmHz() {
    return fwhmHz;
  }

  public double getFwhmPpm() {
    return fwhmPpm;
  }

  public double[] getDriftPre() {
    return driftPre.clone();
  }

  public double[] getDriftPost() {
    return driftPost.clone();
  }

  public double getMeanDeltaCrPre() {
    return meanDeltaCrPre;
  }

  public double getMeanDeltaCrPost() {
    return meanDeltaCrPost;
  }

  @Override
  public String toString() {
    return String.format("QualityMetrics{%s: SNR %.1f, FWHM %.2f Hz (%.4f ppm)}", condition, snr, fwhmHz, fwhmPpm);
  }
}
