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
import com.twentyn.mrs.fit.FitParameters;
import com.twentyn.mrs.quality.QualityMetrics;
import com.twentyn.mrs.signal.ConditionKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Everything produced for one dataset.  A dataset that could not be processed at all carries only its failures.
 */
public class DatasetResult {

  @JsonProperty("id")
  private final String id;

  @JsonProperty("spectra")
  private final Map<ConditionKind, ProcessedSpectrum> spectra = new EnumMap<>(ConditionKind.class);

  @JsonProperty("fits")
  private final Map<ConditionKind, FitParameters> fits = new EnumMap<>(ConditionKind.class);

  @JsonProperty("quality")
  private final Map<ConditionKind, QualityMetrics> quality = new EnumMap<>(ConditionKind.class);

  @JsonProperty("creatine_ratios")
  private final Map<ConditionKind, Map<String, Double>> creatineRatios = new EnumMap<>(ConditionKind.class);

  @JsonProperty("water_scaled")
  private final Map<ConditionKind, Map<String, Double>> waterScaled = new EnumMap<>(ConditionKind.class);

  @JsonProperty("failures")
  private final List<String> failures = new ArrayList<>();

  @JsonProperty("processed")
  private boolean processed;

  public DatasetResult(String id) {
    this.id = id;
  }

  public static DatasetResult failed(String id, String reason) {
    DatasetResult result = new DatasetResult(id);
    result.addFailure(reason);
    return result;
  }

  void putSpectrum(ProcessedSpectrum spectrum) {
    spectra.put(spectrum.getCondition(), spectrum);
  }

  void putFit(ConditionKind kind, FitParameters fit) {
    fits.put(kind, fit);
    if (fit.isFailed()) {
      addFailure(String.format("Fit of %s failed in %s: %s", kind, fit.getFailedStage(), fit.getFailureReason()));
    }
  }

  void putQuality(QualityMetrics metrics) {
    quality.put(metrics.getCondition(), metrics);
  }

  void putCreatineRatios(ConditionKind kind, Map<String, Double> ratios) {
    creatineRatios.put(kind, ratios);
  }

  void putWaterScaled(ConditionKind kind, Map<String, Double> scaled) {
    waterScaled.put(kind, scaled);
  }

  void addFailure(String reason) {
    failures.add(reason);
  }

  void markProcessed() {
    processed = true;
  }

  public String getId() {
    return id;
  }

  /** Null when the condition was not produced. */
  public ProcessedSpectrum getSpectrum(ConditionKind kind) {
    return spectra.get(kind);
  }

  public Map<ConditionKind, ProcessedSpectrum> getSpectra() {
    return Collections.unmodifiableMap(spectra);
  }

  public FitParameters getFit(ConditionKind kind) {
    return fits.get(kind);
  }

  public Map<ConditionKind, FitParameters> getFits() {
    return Collections.unmodifiableMap(fits);
  }

  public QualityMetrics getQuality(ConditionKind kind) {
    return quality.get(kind);
  }

  public Map<ConditionKind, QualityMetrics> getQuality() {
    return Collections.unmodifiableMap(quality);
  }

  public Map<ConditionKind, Map<String, Double>> getCreatineRatios() {
    return Collections.unmodifiableMap(creatineRatios);
  }

  public Map<ConditionKind, Map<String, Double>> getWaterScaled() {
    return Collections.unmodifiableMap(waterScaled);
  }

  public List<String> getFailures() {
    return Collections.unmodifiableList(failures);
  }

  /** False for datasets that were skipped or aborted. */
  public boolean isProcessed() {
    return processed;
  }

  @JsonIgnore
  public boolean hasFailures() {
    return !failures.isEmpty();
  }
}
