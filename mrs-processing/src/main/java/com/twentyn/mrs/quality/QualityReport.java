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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.twentyn.mrs.signal.ConditionKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Quality metrics keyed by dataset and condition, plus the reasons of datasets or stages that failed.  Safe to fill
 * from several worker threads.
 */
public class QualityReport {

  @JsonProperty("metrics")
  private final Map<String, Map<ConditionKind, QualityMetrics>> metrics = new TreeMap<>();

  @JsonProperty("failures")
  private final Map<String, List<String>> failures = new TreeMap<>();

  public synchronized void record(String datasetId, QualityMetrics quality) {
    Map<ConditionKind, QualityMetrics> byCondition = metrics.get(datasetId);
    if (byCondition == null) {
      byCondition = new EnumMap<>(ConditionKind.class);
      metrics.put(datasetId, byCondition);
    }
    byCondition.put(quality.getCondition(), quality);
  }

  public synchronized void recordFailure(String datasetId, String reason) {
    List<String> reasons = failures.get(datasetId);
    if (reasons == null) {
      reasons = new ArrayList<>();
      failures.put(datasetId, reasons);
    }
    reasons.add(reason);
  }

  /** Null when the dataset or condition was not measured. */
  public synchronized QualityMetrics get(String datasetId, ConditionKind condition) {
    Map<ConditionKind, QualityMetrics> byCondition = metrics.get(datasetId);
    return byCondition == null ? null : byCondition.get(condition);
  }

  public synchronized Map<ConditionKind, QualityMetrics> forDataset(String datasetId) {
    Map<ConditionKind, QualityMetrics> byCondition = metrics.get(datasetId);
    if (byCondition == null) {
      return Collections.emptyMap();
    }
    return Collections.unmodifiableMap(new EnumMap<>(byCondition));
  }

  public synchronized List<String> datasets() {
    return new ArrayList<>(metrics.keySet());
  }

  public synchronized boolean hasFailures(String datasetId) {
    return failures.containsKey(datasetId);
  }

  public synchronized List<String> failuresOf(String datasetId) {
    List<String> reasons = failures.get(datasetId);
    return reasons == null ? Collections.<String>emptyList() : new ArrayList<>(reasons);
  }

  public synchronized Map<String, List<String>> getFailures() {
    Map<String, List<String>> copy = new TreeMap<>();
    for (Map.Entry<String, List<String>> entry : failures.entrySet()) {
      copy.put(entry.getKey(), new ArrayList<>(entry.getValue()));
    }
    return copy;
  }
}
