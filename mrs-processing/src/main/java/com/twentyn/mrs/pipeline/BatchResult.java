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

import com.twentyn.mrs.quality.QualityReport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a batch run: results of the datasets that were processed, in input order, the quality report over all
 * of them and the ids of datasets skipped after cancellation.
 */
public class BatchResult {
  private final List<DatasetResult> results;
  private final List<String> skipped;
  private final QualityReport qualityReport;
  private final boolean cancelled;

  BatchResult(List<DatasetResult> results, List<String> skipped, QualityReport qualityReport, boolean cancelled) {
    this.results = Collections.unmodifiableList(new ArrayList<>(results));
    this.skipped = Collections.unmodifiableList(new ArrayList<>(skipped));
    this.qualityReport = qualityReport;
    this.cancelled = cancelled;
  }

  public List<DatasetResult> getResults() {
    return results;
  }

  public DatasetResult getResult(String datasetId) {
    for (DatasetResult result : results) {
      if (result.getId().equals(datasetId)) {
        return result;
      }
    }
    return null;
  }

  public List<String> getSkipped() {
    return skipped;
  }

  public QualityReport getQualityReport() {
    return qualityReport;
  }

  public boolean isCancelled() {
    return cancelled;
  }
}
