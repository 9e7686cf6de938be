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

import com.twentyn.mrs.exceptions.DataInconsistencyException;
import com.twentyn.mrs.fit.BasisSet;
import com.twentyn.mrs.quality.QualityMetrics;
import com.twentyn.mrs.quality.QualityReport;
import com.twentyn.mrs.signal.ConditionKind;
import com.twentyn.mrs.signal.TimeDomainSignal;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Processes many datasets with one configuration on a fixed pool of worker threads.  A failure in one dataset is
 * recorded against it and never stops the others.  {@link #cancel()} stops datasets that have not started yet; a
 * dataset already running finishes.
 */
public class BatchProcessor {
  private static final Logger LOGGER = LogManager.getFormatterLogger(BatchProcessor.class);

  private final DatasetProcessor processor;
  private final int workerThreads;
  private final ProgressListener listener;
  private final AtomicBoolean cancelled = new AtomicBoolean(false);

  public BatchProcessor(ProcessingConfiguration configuration, Map<ConditionKind, BasisSet> bases,
                        ProgressListener listener) {
    this(new DatasetProcessor(configuration, bases, listener), configuration.getWorkerThreads(), listener);
  }

  BatchProcessor(DatasetProcessor processor, int workerThreads, ProgressListener listener) {
    this.processor = processor;
    this.workerThreads = Math.max(1, workerThreads);
    this.listener = listener == null ? ProgressListener.NO_OP : listener;
  }

  public void cancel() {
    LOGGER.info("Batch cancellation requested");
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /**
   * Checks every dataset of the batch before any of them runs:
   * <ul>
   *   <li>reference, short-TE water and macromolecule signals have the metabolite signal's sample count;</li>
   *   <li>the metabolite averages split evenly into the protocol's sub-experiments;</li>
   *   <li>every basis set matches the sample count of the metabolite and reference signals.</li>
   * </ul>
   * @throws DataInconsistencyException on the first mismatch
   */
  public void validate(List<DatasetInput> inputs) {
    int subExperiments = processor.getProtocol().getSubExperimentCount();
    for (DatasetInput input : inputs) {
      int metabolitePoints = input.getMetabolite().getHeader().getSampleCount();
      requirePaired(input.getId(), "reference", input.getReference(), metabolitePoints);
      requirePaired(input.getId(), "water", input.getWater(), metabolitePoints);
      requirePaired(input.getId(), "macromolecule", input.getMacromolecule(), metabolitePoints);
      requireSplittable(input.getId(), input.getMetabolite(), subExperiments);

      for (Map.Entry<ConditionKind, BasisSet> entry : processor.getBases().entrySet()) {
        int basisPoints = entry.getValue().getHeader().getSampleCount();
        requireSamples(input.getId(), "metabolite", input.getMetabolite(), entry.getKey(), basisPoints);
        if (input.hasReference()) {
          requireSamples(input.getId(), "reference", input.getReference(), entry.getKey(), basisPoints);
        }
      }
    }
  }

  private static void requirePaired(String id, String role, TimeDomainSignal signal, int metabolitePoints) {
    if (signal != null && signal.getHeader().getSampleCount() != metabolitePoints) {
      throw new DataInconsistencyException(String.format(
          "Dataset %s: %s signal has %d points but the metabolite signal has %d", id, role,
          signal.getHeader().getSampleCount(), metabolitePoints));
    }
  }

  private static void requireSplittable(String id, TimeDomainSignal metabolite, int subExperiments) {
    if (subExperiments <= 1 || metabolite.getSubSpectrumCount() == subExperiments) {
      return;
    }
    if (metabolite.getSubSpectrumCount() != 1 || metabolite.getAverageCount() % subExperiments != 0) {
      throw new DataInconsistencyException(String.format(
          "Dataset %s: %d sub-spectra with %d averages cannot be split into %d sub-experiments", id,
          metabolite.getSubSpectrumCount(), metabolite.getAverageCount(), subExperiments));
    }
  }

  private static void requireSamples(String id, String role, TimeDomainSignal signal, ConditionKind kind,
                                     int basisPoints) {
    int points = signal.getHeader().getSampleCount();
    if (points != basisPoints) {
      throw new DataInconsistencyException(String.format(
          "Dataset %s: %s signal has %d points but the %s basis set has %d", id, role, points, kind, basisPoints));
    }
  }

  /**
   * Validates the batch, then processes every dataset.
   * @throws DataInconsistencyException before any processing when the inputs do not match the basis sets
   */
  public BatchResult run(List<DatasetInput> inputs) {
    validate(inputs);
    LOGGER.info("Processing %d datasets on %d worker threads", inputs.size(), workerThreads);
    final QualityReport report = new QualityReport();
    ExecutorService executor = Executors.newFixedThreadPool(Math.min(workerThreads, Math.max(1, inputs.size())));
    List<Future<DatasetResult>> futures = new ArrayList<>(inputs.size());
    try {
      for (DatasetInput input : inputs) {
        futures.add(executor.submit(new DatasetTask(input)));
      }

      List<DatasetResult> results = new ArrayList<>(inputs.size());
      List<String> skipped = new ArrayList<>();
      for (int i = 0; i < futures.size(); i++) {
        String id = inputs.get(i).getId();
        DatasetResult result;
        try {
          result = futures.get(i).get();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          LOGGER.warn("Interrupted while waiting for dataset %s, cancelling the rest of the batch", id);
          cancel();
          result = null;
        } catch (ExecutionException e) {
          throw new IllegalStateException("Processing of dataset " + id + " aborted", e.getCause());
        }
        if (result == null) {
          skipped.add(id);
          continue;
        }
        results.add(result);
        for (QualityMetrics metrics : result.getQuality().values()) {
          report.record(id, metrics);
        }
        for (String failure : result.getFailures()) {
          report.recordFailure(id, failure);
        }
      }
      LOGGER.info("Batch finished: %d processed, %d skipped", results.size(), skipped.size());
      return new BatchResult(results, skipped, report, cancelled.get());
    } finally {
      executor.shutdownNow();
    }
  }

  private class DatasetTask implements Callable<DatasetResult> {
    private final DatasetInput input;

    DatasetTask(DatasetInput input) {
      this.input = input;
    }

    @Override
    public DatasetResult call() {
      if (cancelled.get()) {
        LOGGER.info("Skipping dataset %s, batch was cancelled", input.getId());
        return null;
      }
      try {
        return processor.process(input);
      } catch (RuntimeException e) {
        LOGGER.error("Dataset %s failed: %s", input.getId(), e.getMessage(), e);
        listener.onProgress("failed", input.getId() + ": " + e.getMessage());
        return DatasetResult.failed(input.getId(), e.getClass().getSimpleName() + ": " + e.getMessage());
      }
    }
  }
}
