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

import com.twentyn.mrs.align.AlignmentResult;
import com.twentyn.mrs.align.DriftMeter;
import com.twentyn.mrs.align.SpectralRegistration;
import com.twentyn.mrs.correct.EddyCurrentCorrector;
import com.twentyn.mrs.correct.PolarityCorrector;
import com.twentyn.mrs.correct.ResidualWaterRemover;
import com.twentyn.mrs.edit.AcquisitionProtocol;
import com.twentyn.mrs.edit.EditClassification;
import com.twentyn.mrs.edit.SubSpectrumAligner;
import com.twentyn.mrs.fit.BasisSet;
import com.twentyn.mrs.fit.FitParameters;
import com.twentyn.mrs.fit.FitStyle;
import com.twentyn.mrs.fit.MacromoleculeBasis;
import com.twentyn.mrs.fit.ModelFitter;
import com.twentyn.mrs.fit.WaterFitter;
import com.twentyn.mrs.quality.AmplitudeRatios;
import com.twentyn.mrs.quality.QualityMetrics;
import com.twentyn.mrs.reference.Landmark;
import com.twentyn.mrs.reference.PeakReferencer;
import com.twentyn.mrs.reference.ReferenceResult;
import com.twentyn.mrs.signal.ConditionKind;
import com.twentyn.mrs.signal.SpectralOps;
import com.twentyn.mrs.signal.Spectrum;
import com.twentyn.mrs.signal.TimeDomainSignal;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.math3.complex.Complex;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one dataset through averaging, correction, referencing, editing, quality control and fitting.
 *
 * Instances hold only read-only state (configuration, basis sets and stateless processing components) and can be
 * shared by worker threads.
 */
public class DatasetProcessor {
  private static final Logger LOGGER = LogManager.getFormatterLogger(DatasetProcessor.class);

  private final ProcessingConfiguration configuration;
  private final AcquisitionProtocol protocol;
  private final Map<ConditionKind, BasisSet> bases;
  private final ProgressListener listener;

  private final SpectralRegistration registration;
  private final EddyCurrentCorrector eddyCurrentCorrector = new EddyCurrentCorrector();
  private final PolarityCorrector polarityCorrector = new PolarityCorrector();
  private final ResidualWaterRemover waterRemover;
  private final PeakReferencer peakReferencer = new PeakReferencer();
  private final SubSpectrumAligner subSpectrumAligner = new SubSpectrumAligner();
  private final MacromoleculeBasis macromoleculeBasis = new MacromoleculeBasis();
  private final ModelFitter metaboliteFitter;
  private final WaterFitter waterFitter;

  /**
   * @param bases basis sets per condition; only conditions with a basis set are fitted
   */
  public DatasetProcessor(ProcessingConfiguration configuration, Map<ConditionKind, BasisSet> bases,
                          ProgressListener listener) {
    this.configuration = configuration.validate();
    this.protocol = configuration.protocol();
    Map<ConditionKind, BasisSet> basisCopy = new EnumMap<>(ConditionKind.class);
    basisCopy.putAll(bases);
    this.bases = Collections.unmodifiableMap(basisCopy);
    this.listener = listener == null ? ProgressListener.NO_OP : listener;
    this.registration = configuration.registration();
    this.waterRemover = configuration.waterRemover();
    this.metaboliteFitter = new ModelFitter(configuration.metaboliteFitOptions());
    this.waterFitter = new WaterFitter(configuration.waterFitOptions());
  }

  public AcquisitionProtocol getProtocol() {
    return protocol;
  }

  public Map<ConditionKind, BasisSet> getBases() {
    return bases;
  }

  /**
   * @throws com.twentyn.mrs.exceptions.PreconditionViolationException for empty or malformed signals
   */
  public DatasetResult process(DatasetInput input) {
    String id = input.getId();
    DatasetResult result = new DatasetResult(id);
    listener.onProgress("start", String.format("Processing %s as %s", id, protocol));

    Spectrum reference = null;
    if (input.hasReference()) {
      reference = averageAll(input.getReference(), Landmark.WATER.getCanonicalPpm());
    }

    Map<ConditionKind, ProcessedSpectrum> metabolites = configuration.isEdited()
        ? processEdited(input, reference, result)
        : processUnedited(input, reference, result);
    for (ProcessedSpectrum spectrum : metabolites.values()) {
      result.putSpectrum(spectrum);
    }

    if (input.hasMacromolecule() && !configuration.isEdited()) {
      result.putSpectrum(processMacromolecules(input.getMacromolecule(), reference, result));
    }
    if (input.hasWater()) {
      result.putSpectrum(processShortTeWater(input.getWater()));
    }

    listener.onProgress("quality", "Measuring SNR and linewidth for " + id);
    for (ProcessedSpectrum spectrum : result.getSpectra().values()) {
      result.putQuality(QualityMetrics.measure(spectrum.getCondition(), spectrum.getSpectrum(),
          protocol.qualityWindow(spectrum.getCondition()), spectrum.getDriftPre(), spectrum.getDriftPost()));
    }

    fit(result);
    result.markProcessed();
    listener.onProgress("done", String.format("%s finished with %d failure(s)", id, result.getFailures().size()));
    return result;
  }

  private Map<ConditionKind, ProcessedSpectrum> processUnedited(DatasetInput input, Spectrum reference,
                                                               DatasetResult result) {
    Map<ConditionKind, ProcessedSpectrum> out = new EnumMap<>(ConditionKind.class);
    TimeDomainSignal metabolite = input.getMetabolite();
    metabolite.requireNonEmpty();
    metabolite = metabolite.combineCoils();

    boolean eddyCurrentCorrected = false;
    if (reference != null) {
      listener.onProgress("eddy-current", "Correcting eddy currents with the water reference");
      Pair<TimeDomainSignal, Spectrum> corrected = eddyCurrentCorrector.correct(metabolite,
          TimeDomainSignal.preAveraged(reference.getHeader(), reference.getFid()));
      if (EddyCurrentCorrector.shouldKeep(metabolite.averageOf(0), corrected.getLeft().averageOf(0))) {
        metabolite = corrected.getLeft();
        eddyCurrentCorrected = true;
      } else {
        LOGGER.info("Eddy-current correction of %s made the landmark phase worse, reverting", input.getId());
      }
      out.put(ConditionKind.REF, processReference(corrected.getRight()));
    }

    listener.onProgress("align", "Aligning and averaging " + metabolite.getAverageCount() + " averages");
    AlignmentResult alignment = registration.align(metabolite, 0, protocol.getAlignmentLandmarks());
    ProcessedSpectrum processed = ProcessedSpectrum.fromAlignment(ConditionKind.OFF, alignment)
        .withEddyCurrentCorrection(eddyCurrentCorrected);

    double[] window = protocol.getPolarityWindow();
    Pair<Spectrum, Boolean> polarity = polarityCorrector.correct(processed.getSpectrum(), window[0], window[1]);
    processed = processed.withSpectrum(polarity.getLeft()).withPolarityFlipped(polarity.getRight());

    processed = removeWater(processed, result);

    listener.onProgress("reference", "Referencing on " + configuration.getUneditedLandmark());
    ReferenceResult landmark = peakReferencer.reference(processed.getSpectrum(), configuration.getUneditedLandmark());
    processed = processed.referenced(landmark.getShiftHz());

    if (configuration.getVendor() == Vendor.SIEMENS) {
      Pair<Spectrum, Double> phased = peakReferencer.phaseOnCrCho(processed.getSpectrum());
      processed = processed.phased(-phased.getRight());
    }
    out.put(ConditionKind.OFF, processed);
    return out;
  }

  private Map<ConditionKind, ProcessedSpectrum> processEdited(DatasetInput input, Spectrum reference,
                                                             DatasetResult result) {
    Map<ConditionKind, ProcessedSpectrum> out = new EnumMap<>(ConditionKind.class);
    TimeDomainSignal metabolite = input.getMetabolite();
    metabolite.requireNonEmpty();
    List<TimeDomainSignal> parts = protocol.splitSubExperiments(metabolite.combineCoils());

    Spectrum correctedReference = reference;
    if (reference != null) {
      listener.onProgress("eddy-current", "Correcting eddy currents with the water reference");
      TimeDomainSignal referenceSignal = TimeDomainSignal.preAveraged(reference.getHeader(), reference.getFid());
      List<TimeDomainSignal> correctedParts = new ArrayList<>(parts.size());
      for (TimeDomainSignal part : parts) {
        Pair<TimeDomainSignal, Spectrum> corrected = eddyCurrentCorrector.correct(part, referenceSignal);
        correctedParts.add(corrected.getLeft());
        correctedReference = corrected.getRight();
      }
      parts = correctedParts;
      out.put(ConditionKind.REF, processReference(correctedReference));
    }

    listener.onProgress("align", String.format("Aligning %d sub-experiments", parts.size()));
    List<AlignmentResult> alignments = new ArrayList<>(parts.size());
    List<Spectrum> subSpectra = new ArrayList<>(parts.size());
    for (TimeDomainSignal part : parts) {
      AlignmentResult alignment = registration.align(part, 0, protocol.getAlignmentLandmarks());
      alignments.add(alignment);
      subSpectra.add(alignment.getAveraged());
    }

    double[] window = protocol.getPolarityWindow();
    boolean flipped = PolarityCorrector.isInverted(subSpectra.get(0), window[0], window[1]);
    if (flipped) {
      LOGGER.info("First sub-experiment of %s is inverted, flipping all sub-spectra", input.getId());
      for (int i = 0; i < subSpectra.size(); i++) {
        subSpectra.set(i, subSpectra.get(i).scale(-1.0));
      }
    }

    listener.onProgress("classify", "Classifying sub-spectra for " + protocol.getTarget());
    EditClassification classification = protocol.classify(subSpectra);
    List<ConditionKind> acquired = protocol.getAcquiredConditions();

    Spectrum total = null;
    for (ConditionKind kind : acquired) {
      total = total == null ? classification.get(kind) : total.add(classification.get(kind));
    }
    double commonShift = peakReferencer.reference(total, Landmark.CR_CHO).getShiftHz();
    for (ConditionKind kind : acquired) {
      classification = classification.with(kind, classification.get(kind).freqShift(-commonShift));
    }

    Pair<Spectrum, Double> phasedOff = peakReferencer.phaseOnCrCho(classification.get(ConditionKind.OFF));
    classification = classification.with(ConditionKind.OFF, phasedOff.getLeft());
    Map<ConditionKind, double[]> corrections = new EnumMap<>(ConditionKind.class);
    corrections.put(ConditionKind.OFF, new double[]{commonShift, -phasedOff.getRight()});
    for (ConditionKind kind : acquired) {
      if (kind == ConditionKind.OFF) {
        continue;
      }
      Pair<Spectrum, double[]> aligned = subSpectrumAligner.align(classification.get(ConditionKind.OFF),
          classification.get(kind), protocol.getTarget());
      classification = classification.with(kind, aligned.getLeft());
      corrections.put(kind, new double[]{commonShift - aligned.getRight()[0], aligned.getRight()[1]});
    }

    Map<ConditionKind, ProcessedSpectrum> conditions = new LinkedHashMap<>();
    for (ConditionKind kind : acquired) {
      AlignmentResult alignment = alignments.get(classification.getAcquisitionIndex(kind));
      double[] applied = corrections.get(kind);
      conditions.put(kind, ProcessedSpectrum.fromAlignment(kind, alignment)
          .withSpectrum(classification.get(kind))
          .withAppliedCorrections(applied[0], applied[1])
          .withEddyCurrentCorrection(reference != null)
          .withPolarityFlipped(flipped)
          .withSwitchOrder(classification.isSwitchOrder()));
    }

    AlignmentResult off = alignments.get(classification.getAcquisitionIndex(ConditionKind.OFF));
    AlignmentResult on = alignments.get(classification.getAcquisitionIndex(ConditionKind.ON));
    double[] derivedDriftPre = DriftMeter.interleave(off.getDriftPre(), on.getDriftPre());
    double[] derivedDriftPost = DriftMeter.interleave(off.getDriftPost(), on.getDriftPost());
    for (Map.Entry<ConditionKind, Spectrum> derived : protocol.combine(classification).entrySet()) {
      conditions.put(derived.getKey(), new ProcessedSpectrum(derived.getKey(), derived.getValue())
          .withAppliedCorrections(commonShift, 0.0)
          .withSwitchOrder(classification.isSwitchOrder())
          .withEddyCurrentCorrection(reference != null)
          .withPolarityFlipped(flipped)
          .withDrift(derivedDriftPre, derivedDriftPost));
    }

    listener.onProgress("water", "Removing residual water from " + conditions.size() + " spectra");
    for (Map.Entry<ConditionKind, ProcessedSpectrum> entry : conditions.entrySet()) {
      entry.setValue(removeWater(entry.getValue(), result));
    }

    ProcessedSpectrum sum = conditions.get(ConditionKind.SUM);
    if (sum != null) {
      double sumShift = peakReferencer.reference(sum.getSpectrum(), Landmark.CR_CHO).getShiftHz();
      LOGGER.debug("Applying SUM reference shift %.3f Hz to all conditions of %s", sumShift, input.getId());
      for (Map.Entry<ConditionKind, ProcessedSpectrum> entry : conditions.entrySet()) {
        entry.setValue(entry.getValue().referenced(sumShift));
      }
    }
    out.putAll(conditions);
    return out;
  }

  private ProcessedSpectrum processReference(Spectrum reference) {
    listener.onProgress("reference", "Referencing water reference to 4.68 ppm");
    ReferenceResult water = peakReferencer.reference(reference, Landmark.WATER);
    return new ProcessedSpectrum(ConditionKind.REF, reference).withEddyCurrentCorrection(true)
        .referenced(water.getShiftHz());
  }

  private ProcessedSpectrum processShortTeWater(TimeDomainSignal water) {
    listener.onProgress("water", "Processing short-TE water");
    Spectrum averaged = averageAll(water, Landmark.WATER.getCanonicalPpm());
    Spectrum corrected = eddyCurrentCorrector.correct(averaged, averaged).getLeft();
    ReferenceResult landmark = peakReferencer.reference(corrected, Landmark.WATER);
    return new ProcessedSpectrum(ConditionKind.WATER, corrected).withEddyCurrentCorrection(true)
        .referenced(landmark.getShiftHz());
  }

  private ProcessedSpectrum processMacromolecules(TimeDomainSignal macromolecule, Spectrum reference,
                                                  DatasetResult result) {
    listener.onProgress("macromolecules", "Processing macromolecule acquisition");
    macromolecule.requireNonEmpty();
    AlignmentResult alignment = registration.align(macromolecule.combineCoils(), 0, Landmark.MM.getCanonicalPpm());
    ProcessedSpectrum processed = ProcessedSpectrum.fromAlignment(ConditionKind.MM, alignment);
    if (reference != null) {
      processed = processed.withSpectrum(eddyCurrentCorrector.correct(processed.getSpectrum(), reference).getLeft())
          .withEddyCurrentCorrection(true);
    }
    processed = removeWater(processed, result);
    ReferenceResult landmark = peakReferencer.reference(processed.getSpectrum(), Landmark.MM);
    return processed.referenced(landmark.getShiftHz());
  }

  private ProcessedSpectrum removeWater(ProcessedSpectrum processed, DatasetResult result) {
    ResidualWaterRemover.Result removal = waterRemover.remove(processed.getSpectrum());
    if (removal.isFailed()) {
      result.addFailure(String.format("Residual water removal failed for %s", processed.getCondition()));
    }
    return processed.withWaterRemoval(removal.getSpectrum(), removal.getOrder(), removal.isFailed());
  }

  // Aligns every sub-spectrum of a signal and averages the results.
  private Spectrum averageAll(TimeDomainSignal signal, double[] landmarkPpm) {
    signal.requireNonEmpty();
    TimeDomainSignal combined = signal.combineCoils();
    List<Spectrum> averaged = new ArrayList<>(combined.getSubSpectrumCount());
    for (int s = 0; s < combined.getSubSpectrumCount(); s++) {
      averaged.add(registration.align(combined, s, landmarkPpm).getAveraged());
    }
    if (averaged.size() == 1) {
      return averaged.get(0);
    }
    List<Complex[]> fids = new ArrayList<>(averaged.size());
    for (Spectrum spectrum : averaged) {
      fids.add(spectrum.getFid());
    }
    return new Spectrum(combined.getHeader(), SpectralOps.average(fids));
  }

  private void fit(DatasetResult result) {
    Map<ConditionKind, ProcessedSpectrum> spectra = result.getSpectra();
    Map<ConditionKind, BasisSet> toFit = new EnumMap<>(ConditionKind.class);
    for (Map.Entry<ConditionKind, BasisSet> entry : bases.entrySet()) {
      ConditionKind kind = entry.getKey();
      if (spectra.containsKey(kind) && !kind.isWater()) {
        toFit.put(kind, prepareBasis(entry.getValue()));
      }
    }

    if (configuration.getFitStyle() == FitStyle.CONCATENATED) {
      Map<ConditionKind, Spectrum> joint = new LinkedHashMap<>();
      Map<ConditionKind, BasisSet> jointBases = new EnumMap<>(ConditionKind.class);
      for (Map.Entry<ConditionKind, BasisSet> entry : toFit.entrySet()) {
        if (entry.getKey().isDifference() || entry.getKey() == ConditionKind.SUM) {
          joint.put(entry.getKey(), spectra.get(entry.getKey()).getSpectrum());
          jointBases.put(entry.getKey(), entry.getValue());
        }
      }
      if (!joint.isEmpty()) {
        listener.onProgress("fit", "Fitting " + joint.keySet() + " jointly");
        for (Map.Entry<ConditionKind, FitParameters> fit
            : metaboliteFitter.fitConcatenated(joint, jointBases).entrySet()) {
          result.putFit(fit.getKey(), fit.getValue());
        }
        toFit.keySet().removeAll(joint.keySet());
      }
    }
    for (Map.Entry<ConditionKind, BasisSet> entry : toFit.entrySet()) {
      listener.onProgress("fit", "Fitting " + entry.getKey());
      result.putFit(entry.getKey(), metaboliteFitter.fit(spectra.get(entry.getKey()).getSpectrum(),
          entry.getValue()));
    }

    // Short-TE water, when present and fitted, takes precedence over the reference for water scaling.
    FitParameters waterFit = null;
    for (ConditionKind kind : new ConditionKind[]{ConditionKind.REF, ConditionKind.WATER}) {
      ProcessedSpectrum water = spectra.get(kind);
      if (water != null) {
        listener.onProgress("fit", "Fitting water in " + kind);
        FitParameters fit = waterFitter.fit(water.getSpectrum());
        result.putFit(kind, fit);
        if (!fit.isFailed()) {
          waterFit = fit;
        }
      }
    }

    for (Map.Entry<ConditionKind, FitParameters> entry : result.getFits().entrySet()) {
      if (entry.getKey().isWater() || entry.getValue().isFailed()) {
        continue;
      }
      result.putCreatineRatios(entry.getKey(), AmplitudeRatios.creatineRatios(entry.getValue()));
      if (waterFit != null) {
        result.putWaterScaled(entry.getKey(),
            AmplitudeRatios.waterScaled(entry.getValue(), waterFit, WaterFitter.WATER));
      }
    }
  }

  private BasisSet prepareBasis(BasisSet basis) {
    if (configuration.isIncludeMacromolecules() && basis.contains(MacromoleculeBasis.CREATINE)) {
      return macromoleculeBasis.augment(basis);
    }
    return basis;
  }
}
