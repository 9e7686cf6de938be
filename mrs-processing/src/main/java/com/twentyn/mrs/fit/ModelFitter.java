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

import com.twentyn.mrs.exceptions.DataInconsistencyException;
import com.twentyn.mrs.exceptions.PreconditionViolationException;
import com.twentyn.mrs.reference.CrossCorrelationReferencer;
import com.twentyn.mrs.reference.Landmark;
import com.twentyn.mrs.reference.PeakReferencer;
import com.twentyn.mrs.reference.ReferenceResult;
import com.twentyn.mrs.signal.AcquisitionHeader;
import com.twentyn.mrs.signal.ConditionKind;
import com.twentyn.mrs.signal.Spectrum;
import com.twentyn.mrs.util.LeastSquaresSolver;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Staged linear-combination fitting of processed spectra.
 *
 * Unfit -> Referenced -> PreliminaryReduced -> PreliminaryFull -> Complete, with Failed reachable from every stage.
 * The reduced stage fits a handful of well separated metabolites with global phase, Gaussian linewidth and shift;
 * the full stage starts from there and adds a Lorentzian linewidth and a shift per basis function.  Spectra fitted
 * jointly share all nonlinear parameters and keep their own amplitudes and baselines.
 */
public class ModelFitter {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ModelFitter.class);

  public static final double MAX_GAUSS_HZ = 30.0;
  public static final double MAX_LORENTZ_HZ = 10.0;
  public static final double MAX_PH1_RAD_PER_PPM = Math.toRadians(10.0);
  public static final double MAX_BASIS_SHIFT_PPM = 0.05;
  private static final double REFERENCE_MARGIN_PPM = 0.3;

  private final FitOptions options;
  private final CrossCorrelationReferencer coarseReferencer;
  private final PeakReferencer peakReferencer;

  public ModelFitter(FitOptions options) {
    this(options, new CrossCorrelationReferencer(), new PeakReferencer());
  }

  public ModelFitter(FitOptions options, CrossCorrelationReferencer coarseReferencer, PeakReferencer peakReferencer) {
    this.options = options;
    this.coarseReferencer = coarseReferencer;
    this.peakReferencer = peakReferencer;
  }

  public FitOptions getOptions() {
    return options;
  }

  /** Fits one spectrum, estimating the reference shift by cross-correlation. */
  public FitParameters fit(Spectrum spectrum, BasisSet basis) {
    return fitJointly(Collections.singletonList(spectrum), Collections.singletonList(basis), null, 0).get(0);
  }

  /** Fits one spectrum whose reference shift has already been determined upstream. */
  public FitParameters fit(Spectrum spectrum, BasisSet basis, double referenceShiftHz) {
    return fitJointly(Collections.singletonList(spectrum), Collections.singletonList(basis), referenceShiftHz, 0)
        .get(0);
  }

  /**
   * Fits several conditions jointly.  The reference shift is estimated once, on SUM when it is among the spectra and
   * on the first spectrum otherwise, and applied to all of them.
   */
  public Map<ConditionKind, FitParameters> fitConcatenated(Map<ConditionKind, Spectrum> spectra,
                                                          Map<ConditionKind, BasisSet> bases) {
    List<ConditionKind> kinds = new ArrayList<>(spectra.keySet());
    List<Spectrum> spectrumList = new ArrayList<>();
    List<BasisSet> basisList = new ArrayList<>();
    for (ConditionKind kind : kinds) {
      BasisSet basis = bases.get(kind);
      if (basis == null) {
        throw new PreconditionViolationException(String.format("No basis set supplied for condition %s", kind));
      }
      spectrumList.add(spectra.get(kind));
      basisList.add(basis);
    }
    int referenceIndex = Math.max(0, kinds.indexOf(ConditionKind.SUM));
    List<FitParameters> fits = fitJointly(spectrumList, basisList, null, referenceIndex);
    Map<ConditionKind, FitParameters> results = new EnumMap<>(ConditionKind.class);
    for (int i = 0; i < kinds.size(); i++) {
      results.put(kinds.get(i), fits.get(i));
    }
    return results;
  }

  private List<FitParameters> fitJointly(List<Spectrum> spectra, List<BasisSet> bases, Double suppliedShiftHz,
                                         int referenceIndex) {
    if (spectra.isEmpty()) {
      throw new PreconditionViolationException("Nothing to fit");
    }
    List<BasisSet> prepared = new ArrayList<>(bases.size());
    for (int i = 0; i < spectra.size(); i++) {
      BasisSet basis = bases.get(i).resampleTo(spectra.get(i).getHeader());
      if (!options.getIncludedMetabolites().isEmpty()) {
        basis = basis.subset(options.getIncludedMetabolites());
      }
      prepared.add(basis);
    }

    // The stage currently being attempted; a failure is recorded against it.
    FitStage stage = FitStage.REFERENCED;
    try {
      Spectrum representative = spectra.get(referenceIndex);
      for (Spectrum spectrum : spectra) {
        if (!spectrum.isFinite()) {
          return failAll(spectra.size(), stage, "Spectrum contains non-finite samples");
        }
      }
      double referenceShift = suppliedShiftHz != null ? suppliedShiftHz : estimateReferenceShift(representative);
      if (Double.isNaN(referenceShift) || Double.isInfinite(referenceShift)) {
        return failAll(spectra.size(), stage, "Reference shift is not finite");
      }
      double referenceFwhm = referenceLinewidth(representative);
      List<Spectrum> referenced = new ArrayList<>(spectra.size());
      for (Spectrum spectrum : spectra) {
        referenced.add(spectrum.freqShift(-referenceShift));
      }
      LOGGER.debug("Referenced %d spectra by %.3f Hz, reference FWHM %.2f Hz", spectra.size(), referenceShift,
          referenceFwhm);

      double basisFwhm = referenceLinewidth(summedBasis(prepared.get(referenceIndex)));
      double gaussStart = Math.sqrt(Math.max(0.0, square(referenceFwhm) - square(basisFwhm)));
      if (Double.isNaN(gaussStart)) {
        gaussStart = 0.0;
      }
      gaussStart = Math.min(MAX_GAUSS_HZ, gaussStart);

      stage = FitStage.PRELIMINARY_REDUCED;
      List<SpectralModel> reducedModels = new ArrayList<>();
      for (int i = 0; i < referenced.size(); i++) {
        reducedModels.add(model(referenced.get(i), reducedBasis(prepared.get(i))));
      }
      ParameterLayout reducedLayout = new ParameterLayout(unionOfNames(reducedModels), false);
      double[] reducedStart = new double[reducedLayout.size()];
      reducedStart[ParameterLayout.GAUSS] = gaussStart;
      LeastSquaresSolver.Solution reduced = solve(reducedModels, reducedLayout, reducedStart,
          spectra.get(0).getHeader());
      if (!reduced.isFinite()) {
        return failAll(spectra.size(), stage, "Reduced fit objective is not finite");
      }

      stage = FitStage.PRELIMINARY_FULL;
      List<SpectralModel> fullModels = new ArrayList<>();
      for (int i = 0; i < referenced.size(); i++) {
        fullModels.add(model(referenced.get(i), prepared.get(i)));
      }
      ParameterLayout fullLayout = new ParameterLayout(unionOfNames(fullModels), true);
      double[] fullStart = new double[fullLayout.size()];
      System.arraycopy(reduced.getPoint(), 0, fullStart, 0, ParameterLayout.GLOBAL_COUNT);
      LeastSquaresSolver.Solution full = solve(fullModels, fullLayout, fullStart, spectra.get(0).getHeader());
      if (!full.isFinite()) {
        return failAll(spectra.size(), stage, "Full fit objective is not finite");
      }

      stage = FitStage.COMPLETE;

      double[] p = full.getPoint();
      List<FitParameters> results = new ArrayList<>(fullModels.size());
      for (SpectralModel model : fullModels) {
        results.add(packageResult(model, fullLayout, p, referenceShift, referenceFwhm));
      }
      LOGGER.info("Fit complete after %d+%d evaluations, residual %g", reduced.getEvaluations(),
          full.getEvaluations(), full.getCost());
      return results;
    } catch (PreconditionViolationException | DataInconsistencyException e) {
      throw e;
    } catch (RuntimeException e) {
      LOGGER.error("Model fit failed in stage %s: %s", stage, e.getMessage());
      return failAll(spectra.size(), stage, e.getMessage());
    }
  }

  private SpectralModel model(Spectrum spectrum, BasisSet basis) {
    return new SpectralModel(spectrum, basis, options.getLowPpm(), options.getHighPpm(),
        options.getKnotSpacingPpm(), options.getZeroFill());
  }

  private BasisSet reducedBasis(BasisSet basis) {
    List<String> selected = new ArrayList<>();
    for (String name : basis.names()) {
      if (options.getReducedMetabolites().contains(name)) {
        selected.add(name);
      }
    }
    return selected.isEmpty() ? basis : basis.subset(selected);
  }

  private static List<String> unionOfNames(List<SpectralModel> models) {
    Set<String> names = new LinkedHashSet<>();
    for (SpectralModel model : models) {
      names.addAll(model.getNames());
    }
    return new ArrayList<>(names);
  }

  private LeastSquaresSolver.Solution solve(final List<SpectralModel> models, final ParameterLayout layout,
                                            double[] start, AcquisitionHeader header) {
    final double maxBasisShift = header.ppmToHz(MAX_BASIS_SHIFT_PPM);
    final double maxGlobalShift = header.ppmToHz(REFERENCE_MARGIN_PPM);
    LeastSquaresSolver.Residuals residuals = new LeastSquaresSolver.Residuals() {
      @Override
      public double[] value(double[] p) {
        List<double[]> parts = new ArrayList<>(models.size());
        int total = 0;
        for (SpectralModel model : models) {
          double[] r = model.evaluate(p, layout).getResidual();
          parts.add(r);
          total += r.length;
        }
        double[] joined = new double[total];
        int offset = 0;
        for (double[] r : parts) {
          System.arraycopy(r, 0, joined, offset, r.length);
          offset += r.length;
        }
        return joined;
      }
    };
    ParameterValidator validator = new ParameterValidator() {
      @Override
      public RealVector validate(RealVector params) {
        double[] p = params.toArray();
        p[ParameterLayout.PH0] = clamp(p[ParameterLayout.PH0], -2.0 * Math.PI, 2.0 * Math.PI);
        p[ParameterLayout.PH1] = clamp(p[ParameterLayout.PH1], -MAX_PH1_RAD_PER_PPM, MAX_PH1_RAD_PER_PPM);
        p[ParameterLayout.GAUSS] = clamp(p[ParameterLayout.GAUSS], 0.0, MAX_GAUSS_HZ);
        p[ParameterLayout.SHIFT] = clamp(p[ParameterLayout.SHIFT], -maxGlobalShift, maxGlobalShift);
        if (layout.isPerBasis()) {
          for (String name : layout.getNames()) {
            int l = layout.lorentzIndex(name);
            int s = layout.shiftIndex(name);
            p[l] = clamp(p[l], 0.0, MAX_LORENTZ_HZ);
            p[s] = clamp(p[s], -maxBasisShift, maxBasisShift);
          }
        }
        return new ArrayRealVector(p, false);
      }
    };
    double[] typical = new double[layout.size()];
    typical[ParameterLayout.PH0] = 0.1;
    typical[ParameterLayout.PH1] = 0.01;
    typical[ParameterLayout.GAUSS] = 1.0;
    typical[ParameterLayout.SHIFT] = 1.0;
    for (int i = ParameterLayout.GLOBAL_COUNT; i < typical.length; i++) {
      typical[i] = 1.0;
    }
    return new LeastSquaresSolver(options.getMaxIterations(), options.getMaxEvaluations())
        .withValidator(validator)
        .withTypicalScale(typical)
        .minimize(residuals, start);
  }

  private FitParameters packageResult(SpectralModel model, ParameterLayout layout, double[] p, double referenceShift,
                                      double referenceFwhm) {
    SpectralModel.Evaluation evaluation = model.evaluate(p, layout);
    Map<String, Double> amplitudes = new LinkedHashMap<>();
    Map<String, Double> lorentz = new LinkedHashMap<>();
    Map<String, Double> shifts = new LinkedHashMap<>();
    double[] a = evaluation.getAmplitudes();
    List<String> names = model.getNames();
    for (int j = 0; j < names.size(); j++) {
      String name = names.get(j);
      amplitudes.put(name, a[j]);
      lorentz.put(name, layout.lorentz(p, name));
      shifts.put(name, layout.shift(p, name));
    }
    return new FitParameters(amplitudes, lorentz, shifts, evaluation.getBaseline(), p[ParameterLayout.PH0],
        p[ParameterLayout.PH1], p[ParameterLayout.GAUSS], p[ParameterLayout.SHIFT], referenceShift, referenceFwhm,
        LeastSquaresSolver.sumOfSquares(evaluation.getResidual()),
        new double[]{options.getLowPpm(), options.getHighPpm()}, model.getBasis().getNormalization());
  }

  private double estimateReferenceShift(Spectrum spectrum) {
    List<Double> inRange = new ArrayList<>();
    for (double ppm : options.getReferencePpm()) {
      if (ppm >= options.getLowPpm() && ppm <= options.getHighPpm()) {
        inRange.add(ppm);
      }
    }
    if (inRange.isEmpty()) {
      return 0.0;
    }
    double[] ppm = new double[inRange.size()];
    for (int i = 0; i < ppm.length; i++) {
      ppm[i] = inRange.get(i);
    }
    return coarseReferencer.estimateShift(spectrum, ppm);
  }

  // FWHM of the main reference resonance, NaN when it cannot be fitted.
  private double referenceLinewidth(Spectrum spectrum) {
    Landmark landmark = referencesWater() ? Landmark.WATER : Landmark.CR;
    ReferenceResult result = peakReferencer.reference(spectrum, landmark);
    return result.getLinewidthHz();
  }

  private boolean referencesWater() {
    for (double ppm : options.getReferencePpm()) {
      if (ppm == Landmark.WATER.getPpm()) {
        return true;
      }
    }
    return false;
  }

  private static Spectrum summedBasis(BasisSet basis) {
    Spectrum sum = null;
    for (BasisFunction function : basis.functions()) {
      sum = sum == null ? function.getSpectrum() : sum.add(function.getSpectrum());
    }
    return sum;
  }

  private List<FitParameters> failAll(int count, FitStage stage, String reason) {
    LOGGER.warn("Recording failed fit (stage %s): %s", stage, reason);
    List<FitParameters> failed = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      failed.add(FitParameters.failed(stage, reason, new double[]{options.getLowPpm(), options.getHighPpm()}));
    }
    return failed;
  }

  private static double clamp(double value, double low, double high) {
    return Math.max(low, Math.min(high, value));
  }

  private static double square(double value) {
    return value * value;
  }
}
