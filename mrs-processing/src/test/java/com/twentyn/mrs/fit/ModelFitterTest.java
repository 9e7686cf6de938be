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

import com.twentyn.mrs.exceptions.PreconditionViolationException;
import com.twentyn.mrs.signal.AcquisitionHeader;
import com.twentyn.mrs.signal.ConditionKind;
import com.twentyn.mrs.signal.SpectralOps;
import com.twentyn.mrs.signal.Spectrum;
import com.twentyn.mrs.test.util.SyntheticSignals;
import org.apache.commons.math3.complex.Complex;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ModelFitterTest {

  private AcquisitionHeader header;
  private BasisSet basis;
  private FitOptions options;
  private double[] baselineCoefficients;

  @Before
  public void setUp() throws Exception {
    header = SyntheticSignals.header();
    basis = SyntheticSignals.singletBasis(header);
    options = FitOptions.metaboliteDefaults()
        .withZeroFill(1)
        .withReducedMetabolites(Arrays.asList("NAA", "Cr", "Cho"));
    BSplineBaseline baseline = new BSplineBaseline(options.getLowPpm(), options.getHighPpm(),
        options.getKnotSpacingPpm());
    baselineCoefficients = new double[baseline.getFunctionCount()];
    for (int j = 0; j < baselineCoefficients.length; j++) {
      baselineCoefficients[j] = 0.05 * (1.0 + Math.sin(j));
    }
  }

  /** Weighted sum of the normalised basis functions plus a smooth baseline in the real spectrum. */
  private Spectrum synthetic(double naa, double cr, double cho, boolean withBaseline) {
    Complex[] fid = SpectralOps.add(SpectralOps.add(
        SpectralOps.scale(basis.get("NAA").getFid(), naa),
        SpectralOps.scale(basis.get("Cr").getFid(), cr)),
        SpectralOps.scale(basis.get("Cho").getFid(), cho));
    if (!withBaseline) {
      return new Spectrum(header, fid);
    }
    Complex[] spectrum = SpectralOps.toSpectrum(fid);
    double[] ppm = header.ppmAxis().ppmValues();
    double[] baseline = new BSplineBaseline(options.getLowPpm(), options.getHighPpm(), options.getKnotSpacingPpm())
        .evaluate(ppm, baselineCoefficients);
    for (int i = 0; i < spectrum.length; i++) {
      spectrum[i] = spectrum[i].add(baseline[i]);
    }
    return Spectrum.fromFrequencyDomain(header, spectrum);
  }

  @Test
  public void testRecoversAmplitudesAndBaseline() throws Exception {
    FitParameters fit = new ModelFitter(options).fit(synthetic(2.0, 1.0, 0.5, true), basis, 0.0);

    assertFalse(fit.isFailed());
    assertEquals(FitStage.COMPLETE, fit.getStage());
    assertEquals(2.0, fit.amplitudeOf("NAA"), 0.04);
    assertEquals(1.0, fit.amplitudeOf("Cr"), 0.02);
    assertEquals(0.5, fit.amplitudeOf("Cho"), 0.01);
    assertEquals(basis.getNormalization(), fit.getBasisNormalization(), 0.0);
    double[] coefficients = fit.getBaselineCoefficients();
    assertEquals(baselineCoefficients.length, coefficients.length);
    for (int j = 2; j < coefficients.length - 2; j++) {
      assertEquals("baseline coefficient " + j, baselineCoefficients[j], coefficients[j], 0.01);
    }
    assertArrayEqualsRange(fit.getFitRangePpm());
  }

  private void assertArrayEqualsRange(double[] range) {
    assertEquals(options.getLowPpm(), range[0], 0.0);
    assertEquals(options.getHighPpm(), range[1], 0.0);
  }

  @Test
  public void testEstimatesReferenceShiftWhenNotSupplied() throws Exception {
    double shiftHz = header.ppmToHz(0.03);
    Spectrum shifted = synthetic(2.0, 1.0, 0.5, false).freqShift(shiftHz);

    FitParameters fit = new ModelFitter(options).fit(shifted, basis);

    assertFalse(fit.isFailed());
    assertEquals(shiftHz, fit.getReferenceShiftHz() + fit.getShiftHz().get("Cr"), 0.1);
    assertEquals(1.0, fit.amplitudeOf("Cr"), 0.03);
  }

  @Test
  public void testNonFiniteSpectrumIsRecordedAsFailedReferencingStage() throws Exception {
    Complex[] fid = synthetic(2.0, 1.0, 0.5, false).getFid();
    fid[5] = new Complex(Double.NaN, 0.0);

    FitParameters fit = new ModelFitter(options).fit(new Spectrum(header, fid), basis, 0.0);

    assertTrue(fit.isFailed());
    assertEquals(FitStage.REFERENCED, fit.getFailedStage());
    assertTrue(fit.getFailureReason().contains("non-finite"));
  }

  @Test
  public void testIncludedMetabolitesRestrictTheModel() throws Exception {
    FitParameters fit = new ModelFitter(options.withIncludedMetabolites(Arrays.asList("NAA", "Cr")))
        .fit(synthetic(2.0, 1.0, 0.0, false), basis, 0.0);

    assertEquals(Arrays.asList("NAA", "Cr"), Arrays.asList(fit.getAmplitudes().keySet().toArray()));
  }

  @Test
  public void testConcatenatedFitSharesReferenceAcrossConditions() throws Exception {
    Map<ConditionKind, Spectrum> spectra = new EnumMap<>(ConditionKind.class);
    spectra.put(ConditionKind.DIFF1, synthetic(0.0, 0.0, 0.6, false));
    spectra.put(ConditionKind.SUM, synthetic(2.0, 1.0, 0.5, false));
    Map<ConditionKind, BasisSet> bases = new EnumMap<>(ConditionKind.class);
    bases.put(ConditionKind.DIFF1, basis);
    bases.put(ConditionKind.SUM, basis);

    Map<ConditionKind, FitParameters> fits = new ModelFitter(options).fitConcatenated(spectra, bases);

    FitParameters diff = fits.get(ConditionKind.DIFF1);
    FitParameters sum = fits.get(ConditionKind.SUM);
    assertFalse(diff.isFailed());
    assertFalse(sum.isFailed());
    assertEquals(sum.getReferenceShiftHz(), diff.getReferenceShiftHz(), 0.0);
    assertEquals(0.6, diff.amplitudeOf("Cho"), 0.02);
    assertEquals(1.0, sum.amplitudeOf("Cr"), 0.03);
  }

  @Test(expected = PreconditionViolationException.class)
  public void testConcatenatedFitNeedsBasisForEveryCondition() throws Exception {
    Map<ConditionKind, Spectrum> spectra = new EnumMap<>(ConditionKind.class);
    spectra.put(ConditionKind.SUM, synthetic(2.0, 1.0, 0.5, false));
    new ModelFitter(options).fitConcatenated(spectra, new EnumMap<ConditionKind, BasisSet>(ConditionKind.class));
  }
}
