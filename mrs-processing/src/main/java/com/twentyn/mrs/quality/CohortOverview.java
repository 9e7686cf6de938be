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

import com.twentyn.mrs.exceptions.PreconditionViolationException;
import com.twentyn.mrs.signal.PpmAxis;
import com.twentyn.mrs.signal.SpectralOps;
import com.twentyn.mrs.signal.Spectrum;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Mean and standard deviation spectra over a cohort.  Each spectrum is re-referenced so that its NAA maximum sits at
 * 2.013 ppm and then interpolated onto the ppm grid of the first spectrum, restricted to the range all spectra
 * cover.
 */
public class CohortOverview {
  private static final Logger LOGGER = LogManager.getFormatterLogger(CohortOverview.class);

  public static final double NAA_SEARCH_LOW_PPM = 1.9;
  public static final double NAA_SEARCH_HIGH_PPM = 2.1;
  public static final double NAA_TARGET_PPM = 2.013;

  public static class Summary {
    private final double[] ppm;
    private final double[] mean;
    private final double[] standardDeviation;
    private final int count;

    Summary(double[] ppm, double[] mean, double[] standardDeviation, int count) {
      this.ppm = ppm;
      this.mean = mean;
      this.standardDeviation = standardDeviation;
      this.count = count;
    }

    public double[] getPpm() {
      return ppm.clone();
    }

    public double[] getMean() {
      return mean.clone();
    }

    public double[] getStandardDeviation() {
      return standardDeviation.clone();
    }

    public int getCount() {
      return count;
    }
  }

  public Summary summarize(List<Spectrum> spectra) {
    if (spectra.isEmpty()) {
      throw new PreconditionViolationException("A cohort overview needs at least one spectrum");
    }
    List<PolynomialSplineFunction> interpolants = new ArrayList<>(spectra.size());
    double low = Double.NEGATIVE_INFINITY;
    double high = Double.POSITIVE_INFINITY;
    for (Spectrum spectrum : spectra) {
      Spectrum referenced = onNaa(spectrum);
      double[] ppm = referenced.ppmAxis().ppmValues();
      low = Math.max(low, ppm[0]);
      high = Math.min(high, ppm[ppm.length - 1]);
      interpolants.add(new LinearInterpolator().interpolate(ppm, referenced.realSpectrum()));
    }

    PpmAxis grid = spectra.get(0).ppmAxis();
    int[] range = grid.indexRange(low, high);
    double[] ppm = grid.ppmValues(range[0], range[1]);
    double[] mean = new double[ppm.length];
    double[] sd = new double[ppm.length];
    for (int i = 0; i < ppm.length; i++) {
      SummaryStatistics statistics = new SummaryStatistics();
      for (PolynomialSplineFunction interpolant : interpolants) {
        statistics.addValue(interpolant.value(ppm[i]));
      }
      mean[i] = statistics.getMean();
      sd[i] = spectra.size() > 1 ? statistics.getStandardDeviation() : 0.0;
    }
    LOGGER.debug("Summarised %d spectra over %.2f-%.2f ppm", spectra.size(), low, high);
    return new Summary(ppm, mean, sd, spectra.size());
  }

  Spectrum onNaa(Spectrum spectrum) {
    PpmAxis axis = spectrum.ppmAxis();
    int[] range = axis.indexRange(NAA_SEARCH_LOW_PPM, NAA_SEARCH_HIGH_PPM);
    if (range[0] > range[1]) {
      return spectrum;
    }
    double[] real = spectrum.realSpectrum();
    int peak = SpectralOps.argMax(real, range[0], range[1]);
    double observed = axis.ppmAt(SpectralOps.parabolicPeak(real, peak));
    return spectrum.freqShift(-spectrum.getHeader().ppmToHz(observed - NAA_TARGET_PPM));
  }
}
