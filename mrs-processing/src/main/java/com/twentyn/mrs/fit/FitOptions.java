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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Settings for one model fit.  Instances are immutable; the with* methods return modified copies.
 */
public class FitOptions {
  public static final double[] METABOLITE_RANGE_PPM = {0.2, 4.2};
  public static final double[] WATER_RANGE_PPM = {2.0, 7.4};
  // NAA, Cr and Cho singlets.
  public static final double[] METABOLITE_REFERENCE_PPM = {2.008, 3.027, 3.20};
  public static final double[] WATER_REFERENCE_PPM = {4.68};
  public static final List<String> DEFAULT_REDUCED_SET =
      Collections.unmodifiableList(Arrays.asList("Cr", "Glu", "Ins", "mI", "GPC", "PCh", "NAA"));

  private final double lowPpm;
  private final double highPpm;
  private final double knotSpacingPpm;
  private final int zeroFill;
  private final List<String> includedMetabolites;
  private final List<String> reducedMetabolites;
  private final double[] referencePpm;
  private final int maxIterations;
  private final int maxEvaluations;

  public FitOptions(double lowPpm, double highPpm, double knotSpacingPpm, int zeroFill,
                    List<String> includedMetabolites, List<String> reducedMetabolites, double[] referencePpm,
                    int maxIterations, int maxEvaluations) {
    this.lowPpm = lowPpm;
    this.highPpm = highPpm;
    this.knotSpacingPpm = knotSpacingPpm;
    this.zeroFill = zeroFill;
    this.includedMetabolites = Collections.unmodifiableList(new ArrayList<>(includedMetabolites));
    this.reducedMetabolites = Collections.unmodifiableList(new ArrayList<>(reducedMetabolites));
    this.referencePpm = referencePpm.clone();
    this.maxIterations = maxIterations;
    this.maxEvaluations = maxEvaluations;
  }

  public static FitOptions metaboliteDefaults() {
    return new FitOptions(METABOLITE_RANGE_PPM[0], METABOLITE_RANGE_PPM[1], BSplineBaseline.DEFAULT_KNOT_SPACING_PPM,
        2, Collections.<String>emptyList(), DEFAULT_REDUCED_SET, METABOLITE_REFERENCE_PPM, 200, 4000);
  }

  public static FitOptions waterDefaults() {
    return new FitOptions(WATER_RANGE_PPM[0], WATER_RANGE_PPM[1], BSplineBaseline.DEFAULT_KNOT_SPACING_PPM,
        2, Collections.<String>emptyList(), Collections.<String>emptyList(), WATER_REFERENCE_PPM, 200, 4000);
  }

  public FitOptions withRange(double low, double high) {
    return new FitOptions(low, high, knotSpacingPpm, zeroFill, includedMetabolites, reducedMetabolites,
        referencePpm, maxIterations, maxEvaluations);
  }

  public FitOptions withKnotSpacing(double spacing) {
    return new FitOptions(lowPpm, highPpm, spacing, zeroFill, includedMetabolites, reducedMetabolites,
        referencePpm, maxIterations, maxEvaluations);
  }

  public FitOptions withZeroFill(int factor) {
    return new FitOptions(lowPpm, highPpm, knotSpacingPpm, factor, includedMetabolites, reducedMetabolites,
        referencePpm, maxIterations, maxEvaluations);
  }

  public FitOptions withIncludedMetabolites(List<String> names) {
    return new FitOptions(lowPpm, highPpm, knotSpacingPpm, zeroFill, names, reducedMetabolites,
        referencePpm, maxIterations, maxEvaluations);
  }

  public FitOptions withReducedMetabolites(List<String> names) {
    return new FitOptions(lowPpm, highPpm, knotSpacingPpm, zeroFill, includedMetabolites, names,
        referencePpm, maxIterations, maxEvaluations);
  }

  public FitOptions withIterationCaps(int iterations, int evaluations) {
    return new FitOptions(lowPpm, highPpm, knotSpacingPpm, zeroFill, includedMetabolites, reducedMetabolites,
        referencePpm, iterations, evaluations);
  }

  public double getLowPpm() {
    return lowPpm;
  }

  public double getHighPpm() {
    return highPpm;
  }

  public double getKnotSpacingPpm() {
    return knotSpacingPpm;
  }

  public int getZeroFill() {
    return zeroFill;
  }

  /** Empty means every function of the basis set. */
  public List<String> getIncludedMetabolites() {
    return includedMetabolites;
  }

  public List<String> getReducedMetabolites() {
    return reducedMetabolites;
  }

  public double[] getReferencePpm() {
    return referencePpm.clone();
  }

  public int getMaxIterations() {
    return maxIterations;
  }

  public int getMaxEvaluations() {
    return maxEvaluations;
  }
}
