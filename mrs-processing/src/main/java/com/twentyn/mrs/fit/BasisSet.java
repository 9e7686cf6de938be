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
import com.twentyn.mrs.signal.AcquisitionHeader;
import com.twentyn.mrs.signal.PpmAxis;
import com.twentyn.mrs.signal.Spectrum;
import org.apache.commons.math3.analysis.interpolation.SplineInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.complex.Complex;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered collection of uniquely named basis functions sharing one sampling grid.
 *
 * The set is normalised once when it is created: all functions are divided by the largest real spectral value found
 * in any of them.  Later operations (resampling, selection, augmentation) never rescale.
 */
public class BasisSet {
  private static final Logger LOGGER = LogManager.getFormatterLogger(BasisSet.class);

  private final AcquisitionHeader header;
  private final Map<String, BasisFunction> functions;
  private final double normalization;

  private BasisSet(AcquisitionHeader header, List<BasisFunction> functions, double normalization) {
    Map<String, BasisFunction> byName = new LinkedHashMap<>();
    for (BasisFunction function : functions) {
      if (byName.put(function.getName(), function) != null) {
        throw new PreconditionViolationException(String.format(
            "Basis set contains the name '%s' more than once", function.getName()));
      }
      if (!header.sameGrid(function.getHeader())) {
        throw new DataInconsistencyException(String.format(
            "Basis function '%s' is sampled on %s, basis set on %s", function.getName(), function.getHeader(),
            header));
      }
    }
    this.header = header;
    this.functions = Collections.unmodifiableMap(byName);
    this.normalization = normalization;
  }

  /**
   * Builds a normalised basis set.
   * @throws PreconditionViolationException on duplicate names or an empty list
   */
  public static BasisSet of(AcquisitionHeader header, List<BasisFunction> functions) {
    if (functions.isEmpty()) {
      throw new PreconditionViolationException("A basis set needs at least one function");
    }
    Set<String> seen = new HashSet<>();
    for (BasisFunction function : functions) {
      if (!seen.add(function.getName())) {
        throw new PreconditionViolationException(String.format(
            "Basis set contains the name '%s' more than once", function.getName()));
      }
    }
    double max = 0.0;
    for (BasisFunction function : functions) {
      for (double v : function.getSpectrum().realSpectrum()) {
        max = Math.max(max, Math.abs(v));
      }
    }
    if (!(max > 0.0)) {
      throw new PreconditionViolationException("Basis set spectra are all zero");
    }
    List<BasisFunction> scaled = new ArrayList<>(functions.size());
    for (BasisFunction function : functions) {
      scaled.add(function.scaled(1.0 / max));
    }
    LOGGER.debug("Normalised %d basis functions by %g", functions.size(), max);
    return new BasisSet(header, scaled, max);
  }

  public AcquisitionHeader getHeader() {
    return header;
  }

  /** Factor all functions were divided by at creation. */
  public double getNormalization() {
    return normalization;
  }

  public int size() {
    return functions.size();
  }

  public List<String> names() {
    return new ArrayList<>(functions.keySet());
  }

  public boolean contains(String name) {
    return functions.containsKey(name);
  }

  public BasisFunction get(String name) {
    BasisFunction function = functions.get(name);
    if (function == null) {
      throw new PreconditionViolationException(String.format("No basis function named '%s'", name));
    }
    return function;
  }

  public List<BasisFunction> functions() {
    return new ArrayList<>(functions.values());
  }

  /** The functions whose names are listed, in basis-set order.  Unknown names are ignored. */
  public BasisSet subset(Collection<String> names) {
    List<BasisFunction> selected = new ArrayList<>();
    for (BasisFunction function : functions.values()) {
      if (names.contains(function.getName())) {
        selected.add(function);
      }
    }
    if (selected.isEmpty()) {
      throw new PreconditionViolationException(String.format("None of %s is in the basis set", names));
    }
    return new BasisSet(header, selected, normalization);
  }

  /** Appends already-scaled functions (for example macromolecule components) without renormalising. */
  public BasisSet withAdditional(List<BasisFunction> additional) {
    List<BasisFunction> all = new ArrayList<>(functions.values());
    all.addAll(additional);
    return new BasisSet(header, all, normalization);
  }

  /**
   * Puts the basis onto the data's frequency grid.  Sample counts must agree; a differing dwell time or transmitter
   * frequency is handled by spline interpolation of the spectra over the ppm axis.
   * @throws DataInconsistencyException when the sample counts differ
   */
  public BasisSet resampleTo(AcquisitionHeader data) {
    if (data.getSampleCount() != header.getSampleCount()) {
      throw new DataInconsistencyException(String.format(
          "Basis set has %d samples, data has %d", header.getSampleCount(), data.getSampleCount()));
    }
    if (header.sameGrid(data)) {
      return this;
    }
    LOGGER.info("Resampling %d basis functions from %s onto %s", size(), header, data);
    PpmAxis from = header.ppmAxis();
    PpmAxis to = data.ppmAxis();
    double[] sourcePpm = from.ppmValues();
    double[] targetPpm = to.ppmValues();
    List<BasisFunction> resampled = new ArrayList<>(size());
    for (BasisFunction function : functions.values()) {
      Complex[] spectrum = function.getSpectrum().getSpectrum();
      double[] re = new double[spectrum.length];
      double[] im = new double[spectrum.length];
      for (int i = 0; i < spectrum.length; i++) {
        re[i] = spectrum[i].getReal();
        im[i] = spectrum[i].getImaginary();
      }
      PolynomialSplineFunction reSpline = new SplineInterpolator().interpolate(sourcePpm, re);
      PolynomialSplineFunction imSpline = new SplineInterpolator().interpolate(sourcePpm, im);
      Complex[] onGrid = new Complex[targetPpm.length];
      for (int i = 0; i < targetPpm.length; i++) {
        double ppm = targetPpm[i];
        onGrid[i] = reSpline.isValidPoint(ppm)
            ? new Complex(reSpline.value(ppm), imSpline.value(ppm))
            : Complex.ZERO;
      }
      resampled.add(function.onGrid(Spectrum.fromFrequencyDomain(data, onGrid)));
    }
    return new BasisSet(data, resampled, normalization);
  }
}
