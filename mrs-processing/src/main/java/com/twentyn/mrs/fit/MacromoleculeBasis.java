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
import com.twentyn.mrs.signal.SpectralOps;
import com.twentyn.mrs.signal.Spectrum;
import org.apache.commons.math3.complex.Complex;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adds parametrised macromolecule and lipid signals to a metabolite basis set.  Every signal is a sum of Gaussians
 * given as (ppm, FWHM in ppm, protons) and is scaled so that one proton carries the area of one creatine methyl
 * proton.
 */
public class MacromoleculeBasis {
  private static final Logger LOGGER = LogManager.getFormatterLogger(MacromoleculeBasis.class);

  public static final String CREATINE = "Cr";
  private static final double CREATINE_PPM = 3.027;
  private static final double CREATINE_HALF_WIDTH_PPM = 0.4;
  private static final double CREATINE_METHYL_PROTONS = 3.0;

  static final Map<String, double[][]> COMPONENTS;

  static {
    Map<String, double[][]> components = new LinkedHashMap<>();
    components.put("MM09", new double[][]{{0.91, 0.14, 3.0}});
    components.put("MM12", new double[][]{{1.21, 0.15, 2.0}});
    components.put("MM14", new double[][]{{1.43, 0.17, 2.0}});
    components.put("MM17", new double[][]{{1.67, 0.15, 2.0}});
    components.put("MM20", new double[][]{{2.08, 0.15, 1.33}, {2.25, 0.2, 0.33}, {1.95, 0.15, 0.33},
        {3.0, 0.2, 0.4}});
    components.put("Lip09", new double[][]{{0.89, 0.14, 3.0}});
    components.put("Lip13", new double[][]{{1.28, 0.15, 2.0}, {1.28, 0.89, 2.0}});
    components.put("Lip20", new double[][]{{2.04, 0.15, 1.33}, {2.25, 0.15, 0.67}, {2.8, 0.2, 0.87}});
    COMPONENTS = Collections.unmodifiableMap(components);
  }

  public static List<String> names() {
    return new ArrayList<>(COMPONENTS.keySet());
  }

  /**
   * Returns the basis set with all macromolecule and lipid signals appended.  Names already in the set are left
   * alone.
   * @throws PreconditionViolationException when the set holds no creatine function to scale against
   */
  public BasisSet augment(BasisSet basis) {
    if (!basis.contains(CREATINE)) {
      throw new PreconditionViolationException(
          "Macromolecule signals are scaled to creatine, but the basis set has no '" + CREATINE + "'");
    }
    AcquisitionHeader header = basis.getHeader();
    double oneProtonArea = area(basis.get(CREATINE).getSpectrum(), CREATINE_PPM - CREATINE_HALF_WIDTH_PPM,
        CREATINE_PPM + CREATINE_HALF_WIDTH_PPM) / CREATINE_METHYL_PROTONS;

    List<BasisFunction> added = new ArrayList<>();
    for (Map.Entry<String, double[][]> entry : COMPONENTS.entrySet()) {
      if (basis.contains(entry.getKey())) {
        LOGGER.debug("Basis set already holds %s, not adding it", entry.getKey());
        continue;
      }
      added.add(new BasisFunction(entry.getKey(), header, synthesize(header, entry.getValue(), oneProtonArea)));
    }
    LOGGER.info("Added %d macromolecule/lipid functions (one-proton area %g)", added.size(), oneProtonArea);
    return basis.withAdditional(added);
  }

  private static Complex[] synthesize(AcquisitionHeader header, double[][] gaussians, double oneProtonArea) {
    Complex[] fid = null;
    for (double[] g : gaussians) {
      double fwhmHz = header.ppmToHz(g[1]);
      Complex[] unit = SpectralOps.gaussian(header, g[0], fwhmHz, 1.0, 0.0);
      double unitArea = area(new Spectrum(header, unit), Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
      Complex[] scaled = SpectralOps.scale(unit, g[2] * oneProtonArea / unitArea);
      fid = fid == null ? scaled : SpectralOps.add(fid, scaled);
    }
    return fid;
  }

  // Sum of the real spectrum over [lowPpm, highPpm].
  static double area(Spectrum spectrum, double lowPpm, double highPpm) {
    double[] real = spectrum.realSpectrum();
    double[] ppm = spectrum.ppmAxis().ppmValues();
    double total = 0.0;
    for (int i = 0; i < real.length; i++) {
      if (ppm[i] >= lowPpm && ppm[i] <= highPpm) {
        total += real[i];
      }
    }
    return total;
  }
}
