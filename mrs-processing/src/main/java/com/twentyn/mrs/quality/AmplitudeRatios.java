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

import com.twentyn.mrs.fit.FitParameters;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Amplitude ratios derived from fit results.
 */
public class AmplitudeRatios {
  public static final String CREATINE = "Cr";
  public static final String PHOSPHOCREATINE = "PCr";

  private AmplitudeRatios() {
  }

  /**
   * Every amplitude divided by total creatine (Cr + PCr; PCr counts as zero when it was not fitted).  Empty for a
   * failed fit or when total creatine is not positive.
   */
  public static Map<String, Double> creatineRatios(FitParameters fit) {
    Map<String, Double> ratios = new LinkedHashMap<>();
    if (fit.isFailed()) {
      return ratios;
    }
    double creatine = fit.amplitudeOf(CREATINE);
    double phosphocreatine = fit.amplitudeOf(PHOSPHOCREATINE);
    double total = (Double.isNaN(creatine) ? 0.0 : creatine) + (Double.isNaN(phosphocreatine) ? 0.0 : phosphocreatine);
    if (!(total > 0.0)) {
      return ratios;
    }
    for (Map.Entry<String, Double> entry : fit.getAmplitudes().entrySet()) {
      ratios.put(entry.getKey(), entry.getValue() / total);
    }
    return ratios;
  }

  /**
   * Amplitudes in units of the original basis divided by the water amplitude in units of the water basis.
   */
  public static Map<String, Double> waterScaled(FitParameters metabolites, FitParameters water, String waterName) {
    Map<String, Double> scaled = new LinkedHashMap<>();
    if (metabolites.isFailed() || water.isFailed()) {
      return scaled;
    }
    double waterAmplitude = water.amplitudeOf(waterName) / water.getBasisNormalization();
    if (!(waterAmplitude > 0.0)) {
      return scaled;
    }
    for (Map.Entry<String, Double> entry : metabolites.getAmplitudes().entrySet()) {
      scaled.put(entry.getKey(), entry.getValue() / metabolites.getBasisNormalization() / waterAmplitude);
    }
    return scaled;
  }
}
