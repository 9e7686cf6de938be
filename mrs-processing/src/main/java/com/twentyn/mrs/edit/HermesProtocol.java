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

package com.twentyn.mrs.edit;

import com.twentyn.mrs.correct.PolarityCorrector;
import com.twentyn.mrs.exceptions.UnsupportedEditTargetException;
import com.twentyn.mrs.reference.Landmark;
import com.twentyn.mrs.signal.ConditionKind;
import com.twentyn.mrs.signal.PpmAxis;
import com.twentyn.mrs.signal.SpectralOps;
import com.twentyn.mrs.signal.Spectrum;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Four-step Hadamard editing of GABA and GSH.  The two sub-experiments with the lowest NAA signal carry the GABA
 * editing pulse; within each pair the one with less residual water carries the GSH editing pulse.
 */
public class HermesProtocol extends AbstractAcquisitionProtocol {
  public static final double NAA_LOW_PPM = 1.9;
  public static final double NAA_HIGH_PPM = 2.1;
  public static final double WATER_LOW_PPM = 4.4;
  public static final double WATER_HIGH_PPM = 5.0;

  public HermesProtocol() {
    this(AcquisitionType.HERMES);
  }

  protected HermesProtocol(AcquisitionType type) {
    super(type, EditTarget.GABA_GSH, 4);
  }

  public HermesProtocol(EditTarget target) {
    this();
    requireGabaGsh(target);
  }

  static void requireGabaGsh(EditTarget target) {
    if (target != EditTarget.GABA_GSH) {
      throw new UnsupportedEditTargetException(String.format(
          "Four-step editing classifies GABA and GSH jointly, target %s is not supported", target));
    }
  }

  @Override
  public double[] getPolarityWindow() {
    return new double[]{PolarityCorrector.CR_LOW_PPM, PolarityCorrector.CR_HIGH_PPM};
  }

  @Override
  public double[] getAlignmentLandmarks() {
    return Landmark.CR_CHO.getCanonicalPpm();
  }

  @Override
  public EditClassification classify(List<Spectrum> subSpectra) {
    requireCount(subSpectra);
    final double[] naa = new double[4];
    final double[] water = new double[4];
    for (int k = 0; k < 4; k++) {
      naa[k] = windowMax(subSpectra.get(k), NAA_LOW_PPM, NAA_HIGH_PPM);
      water[k] = windowMax(subSpectra.get(k), WATER_LOW_PPM, WATER_HIGH_PPM);
    }
    List<Integer> byNaa = new ArrayList<>(Arrays.asList(0, 1, 2, 3));
    Collections.sort(byNaa, new Comparator<Integer>() {
      @Override
      public int compare(Integer a, Integer b) {
        int c = Double.compare(naa[a], naa[b]);
        return c != 0 ? c : Integer.compare(a, b);
      }
    });
    int[] gabaOn = lowerWaterFirst(byNaa.get(0), byNaa.get(1), water);
    int[] gabaOff = lowerWaterFirst(byNaa.get(2), byNaa.get(3), water);

    Map<ConditionKind, Integer> index = new EnumMap<>(ConditionKind.class);
    index.put(ConditionKind.OFF, gabaOff[1]);
    index.put(ConditionKind.ON, gabaOn[1]);
    index.put(ConditionKind.ON2, gabaOff[0]);
    index.put(ConditionKind.ON12, gabaOn[0]);
    Map<ConditionKind, Spectrum> spectra = new EnumMap<>(ConditionKind.class);
    boolean switchOrder = false;
    List<ConditionKind> order = getAcquiredConditions();
    for (int k = 0; k < order.size(); k++) {
      ConditionKind kind = order.get(k);
      spectra.put(kind, subSpectra.get(index.get(kind)));
      switchOrder |= index.get(kind) != k;
    }
    return new EditClassification(spectra, index, switchOrder);
  }

  private static int[] lowerWaterFirst(int a, int b, double[] water) {
    return water[a] <= water[b] ? new int[]{a, b} : new int[]{b, a};
  }

  private static double windowMax(Spectrum spectrum, double low, double high) {
    PpmAxis axis = spectrum.ppmAxis();
    int[] range = axis.indexRange(low, high);
    double[] magnitude = spectrum.magnitudeSpectrum();
    return magnitude[SpectralOps.argMax(magnitude, range[0], range[1])];
  }

  /** DIFF1 = ON + ON12 - OFF - ON2 (GABA), DIFF2 = ON2 + ON12 - OFF - ON (GSH), SUM = all four. */
  @Override
  public Map<ConditionKind, Spectrum> combine(EditClassification classification) {
    Spectrum off = classification.get(ConditionKind.OFF);
    Spectrum on = classification.get(ConditionKind.ON);
    Spectrum on2 = classification.get(ConditionKind.ON2);
    Spectrum on12 = classification.get(ConditionKind.ON12);
    Map<ConditionKind, Spectrum> derived = new EnumMap<>(ConditionKind.class);
    derived.put(ConditionKind.DIFF1, on.add(on12).subtract(off).subtract(on2));
    derived.put(ConditionKind.DIFF2, on2.add(on12).subtract(off).subtract(on));
    derived.put(ConditionKind.SUM, off.add(on).add(on2).add(on12));
    return derived;
  }

  @Override
  public List<ConditionKind> getAcquiredConditions() {
    return Arrays.asList(ConditionKind.OFF, ConditionKind.ON, ConditionKind.ON2, ConditionKind.ON12);
  }

  @Override
  public List<ConditionKind> getDerivedConditions() {
    return Arrays.asList(ConditionKind.DIFF1, ConditionKind.DIFF2, ConditionKind.SUM);
  }
}
