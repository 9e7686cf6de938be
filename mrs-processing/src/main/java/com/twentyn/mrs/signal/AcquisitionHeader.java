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

package com.twentyn.mrs.signal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.twentyn.mrs.exceptions.PreconditionViolationException;

import java.util.Arrays;

/**
 * Sampling and scanner metadata shared by every FID of one acquisition.  Sample count and dwell time are fixed for
 * all averages and sub-spectra.
 */
public class AcquisitionHeader {
  // Chemical shift of the transmitter (water) frequency.
  public static final double CENTER_PPM = 4.68;
  // Proton gyromagnetic ratio in MHz/T.
  public static final double GAMMA_MHZ_PER_T = 42.577;

  @JsonProperty("dwell_time")
  private final double dwellTime;

  @JsonProperty("sample_count")
  private final int sampleCount;

  @JsonProperty("tx_frequency_mhz")
  private final double txFrequencyMHz;

  @JsonProperty("field_strength_t")
  private final double fieldStrengthT;

  @JsonProperty("echo_time_ms")
  private final double echoTimeMs;

  @JsonProperty("repetition_time_ms")
  private final double repetitionTimeMs;

  @JsonProperty("voxel_dimensions_mm")
  private final double[] voxelDimensionsMm;

  @JsonCreator
  public AcquisitionHeader(@JsonProperty("dwell_time") double dwellTime,
                           @JsonProperty("sample_count") int sampleCount,
                           @JsonProperty("tx_frequency_mhz") double txFrequencyMHz,
                           @JsonProperty("field_strength_t") double fieldStrengthT,
                           @JsonProperty("echo_time_ms") double echoTimeMs,
                           @JsonProperty("repetition_time_ms") double repetitionTimeMs,
                           @JsonProperty("voxel_dimensions_mm") double[] voxelDimensionsMm) {
    if (!(dwellTime > 0.0)) {
      throw new PreconditionViolationException(String.format("Dwell time must be positive, got %f", dwellTime));
    }
    if (sampleCount <= 0 || Integer.bitCount(sampleCount) != 1) {
      throw new PreconditionViolationException(
          String.format("Sample count must be a positive power of two, got %d", sampleCount));
    }
    if (!(txFrequencyMHz > 0.0)) {
      throw new PreconditionViolationException(
          String.format("Transmitter frequency must be positive, got %f", txFrequencyMHz));
    }
    this.dwellTime = dwellTime;
    this.sampleCount = sampleCount;
    this.txFrequencyMHz = txFrequencyMHz;
    this.fieldStrengthT = fieldStrengthT;
    this.echoTimeMs = echoTimeMs;
    this.repetitionTimeMs = repetitionTimeMs;
    this.voxelDimensionsMm = voxelDimensionsMm == null ? new double[0] : voxelDimensionsMm.clone();
  }

  /**
   * Builds a header for a given field strength, deriving the transmitter frequency from the proton gyromagnetic ratio.
   */
  public static AcquisitionHeader forField(double fieldStrengthT, double spectralWidthHz, int sampleCount,
                                           double echoTimeMs, double repetitionTimeMs) {
    return new AcquisitionHeader(1.0 / spectralWidthHz, sampleCount, fieldStrengthT * GAMMA_MHZ_PER_T,
        fieldStrengthT, echoTimeMs, repetitionTimeMs, null);
  }

  public AcquisitionHeader withSampleCount(int newSampleCount) {
    return new AcquisitionHeader(dwellTime, newSampleCount, txFrequencyMHz, fieldStrengthT, echoTimeMs,
        repetitionTimeMs, voxelDimensionsMm);
  }

  public AcquisitionHeader withDwellTime(double newDwellTime) {
    return new AcquisitionHeader(newDwellTime, sampleCount, txFrequencyMHz, fieldStrengthT, echoTimeMs,
        repetitionTimeMs, voxelDimensionsMm);
  }

  public double getDwellTime() {
    return dwellTime;
  }

  public int getSampleCount() {
    return sampleCount;
  }

  public double getTxFrequencyMHz() {
    return txFrequencyMHz;
  }

  public double getFieldStrengthT() {
    return fieldStrengthT;
  }

  public double getEchoTimeMs() {
    return echoTimeMs;
  }

  public double getRepetitionTimeMs() {
    return repetitionTimeMs;
  }

  public double[] getVoxelDimensionsMm() {
    return voxelDimensionsMm.clone();
  }

  public double getSpectralWidthHz() {
    return 1.0 / dwellTime;
  }

  /** Hz per ppm, numerically equal to the transmitter frequency in MHz. */
  public double getHzPerPpm() {
    return txFrequencyMHz;
  }

  public double hzToPpm(double hz) {
    return hz / txFrequencyMHz;
  }

  public double ppmToHz(double ppm) {
    return ppm * txFrequencyMHz;
  }

  public double timeAt(int sample) {
    return sample * dwellTime;
  }

  public PpmAxis ppmAxis() {
    return new PpmAxis(this);
  }

  /** True when both headers describe the same sampling grid. */
  public boolean sameGrid(AcquisitionHeader other) {
    return other != null && other.sampleCount == sampleCount
        && Math.abs(other.dwellTime - dwellTime) <= 1e-9 * dwellTime
        && Math.abs(other.txFrequencyMHz - txFrequencyMHz) <= 1e-6 * txFrequencyMHz;
  }

  @Override
  public String toString() {
    return String.format(
        "AcquisitionHeader{dwell=%g s, n=%d, tx=%.4f MHz, B0=%.2f T, TE=%.1f ms, TR=%.1f ms, voxel=%s}",
        dwellTime, sampleCount, txFrequencyMHz, fieldStrengthT, echoTimeMs, repetitionTimeMs,
        Arrays.toString(voxelDimensionsMm));
  }
}
