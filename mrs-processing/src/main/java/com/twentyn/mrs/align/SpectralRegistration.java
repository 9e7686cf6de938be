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

package com.twentyn.mrs.align;

import com.twentyn.mrs.reference.CrossCorrelationReferencer;
import com.twentyn.mrs.signal.AcquisitionHeader;
import com.twentyn.mrs.signal.SpectralOps;
import com.twentyn.mrs.signal.Spectrum;
import com.twentyn.mrs.signal.TimeDomainSignal;
import com.twentyn.mrs.util.LeastSquaresSolver;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Robust spectral registration of repeated transients.
 *
 * A coarse frequency estimate is computed per package of contiguous averages (10% of the averages each) by
 * cross-correlation against a synthetic landmark comb.  Starting from it, frequency and phase of every average are
 * refined against the weighted mean of all corrected averages over the first part of the FID.  Averages that stay
 * dissimilar to the target are down-weighted, never rejected.
 */
public class SpectralRegistration {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpectralRegistration.class);

  public static final int DEFAULT_ITERATIONS = 5;
  public static final double DEFAULT_WINDOW_SECONDS = 0.2;
  public static final double PACKAGE_FRACTION = 0.1;
  private static final int MIN_WINDOW_POINTS = 32;
  private static final double FREQUENCY_TOLERANCE_HZ = 1e-3;
  private static final double PHASE_TOLERANCE_RAD = 1e-4;
  private static final int LM_MAX_ITERATIONS = 100;
  private static final int LM_MAX_EVALUATIONS = 500;

  private final CrossCorrelationReferencer coarseReferencer;
  private final DriftMeter driftMeter;
  private final int iterations;
  private final double windowSeconds;

  public SpectralRegistration() {
    this(new CrossCorrelationReferencer(), new DriftMeter(), DEFAULT_ITERATIONS, DEFAULT_WINDOW_SECONDS);
  }

  public SpectralRegistration(CrossCorrelationReferencer coarseReferencer, DriftMeter driftMeter, int iterations,
                              double windowSeconds) {
    this.coarseReferencer = coarseReferencer;
    this.driftMeter = driftMeter;
    this.iterations = iterations;
    this.windowSeconds = windowSeconds;
  }

  /**
   * Aligns and averages the averages of one sub-spectrum.
   * @param landmarkPpm canonical positions of the resonances used for the coarse estimate
   */
  public AlignmentResult align(TimeDomainSignal signal, int subSpectrum, double[] landmarkPpm) {
    signal.requireNonEmpty();
    TimeDomainSignal combined = signal.combineCoils();
    AcquisitionHeader header = combined.getHeader();
    List<Complex[]> fids = combined.averagesOf(subSpectrum);
    int count = fids.size();

    if (count == 1 || combined.isPreAveraged()) {
      Complex[] fid = count == 1 ? fids.get(0) : SpectralOps.average(fids);
      double[] drift = driftMeter.measureDrift(Collections.singletonList(fid), header);
      double[] ones = new double[count];
      Arrays.fill(ones, 1.0);
      return new AlignmentResult(new Spectrum(header, fid), new double[count], new double[count], ones, drift, drift,
          false, false);
    }

    double[] coarse = coarseFrequencyGuess(fids, header, landmarkPpm);
    double[] frequency = new double[count];
    double[] phase = new double[count];
    for (int k = 0; k < count; k++) {
      frequency[k] = -coarse[k];
    }

    int points = windowPoints(header);
    List<Complex[]> truncated = new ArrayList<>(count);
    for (Complex[] fid : fids) {
      truncated.add(Arrays.copyOf(fid, points));
    }
    double dt = header.getDwellTime();
    double[] weights = new double[count];
    Arrays.fill(weights, 1.0);
    double[] residual = new double[count];
    boolean degraded = false;

    for (int iteration = 0; iteration < iterations; iteration++) {
      List<Complex[]> corrected = new ArrayList<>(count);
      for (int k = 0; k < count; k++) {
        corrected.add(SpectralOps.freqPhaseShift(truncated.get(k), dt, frequency[k], phase[k]));
      }
      Complex[] target = SpectralOps.weightedAverage(corrected, weights);

      double maxFrequencyChange = 0.0;
      double maxPhaseChange = 0.0;
      for (int k = 0; k < count; k++) {
        LeastSquaresSolver.Solution solution = register(corrected.get(k), target, dt);
        if (!solution.isFinite()) {
          LOGGER.warn("Registration of average %d did not yield a finite solution, using coarse estimate", k);
          frequency[k] = -coarse[k];
          phase[k] = 0.0;
          residual[k] = Double.POSITIVE_INFINITY;
          degraded = true;
          continue;
        }
        double[] step = solution.getPoint();
        frequency[k] += step[0];
        phase[k] += step[1];
        residual[k] = Math.sqrt(solution.getCost());
        maxFrequencyChange = Math.max(maxFrequencyChange, Math.abs(step[0]));
        maxPhaseChange = Math.max(maxPhaseChange, Math.abs(step[1]));
      }
      weights = weights(residual, energy(target));
      LOGGER.debug("Registration iteration %d: max change %.4f Hz / %.5f rad", iteration, maxFrequencyChange,
          maxPhaseChange);
      if (maxFrequencyChange < FREQUENCY_TOLERANCE_HZ && maxPhaseChange < PHASE_TOLERANCE_RAD) {
        break;
      }
    }

    List<Complex[]> corrected = new ArrayList<>(count);
    double[] phaseDeg = new double[count];
    for (int k = 0; k < count; k++) {
      corrected.add(SpectralOps.freqPhaseShift(fids.get(k), dt, frequency[k], phase[k]));
      phaseDeg[k] = Math.toDegrees(Math.atan2(Math.sin(phase[k]), Math.cos(phase[k])));
    }
    Spectrum averaged = new Spectrum(header, SpectralOps.weightedAverage(corrected, weights));
    double[] driftPre = driftMeter.measureDrift(fids, header);
    double[] driftPost = driftMeter.measureDrift(corrected, header);
    return new AlignmentResult(averaged, frequency, phaseDeg, weights, driftPre, driftPost, true, degraded);
  }

  /**
   * Per-average coarse frequency offsets (observed minus canonical, Hz).  Averages are grouped into contiguous
   * packages of round(10%) of the averages, the remainder forming a last, smaller package; each package's estimate
   * is given to all its members.
   */
  public double[] coarseFrequencyGuess(List<Complex[]> fids, AcquisitionHeader header, double[] landmarkPpm) {
    int count = fids.size();
    int packageSize = Math.max(1, (int) Math.round(count * PACKAGE_FRACTION));
    double[] guess = new double[count];
    for (int start = 0; start < count; start += packageSize) {
      int end = Math.min(count, start + packageSize);
      Spectrum packageMean = new Spectrum(header, SpectralOps.average(fids.subList(start, end)));
      double shift = coarseReferencer.estimateShift(packageMean, landmarkPpm);
      for (int k = start; k < end; k++) {
        guess[k] = shift;
      }
    }
    return guess;
  }

  public double[] measureDrift(List<Complex[]> fids, AcquisitionHeader header) {
    return driftMeter.measureDrift(fids, header);
  }

  /** Frequency (Hz) and phase (rad) increments that best map fid onto target. */
  private static LeastSquaresSolver.Solution register(final Complex[] fid, final Complex[] target, final double dt) {
    LeastSquaresSolver.Residuals residuals = new LeastSquaresSolver.Residuals() {
      @Override
      public double[] value(double[] p) {
        double[] r = new double[2 * fid.length];
        for (int i = 0; i < fid.length; i++) {
          double angle = 2.0 * Math.PI * p[0] * i * dt + p[1];
          double c = Math.cos(angle);
          double s = Math.sin(angle);
          double re = fid[i].getReal() * c - fid[i].getImaginary() * s;
          double im = fid[i].getReal() * s + fid[i].getImaginary() * c;
          r[2 * i] = re - target[i].getReal();
          r[2 * i + 1] = im - target[i].getImaginary();
        }
        return r;
      }
    };
    return new LeastSquaresSolver(LM_MAX_ITERATIONS, LM_MAX_EVALUATIONS)
        .withTypicalScale(new double[]{1.0, 1.0})
        .minimize(residuals, new double[]{0.0, 0.0});
  }

  /**
   * w = min(1, (dRef / d)^2) with dRef the median residual (floored relative to the target energy).  Bounded to
   * [0, 1], non-increasing in the residual, and at least half of the averages receive weight 1.
   */
  static double[] weights(double[] residual, double targetEnergy) {
    double[] finite = new double[residual.length];
    int n = 0;
    for (double d : residual) {
      if (!Double.isInfinite(d) && !Double.isNaN(d)) {
        finite[n++] = d;
      }
    }
    double[] w = new double[residual.length];
    if (n == 0) {
      Arrays.fill(w, 1.0);
      return w;
    }
    double reference = Math.max(new Median().evaluate(finite, 0, n), 1e-12 * targetEnergy);
    for (int k = 0; k < residual.length; k++) {
      double d = residual[k];
      if (Double.isInfinite(d) || Double.isNaN(d)) {
        w[k] = 0.0;
      } else if (d <= reference) {
        w[k] = 1.0;
      } else {
        w[k] = (reference / d) * (reference / d);
      }
    }
    return w;
  }

  private static double energy(Complex[] values) {
    double total = 0.0;
    for (Complex c : values) {
      total += c.getReal() * c.getReal() + c.getImaginary() * c.getImaginary();
    }
    return Math.sqrt(total);
  }

  private int windowPoints(AcquisitionHeader header) {
    int n = header.getSampleCount();
    int points = (int) Math.round(windowSeconds / header.getDwellTime());
    return Math.max(Math.min(MIN_WINDOW_POINTS, n), Math.min(n, points));
  }
}
