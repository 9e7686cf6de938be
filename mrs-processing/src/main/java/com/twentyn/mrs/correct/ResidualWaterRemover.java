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

package com.twentyn.mrs.correct;

import com.twentyn.mrs.exceptions.PreconditionViolationException;
import com.twentyn.mrs.signal.AcquisitionHeader;
import com.twentyn.mrs.signal.Spectrum;
import com.twentyn.mrs.util.Degradation;
import com.twentyn.mrs.util.DegradationOutcome;
import org.apache.commons.math3.complex.Complex;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Removes residual water by subtracting the HSVD components that fall inside a ppm band.  Numerical breakdown of the
 * decomposition at a given order is retried with one component fewer each time, down to a floor.
 */
public class ResidualWaterRemover {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ResidualWaterRemover.class);

  public static final double DEFAULT_LOW_PPM = 4.5;
  public static final double DEFAULT_HIGH_PPM = 4.9;
  public static final int DEFAULT_ORDER = 20;
  public static final int DEFAULT_MIN_ORDER = 1;
  public static final int DEFAULT_POINT_LIMIT = 512;
  public static final double DEFAULT_DC_PERCENTAGE = 100.0;

  public static class Result {
    private final Spectrum spectrum;
    private final int order;
    private final boolean failed;

    Result(Spectrum spectrum, int order, boolean failed) {
      this.spectrum = spectrum;
      this.order = order;
      this.failed = failed;
    }

    public Spectrum getSpectrum() {
      return spectrum;
    }

    /** Filter order that produced a finite result, or -1 when every order failed. */
    public int getOrder() {
      return order;
    }

    public boolean isFailed() {
      return failed;
    }
  }

  private final Hsvd hsvd = new Hsvd();
  private final double lowPpm;
  private final double highPpm;
  private final int initialOrder;
  private final int minOrder;
  private final int pointLimit;
  private final double dcPercentage;

  public ResidualWaterRemover() {
    this(DEFAULT_LOW_PPM, DEFAULT_HIGH_PPM, DEFAULT_ORDER, DEFAULT_MIN_ORDER, DEFAULT_POINT_LIMIT,
        DEFAULT_DC_PERCENTAGE);
  }

  public ResidualWaterRemover(double lowPpm, double highPpm, int initialOrder, int minOrder, int pointLimit,
                              double dcPercentage) {
    if (minOrder < 1 || initialOrder < minOrder) {
      throw new PreconditionViolationException(String.format(
          "Water filter orders must satisfy 1 <= min (%d) <= initial (%d)", minOrder, initialOrder));
    }
    if (pointLimit < 4) {
      throw new PreconditionViolationException(String.format("HSVD point limit too small: %d", pointLimit));
    }
    this.lowPpm = Math.min(lowPpm, highPpm);
    this.highPpm = Math.max(lowPpm, highPpm);
    this.initialOrder = initialOrder;
    this.minOrder = minOrder;
    this.pointLimit = pointLimit;
    this.dcPercentage = dcPercentage;
  }

  /**
   * Single filtering pass at a fixed order.  The result may contain non-finite values when the decomposition is
   * unstable.
   */
  public Spectrum filter(Spectrum spectrum, int order) {
    AcquisitionHeader header = spectrum.getHeader();
    Complex[] fid = spectrum.getFid();
    List<Hsvd.Component> components = hsvd.decompose(fid, header.getDwellTime(), order, pointLimit);
    Complex[] out = fid.clone();
    int removed = 0;
    for (Hsvd.Component component : components) {
      double ppm = AcquisitionHeader.CENTER_PPM + header.hzToPpm(component.getFrequencyHz());
      if (ppm >= lowPpm && ppm <= highPpm) {
        Complex[] model = component.synthesize(fid.length);
        for (int i = 0; i < out.length; i++) {
          out[i] = out[i].subtract(model[i]);
        }
        removed++;
      }
    }
    LOGGER.debug("Removed %d of %d HSVD components in %.2f-%.2f ppm", removed, components.size(), lowPpm, highPpm);
    return spectrum.withFid(out);
  }

  /**
   * Filters with the configured order, walking the order down until the result is finite, then re-centres the
   * baseline.  When no order yields a finite result the unfiltered spectrum is kept and the result is flagged.
   */
  public Result remove(final Spectrum spectrum) {
    DegradationOutcome<Integer, Spectrum> outcome = Degradation.retryWithDegradation(
        order -> filter(spectrum, order),
        Degradation.descending(initialOrder, minOrder),
        Spectrum::isFinite);
    if (!outcome.succeeded()) {
      LOGGER.warn("Residual water removal failed for every order %d..%d (%s); keeping unfiltered spectrum",
          initialOrder, minOrder, outcome.getFailureReason());
      return new Result(spectrum.dcCorrect(dcPercentage), -1, true);
    }
    if (outcome.getParameter() != initialOrder) {
      LOGGER.info("Residual water removal succeeded at reduced order %d", outcome.getParameter());
    }
    return new Result(outcome.getValue().dcCorrect(dcPercentage), outcome.getParameter(), false);
  }
}
