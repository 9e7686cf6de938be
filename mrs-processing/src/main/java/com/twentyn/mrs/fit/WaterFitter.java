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

import com.twentyn.mrs.signal.AcquisitionHeader;
import com.twentyn.mrs.signal.SpectralOps;
import com.twentyn.mrs.signal.Spectrum;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;

/**
 * Fits water-unsuppressed reference spectra with a single synthetic water resonance over the water fit range.
 */
public class WaterFitter {
  private static final Logger LOGGER = LogManager.getFormatterLogger(WaterFitter.class);

  public static final String WATER = "H2O";
  // Intrinsic linewidth of the synthetic resonance; the fit broadens it to the data.
  private static final double BASIS_FWHM_HZ = 1.0;

  private final ModelFitter fitter;

  public WaterFitter() {
    this(FitOptions.waterDefaults());
  }

  public WaterFitter(FitOptions options) {
    this.fitter = new ModelFitter(options);
  }

  public FitParameters fit(Spectrum water) {
    BasisSet basis = waterBasis(water.getHeader());
    FitParameters result = fitter.fit(water, basis);
    if (!result.isFailed()) {
      LOGGER.debug("Water amplitude %g (basis normalisation %g)", result.amplitudeOf(WATER),
          basis.getNormalization());
    }
    return result;
  }

  public static BasisSet waterBasis(AcquisitionHeader header) {
    BasisFunction water = new BasisFunction(WATER, header,
        SpectralOps.lorentzian(header, AcquisitionHeader.CENTER_PPM, BASIS_FWHM_HZ, 1.0, 0.0));
    return BasisSet.of(header, Collections.singletonList(water));
  }
}
