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
import com.twentyn.mrs.signal.Spectrum;
import org.apache.commons.math3.complex.Complex;

/**
 * A named reference signal (metabolite, macromolecule or lipid) stored as an FID.
 */
public class BasisFunction {
  private final String name;
  private final Spectrum spectrum;

  public BasisFunction(String name, AcquisitionHeader header, Complex[] fid) {
    this(name, new Spectrum(header, fid));
  }

  public BasisFunction(String name, Spectrum spectrum) {
    if (name == null || name.trim().isEmpty()) {
      throw new PreconditionViolationException("Basis functions need a name");
    }
    this.name = name;
    this.spectrum = spectrum;
  }

  public String getName() {
    return name;
  }

  public Spectrum getSpectrum() {
    return spectrum;
  }

  public AcquisitionHeader getHeader() {
    return spectrum.getHeader();
  }

  public Complex[] getFid() {
    return spectrum.getFid();
  }

  BasisFunction scaled(double factor) {
    return new BasisFunction(name, spectrum.scale(factor));
  }

  BasisFunction onGrid(Spectrum resampled) {
    return new BasisFunction(name, resampled);
  }

  @Override
  public String toString() {
    return "BasisFunction{" + name + "}";
  }
}
