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

package com.twentyn.mrs.reference;

/**
 * Resonances with a known canonical chemical shift that spectra are referenced on.  CR_CHO is modelled as two
 * Lorentzians at a fixed separation sharing one linewidth and one phase.
 */
public enum Landmark {
  NAA(new double[]{2.008}, 1.85, 2.25),
  CR_CHO(new double[]{3.027, 3.20}, 2.85, 3.35),
  CR(new double[]{3.027}, 2.9, 3.15),
  WATER(new double[]{4.68}, 4.4, 5.0),
  MM(new double[]{0.9}, 0.7, 1.1),
  ;

  private final double[] canonicalPpm;
  private final double lowPpm;
  private final double highPpm;

  Landmark(double[] canonicalPpm, double lowPpm, double highPpm) {
    this.canonicalPpm = canonicalPpm;
    this.lowPpm = lowPpm;
    this.highPpm = highPpm;
  }

  /** Canonical shift of the primary resonance. */
  public double getPpm() {
    return canonicalPpm[0];
  }

  public double[] getCanonicalPpm() {
    return canonicalPpm.clone();
  }

  public boolean isDoublet() {
    return canonicalPpm.length > 1;
  }

  /** Separation of the secondary resonance from the primary one, in ppm. */
  public double getSeparationPpm() {
    return isDoublet() ? canonicalPpm[1] - canonicalPpm[0] : 0.0;
  }

  public double getLowPpm() {
    return lowPpm;
  }

  public double getHighPpm() {
    return highPpm;
  }
}
