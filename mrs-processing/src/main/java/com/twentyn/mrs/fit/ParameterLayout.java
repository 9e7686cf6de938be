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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Positions of the nonlinear fit parameters in the optimizer's vector: zero- and first-order phase, Gaussian
 * linewidth and global shift, followed (when per-basis terms are enabled) by a Lorentzian linewidth and a shift per
 * basis function name.
 */
class ParameterLayout {
  static final int PH0 = 0;
  static final int PH1 = 1;
  static final int GAUSS = 2;
  static final int SHIFT = 3;
  static final int GLOBAL_COUNT = 4;

  private final List<String> names;
  private final Map<String, Integer> positions = new HashMap<>();
  private final boolean perBasis;

  ParameterLayout(List<String> names, boolean perBasis) {
    this.names = new ArrayList<>(names);
    for (int i = 0; i < names.size(); i++) {
      positions.put(names.get(i), i);
    }
    this.perBasis = perBasis;
  }

  int size() {
    return GLOBAL_COUNT + (perBasis ? 2 * names.size() : 0);
  }

  boolean isPerBasis() {
    return perBasis;
  }

  List<String> getNames() {
    return names;
  }

  int lorentzIndex(String name) {
    return GLOBAL_COUNT + 2 * position(name);
  }

  int shiftIndex(String name) {
    return GLOBAL_COUNT + 2 * position(name) + 1;
  }

  double lorentz(double[] p, String name) {
    return perBasis ? p[lorentzIndex(name)] : 0.0;
  }

  // Global plus per-basis shift.
  double shift(double[] p, String name) {
    return p[SHIFT] + (perBasis ? p[shiftIndex(name)] : 0.0);
  }

  private int position(String name) {
    Integer position = positions.get(name);
    if (position == null) {
      throw new IllegalStateException(String.format("No fit parameters laid out for basis function '%s'", name));
    }
    return position;
  }
}
