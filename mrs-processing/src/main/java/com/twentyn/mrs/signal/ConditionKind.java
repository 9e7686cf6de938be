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

/**
 * Experimental conditions a processed spectrum can represent.  ON2 and ON12 only occur in four-step (HERMES,
 * HERCULES) editing.
 */
public enum ConditionKind {
  OFF("off"),
  ON("on"),
  ON2("on2"),
  ON12("on12"),
  DIFF1("diff1"),
  DIFF2("diff2"),
  SUM("sum"),
  REF("ref"),
  WATER("w"),
  MM("mm"),
  ;

  private final String shortName;

  ConditionKind(String shortName) {
    this.shortName = shortName;
  }

  public String getShortName() {
    return shortName;
  }

  public boolean isDifference() {
    return this == DIFF1 || this == DIFF2;
  }

  public boolean isWater() {
    return this == REF || this == WATER;
  }
}
