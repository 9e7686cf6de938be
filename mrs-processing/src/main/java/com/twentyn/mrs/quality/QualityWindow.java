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

import com.twentyn.mrs.signal.ConditionKind;

/**
 * ppm windows in which SNR and linewidth of a condition are measured.
 */
public class QualityWindow {
  public static final double[] NAA = {1.8, 2.2};
  public static final double[] CR = {2.8, 3.2};
  public static final double[] WATER = {4.2, 5.2};
  public static final double[] MM = {0.7, 1.1};

  private final double[] snrWindow;
  private final double[] linewidthWindow;

  public QualityWindow(double[] snrWindow, double[] linewidthWindow) {
    this.snrWindow = snrWindow.clone();
    this.linewidthWindow = linewidthWindow.clone();
  }

  public static QualityWindow forCondition(ConditionKind kind) {
    switch (kind) {
      case OFF:
        return new QualityWindow(NAA, NAA);
      case SUM:
        return new QualityWindow(NAA, CR);
      case REF:
      case WATER:
        return new QualityWindow(WATER, WATER);
      case MM:
        return new QualityWindow(MM, MM);
      default:
        return new QualityWindow(CR, CR);
    }
  }

  public double[] getSnrWindow() {
    return snrWindow.clone();
  }

  public double[] getLinewidthWindow() {
    return linewidthWindow.clone();
  }
}
