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

import com.twentyn.mrs.exceptions.UnsupportedEditTargetException;
import com.twentyn.mrs.reference.Landmark;

/**
 * Selects the protocol implementation for an acquisition type.
 */
public class AcquisitionProtocols {
  private AcquisitionProtocols() {
  }

  public static AcquisitionProtocol create(AcquisitionType type, EditTarget target, Landmark uneditedLandmark) {
    switch (type) {
      case UNEDITED:
        if (target != EditTarget.NONE) {
          throw new UnsupportedEditTargetException(String.format(
              "Un-edited data cannot have editing target %s", target));
        }
        return new UneditedProtocol(uneditedLandmark);
      case MEGA:
        return new MegaProtocol(target);
      case HERMES:
        return new HermesProtocol(target);
      case HERCULES:
        return new HerculesProtocol(target);
      default:
        throw new UnsupportedEditTargetException(String.format("Unknown acquisition type %s", type));
    }
  }
}
