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

package com.linemerge.merge;

import com.linemerge.lines.LineContainer;

/**
 * Decides whether two lines from different sources describe the same physical transition.
 */
public class LineEquivalence {
  // Neutral iron.  Its catalogued J values are unreliable, so it is the one species whose J values are not compared.
  public static final int FE_I_SPECIES_CODE = 326;

  // Maximum relative difference between upper level energies.
  public static final double REL_ENERGY_TOLERANCE = 0.001;

  // Species codes at or above this are molecules, which use the forbidden-flag byte for unrelated data.
  public static final int MOLECULE_SPECIES_THRESHOLD = 10000;

  private LineEquivalence() {}

  /**
   * Checks rows {@code i} and {@code k} of a container.  The checks run cheapest and most selective first and stop at
   * the first failure.
   */
  public static boolean equivalent(LineContainer lines, int i, int k, double window) {
    return equivalent(
        lines.getWavelength(i), lines.getSpeciesCode(i), lines.getJLower(i), lines.getJUpper(i),
        lines.getEUpper(i), lines.getSourceIndex(i),
        lines.getWavelength(k), lines.getSpeciesCode(k), lines.getJLower(k), lines.getJUpper(k),
        lines.getEUpper(k), lines.getSourceIndex(k),
        window);
  }

  public static boolean equivalent(double wlI, int speciesI, float jLowerI, float jUpperI, double eUpperI, int sourceI,
                                   double wlK, int speciesK, float jLowerK, float jUpperK, double eUpperK, int sourceK,
                                   double window) {
    if (speciesI != speciesK) {
      return false;
    }

    // Never merge a source with itself.
    if (sourceI == sourceK) {
      return false;
    }

    if (Math.abs(wlK - wlI) > window) {
      return false;
    }

    if (speciesI != FE_I_SPECIES_CODE && (jLowerI != jLowerK || jUpperI != jUpperK)) {
      return false;
    }

    if (eUpperI > 0 && Math.abs(eUpperK - eUpperI) > REL_ENERGY_TOLERANCE * eUpperI) {
      return false;
    }

    return true;
  }

  public static boolean isAtom(int speciesCode) {
    return speciesCode < MOLECULE_SPECIES_THRESHOLD;
  }

  /**
   * Forbidden-transition gate for atomic lines: the flags must be identical, or one line must be autoionizing and the
   * other plainly allowed.
   */
  public static boolean forbidCompatible(byte flagI, byte flagK) {
    if (flagI == flagK) {
      return true;
    }
    return (flagI == LineContainer.FORBID_AUTOIONIZING && flagK == LineContainer.FORBID_ALLOWED) ||
        (flagI == LineContainer.FORBID_ALLOWED && flagK == LineContainer.FORBID_AUTOIONIZING);
  }
}
