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
import com.linemerge.lines.RankField;

/**
 * Folds the parameters of a merged-away line into the line that survives the merge, one field at a time.
 *
 * A field is taken from the secondary line when its rank is strictly higher than the primary's current rank for that
 * field.  Landé factors and the three damping constants have "unknown" sentinels (99.0 and 0.0); a primary holding the
 * sentinel also takes a known secondary value whatever the ranks say.  loggf and the level energies have no sentinel
 * and follow the rank comparison alone.
 */
public class FieldResolver {

  private FieldResolver() {}

  /**
   * Merges row {@code secondary} into row {@code primary} of the same container.  The wavelength rank is left alone:
   * it only decides which row is primary.
   */
  public static void mergeInto(LineContainer lines, int primary, int secondary) {
    int rank;

    rank = lines.getRank(secondary, RankField.LOGGF);
    if (rank > lines.getRank(primary, RankField.LOGGF)) {
      lines.setLoggf(primary, lines.getLoggf(secondary), rank);
    }

    rank = lines.getRank(secondary, RankField.E_LOWER);
    if (rank > lines.getRank(primary, RankField.E_LOWER)) {
      lines.setELower(primary, lines.getELower(secondary), rank);
    }

    rank = lines.getRank(secondary, RankField.E_UPPER);
    if (rank > lines.getRank(primary, RankField.E_UPPER)) {
      lines.setEUpper(primary, lines.getEUpper(secondary), rank);
    }

    // Both Landé factors travel together under a single rank; the lower level's value marks the pair as known.
    rank = lines.getRank(secondary, RankField.LANDE);
    if (rank > lines.getRank(primary, RankField.LANDE) ||
        (lines.getLandeLower(primary) == LineContainer.LANDE_UNKNOWN &&
            lines.getLandeLower(secondary) != LineContainer.LANDE_UNKNOWN)) {
      lines.setLande(primary, lines.getLandeLower(secondary), lines.getLandeUpper(secondary), rank);
    }

    rank = lines.getRank(secondary, RankField.GAMMA_RAD);
    if (rank > lines.getRank(primary, RankField.GAMMA_RAD) ||
        isUnknownGamma(lines.getGammaRad(primary), lines.getGammaRad(secondary))) {
      lines.setGammaRad(primary, lines.getGammaRad(secondary), rank);
    }

    rank = lines.getRank(secondary, RankField.GAMMA_STARK);
    if (rank > lines.getRank(primary, RankField.GAMMA_STARK) ||
        isUnknownGamma(lines.getGammaStark(primary), lines.getGammaStark(secondary))) {
      lines.setGammaStark(primary, lines.getGammaStark(secondary), rank);
    }

    rank = lines.getRank(secondary, RankField.GAMMA_VDW);
    if (rank > lines.getRank(primary, RankField.GAMMA_VDW) ||
        isUnknownGamma(lines.getGammaVdw(primary), lines.getGammaVdw(secondary))) {
      lines.setGammaVdw(primary, lines.getGammaVdw(secondary), rank);
    }
  }

  private static boolean isUnknownGamma(float primaryValue, float secondaryValue) {
    return primaryValue == LineContainer.GAMMA_UNKNOWN && secondaryValue != LineContainer.GAMMA_UNKNOWN;
  }
}
