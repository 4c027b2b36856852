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

package com.linemerge.lines;

/**
 * The nine per-line quality ranks, in the order they are stored on every row.  A higher rank means a more trustworthy
 * value for that parameter.
 */
public enum RankField {
  WAVELENGTH(0),
  LOGGF(1),
  E_LOWER(2),
  E_UPPER(3),
  LANDE(4),
  GAMMA_RAD(5),
  GAMMA_STARK(6),
  GAMMA_VDW(7),
  TERM(8),
  ;

  public static final int COUNT = 9;
  public static final int MIN_RANK = 0;
  public static final int MAX_RANK = Byte.MAX_VALUE;
  public static final int DEFAULT_RANK = 3;

  private final int offset;

  RankField(int offset) {
    this.offset = offset;
  }

  public int getOffset() {
    return offset;
  }

  /**
   * Checks a full rank vector.  A vector of the wrong length or with an out-of-range entry means something upstream of
   * the merge is broken, so this throws rather than clamping.
   */
  public static void validate(int[] ranks) {
    if (ranks == null || ranks.length != COUNT) {
      throw new IllegalStateException(String.format("Expected %d ranks, got %s",
          COUNT, ranks == null ? "null" : String.valueOf(ranks.length)));
    }
    for (int i = 0; i < ranks.length; i++) {
      if (ranks[i] < MIN_RANK || ranks[i] > MAX_RANK) {
        throw new IllegalStateException(String.format("Rank %d for %s is outside [%d, %d]",
            ranks[i], values()[i], MIN_RANK, MAX_RANK));
      }
    }
  }

  public static int[] defaultRanks() {
    int[] ranks = new int[COUNT];
    for (int i = 0; i < COUNT; i++) {
      ranks[i] = DEFAULT_RANK;
    }
    return ranks;
  }
}
