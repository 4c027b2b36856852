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

package com.linemerge.config;

import java.util.HashMap;
import java.util.Map;

/**
 * How lines from a source take part in merging.  The numeric codes are the ones used by the legacy configuration
 * files.
 */
public enum MergeClass {
  // Lines may be merged with equivalent lines from other sources.
  MERGEABLE(0),
  // Lines are always emitted as they are and never take part in a merge.
  STANDALONE(1),
  // Lines only override parameters of an equivalent line elsewhere and are dropped if nothing matches.
  REPLACEMENT(2),
  ;

  private static final Map<Integer, MergeClass> CODE_MAP = new HashMap<Integer, MergeClass>() {{
    for (MergeClass mergeClass : MergeClass.values()) {
      put(mergeClass.getCode(), mergeClass);
    }
  }};

  private final int code;

  MergeClass(int code) {
    this.code = code;
  }

  public int getCode() {
    return code;
  }

  public boolean isMergeable() {
    return this != STANDALONE;
  }

  public boolean isReplacement() {
    return this == REPLACEMENT;
  }

  public static MergeClass fromCode(int code) {
    MergeClass mergeClass = CODE_MAP.get(code);
    if (mergeClass == null) {
      throw new IllegalArgumentException(String.format("Unknown mergeability code %d", code));
    }
    return mergeClass;
  }
}
