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

package com.linemerge.extraction;

import com.linemerge.species.Species;
import com.linemerge.species.SpeciesTable;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns a user supplied element filter such as {@code "Fe 1, Ca 2, TiO"} into the species codes it names.
 *
 * Each comma separated token is an element or molecule name, optionally followed by an ionization stage.  Stage N
 * selects charge N-1; a token without a stage, or with a stage that is not a whole number, selects every charge.
 */
public class ElementFilter {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ElementFilter.class);

  private static final Pattern ALLOWED_CHARACTERS = Pattern.compile("[A-Za-z0-9\\s,]*");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final SpeciesTable speciesTable;

  public ElementFilter(SpeciesTable speciesTable) {
    this.speciesTable = speciesTable;
  }

  /**
   * @param filter The filter text; null or blank means no restriction.
   * @return The species codes selected by the filter, in token order.  Empty when the filter is blank or when none of
   *         its tokens names a known species.
   * @throws IllegalArgumentException If the filter contains characters that cannot appear in any token.
   */
  public Set<Integer> resolve(String filter) {
    if (StringUtils.isBlank(filter)) {
      return Collections.emptySet();
    }
    if (!ALLOWED_CHARACTERS.matcher(filter).matches()) {
      throw new IllegalArgumentException(String.format("Element filter '%s' contains invalid characters", filter));
    }

    Set<Integer> codes = new LinkedHashSet<>();
    for (String token : StringUtils.split(filter, ',')) {
      String trimmed = token.trim();
      if (trimmed.isEmpty()) {
        continue;
      }

      String[] parts = WHITESPACE.split(trimmed);
      String name = parts[0];
      Integer charge = null;
      if (parts.length > 1) {
        charge = parseCharge(parts[1]);
      }

      int before = codes.size();
      for (Species species : speciesTable.findByName(name, charge)) {
        codes.add(species.getIndex());
      }
      if (codes.size() == before) {
        LOGGER.warn("Element filter token '%s' matches no known species", trimmed);
      }
    }
    return codes;
  }

  private static Integer parseCharge(String stage) {
    try {
      return Integer.parseInt(stage) - 1;
    } catch (NumberFormatException e) {
      LOGGER.debug("Ionization stage '%s' is not a number, matching all stages", stage);
      return null;
    }
  }
}
