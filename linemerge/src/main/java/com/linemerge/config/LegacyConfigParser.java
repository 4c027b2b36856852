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

import com.linemerge.lines.RankField;
import com.linemerge.merge.WavelengthWindow;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the legacy plain-text configuration format:
 *
 * <pre>
 *   ; comment
 *   0.05,5000.,9,150.
 *   '/ATOMS/Fe_NBS', 1101, 326, 334, 0, 2,4,2,2,2,2,2,2,3, 'Fe: NBS data'
 *   ;'/ATOMS/Fe_K14', 1102, 326, 326, 0, 2,3,2,2,2,2,2,2,3, 'Fe: disabled', 0.03
 * </pre>
 *
 * The first non-comment line holds the reference window, reference wavelength, maximum ionization and maximum
 * excitation.  Each list entry holds its path, priority, species range, mergeability code, nine ranks, a quoted name and
 * an optional merge window.  An entry commented out with a leading ';' is kept as a disabled source.
 */
public class LegacyConfigParser {
  private static final Logger LOGGER = LogManager.getFormatterLogger(LegacyConfigParser.class);

  private static final char COMMENT_CHAR = ';';
  private static final char QUOTE_CHAR = '\'';

  private static final Pattern PATH_PATTERN = Pattern.compile("^'([^']+)'");
  private static final Pattern NAME_AND_WINDOW_PATTERN = Pattern.compile("'([^']+)'(?:\\s*,\\s*([\\d.]+))?$");
  private static final Pattern NUMBER_PATTERN = Pattern.compile("-?\\d+(?:\\.\\d+)?");

  // priority, species min, species max, mergeability code and nine ranks.
  private static final int MIN_NUMBERS_PER_ENTRY = 4 + RankField.COUNT;

  /* Legacy files list ranks as wl, gf, rad, stark, waals, lande, term, ext_vdw, zeeman.  Record order puts the level
   * energies in slots 2 and 3, which the legacy format has no ranks for. */
  private static final int LEGACY_WL = 0;
  private static final int LEGACY_GF = 1;
  private static final int LEGACY_RAD = 2;
  private static final int LEGACY_STARK = 3;
  private static final int LEGACY_WAALS = 4;
  private static final int LEGACY_LANDE = 5;
  private static final int LEGACY_TERM = 6;

  public ExtractionConfig parse(BufferedReader reader) throws IOException {
    ExtractionConfig config = null;
    List<LineListSource> sources = new ArrayList<>();

    String rawLine;
    int lineNumber = 0;
    while ((rawLine = reader.readLine()) != null) {
      lineNumber++;
      String line = rawLine.trim();

      if (line.isEmpty() || (line.charAt(0) == COMMENT_CHAR && line.indexOf(QUOTE_CHAR) < 0)) {
        continue;
      }

      if (config == null && line.charAt(0) != QUOTE_CHAR && line.charAt(0) != COMMENT_CHAR) {
        config = parseGlobalParameters(line);
        continue;
      }

      LineListSource source = parseEntry(line, lineNumber);
      if (source != null) {
        sources.add(source);
      }
    }

    if (config == null) {
      LOGGER.warn("No global parameter line found, using defaults");
      config = new ExtractionConfig();
    }
    config.setSources(sources);
    LOGGER.info("Parsed %d line list entries (%d enabled)", sources.size(), config.getEnabledSourcesByPriority().size());
    return config;
  }

  ExtractionConfig parseGlobalParameters(String line) {
    ExtractionConfig config = new ExtractionConfig();
    String[] parts = line.replace(" ", "").split(",");
    try {
      if (parts.length > 0 && !parts[0].isEmpty()) {
        config.setWindowRef(Double.parseDouble(parts[0]));
      }
      if (parts.length > 1) {
        config.setWlRef(Double.parseDouble(parts[1]));
      }
      if (parts.length > 2) {
        config.setMaxIonization(Integer.parseInt(parts[2]));
      }
      if (parts.length > 3) {
        config.setMaxExcitationEv(Double.parseDouble(parts[3]));
      }
    } catch (NumberFormatException e) {
      LOGGER.warn("Could not parse global parameters '%s' (%s), using defaults", line, e.getMessage());
      return new ExtractionConfig();
    }
    return config;
  }

  /**
   * @return The parsed source, or null if the line is not a usable list entry.
   */
  LineListSource parseEntry(String line, int lineNumber) {
    boolean enabled = true;
    if (line.charAt(0) == COMMENT_CHAR) {
      enabled = false;
      line = line.substring(1).trim();
    }

    Matcher pathMatcher = PATH_PATTERN.matcher(line);
    if (!pathMatcher.find()) {
      return null;
    }
    String path = pathMatcher.group(1);
    String rest = line.substring(pathMatcher.end()).trim();
    if (rest.startsWith(",")) {
      rest = rest.substring(1).trim();
    }

    String name;
    String windowText = null;
    Matcher nameMatcher = NAME_AND_WINDOW_PATTERN.matcher(rest);
    if (nameMatcher.find()) {
      name = nameMatcher.group(1);
      windowText = nameMatcher.group(2);
      rest = rest.substring(0, nameMatcher.start()).trim();
    } else {
      name = path.substring(path.lastIndexOf('/') + 1);
    }

    List<String> numbers = new ArrayList<>();
    Matcher numberMatcher = NUMBER_PATTERN.matcher(rest);
    while (numberMatcher.find()) {
      numbers.add(numberMatcher.group());
    }
    if (numbers.size() < MIN_NUMBERS_PER_ENTRY) {
      LOGGER.warn("Line %d: expected at least %d numbers, found %d: %s",
          lineNumber, MIN_NUMBERS_PER_ENTRY, numbers.size(), line);
      return null;
    }

    try {
      double window = windowText != null ? Double.parseDouble(windowText) : WavelengthWindow.DEFAULT_WINDOW_REF;
      int priority = Integer.parseInt(numbers.get(0));
      int speciesMin = Integer.parseInt(numbers.get(1));
      int speciesMax = Integer.parseInt(numbers.get(2));
      MergeClass mergeClass = MergeClass.fromCode(Integer.parseInt(numbers.get(3)));
      int[] legacyRanks = new int[RankField.COUNT];
      for (int i = 0; i < RankField.COUNT; i++) {
        legacyRanks[i] = Integer.parseInt(numbers.get(4 + i));
      }
      return new LineListSource(path, name, priority, enabled, mergeClass, window, speciesMin, speciesMax,
          toRecordOrder(legacyRanks));
    } catch (IllegalArgumentException e) {
      LOGGER.warn("Line %d: could not parse entry (%s): %s", lineNumber, e.getMessage(), line);
      return null;
    }
  }

  static int[] toRecordOrder(int[] legacyRanks) {
    int[] ranks = new int[RankField.COUNT];
    ranks[RankField.WAVELENGTH.getOffset()] = legacyRanks[LEGACY_WL];
    ranks[RankField.LOGGF.getOffset()] = legacyRanks[LEGACY_GF];
    ranks[RankField.E_LOWER.getOffset()] = RankField.DEFAULT_RANK;
    ranks[RankField.E_UPPER.getOffset()] = RankField.DEFAULT_RANK;
    ranks[RankField.LANDE.getOffset()] = legacyRanks[LEGACY_LANDE];
    ranks[RankField.GAMMA_RAD.getOffset()] = legacyRanks[LEGACY_RAD];
    ranks[RankField.GAMMA_STARK.getOffset()] = legacyRanks[LEGACY_STARK];
    ranks[RankField.GAMMA_VDW.getOffset()] = legacyRanks[LEGACY_WAALS];
    ranks[RankField.TERM.getOffset()] = legacyRanks[LEGACY_TERM];
    return ranks;
  }
}
