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

package com.linemerge.species;

import com.linemerge.utils.FileChecker;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Read-only lookup from numeric species codes to {@link Species}.  Built once from the species list CSV and handed
 * to whatever needs it; nothing in here is cached statically.
 */
public class SpeciesTable {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpeciesTable.class);

  public static final String HEADER_INDEX = "Index";
  public static final String HEADER_NAME = "Name";
  public static final String HEADER_CHARGE = "Charge";
  public static final String HEADER_MASS = "Mass";
  public static final String HEADER_IONIZATION_ENERGY = "Ion. en.";

  private static final List<String> REQUIRED_HEADERS = Arrays.asList(
      HEADER_INDEX, HEADER_NAME, HEADER_CHARGE, HEADER_MASS, HEADER_IONIZATION_ENERGY);

  private static final CSVFormat SPECIES_FORMAT = CSVFormat.DEFAULT.
      withHeader().withIgnoreSurroundingSpaces(true).withIgnoreEmptyLines(true);

  // The list ships with a one-line version stamp ahead of the header.
  private static final char VERSION_LINE_MARKER = '#';

  private final Map<Integer, Species> speciesByIndex;

  public SpeciesTable(List<Species> species) {
    Map<Integer, Species> byIndex = new TreeMap<>();
    for (Species s : species) {
      byIndex.put(s.getIndex(), s);
    }
    this.speciesByIndex = Collections.unmodifiableMap(byIndex);
  }

  public static SpeciesTable load(File speciesFile) throws IOException {
    FileChecker.verifyInputFile(speciesFile);
    LOGGER.info("Loading species list from %s", speciesFile.getAbsolutePath());
    try (InputStream is = new FileInputStream(speciesFile)) {
      return load(is);
    }
  }

  public static SpeciesTable load(InputStream inStream) throws IOException {
    BufferedReader reader = new BufferedReader(new InputStreamReader(inStream, StandardCharsets.UTF_8));
    skipVersionLine(reader);

    List<Species> species = new ArrayList<>();
    int skipped = 0;
    try (CSVParser parser = new CSVParser(reader, SPECIES_FORMAT)) {
      Map<String, Integer> headerMap = parser.getHeaderMap();
      for (String header : REQUIRED_HEADERS) {
        if (!headerMap.containsKey(header)) {
          throw new IOException(String.format("Species list is missing required column '%s'", header));
        }
      }

      for (CSVRecord record : parser) {
        try {
          species.add(new Species(
              Integer.parseInt(record.get(HEADER_INDEX)),
              record.get(HEADER_NAME),
              Integer.parseInt(record.get(HEADER_CHARGE)),
              Double.parseDouble(record.get(HEADER_MASS)),
              Double.parseDouble(record.get(HEADER_IONIZATION_ENERGY))
          ));
        } catch (IllegalArgumentException e) {
          // Covers unparseable numbers and short rows alike.
          LOGGER.debug("Skipping malformed species row %d: %s", record.getRecordNumber(), e.getMessage());
          skipped++;
        }
      }
    }

    LOGGER.info("Loaded %d species (%d malformed rows skipped)", species.size(), skipped);
    return new SpeciesTable(species);
  }

  private static void skipVersionLine(BufferedReader reader) throws IOException {
    reader.mark(4096);
    String firstLine = reader.readLine();
    if (firstLine == null || firstLine.isEmpty() || firstLine.charAt(0) != VERSION_LINE_MARKER) {
      reader.reset();
    }
  }

  public Optional<Species> getSpecies(int index) {
    return Optional.ofNullable(speciesByIndex.get(index));
  }

  public String getSpeciesName(int index) {
    Species species = speciesByIndex.get(index);
    return species != null ? species.getDisplayName() : String.format("Unknown(%d)", index);
  }

  /**
   * Reverse lookup by element or molecule name.
   * @param name The name to match, compared case-insensitively.
   * @param charge The charge to match, or null to match every ionization stage.
   * @return All matching species in index order; empty if nothing matches.
   */
  public List<Species> findByName(String name, Integer charge) {
    List<Species> results = new ArrayList<>();
    for (Species species : speciesByIndex.values()) {
      if (species.getName().equalsIgnoreCase(name) && (charge == null || species.getCharge() == charge)) {
        results.add(species);
      }
    }
    return results;
  }

  public Map<Integer, Species> getAllSpecies() {
    return speciesByIndex;
  }

  public int size() {
    return speciesByIndex.size();
  }
}
