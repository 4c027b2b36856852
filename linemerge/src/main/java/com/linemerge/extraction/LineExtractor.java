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

import com.linemerge.config.ExtractionConfig;
import com.linemerge.config.LineListSource;
import com.linemerge.lines.LineContainer;
import com.linemerge.merge.LineMerger;
import com.linemerge.reader.LineListReader;
import com.linemerge.reader.LineQueryResult;
import com.linemerge.species.SpeciesTable;
import com.linemerge.utils.FileChecker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Pulls the lines of every enabled source inside a wavelength range, restricts them to the requested species and
 * merges them into a single bounded result.
 */
public class LineExtractor {
  private static final Logger LOGGER = LogManager.getFormatterLogger(LineExtractor.class);

  public static final int DEFAULT_MAX_LINES = 500000;

  private final SpeciesTable speciesTable;
  private final LineListReader reader;
  private final ElementFilter elementFilter;

  public LineExtractor(SpeciesTable speciesTable, LineListReader reader) {
    this.speciesTable = speciesTable;
    this.reader = reader;
    this.elementFilter = new ElementFilter(speciesTable);
  }

  public SpeciesTable getSpeciesTable() {
    return speciesTable;
  }

  /**
   * @param config The sources to read and the merge's reference window.
   * @param wlMin Lower wavelength bound in Å, inclusive.
   * @param wlMax Upper wavelength bound in Å, inclusive.
   * @param elementFilter Comma separated element tokens, or null/blank for every species.
   * @param maxLines The most lines to return; also passed to each source query.
   * @return The merged lines in wavelength order, at most {@code maxLines} of them.
   * @throws IllegalArgumentException On an empty wavelength range, a negative line cap or an untokenizable filter.
   */
  public LineContainer extract(ExtractionConfig config, double wlMin, double wlMax, String elementFilter,
                               int maxLines) {
    if (!(wlMin < wlMax)) {
      throw new IllegalArgumentException(
          String.format("Minimum wavelength %f must be below maximum wavelength %f", wlMin, wlMax));
    }
    if (maxLines < 0) {
      throw new IllegalArgumentException(String.format("Line cap must not be negative, got %d", maxLines));
    }
    Set<Integer> speciesCodes = this.elementFilter.resolve(elementFilter);
    if (!speciesCodes.isEmpty()) {
      LOGGER.info("Restricting extraction to %d species", speciesCodes.size());
    }

    List<LineListSource> sources = config.getEnabledSourcesByPriority();
    LOGGER.info("Extracting [%.3f, %.3f] from %d enabled line lists", wlMin, wlMax, sources.size());

    List<LineContainer> containers = new ArrayList<>();
    for (int sourceIndex = 0; sourceIndex < sources.size(); sourceIndex++) {
      LineListSource source = sources.get(sourceIndex);

      if (!FileChecker.allFilesExist(reader.backingFiles(source))) {
        LOGGER.warn("Skipping line list %s: backing files are missing", source.getLabel());
        continue;
      }
      if (!speciesCodes.isEmpty() && !source.mayContainAnyOf(speciesCodes)) {
        LOGGER.debug("Skipping line list %s: species range [%d, %d] holds none of the requested species",
            source.getLabel(), source.getSpeciesMin(), source.getSpeciesMax());
        continue;
      }

      LineQueryResult result;
      try {
        result = reader.query(source, wlMin, wlMax, maxLines);
      } catch (IOException e) {
        LOGGER.warn("Skipping line list %s: read failed: %s", source.getLabel(), e.getMessage());
        continue;
      }

      LineContainer lines = LineContainer.fromQueryResult(result, sourceIndex, source.getRanks(),
          source.getMergeClass());
      if (!speciesCodes.isEmpty()) {
        lines = lines.filterBySpecies(speciesCodes);
      }
      LOGGER.info("Line list %s: %d lines read, %d kept", source.getLabel(), result.getCount(), lines.size());

      if (!lines.isEmpty()) {
        containers.add(lines);
      }
    }

    if (containers.isEmpty()) {
      LOGGER.info("No lines found in any line list");
      return LineContainer.empty();
    }

    LineMerger merger = new LineMerger(config.getWindowRef(), config.getWlRef());
    LineContainer merged = merger.merge(containers, sources);

    if (merged.size() > maxLines) {
      LOGGER.info("Truncating %d merged lines to %d", merged.size(), maxLines);
      merged = merged.head(maxLines);
    }
    return merged;
  }
}
