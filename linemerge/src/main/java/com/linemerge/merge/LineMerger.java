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

import com.linemerge.config.LineListSource;
import com.linemerge.lines.LineContainer;
import com.linemerge.lines.RankField;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Merges the lines read from several sources into one deduplicated, wavelength-sorted container.
 *
 * All lines are pooled and sorted by wavelength, then swept once from short to long wavelengths.  For every line still
 * in play we scan forward through the lines inside its tolerance window; a match collapses the pair into whichever has
 * the better wavelength rank, which absorbs the other's better-ranked parameters.  Lines that were absorbed, and lines
 * from replacement lists that never found a partner, are left out of the result.
 */
public class LineMerger {
  private static final Logger LOGGER = LogManager.getFormatterLogger(LineMerger.class);

  private final double windowRef;
  private final double wlRef;

  public LineMerger(double windowRef, double wlRef) {
    if (!(windowRef > 0.0) || !(wlRef > 0.0)) {
      throw new IllegalArgumentException(
          String.format("Reference window (%f) and reference wavelength (%f) must be positive", windowRef, wlRef));
    }
    this.windowRef = windowRef;
    this.wlRef = wlRef;
  }

  public double getWindowRef() {
    return windowRef;
  }

  public double getWlRef() {
    return wlRef;
  }

  /**
   * @param containers Per-source containers.  Each line's source index must point into {@code sources}.
   * @param sources The enabled sources, indexed by source index; used for their merge window overrides.
   * @return The merged container.  An empty list gives an empty container and a single container is returned as is.
   */
  public LineContainer merge(List<LineContainer> containers, List<LineListSource> sources) {
    if (containers.isEmpty()) {
      return LineContainer.empty();
    }
    if (containers.size() == 1) {
      return containers.get(0);
    }

    // The sorted copy is ours alone; the sweep below writes merged parameters straight into it.
    LineContainer lines = LineContainer.concatenate(containers).sortedByWavelength();
    int n = lines.size();
    boolean[] consumed = new boolean[n];
    int merges = 0;

    for (int i = 0; i < n; i++) {
      if (consumed[i] || !lines.isMergeable(i)) {
        continue;
      }

      double wlI = lines.getWavelength(i);
      int speciesI = lines.getSpeciesCode(i);
      double sourceWindowI = sourceWindow(sources, lines.getSourceIndex(i));

      for (int k = i + 1; k < n; k++) {
        double combinedWindow = Math.max(sourceWindowI, sourceWindow(sources, lines.getSourceIndex(k)));
        double window = WavelengthWindow.compute(wlI, combinedWindow, wlRef);

        // Sorted order: nothing past this point can be close enough.
        if (lines.getWavelength(k) - wlI > window) {
          break;
        }

        if (consumed[k] || !lines.isMergeable(k)) {
          continue;
        }

        if (LineEquivalence.isAtom(speciesI) &&
            !LineEquivalence.forbidCompatible(lines.getForbidFlag(i), lines.getForbidFlag(k))) {
          continue;
        }

        if (!LineEquivalence.equivalent(lines, i, k, window)) {
          continue;
        }

        merges++;
        // Ties go to the earlier line.
        if (lines.getRank(i, RankField.WAVELENGTH) >= lines.getRank(k, RankField.WAVELENGTH)) {
          FieldResolver.mergeInto(lines, i, k);
          consumed[k] = true;
        } else {
          FieldResolver.mergeInto(lines, k, i);
          consumed[i] = true;
          // i is consumed, so stop scanning for it.
          break;
        }
      }
    }

    boolean[] keep = new boolean[n];
    int droppedReplacements = 0;
    for (int i = 0; i < n; i++) {
      keep[i] = !consumed[i] && !lines.isReplacement(i);
      if (!consumed[i] && lines.isReplacement(i)) {
        droppedReplacements++;
      }
    }

    LineContainer merged = lines.select(keep);
    LOGGER.info("Merged %d lines from %d sources into %d lines (%d merges, %d unmatched replacement lines dropped)",
        n, containers.size(), merged.size(), merges, droppedReplacements);
    return merged;
  }

  /**
   * The configured window for a source: its own override when it has one, otherwise the reference window.
   */
  double sourceWindow(List<LineListSource> sources, int sourceIndex) {
    if (sourceIndex < 0 || sourceIndex >= sources.size()) {
      return windowRef;
    }
    Double override = sources.get(sourceIndex).getMergeWindow();
    return override != null ? override : windowRef;
  }
}
