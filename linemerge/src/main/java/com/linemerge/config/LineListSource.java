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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.linemerge.lines.RankField;
import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.Collection;

/**
 * One configured line list: where it lives, how it takes part in merging, and how much each of its parameters is
 * trusted.
 */
public class LineListSource {

  // Relative path of the list, e.g. /ATOMS/Fe_NBS; readers resolve it against their own root.
  @JsonProperty("path")
  private String path;

  @JsonProperty("name")
  private String name;

  // Only decides the order in which sources are read.
  @JsonProperty("priority")
  private int priority;

  @JsonProperty("enabled")
  private boolean enabled = true;

  @JsonProperty("merge_class")
  private MergeClass mergeClass = MergeClass.MERGEABLE;

  // Merge window in Å at the reference wavelength; null means "use the configuration's reference window".
  @JsonProperty("merge_window")
  private Double mergeWindow;

  // Inclusive range of species codes the list can contain.
  @JsonProperty("species_min")
  private int speciesMin = 0;

  @JsonProperty("species_max")
  private int speciesMax = Integer.MAX_VALUE;

  // Nine ranks in RankField order.
  @JsonProperty("ranks")
  private int[] ranks = RankField.defaultRanks();

  public LineListSource() {}

  public LineListSource(String path, String name, int priority, boolean enabled, MergeClass mergeClass,
                        Double mergeWindow, int speciesMin, int speciesMax, int[] ranks) {
    this.path = path;
    this.name = name;
    this.priority = priority;
    this.enabled = enabled;
    this.mergeClass = mergeClass;
    this.mergeWindow = mergeWindow;
    this.speciesMin = speciesMin;
    this.speciesMax = speciesMax;
    this.ranks = Arrays.copyOf(ranks, ranks.length);
  }

  public String getPath() {
    return path;
  }

  public void setPath(String path) {
    this.path = path;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public int getPriority() {
    return priority;
  }

  public void setPriority(int priority) {
    this.priority = priority;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public MergeClass getMergeClass() {
    return mergeClass;
  }

  public void setMergeClass(MergeClass mergeClass) {
    this.mergeClass = mergeClass;
  }

  public Double getMergeWindow() {
    return mergeWindow;
  }

  public void setMergeWindow(Double mergeWindow) {
    this.mergeWindow = mergeWindow;
  }

  public int getSpeciesMin() {
    return speciesMin;
  }

  public void setSpeciesMin(int speciesMin) {
    this.speciesMin = speciesMin;
  }

  public int getSpeciesMax() {
    return speciesMax;
  }

  public void setSpeciesMax(int speciesMax) {
    this.speciesMax = speciesMax;
  }

  public int[] getRanks() {
    return Arrays.copyOf(ranks, ranks.length);
  }

  public void setRanks(int[] ranks) {
    this.ranks = Arrays.copyOf(ranks, ranks.length);
  }

  /**
   * @return True if any of the given species codes falls inside this list's declared species range.
   */
  @JsonIgnore
  public boolean mayContainAnyOf(Collection<Integer> speciesCodes) {
    for (Integer code : speciesCodes) {
      if (speciesMin <= code && code <= speciesMax) {
        return true;
      }
    }
    return false;
  }

  @JsonIgnore
  public String getLabel() {
    return StringUtils.isNotBlank(name) ? name : path;
  }

  /**
   * Rejects values no extraction could make sense of.
   * @throws IllegalArgumentException naming the offending field.
   */
  public void validate() {
    if (StringUtils.isBlank(path)) {
      throw new IllegalArgumentException("Line list source has no path");
    }
    if (mergeClass == null) {
      throw new IllegalArgumentException(String.format("Line list %s has no merge class", path));
    }
    if (mergeWindow != null && !(mergeWindow > 0.0)) {
      throw new IllegalArgumentException(String.format("Line list %s has non-positive merge window %f",
          path, mergeWindow));
    }
    if (speciesMin > speciesMax) {
      throw new IllegalArgumentException(String.format("Line list %s has species range [%d, %d]",
          path, speciesMin, speciesMax));
    }
    if (ranks == null || ranks.length != RankField.COUNT) {
      throw new IllegalArgumentException(String.format("Line list %s must have exactly %d ranks", path, RankField.COUNT));
    }
    for (int rank : ranks) {
      if (rank < RankField.MIN_RANK || rank > RankField.MAX_RANK) {
        throw new IllegalArgumentException(String.format("Line list %s has rank %d outside [%d, %d]",
            path, rank, RankField.MIN_RANK, RankField.MAX_RANK));
      }
    }
  }

  @Override
  public String toString() {
    return String.format("LineListSource{path=%s, priority=%d, enabled=%s, mergeClass=%s}",
        path, priority, enabled, mergeClass);
  }
}
