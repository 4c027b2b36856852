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
import com.linemerge.merge.WavelengthWindow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The set of line lists to extract from, together with the merge's reference window.
 */
public class ExtractionConfig {
  public static final int DEFAULT_MAX_IONIZATION = 9;
  public static final double DEFAULT_MAX_EXCITATION_EV = 150.0;

  @JsonProperty("wl_window_ref")
  private double windowRef = WavelengthWindow.DEFAULT_WINDOW_REF;

  @JsonProperty("wl_ref")
  private double wlRef = WavelengthWindow.DEFAULT_WL_REF;

  // Carried through for output formatting; the merge does not apply these.
  @JsonProperty("max_ionization")
  private int maxIonization = DEFAULT_MAX_IONIZATION;

  @JsonProperty("max_excitation_ev")
  private double maxExcitationEv = DEFAULT_MAX_EXCITATION_EV;

  @JsonProperty("line_lists")
  private List<LineListSource> sources = new ArrayList<>();

  public ExtractionConfig() {}

  public ExtractionConfig(double windowRef, double wlRef, List<LineListSource> sources) {
    this.windowRef = windowRef;
    this.wlRef = wlRef;
    this.sources = new ArrayList<>(sources);
  }

  public double getWindowRef() {
    return windowRef;
  }

  public void setWindowRef(double windowRef) {
    this.windowRef = windowRef;
  }

  public double getWlRef() {
    return wlRef;
  }

  public void setWlRef(double wlRef) {
    this.wlRef = wlRef;
  }

  public int getMaxIonization() {
    return maxIonization;
  }

  public void setMaxIonization(int maxIonization) {
    this.maxIonization = maxIonization;
  }

  public double getMaxExcitationEv() {
    return maxExcitationEv;
  }

  public void setMaxExcitationEv(double maxExcitationEv) {
    this.maxExcitationEv = maxExcitationEv;
  }

  public List<LineListSource> getSources() {
    return Collections.unmodifiableList(sources);
  }

  public void setSources(List<LineListSource> sources) {
    this.sources = new ArrayList<>(sources);
  }

  /**
   * Enabled sources in ascending priority; sources with equal priority keep their configured order.  A source's
   * position in this list is the source index stamped on its lines.
   */
  @JsonIgnore
  public List<LineListSource> getEnabledSourcesByPriority() {
    return sources.stream()
        .filter(LineListSource::isEnabled)
        .sorted(Comparator.comparingInt(LineListSource::getPriority))
        .collect(Collectors.toList());
  }

  public void validate() {
    if (!(windowRef > 0.0)) {
      throw new IllegalArgumentException(String.format("Reference window must be positive, got %f", windowRef));
    }
    if (!(wlRef > 0.0)) {
      throw new IllegalArgumentException(String.format("Reference wavelength must be positive, got %f", wlRef));
    }
    if (sources == null) {
      throw new IllegalArgumentException("Configuration has no line list section");
    }
    for (LineListSource source : sources) {
      source.validate();
    }
  }
}
