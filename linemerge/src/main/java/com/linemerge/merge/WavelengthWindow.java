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

/**
 * Wavelength tolerance for deciding whether two catalogued lines can be the same transition.  The tolerance grows
 * linearly with wavelength from a reference point, within two decades either side of the reference window.
 */
public class WavelengthWindow {
  public static final double DEFAULT_WINDOW_REF = 0.05;
  public static final double DEFAULT_WL_REF = 5000.0;

  static final double MIN_SCALE = 0.01;
  static final double MAX_SCALE = 100.0;

  private WavelengthWindow() {}

  /**
   * @param wl The wavelength at which the window is needed, in Å.
   * @param windowRef The window at the reference wavelength, in Å.
   * @param wlRef The reference wavelength, in Å.
   * @return {@code windowRef * wl / wlRef}, clamped to {@code [0.01 * windowRef, 100 * windowRef]}.
   */
  public static double compute(double wl, double windowRef, double wlRef) {
    double min = windowRef * MIN_SCALE;
    double max = windowRef * MAX_SCALE;
    return Math.min(Math.max(windowRef * wl / wlRef, min), max);
  }
}
