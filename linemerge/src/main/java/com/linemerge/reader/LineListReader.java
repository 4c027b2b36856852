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

package com.linemerge.reader;

import com.linemerge.config.LineListSource;

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * Reads the lines of one configured line list that fall inside a wavelength range.
 */
public interface LineListReader {

  /**
   * @return Every file that must exist for {@link #query} to succeed on this source.
   */
  List<File> backingFiles(LineListSource source);

  /**
   * @param source The list to read.
   * @param wlMin Lower wavelength bound in Å, inclusive.
   * @param wlMax Upper wavelength bound in Å, inclusive.
   * @param maxLines The most lines to return.
   * @return The matching lines in the order the list stores them, at most {@code maxLines} of them.
   * @throws java.io.FileNotFoundException If a backing file is missing.
   * @throws IOException If the list cannot be read or decoded.
   * @throws IllegalArgumentException If {@code wlMin >= wlMax}.
   */
  LineQueryResult query(LineListSource source, double wlMin, double wlMax, int maxLines) throws IOException;
}
