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

package com.linemerge.utils;

import com.linemerge.lines.LineContainer;
import com.linemerge.lines.RankField;
import com.linemerge.species.SpeciesTable;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Writes merged lines as raw tab separated columns, one line per row, with a header.  Values are written in the units
 * the line lists store them in.
 */
public class LineListTsvWriter implements AutoCloseable {
  public static final List<String> HEADER = Collections.unmodifiableList(Arrays.asList(
      "wavelength", "species", "species_name", "loggf", "e_lower", "e_upper", "j_lower", "j_upper",
      "lande_lower", "lande_upper", "gamma_rad", "gamma_stark", "gamma_vdw", "source_index", "forbid", "ranks"
  ));

  private static final CSVFormat TSV_FORMAT = CSVFormat.newFormat('\t').
      withRecordSeparator('\n').withQuote('"').withIgnoreEmptyLines(true);

  private final SpeciesTable speciesTable;
  private CSVPrinter printer;

  public LineListTsvWriter(SpeciesTable speciesTable) {
    this.speciesTable = speciesTable;
  }

  public void open(File f) throws IOException {
    FileChecker.verifyAndCreateOutputFile(f);
    open(new OutputStreamWriter(new FileOutputStream(f), StandardCharsets.UTF_8));
  }

  public void open(Writer writer) throws IOException {
    printer = new CSVPrinter(writer, TSV_FORMAT.withHeader(HEADER.toArray(new String[HEADER.size()])));
  }

  public void append(LineContainer lines) throws IOException {
    for (int i = 0; i < lines.size(); i++) {
      List<Object> vals = new ArrayList<>(HEADER.size());
      vals.add(lines.getWavelength(i));
      vals.add(lines.getSpeciesCode(i));
      vals.add(speciesTable.getSpeciesName(lines.getSpeciesCode(i)));
      vals.add(lines.getLoggf(i));
      vals.add(lines.getELower(i));
      vals.add(lines.getEUpper(i));
      vals.add(lines.getJLower(i));
      vals.add(lines.getJUpper(i));
      vals.add(lines.getLandeLower(i));
      vals.add(lines.getLandeUpper(i));
      vals.add(lines.getGammaRad(i));
      vals.add(lines.getGammaStark(i));
      vals.add(lines.getGammaVdw(i));
      vals.add(lines.getSourceIndex(i));
      vals.add((char) lines.getForbidFlag(i));
      vals.add(formatRanks(lines, i));
      printer.printRecord(vals);
    }
    printer.flush();
  }

  private static String formatRanks(LineContainer lines, int i) {
    StringBuilder sb = new StringBuilder();
    for (RankField field : RankField.values()) {
      if (sb.length() > 0) {
        sb.append(',');
      }
      sb.append(lines.getRank(i, field));
    }
    return sb.toString();
  }

  public void flush() throws IOException {
    printer.flush();
  }

  @Override
  public void close() throws IOException {
    if (printer != null) {
      printer.close();
      printer = null;
    }
  }
}
