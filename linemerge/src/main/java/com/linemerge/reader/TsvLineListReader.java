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
import com.linemerge.lines.LineContainer;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Reads line lists stored as tab separated text, one line per row, at {@code <home>/<source path>.tsv}.
 *
 * Required columns are those in {@link #REQUIRED_HEADERS}; an optional {@code forbid} column holds the one-character
 * forbidden-transition flag, which is packed into the auxiliary bytes at {@link LineQueryResult#FORBID_FLAG_OFFSET}.
 */
public class TsvLineListReader implements LineListReader {
  private static final Logger LOGGER = LogManager.getFormatterLogger(TsvLineListReader.class);

  public static final String FILE_EXTENSION = ".tsv";

  public static final String HEADER_WAVELENGTH = "wavelength";
  public static final String HEADER_SPECIES = "species";
  public static final String HEADER_LOGGF = "loggf";
  public static final String HEADER_E_LOWER = "e_lower";
  public static final String HEADER_E_UPPER = "e_upper";
  public static final String HEADER_J_LOWER = "j_lower";
  public static final String HEADER_J_UPPER = "j_upper";
  public static final String HEADER_LANDE_LOWER = "lande_lower";
  public static final String HEADER_LANDE_UPPER = "lande_upper";
  public static final String HEADER_GAMMA_RAD = "gamma_rad";
  public static final String HEADER_GAMMA_STARK = "gamma_stark";
  public static final String HEADER_GAMMA_VDW = "gamma_vdw";
  public static final String HEADER_FORBID = "forbid";

  public static final List<String> REQUIRED_HEADERS = Collections.unmodifiableList(Arrays.asList(
      HEADER_WAVELENGTH, HEADER_SPECIES, HEADER_LOGGF, HEADER_E_LOWER, HEADER_E_UPPER, HEADER_J_LOWER, HEADER_J_UPPER,
      HEADER_LANDE_LOWER, HEADER_LANDE_UPPER, HEADER_GAMMA_RAD, HEADER_GAMMA_STARK, HEADER_GAMMA_VDW
  ));

  private static final CSVFormat TSV_FORMAT = CSVFormat.newFormat('\t').
      withRecordSeparator('\n').withQuote('"').withIgnoreEmptyLines(true).withCommentMarker('#').withHeader();

  private final File home;

  public TsvLineListReader(File home) {
    this.home = home;
  }

  public File getHome() {
    return home;
  }

  public File resolve(LineListSource source) {
    String relative = StringUtils.removeStart(source.getPath(), "/");
    return new File(home, relative + FILE_EXTENSION);
  }

  @Override
  public List<File> backingFiles(LineListSource source) {
    return Collections.singletonList(resolve(source));
  }

  @Override
  public LineQueryResult query(LineListSource source, double wlMin, double wlMax, int maxLines) throws IOException {
    if (!(wlMin < wlMax)) {
      throw new IllegalArgumentException(String.format("Wavelength range [%f, %f] is empty", wlMin, wlMax));
    }
    File file = resolve(source);
    if (!file.isFile()) {
      throw new FileNotFoundException(String.format("Line list file %s does not exist", file.getAbsolutePath()));
    }

    List<CSVRecord> matches = new ArrayList<>();
    boolean hasForbidColumn;
    try (Reader in = new InputStreamReader(new FileInputStream(file), StandardCharsets.UTF_8);
         CSVParser parser = new CSVParser(in, TSV_FORMAT)) {
      for (String header : REQUIRED_HEADERS) {
        if (!parser.getHeaderMap().containsKey(header)) {
          throw new IOException(String.format("Line list %s is missing column '%s'", file.getAbsolutePath(), header));
        }
      }
      hasForbidColumn = parser.getHeaderMap().containsKey(HEADER_FORBID);

      for (CSVRecord record : parser) {
        if (matches.size() >= maxLines) {
          break;
        }
        double wl = parseDouble(record, HEADER_WAVELENGTH, file);
        if (wl >= wlMin && wl <= wlMax) {
          matches.add(record);
        }
      }
    } catch (UncheckedIOException | IllegalArgumentException | IllegalStateException e) {
      // commons-csv reports malformed structure (bad quoting, duplicate headers) through unchecked exceptions.
      throw new IOException(String.format("Line list %s is malformed: %s", file.getAbsolutePath(), e.getMessage()), e);
    }

    LineQueryResult result = buildResult(matches, hasForbidColumn, file);
    LOGGER.debug("Read %d lines in [%.3f, %.3f] from %s", result.getCount(), wlMin, wlMax, file.getAbsolutePath());
    return result;
  }

  private LineQueryResult buildResult(List<CSVRecord> records, boolean hasForbidColumn, File file) throws IOException {
    int n = records.size();
    if (n == 0) {
      return LineQueryResult.empty();
    }

    double[] wavelength = new double[n];
    int[] species = new int[n];
    float[] loggf = new float[n];
    double[] eLower = new double[n];
    double[] eUpper = new double[n];
    float[] jLower = new float[n];
    float[] jUpper = new float[n];
    float[] landeLower = new float[n];
    float[] landeUpper = new float[n];
    float[] gammaRad = new float[n];
    float[] gammaStark = new float[n];
    float[] gammaVdw = new float[n];
    byte[] aux = new byte[n * LineQueryResult.AUX_STRIDE];
    Arrays.fill(aux, LineContainer.FORBID_ALLOWED);

    for (int i = 0; i < n; i++) {
      CSVRecord r = records.get(i);
      wavelength[i] = parseDouble(r, HEADER_WAVELENGTH, file);
      species[i] = parseInt(r, HEADER_SPECIES, file);
      loggf[i] = (float) parseDouble(r, HEADER_LOGGF, file);
      eLower[i] = parseDouble(r, HEADER_E_LOWER, file);
      eUpper[i] = parseDouble(r, HEADER_E_UPPER, file);
      jLower[i] = (float) parseDouble(r, HEADER_J_LOWER, file);
      jUpper[i] = (float) parseDouble(r, HEADER_J_UPPER, file);
      landeLower[i] = (float) parseDouble(r, HEADER_LANDE_LOWER, file);
      landeUpper[i] = (float) parseDouble(r, HEADER_LANDE_UPPER, file);
      gammaRad[i] = (float) parseDouble(r, HEADER_GAMMA_RAD, file);
      gammaStark[i] = (float) parseDouble(r, HEADER_GAMMA_STARK, file);
      gammaVdw[i] = (float) parseDouble(r, HEADER_GAMMA_VDW, file);

      if (hasForbidColumn && r.isSet(HEADER_FORBID)) {
        String flag = r.get(HEADER_FORBID);
        if (!flag.isEmpty()) {
          aux[i * LineQueryResult.AUX_STRIDE + LineQueryResult.FORBID_FLAG_OFFSET] = (byte) flag.charAt(0);
        }
      }
    }

    return new LineQueryResult(n, wavelength, species, loggf, eLower, eUpper, jLower, jUpper,
        landeLower, landeUpper, gammaRad, gammaStark, gammaVdw, aux);
  }

  private static int parseInt(CSVRecord record, String column, File file) throws IOException {
    String value = record.isSet(column) ? record.get(column).trim() : "";
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IOException(String.format("Bad value '%s' for column %s on record %d of %s",
          value, column, record.getRecordNumber(), file.getAbsolutePath()), e);
    }
  }

  private static double parseDouble(CSVRecord record, String column, File file) throws IOException {
    String value = record.isSet(column) ? record.get(column).trim() : "";
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException e) {
      throw new IOException(String.format("Bad value '%s' for column %s on record %d of %s",
          value, column, record.getRecordNumber(), file.getAbsolutePath()), e);
    }
  }
}
