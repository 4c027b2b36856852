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

import com.linemerge.lines.LineContainer;

/**
 * Columnar output of one {@link LineListReader} query.  Every column holds exactly {@code count} values; the auxiliary
 * blob holds {@code count} fixed-stride records of per-line text (terms, references, flags).
 */
public class LineQueryResult {
  // Stride of the auxiliary record written by the line list decoder.
  public static final int AUX_STRIDE = 210;
  // Zero-based offset of the forbidden-transition flag inside each auxiliary record.
  public static final int FORBID_FLAG_OFFSET = 190;

  private final int count;
  private final double[] wavelength;
  private final int[] speciesCode;
  private final float[] loggf;
  private final double[] eLower;
  private final double[] eUpper;
  private final float[] jLower;
  private final float[] jUpper;
  private final float[] landeLower;
  private final float[] landeUpper;
  private final float[] gammaRad;
  private final float[] gammaStark;
  private final float[] gammaVdw;
  private final byte[] auxBytes;

  public LineQueryResult(int count, double[] wavelength, int[] speciesCode, float[] loggf,
                         double[] eLower, double[] eUpper, float[] jLower, float[] jUpper,
                         float[] landeLower, float[] landeUpper,
                         float[] gammaRad, float[] gammaStark, float[] gammaVdw,
                         byte[] auxBytes) {
    this.count = count;
    this.wavelength = wavelength;
    this.speciesCode = speciesCode;
    this.loggf = loggf;
    this.eLower = eLower;
    this.eUpper = eUpper;
    this.jLower = jLower;
    this.jUpper = jUpper;
    this.landeLower = landeLower;
    this.landeUpper = landeUpper;
    this.gammaRad = gammaRad;
    this.gammaStark = gammaStark;
    this.gammaVdw = gammaVdw;
    this.auxBytes = auxBytes;

    checkLength("wavelength", wavelength.length);
    checkLength("species_code", speciesCode.length);
    checkLength("loggf", loggf.length);
    checkLength("e_lower", eLower.length);
    checkLength("e_upper", eUpper.length);
    checkLength("j_lower", jLower.length);
    checkLength("j_upper", jUpper.length);
    checkLength("lande_lower", landeLower.length);
    checkLength("lande_upper", landeUpper.length);
    checkLength("gamma_rad", gammaRad.length);
    checkLength("gamma_stark", gammaStark.length);
    checkLength("gamma_vdw", gammaVdw.length);
  }

  public static LineQueryResult empty() {
    return new LineQueryResult(0, new double[0], new int[0], new float[0], new double[0], new double[0],
        new float[0], new float[0], new float[0], new float[0], new float[0], new float[0], new float[0], null);
  }

  private void checkLength(String column, int length) {
    if (length != count) {
      throw new IllegalStateException(
          String.format("Column %s has %d values but the result reports %d lines", column, length, count));
    }
  }

  public int getCount() {
    return count;
  }

  public double[] getWavelength() {
    return wavelength;
  }

  public int[] getSpeciesCode() {
    return speciesCode;
  }

  public float[] getLoggf() {
    return loggf;
  }

  public double[] getELower() {
    return eLower;
  }

  public double[] getEUpper() {
    return eUpper;
  }

  public float[] getJLower() {
    return jLower;
  }

  public float[] getJUpper() {
    return jUpper;
  }

  public float[] getLandeLower() {
    return landeLower;
  }

  public float[] getLandeUpper() {
    return landeUpper;
  }

  public float[] getGammaRad() {
    return gammaRad;
  }

  public float[] getGammaStark() {
    return gammaStark;
  }

  public float[] getGammaVdw() {
    return gammaVdw;
  }

  public byte[] getAuxBytes() {
    return auxBytes;
  }

  /**
   * @return The number of auxiliary bytes per line, or 0 when there is no usable auxiliary data.
   */
  public int getAuxStride() {
    if (count == 0 || auxBytes == null || auxBytes.length < count) {
      return 0;
    }
    return auxBytes.length / count;
  }

  /**
   * The forbidden-transition flag of line {@code i}, read from its auxiliary record.  Lines whose record is too short
   * to carry the flag are reported as allowed.
   */
  public byte getForbidFlag(int i) {
    int stride = getAuxStride();
    if (stride <= FORBID_FLAG_OFFSET) {
      return LineContainer.FORBID_ALLOWED;
    }
    return auxBytes[i * stride + FORBID_FLAG_OFFSET];
  }

  /**
   * @return A copy of line {@code i}'s auxiliary record, or null if the result carries none.
   */
  public byte[] getAuxRecord(int i) {
    int stride = getAuxStride();
    if (stride == 0) {
      return null;
    }
    byte[] record = new byte[stride];
    System.arraycopy(auxBytes, i * stride, record, 0, stride);
    return record;
  }
}
