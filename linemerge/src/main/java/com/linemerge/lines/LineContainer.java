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

package com.linemerge.lines;

import com.linemerge.config.MergeClass;
import com.linemerge.reader.LineQueryResult;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Columnar set of spectral lines, as read from one source or produced by a merge.
 *
 * Each physical parameter lives in its own primitive array so that containers holding several hundred thousand lines
 * stay compact; row {@code i} is the i-th entry of every column.  Alongside the catalogued values each row carries its
 * provenance: the index of the source it came from, nine quality ranks (see {@link RankField}), whether it may be
 * merged, whether it comes from a replacement list, and its forbidden-transition flag.
 *
 * Filtering, selection and concatenation always build new containers.  The only in-place writes are the rank-resolved
 * field setters, which the merge engine applies to its own sorted working copy.
 */
public class LineContainer {
  // Sentinel for an unknown Landé factor.
  public static final float LANDE_UNKNOWN = 99.0f;
  // Sentinel for an unknown damping constant.
  public static final float GAMMA_UNKNOWN = 0.0f;

  public static final byte FORBID_ALLOWED = (byte) ' ';
  public static final byte FORBID_AUTOIONIZING = (byte) 'A';

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
  private final int[] sourceIndex;
  // Flattened [count][RankField.COUNT].
  private final byte[] ranks;
  private final boolean[] mergeable;
  private final boolean[] replacement;
  private final byte[] forbidFlag;
  private final byte[][] auxBytes;

  private LineContainer(int count) {
    this.count = count;
    this.wavelength = new double[count];
    this.speciesCode = new int[count];
    this.loggf = new float[count];
    this.eLower = new double[count];
    this.eUpper = new double[count];
    this.jLower = new float[count];
    this.jUpper = new float[count];
    this.landeLower = new float[count];
    this.landeUpper = new float[count];
    this.gammaRad = new float[count];
    this.gammaStark = new float[count];
    this.gammaVdw = new float[count];
    this.sourceIndex = new int[count];
    this.ranks = new byte[count * RankField.COUNT];
    this.mergeable = new boolean[count];
    this.replacement = new boolean[count];
    this.forbidFlag = new byte[count];
    this.auxBytes = new byte[count][];
  }

  public static LineContainer empty() {
    return new LineContainer(0);
  }

  /**
   * Wraps one reader query, tagging every line with the provenance of the source it was read from.
   * @param result The reader's columns.
   * @param sourceIndex The position of the source among the enabled sources of the configuration.
   * @param sourceRanks The source's nine ranks, in {@link RankField} order.
   * @param mergeClass The source's mergeability class.
   * @return A new container; empty if the result has no lines.
   */
  public static LineContainer fromQueryResult(LineQueryResult result, int sourceIndex, int[] sourceRanks,
                                              MergeClass mergeClass) {
    RankField.validate(sourceRanks);
    int n = result.getCount();
    if (n == 0) {
      return empty();
    }

    LineContainer c = new LineContainer(n);
    System.arraycopy(result.getWavelength(), 0, c.wavelength, 0, n);
    System.arraycopy(result.getSpeciesCode(), 0, c.speciesCode, 0, n);
    System.arraycopy(result.getLoggf(), 0, c.loggf, 0, n);
    System.arraycopy(result.getELower(), 0, c.eLower, 0, n);
    System.arraycopy(result.getEUpper(), 0, c.eUpper, 0, n);
    System.arraycopy(result.getJLower(), 0, c.jLower, 0, n);
    System.arraycopy(result.getJUpper(), 0, c.jUpper, 0, n);
    System.arraycopy(result.getLandeLower(), 0, c.landeLower, 0, n);
    System.arraycopy(result.getLandeUpper(), 0, c.landeUpper, 0, n);
    System.arraycopy(result.getGammaRad(), 0, c.gammaRad, 0, n);
    System.arraycopy(result.getGammaStark(), 0, c.gammaStark, 0, n);
    System.arraycopy(result.getGammaVdw(), 0, c.gammaVdw, 0, n);

    for (int i = 0; i < n; i++) {
      c.sourceIndex[i] = sourceIndex;
      for (int r = 0; r < RankField.COUNT; r++) {
        c.ranks[i * RankField.COUNT + r] = (byte) sourceRanks[r];
      }
      c.mergeable[i] = mergeClass.isMergeable();
      c.replacement[i] = mergeClass.isReplacement();
      c.forbidFlag[i] = result.getForbidFlag(i);
      c.auxBytes[i] = result.getAuxRecord(i);
    }
    return c;
  }

  public static LineContainer fromRecords(List<LineRecord> records) {
    LineContainer c = new LineContainer(records.size());
    for (int i = 0; i < records.size(); i++) {
      LineRecord r = records.get(i);
      c.wavelength[i] = r.getWavelength();
      c.speciesCode[i] = r.getSpeciesCode();
      c.loggf[i] = r.getLoggf();
      c.eLower[i] = r.getELower();
      c.eUpper[i] = r.getEUpper();
      c.jLower[i] = r.getJLower();
      c.jUpper[i] = r.getJUpper();
      c.landeLower[i] = r.getLandeLower();
      c.landeUpper[i] = r.getLandeUpper();
      c.gammaRad[i] = r.getGammaRad();
      c.gammaStark[i] = r.getGammaStark();
      c.gammaVdw[i] = r.getGammaVdw();
      c.sourceIndex[i] = r.getSourceIndex();
      int[] rowRanks = r.getRanks();
      RankField.validate(rowRanks);
      for (int k = 0; k < RankField.COUNT; k++) {
        c.ranks[i * RankField.COUNT + k] = (byte) rowRanks[k];
      }
      c.mergeable[i] = r.isMergeable();
      c.replacement[i] = r.isReplacement();
      c.forbidFlag[i] = r.getForbidFlag();
      c.auxBytes[i] = r.getAuxBytes();
    }
    return c;
  }

  /**
   * Appends the rows of several containers, in list order.
   */
  public static LineContainer concatenate(List<LineContainer> containers) {
    int total = 0;
    for (LineContainer c : containers) {
      total += c.size();
    }

    LineContainer out = new LineContainer(total);
    int offset = 0;
    for (LineContainer c : containers) {
      c.checkColumns();
      int n = c.size();
      System.arraycopy(c.wavelength, 0, out.wavelength, offset, n);
      System.arraycopy(c.speciesCode, 0, out.speciesCode, offset, n);
      System.arraycopy(c.loggf, 0, out.loggf, offset, n);
      System.arraycopy(c.eLower, 0, out.eLower, offset, n);
      System.arraycopy(c.eUpper, 0, out.eUpper, offset, n);
      System.arraycopy(c.jLower, 0, out.jLower, offset, n);
      System.arraycopy(c.jUpper, 0, out.jUpper, offset, n);
      System.arraycopy(c.landeLower, 0, out.landeLower, offset, n);
      System.arraycopy(c.landeUpper, 0, out.landeUpper, offset, n);
      System.arraycopy(c.gammaRad, 0, out.gammaRad, offset, n);
      System.arraycopy(c.gammaStark, 0, out.gammaStark, offset, n);
      System.arraycopy(c.gammaVdw, 0, out.gammaVdw, offset, n);
      System.arraycopy(c.sourceIndex, 0, out.sourceIndex, offset, n);
      System.arraycopy(c.ranks, 0, out.ranks, offset * RankField.COUNT, n * RankField.COUNT);
      System.arraycopy(c.mergeable, 0, out.mergeable, offset, n);
      System.arraycopy(c.replacement, 0, out.replacement, offset, n);
      System.arraycopy(c.forbidFlag, 0, out.forbidFlag, offset, n);
      System.arraycopy(c.auxBytes, 0, out.auxBytes, offset, n);
      offset += n;
    }
    return out;
  }

  /**
   * Builds a new container from the given rows of this one, in the order given.
   */
  public LineContainer select(int[] rows) {
    LineContainer out = new LineContainer(rows.length);
    for (int j = 0; j < rows.length; j++) {
      int i = rows[j];
      out.wavelength[j] = wavelength[i];
      out.speciesCode[j] = speciesCode[i];
      out.loggf[j] = loggf[i];
      out.eLower[j] = eLower[i];
      out.eUpper[j] = eUpper[i];
      out.jLower[j] = jLower[i];
      out.jUpper[j] = jUpper[i];
      out.landeLower[j] = landeLower[i];
      out.landeUpper[j] = landeUpper[i];
      out.gammaRad[j] = gammaRad[i];
      out.gammaStark[j] = gammaStark[i];
      out.gammaVdw[j] = gammaVdw[i];
      out.sourceIndex[j] = sourceIndex[i];
      System.arraycopy(ranks, i * RankField.COUNT, out.ranks, j * RankField.COUNT, RankField.COUNT);
      out.mergeable[j] = mergeable[i];
      out.replacement[j] = replacement[i];
      out.forbidFlag[j] = forbidFlag[i];
      out.auxBytes[j] = auxBytes[i];
    }
    return out;
  }

  /**
   * Selects the rows whose mask entry is true, keeping their current order.
   */
  public LineContainer select(boolean[] mask) {
    if (mask.length != count) {
      throw new IllegalStateException(String.format("Mask of length %d applied to %d lines", mask.length, count));
    }
    int kept = 0;
    for (boolean b : mask) {
      if (b) {
        kept++;
      }
    }
    int[] rows = new int[kept];
    int j = 0;
    for (int i = 0; i < count; i++) {
      if (mask[i]) {
        rows[j++] = i;
      }
    }
    return select(rows);
  }

  /**
   * Keeps only lines whose species code is in the given set.  A null or empty set means no restriction, in which case
   * this container itself is returned.
   */
  public LineContainer filterBySpecies(Set<Integer> speciesCodes) {
    if (speciesCodes == null || speciesCodes.isEmpty()) {
      return this;
    }
    boolean[] mask = new boolean[count];
    for (int i = 0; i < count; i++) {
      mask[i] = speciesCodes.contains(speciesCode[i]);
    }
    return select(mask);
  }

  /**
   * Keeps only lines with {@code wlMin <= wavelength <= wlMax}.
   */
  public LineContainer filterByWavelength(double wlMin, double wlMax) {
    boolean[] mask = new boolean[count];
    for (int i = 0; i < count; i++) {
      mask[i] = wavelength[i] >= wlMin && wavelength[i] <= wlMax;
    }
    return select(mask);
  }

  /**
   * @return The first {@code n} lines in current order, or this container if it holds no more than that.
   */
  public LineContainer head(int n) {
    if (n >= count) {
      return this;
    }
    int[] rows = new int[Math.max(n, 0)];
    for (int i = 0; i < rows.length; i++) {
      rows[i] = i;
    }
    return select(rows);
  }

  /**
   * @return A copy sorted by ascending wavelength.  The sort is stable: lines with equal wavelengths keep their
   * relative order.
   */
  public LineContainer sortedByWavelength() {
    Integer[] order = new Integer[count];
    for (int i = 0; i < count; i++) {
      order[i] = i;
    }
    // Object sorts are stable merge sorts, which primitive sorts are not.
    Arrays.sort(order, Comparator.comparingDouble(i -> wavelength[i]));
    int[] rows = new int[count];
    for (int i = 0; i < count; i++) {
      rows[i] = order[i];
    }
    return select(rows);
  }

  void checkColumns() {
    int[] lengths = {
        wavelength.length, speciesCode.length, loggf.length, eLower.length, eUpper.length,
        jLower.length, jUpper.length, landeLower.length, landeUpper.length,
        gammaRad.length, gammaStark.length, gammaVdw.length, sourceIndex.length,
        mergeable.length, replacement.length, forbidFlag.length, auxBytes.length,
    };
    for (int length : lengths) {
      if (length != count) {
        throw new IllegalStateException(String.format("Column of length %d in a container of %d lines", length, count));
      }
    }
    if (ranks.length != count * RankField.COUNT) {
      throw new IllegalStateException(String.format("Rank block of length %d in a container of %d lines",
          ranks.length, count));
    }
  }

  public int size() {
    return count;
  }

  public boolean isEmpty() {
    return count == 0;
  }

  public double getWavelength(int i) {
    return wavelength[i];
  }

  public int getSpeciesCode(int i) {
    return speciesCode[i];
  }

  public float getLoggf(int i) {
    return loggf[i];
  }

  public double getELower(int i) {
    return eLower[i];
  }

  public double getEUpper(int i) {
    return eUpper[i];
  }

  public float getJLower(int i) {
    return jLower[i];
  }

  public float getJUpper(int i) {
    return jUpper[i];
  }

  public float getLandeLower(int i) {
    return landeLower[i];
  }

  public float getLandeUpper(int i) {
    return landeUpper[i];
  }

  public float getGammaRad(int i) {
    return gammaRad[i];
  }

  public float getGammaStark(int i) {
    return gammaStark[i];
  }

  public float getGammaVdw(int i) {
    return gammaVdw[i];
  }

  public int getSourceIndex(int i) {
    return sourceIndex[i];
  }

  public int getRank(int i, RankField field) {
    return ranks[i * RankField.COUNT + field.getOffset()];
  }

  public boolean isMergeable(int i) {
    return mergeable[i];
  }

  public boolean isReplacement(int i) {
    return replacement[i];
  }

  public byte getForbidFlag(int i) {
    return forbidFlag[i];
  }

  public byte[] getAuxBytes(int i) {
    return auxBytes[i];
  }

  public LineRecord getRecord(int i) {
    LineRecord r = new LineRecord(wavelength[i], speciesCode[i]);
    r.setLoggf(loggf[i]);
    r.setELower(eLower[i]);
    r.setEUpper(eUpper[i]);
    r.setJLower(jLower[i]);
    r.setJUpper(jUpper[i]);
    r.setLandeLower(landeLower[i]);
    r.setLandeUpper(landeUpper[i]);
    r.setGammaRad(gammaRad[i]);
    r.setGammaStark(gammaStark[i]);
    r.setGammaVdw(gammaVdw[i]);
    r.setSourceIndex(sourceIndex[i]);
    r.setRanks(getRanks(i));
    r.setMergeable(mergeable[i]);
    r.setReplacement(replacement[i]);
    r.setForbidFlag(forbidFlag[i]);
    r.setAuxBytes(auxBytes[i]);
    return r;
  }

  public int[] getRanks(int i) {
    int[] rowRanks = new int[RankField.COUNT];
    for (int r = 0; r < RankField.COUNT; r++) {
      rowRanks[r] = ranks[i * RankField.COUNT + r];
    }
    return rowRanks;
  }

  /* Rank-resolved setters.  Each writes a value together with the rank that justified it, so a row's rank always
   * describes the value it currently holds. */

  public void setLoggf(int i, float value, int rank) {
    loggf[i] = value;
    setRank(i, RankField.LOGGF, rank);
  }

  public void setELower(int i, double value, int rank) {
    eLower[i] = value;
    setRank(i, RankField.E_LOWER, rank);
  }

  public void setEUpper(int i, double value, int rank) {
    eUpper[i] = value;
    setRank(i, RankField.E_UPPER, rank);
  }

  public void setLande(int i, float lower, float upper, int rank) {
    landeLower[i] = lower;
    landeUpper[i] = upper;
    setRank(i, RankField.LANDE, rank);
  }

  public void setGammaRad(int i, float value, int rank) {
    gammaRad[i] = value;
    setRank(i, RankField.GAMMA_RAD, rank);
  }

  public void setGammaStark(int i, float value, int rank) {
    gammaStark[i] = value;
    setRank(i, RankField.GAMMA_STARK, rank);
  }

  public void setGammaVdw(int i, float value, int rank) {
    gammaVdw[i] = value;
    setRank(i, RankField.GAMMA_VDW, rank);
  }

  private void setRank(int i, RankField field, int rank) {
    if (rank < RankField.MIN_RANK || rank > RankField.MAX_RANK) {
      throw new IllegalStateException(String.format("Rank %d for %s is outside [%d, %d]",
          rank, field, RankField.MIN_RANK, RankField.MAX_RANK));
    }
    ranks[i * RankField.COUNT + field.getOffset()] = (byte) rank;
  }
}
