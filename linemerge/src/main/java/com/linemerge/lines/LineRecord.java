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

import java.util.Arrays;

/**
 * A single row of a {@link LineContainer}, detached from the container's columns.  Handy for building small containers
 * and for handing rows to output code; the merge itself never goes through this class.
 */
public class LineRecord {
  private double wavelength;
  private int speciesCode;
  private float loggf;
  private double eLower;
  private double eUpper;
  private float jLower;
  private float jUpper;
  private float landeLower = LineContainer.LANDE_UNKNOWN;
  private float landeUpper = LineContainer.LANDE_UNKNOWN;
  private float gammaRad = LineContainer.GAMMA_UNKNOWN;
  private float gammaStark = LineContainer.GAMMA_UNKNOWN;
  private float gammaVdw = LineContainer.GAMMA_UNKNOWN;
  private int sourceIndex;
  private int[] ranks = RankField.defaultRanks();
  private boolean mergeable = true;
  private boolean replacement = false;
  private byte forbidFlag = LineContainer.FORBID_ALLOWED;
  private byte[] auxBytes;

  public LineRecord() {}

  public LineRecord(double wavelength, int speciesCode) {
    this.wavelength = wavelength;
    this.speciesCode = speciesCode;
  }

  public double getWavelength() {
    return wavelength;
  }

  public void setWavelength(double wavelength) {
    this.wavelength = wavelength;
  }

  public int getSpeciesCode() {
    return speciesCode;
  }

  public void setSpeciesCode(int speciesCode) {
    this.speciesCode = speciesCode;
  }

  public float getLoggf() {
    return loggf;
  }

  public void setLoggf(float loggf) {
    this.loggf = loggf;
  }

  public double getELower() {
    return eLower;
  }

  public void setELower(double eLower) {
    this.eLower = eLower;
  }

  public double getEUpper() {
    return eUpper;
  }

  public void setEUpper(double eUpper) {
    this.eUpper = eUpper;
  }

  public float getJLower() {
    return jLower;
  }

  public void setJLower(float jLower) {
    this.jLower = jLower;
  }

  public float getJUpper() {
    return jUpper;
  }

  public void setJUpper(float jUpper) {
    this.jUpper = jUpper;
  }

  public float getLandeLower() {
    return landeLower;
  }

  public void setLandeLower(float landeLower) {
    this.landeLower = landeLower;
  }

  public float getLandeUpper() {
    return landeUpper;
  }

  public void setLandeUpper(float landeUpper) {
    this.landeUpper = landeUpper;
  }

  public float getGammaRad() {
    return gammaRad;
  }

  public void setGammaRad(float gammaRad) {
    this.gammaRad = gammaRad;
  }

  public float getGammaStark() {
    return gammaStark;
  }

  public void setGammaStark(float gammaStark) {
    this.gammaStark = gammaStark;
  }

  public float getGammaVdw() {
    return gammaVdw;
  }

  public void setGammaVdw(float gammaVdw) {
    this.gammaVdw = gammaVdw;
  }

  public int getSourceIndex() {
    return sourceIndex;
  }

  public void setSourceIndex(int sourceIndex) {
    this.sourceIndex = sourceIndex;
  }

  public int[] getRanks() {
    return Arrays.copyOf(ranks, ranks.length);
  }

  public int getRank(RankField field) {
    return ranks[field.getOffset()];
  }

  public void setRanks(int[] ranks) {
    RankField.validate(ranks);
    this.ranks = Arrays.copyOf(ranks, ranks.length);
  }

  public void setRank(RankField field, int rank) {
    int[] updated = Arrays.copyOf(ranks, ranks.length);
    updated[field.getOffset()] = rank;
    setRanks(updated);
  }

  public boolean isMergeable() {
    return mergeable;
  }

  public void setMergeable(boolean mergeable) {
    this.mergeable = mergeable;
  }

  public boolean isReplacement() {
    return replacement;
  }

  public void setReplacement(boolean replacement) {
    this.replacement = replacement;
  }

  public byte getForbidFlag() {
    return forbidFlag;
  }

  public void setForbidFlag(byte forbidFlag) {
    this.forbidFlag = forbidFlag;
  }

  public void setForbidFlag(char forbidFlag) {
    this.forbidFlag = (byte) forbidFlag;
  }

  public byte[] getAuxBytes() {
    return auxBytes;
  }

  public void setAuxBytes(byte[] auxBytes) {
    this.auxBytes = auxBytes;
  }

  @Override
  public String toString() {
    return String.format("LineRecord{wl=%.4f, species=%d, loggf=%.3f, source=%d}",
        wavelength, speciesCode, loggf, sourceIndex);
  }
}
