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
import com.linemerge.config.MergeClass;
import com.linemerge.lines.LineContainer;
import com.linemerge.lines.RankField;
import org.junit.Before;
import org.junit.Test;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;

import static org.junit.Assert.assertEquals;

public class TsvLineListReaderTest {
  private static final double DELTA = 1e-6;

  private TsvLineListReader reader;

  private static LineListSource source(String path) {
    return new LineListSource(path, path, 0, true, MergeClass.MERGEABLE, null, 0, Integer.MAX_VALUE,
        RankField.defaultRanks());
  }

  @Before
  public void setup() throws Exception {
    reader = new TsvLineListReader(new File(TsvLineListReaderTest.class.getResource("/linelists").toURI()));
  }

  @Test
  public void testBackingFileResolution() {
    File f = reader.backingFiles(source("/ATOMS/Fe_A")).get(0);
    assertEquals("Fe_A.tsv", f.getName());
    assertEquals(new File(reader.getHome(), "ATOMS"), f.getParentFile());
  }

  @Test
  public void testQueryIsInclusiveAndKeepsFileOrder() throws Exception {
    // Act
    LineQueryResult result = reader.query(source("/ATOMS/Fe_A"), 5000.0, 5010.0, 100);

    // Assert
    assertEquals(3, result.getCount());
    assertEquals(5000.0, result.getWavelength()[0], DELTA);
    assertEquals(5010.0, result.getWavelength()[2], DELTA);
    assertEquals(326, result.getSpeciesCode()[0]);
    assertEquals(191, result.getSpeciesCode()[2]);
    assertEquals(-1.5f, result.getLoggf()[0], DELTA);
    assertEquals(3.479, result.getEUpper()[0], DELTA);
    assertEquals(3.0f, result.getJUpper()[0], DELTA);
    assertEquals(99.0f, result.getLandeLower()[1], DELTA);
    assertEquals(-7.5f, result.getGammaVdw()[1], DELTA);
    assertEquals(LineQueryResult.AUX_STRIDE, result.getAuxStride());
  }

  @Test
  public void testQueryHonoursLineCap() throws Exception {
    LineQueryResult result = reader.query(source("/ATOMS/Fe_A"), 4000.0, 7000.0, 2);

    assertEquals(2, result.getCount());
    assertEquals(5001.0, result.getWavelength()[1], DELTA);
  }

  @Test
  public void testQueryOutsideRangeIsEmpty() throws Exception {
    assertEquals(0, reader.query(source("/ATOMS/Fe_A"), 7000.0, 8000.0, 100).getCount());
  }

  @Test
  public void testForbidColumnIsPackedIntoAuxRecord() throws Exception {
    LineQueryResult result = reader.query(source("/ATOMS/forbid"), 4000.0, 6000.0, 100);

    assertEquals(2, result.getCount());
    assertEquals(LineContainer.FORBID_AUTOIONIZING, result.getForbidFlag(0));
    assertEquals(LineContainer.FORBID_ALLOWED, result.getForbidFlag(1));
  }

  @Test
  public void testListWithoutForbidColumnReadsAllowed() throws Exception {
    LineQueryResult result = reader.query(source("/ATOMS/Ca_R"), 4000.0, 6000.0, 100);

    assertEquals(2, result.getCount());
    assertEquals(LineContainer.FORBID_ALLOWED, result.getForbidFlag(1));
  }

  @Test(expected = FileNotFoundException.class)
  public void testMissingFile() throws Exception {
    reader.query(source("/ATOMS/missing"), 4000.0, 6000.0, 100);
  }

  @Test(expected = IOException.class)
  public void testCorruptValue() throws Exception {
    reader.query(source("/ATOMS/corrupt"), 4000.0, 6000.0, 100);
  }

  @Test(expected = IOException.class)
  public void testUnterminatedQuoteIsReportedAsIOException() throws Exception {
    reader.query(source("/ATOMS/unterminated"), 4000.0, 6000.0, 100);
  }

  @Test(expected = IOException.class)
  public void testFractionalSpeciesCodeIsRejected() throws Exception {
    reader.query(source("/ATOMS/fractional_species"), 4000.0, 6000.0, 100);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyRange() throws Exception {
    reader.query(source("/ATOMS/Fe_A"), 5000.0, 5000.0, 100);
  }
}
