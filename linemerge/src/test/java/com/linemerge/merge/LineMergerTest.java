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

import com.linemerge.config.LineListSource;
import com.linemerge.config.MergeClass;
import com.linemerge.lines.LineContainer;
import com.linemerge.lines.LineRecord;
import com.linemerge.lines.RankField;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class LineMergerTest {
  private static final double DELTA = 1e-6;
  private static final int CA_I = 191;
  private static final int FE_I = 326;
  private static final int FE_II = 327;
  private static final int TIO = 10001;

  private static final int[] HIGH_WL_RANKS = {5, 2, 3, 3, 4, 2, 2, 2, 3};
  private static final int[] LOW_WL_RANKS = {2, 5, 3, 3, 1, 4, 4, 4, 3};

  private LineMerger merger;

  @Before
  public void setup() {
    merger = new LineMerger(WavelengthWindow.DEFAULT_WINDOW_REF, WavelengthWindow.DEFAULT_WL_REF);
  }

  private static LineRecord line(double wl, int species, int sourceIndex, int[] ranks, MergeClass mergeClass) {
    LineRecord r = new LineRecord(wl, species);
    r.setSourceIndex(sourceIndex);
    r.setLoggf(-1.0f);
    r.setELower(1.0);
    r.setEUpper(3.0);
    r.setJLower(1.0f);
    r.setJUpper(2.0f);
    r.setLandeLower(1.0f);
    r.setLandeUpper(1.0f);
    r.setGammaRad(8.0f);
    r.setGammaStark(-6.0f);
    r.setGammaVdw(-7.0f);
    r.setRanks(ranks);
    r.setMergeable(mergeClass.isMergeable());
    r.setReplacement(mergeClass.isReplacement());
    return r;
  }

  private static LineRecord line(double wl, int species, int sourceIndex, int[] ranks) {
    return line(wl, species, sourceIndex, ranks, MergeClass.MERGEABLE);
  }

  private static LineContainer container(LineRecord... records) {
    return LineContainer.fromRecords(Arrays.asList(records));
  }

  private static LineListSource source(String path, MergeClass mergeClass, Double window) {
    return new LineListSource(path, path, 0, true, mergeClass, window, 0, Integer.MAX_VALUE,
        RankField.defaultRanks());
  }

  private static List<LineListSource> sources(int n) {
    List<LineListSource> sources = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      sources.add(source("/list" + i, MergeClass.MERGEABLE, null));
    }
    return sources;
  }

  @Test
  public void testNoContainersGivesEmptyResult() {
    LineContainer merged = merger.merge(Collections.emptyList(), sources(0));
    assertTrue(merged.isEmpty());
  }

  @Test
  public void testSingleContainerIsReturnedUnchanged() {
    LineContainer only = container(
        line(5001.0, CA_I, 0, HIGH_WL_RANKS),
        line(5000.0, CA_I, 0, HIGH_WL_RANKS, MergeClass.REPLACEMENT));

    LineContainer merged = merger.merge(Collections.singletonList(only), sources(1));

    assertSame("A lone container is not even sorted", only, merged);
  }

  @Test
  public void testDuplicateLinesMergeIntoBetterRankedWavelength() {
    // Arrange
    LineRecord a = line(5000.00, CA_I, 0, HIGH_WL_RANKS);
    LineRecord b = line(5000.02, CA_I, 1, LOW_WL_RANKS);
    b.setLoggf(-2.0f);
    b.setGammaVdw(-7.7f);

    // Act
    LineContainer merged = merger.merge(Arrays.asList(container(a), container(b)), sources(2));

    // Assert
    assertEquals("The pair collapses into one line", 1, merged.size());
    assertEquals("The better wavelength survives", 5000.00, merged.getWavelength(0), DELTA);
    assertEquals(0, merged.getSourceIndex(0));
    assertEquals("loggf comes from the better loggf source", -2.0f, merged.getLoggf(0), DELTA);
    assertEquals(-7.7f, merged.getGammaVdw(0), DELTA);
  }

  @Test
  public void testLaterLineWithBetterRankAbsorbsEarlierOne() {
    LineRecord a = line(5000.00, CA_I, 0, LOW_WL_RANKS);
    LineRecord b = line(5000.03, CA_I, 1, HIGH_WL_RANKS);

    LineContainer merged = merger.merge(Arrays.asList(container(a), container(b)), sources(2));

    assertEquals(1, merged.size());
    assertEquals(5000.03, merged.getWavelength(0), DELTA);
    assertEquals(1, merged.getSourceIndex(0));
    assertEquals("loggf rank 5 from the absorbed line wins", 5, merged.getRank(0, RankField.LOGGF));
  }

  @Test
  public void testWavelengthRankTieGoesToEarlierLine() {
    int[] ranks = RankField.defaultRanks();
    LineRecord a = line(5000.00, CA_I, 1, ranks);
    LineRecord b = line(5000.01, CA_I, 0, ranks);

    LineContainer merged = merger.merge(Arrays.asList(container(b), container(a)), sources(2));

    assertEquals(1, merged.size());
    assertEquals(5000.00, merged.getWavelength(0), DELTA);
  }

  @Test
  public void testMergeIsIndependentOfContainerOrder() {
    List<LineContainer> containers = Arrays.asList(
        container(line(5000.00, CA_I, 0, HIGH_WL_RANKS), line(5003.00, FE_II, 0, HIGH_WL_RANKS)),
        container(line(5000.02, CA_I, 1, LOW_WL_RANKS), line(5001.00, FE_I, 1, LOW_WL_RANKS)),
        container(line(5003.01, FE_II, 2, LOW_WL_RANKS)));
    List<LineContainer> reversed = new ArrayList<>(containers);
    Collections.reverse(reversed);

    LineContainer forward = merger.merge(containers, sources(3));
    LineContainer backward = merger.merge(reversed, sources(3));

    assertEquals(3, forward.size());
    assertEquals(forward.size(), backward.size());
    for (int i = 0; i < forward.size(); i++) {
      assertEquals(forward.getWavelength(i), backward.getWavelength(i), DELTA);
      assertEquals(forward.getSpeciesCode(i), backward.getSpeciesCode(i));
      assertEquals(forward.getLoggf(i), backward.getLoggf(i), DELTA);
    }
  }

  @Test
  public void testOutputIsSortedByWavelength() {
    LineContainer merged = merger.merge(Arrays.asList(
        container(line(5010.0, CA_I, 0, HIGH_WL_RANKS), line(4990.0, CA_I, 0, HIGH_WL_RANKS)),
        container(line(5000.0, FE_I, 1, HIGH_WL_RANKS), line(4995.0, FE_II, 1, HIGH_WL_RANKS))), sources(2));

    assertEquals(4, merged.size());
    for (int i = 1; i < merged.size(); i++) {
      assertTrue(merged.getWavelength(i - 1) <= merged.getWavelength(i));
    }
  }

  @Test
  public void testThreeSourcesCollapseMatchingLines() {
    // Arrange: three lists report the same Ca I line, two of them also report an Fe I line.
    List<LineContainer> containers = Arrays.asList(
        container(line(5000.000, CA_I, 0, HIGH_WL_RANKS), line(5100.000, FE_I, 0, HIGH_WL_RANKS)),
        container(line(5000.010, CA_I, 1, LOW_WL_RANKS), line(5100.020, FE_I, 1, LOW_WL_RANKS)),
        container(line(5000.020, CA_I, 2, LOW_WL_RANKS)));

    // Act
    LineContainer merged = merger.merge(containers, sources(3));

    // Assert
    assertEquals(2, merged.size());
    assertEquals(5000.000, merged.getWavelength(0), DELTA);
    assertEquals(CA_I, merged.getSpeciesCode(0));
    assertEquals(5100.000, merged.getWavelength(1), DELTA);
    assertEquals(FE_I, merged.getSpeciesCode(1));
  }

  @Test
  public void testUnmatchedReplacementLinesAreDropped() {
    // Arrange
    LineRecord base = line(5000.00, CA_I, 0, HIGH_WL_RANKS);
    LineRecord replacement = line(5000.01, CA_I, 1, new int[]{1, 9, 3, 3, 1, 1, 1, 1, 1}, MergeClass.REPLACEMENT);
    replacement.setLoggf(-0.25f);
    LineRecord orphan = line(5200.00, CA_I, 1, new int[]{1, 9, 3, 3, 1, 1, 1, 1, 1}, MergeClass.REPLACEMENT);
    List<LineListSource> sources = Arrays.asList(
        source("/base", MergeClass.MERGEABLE, null),
        source("/replacement", MergeClass.REPLACEMENT, null));

    // Act
    LineContainer merged = merger.merge(Arrays.asList(container(base), container(replacement, orphan)), sources);

    // Assert
    assertEquals("Only the base line survives", 1, merged.size());
    assertEquals(5000.00, merged.getWavelength(0), DELTA);
    assertEquals("The replacement's loggf was folded in", -0.25f, merged.getLoggf(0), DELTA);
  }

  @Test
  public void testStandaloneLinesNeverMerge() {
    LineRecord a = line(5000.00, CA_I, 0, HIGH_WL_RANKS);
    LineRecord b = line(5000.00, CA_I, 1, LOW_WL_RANKS, MergeClass.STANDALONE);

    LineContainer merged = merger.merge(Arrays.asList(container(a), container(b)), sources(2));

    assertEquals(2, merged.size());
  }

  @Test
  public void testLinesOfOneSourceNeverMerge() {
    LineContainer merged = merger.merge(Arrays.asList(
        container(line(5000.00, CA_I, 0, HIGH_WL_RANKS), line(5000.01, CA_I, 0, HIGH_WL_RANKS)),
        container(line(6000.00, CA_I, 1, HIGH_WL_RANKS))), sources(2));

    assertEquals(3, merged.size());
  }

  @Test
  public void testIncompatibleForbidFlagsBlockAtomicMerge() {
    LineRecord a = line(5000.00, CA_I, 0, HIGH_WL_RANKS);
    a.setForbidFlag('F');
    LineRecord b = line(5000.01, CA_I, 1, LOW_WL_RANKS);

    LineContainer merged = merger.merge(Arrays.asList(container(a), container(b)), sources(2));

    assertEquals(2, merged.size());
  }

  @Test
  public void testAutoionizingMatchesAllowedLine() {
    LineRecord a = line(5000.00, CA_I, 0, HIGH_WL_RANKS);
    a.setForbidFlag('A');
    LineRecord b = line(5000.01, CA_I, 1, LOW_WL_RANKS);

    LineContainer merged = merger.merge(Arrays.asList(container(a), container(b)), sources(2));

    assertEquals(1, merged.size());
  }

  @Test
  public void testMoleculesSkipForbidGate() {
    LineRecord a = line(5000.00, TIO, 0, HIGH_WL_RANKS);
    a.setForbidFlag('7');
    LineRecord b = line(5000.01, TIO, 1, LOW_WL_RANKS);
    b.setForbidFlag('2');

    LineContainer merged = merger.merge(Arrays.asList(container(a), container(b)), sources(2));

    assertEquals("Molecular flag bytes carry other data and are ignored", 1, merged.size());
  }

  @Test
  public void testConsumedLineStopsScanning() {
    // Arrange: b absorbs a, then c, which a would also have matched, must still be free to merge with b.
    LineRecord a = line(5000.00, CA_I, 0, LOW_WL_RANKS);
    LineRecord b = line(5000.01, CA_I, 1, HIGH_WL_RANKS);
    LineRecord c = line(5000.02, CA_I, 2, LOW_WL_RANKS);
    c.setLoggf(-3.0f);

    // Act
    LineContainer merged = merger.merge(Arrays.asList(container(a), container(b), container(c)), sources(3));

    // Assert
    assertEquals(1, merged.size());
    assertEquals(5000.01, merged.getWavelength(0), DELTA);
    assertEquals(1, merged.getSourceIndex(0));
    assertEquals("a's loggf arrived first and kept rank 5", -1.0f, merged.getLoggf(0), DELTA);
  }

  @Test
  public void testAbsorbedLineDoesNotGoOnToAbsorbLaterLines() {
    // Arrange: a matches both b and c, but b and c do not match each other.
    LineRecord a = line(5000.00, CA_I, 0, LOW_WL_RANKS);
    a.setEUpper(3.0);
    LineRecord b = line(5000.01, CA_I, 1, HIGH_WL_RANKS);
    b.setEUpper(3.0029);
    LineRecord c = line(5000.02, CA_I, 2, LOW_WL_RANKS);
    c.setEUpper(2.9971);

    // Act
    LineContainer merged = merger.merge(Arrays.asList(container(a), container(b), container(c)), sources(3));

    // Assert
    assertEquals("Once b absorbs a, a must not also absorb c", 2, merged.size());
    assertEquals(5000.01, merged.getWavelength(0), DELTA);
    assertEquals(1, merged.getSourceIndex(0));
    assertEquals(5000.02, merged.getWavelength(1), DELTA);
    assertEquals(2, merged.getSourceIndex(1));
  }

  @Test
  public void testThreeSingleLineSourcesWithBestWavelengthInTheMiddle() {
    // Arrange
    int[] sourceZeroRanks = {2, 3, 3, 3, 3, 6, 3, 3, 3};
    int[] sourceOneRanks = {7, 3, 3, 3, 3, 2, 3, 3, 3};
    int[] sourceTwoRanks = {2, 3, 3, 3, 3, 3, 3, 3, 3};
    LineRecord zero = line(5000.0, FE_I, 0, sourceZeroRanks);
    zero.setGammaRad(8.4f);
    LineRecord one = line(5000.005, FE_I, 1, sourceOneRanks);
    one.setGammaRad(7.9f);
    LineRecord two = line(5003.0, FE_I, 2, sourceTwoRanks);

    // Act
    LineContainer merged = merger.merge(Arrays.asList(container(zero), container(one), container(two)), sources(3));

    // Assert
    assertEquals(2, merged.size());
    assertEquals("The merged row sits at the best ranked wavelength", 5000.005, merged.getWavelength(0), DELTA);
    assertEquals(1, merged.getSourceIndex(0));
    assertEquals("Better ranked radiative damping carried in from source 0", 8.4f, merged.getGammaRad(0), DELTA);
    assertEquals(6, merged.getRank(0, RankField.GAMMA_RAD));
    assertEquals(5003.0, merged.getWavelength(1), DELTA);
    assertEquals(2, merged.getSourceIndex(1));
  }

  @Test
  public void testPerSourceWindowOverrideWidensMatch() {
    LineRecord a = line(5000.00, CA_I, 0, HIGH_WL_RANKS);
    LineRecord b = line(5000.20, CA_I, 1, LOW_WL_RANKS);
    List<LineContainer> containers = Arrays.asList(container(a), container(b));

    LineContainer narrow = merger.merge(containers, sources(2));
    LineContainer wide = merger.merge(containers, Arrays.asList(
        source("/a", MergeClass.MERGEABLE, null),
        source("/b", MergeClass.MERGEABLE, 0.5)));

    assertEquals("0.2 Å apart is outside the 0.05 Å default", 2, narrow.size());
    assertEquals("The wider of the two source windows applies", 1, wide.size());
  }

  @Test
  public void testSourceWindowFallsBackToReference() {
    List<LineListSource> sources = Arrays.asList(source("/a", MergeClass.MERGEABLE, 0.2));
    assertEquals(0.2, merger.sourceWindow(sources, 0), DELTA);
    assertEquals(WavelengthWindow.DEFAULT_WINDOW_REF, merger.sourceWindow(sources, 3), DELTA);
    assertEquals(WavelengthWindow.DEFAULT_WINDOW_REF, merger.sourceWindow(sources, -1), DELTA);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonPositiveWindowRejected() {
    new LineMerger(0.0, 5000.0);
  }
}
