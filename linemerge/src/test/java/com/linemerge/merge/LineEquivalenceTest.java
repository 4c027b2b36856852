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

import com.linemerge.lines.LineContainer;
import org.junit.Test;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class LineEquivalenceTest {
  private static final int CA_I = 191;
  private static final int FE_I = LineEquivalence.FE_I_SPECIES_CODE;
  private static final double WINDOW = 0.05;

  @Test
  public void testMatchingLinesAreEquivalent() {
    assertTrue(LineEquivalence.equivalent(5000.00, CA_I, 1.0f, 2.0f, 3.0, 0,
        5000.02, CA_I, 1.0f, 2.0f, 3.001, 1, WINDOW));
  }

  @Test
  public void testDifferentSpeciesAreNotEquivalent() {
    assertFalse(LineEquivalence.equivalent(5000.00, CA_I, 1.0f, 2.0f, 3.0, 0,
        5000.00, CA_I + 1, 1.0f, 2.0f, 3.0, 1, WINDOW));
  }

  @Test
  public void testSameSourceIsNeverEquivalent() {
    assertFalse("Two lines of one source must never merge",
        LineEquivalence.equivalent(5000.00, CA_I, 1.0f, 2.0f, 3.0, 2,
            5000.00, CA_I, 1.0f, 2.0f, 3.0, 2, WINDOW));
  }

  @Test
  public void testWavelengthOutsideWindow() {
    assertFalse(LineEquivalence.equivalent(5000.00, CA_I, 1.0f, 2.0f, 3.0, 0,
        5000.06, CA_I, 1.0f, 2.0f, 3.0, 1, WINDOW));
  }

  @Test
  public void testJMismatchRejectedExceptForNeutralIron() {
    assertFalse("J mismatch should reject Ca I",
        LineEquivalence.equivalent(5000.00, CA_I, 1.0f, 2.0f, 3.0, 0,
            5000.01, CA_I, 2.0f, 2.0f, 3.0, 1, WINDOW));
    assertTrue("Fe I ignores J values",
        LineEquivalence.equivalent(5000.00, FE_I, 1.0f, 2.0f, 3.0, 0,
            5000.01, FE_I, 2.0f, 3.0f, 3.0, 1, WINDOW));
  }

  @Test
  public void testNeutralIronIgnoresJButCalciumDoesNot() {
    assertTrue(LineEquivalence.equivalent(5000.00, FE_I, 0.5f, 1.5f, 2.5, 0,
        5000.01, FE_I, 1.5f, 2.5f, 2.5, 1, WINDOW));
    assertFalse(LineEquivalence.equivalent(5000.00, CA_I, 0.5f, 1.5f, 2.5, 0,
        5000.01, CA_I, 1.5f, 2.5f, 2.5, 1, WINDOW));
  }

  @Test
  public void testLinesATenthApartNeverMatchInNarrowWindow() {
    assertFalse(LineEquivalence.equivalent(5000.00, FE_I, 1.0f, 2.0f, 3.0, 0,
        5000.10, FE_I, 1.0f, 2.0f, 3.0, 1, WINDOW));
  }

  @Test
  public void testUpperEnergyTolerance() {
    assertTrue("0.05% relative difference is within tolerance",
        LineEquivalence.equivalent(5000.00, FE_I, 1.0f, 2.0f, 4.0, 0,
            5000.01, FE_I, 1.0f, 2.0f, 4.002, 1, WINDOW));
    assertFalse("0.2% relative difference is outside tolerance",
        LineEquivalence.equivalent(5000.00, FE_I, 1.0f, 2.0f, 4.0, 0,
            5000.01, FE_I, 1.0f, 2.0f, 4.008, 1, WINDOW));
  }

  @Test
  public void testForbidCompatibility() {
    byte allowed = LineContainer.FORBID_ALLOWED;
    byte autoionizing = LineContainer.FORBID_AUTOIONIZING;
    byte other = (byte) 'F';

    assertTrue(LineEquivalence.forbidCompatible(allowed, allowed));
    assertTrue(LineEquivalence.forbidCompatible(other, other));
    assertTrue(LineEquivalence.forbidCompatible(autoionizing, allowed));
    assertTrue(LineEquivalence.forbidCompatible(allowed, autoionizing));
    assertFalse(LineEquivalence.forbidCompatible(allowed, other));
    assertFalse(LineEquivalence.forbidCompatible(autoionizing, other));
  }

  @Test
  public void testMoleculeThreshold() {
    assertTrue(LineEquivalence.isAtom(326));
    assertTrue(LineEquivalence.isAtom(9999));
    assertFalse(LineEquivalence.isAtom(10000));
    assertFalse(LineEquivalence.isAtom(10001));
  }
}
