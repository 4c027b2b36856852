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

package com.linemerge.species;

/**
 * One entry of the species list: an atom, ion or molecule that a catalogued line belongs to.
 */
public class Species {
  private static final String[] ROMAN_NUMERALS = {"I", "II", "III", "IV", "V", "VI", "VII", "VIII", "IX", "X"};

  private final int index;
  private final String name;
  private final int charge;
  private final double mass;
  private final double ionizationEnergy;

  public Species(int index, String name, int charge, double mass, double ionizationEnergy) {
    if (charge < 0) {
      throw new IllegalArgumentException(String.format("Species %d (%s) has negative charge %d", index, name, charge));
    }
    this.index = index;
    this.name = name;
    this.charge = charge;
    this.mass = mass;
    this.ionizationEnergy = ionizationEnergy;
  }

  public int getIndex() {
    return index;
  }

  public String getName() {
    return name;
  }

  public int getCharge() {
    return charge;
  }

  public double getMass() {
    return mass;
  }

  public double getIonizationEnergy() {
    return ionizationEnergy;
  }

  /**
   * Spectroscopic notation: the ionization stage is the charge plus one, so "Fe I" is neutral iron.
   * @return The element name followed by its ionization stage in roman numerals.
   */
  public String getDisplayName() {
    String stage = charge < ROMAN_NUMERALS.length ? ROMAN_NUMERALS[charge] : String.valueOf(charge + 1);
    return name + " " + stage;
  }

  /**
   * A name-based guess: longer than two characters, or containing a digit.  Two-letter diatomics such as CN pass as
   * atoms; the merge goes by species code instead.
   */
  public boolean isMolecule() {
    if (name.length() > 2) {
      return true;
    }
    for (char c : name.toCharArray()) {
      if (Character.isDigit(c)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    Species species = (Species) o;

    if (index != species.index) return false;
    if (charge != species.charge) return false;
    return name != null ? name.equals(species.name) : species.name == null;
  }

  @Override
  public int hashCode() {
    int result = index;
    result = 31 * result + (name != null ? name.hashCode() : 0);
    result = 31 * result + charge;
    return result;
  }

  @Override
  public String toString() {
    return String.format("%s (%d)", getDisplayName(), index);
  }
}
