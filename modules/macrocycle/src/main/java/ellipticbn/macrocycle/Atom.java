// ******************************************************************************
//
// Title:       ElliptiCBn.
// Description: ElliptiCBn - Ellipticity of Cucurbituril Macrocycles.
// Copyright:   Copyright (c) Michael J. Schnieders 2001-2026.
//
// This file is part of ElliptiCBn.
//
// ElliptiCBn is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// ElliptiCBn is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// ElliptiCBn; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
// ******************************************************************************

package ellipticbn.macrocycle;

import static java.lang.String.format;

/**
 * One atom of an input geometry.
 *
 * @param index The 0-based position of the atom in its source file.
 * @param element The element label as read (e.g. "C", "O", "N").
 * @param x The x coordinate (Angstroms).
 * @param y The y coordinate (Angstroms).
 * @param z The z coordinate (Angstroms).
 * @author Michael J. Schnieders
 */
public record Atom(int index, String element, double x, double y, double z) {

  /**
   * @return a new array holding {x, y, z}.
   */
  public double[] getXYZ() {
    return new double[] {x, y, z};
  }

  /**
   * Case-insensitive element comparison.
   *
   * @param symbol An element symbol.
   * @return true if this atom has the element.
   */
  public boolean isElement(String symbol) {
    return element.equalsIgnoreCase(symbol);
  }

  public boolean isCarbon() {
    return isElement("C");
  }

  public boolean isOxygen() {
    return isElement("O");
  }

  @Override
  public String toString() {
    return format("%d-%s (%10.5f, %10.5f, %10.5f)", index, element, x, y, z);
  }
}
