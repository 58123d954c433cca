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
 * This exception is thrown when a molecule cannot contribute a ring: too few carbons remain after
 * the oxygen filter, or no cycle of an allowed size was found. It is a no-result outcome for one
 * molecule.
 *
 * @author Michael J. Schnieders
 */
public class InsufficientAtomsException extends Exception {

  /** The molecule number within its file. */
  public final int molecule;
  /** Either {@link ReasonTag#TOO_FEW_CARBONS} or {@link ReasonTag#NO_RINGS}. */
  public final ReasonTag reason;
  /** The number of carbons that survived the oxygen filter. */
  public final int nCarbons;

  public InsufficientAtomsException(int molecule, ReasonTag reason, int nCarbons) {
    super(format(" Molecule %d: %s (%d ring carbons)", molecule, reason.tag(), nCarbons));
    this.molecule = molecule;
    this.reason = reason;
    this.nCarbons = nCarbons;
  }
}
