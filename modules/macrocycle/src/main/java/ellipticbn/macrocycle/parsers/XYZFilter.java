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

package ellipticbn.macrocycle.parsers;

import static java.lang.String.format;

import ellipticbn.macrocycle.Atom;
import ellipticbn.macrocycle.InvalidInputException;
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Reads the standard XYZ coordinate format.
 * <p>
 * Line 1 holds the atom count, line 2 a comment, followed by one "Element x y z" line per atom.
 * Extra columns are ignored. If the file holds more than one frame only the first is read.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class XYZFilter {

  private static final Logger logger = Logger.getLogger(XYZFilter.class.getName());

  private XYZFilter() {
  }

  /**
   * Read the first frame of an XYZ file.
   *
   * @param file The file.
   * @return the atoms, indexed from 0 in file order.
   * @throws IOException If the file cannot be read.
   * @throws InvalidInputException If the file is not a valid XYZ file.
   */
  public static List<Atom> readFile(File file) throws IOException, InvalidInputException {
    try (BufferedReader br = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
      return read(br, file.getName());
    }
  }

  /**
   * Read the first frame of XYZ data.
   *
   * @param br The reader.
   * @param source Name of the source used in messages.
   * @return the atoms, indexed from 0 in file order.
   * @throws IOException If the reader fails.
   * @throws InvalidInputException If the data is not valid XYZ.
   */
  public static List<Atom> read(BufferedReader br, String source)
      throws IOException, InvalidInputException {
    String line = br.readLine();
    if (line == null || line.isBlank()) {
      throw new InvalidInputException(format(" %s is empty.", source));
    }
    int nAtoms;
    try {
      nAtoms = Integer.parseInt(line.trim().split("\\s+")[0]);
    } catch (NumberFormatException e) {
      throw new InvalidInputException(format(" %s: the atom count could not be parsed from \"%s\".",
          source, line.trim()), e);
    }
    if (nAtoms <= 0) {
      throw new InvalidInputException(format(" %s declares %d atoms.", source, nAtoms));
    }

    // Comment line.
    if (br.readLine() == null) {
      throw new InvalidInputException(format(" %s ends before its comment line.", source));
    }

    List<Atom> atoms = new ArrayList<>(nAtoms);
    int lineNumber = 2;
    while (atoms.size() < nAtoms) {
      line = br.readLine();
      lineNumber++;
      if (line == null) {
        throw new InvalidInputException(format(" %s declares %d atoms but only %d were found.",
            source, nAtoms, atoms.size()));
      }
      String[] tokens = line.trim().split("\\s+");
      if (tokens.length < 4) {
        throw new InvalidInputException(format(" %s line %d: expected \"Element x y z\" but found \"%s\".",
            source, lineNumber, line.trim()));
      }
      try {
        double x = Double.parseDouble(tokens[1]);
        double y = Double.parseDouble(tokens[2]);
        double z = Double.parseDouble(tokens[3]);
        if (!Double.isFinite(x) || !Double.isFinite(y) || !Double.isFinite(z)) {
          throw new NumberFormatException("non-finite coordinate");
        }
        atoms.add(new Atom(atoms.size(), tokens[0], x, y, z));
      } catch (NumberFormatException e) {
        throw new InvalidInputException(format(" %s line %d: coordinates could not be parsed from \"%s\".",
            source, lineNumber, line.trim()), e);
      }
    }

    // Anything other than blank lines after the first frame is ignored.
    while ((line = br.readLine()) != null) {
      if (!line.isBlank()) {
        logger.warning(format(" %s holds more than %d atoms; only the first frame was read.",
            source, nAtoms));
        break;
      }
    }
    return atoms;
  }
}
