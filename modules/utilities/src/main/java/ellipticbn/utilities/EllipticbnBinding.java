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

package ellipticbn.utilities;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The EllipticbnBinding holds the variables passed into (and exported by) an ElliptiCBn Command.
 * <p>
 * The "args" variable is read by {@link EllipticbnCommand#init()}. Commands may export their
 * results through the Binding so that a caller (or a unit test) can retrieve them by name.
 * <p>
 * The Binding API is not supposed to be used in a multithreaded context.
 *
 * @author Michael J. Schnieders
 */
public class EllipticbnBinding {

  private Map<String, Object> variables;

  public EllipticbnBinding() {
    this(new LinkedHashMap<>());
  }

  public EllipticbnBinding(Map<String, Object> variables) {
    this.variables = variables;
  }

  /**
   * A helper constructor used in main(String[]) method calls
   *
   * @param args are the command line arguments from a main()
   */
  public EllipticbnBinding(String[] args) {
    this();
    setVariable("args", args);
  }

  /**
   * @param name the name of the variable to lookup
   * @return the variable value, or null if the variable is not defined.
   */
  public Object getVariable(String name) {
    return variables.get(name);
  }

  /**
   * Sets the value of the given variable
   *
   * @param name the name of the variable to set
   * @param value the new value for the given variable
   */
  public void setVariable(String name, Object value) {
    variables.put(name, value);
  }

  /**
   * Remove the variable with the specified name.
   *
   * @param name the name of the variable to remove
   */
  public void removeVariable(String name) {
    variables.remove(name);
  }

  /**
   * Simple check for whether the binding contains a particular variable or not.
   *
   * @param name the name of the variable to check for
   * @return true if the variable is defined.
   */
  public boolean hasVariable(String name) {
    return variables.containsKey(name);
  }

  /**
   * Get the Map of all variables. This returns a reference and not a copy.
   *
   * @return a Map of the variables.
   */
  public Map<String, Object> getVariables() {
    return variables;
  }
}
