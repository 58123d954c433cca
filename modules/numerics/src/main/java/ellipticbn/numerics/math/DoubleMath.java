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

package ellipticbn.numerics.math;

import static org.apache.commons.math3.util.FastMath.sqrt;

/**
 * The DoubleMath class is a simple math library that operates on 3-coordinate double arrays.
 *
 * <p>All methods are static and thread-safe.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class DoubleMath {

  private DoubleMath() {
    // Prevent instantiation.
  }

  /**
   * Finds the cross-product between two vectors
   *
   * @param a First vector
   * @param b Second vector
   * @return Returns the cross-product.
   */
  public static double[] X(double[] a, double[] b) {
    double[] ret = new double[3];
    ret[0] = a[1] * b[2] - a[2] * b[1];
    ret[1] = a[2] * b[0] - a[0] * b[2];
    ret[2] = a[0] * b[1] - a[1] * b[0];
    return ret;
  }

  /**
   * Finds the distance between two vectors.
   *
   * @param a First vector.
   * @param b Second vector.
   * @return Returns the distance between vectors a and b.
   */
  public static double dist(double[] a, double[] b) {
    return sqrt(dist2(a, b));
  }

  /**
   * Finds the squared distance between two vectors
   *
   * @param a First vector.
   * @param b Second vector.
   * @return Returns the squared distance between vectors a and b.
   */
  public static double dist2(double[] a, double[] b) {
    double dx = a[0] - b[0];
    double dy = a[1] - b[1];
    double dz = a[2] - b[2];
    return dx * dx + dy * dy + dz * dz;
  }

  /**
   * Computes the dot product of two vectors.
   *
   * @param a First vector.
   * @param b Second vector.
   * @return Returns the dot product of a and b.
   */
  public static double dot(double[] a, double[] b) {
    return a[0] * b[0] + a[1] * b[1] + a[2] * b[2];
  }

  /**
   * Returns the length of a vector.
   *
   * @param d A vector.
   * @return Returns the length of the vector.
   */
  public static double length(double[] d) {
    return sqrt(dot(d, d));
  }

  /**
   * Normalizes a vector.
   *
   * @param n A vector.
   * @return Returns the normalized vector.
   */
  public static double[] normalize(double[] n) {
    return scale(n, 1.0 / length(n));
  }

  /**
   * Scales a vector.
   *
   * @param n A vector.
   * @param a A scalar.
   * @return Returns the scaled vector.
   */
  public static double[] scale(double[] n, double a) {
    return new double[] {n[0] * a, n[1] * a, n[2] * a};
  }

  /**
   * Vector a - b.
   *
   * @param a First vector.
   * @param b Second vector.
   * @return Returns a - b.
   */
  public static double[] sub(double[] a, double[] b) {
    return new double[] {a[0] - b[0], a[1] - b[1], a[2] - b[2]};
  }
}
