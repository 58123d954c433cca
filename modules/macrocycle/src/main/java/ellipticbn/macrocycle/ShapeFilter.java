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
import static org.apache.commons.math3.util.FastMath.abs;

import ellipticbn.numerics.DegenerateGeometryException;
import ellipticbn.numerics.PrincipalAxes;
import java.util.logging.Logger;

/**
 * Rejects rings that are not ring-like: a ring passes only if the ratio of its two in-plane
 * principal axes is below the aspect ratio filter.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class ShapeFilter {

  private static final Logger logger = Logger.getLogger(ShapeFilter.class.getName());

  /** Relative tolerance within which an aspect ratio counts as reaching the filter. */
  public static final double RELATIVE_TOLERANCE = 1.0e-8;

  private final double aspectRatioFilter;

  public ShapeFilter(double aspectRatioFilter) {
    if (!Double.isFinite(aspectRatioFilter) || aspectRatioFilter <= 0.0) {
      throw new IllegalArgumentException(
          format(" The aspect ratio filter must be positive (found %s).", aspectRatioFilter));
    }
    this.aspectRatioFilter = aspectRatioFilter;
  }

  /**
   * @param ratio An aspect ratio.
   * @return true if the ratio is strictly below the filter.
   */
  public boolean passes(double ratio) {
    return ratio < aspectRatioFilter
        && abs(ratio - aspectRatioFilter) > RELATIVE_TOLERANCE * aspectRatioFilter;
  }

  /**
   * Assess the shape of a ring.
   *
   * @param points The ring atom coordinates.
   * @return the assessment.
   */
  public ShapeAssessment assess(double[][] points) {
    PrincipalAxes axes;
    try {
      axes = PrincipalAxes.fit(points);
    } catch (DegenerateGeometryException e) {
      logger.fine(format(" Degenerate ring:%s", e.getMessage()));
      return new ShapeAssessment(ReasonTag.DEGENERATE, Double.NaN, null);
    }
    double ratio = axes.getAspectRatio();
    ReasonTag status = passes(ratio) ? ReasonTag.ACCEPTED : ReasonTag.ASPECT_RATIO;
    return new ShapeAssessment(status, ratio, axes);
  }

  public double getAspectRatioFilter() {
    return aspectRatioFilter;
  }
}
