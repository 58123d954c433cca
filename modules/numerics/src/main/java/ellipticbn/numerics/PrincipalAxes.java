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

package ellipticbn.numerics;

import static ellipticbn.numerics.math.DoubleMath.X;
import static ellipticbn.numerics.math.DoubleMath.normalize;
import static java.lang.String.format;
import static java.util.Arrays.copyOf;
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.sqrt;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;

/**
 * Principal component analysis of a small set of 3D points.
 * <p>
 * The centered covariance matrix (normalized by the number of points) is diagonalized with the
 * Apache Commons Math {@link EigenDecomposition}. Axes are ordered by descending variance. The
 * major and minor axes span the best-fit plane of the points; the normal completes a right-handed
 * frame (normal = major x minor).
 * <p>
 * Each axis carries a deterministic sign: its largest magnitude component is positive.
 * <p>
 * Instances are immutable; accessors return copies.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class PrincipalAxes {

  /**
   * If the second variance is below this fraction of the first, the points are treated as
   * collinear.
   */
  public static final double PLANAR_TOLERANCE = 1.0e-10;

  private final int nPoints;
  private final double[] centroid;
  /** Variances in descending order. */
  private final double[] variances;
  /** Unit axes as rows: major, minor, normal. */
  private final double[][] axes;

  private PrincipalAxes(int nPoints, double[] centroid, double[] variances, double[][] axes) {
    this.nPoints = nPoints;
    this.centroid = centroid;
    this.variances = variances;
    this.axes = axes;
  }

  /**
   * Fit principal axes to a point set.
   *
   * @param points Points as rows of {x, y, z}.
   * @return the principal axes.
   * @throws DegenerateGeometryException If the points do not define a plane.
   * @throws IllegalArgumentException If a point is not 3-dimensional or not finite.
   */
  public static PrincipalAxes fit(double[][] points) {
    int n = points.length;
    if (n < 3) {
      throw new DegenerateGeometryException(
          format(" At least 3 points are needed to define a plane (found %d).", n), n,
          Double.NaN, Double.NaN);
    }

    double[] centroid = new double[3];
    for (double[] point : points) {
      if (point.length != 3) {
        throw new IllegalArgumentException(format(" Expected 3 coordinates, found %d.", point.length));
      }
      for (int k = 0; k < 3; k++) {
        if (!Double.isFinite(point[k])) {
          throw new IllegalArgumentException(" Coordinates must be finite: " + Arrays.toString(point));
        }
        centroid[k] += point[k];
      }
    }
    for (int k = 0; k < 3; k++) {
      centroid[k] /= n;
    }

    double[][] covariance = new double[3][3];
    for (double[] point : points) {
      double dx = point[0] - centroid[0];
      double dy = point[1] - centroid[1];
      double dz = point[2] - centroid[2];
      covariance[0][0] += dx * dx;
      covariance[0][1] += dx * dy;
      covariance[0][2] += dx * dz;
      covariance[1][1] += dy * dy;
      covariance[1][2] += dy * dz;
      covariance[2][2] += dz * dz;
    }
    covariance[1][0] = covariance[0][1];
    covariance[2][0] = covariance[0][2];
    covariance[2][1] = covariance[1][2];
    for (int i = 0; i < 3; i++) {
      for (int j = 0; j < 3; j++) {
        covariance[i][j] /= n;
      }
    }

    EigenDecomposition eigen = new EigenDecomposition(new Array2DRowRealMatrix(covariance));
    double[] eigenvalues = eigen.getRealEigenvalues();

    // Order by descending variance; round-off can give tiny negative values for a flat direction.
    Integer[] order = IntStream.range(0, 3).boxed().toArray(Integer[]::new);
    Arrays.sort(order, Comparator.comparingDouble((Integer i) -> eigenvalues[i]).reversed());
    double[] variances = new double[3];
    for (int i = 0; i < 3; i++) {
      variances[i] = max(0.0, eigenvalues[order[i]]);
    }

    if (variances[0] <= 0.0 || variances[1] <= variances[0] * PLANAR_TOLERANCE) {
      throw new DegenerateGeometryException(" The points are collinear or coincident.", n,
          variances[0], variances[1]);
    }

    double[] major = canonicalSign(normalize(eigen.getEigenvector(order[0]).toArray()));
    double[] minor = canonicalSign(normalize(eigen.getEigenvector(order[1]).toArray()));
    double[] normal = normalize(X(major, minor));

    return new PrincipalAxes(n, centroid, variances, new double[][] {major, minor, normal});
  }

  /**
   * Flip a vector so that its largest magnitude component is positive.
   *
   * @param v The vector, modified in place.
   * @return the vector.
   */
  static double[] canonicalSign(double[] v) {
    int largest = 0;
    for (int k = 1; k < 3; k++) {
      if (abs(v[k]) > abs(v[largest])) {
        largest = k;
      }
    }
    if (v[largest] < 0.0) {
      for (int k = 0; k < 3; k++) {
        v[k] = -v[k];
      }
    }
    return v;
  }

  public int getNumberOfPoints() {
    return nPoints;
  }

  public double[] getCentroid() {
    return copyOf(centroid, 3);
  }

  /**
   * @return the three principal variances in descending order.
   */
  public double[] getVariances() {
    return copyOf(variances, 3);
  }

  public double[] getMajorAxis() {
    return copyOf(axes[0], 3);
  }

  public double[] getMinorAxis() {
    return copyOf(axes[1], 3);
  }

  public double[] getNormal() {
    return copyOf(axes[2], 3);
  }

  /**
   * Semi-axis lengths of the ellipse that produces the in-plane variances. Points spread evenly
   * around an ellipse with semi-axes a and b have variances a^2/2 and b^2/2.
   *
   * @return {a, b}
   */
  public double[] getSemiAxes() {
    return new double[] {sqrt(2.0 * variances[0]), sqrt(2.0 * variances[1])};
  }

  /**
   * The ratio of the two in-plane principal axis lengths: sqrt(variance1 / variance2).
   *
   * @return the aspect ratio (at least 1).
   */
  public double getAspectRatio() {
    return sqrt(variances[0] / variances[1]);
  }

  @Override
  public String toString() {
    return format(" Principal axes of %d points\n  Centroid %s\n  Variances %12.6f %12.6f %12.6f",
        nPoints, Arrays.toString(centroid), variances[0], variances[1], variances[2]);
  }
}
