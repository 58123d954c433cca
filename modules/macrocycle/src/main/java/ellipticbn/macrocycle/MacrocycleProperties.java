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

import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.ex.ConversionException;

/**
 * Immutable settings shared by every stage of the macrocycle analysis.
 * <p>
 * Distances are in Angstroms. The property keys match the long names used in property files and
 * as JVM system properties (for example -Dbond-dist=2.5).
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class MacrocycleProperties {

  public static final String BOND_DIST = "bond-dist";
  public static final String ASPECT_RATIO_FILTER = "aspect-ratio-filter";
  public static final String OXYGEN_DIST_CUTOFF = "oxygen-dist-cutoff";
  public static final String MIN_NUM_CARBONS = "min-num-carbons";
  public static final String MAX_NUM_CARBONS = "max-num-carbons";
  public static final String MIN_CYCLE_CC_BOND_LENGTH = "min-cycle-cc-bond-length";
  public static final String MAX_CYCLE_CC_BOND_LENGTH = "max-cycle-cc-bond-length";

  public static final double DEFAULT_BOND_DIST = 2.5;
  public static final double DEFAULT_ASPECT_RATIO_FILTER = 3.0;
  public static final double DEFAULT_OXYGEN_DIST_CUTOFF = 2.9;
  public static final int DEFAULT_MIN_NUM_CARBONS = 10;
  public static final int DEFAULT_MAX_NUM_CARBONS = 20;
  public static final double DEFAULT_MIN_CYCLE_CC_BOND_LENGTH = 1.3;
  public static final double DEFAULT_MAX_CYCLE_CC_BOND_LENGTH = 1.7;

  /** Atoms closer than this are part of one molecule. */
  private final double bondDist;
  /** Rings whose aspect ratio reaches this value are rejected. */
  private final double aspectRatioFilter;
  /** Carbons within this distance of an oxygen are not ring scaffold candidates. */
  private final double oxygenDistCutoff;
  private final int minNumCarbons;
  private final int maxNumCarbons;
  private final double minCycleCCBondLength;
  private final double maxCycleCCBondLength;

  /**
   * Construct and validate a set of properties.
   *
   * @throws IllegalArgumentException If the settings are structurally invalid.
   */
  public MacrocycleProperties(double bondDist, double aspectRatioFilter, double oxygenDistCutoff,
      int minNumCarbons, int maxNumCarbons, double minCycleCCBondLength,
      double maxCycleCCBondLength) {
    this.bondDist = positive(BOND_DIST, bondDist);
    this.aspectRatioFilter = positive(ASPECT_RATIO_FILTER, aspectRatioFilter);
    this.oxygenDistCutoff = positive(OXYGEN_DIST_CUTOFF, oxygenDistCutoff);
    this.minCycleCCBondLength = positive(MIN_CYCLE_CC_BOND_LENGTH, minCycleCCBondLength);
    this.maxCycleCCBondLength = positive(MAX_CYCLE_CC_BOND_LENGTH, maxCycleCCBondLength);
    if (minCycleCCBondLength > maxCycleCCBondLength) {
      throw new IllegalArgumentException(format(" %s (%6.3f) is larger than %s (%6.3f).",
          MIN_CYCLE_CC_BOND_LENGTH, minCycleCCBondLength, MAX_CYCLE_CC_BOND_LENGTH,
          maxCycleCCBondLength));
    }
    if (minNumCarbons < 3) {
      throw new IllegalArgumentException(
          format(" %s must be at least 3 (found %d).", MIN_NUM_CARBONS, minNumCarbons));
    }
    if (maxNumCarbons < minNumCarbons) {
      throw new IllegalArgumentException(format(" %s (%d) is smaller than %s (%d).",
          MAX_NUM_CARBONS, maxNumCarbons, MIN_NUM_CARBONS, minNumCarbons));
    }
    this.minNumCarbons = minNumCarbons;
    this.maxNumCarbons = maxNumCarbons;
  }

  /**
   * @return the default settings.
   */
  public static MacrocycleProperties defaults() {
    return new MacrocycleProperties(DEFAULT_BOND_DIST, DEFAULT_ASPECT_RATIO_FILTER,
        DEFAULT_OXYGEN_DIST_CUTOFF, DEFAULT_MIN_NUM_CARBONS, DEFAULT_MAX_NUM_CARBONS,
        DEFAULT_MIN_CYCLE_CC_BOND_LENGTH, DEFAULT_MAX_CYCLE_CC_BOND_LENGTH);
  }

  /**
   * Read settings from a configuration, falling back to the defaults for missing keys.
   *
   * @param configuration The layered configuration.
   * @return the settings.
   * @throws IllegalArgumentException If a value cannot be converted or is invalid.
   */
  public static MacrocycleProperties fromConfiguration(Configuration configuration) {
    try {
      return new MacrocycleProperties(
          configuration.getDouble(BOND_DIST, DEFAULT_BOND_DIST),
          configuration.getDouble(ASPECT_RATIO_FILTER, DEFAULT_ASPECT_RATIO_FILTER),
          configuration.getDouble(OXYGEN_DIST_CUTOFF, DEFAULT_OXYGEN_DIST_CUTOFF),
          configuration.getInt(MIN_NUM_CARBONS, DEFAULT_MIN_NUM_CARBONS),
          configuration.getInt(MAX_NUM_CARBONS, DEFAULT_MAX_NUM_CARBONS),
          configuration.getDouble(MIN_CYCLE_CC_BOND_LENGTH, DEFAULT_MIN_CYCLE_CC_BOND_LENGTH),
          configuration.getDouble(MAX_CYCLE_CC_BOND_LENGTH, DEFAULT_MAX_CYCLE_CC_BOND_LENGTH));
    } catch (ConversionException e) {
      throw new IllegalArgumentException(" Invalid macrocycle property: " + e.getMessage(), e);
    }
  }

  private static double positive(String key, double value) {
    if (!Double.isFinite(value) || value <= 0.0) {
      throw new IllegalArgumentException(format(" %s must be positive (found %s).", key, value));
    }
    return value;
  }

  public double getBondDist() {
    return bondDist;
  }

  public double getAspectRatioFilter() {
    return aspectRatioFilter;
  }

  public double getOxygenDistCutoff() {
    return oxygenDistCutoff;
  }

  public int getMinNumCarbons() {
    return minNumCarbons;
  }

  public int getMaxNumCarbons() {
    return maxNumCarbons;
  }

  public double getMinCycleCCBondLength() {
    return minCycleCCBondLength;
  }

  public double getMaxCycleCCBondLength() {
    return maxCycleCCBondLength;
  }

  /**
   * @param nCarbons A ring size.
   * @return true if the ring size is within [min-num-carbons, max-num-carbons].
   */
  public boolean isAllowedRingSize(int nCarbons) {
    return nCarbons >= minNumCarbons && nCarbons <= maxNumCarbons;
  }

  /**
   * @param distance A carbon-carbon distance.
   * @return true if the distance is within the inclusive ring bond window.
   */
  public boolean isRingBond(double distance) {
    return distance >= minCycleCCBondLength && distance <= maxCycleCCBondLength;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(" Macrocycle settings:\n");
    sb.append(format("  %-26s %8.3f\n", BOND_DIST, bondDist));
    sb.append(format("  %-26s %8.3f\n", ASPECT_RATIO_FILTER, aspectRatioFilter));
    sb.append(format("  %-26s %8.3f\n", OXYGEN_DIST_CUTOFF, oxygenDistCutoff));
    sb.append(format("  %-26s %8d\n", MIN_NUM_CARBONS, minNumCarbons));
    sb.append(format("  %-26s %8d\n", MAX_NUM_CARBONS, maxNumCarbons));
    sb.append(format("  %-26s %8.3f\n", MIN_CYCLE_CC_BOND_LENGTH, minCycleCCBondLength));
    sb.append(format("  %-26s %8.3f", MAX_CYCLE_CC_BOND_LENGTH, maxCycleCCBondLength));
    return sb.toString();
  }
}
