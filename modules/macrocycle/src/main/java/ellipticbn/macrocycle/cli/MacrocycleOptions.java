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

package ellipticbn.macrocycle.cli;

import static ellipticbn.macrocycle.MacrocycleProperties.ASPECT_RATIO_FILTER;
import static ellipticbn.macrocycle.MacrocycleProperties.BOND_DIST;
import static ellipticbn.macrocycle.MacrocycleProperties.MAX_CYCLE_CC_BOND_LENGTH;
import static ellipticbn.macrocycle.MacrocycleProperties.MAX_NUM_CARBONS;
import static ellipticbn.macrocycle.MacrocycleProperties.MIN_CYCLE_CC_BOND_LENGTH;
import static ellipticbn.macrocycle.MacrocycleProperties.MIN_NUM_CARBONS;
import static ellipticbn.macrocycle.MacrocycleProperties.OXYGEN_DIST_CUTOFF;

import ellipticbn.macrocycle.MacrocycleProperties;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.Configuration;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Option;

/**
 * Represents command line options for the macrocycle detection thresholds.
 * <p>
 * Options left unset fall through to the layered property files and then to the defaults.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class MacrocycleOptions {

  /**
   * The ArgGroup keeps the MacrocycleOptions together when printing help.
   */
  @ArgGroup(heading = "%n Macrocycle Options%n", validate = false)
  public MacrocycleOptionGroup group = new MacrocycleOptionGroup();

  /**
   * Layer the command line values over a loaded configuration and build the settings.
   *
   * @param loaded The configuration from system properties and property files.
   * @return the validated settings.
   * @throws IllegalArgumentException If a setting is invalid.
   */
  public MacrocycleProperties toProperties(Configuration loaded) {
    CompositeConfiguration layered = new CompositeConfiguration();
    layered.addConfiguration(commandLineConfiguration());
    layered.addConfiguration(loaded);
    return MacrocycleProperties.fromConfiguration(layered);
  }

  /**
   * @return a configuration holding only the options given on the command line.
   */
  Configuration commandLineConfiguration() {
    BaseConfiguration configuration = new BaseConfiguration();
    setIfPresent(configuration, BOND_DIST, group.bondDist);
    setIfPresent(configuration, ASPECT_RATIO_FILTER, group.aspectRatioFilter);
    setIfPresent(configuration, OXYGEN_DIST_CUTOFF, group.oxygenDistCutoff);
    setIfPresent(configuration, MIN_NUM_CARBONS, group.minCarbons);
    setIfPresent(configuration, MAX_NUM_CARBONS, group.maxCarbons);
    setIfPresent(configuration, MIN_CYCLE_CC_BOND_LENGTH, group.minCC);
    setIfPresent(configuration, MAX_CYCLE_CC_BOND_LENGTH, group.maxCC);
    return configuration;
  }

  private static void setIfPresent(Configuration configuration, String key, Number value) {
    if (value != null) {
      configuration.setProperty(key, value);
    }
  }

  /**
   * Collection of Macrocycle Options.
   */
  private static class MacrocycleOptionGroup {

    /** -b or --bondDist Atoms closer than this distance belong to one molecule. */
    @Option(
        names = {"-b", "--bondDist"},
        paramLabel = "2.5 Å",
        description = "Atoms closer than this distance are part of one molecule.")
    public Double bondDist;

    /** -a or --aspectRatioFilter Reject rings whose principal axis aspect ratio reaches this. */
    @Option(
        names = {"-a", "--aspectRatioFilter"},
        paramLabel = "3.0",
        description = "Reject rings with a principal axis aspect ratio at or above this value.")
    public Double aspectRatioFilter;

    /** -o or --oxygenDistCutoff Carbons this close to an oxygen are not ring candidates. */
    @Option(
        names = {"-o", "--oxygenDistCutoff"},
        paramLabel = "2.9 Å",
        description = "Remove carbons within this distance of an oxygen before finding rings.")
    public Double oxygenDistCutoff;

    /** --minCarbons Minimum number of carbons in a ring. */
    @Option(
        names = {"--minCarbons"},
        paramLabel = "10",
        description = "Minimum number of carbons in the central ring.")
    public Integer minCarbons;

    /** --maxCarbons Maximum number of carbons in a ring. */
    @Option(
        names = {"--maxCarbons"},
        paramLabel = "20",
        description = "Maximum number of carbons in the central ring.")
    public Integer maxCarbons;

    /** --minCC Minimum ring C-C bond length. */
    @Option(
        names = {"--minCC"},
        paramLabel = "1.3 Å",
        description = "Minimum length of a C-C bond in the ring.")
    public Double minCC;

    /** --maxCC Maximum ring C-C bond length. */
    @Option(
        names = {"--maxCC"},
        paramLabel = "1.7 Å",
        description = "Maximum length of a C-C bond in the ring.")
    public Double maxCC;
  }
}
