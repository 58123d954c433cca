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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import ellipticbn.utilities.EllipticbnTest;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.Test;

/**
 * Tests validation and configuration of the macrocycle settings.
 */
public class MacrocyclePropertiesTest extends EllipticbnTest {

  @Test
  public void testDefaults() {
    MacrocycleProperties properties = MacrocycleProperties.defaults();
    assertEquals(2.5, properties.getBondDist(), 0.0);
    assertEquals(3.0, properties.getAspectRatioFilter(), 0.0);
    assertEquals(2.9, properties.getOxygenDistCutoff(), 0.0);
    assertEquals(10, properties.getMinNumCarbons());
    assertEquals(20, properties.getMaxNumCarbons());
    assertEquals(1.3, properties.getMinCycleCCBondLength(), 0.0);
    assertEquals(1.7, properties.getMaxCycleCCBondLength(), 0.0);
  }

  @Test
  public void testInclusiveWindows() {
    MacrocycleProperties properties = MacrocycleProperties.defaults();
    assertTrue(properties.isRingBond(1.3));
    assertTrue(properties.isRingBond(1.7));
    assertFalse(properties.isRingBond(1.2999));
    assertFalse(properties.isRingBond(1.7001));
    assertTrue(properties.isAllowedRingSize(10));
    assertTrue(properties.isAllowedRingSize(20));
    assertFalse(properties.isAllowedRingSize(9));
    assertFalse(properties.isAllowedRingSize(21));
  }

  @Test
  public void testFromConfiguration() {
    BaseConfiguration configuration = new BaseConfiguration();
    configuration.setProperty(MacrocycleProperties.ASPECT_RATIO_FILTER, "5.0");
    configuration.setProperty(MacrocycleProperties.MAX_NUM_CARBONS, "30");
    MacrocycleProperties properties = MacrocycleProperties.fromConfiguration(configuration);
    assertEquals(5.0, properties.getAspectRatioFilter(), 0.0);
    assertEquals(30, properties.getMaxNumCarbons());
    assertEquals(2.5, properties.getBondDist(), 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnparsableValue() {
    BaseConfiguration configuration = new BaseConfiguration();
    configuration.setProperty(MacrocycleProperties.BOND_DIST, "far");
    MacrocycleProperties.fromConfiguration(configuration);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeDistance() {
    new MacrocycleProperties(-2.5, 3.0, 2.9, 10, 20, 1.3, 1.7);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testTooFewCarbons() {
    new MacrocycleProperties(2.5, 3.0, 2.9, 2, 20, 1.3, 1.7);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMaxBelowMin() {
    new MacrocycleProperties(2.5, 3.0, 2.9, 10, 9, 1.3, 1.7);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvertedBondWindow() {
    new MacrocycleProperties(2.5, 3.0, 2.9, 10, 20, 1.8, 1.7);
  }
}
