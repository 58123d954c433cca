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

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.Iterator;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.SystemConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.io.FilenameUtils;

import static java.lang.String.format;

/**
 * The PropertyLoader assembles the layered ElliptiCBn configuration.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class PropertyLoader {

  private static final Logger logger = Logger.getLogger(PropertyLoader.class.getName());

  /**
   * Environment variable naming a system wide property file.
   */
  public static final String PROPERTIES_ENV = "ELLIPTICBN_PROPERTIES";

  /**
   * User property file, relative to the user's home directory.
   */
  public static final String USER_PROPERTIES = ".ellipticbn" + File.separator + "ellipticbn.properties";

  private PropertyLoader() {
    // Prevent instantiation.
  }

  /**
   * This method sets up configuration properties in the following precedence order:
   * <p>
   * 1.) Java system properties a.) -Dkey=value from the Java command line b.)
   * System.setProperty("key","value") within Java code.
   * <p>
   * 2.) Structure specific properties (for example cb7.properties next to cb7.xyz)
   * <p>
   * 3.) User specific properties (~/.ellipticbn/ellipticbn.properties)
   * <p>
   * 4.) System wide properties (file defined by environment variable ELLIPTICBN_PROPERTIES)
   * <p>
   * Values given on the command line are applied on top of the returned configuration by each
   * Command.
   *
   * @param file The structure file, or null if there is no structure specific configuration.
   * @return a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   */
  public static CompositeConfiguration loadProperties(File file) {
    return loadProperties(file, new File(System.getProperty("user.home"), USER_PROPERTIES),
        System.getenv(PROPERTIES_ENV));
  }

  /**
   * Assemble the layered configuration from explicit user and system property file locations.
   *
   * @param file The structure file, or null.
   * @param userPropFile The user property file (may not exist).
   * @param systemFilename The system wide property file name, or null.
   * @return a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   */
  static CompositeConfiguration loadProperties(File file, File userPropFile,
      String systemFilename) {

    CompositeConfiguration properties = new CompositeConfiguration();

    /*
      JVM system properties are read first.
      a.) -Dkey=value from the Java command line
      b.) System.setProperty("key","value") within Java code.
     */
    PropertiesConfiguration systemConfiguration = new PropertiesConfiguration();
    systemConfiguration.append(new SystemConfiguration());
    systemConfiguration.setHeader("JVM system properties (i.e. command line -Dkey=value pairs).");
    properties.addConfiguration(systemConfiguration);

    // Structure specific options are 2nd.
    if (file != null) {
      String structureBasename = FilenameUtils.removeExtension(file.getAbsolutePath());
      String propertyFilename =
          (new File(structureBasename + ".properties").exists()) ? structureBasename + ".properties"
              : (new File(structureBasename + ".prop").exists()) ? structureBasename + ".prop"
              : null;
      if (propertyFilename != null) {
        File structurePropFile = new File(propertyFilename);
        PropertiesConfiguration structureConfiguration =
            readPropertyFile(structurePropFile, "Structure properties from (" + propertyFilename + ").");
        if (structureConfiguration != null) {
          properties.addConfiguration(structureConfiguration);
          try {
            properties.addProperty("propertyFile", structurePropFile.getCanonicalPath());
          } catch (IOException e) {
            logger.log(Level.INFO, " Error resolving {0}.", propertyFilename);
          }
        }
      }
    }

    // User specific options are 3rd.
    if (userPropFile != null && userPropFile.exists() && userPropFile.canRead()) {
      PropertiesConfiguration userConfiguration = readPropertyFile(userPropFile,
          "User property file (" + userPropFile + ").");
      if (userConfiguration != null) {
        properties.addConfiguration(userConfiguration);
      }
    }

    // System wide options are last.
    if (systemFilename != null) {
      File systemPropFile = new File(systemFilename);
      if (systemPropFile.exists() && systemPropFile.canRead()) {
        PropertiesConfiguration envConfiguration = readPropertyFile(systemPropFile,
            "Environment variable " + PROPERTIES_ENV + " (" + systemFilename + ").");
        if (envConfiguration != null) {
          properties.addConfiguration(envConfiguration);
        }
      }
    }

    // Echo the interpolated configuration.
    if (logger.isLoggable(Level.FINE)) {
      Iterator<String> i = properties.getKeys();
      StringBuilder sb = new StringBuilder();
      sb.append(format("\n %-30s %s\n", "Property", "Value"));
      while (i.hasNext()) {
        String s = i.next();
        sb.append(format(" %-30s %s\n", s, Arrays.toString(properties.getList(s).toArray())));
      }
      logger.fine(sb.toString());
    }

    return properties;
  }

  /**
   * Read one property file.
   *
   * @param propertyFile The file to read.
   * @param header A description of where the file came from.
   * @return The configuration, or null if the file could not be read.
   */
  private static PropertiesConfiguration readPropertyFile(File propertyFile, String header) {
    try {
      FileBasedConfigurationBuilder<PropertiesConfiguration> builder =
          new FileBasedConfigurationBuilder<>(PropertiesConfiguration.class)
              .configure(new Parameters().properties()
                  .setFile(propertyFile)
                  .setThrowExceptionOnMissing(true)
                  .setIncludesAllowed(false));
      PropertiesConfiguration configuration = builder.getConfiguration();
      configuration.setHeader(header);
      return configuration;
    } catch (ConfigurationException e) {
      logger.log(Level.INFO, " Error loading {0}.", propertyFile);
      return null;
    }
  }
}
