// ******************************************************************************
//
// Title:       XSim.
// Description: XSim - Analysis of Simulated X-ray Diffraction Experiments.
// Copyright:   Copyright (c) Michael J. Schnieders 2001-2025.
//
// This file is part of XSim.
//
// XSim is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// XSim is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// XSim; if not, write to the Free Software Foundation, Inc., 59 Temple
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
package xsim.utilities;

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
import org.apache.commons.configuration2.convert.DefaultListDelimiterHandler;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.io.FilenameUtils;

import static java.lang.String.format;

/**
 * The XSimProperties class assembles the layered configuration used by the analysis classes.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class XSimProperties {

  private static final Logger logger = Logger.getLogger(XSimProperties.class.getName());

  /** Name of the environment variable that points to a system wide property file. */
  public static final String ENVIRONMENT_VARIABLE = "XSIM_PROPERTIES";

  /** Location of the user property file, relative to the user's home directory. */
  public static final String USER_PROPERTIES = ".xsim" + File.separator + "xsim.properties";

  private XSimProperties() {
    // Empty constructor.
  }

  /**
   * This method sets up configuration properties in the following precedence order:
   * <p>
   * 1.) Java system properties a.) -Dkey=value from the Java command line b.)
   * System.setProperty("key","value") within Java code.
   * <p>
   * 2.) Data specific properties (for example diffr.properties next to diffr.h5, or
   * patterns.properties next to a directory named patterns).
   * <p>
   * 3.) User specific properties (~/.xsim/xsim.properties)
   * <p>
   * 4.) System wide properties (file defined by environment variable XSIM_PROPERTIES)
   *
   * @param file The diffraction file or directory being analysed; may be null.
   * @return a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   */
  public static CompositeConfiguration loadProperties(File file) {
    CompositeConfiguration properties = new CompositeConfiguration();

    // JVM system properties take precedence.
    PropertiesConfiguration systemConfiguration = new PropertiesConfiguration();
    systemConfiguration.append(new SystemConfiguration());
    systemConfiguration.setHeader("JVM system properties (i.e. command line -Dkey=value pairs).");
    properties.addConfiguration(systemConfiguration);

    // Data specific options are 2nd.
    if (file != null) {
      String basename = FilenameUtils.removeExtension(file.getAbsolutePath());
      File dataPropFile = new File(basename + ".properties");
      if (dataPropFile.exists() && dataPropFile.canRead()) {
        PropertiesConfiguration dataConfiguration = readPropertyFile(dataPropFile,
            "Data properties from (" + dataPropFile + ").");
        if (dataConfiguration != null) {
          properties.addConfiguration(dataConfiguration);
          try {
            properties.addProperty("propertyFile", dataPropFile.getCanonicalPath());
          } catch (IOException e) {
            logger.log(Level.INFO, " Error resolving {0}.", dataPropFile);
          }
        }
      }
    }

    // User specific options are 3rd.
    File userPropFile = new File(System.getProperty("user.home"), USER_PROPERTIES);
    if (userPropFile.exists() && userPropFile.canRead()) {
      PropertiesConfiguration userConfiguration = readPropertyFile(userPropFile,
          "XSim user property file (" + userPropFile + ").");
      if (userConfiguration != null) {
        properties.addConfiguration(userConfiguration);
      }
    }

    // System wide options are last.
    String filename = System.getenv(ENVIRONMENT_VARIABLE);
    if (filename != null) {
      File systemPropFile = new File(filename);
      if (systemPropFile.exists() && systemPropFile.canRead()) {
        PropertiesConfiguration envConfiguration = readPropertyFile(systemPropFile,
            "Environment variable " + ENVIRONMENT_VARIABLE + " (" + filename + ").");
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
   * Read a single property file. Comma separated values are split into lists.
   *
   * @param propertyFile The file to read.
   * @param header       Header describing the origin of the properties.
   * @return The configuration, or null if the file could not be parsed.
   */
  private static PropertiesConfiguration readPropertyFile(File propertyFile, String header) {
    try {
      FileBasedConfigurationBuilder<PropertiesConfiguration> builder =
          new FileBasedConfigurationBuilder<>(PropertiesConfiguration.class)
              .configure(new Parameters().properties()
                  .setFile(propertyFile)
                  .setThrowExceptionOnMissing(true)
                  .setListDelimiterHandler(new DefaultListDelimiterHandler(','))
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
