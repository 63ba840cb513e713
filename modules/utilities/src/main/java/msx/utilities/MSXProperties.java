// ******************************************************************************
//
// Title:       Multislice X.
// Description: Multislice X - Software for Electron Scattering Simulation.
// Copyright:   Copyright (c) Michael J. Schnieders 2001-2024.
//
// This file is part of Multislice X.
//
// Multislice X is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// Multislice X is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// Multislice X; if not, write to the Free Software Foundation, Inc., 59 Temple
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
package msx.utilities;

import static java.lang.String.format;

import java.io.File;
import java.net.URL;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.SystemConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.io.FileHandler;

/**
 * Assemble the Multislice X properties used to configure a simulation.
 *
 * <p>Properties are searched in the following order:
 * <br>
 * 1) Java system properties (e.g. -Dmsx.lazy=false).
 * <br>
 * 2) An optional user supplied property file.
 * <br>
 * 3) The defaults bundled in msx/utilities/msx.properties.
 *
 * <p>The resulting configuration is read once at the outermost entry point; algorithms receive the
 * values they need as explicit arguments.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class MSXProperties {

  private static final Logger logger = Logger.getLogger(MSXProperties.class.getName());

  /** Resource holding the default property values. */
  public static final String DEFAULT_PROPERTIES = "msx/utilities/msx.properties";
  /** Device key. */
  public static final String DEVICE = "msx.device";
  /** Laziness key. */
  public static final String LAZY = "msx.lazy";
  /** Chunk size (bytes) key. */
  public static final String CHUNK_SIZE = "msx.chunk-size";
  /** Thread count key. */
  public static final String THREADS = "msx.threads";
  /** Progress logging key. */
  public static final String PROGRESS = "msx.progress";

  private MSXProperties() {
  }

  /**
   * Build the default configuration: system properties followed by the bundled defaults.
   *
   * @return a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   */
  public static CompositeConfiguration defaultProperties() {
    return loadProperties(null);
  }

  /**
   * Build a configuration from system properties, an optional property file and the bundled
   * defaults.
   *
   * @param propertyFile a property file (may be null).
   * @return a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   */
  public static CompositeConfiguration loadProperties(File propertyFile) {
    CompositeConfiguration properties = new CompositeConfiguration();
    properties.addConfiguration(new SystemConfiguration());

    if (propertyFile != null) {
      if (!propertyFile.exists() || !propertyFile.canRead()) {
        throw new IllegalArgumentException(
            format(" Property file %s could not be read.", propertyFile));
      }
      PropertiesConfiguration userProperties = new PropertiesConfiguration();
      try {
        new FileHandler(userProperties).load(propertyFile);
      } catch (ConfigurationException e) {
        throw new IllegalArgumentException(
            format(" Property file %s could not be parsed.", propertyFile), e);
      }
      properties.addConfiguration(userProperties);
      if (logger.isLoggable(Level.FINE)) {
        logger.fine(format(" Loaded properties from %s.", propertyFile));
      }
    }

    URL url = MSXProperties.class.getClassLoader().getResource(DEFAULT_PROPERTIES);
    if (url != null) {
      PropertiesConfiguration defaults = new PropertiesConfiguration();
      try {
        new FileHandler(defaults).load(url);
      } catch (ConfigurationException e) {
        throw new IllegalStateException(
            format(" Default properties %s could not be parsed.", DEFAULT_PROPERTIES), e);
      }
      properties.addConfiguration(defaults);
    } else {
      logger.warning(format(" Default properties %s were not found.", DEFAULT_PROPERTIES));
    }
    return properties;
  }
}
