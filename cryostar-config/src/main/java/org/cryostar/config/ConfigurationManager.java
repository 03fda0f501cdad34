/**
 * cryostar: STAR metadata interchange for cryo-EM image processing.
 *
 * Copyright (C) 2015 The cryostar authors
 *
 * This file is part of cryostar.
 *
 * cryostar is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package org.cryostar.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

import javax.annotation.PostConstruct;

import org.cryostar.context.AutoInstatiate;
import org.cryostar.context.Profiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;

/**
 * Provides the active configuration values of cryostar.
 * 
 * <p>
 * Defaults are read from "/cryostar.properties" on the classpath; tests can replace that file by providing
 * "/cryostar-test.properties". Single values can be overridden in a properties file whose path is given in the system
 * property "cryostar.properties".
 */
@AutoInstatiate
@Profile(Profiles.CONFIG)
public class ConfigurationManager {
  private static final Logger logger = LoggerFactory.getLogger(ConfigurationManager.class);

  public static final String TEST_CONFIG_CLASSPATH_FILENAME = "/cryostar-test.properties";

  public static final String DEFAULT_CONFIG_CLASSPATH_FILENAME = "/cryostar.properties";

  public static final String CUSTOM_PROPERTIES_SYSTEM_PROPERTY = "cryostar.properties";

  private Properties defaultProperties;
  private Properties overrideProperties = new Properties();

  @PostConstruct
  private void initialize() {
    defaultProperties = loadDefaults();

    String overrideFile = System.getProperty(CUSTOM_PROPERTIES_SYSTEM_PROPERTY);
    if (overrideFile == null) {
      logger.debug("No overrides for the default configuration, set system property '{}' to provide some.",
          CUSTOM_PROPERTIES_SYSTEM_PROPERTY);
      return;
    }

    Path overridePath = Paths.get(overrideFile);
    try (Reader reader = Files.newBufferedReader(overridePath, StandardCharsets.UTF_8)) {
      overrideProperties.load(reader);
    } catch (IOException e) {
      throw new RuntimeException("Could not read configuration overrides from " + overridePath, e);
    }
    logger.info("Using {} configuration overrides from {}", overrideProperties.size(), overridePath);
  }

  private Properties loadDefaults() {
    String resource = TEST_CONFIG_CLASSPATH_FILENAME;
    InputStream stream = ConfigurationManager.class.getResourceAsStream(resource);
    if (stream == null) {
      resource = DEFAULT_CONFIG_CLASSPATH_FILENAME;
      stream = ConfigurationManager.class.getResourceAsStream(resource);
    }
    if (stream == null)
      throw new RuntimeException("Default configuration " + DEFAULT_CONFIG_CLASSPATH_FILENAME
          + " is not available on the classpath.");

    Properties res = new Properties();
    try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
      res.load(reader);
    } catch (IOException e) {
      throw new RuntimeException("Could not read default configuration " + resource, e);
    }
    logger.debug("Loaded default configuration from {}", resource);
    return res;
  }

  /**
   * @return The value of the given config key (see {@link ConfigKey}): the overridden value if there is one, the
   *         default otherwise. <code>null</code> if neither is available.
   */
  public String getValue(String configKey) {
    String res = overrideProperties.getProperty(configKey);
    if (res != null)
      return res;
    return getDefaultValue(configKey);
  }

  public String getDefaultValue(String configKey) {
    return defaultProperties.getProperty(configKey);
  }
}
