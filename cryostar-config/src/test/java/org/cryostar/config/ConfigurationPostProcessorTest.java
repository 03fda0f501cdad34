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

import org.cryostar.context.AutoInstatiate;
import org.cryostar.context.Profiles;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

/**
 * Tests {@link ConfigurationManager} and {@link ConfigurationPostProcessor}.
 */
public class ConfigurationPostProcessorTest {
  private AnnotationConfigApplicationContext dataContext;

  @BeforeMethod
  public void setUp() {
    dataContext = new AnnotationConfigApplicationContext();
    dataContext.getEnvironment().setActiveProfiles(Profiles.UNIT_TEST);
    dataContext.scan("org.cryostar");
    dataContext.refresh();
  }

  @AfterMethod
  public void cleanup() {
    dataContext.close();
  }

  @Test
  public void defaultValuesAreWired() {
    // WHEN
    ConfiguredBean bean = dataContext.getBean(ConfiguredBean.class);

    // THEN
    Assert.assertEquals(bean.formatVersion, "31", "Expected default format version");
    Assert.assertEquals(bean.defocusDiff, 1000., "Expected default defocus diff");
    Assert.assertEquals(bean.minGroupSize, Integer.valueOf(10), "Expected default min group size");
    Assert.assertEquals(bean.imageSize, -1L, "Expected default image size");
  }

  @Test
  public void allKeysHaveDefaults() throws IllegalAccessException {
    ConfigurationManager configManager = dataContext.getBean(ConfigurationManager.class);
    for (java.lang.reflect.Field f : ConfigKey.class.getFields()) {
      String key = (String) f.get(null);
      Assert.assertNotNull(configManager.getDefaultValue(key), "Expected default value for " + key);
    }
  }

  @AutoInstatiate
  public static class ConfiguredBean {
    @Config(ConfigKey.STAR_FORMAT_VERSION)
    private String formatVersion;

    @Config(ConfigKey.DEFOCUS_GROUP_DIFF)
    private double defocusDiff;

    @Config(ConfigKey.DEFOCUS_GROUP_MIN_SIZE)
    private Integer minGroupSize;

    @Config(ConfigKey.OPTICS_DEFAULT_IMAGE_SIZE)
    private long imageSize;
  }
}
