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
package org.cryostar.convert;

import java.util.Arrays;

import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class FormatVersionTest {
  @DataProvider(name = "configValues")
  public Object[][] configValues() {
    return new Object[][] { //
        { "30", FormatVersion.V30 }, //
        { "31", FormatVersion.V31 }, //
        { " 3.1 ", FormatVersion.V31 }, //
    };
  }

  @Test(dataProvider = "configValues")
  public void fromConfigValue(String value, FormatVersion expected) {
    Assert.assertEquals(FormatVersion.fromConfigValue(value), expected);
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void unknownConfigValue() {
    FormatVersion.fromConfigValue("4.0");
  }

  @Test
  public void detectByOpticsTable() {
    Assert.assertEquals(FormatVersion.detect(Arrays.asList("optics", "particles")), FormatVersion.V31);
    Assert.assertEquals(FormatVersion.detect(Arrays.asList("", "model_classes")), FormatVersion.V30);
  }

  @Test
  public void entityTableNames() {
    Assert.assertEquals(FormatVersion.V30.getEntityTableName(ImageKind.PARTICLES), "");
    Assert.assertEquals(FormatVersion.V30.getEntityTableName(ImageKind.MICROGRAPHS), "micrographs");
    Assert.assertEquals(FormatVersion.V31.getEntityTableName(ImageKind.PARTICLES), "particles");
    Assert.assertNull(FormatVersion.V30.getParticlesTableName(), "Expected first table for RELION 3.0");
  }
}
