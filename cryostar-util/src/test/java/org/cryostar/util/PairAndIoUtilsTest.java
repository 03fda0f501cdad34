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
package org.cryostar.util;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Tests {@link Pair} and {@link IoUtils}.
 */
public class PairAndIoUtilsTest {
  @Test
  public void pairEqualityWithNulls() {
    Assert.assertEquals(Pair.of(null, 1), Pair.of(null, 1));
    Assert.assertNotEquals(Pair.of(1, null), Pair.of(1, 2));
    Assert.assertEquals(Pair.of(1, null).hashCode(), Pair.of(1, null).hashCode());
  }

  @Test
  public void pairSortsLeftThenRight() {
    // GIVEN
    List<Pair<Long, Double>> pairs = Arrays.asList(Pair.of(2L, 1.), Pair.of(1L, 5.), Pair.of(1L, 3.));

    // WHEN
    Collections.sort(pairs);

    // THEN
    Assert.assertEquals(pairs, Arrays.asList(Pair.of(1L, 3.), Pair.of(1L, 5.), Pair.of(2L, 1.)),
        "Expected correct order");
  }

  @Test
  public void fileNames() {
    Assert.assertEquals(IoUtils.getExtension("a/b/stack.mrcs"), "mrcs");
    Assert.assertEquals(IoUtils.getExtension("a.b/stack"), "");
    Assert.assertEquals(IoUtils.replaceBaseExtension("a/b/stack.hdf", "mrcs"), "stack.mrcs");
    Assert.assertEquals(IoUtils.relativize(Paths.get("/run/tmp/mic_000001.mrc"), Paths.get("/run")),
        "tmp/mic_000001.mrc");
    Assert.assertEquals(IoUtils.relativize(Paths.get("x/y.mrc"), null), "x/y.mrc");
  }
}
