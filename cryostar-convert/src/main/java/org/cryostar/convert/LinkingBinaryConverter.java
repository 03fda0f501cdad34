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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.cryostar.util.IoUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

/**
 * A {@link BinaryConverter} that creates symbolic links to files of the accepted formats. It cannot convert files of
 * other formats.
 */
public class LinkingBinaryConverter implements BinaryConverter {
  private static final Logger logger = LoggerFactory.getLogger(LinkingBinaryConverter.class);

  private final List<String> extensions;

  /**
   * @param extensions
   *          Accepted extensions, the first one is the default extension.
   */
  public LinkingBinaryConverter(String... extensions) {
    if (extensions.length == 0)
      throw new IllegalArgumentException("At least one extension is needed.");
    this.extensions = ImmutableList.copyOf(Arrays.asList(extensions));
  }

  /**
   * Accepts "mrc" files only.
   */
  public LinkingBinaryConverter() {
    this("mrc");
  }

  @Override
  public boolean isSupported(String extension) {
    return extensions.contains(extension);
  }

  @Override
  public String getDefaultExtension() {
    return extensions.get(0);
  }

  /**
   * @throws UnsupportedOperationException
   *           If the extension of the source is not accepted.
   */
  @Override
  public void convert(Path source, Path target) throws IOException {
    String extension = IoUtils.getExtension(source.getFileName().toString());
    if (!isSupported(extension))
      throw new UnsupportedOperationException("Cannot convert '" + source + "', only files with extensions "
          + extensions + " are linked.");
    if (Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
      logger.debug("Not linking '{}', target '{}' exists already.", source, target);
      return;
    }
    Files.createDirectories(target.toAbsolutePath().getParent());
    Files.createSymbolicLink(target, source.toAbsolutePath());
    logger.debug("Linked '{}' to '{}'", target, source);
  }
}
