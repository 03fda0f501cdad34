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
package org.cryostar.data.image;

/**
 * The kind of geometrical information a {@link Transform} of the images of a set represents.
 */
public enum AlignmentType {
  /** Images are not aligned, they do not carry a transform. */
  NONE,
  /** In-plane alignment of 2D images: a rotation around the Z axis and X/Y shifts. */
  ALIGN_2D,
  /** Alignment of 3D volumes. */
  ALIGN_3D,
  /** Projection alignment: three Euler angles and shifts describing how a 2D image is a projection of a volume. */
  ALIGN_PROJ
}
