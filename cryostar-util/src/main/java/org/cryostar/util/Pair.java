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

import java.io.Serializable;
import java.util.Objects;

/**
 * An arbitrary pair of values.
 * 
 * <p>
 * A {@link Pair} is {@link Comparable} when both objects are {@link Comparable}. The left side will be compared first
 * and only if the left is equal, the right will be compared.
 */
public final class Pair<L, R> implements Comparable<Pair<L, R>>, Serializable {
  private static final long serialVersionUID = 1L;

  private final L left;

  private final R right;

  public Pair(L left, R right) {
    this.left = left;
    this.right = right;
  }

  public static <L, R> Pair<L, R> of(L left, R right) {
    return new Pair<>(left, right);
  }

  public L getLeft() {
    return left;
  }

  public R getRight() {
    return right;
  }

  @Override
  public int hashCode() {
    return ((left != null) ? left.hashCode() : 7) ^ ((right != null) ? right.hashCode() : 11);
  }

  @SuppressWarnings("unchecked")
  @Override
  public int compareTo(Pair<L, R> o) {
    int compareResLeft = ((Comparable<L>) left).compareTo(o.getLeft());
    if (compareResLeft == 0)
      return ((Comparable<R>) right).compareTo(o.getRight());
    return compareResLeft;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Pair))
      return false;

    Pair<?, ?> p = (Pair<?, ?>) obj;
    return Objects.equals(left, p.left) && Objects.equals(right, p.right);
  }

  @Override
  public String toString() {
    return "Pair(left=" + left + ", right=" + right + ")";
  }

}
