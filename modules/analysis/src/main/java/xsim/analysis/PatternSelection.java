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
package xsim.analysis;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import static java.lang.String.format;

/**
 * The patterns selected from a {@link PatternStore}: either every pattern, or an ordered list of
 * non-negative indices. Duplicate indices are kept, so a pattern may be read more than once.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class PatternSelection {

  /** The keyword that selects every pattern. */
  public static final String ALL_KEYWORD = "all";

  /** The largest number of indices a parsed selection may expand to. */
  public static final int MAX_PARSED_INDICES = 1_000_000;

  private static final PatternSelection ALL = new PatternSelection(null);

  /** Null for every pattern. */
  private final List<Integer> indices;
  /** The distinct indices, for membership tests. */
  private final Set<Integer> indexSet;

  private PatternSelection(List<Integer> indices) {
    this.indices = indices;
    this.indexSet = indices == null ? null : new HashSet<>(indices);
  }

  /**
   * Select every pattern.
   *
   * @return the PatternSelection.
   */
  public static PatternSelection all() {
    return ALL;
  }

  /**
   * Select patterns by index.
   *
   * @param indices non-negative indices.
   * @return the PatternSelection.
   * @throws IllegalArgumentException if an index is negative.
   */
  public static PatternSelection of(int... indices) {
    if (indices == null) {
      throw new IllegalArgumentException(" Pattern indices may not be null.");
    }
    List<Integer> list = new ArrayList<>(indices.length);
    for (int index : indices) {
      list.add(index);
    }
    return of(list);
  }

  /**
   * Select patterns by index.
   *
   * @param indices non-negative indices.
   * @return the PatternSelection.
   * @throws IllegalArgumentException if an index is null or negative.
   */
  public static PatternSelection of(Collection<Integer> indices) {
    if (indices == null) {
      throw new IllegalArgumentException(" Pattern indices may not be null.");
    }
    List<Integer> list = new ArrayList<>(indices.size());
    for (Integer index : indices) {
      list.add(checkIndex(index));
    }
    return new PatternSelection(Collections.unmodifiableList(list));
  }

  /**
   * Parse a selection such as "all", "3", "3,7" or "0-9, 12". Ranges are inclusive and are
   * expanded, so the whole selection may hold at most {@link #MAX_PARSED_INDICES} indices.
   *
   * @param value the text.
   * @return the PatternSelection.
   * @throws IllegalArgumentException if the text cannot be parsed or expands to too many indices.
   */
  public static PatternSelection parse(String value) {
    if (value == null || value.trim().isEmpty() || value.trim().equalsIgnoreCase(ALL_KEYWORD)) {
      return ALL;
    }
    List<Integer> list = new ArrayList<>();
    for (String token : value.split(",")) {
      String t = token.trim();
      try {
        int dash = t.indexOf('-', 1);
        if (dash > 0) {
          int first = Integer.parseInt(t.substring(0, dash).trim());
          int last = Integer.parseInt(t.substring(dash + 1).trim());
          if (last < first) {
            throw new IllegalArgumentException(format(" Pattern range %s is descending.", t));
          }
          checkIndex(first);
          long length = (long) last - first + 1;
          checkParsedSize(value, list.size() + length);
          for (int i = first; i <= last; i++) {
            list.add(i);
          }
        } else {
          checkParsedSize(value, list.size() + 1L);
          list.add(checkIndex(Integer.parseInt(t)));
        }
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(format(" Could not parse pattern indices %s.", value), e);
      }
    }
    return new PatternSelection(Collections.unmodifiableList(list));
  }

  /**
   * Convert a loosely typed selection. Accepted values are null or "all" (every pattern), a
   * String understood by {@link #parse(String)}, an integral number (Integer, Long, Short or Byte)
   * within the int range, an int[], or an Iterable of such numbers.
   *
   * @param value the selection.
   * @return the PatternSelection.
   * @throws IllegalArgumentException for any other value.
   */
  public static PatternSelection from(Object value) {
    if (value == null) {
      return ALL;
    } else if (value instanceof PatternSelection) {
      return (PatternSelection) value;
    } else if (value instanceof String) {
      return parse((String) value);
    } else if (isIntegral(value)) {
      return of(toIndex(value));
    } else if (value instanceof int[]) {
      return of((int[]) value);
    } else if (value instanceof Iterable) {
      List<Integer> list = new ArrayList<>();
      for (Object o : (Iterable<?>) value) {
        list.add(toIndex(o));
      }
      return of(list);
    }
    throw new IllegalArgumentException(format(
        " Pattern indices must be \"all\", an integer or a sequence of integers, found %s.",
        value.getClass().getSimpleName()));
  }

  /**
   * True if every pattern is selected.
   *
   * @return true for "all".
   */
  public boolean isAll() {
    return indices == null;
  }

  /**
   * The selected indices.
   *
   * @return an unmodifiable list.
   * @throws IllegalStateException if every pattern is selected.
   */
  public List<Integer> getIndices() {
    if (indices == null) {
      throw new IllegalStateException(" Every pattern is selected; there is no index list.");
    }
    return indices;
  }

  /**
   * Check if a position is selected.
   *
   * @param index a pattern index or position.
   * @return true if every pattern is selected or the index is listed.
   */
  public boolean includes(int index) {
    return indexSet == null || indexSet.contains(index);
  }

  /**
   * The number of selected patterns, or -1 when every pattern is selected.
   *
   * @return the count.
   */
  public int size() {
    return indices == null ? -1 : indices.size();
  }

  private static boolean isIntegral(Object value) {
    return value instanceof Integer || value instanceof Long || value instanceof Short
        || value instanceof Byte;
  }

  private static int toIndex(Object value) {
    if (!isIntegral(value)) {
      throw new IllegalArgumentException(format(" Pattern index %s is not an integer.", value));
    }
    long index = ((Number) value).longValue();
    if (index < 0 || index > Integer.MAX_VALUE) {
      throw new IllegalArgumentException(format(" Invalid pattern index %d.", index));
    }
    return (int) index;
  }

  private static void checkParsedSize(String value, long size) {
    if (size > MAX_PARSED_INDICES) {
      throw new IllegalArgumentException(format(
          " Pattern indices %s expand to more than %d indices.", value, MAX_PARSED_INDICES));
    }
  }

  private static int checkIndex(Integer index) {
    if (index == null || index < 0) {
      throw new IllegalArgumentException(format(" Invalid pattern index %s.", index));
    }
    return index;
  }

  /** {@inheritDoc} */
  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    PatternSelection other = (PatternSelection) o;
    return Objects.equals(indices, other.indices);
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return Objects.hashCode(indices);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    if (indices == null) {
      return ALL_KEYWORD;
    }
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < indices.size(); i++) {
      if (i > 0) {
        sb.append(",");
      }
      sb.append(indices.get(i));
    }
    return sb.toString();
  }
}
