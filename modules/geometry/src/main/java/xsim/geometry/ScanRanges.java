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
package xsim.geometry;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static java.lang.String.format;

/**
 * Inclusive fast-scan and slow-scan pixel bounds of a panel within the data array.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class ScanRanges {

  public static final String FAST_SCAN_MIN = "fast_scan_min";
  public static final String FAST_SCAN_MAX = "fast_scan_max";
  public static final String SLOW_SCAN_MIN = "slow_scan_min";
  public static final String SLOW_SCAN_MAX = "slow_scan_max";

  public final int fastScanMin;
  public final int fastScanMax;
  public final int slowScanMin;
  public final int slowScanMax;

  /**
   * Constructor for ScanRanges.
   *
   * @param fastScanMin first fast-scan pixel.
   * @param fastScanMax last fast-scan pixel.
   * @param slowScanMin first slow-scan pixel.
   * @param slowScanMax last slow-scan pixel.
   * @throws IllegalArgumentException if a bound is negative or a maximum precedes its minimum.
   */
  public ScanRanges(int fastScanMin, int fastScanMax, int slowScanMin, int slowScanMax) {
    check("fast scan", fastScanMin, fastScanMax);
    check("slow scan", slowScanMin, slowScanMax);
    this.fastScanMin = fastScanMin;
    this.fastScanMax = fastScanMax;
    this.slowScanMin = slowScanMin;
    this.slowScanMax = slowScanMax;
  }

  /**
   * Build ranges from a mapping keyed by fast_scan_min, fast_scan_max, slow_scan_min and
   * slow_scan_max.
   *
   * @param ranges the mapping.
   * @return a {@link ScanRanges}.
   * @throws IllegalArgumentException if a key is missing.
   */
  public static ScanRanges fromMap(Map<String, Integer> ranges) {
    return new ScanRanges(require(ranges, FAST_SCAN_MIN), require(ranges, FAST_SCAN_MAX),
        require(ranges, SLOW_SCAN_MIN), require(ranges, SLOW_SCAN_MAX));
  }

  private static int require(Map<String, Integer> ranges, String key) {
    Integer value = ranges.get(key);
    if (value == null) {
      throw new IllegalArgumentException(format(" The panel ranges are missing %s.", key));
    }
    return value;
  }

  private static void check(String axis, int min, int max) {
    if (min < 0 || max < 0) {
      throw new IllegalArgumentException(
          format(" The %s range [%d, %d] must be non-negative.", axis, min, max));
    }
    if (max < min) {
      throw new IllegalArgumentException(
          format(" The %s maximum %d is less than the minimum %d.", axis, max, min));
    }
  }

  /**
   * Number of pixels along the fast-scan axis.
   *
   * @return fastScanMax - fastScanMin + 1.
   */
  public int fastScanPixels() {
    return fastScanMax - fastScanMin + 1;
  }

  /**
   * Number of pixels along the slow-scan axis.
   *
   * @return slowScanMax - slowScanMin + 1.
   */
  public int slowScanPixels() {
    return slowScanMax - slowScanMin + 1;
  }

  /**
   * The ranges as an ordered mapping.
   *
   * @return a new map.
   */
  public Map<String, Integer> toMap() {
    Map<String, Integer> map = new LinkedHashMap<>();
    map.put(FAST_SCAN_MIN, fastScanMin);
    map.put(FAST_SCAN_MAX, fastScanMax);
    map.put(SLOW_SCAN_MIN, slowScanMin);
    map.put(SLOW_SCAN_MAX, slowScanMax);
    return map;
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
    ScanRanges that = (ScanRanges) o;
    return fastScanMin == that.fastScanMin && fastScanMax == that.fastScanMax
        && slowScanMin == that.slowScanMin && slowScanMax == that.slowScanMax;
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return Objects.hash(fastScanMin, fastScanMax, slowScanMin, slowScanMax);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return toMap().toString();
  }
}
