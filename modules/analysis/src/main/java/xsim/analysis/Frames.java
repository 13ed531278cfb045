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

import java.lang.reflect.Array;

import static java.lang.String.format;

/**
 * Static methods that convert the typed payloads of a {@link HierarchicalStore} into the double
 * precision frames and scalars used by the analysis classes.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Frames {

  private Frames() {
    // Prevent instantiation.
  }

  /**
   * Convert a rank 2 numeric array of any primitive or boxed type to double[][].
   *
   * @param data a two dimensional array.
   * @return a new double[][], or the argument itself if it is already a double[][].
   * @throws IllegalArgumentException if the data is not a rank 2 numeric array.
   */
  public static double[][] toFrame(Object data) {
    if (data instanceof double[][]) {
      return (double[][]) data;
    }
    if (data == null || !data.getClass().isArray()
        || !data.getClass().getComponentType().isArray()) {
      throw new IllegalArgumentException(
          format(" Expected a two dimensional array, found %s.", describe(data)));
    }
    int rows = Array.getLength(data);
    double[][] frame = new double[rows][];
    for (int i = 0; i < rows; i++) {
      Object row = Array.get(data, i);
      if (row == null || !row.getClass().isArray() || row.getClass().getComponentType().isArray()) {
        throw new IllegalArgumentException(
            format(" Expected a two dimensional array, found %s.", describe(data)));
      }
      int columns = Array.getLength(row);
      frame[i] = new double[columns];
      for (int j = 0; j < columns; j++) {
        frame[i][j] = toDouble(Array.get(row, j));
      }
    }
    return frame;
  }

  /**
   * Convert a scalar payload to a double. Arrays holding exactly one element are accepted.
   *
   * @param value a {@link Number}, or an array of rank one or higher holding a single number.
   * @return the value.
   * @throws IllegalArgumentException if the value is not a single number.
   */
  public static double toScalar(Object value) {
    Object v = value;
    while (v != null && v.getClass().isArray()) {
      if (Array.getLength(v) != 1) {
        throw new IllegalArgumentException(
            format(" Expected a scalar, found %s.", describe(value)));
      }
      v = Array.get(v, 0);
    }
    return toDouble(v);
  }

  /**
   * The length of the first (slowest varying) dimension of an array.
   *
   * @param data an array.
   * @return the length.
   * @throws IllegalArgumentException if the data is not an array.
   */
  public static int firstDimension(Object data) {
    if (data == null || !data.getClass().isArray()) {
      throw new IllegalArgumentException(format(" Expected an array, found %s.", describe(data)));
    }
    return Array.getLength(data);
  }

  /**
   * Sum of all pixels of a frame.
   *
   * @param frame a frame.
   * @return the total count.
   */
  public static double sum(double[][] frame) {
    double sum = 0.0;
    for (double[] row : frame) {
      for (double v : row) {
        sum += v;
      }
    }
    return sum;
  }

  private static double toDouble(Object value) {
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    if (value instanceof Boolean) {
      return (Boolean) value ? 1.0 : 0.0;
    }
    throw new IllegalArgumentException(format(" Expected a number, found %s.", describe(value)));
  }

  private static String describe(Object value) {
    return value == null ? "null" : value.getClass().getSimpleName();
  }
}
