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

import static java.lang.String.format;

/**
 * Pixel-wise reductions of a stack of frames to a single frame.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public enum PatternReduction {
  SUM, MEAN, MAX, MIN;

  /**
   * Reduce frames, one at a time.
   *
   * @param frames the frames, all of the same shape.
   * @return the reduced frame.
   * @throws IllegalArgumentException if the frames differ in shape.
   * @throws IllegalStateException    if there are no frames.
   */
  public double[][] reduce(Iterable<double[][]> frames) {
    double[][] result = null;
    int count = 0;
    for (double[][] frame : frames) {
      if (result == null) {
        result = new double[frame.length][];
        for (int i = 0; i < frame.length; i++) {
          result[i] = frame[i].clone();
        }
      } else {
        accumulate(result, frame);
      }
      count++;
    }
    if (result == null) {
      throw new IllegalStateException(format(" No frames to reduce with %s.", this));
    }
    if (this == MEAN) {
      for (double[] row : result) {
        for (int j = 0; j < row.length; j++) {
          row[j] /= count;
        }
      }
    }
    return result;
  }

  private void accumulate(double[][] result, double[][] frame) {
    if (frame.length != result.length) {
      throw new IllegalArgumentException(
          format(" Frame has %d rows; expected %d.", frame.length, result.length));
    }
    for (int i = 0; i < result.length; i++) {
      double[] r = result[i];
      double[] f = frame[i];
      if (f.length != r.length) {
        throw new IllegalArgumentException(
            format(" Frame row %d has %d columns; expected %d.", i, f.length, r.length));
      }
      for (int j = 0; j < r.length; j++) {
        switch (this) {
          case MAX:
            r[j] = Math.max(r[j], f[j]);
            break;
          case MIN:
            r[j] = Math.min(r[j], f[j]);
            break;
          case SUM:
          case MEAN:
          default:
            r[j] += f[j];
            break;
        }
      }
    }
  }
}
