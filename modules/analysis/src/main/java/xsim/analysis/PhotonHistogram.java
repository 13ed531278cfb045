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

import java.util.Arrays;
import java.util.Locale;

import static java.lang.String.format;

/**
 * A histogram of photon counts with equal width bins. Bin i covers [edge i, edge i+1); the last
 * bin also includes its upper edge.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class PhotonHistogram {

  private final double[] edges;
  private final int[] counts;

  /**
   * Constructor for PhotonHistogram.
   *
   * @param edges  Bin edges (one more than the number of bins).
   * @param counts Number of values in each bin.
   */
  public PhotonHistogram(double[] edges, int[] counts) {
    if (edges.length != counts.length + 1) {
      throw new IllegalArgumentException(
          format(" %d bins need %d edges (found %d).", counts.length, counts.length + 1,
              edges.length));
    }
    this.edges = Arrays.copyOf(edges, edges.length);
    this.counts = Arrays.copyOf(counts, counts.length);
  }

  /**
   * Bin values into a histogram with a number of equal width bins spanning [min, max]. When every
   * value is the same a single bin [min, min + 1) is used.
   *
   * @param values         the values.
   * @param numberOfBins   the number of bins.
   * @return the PhotonHistogram.
   */
  public static PhotonHistogram bin(double[] values, int numberOfBins) {
    if (values.length == 0) {
      throw new IllegalArgumentException(" A histogram needs at least one value.");
    }
    if (numberOfBins < 1) {
      throw new IllegalArgumentException(format(" Invalid number of bins %d.", numberOfBins));
    }
    double min = values[0];
    double max = values[0];
    for (double v : values) {
      min = Math.min(min, v);
      max = Math.max(max, v);
    }
    if (max == min) {
      return new PhotonHistogram(new double[] {min, min + 1.0}, new int[] {values.length});
    }
    double width = (max - min) / numberOfBins;
    double[] edges = new double[numberOfBins + 1];
    for (int i = 0; i < numberOfBins; i++) {
      edges[i] = min + i * width;
    }
    edges[numberOfBins] = max;
    int[] counts = new int[numberOfBins];
    for (double v : values) {
      int bin = (int) ((v - min) / width);
      counts[Math.min(bin, numberOfBins - 1)]++;
    }
    return new PhotonHistogram(edges, counts);
  }

  public int getNumberOfBins() {
    return counts.length;
  }

  public double[] getEdges() {
    return Arrays.copyOf(edges, edges.length);
  }

  public int[] getCounts() {
    return Arrays.copyOf(counts, counts.length);
  }

  public double getBinWidth() {
    return edges[1] - edges[0];
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(" Photon number histogram\n");
    for (int i = 0; i < counts.length; i++) {
      sb.append(format(Locale.US, " [%14.4f, %14.4f%s %8d\n", edges[i], edges[i + 1],
          i == counts.length - 1 ? "]" : ")", counts[i]));
    }
    return sb.toString();
  }
}
