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
import java.util.logging.Logger;

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.min;
import static org.apache.commons.math3.util.FastMath.sqrt;

/**
 * Statistics of the total photon count of each frame in a stack of diffraction patterns.
 * <p>
 * Frames are consumed one at a time, so the stack never has to fit in memory. The mean and
 * variance are accumulated with Welford's algorithm and the sum is Kahan compensated. The
 * reported standard deviation is the population (not sample) value.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class PhotonStatistics {

  private static final Logger logger = Logger.getLogger(PhotonStatistics.class.getName());

  /** Upper limit on the number of histogram bins. */
  public static final int MAX_BINS = 20;

  private double[] photons = new double[16];
  private int count = 0;
  private double mean = 0.0;
  private double var = 0.0;
  private double sum = 0.0;
  private double comp = 0.0;
  private double min = Double.POSITIVE_INFINITY;
  private double max = Double.NEGATIVE_INFINITY;

  /**
   * Compute the statistics of a stack of frames.
   *
   * @param frames the frames.
   * @throws IllegalStateException if there are no frames.
   */
  public PhotonStatistics(Iterable<double[][]> frames) {
    for (double[][] frame : frames) {
      addValue(Frames.sum(frame));
    }
    if (count == 0) {
      throw new IllegalStateException(" Photon statistics require at least one frame.");
    }
    logger.info(toString());
  }

  /**
   * Compute the statistics of known per-frame photon counts.
   *
   * @param photons Total photon count of each frame.
   * @return the PhotonStatistics.
   * @throws IllegalStateException if there are no counts.
   */
  public static PhotonStatistics fromCounts(double... photons) {
    double[][][] frames = new double[photons.length][1][1];
    for (int i = 0; i < photons.length; i++) {
      frames[i][0][0] = photons[i];
    }
    return new PhotonStatistics(Arrays.asList(frames));
  }

  private void addValue(double val) {
    if (count == photons.length) {
      photons = Arrays.copyOf(photons, 2 * count);
    }
    photons[count++] = val;
    double priorMean = mean;
    double y = val - comp;
    double t = sum + y;
    comp = (t - sum) - y;
    sum = t;
    min = min(min, val);
    max = max(max, val);
    mean += (val - mean) / count;
    var += (val - priorMean) * (val - mean);
  }

  /**
   * The number of frames.
   *
   * @return the frame count.
   */
  public int getNumberOfFrames() {
    return count;
  }

  /**
   * The total photon count of each frame, in iteration order.
   *
   * @return a new array.
   */
  public double[] getPhotons() {
    return Arrays.copyOf(photons, count);
  }

  public double getMean() {
    return mean;
  }

  public double getPopulationVariance() {
    return var / count;
  }

  public double getStandardDeviation() {
    return sqrt(getPopulationVariance());
  }

  public double getMin() {
    return min;
  }

  public double getMax() {
    return max;
  }

  /**
   * The photon count summed over every frame.
   *
   * @return the total.
   */
  public double getSum() {
    return sum;
  }

  /**
   * Histogram of the per-frame counts, with min(20, number of frames) equal width bins.
   *
   * @return the PhotonHistogram.
   */
  public PhotonHistogram getHistogram() {
    return PhotonHistogram.bin(getPhotons(), Math.min(MAX_BINS, count));
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(Locale.US, " Photons over %d frames: avg = %.6g, std = %.6g, min = %.6g, max = %.6g",
        count, mean, getStandardDeviation(), min, max);
  }
}
