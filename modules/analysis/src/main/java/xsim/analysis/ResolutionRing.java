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

import java.util.Locale;

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.sqrt;
import static xsim.utilities.Constants.NM_TO_ANG;

/**
 * A circle of constant resolution on the detector, in pixel coordinates. A renderer draws it as
 * two half circle polylines and a label on the 45 degree diagonal.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class ResolutionRing {

  private final double spacing;
  private final double radius;
  private final double center;
  private final int samples;

  /**
   * Constructor for ResolutionRing.
   *
   * @param spacing Lattice spacing d (nm).
   * @param radius  Ring radius (pixels).
   * @param center  Ring center along both axes (pixels).
   * @param samples Number of points in each half circle polyline.
   */
  public ResolutionRing(double spacing, double radius, double center, int samples) {
    if (samples < 2) {
      throw new IllegalArgumentException(format(" A ring needs at least 2 samples (%d).", samples));
    }
    this.spacing = spacing;
    this.radius = radius;
    this.center = center;
    this.samples = samples;
  }

  /**
   * The lattice spacing of the ring.
   *
   * @return d in nm.
   */
  public double getSpacing() {
    return spacing;
  }

  /**
   * The radius of the ring.
   *
   * @return radius in pixels.
   */
  public double getRadius() {
    return radius;
  }

  public double getCenterX() {
    return center;
  }

  public double getCenterY() {
    return center;
  }

  /**
   * The label of the ring: the spacing in Angstrom with one decimal.
   *
   * @return the label, for example "10.0".
   */
  public String getLabel() {
    return format(Locale.US, "%2.1f", spacing * NM_TO_ANG);
  }

  public double getLabelX() {
    return center + 0.75 * radius;
  }

  public double getLabelY() {
    return center + 0.75 * radius;
  }

  /**
   * The upper half circle.
   *
   * @return {x[], y[]} with x running from center - radius to center + radius.
   */
  public double[][] getUpperHalf() {
    return halfCircle(1.0);
  }

  /**
   * The lower half circle.
   *
   * @return {x[], y[]} with x running from center - radius to center + radius.
   */
  public double[][] getLowerHalf() {
    return halfCircle(-1.0);
  }

  private double[][] halfCircle(double sign) {
    double[] x = new double[samples];
    double[] y = new double[samples];
    double step = 2.0 * radius / (samples - 1);
    for (int i = 0; i < samples; i++) {
      x[i] = center - radius + i * step;
      double dx = x[i] - center;
      // Clamp rounding error at the ends of the diameter.
      y[i] = center + sign * sqrt(max(0.0, radius * radius - dx * dx));
    }
    x[samples - 1] = center + radius;
    return new double[][] {x, y};
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(Locale.US, " Ring %s A: radius %10.3f pixels", getLabel(), radius);
  }
}
