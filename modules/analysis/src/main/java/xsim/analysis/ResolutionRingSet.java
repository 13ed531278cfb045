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

import java.util.Collections;
import java.util.List;
import java.util.Locale;

import static java.lang.String.format;

/**
 * The resolution rings of a detector together with the quantities they were derived from.
 *
 * @author Michael J. Schnieders
 * @see ResolutionRingCalculator
 * @since 1.0
 */
public class ResolutionRingSet {

  private final double wavelength;
  private final double thetaMax;
  private final double minimumSpacing;
  private final double roundedSpacing;
  private final int numberOfPixels;
  private final List<ResolutionRing> rings;

  /**
   * Constructor for ResolutionRingSet.
   *
   * @param wavelength     Photon wavelength (nm).
   * @param thetaMax       Largest scattering angle seen by the detector (radians).
   * @param minimumSpacing Smallest resolvable lattice spacing (nm).
   * @param roundedSpacing The minimum spacing rounded up to a whole Angstrom (nm).
   * @param numberOfPixels Detector edge length (pixels).
   * @param rings          The rings.
   */
  public ResolutionRingSet(double wavelength, double thetaMax, double minimumSpacing,
      double roundedSpacing, int numberOfPixels, List<ResolutionRing> rings) {
    this.wavelength = wavelength;
    this.thetaMax = thetaMax;
    this.minimumSpacing = minimumSpacing;
    this.roundedSpacing = roundedSpacing;
    this.numberOfPixels = numberOfPixels;
    this.rings = Collections.unmodifiableList(rings);
  }

  public double getWavelength() {
    return wavelength;
  }

  public double getThetaMax() {
    return thetaMax;
  }

  public double getMinimumSpacing() {
    return minimumSpacing;
  }

  public double getRoundedSpacing() {
    return roundedSpacing;
  }

  public int getNumberOfPixels() {
    return numberOfPixels;
  }

  /**
   * Pixel coordinate of the detector center along both axes.
   *
   * @return half the number of pixels.
   */
  public double getCenter() {
    return 0.5 * numberOfPixels;
  }

  public List<ResolutionRing> getRings() {
    return rings;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(format(Locale.US,
        " Wavelength %8.5f nm, maximum angle %8.5f rad, resolution limit %8.5f nm (%3.1f nm)\n",
        wavelength, thetaMax, minimumSpacing, roundedSpacing));
    for (ResolutionRing ring : rings) {
      sb.append(ring).append("\n");
    }
    return sb.toString();
  }
}
