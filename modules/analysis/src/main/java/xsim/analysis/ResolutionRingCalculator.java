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
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

import org.apache.commons.configuration2.CompositeConfiguration;

import static java.lang.Double.isFinite;
import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.asin;
import static org.apache.commons.math3.util.FastMath.atan;
import static org.apache.commons.math3.util.FastMath.ceil;
import static org.apache.commons.math3.util.FastMath.sin;
import static xsim.utilities.Constants.HC_EV_NM;

/**
 * The ResolutionRingCalculator places resolution rings on a square detector.
 * <p>
 * From the photon energy E (eV) the wavelength is lambda = 1239.8 / E (nm). The largest
 * scattering angle is theta = atan(0.5 * N * p / D) for N pixels of width p at distance D, giving
 * a resolution limit of 0.5 * lambda / sin(theta). A ring for lattice spacing d has a radius of
 * (D / p) * atan(asin(lambda / 2d)) pixels and is centered on the detector.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class ResolutionRingCalculator {

  private static final Logger logger = Logger.getLogger(ResolutionRingCalculator.class.getName());

  /** Property listing the ring spacings in nm. */
  public static final String RING_SPACINGS = "resolution-ring-spacings";
  /** Property giving the number of points in each half circle. */
  public static final String RING_SAMPLES = "resolution-ring-samples";

  /** Ring spacings (nm) used by default. */
  public static final double[] DEFAULT_SPACINGS = {1.0, 0.5, 0.3};
  /** Points in each half circle used by default. */
  public static final int DEFAULT_SAMPLES = 512;

  private final double[] spacings;
  private final int samples;

  /** Constructor for a ResolutionRingCalculator with the default rings. */
  public ResolutionRingCalculator() {
    this(DEFAULT_SPACINGS, DEFAULT_SAMPLES);
  }

  /**
   * Constructor for ResolutionRingCalculator.
   *
   * @param spacings Ring spacings (nm).
   * @param samples  Points in each half circle.
   * @throws IllegalArgumentException if a spacing is not positive or samples is less than 2.
   */
  public ResolutionRingCalculator(double[] spacings, int samples) {
    if (spacings == null || spacings.length == 0) {
      throw new IllegalArgumentException(" At least one ring spacing is required.");
    }
    for (double d : spacings) {
      if (!(d > 0.0) || !isFinite(d)) {
        throw new IllegalArgumentException(format(" Invalid ring spacing %s.", d));
      }
    }
    if (samples < 2) {
      throw new IllegalArgumentException(format(" Invalid number of ring samples %d.", samples));
    }
    this.spacings = Arrays.copyOf(spacings, spacings.length);
    this.samples = samples;
  }

  /**
   * Constructor for a ResolutionRingCalculator configured by properties.
   *
   * @param properties the configuration ({@link #RING_SPACINGS} and {@link #RING_SAMPLES}).
   */
  public ResolutionRingCalculator(CompositeConfiguration properties) {
    this(parseSpacings(properties), properties == null ? DEFAULT_SAMPLES
        : properties.getInt(RING_SAMPLES, DEFAULT_SAMPLES));
  }

  public double[] getSpacings() {
    return Arrays.copyOf(spacings, spacings.length);
  }

  public int getSamples() {
    return samples;
  }

  /**
   * Compute the rings for a set of diffraction parameters.
   *
   * @param parameters Needs beam/photonEnergy, geom/pixelWidth, geom/detectorDist and geom/mask.
   * @return the ResolutionRingSet.
   * @throws ArithmeticException if the parameters are outside the domain of the calculation.
   */
  public ResolutionRingSet calculate(DiffractionParameters parameters) {
    return calculate(parameters.getPhotonEnergy(), parameters.getPixelWidth(),
        parameters.getDetectorDistance(), parameters.getNumberOfPixels());
  }

  /**
   * Compute the rings.
   *
   * @param photonEnergy     Photon energy (eV).
   * @param pixelWidth       Pixel width (m).
   * @param detectorDistance Sample to detector distance (m).
   * @param numberOfPixels   Detector edge length (pixels).
   * @return the ResolutionRingSet.
   * @throws ArithmeticException if the parameters are outside the domain of the calculation.
   */
  public ResolutionRingSet calculate(double photonEnergy, double pixelWidth,
      double detectorDistance, int numberOfPixels) {
    if (!(detectorDistance > 0.0)) {
      throw new ArithmeticException(
          format(" The detector distance must be positive (%s m).", detectorDistance));
    }
    if (!(pixelWidth > 0.0)) {
      throw new ArithmeticException(format(" The pixel width must be positive (%s m).", pixelWidth));
    }
    if (numberOfPixels <= 0) {
      throw new ArithmeticException(
          format(" The detector must have at least one pixel (%d).", numberOfPixels));
    }
    double lambda = wavelength(photonEnergy);
    double thetaMax = atan(0.5 * numberOfPixels * pixelWidth / detectorDistance);
    double dMin = 0.5 * lambda / sin(thetaMax);
    // Round up to the next whole Angstrom.
    double d0 = 0.1 * ceil(dMin * 10.0);

    double center = 0.5 * numberOfPixels;
    List<ResolutionRing> rings = new ArrayList<>(spacings.length);
    for (double d : spacings) {
      double radius = ringRadius(lambda, d, pixelWidth, detectorDistance);
      rings.add(new ResolutionRing(d, radius, center, samples));
    }
    ResolutionRingSet ringSet = new ResolutionRingSet(lambda, thetaMax, dMin, d0, numberOfPixels,
        rings);
    logger.fine(ringSet.toString());
    return ringSet;
  }

  /**
   * Photon wavelength.
   *
   * @param photonEnergy Photon energy (eV).
   * @return the wavelength (nm).
   * @throws ArithmeticException if the energy is not positive.
   */
  public static double wavelength(double photonEnergy) {
    if (!(photonEnergy > 0.0)) {
      throw new ArithmeticException(
          format(" The photon energy must be positive (%s eV).", photonEnergy));
    }
    return HC_EV_NM / photonEnergy;
  }

  /**
   * Radius of the ring for a lattice spacing.
   *
   * @param wavelength       Photon wavelength (nm).
   * @param spacing          Lattice spacing (nm).
   * @param pixelWidth       Pixel width (m).
   * @param detectorDistance Sample to detector distance (m).
   * @return the radius (pixels).
   * @throws ArithmeticException if lambda / 2d exceeds 1.
   */
  public static double ringRadius(double wavelength, double spacing, double pixelWidth,
      double detectorDistance) {
    double sinTheta = wavelength / (2.0 * spacing);
    if (!(sinTheta <= 1.0) || sinTheta < 0.0) {
      throw new ArithmeticException(format(
          " A spacing of %s nm cannot be resolved at a wavelength of %s nm.", spacing, wavelength));
    }
    return detectorDistance / pixelWidth * atan(asin(sinTheta));
  }

  private static double[] parseSpacings(CompositeConfiguration properties) {
    if (properties == null || !properties.containsKey(RING_SPACINGS)) {
      return DEFAULT_SPACINGS;
    }
    String[] values = properties.getStringArray(RING_SPACINGS);
    double[] spacings = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      try {
        spacings[i] = Double.parseDouble(values[i].trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(
            format(" Could not parse ring spacing %s.", values[i]), e);
      }
    }
    return spacings;
  }
}
