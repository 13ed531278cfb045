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
import java.util.LinkedHashMap;
import java.util.Map;

import static java.lang.String.format;

/**
 * The beam and geometry parameters of a diffraction simulation, as stored under
 * <code>/params/beam</code> and <code>/params/geom</code>. Values are kept exactly as read: a
 * boxed scalar or a primitive array.
 *
 * @author Michael J. Schnieders
 * @see ParameterStore
 * @since 1.0
 */
public class DiffractionParameters {

  /** Name of the beam parameter group. */
  public static final String BEAM = "beam";
  /** Name of the geometry parameter group. */
  public static final String GEOM = "geom";

  /** Photon energy (eV). */
  public static final String PHOTON_ENERGY = "photonEnergy";
  /** Pixel width (m). */
  public static final String PIXEL_WIDTH = "pixelWidth";
  /** Sample to detector distance (m). */
  public static final String DETECTOR_DIST = "detectorDist";
  /** Detector mask; its first dimension gives the number of pixels along one edge. */
  public static final String MASK = "mask";

  private final Map<String, Object> beam;
  private final Map<String, Object> geom;

  /**
   * Constructor for DiffractionParameters.
   *
   * @param beam Beam parameters.
   * @param geom Geometry parameters.
   */
  public DiffractionParameters(Map<String, Object> beam, Map<String, Object> geom) {
    this.beam = Collections.unmodifiableMap(new LinkedHashMap<>(beam));
    this.geom = Collections.unmodifiableMap(new LinkedHashMap<>(geom));
  }

  public Map<String, Object> getBeam() {
    return beam;
  }

  public Map<String, Object> getGeom() {
    return geom;
  }

  /**
   * The parameters as a nested mapping with the keys "beam" and "geom".
   *
   * @return a new unmodifiable mapping.
   */
  public Map<String, Map<String, Object>> toMap() {
    Map<String, Map<String, Object>> map = new LinkedHashMap<>();
    map.put(BEAM, beam);
    map.put(GEOM, geom);
    return Collections.unmodifiableMap(map);
  }

  /**
   * getBeamScalar
   *
   * @param name a beam parameter name.
   * @return the value as a double.
   * @throws IllegalArgumentException if the parameter is absent or not a scalar.
   */
  public double getBeamScalar(String name) {
    return Frames.toScalar(require(beam, BEAM, name));
  }

  /**
   * getGeomScalar
   *
   * @param name a geometry parameter name.
   * @return the value as a double.
   * @throws IllegalArgumentException if the parameter is absent or not a scalar.
   */
  public double getGeomScalar(String name) {
    return Frames.toScalar(require(geom, GEOM, name));
  }

  /**
   * getGeomValue
   *
   * @param name a geometry parameter name.
   * @return the raw value.
   * @throws IllegalArgumentException if the parameter is absent.
   */
  public Object getGeomValue(String name) {
    return require(geom, GEOM, name);
  }

  /**
   * Photon energy in eV.
   *
   * @return beam/photonEnergy.
   */
  public double getPhotonEnergy() {
    return getBeamScalar(PHOTON_ENERGY);
  }

  /**
   * Pixel width in m.
   *
   * @return geom/pixelWidth.
   */
  public double getPixelWidth() {
    return getGeomScalar(PIXEL_WIDTH);
  }

  /**
   * Sample to detector distance in m.
   *
   * @return geom/detectorDist.
   */
  public double getDetectorDistance() {
    return getGeomScalar(DETECTOR_DIST);
  }

  /**
   * Number of pixels along one edge of the (square) detector, taken from the mask.
   *
   * @return the first dimension of geom/mask.
   */
  public int getNumberOfPixels() {
    return Frames.firstDimension(getGeomValue(MASK));
  }

  private static Object require(Map<String, Object> group, String groupName, String name) {
    Object value = group.get(name);
    if (value == null) {
      throw new IllegalArgumentException(
          format(" The %s parameters do not include %s.", groupName, name));
    }
    return value;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" Beam parameters: %s\n Geometry parameters: %s", beam.keySet(), geom.keySet());
  }
}
