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

import static xsim.utilities.Constants.EV_TO_JOULE;
import static xsim.utilities.Constants.METERS_TO_ANG;
import static xsim.utilities.Constants.METERS_TO_NM;

/**
 * Units of length and energy. Each unit carries the number of its own units that make up one base
 * unit of its dimension (meter for lengths, electron volt for energies).
 * <p>
 * Conversion into the base unit divides by that count, so a whole or decimal magnitude in a
 * smaller unit lands on the same double as the decimal literal in the base unit (220 um and
 * 2.2e-4 m, 130 mm and 0.13 m).
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public enum Unit {

  METER(Dimension.LENGTH, "m", 1.0),
  CENTIMETER(Dimension.LENGTH, "cm", 1.0e2),
  MILLIMETER(Dimension.LENGTH, "mm", 1.0e3),
  MICROMETER(Dimension.LENGTH, "um", 1.0e6),
  NANOMETER(Dimension.LENGTH, "nm", METERS_TO_NM),
  ANGSTROM(Dimension.LENGTH, "A", METERS_TO_ANG),
  ELECTRONVOLT(Dimension.ENERGY, "eV", 1.0),
  KILOELECTRONVOLT(Dimension.ENERGY, "keV", 1.0e-3),
  JOULE(Dimension.ENERGY, "J", EV_TO_JOULE);

  /** The dimension of this unit. */
  public final Dimension dimension;
  /** The unit symbol. */
  public final String symbol;
  /** Number of these units in one base unit. */
  public final double perBase;

  Unit(Dimension dimension, String symbol, double perBase) {
    this.dimension = dimension;
    this.symbol = symbol;
    this.perBase = perBase;
  }

  /**
   * Express a magnitude in this unit in the base unit of the dimension.
   *
   * @param magnitude The magnitude in this unit.
   * @return the magnitude in the base unit.
   */
  public double toBase(double magnitude) {
    return magnitude / perBase;
  }

  /**
   * Express a magnitude in the base unit of the dimension in this unit.
   *
   * @param baseMagnitude The magnitude in the base unit.
   * @return the magnitude in this unit.
   */
  public double fromBase(double baseMagnitude) {
    return baseMagnitude * perBase;
  }

  /**
   * Tag a magnitude with this unit, e.g. <code>Unit.METER.times(0.13)</code>.
   *
   * @param magnitude The magnitude.
   * @return a {@link Quantity}.
   */
  public Quantity times(double magnitude) {
    return new Quantity(magnitude, this);
  }

  /**
   * The base unit of the given dimension.
   *
   * @param dimension a {@link Dimension}.
   * @return METER or ELECTRONVOLT.
   */
  public static Unit baseUnit(Dimension dimension) {
    switch (dimension) {
      case LENGTH:
        return METER;
      case ENERGY:
      default:
        return ELECTRONVOLT;
    }
  }
}
