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

import java.util.Objects;

import static java.lang.String.format;

/**
 * An immutable magnitude tagged with a physical {@link Unit}.
 * <p>
 * Equality and ordering compare the magnitudes after conversion to the base unit of the dimension,
 * and the comparison of the converted doubles is exact. <code>0.13 m</code> and <code>130 mm</code>
 * are equal because both convert to the same double; two magnitudes whose conversions differ in the
 * last bit are not. Use {@link #in(Unit)} with a tolerance for approximate comparison. Arithmetic and
 * ordering between quantities of different dimensions throw an IllegalArgumentException; equals
 * simply returns false.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class Quantity implements Comparable<Quantity> {

  private final double magnitude;
  private final Unit unit;

  /**
   * Constructor for Quantity.
   *
   * @param magnitude The magnitude.
   * @param unit      The unit of the magnitude.
   */
  public Quantity(double magnitude, Unit unit) {
    if (unit == null) {
      throw new IllegalArgumentException(" A quantity requires a unit.");
    }
    this.magnitude = magnitude;
    this.unit = unit;
  }

  /**
   * Static factory equivalent to <code>new Quantity(magnitude, unit)</code>.
   *
   * @param magnitude The magnitude.
   * @param unit      The unit.
   * @return a {@link Quantity}.
   */
  public static Quantity of(double magnitude, Unit unit) {
    return new Quantity(magnitude, unit);
  }

  public double getMagnitude() {
    return magnitude;
  }

  public Unit getUnit() {
    return unit;
  }

  public Dimension getDimension() {
    return unit.dimension;
  }

  /**
   * The magnitude expressed in the base unit of this quantity's dimension.
   *
   * @return the magnitude in meters or electron volts.
   */
  public double baseMagnitude() {
    return unit.toBase(magnitude);
  }

  /**
   * The magnitude expressed in another unit of the same dimension.
   *
   * @param target The unit to convert into.
   * @return the converted magnitude.
   */
  public double in(Unit target) {
    requireDimension(target.dimension);
    if (target == unit) {
      return magnitude;
    }
    return target.fromBase(unit.toBase(magnitude));
  }

  /**
   * Convert this quantity into another unit of the same dimension.
   *
   * @param target The unit to convert into.
   * @return a new {@link Quantity}.
   */
  public Quantity to(Unit target) {
    return new Quantity(in(target), target);
  }

  /**
   * Scale the magnitude.
   *
   * @param factor The scale factor.
   * @return a new {@link Quantity} in the same unit.
   */
  public Quantity times(double factor) {
    return new Quantity(magnitude * factor, unit);
  }

  /**
   * Add a quantity of the same dimension. The result is expressed in this quantity's unit.
   *
   * @param other The quantity to add.
   * @return the sum.
   */
  public Quantity plus(Quantity other) {
    return new Quantity(magnitude + other.in(unit), unit);
  }

  /**
   * Subtract a quantity of the same dimension. The result is expressed in this quantity's unit.
   *
   * @param other The quantity to subtract.
   * @return the difference.
   */
  public Quantity minus(Quantity other) {
    return new Quantity(magnitude - other.in(unit), unit);
  }

  /**
   * Check the dimension of this quantity.
   *
   * @param dimension The required dimension.
   * @return this quantity.
   * @throws IllegalArgumentException if the dimensions differ.
   */
  public Quantity requireDimension(Dimension dimension) {
    if (unit.dimension != dimension) {
      throw new IllegalArgumentException(
          format(" Expected a quantity of dimension %s, but %s has dimension %s.", dimension,
              this, unit.dimension));
    }
    return this;
  }

  /** {@inheritDoc} */
  @Override
  public int compareTo(Quantity other) {
    other.requireDimension(unit.dimension);
    return Double.compare(baseMagnitude(), other.baseMagnitude());
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
    Quantity quantity = (Quantity) o;
    return unit.dimension == quantity.unit.dimension
        && Double.compare(baseMagnitude(), quantity.baseMagnitude()) == 0;
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return Objects.hash(unit.dimension, baseMagnitude());
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return magnitude + " " + unit.symbol;
  }
}
