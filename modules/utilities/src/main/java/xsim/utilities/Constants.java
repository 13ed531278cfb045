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
package xsim.utilities;

/**
 * Library class containing the physical constants and conversion factors used to relate beam
 * energies, wavelengths and detector lengths.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Constants {

  // SI units: kg, m, s, C, K, mol, lm
  // Our typical units: eV for photon energies, nm for wavelengths and lattice spacings,
  // m for detector distances and pixel sizes.

  /**
   * Elementary charge in Coulombs, defining the Coulomb. <code>
   *  ELEMENTARY_CHARGE_SI=1.602176634E-19d</code>
   */
  public static final double ELEMENTARY_CHARGE_SI = 1.602176634E-19d;
  /**
   * Product of the Planck constant and the speed of light in eV*nm, as used to convert a photon
   * energy in eV into a wavelength in nm. <code>HC_EV_NM=1239.8</code>
   *
   * <p>The exact value is 1239.84198; the truncated value is retained so that wavelengths agree
   * with the simulation codes that produced the data.
   */
  public static final double HC_EV_NM = 1239.8;
  /** Constant <code>EV_TO_JOULE=ELEMENTARY_CHARGE_SI</code> */
  public static final double EV_TO_JOULE = ELEMENTARY_CHARGE_SI;
  /** Constant <code>METERS_TO_ANG=1E10</code> */
  public static final double METERS_TO_ANG = 1E10;
  /** Constant <code>METERS_TO_NM=1E9</code> */
  public static final double METERS_TO_NM = 1E9;
  /** Constant <code>NM_TO_ANG=10</code> */
  public static final double NM_TO_ANG = 10.0;

  // Library class: make the default constructor private to ensure it's never constructed.
  private Constants() {}
}
