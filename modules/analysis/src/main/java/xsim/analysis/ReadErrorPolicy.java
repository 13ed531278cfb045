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
 * What a {@link PatternStore} does when a single frame cannot be read.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public enum ReadErrorPolicy {

  /** Log the failure, skip the frame and continue with the next one. */
  SKIP,

  /** Abort the iteration. */
  FAIL;

  /**
   * Parse a policy name, ignoring case.
   *
   * @param value "skip" or "fail".
   * @return the ReadErrorPolicy.
   * @throws IllegalArgumentException for any other value.
   */
  public static ReadErrorPolicy parse(String value) {
    if (value != null) {
      for (ReadErrorPolicy policy : values()) {
        if (policy.name().equalsIgnoreCase(value.trim())) {
          return policy;
        }
      }
    }
    throw new IllegalArgumentException(
        format(" Unknown read error policy %s (expected skip or fail).", value));
  }
}
