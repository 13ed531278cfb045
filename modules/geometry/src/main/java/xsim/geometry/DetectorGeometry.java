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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The DetectorGeometry class is an ordered composition of one or more {@link DetectorPanel}
 * instances. The position of a panel is its index in the serialized geometry.
 *
 * @author Michael J. Schnieders
 * @see GeometryWriter
 * @since 1.0
 */
public class DetectorGeometry {

  private final List<DetectorPanel> panels;

  /**
   * Constructor for DetectorGeometry.
   *
   * @param panels One or more panels, in serialization order.
   * @throws IllegalArgumentException if no panel is given.
   */
  public DetectorGeometry(DetectorPanel... panels) {
    this(panels == null ? null : Arrays.asList(panels));
  }

  /**
   * Constructor for DetectorGeometry.
   *
   * @param panels A non-empty list of panels, in serialization order.
   * @throws IllegalArgumentException if the list is null or empty.
   */
  public DetectorGeometry(List<DetectorPanel> panels) {
    if (panels == null || panels.isEmpty()) {
      throw new IllegalArgumentException(" A detector geometry requires at least one panel.");
    }
    List<DetectorPanel> copy = new ArrayList<>(panels.size());
    for (DetectorPanel panel : panels) {
      if (panel == null) {
        throw new IllegalArgumentException(" A detector geometry cannot contain a null panel.");
      }
      copy.add(panel);
    }
    this.panels = Collections.unmodifiableList(copy);
  }

  /**
   * The panels, in serialization order.
   *
   * @return an unmodifiable list.
   */
  public List<DetectorPanel> getPanels() {
    return panels;
  }

  /**
   * getPanel
   *
   * @param index an int.
   * @return a {@link DetectorPanel} object.
   */
  public DetectorPanel getPanel(int index) {
    return panels.get(index);
  }

  /**
   * getNumberOfPanels
   *
   * @return an int.
   */
  public int getNumberOfPanels() {
    return panels.size();
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
    return panels.equals(((DetectorGeometry) o).panels);
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return panels.hashCode();
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(" Detector geometry with " + panels.size() + " panel(s)");
    for (int i = 0; i < panels.size(); i++) {
      sb.append("\n  ").append(i).append(":").append(panels.get(i));
    }
    return sb.toString();
  }
}
