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

import java.io.File;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

import org.junit.Test;
import xsim.utilities.XSimTest;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

/**
 * @author Michael J. Schnieders
 */
public class DetectorGeometryTest extends XSimTest {

  private final DetectorPanel upper = DetectorPanel.builder()
      .ranges(0, 511, 0, 511)
      .pixelSize(Unit.METER.times(2.2e-4))
      .distanceFromInteractionPlane(Unit.METER.times(0.13))
      .corners(-512, 0)
      .build();

  private final DetectorPanel lower = DetectorPanel.builder()
      .ranges(0, 511, 512, 1023)
      .pixelSize(Unit.MICROMETER.times(100.0))
      .distanceFromInteractionPlane(Unit.METER.times(0.25))
      .corners(-512, -512)
      .build();

  @Test(expected = IllegalArgumentException.class)
  public void testDefaultConstruction() {
    new DetectorGeometry();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyListConstruction() {
    new DetectorGeometry(new ArrayList<>());
  }

  @Test
  public void testShapedConstruction() {
    DetectorPanel panel = new DetectorPanel();
    DetectorGeometry geometry = new DetectorGeometry(panel);
    assertEquals(1, geometry.getNumberOfPanels());
    assertEquals(panel, geometry.getPanels().get(0));
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testPanelsAreNotModifiable() {
    new DetectorGeometry(upper).getPanels().add(lower);
  }

  @Test
  public void testPanelOrder() {
    String text = new GeometryWriter(new DetectorGeometry(List.of(upper, lower)))
        .toGeometryString();
    int first = text.indexOf(";panel 0\n");
    int second = text.indexOf(";panel 1\n");
    assertTrue(first == 0);
    assertTrue(second > first);
    assertEquals(upper.toGeometryString(0) + lower.toGeometryString(1), text);
    assertTrue(text.contains("panel1/clen          = 2.5000000e-01\n"));
    assertTrue(text.contains("panel1/res           = 1.0000000e+04\n"));
    assertTrue(text.contains("panel1/corner_y      = -512\n"));
  }

  @Test
  public void testSerializationIsIdempotent() throws IOException {
    DetectorGeometry geometry = new DetectorGeometry(upper, lower);
    GeometryWriter writer = new GeometryWriter(geometry);
    StringWriter first = new StringWriter();
    StringWriter second = new StringWriter();
    writer.write(first);
    writer.write(second);
    assertEquals(first.toString(), second.toString());
  }

  @Test
  public void testWriteFile() throws IOException {
    File file = registerTemporaryDirectory().resolve("detector.geom").toFile();
    DetectorGeometry geometry = new DetectorGeometry(upper, lower);
    new GeometryWriter(geometry).write(file);
    assertEquals(new GeometryWriter(geometry).toGeometryString(),
        Files.readString(file.toPath(), StandardCharsets.UTF_8));
  }
}
