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

import org.junit.Test;
import xsim.utilities.XSimTest;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

/**
 * @author Michael J. Schnieders
 */
public class GeometryFilterTest extends XSimTest {

  private final DetectorPanel panel = DetectorPanel.builder()
      .ranges(0, 511, 512, 1024)
      .pixelSize(Unit.METER.times(2.2e-4))
      .distanceFromInteractionPlane(Unit.METER.times(0.13))
      .corners(-512, -256)
      .build();

  @Test
  public void testReadWrittenGeometry() throws IOException {
    DetectorPanel second = DetectorPanel.builder(panel).corners(0, -256).build();
    DetectorGeometry geometry = new DetectorGeometry(panel, second);
    File file = registerTemporaryDirectory().resolve("detector.geom").toFile();
    new GeometryWriter(geometry).write(file);

    DetectorGeometry read = new GeometryFilter().readFile(file);
    assertEquals(2, read.getNumberOfPanels());
    DetectorPanel first = read.getPanel(0);
    assertEquals(panel.getRanges(), first.getRanges());
    assertEquals(panel.getCorners(), first.getCorners());
    assertEquals(0.13, first.getCameraLengthMeters(), 0.0);
    assertEquals(2.2e-4, first.getPixelSize().in(Unit.METER), 1.0e-12);
    assertEquals(0, read.getPanel(1).getCorners().x);

    // Serializing the geometry that was read reproduces the file.
    assertEquals(new GeometryWriter(geometry).toGeometryString(),
        new GeometryWriter(read).toGeometryString());
  }

  @Test
  public void testGlobalsAndOptionalFields() throws IOException {
    String text = "; Two panel detector\n"
        + "clen = 0.2\n"
        + "res = 10000\n"
        + "adu_per_photon = 2.5\n"
        + "\n"
        + "a/min_fs = 0\n"
        + "a/max_fs = 99\n"
        + "a/min_ss = 0\n"
        + "a/max_ss = 49\n"
        + "a/fast_scan_xyz = -1.0*x\n"
        + "a/badrow_direction = f\n"
        + "a/mask_good = 0x01\n"
        + "b/min_fs = 0\n"
        + "b/max_fs = 99\n"
        + "b/min_ss = 50\n"
        + "b/max_ss = 99  ; lower half\n"
        + "b/clen = 0.3\n"
        + "b/no_index = 1\n"
        + "b/unknown_field = 7\n";
    DetectorGeometry geometry = new GeometryFilter().parse(text);
    DetectorPanel a = geometry.getPanel(0);
    DetectorPanel b = geometry.getPanel(1);
    assertEquals(0.2, a.getCameraLengthMeters(), 0.0);
    assertEquals(0.3, b.getCameraLengthMeters(), 0.0);
    assertEquals(1.0e-4, b.getPixelSize().in(Unit.METER), 1.0e-18);
    assertEquals(2.5, b.getAduResponse(), 0.0);
    assertEquals("-1.0*x", a.getFastScanXyz());
    assertEquals(BadRowDirection.FAST_SCAN, a.getBadrowDirection());
    assertEquals(Integer.valueOf(1), a.getGoodBitMask());
    assertFalse(a.isBadregion());
    assertTrue(b.isBadregion());
    assertEquals(50, b.getRanges().slowScanMin);
    assertEquals(99, b.getRanges().slowScanMax);
  }

  @Test(expected = IOException.class)
  public void testNoPanels() throws IOException {
    new GeometryFilter().parse("clen = 0.1\n");
  }

  @Test(expected = IOException.class)
  public void testMalformedLine() throws IOException {
    new GeometryFilter().parse("panel0/min_fs 0\n");
  }

  @Test(expected = IOException.class)
  public void testInvalidPanel() throws IOException {
    new GeometryFilter().parse("panel0/min_fs = 10\npanel0/max_fs = 5\n");
  }
}
