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
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;
import xsim.utilities.XSimTest;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;

/**
 * Tests construction, equality and serialization of a single DetectorPanel.
 *
 * @author Michael J. Schnieders
 */
public class DetectorPanelTest extends XSimTest {

  private static final String REFERENCE = ";panel 0\n"
      + "panel0/min_fs        = 0\n"
      + "panel0/max_fs        = 511\n"
      + "panel0/min_ss        = 512\n"
      + "panel0/max_ss        = 1024\n"
      + "panel0/corner_x      = -512\n"
      + "panel0/corner_y      = -256\n"
      + "panel0/fast_scan_xyz = 1.0*x\n"
      + "panel0/slow_scan_xyz = 1.0*y\n"
      + "panel0/clen          = 1.3000000e-01\n"
      + "panel0/res           = 4.5454545e+03\n"
      + "\n";

  private DetectorPanel panel;

  @Before
  public void setUp() {
    panel = new DetectorPanel(
        List.of("ss", "fs"),
        new ScanRanges(0, 511, 512, 1024),
        Unit.METER.times(2.2e-4),
        1.0,
        null,
        Unit.METER.times(0.13),
        Unit.METER.times(0.0),
        DetectorPanel.DEFAULT_FAST_SCAN_XYZ,
        DetectorPanel.DEFAULT_SLOW_SCAN_XYZ,
        new Corner(-512, -256),
        1.0e4,
        null,
        null,
        null,
        null,
        false);
  }

  @Test
  public void testDefaultConstruction() {
    DetectorPanel defaults = new DetectorPanel();
    assertEquals(List.of("ss", "fs"), defaults.getDimensions());
    assertEquals("1.0*x", defaults.getFastScanXyz());
    assertEquals("1.0*y", defaults.getSlowScanXyz());
    assertEquals(Unit.METER.times(0.0), defaults.getDistanceOffset());
    assertFalse(defaults.isBadregion());
    assertEquals(new DetectorPanel(), defaults);
  }

  @Test
  public void testShapedConstruction() {
    Map<String, Integer> ranges = Map.of("fast_scan_min", 0, "fast_scan_max", 511,
        "slow_scan_min", 512, "slow_scan_max", 1024);
    assertEquals(List.of("ss", "fs"), panel.getDimensions());
    assertEquals(ranges, panel.getRanges().toMap());
    assertEquals(Unit.METER.times(2.2e-4), panel.getPixelSize());
    assertEquals(1.0, panel.getAduResponse(), 0.0);
    assertNull(panel.getBadrowDirection());
    assertEquals(Unit.METER.times(0.13), panel.getDistanceFromInteractionPlane());
    assertEquals(Unit.METER.times(0.0), panel.getDistanceOffset());
    assertEquals("1.0*x", panel.getFastScanXyz());
    assertEquals("1.0*y", panel.getSlowScanXyz());
    assertEquals(Map.of("x", -512, "y", -256), panel.getCorners().toMap());
    assertEquals(1.0e4, panel.getSaturationAdu(), 0.0);
    assertNull(panel.getMask());
    assertNull(panel.getGoodBitMask());
    assertNull(panel.getBadBitMask());
    assertNull(panel.getSaturationMap());
    assertFalse(panel.isBadregion());
  }

  @Test
  public void testBuilderDefaultsScanDirections() {
    DetectorPanel built = DetectorPanel.builder()
        .ranges(ScanRanges.fromMap(panel.getRanges().toMap()))
        .pixelSize(Unit.METER.times(2.2e-4))
        .distanceFromInteractionPlane(Unit.METER.times(0.13))
        .corners(-512, -256)
        .build();
    assertEquals(panel, built);
  }

  @Test
  public void testCopy() {
    DetectorPanel copy = new DetectorPanel(panel);
    assertEquals(panel, copy);
    assertEquals(panel.hashCode(), copy.hashCode());
    assertNotSame(panel, copy);
  }

  @Test
  public void testEqualityIsStructural() {
    DetectorPanel moved = DetectorPanel.builder(panel).corners(0, 0).build();
    assertNotEquals(panel, moved);
    DetectorPanel millimeters = DetectorPanel.builder(panel)
        .distanceFromInteractionPlane(Unit.MILLIMETER.times(130.0)).build();
    assertEquals(panel.getCameraLengthMeters(), millimeters.getCameraLengthMeters(), 1.0e-15);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testPixelSizeMustBeALength() {
    DetectorPanel.builder().pixelSize(Unit.ELECTRONVOLT.times(1.0e-4)).build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testPixelSizeMustBePositive() {
    DetectorPanel.builder().pixelSize(Unit.METER.times(0.0)).build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testPixelSizeIsRequired() {
    DetectorPanel.builder().pixelSize(null).build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRangesMustBeOrdered() {
    new ScanRanges(0, 511, 1024, 512);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRangesMustBeNonNegative() {
    new ScanRanges(-1, 511, 0, 512);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testScanDirectionSyntax() {
    DetectorPanel.builder().fastScanXyz("x").build();
  }

  @Test
  public void testCompoundScanDirection() {
    DetectorPanel rotated = DetectorPanel.builder().fastScanXyz("0.7071*x + 0.7071*y").build();
    assertEquals("0.7071*x + 0.7071*y", rotated.getFastScanXyz());
  }

  @Test
  public void testSerialize() throws IOException {
    StringWriter writer = new StringWriter();
    panel.serialize(0, writer);
    assertEquals(REFERENCE, writer.toString());
  }

  @Test
  public void testSerializeIsDeterministic() {
    assertEquals(panel.toGeometryString(3), panel.toGeometryString(3));
  }

  @Test
  public void testSerializeConvertsUnits() {
    DetectorPanel micro = DetectorPanel.builder(panel)
        .pixelSize(Unit.MICROMETER.times(220.0))
        .distanceFromInteractionPlane(Unit.CENTIMETER.times(13.0))
        .build();
    assertEquals(REFERENCE, micro.toGeometryString(0));
  }

  @Test
  public void testSerializeToFile() throws IOException {
    Path dir = registerTemporaryDirectory();
    File file = dir.resolve("panel0.geom").toFile();
    try (Writer writer = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
      panel.serialize(0, writer);
    }
    assertEquals(REFERENCE, Files.readString(file.toPath(), StandardCharsets.UTF_8));
  }

  @Test
  public void testOmittedScanDirectionsUseDefaults() {
    DetectorPanel omitted = new DetectorPanel(List.of("ss", "fs"), new ScanRanges(0, 1, 0, 1),
        Unit.METER.times(1.0e-4), 1.0, null, Unit.METER.times(0.1), Unit.METER.times(0.0),
        null, null, new Corner(0, 0), 1.0e4, null, null, null, null, false);
    assertEquals(DetectorPanel.DEFAULT_FAST_SCAN_XYZ, omitted.getFastScanXyz());
    assertEquals(DetectorPanel.DEFAULT_SLOW_SCAN_XYZ, omitted.getSlowScanXyz());
  }
}
