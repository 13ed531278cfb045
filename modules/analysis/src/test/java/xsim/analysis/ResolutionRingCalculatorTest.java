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

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.configuration2.CompositeConfiguration;
import org.junit.Test;
import xsim.utilities.XSimTest;

import static java.lang.Double.isFinite;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

/**
 * @author Michael J. Schnieders
 */
public class ResolutionRingCalculatorTest extends XSimTest {

  private final ResolutionRingCalculator calculator = new ResolutionRingCalculator();

  private ResolutionRingSet reference() {
    return calculator.calculate(6000.0, 2.2e-4, 0.13, 1024);
  }

  @Test
  public void testReferenceDetector() {
    ResolutionRingSet rings = reference();
    assertEquals(0.20663, rings.getWavelength(), 1.0e-5);
    assertEquals(0.71397, rings.getThetaMax(), 1.0e-5);
    assertEquals(0.15777, rings.getMinimumSpacing(), 1.0e-4);
    assertEquals(0.2, rings.getRoundedSpacing(), 1.0e-12);
    assertEquals(512.0, rings.getCenter(), 0.0);
    assertTrue(isFinite(rings.getThetaMax()) && rings.getThetaMax() > 0.0);
    assertTrue(isFinite(rings.getMinimumSpacing()) && rings.getMinimumSpacing() > 0.0);
  }

  @Test
  public void testRingRadii() {
    List<ResolutionRing> rings = reference().getRings();
    assertEquals(3, rings.size());
    assertEquals(1.0, rings.get(0).getSpacing(), 0.0);
    assertEquals(60.94, rings.get(0).getRadius(), 0.1);
    assertEquals(121.26, rings.get(1).getRadius(), 0.2);
    assertEquals(199.8, rings.get(2).getRadius(), 0.5);
    double previous = 0.0;
    for (ResolutionRing ring : rings) {
      assertTrue(isFinite(ring.getRadius()));
      // Smaller spacings scatter to larger angles.
      assertTrue(ring.getRadius() > previous);
      previous = ring.getRadius();
    }
  }

  @Test
  public void testRingPrimitives() {
    ResolutionRing ring = reference().getRings().get(0);
    assertEquals("10.0", ring.getLabel());
    assertEquals("5.0", reference().getRings().get(1).getLabel());
    assertEquals(512.0, ring.getCenterX(), 0.0);
    assertEquals(512.0, ring.getCenterY(), 0.0);
    assertEquals(512.0 + 0.75 * ring.getRadius(), ring.getLabelX(), 1.0e-12);
    assertEquals(ring.getLabelX(), ring.getLabelY(), 0.0);

    double[][] upper = ring.getUpperHalf();
    double[][] lower = ring.getLowerHalf();
    assertEquals(ResolutionRingCalculator.DEFAULT_SAMPLES, upper[0].length);
    assertEquals(512.0 - ring.getRadius(), upper[0][0], 1.0e-9);
    assertEquals(512.0 + ring.getRadius(), upper[0][511], 1.0e-9);
    assertArrayEquals(upper[0], lower[0], 0.0);
    for (int i = 0; i < upper[0].length; i++) {
      double dx = upper[0][i] - 512.0;
      double dy = upper[1][i] - 512.0;
      assertTrue(dy >= 0.0);
      assertEquals(-dy, lower[1][i] - 512.0, 1.0e-9);
      assertEquals(ring.getRadius(), Math.sqrt(dx * dx + dy * dy), 1.0e-6);
    }
  }

  @Test
  public void testParameters() {
    Map<String, Object> beam = new HashMap<>();
    beam.put("photonEnergy", 6000.0);
    Map<String, Object> geom = new HashMap<>();
    geom.put("pixelWidth", new double[] {2.2e-4});
    geom.put("detectorDist", 0.13f);
    geom.put("mask", new int[1024][4]);
    ResolutionRingSet rings = calculator.calculate(new DiffractionParameters(beam, geom));
    assertEquals(1024, rings.getNumberOfPixels());
    assertEquals(reference().getRings().get(2).getRadius(), rings.getRings().get(2).getRadius(),
        1.0e-3);
  }

  @Test
  public void testConfiguration() {
    CompositeConfiguration properties = new CompositeConfiguration();
    properties.addProperty(ResolutionRingCalculator.RING_SPACINGS, "2.0");
    properties.addProperty(ResolutionRingCalculator.RING_SPACINGS, "0.25");
    properties.addProperty(ResolutionRingCalculator.RING_SAMPLES, "64");
    ResolutionRingCalculator configured = new ResolutionRingCalculator(properties);
    assertArrayEquals(new double[] {2.0, 0.25}, configured.getSpacings(), 0.0);
    ResolutionRingSet rings = configured.calculate(6000.0, 2.2e-4, 0.13, 1024);
    assertEquals("20.0", rings.getRings().get(0).getLabel());
    assertEquals("2.5", rings.getRings().get(1).getLabel());
    assertEquals(64, rings.getRings().get(1).getUpperHalf()[0].length);
  }

  @Test(expected = ArithmeticException.class)
  public void testUnresolvableSpacing() {
    new ResolutionRingCalculator(new double[] {0.1}, 16).calculate(6000.0, 2.2e-4, 0.13, 1024);
  }

  @Test(expected = ArithmeticException.class)
  public void testZeroEnergy() {
    calculator.calculate(0.0, 2.2e-4, 0.13, 1024);
  }

  @Test(expected = ArithmeticException.class)
  public void testNegativeDistance() {
    calculator.calculate(6000.0, 2.2e-4, -0.13, 1024);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidSpacing() {
    new ResolutionRingCalculator(new double[] {1.0, 0.0}, 512);
  }
}
