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

import org.junit.Test;
import xsim.utilities.XSimTest;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

/**
 * @author Michael J. Schnieders
 */
public class FramesTest extends XSimTest {

  @Test
  public void testFrameConversion() {
    double[][] doubles = {{1.5}};
    assertSame(doubles, Frames.toFrame(doubles));
    assertArrayEquals(new double[] {1.0, 2.0}, Frames.toFrame(new long[][] {{1L, 2L}})[0], 0.0);
    assertArrayEquals(new double[] {0.5}, Frames.toFrame(new float[][] {{0.5f}})[0], 0.0);
    assertArrayEquals(new double[] {-3.0}, Frames.toFrame(new short[][] {{-3}})[0], 0.0);
  }

  @Test
  public void testScalars() {
    assertEquals(6000.0, Frames.toScalar(6000), 0.0);
    assertEquals(0.13, Frames.toScalar(new double[] {0.13}), 0.0);
    assertEquals(2.0, Frames.toScalar(new int[][] {{2}}), 0.0);
    assertEquals(3, Frames.firstDimension(new byte[3][7]));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRankOneIsNotAFrame() {
    Frames.toFrame(new double[] {1.0, 2.0});
  }

  @Test(expected = IllegalArgumentException.class)
  public void testArrayIsNotAScalar() {
    Frames.toScalar(new double[] {1.0, 2.0});
  }
}
