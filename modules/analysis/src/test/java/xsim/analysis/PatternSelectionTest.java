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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;

import org.junit.Test;
import xsim.utilities.XSimTest;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

/**
 * @author Michael J. Schnieders
 */
public class PatternSelectionTest extends XSimTest {

  @Test
  public void testNullSelectsAll() {
    PatternSelection selection = PatternSelection.from(null);
    assertTrue(selection.isAll());
    assertSame(PatternSelection.all(), selection);
    assertEquals("all", selection.toString());
  }

  @Test
  public void testAllKeyword() {
    assertTrue(PatternSelection.from("all").isAll());
    assertTrue(PatternSelection.parse(" ALL ").isAll());
  }

  @Test
  public void testIntegerIsSingleton() {
    PatternSelection selection = PatternSelection.from(4);
    assertFalse(selection.isAll());
    assertEquals(Collections.singletonList(4), selection.getIndices());
    assertEquals(PatternSelection.of(4), selection);
  }

  @Test
  public void testSequences() {
    assertEquals(Arrays.asList(3, 7), PatternSelection.from(Arrays.asList(3, 7)).getIndices());
    assertEquals(Arrays.asList(3, 7), PatternSelection.from(new int[] {3, 7}).getIndices());
    assertEquals(Arrays.asList(1, 2), PatternSelection.from(new HashSet<>(Arrays.asList(1, 2)))
        .getIndices());
  }

  @Test
  public void testParseRanges() {
    PatternSelection selection = PatternSelection.parse("0-3, 7");
    assertEquals(Arrays.asList(0, 1, 2, 3, 7), selection.getIndices());
    assertEquals("0,1,2,3,7", selection.toString());
    assertEquals(5, selection.size());
    assertTrue(selection.includes(2));
    assertFalse(selection.includes(5));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidType() {
    PatternSelection.from(2.5);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidElementType() {
    PatternSelection.from(Arrays.asList(1, "two"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeIndex() {
    PatternSelection.of(1, -1);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnparsableText() {
    PatternSelection.parse("first");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDescendingRange() {
    PatternSelection.parse("9-3");
  }

  @Test
  public void testIntegralNumbers() {
    assertEquals(PatternSelection.of(5), PatternSelection.from(5L));
    assertEquals(PatternSelection.of(2), PatternSelection.from((short) 2));
    assertEquals(PatternSelection.of(7), PatternSelection.from((byte) 7));
    assertEquals(PatternSelection.of(1, 3), PatternSelection.from(Arrays.asList(1L, 3L)));
    assertEquals(PatternSelection.of(Integer.MAX_VALUE),
        PatternSelection.from((long) Integer.MAX_VALUE));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testIndexBeyondIntRange() {
    PatternSelection.from(1L << 40);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeLongIndex() {
    PatternSelection.from(Arrays.asList(1L, -3L));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testFullIntRangeIsRejected() {
    PatternSelection.parse("0-2147483647");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRangesTogetherTooLong() {
    PatternSelection.parse("0-600000, 600001-1200000");
  }

  @Test
  public void testLargestParsedRange() {
    int last = PatternSelection.MAX_PARSED_INDICES - 1;
    PatternSelection selection = PatternSelection.parse("0-" + last);
    assertEquals(PatternSelection.MAX_PARSED_INDICES, selection.size());
    assertTrue(selection.includes(last));
    assertFalse(selection.includes(last + 1));
  }

  @Test
  public void testIncludesWithDuplicates() {
    PatternSelection selection = PatternSelection.of(4, 2, 4);
    assertEquals(3, selection.size());
    assertTrue(selection.includes(2));
    assertTrue(selection.includes(4));
    assertFalse(selection.includes(3));
    assertTrue(PatternSelection.all().includes(12345));
  }

  @Test(expected = IllegalStateException.class)
  public void testAllHasNoIndices() {
    PatternSelection.all().getIndices();
  }
}
