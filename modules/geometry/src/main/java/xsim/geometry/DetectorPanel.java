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

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import static java.lang.String.format;

/**
 * The DetectorPanel class describes a single rectangular region of an area detector: its position
 * in the data array, its orientation and distance relative to the interaction point, and its
 * calibration.
 * <p>
 * Panels are immutable values. Two panels with identical attributes are equal.
 *
 * @author Michael J. Schnieders
 * @see DetectorGeometry
 * @since 1.0
 */
public final class DetectorPanel {

  /** Default fast scan direction. */
  public static final String DEFAULT_FAST_SCAN_XYZ = "1.0*x";
  /** Default slow scan direction. */
  public static final String DEFAULT_SLOW_SCAN_XYZ = "1.0*y";
  /** Default axis names, slowest varying first. */
  public static final List<String> DEFAULT_DIMENSIONS = List.of("ss", "fs");

  /**
   * Width of the key column of the serialized format, i.e. the length of the longest key
   * ("fast_scan_xyz") plus one space.
   */
  private static final int KEY_WIDTH = 14;

  /** A sum of one or more terms such as "1.0*x", "-0.5*y". */
  private static final Pattern SCAN_EXPRESSION = Pattern.compile(
      "[+-]?\\s*\\d+(\\.\\d*)?([eE][+-]?\\d+)?\\s*\\*\\s*[xyz]"
          + "(\\s*[+-]\\s*\\d+(\\.\\d*)?([eE][+-]?\\d+)?\\s*\\*\\s*[xyz])*");

  private final List<String> dimensions;
  private final ScanRanges ranges;
  private final Quantity pixelSize;
  private final double aduResponse;
  private final BadRowDirection badrowDirection;
  private final Quantity distanceFromInteractionPlane;
  private final Quantity distanceOffset;
  private final String fastScanXyz;
  private final String slowScanXyz;
  private final Corner corners;
  private final double saturationAdu;
  private final String mask;
  private final Integer goodBitMask;
  private final Integer badBitMask;
  private final String saturationMap;
  private final boolean badregionFlag;

  /**
   * Construct a panel with default attributes: a single pixel at the origin, 100 micron pixels,
   * 10 cm from the interaction plane.
   */
  public DetectorPanel() {
    this(new Builder());
  }

  /**
   * Copy constructor. The new panel is equal to, but not the same instance as, the original.
   *
   * @param panel The panel to copy.
   */
  public DetectorPanel(DetectorPanel panel) {
    this(panel.dimensions, panel.ranges, panel.pixelSize, panel.aduResponse,
        panel.badrowDirection, panel.distanceFromInteractionPlane, panel.distanceOffset,
        panel.fastScanXyz, panel.slowScanXyz, panel.corners, panel.saturationAdu, panel.mask,
        panel.goodBitMask, panel.badBitMask, panel.saturationMap, panel.badregionFlag);
  }

  private DetectorPanel(Builder builder) {
    this(builder.dimensions, builder.ranges, builder.pixelSize, builder.aduResponse,
        builder.badrowDirection, builder.distanceFromInteractionPlane, builder.distanceOffset,
        builder.fastScanXyz, builder.slowScanXyz, builder.corners, builder.saturationAdu,
        builder.mask, builder.goodBitMask, builder.badBitMask, builder.saturationMap,
        builder.badregionFlag);
  }

  /**
   * Constructor for DetectorPanel.
   *
   * @param dimensions                   Axis names, slowest varying first.
   * @param ranges                       Inclusive pixel bounds within the data array.
   * @param pixelSize                    Pixel edge length (must be a positive length).
   * @param aduResponse                  Detector gain (ADU per photon).
   * @param badrowDirection              Direction of bad rows, or null.
   * @param distanceFromInteractionPlane Camera length (a length).
   * @param distanceOffset               Offset added to the camera length (a length).
   * @param fastScanXyz                  Lab-frame direction of the fast scan axis, e.g. "1.0*x";
   *                                     null for {@link #DEFAULT_FAST_SCAN_XYZ}.
   * @param slowScanXyz                  Lab-frame direction of the slow scan axis, e.g. "1.0*y".
   * @param corners                      Pixel-space offset of the panel origin.
   * @param saturationAdu                Saturation threshold in ADU.
   * @param mask                         Dataset holding the pixel mask, or null.
   * @param goodBitMask                  Mask bits that flag good pixels, or null.
   * @param badBitMask                   Mask bits that flag bad pixels, or null.
   * @param saturationMap                Dataset holding per-pixel saturation values, or null.
   * @param badregionFlag                True if the whole panel is to be ignored.
   * @throws IllegalArgumentException if an attribute is missing, has the wrong dimension, or is
   *                                  out of range.
   */
  public DetectorPanel(List<String> dimensions, ScanRanges ranges, Quantity pixelSize,
      double aduResponse, BadRowDirection badrowDirection, Quantity distanceFromInteractionPlane,
      Quantity distanceOffset, String fastScanXyz, String slowScanXyz, Corner corners,
      double saturationAdu, String mask, Integer goodBitMask, Integer badBitMask,
      String saturationMap, boolean badregionFlag) {
    this.dimensions = List.copyOf(requireNonNull(dimensions, "dimensions"));
    this.ranges = requireNonNull(ranges, "ranges");
    this.pixelSize = requireLength(pixelSize, "pixel_size");
    if (pixelSize.getMagnitude() <= 0.0) {
      throw new IllegalArgumentException(
          format(" The pixel size must be positive (%s).", pixelSize));
    }
    this.aduResponse = aduResponse;
    this.badrowDirection = badrowDirection;
    this.distanceFromInteractionPlane = requireLength(distanceFromInteractionPlane,
        "distance_from_interaction_plane");
    this.distanceOffset = requireLength(distanceOffset, "distance_offset");
    this.fastScanXyz = requireScanExpression(
        fastScanXyz != null ? fastScanXyz : DEFAULT_FAST_SCAN_XYZ, "fast_scan_xyz");
    this.slowScanXyz = requireScanExpression(
        slowScanXyz != null ? slowScanXyz : DEFAULT_SLOW_SCAN_XYZ, "slow_scan_xyz");
    this.corners = requireNonNull(corners, "corners");
    this.saturationAdu = saturationAdu;
    this.mask = mask;
    this.goodBitMask = goodBitMask;
    this.badBitMask = badBitMask;
    this.saturationMap = saturationMap;
    this.badregionFlag = badregionFlag;
  }

  private static <T> T requireNonNull(T value, String name) {
    if (value == null) {
      throw new IllegalArgumentException(format(" The panel attribute %s is required.", name));
    }
    return value;
  }

  private static Quantity requireLength(Quantity quantity, String name) {
    requireNonNull(quantity, name);
    if (quantity.getDimension() != Dimension.LENGTH) {
      throw new IllegalArgumentException(
          format(" The panel attribute %s must be a length, not %s.", name, quantity));
    }
    return quantity;
  }

  private static String requireScanExpression(String expression, String name) {
    requireNonNull(expression, name);
    if (!SCAN_EXPRESSION.matcher(expression.trim()).matches()) {
      throw new IllegalArgumentException(
          format(" The panel attribute %s has an invalid direction \"%s\".", name, expression));
    }
    return expression.trim();
  }

  /**
   * Write this panel in the geometry text format, followed by a blank line.
   *
   * @param index  The position of this panel in its geometry.
   * @param writer The sink.
   * @throws IOException if the sink cannot be written.
   */
  public void serialize(int index, Writer writer) throws IOException {
    String prefix = "panel" + index + "/";
    StringBuilder sb = new StringBuilder();
    sb.append(";panel ").append(index).append("\n");
    appendField(sb, prefix, "min_fs", Integer.toString(ranges.fastScanMin));
    appendField(sb, prefix, "max_fs", Integer.toString(ranges.fastScanMax));
    appendField(sb, prefix, "min_ss", Integer.toString(ranges.slowScanMin));
    appendField(sb, prefix, "max_ss", Integer.toString(ranges.slowScanMax));
    appendField(sb, prefix, "corner_x", Integer.toString(corners.x));
    appendField(sb, prefix, "corner_y", Integer.toString(corners.y));
    appendField(sb, prefix, "fast_scan_xyz", fastScanXyz);
    appendField(sb, prefix, "slow_scan_xyz", slowScanXyz);
    appendField(sb, prefix, "clen", formatReal(getCameraLengthMeters()));
    appendField(sb, prefix, "res", formatReal(getPixelsPerMeter()));
    sb.append("\n");
    writer.write(sb.toString());
  }

  /**
   * The serialized form of this panel.
   *
   * @param index The position of this panel in its geometry.
   * @return the text block written by {@link #serialize(int, Writer)}.
   */
  public String toGeometryString(int index) {
    StringWriter writer = new StringWriter();
    try {
      serialize(index, writer);
    } catch (IOException e) {
      // A StringWriter does not throw.
      throw new UncheckedIOException(e);
    }
    return writer.toString();
  }

  private static void appendField(StringBuilder sb, String prefix, String key, String value) {
    sb.append(prefix).append(format(Locale.US, "%-" + KEY_WIDTH + "s= ", key))
        .append(value).append("\n");
  }

  /**
   * Format a real number with 8 significant digits in exponent form, e.g. 1.3000000e-01.
   *
   * @param value a double.
   * @return the formatted value.
   */
  static String formatReal(double value) {
    return format(Locale.US, "%.7e", value);
  }

  /**
   * The camera length in meters.
   *
   * @return distance_from_interaction_plane in m.
   */
  public double getCameraLengthMeters() {
    return distanceFromInteractionPlane.in(Unit.METER);
  }

  /**
   * The resolution of the panel, in pixels per meter.
   *
   * @return 1 / pixel_size in 1/m.
   */
  public double getPixelsPerMeter() {
    return 1.0 / pixelSize.in(Unit.METER);
  }

  public List<String> getDimensions() {
    return dimensions;
  }

  public ScanRanges getRanges() {
    return ranges;
  }

  public Quantity getPixelSize() {
    return pixelSize;
  }

  public double getAduResponse() {
    return aduResponse;
  }

  public BadRowDirection getBadrowDirection() {
    return badrowDirection;
  }

  public Quantity getDistanceFromInteractionPlane() {
    return distanceFromInteractionPlane;
  }

  public Quantity getDistanceOffset() {
    return distanceOffset;
  }

  public String getFastScanXyz() {
    return fastScanXyz;
  }

  public String getSlowScanXyz() {
    return slowScanXyz;
  }

  public Corner getCorners() {
    return corners;
  }

  public double getSaturationAdu() {
    return saturationAdu;
  }

  public String getMask() {
    return mask;
  }

  public Integer getGoodBitMask() {
    return goodBitMask;
  }

  public Integer getBadBitMask() {
    return badBitMask;
  }

  public String getSaturationMap() {
    return saturationMap;
  }

  public boolean isBadregion() {
    return badregionFlag;
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
    DetectorPanel panel = (DetectorPanel) o;
    return Double.compare(aduResponse, panel.aduResponse) == 0
        && Double.compare(saturationAdu, panel.saturationAdu) == 0
        && badregionFlag == panel.badregionFlag
        && dimensions.equals(panel.dimensions)
        && ranges.equals(panel.ranges)
        && pixelSize.equals(panel.pixelSize)
        && badrowDirection == panel.badrowDirection
        && distanceFromInteractionPlane.equals(panel.distanceFromInteractionPlane)
        && distanceOffset.equals(panel.distanceOffset)
        && fastScanXyz.equals(panel.fastScanXyz)
        && slowScanXyz.equals(panel.slowScanXyz)
        && corners.equals(panel.corners)
        && Objects.equals(mask, panel.mask)
        && Objects.equals(goodBitMask, panel.goodBitMask)
        && Objects.equals(badBitMask, panel.badBitMask)
        && Objects.equals(saturationMap, panel.saturationMap);
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return Objects.hash(dimensions, ranges, pixelSize, aduResponse, badrowDirection,
        distanceFromInteractionPlane, distanceOffset, fastScanXyz, slowScanXyz, corners,
        saturationAdu, mask, goodBitMask, badBitMask, saturationMap, badregionFlag);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" Panel %s x %s pixels of %s at %s, corner %s",
        ranges.fastScanPixels(), ranges.slowScanPixels(), pixelSize,
        distanceFromInteractionPlane, corners);
  }

  /**
   * Start a builder initialized with the default attributes.
   *
   * @return a new {@link Builder}.
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Start a builder initialized with the attributes of an existing panel.
   *
   * @param panel The template.
   * @return a new {@link Builder}.
   */
  public static Builder builder(DetectorPanel panel) {
    Builder builder = new Builder();
    builder.dimensions = panel.dimensions;
    builder.ranges = panel.ranges;
    builder.pixelSize = panel.pixelSize;
    builder.aduResponse = panel.aduResponse;
    builder.badrowDirection = panel.badrowDirection;
    builder.distanceFromInteractionPlane = panel.distanceFromInteractionPlane;
    builder.distanceOffset = panel.distanceOffset;
    builder.fastScanXyz = panel.fastScanXyz;
    builder.slowScanXyz = panel.slowScanXyz;
    builder.corners = panel.corners;
    builder.saturationAdu = panel.saturationAdu;
    builder.mask = panel.mask;
    builder.goodBitMask = panel.goodBitMask;
    builder.badBitMask = panel.badBitMask;
    builder.saturationMap = panel.saturationMap;
    builder.badregionFlag = panel.badregionFlag;
    return builder;
  }

  /**
   * Builder for DetectorPanel. Every attribute starts at its documented default.
   */
  public static final class Builder {

    private List<String> dimensions = DEFAULT_DIMENSIONS;
    private ScanRanges ranges = new ScanRanges(0, 0, 0, 0);
    private Quantity pixelSize = Unit.METER.times(1.0e-4);
    private double aduResponse = 1.0;
    private BadRowDirection badrowDirection = null;
    private Quantity distanceFromInteractionPlane = Unit.METER.times(0.1);
    private Quantity distanceOffset = Unit.METER.times(0.0);
    private String fastScanXyz = DEFAULT_FAST_SCAN_XYZ;
    private String slowScanXyz = DEFAULT_SLOW_SCAN_XYZ;
    private Corner corners = new Corner(0, 0);
    private double saturationAdu = 1.0e4;
    private String mask = null;
    private Integer goodBitMask = null;
    private Integer badBitMask = null;
    private String saturationMap = null;
    private boolean badregionFlag = false;

    private Builder() {
    }

    public Builder dimensions(List<String> dimensions) {
      this.dimensions = dimensions;
      return this;
    }

    public Builder ranges(ScanRanges ranges) {
      this.ranges = ranges;
      return this;
    }

    public Builder ranges(int fastScanMin, int fastScanMax, int slowScanMin, int slowScanMax) {
      this.ranges = new ScanRanges(fastScanMin, fastScanMax, slowScanMin, slowScanMax);
      return this;
    }

    public Builder pixelSize(Quantity pixelSize) {
      this.pixelSize = pixelSize;
      return this;
    }

    public Builder aduResponse(double aduResponse) {
      this.aduResponse = aduResponse;
      return this;
    }

    public Builder badrowDirection(BadRowDirection badrowDirection) {
      this.badrowDirection = badrowDirection;
      return this;
    }

    public Builder distanceFromInteractionPlane(Quantity distance) {
      this.distanceFromInteractionPlane = distance;
      return this;
    }

    public Builder distanceOffset(Quantity distanceOffset) {
      this.distanceOffset = distanceOffset;
      return this;
    }

    public Builder fastScanXyz(String fastScanXyz) {
      this.fastScanXyz = fastScanXyz;
      return this;
    }

    public Builder slowScanXyz(String slowScanXyz) {
      this.slowScanXyz = slowScanXyz;
      return this;
    }

    public Builder corners(int x, int y) {
      this.corners = new Corner(x, y);
      return this;
    }

    public Builder saturationAdu(double saturationAdu) {
      this.saturationAdu = saturationAdu;
      return this;
    }

    public Builder mask(String mask) {
      this.mask = mask;
      return this;
    }

    public Builder goodBitMask(Integer goodBitMask) {
      this.goodBitMask = goodBitMask;
      return this;
    }

    public Builder badBitMask(Integer badBitMask) {
      this.badBitMask = badBitMask;
      return this;
    }

    public Builder saturationMap(String saturationMap) {
      this.saturationMap = saturationMap;
      return this;
    }

    public Builder badregionFlag(boolean badregionFlag) {
      this.badregionFlag = badregionFlag;
      return this;
    }

    /**
     * Validate the attributes and create the panel.
     *
     * @return a new {@link DetectorPanel}.
     * @throws IllegalArgumentException if an attribute is invalid.
     */
    public DetectorPanel build() {
      return new DetectorPanel(this);
    }
  }
}
