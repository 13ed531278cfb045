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

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import org.apache.commons.lang3.StringUtils;

import static java.lang.String.format;

/**
 * The GeometryFilter class reads panel based geometry text files, such as those produced by
 * {@link GeometryWriter}.
 * <p>
 * Keys of the form <code>name/field = value</code> describe the panel <code>name</code>; keys
 * without a panel prefix are global defaults applied to every panel that does not set the field.
 * Everything after a ';' is a comment. Panels are returned in order of first appearance.
 * <p>
 * Supported fields: min_fs, max_fs, min_ss, max_ss, corner_x, corner_y, fast_scan_xyz,
 * slow_scan_xyz, clen (m), res (pixels/m), coffset (m), adu_per_photon, max_adu,
 * badrow_direction, mask, mask_good, mask_bad, saturation_map and no_index. Other fields are
 * ignored.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class GeometryFilter {

  private static final Logger logger = Logger.getLogger(GeometryFilter.class.getName());

  /**
   * Read a geometry file.
   *
   * @param file The geometry file.
   * @return the {@link DetectorGeometry}.
   * @throws IOException if the file cannot be read or is malformed.
   */
  public DetectorGeometry readFile(File file) throws IOException {
    try (BufferedReader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
      DetectorGeometry geometry = read(reader);
      logger.info(format(" Read %d panel(s) from geometry file %s.",
          geometry.getNumberOfPanels(), file));
      return geometry;
    }
  }

  /**
   * Parse geometry text.
   *
   * @param text The geometry text.
   * @return the {@link DetectorGeometry}.
   * @throws IOException if the text is malformed.
   */
  public DetectorGeometry parse(String text) throws IOException {
    return read(new StringReader(text));
  }

  /**
   * Read geometry text from a reader.
   *
   * @param reader The source; it is not closed.
   * @return the {@link DetectorGeometry}.
   * @throws IOException if the source cannot be read or is malformed.
   */
  public DetectorGeometry read(Reader reader) throws IOException {
    BufferedReader br = reader instanceof BufferedReader ? (BufferedReader) reader
        : new BufferedReader(reader);
    Map<String, String> globals = new HashMap<>();
    Map<String, Map<String, String>> panelFields = new LinkedHashMap<>();

    String line;
    int lineNumber = 0;
    while ((line = br.readLine()) != null) {
      lineNumber++;
      int comment = line.indexOf(';');
      if (comment >= 0) {
        line = line.substring(0, comment);
      }
      if (StringUtils.isBlank(line)) {
        continue;
      }
      int equals = line.indexOf('=');
      if (equals < 0) {
        throw new IOException(format(" Line %d of the geometry is not a key = value pair: %s",
            lineNumber, line));
      }
      String key = line.substring(0, equals).trim();
      String value = line.substring(equals + 1).trim();
      int slash = key.lastIndexOf('/');
      if (slash < 0) {
        globals.put(key, value);
      } else {
        String panel = key.substring(0, slash).trim();
        String field = key.substring(slash + 1).trim();
        panelFields.computeIfAbsent(panel, k -> new LinkedHashMap<>()).put(field, value);
      }
    }

    if (panelFields.isEmpty()) {
      throw new IOException(" The geometry does not describe any panels.");
    }

    List<DetectorPanel> panels = new ArrayList<>(panelFields.size());
    for (Map.Entry<String, Map<String, String>> entry : panelFields.entrySet()) {
      Map<String, String> fields = new HashMap<>(globals);
      fields.putAll(entry.getValue());
      try {
        panels.add(buildPanel(fields));
      } catch (IllegalArgumentException e) {
        throw new IOException(format(" Panel %s is invalid: %s", entry.getKey(),
            e.getMessage().trim()), e);
      }
    }
    return new DetectorGeometry(panels);
  }

  private static DetectorPanel buildPanel(Map<String, String> fields) {
    DetectorPanel.Builder builder = DetectorPanel.builder();
    builder.ranges(getInt(fields, "min_fs", 0), getInt(fields, "max_fs", 0),
        getInt(fields, "min_ss", 0), getInt(fields, "max_ss", 0));
    builder.corners(getInt(fields, "corner_x", 0), getInt(fields, "corner_y", 0));
    for (Map.Entry<String, String> field : fields.entrySet()) {
      String value = field.getValue();
      switch (field.getKey()) {
        case "min_fs":
        case "max_fs":
        case "min_ss":
        case "max_ss":
        case "corner_x":
        case "corner_y":
          break;
        case "fast_scan_xyz":
          builder.fastScanXyz(value);
          break;
        case "slow_scan_xyz":
          builder.slowScanXyz(value);
          break;
        case "clen":
          builder.distanceFromInteractionPlane(Unit.METER.times(parseDouble("clen", value)));
          break;
        case "res":
          builder.pixelSize(Unit.METER.times(1.0 / parseDouble("res", value)));
          break;
        case "coffset":
          builder.distanceOffset(Unit.METER.times(parseDouble("coffset", value)));
          break;
        case "adu_per_photon":
          builder.aduResponse(parseDouble("adu_per_photon", value));
          break;
        case "max_adu":
          builder.saturationAdu(parseDouble("max_adu", value));
          break;
        case "badrow_direction":
          builder.badrowDirection(BadRowDirection.parse(value));
          break;
        case "mask":
          builder.mask(value);
          break;
        case "mask_good":
          builder.goodBitMask(Integer.decode(value));
          break;
        case "mask_bad":
          builder.badBitMask(Integer.decode(value));
          break;
        case "saturation_map":
          builder.saturationMap(value);
          break;
        case "no_index":
          builder.badregionFlag(value.equals("1") || value.equalsIgnoreCase("true"));
          break;
        default:
          logger.fine(format(" Ignoring geometry field %s = %s.", field.getKey(), value));
      }
    }
    return builder.build();
  }

  private static int getInt(Map<String, String> fields, String key, int defaultValue) {
    String value = fields.get(key);
    if (value == null) {
      return defaultValue;
    }
    double d = parseDouble(key, value);
    if (d != Math.rint(d)) {
      throw new IllegalArgumentException(format(" %s = %s is not an integer.", key, value));
    }
    return (int) d;
  }

  private static double parseDouble(String key, String value) {
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(format(" %s = %s is not a number.", key, value), e);
    }
  }
}
