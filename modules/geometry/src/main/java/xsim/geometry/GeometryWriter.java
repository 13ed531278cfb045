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

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;

/**
 * The GeometryWriter class writes a {@link DetectorGeometry} in the panel based geometry text
 * format: one block per panel, in panel order, each block followed by a blank line.
 * <p>
 * Output is deterministic; writing the same geometry twice produces identical bytes.
 *
 * @author Michael J. Schnieders
 * @see GeometryFilter
 * @since 1.0
 */
public class GeometryWriter {

  private static final Logger logger = Logger.getLogger(GeometryWriter.class.getName());

  private final DetectorGeometry geometry;

  /**
   * Constructor for GeometryWriter.
   *
   * @param geometry The geometry to write.
   */
  public GeometryWriter(DetectorGeometry geometry) {
    this.geometry = geometry;
  }

  /**
   * Write every panel to the sink.
   *
   * @param writer The sink.
   * @throws IOException if the sink cannot be written.
   */
  public void write(Writer writer) throws IOException {
    List<DetectorPanel> panels = geometry.getPanels();
    for (int i = 0; i < panels.size(); i++) {
      panels.get(i).serialize(i, writer);
    }
    writer.flush();
  }

  /**
   * Write the geometry to a file, replacing any existing content.
   *
   * @param file The destination.
   * @throws IOException if the file cannot be written.
   */
  public void write(File file) throws IOException {
    try (BufferedWriter writer = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
      write(writer);
    }
    if (logger.isLoggable(Level.INFO)) {
      logger.info(format(" Wrote %d panel(s) to geometry file %s.",
          geometry.getNumberOfPanels(), file));
    }
  }

  /**
   * The complete geometry text.
   *
   * @return the serialized geometry.
   */
  public String toGeometryString() {
    StringWriter writer = new StringWriter();
    try {
      write(writer);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return writer.toString();
  }
}
