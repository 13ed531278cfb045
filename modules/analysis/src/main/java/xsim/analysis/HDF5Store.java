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

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

import io.jhdf.HdfFile;
import io.jhdf.api.Dataset;
import io.jhdf.api.Group;
import io.jhdf.api.Node;
import io.jhdf.exceptions.HdfException;
import io.jhdf.exceptions.HdfInvalidPathException;

import static java.lang.String.format;

/**
 * A {@link HierarchicalStore} backed by an HDF5 file, read with the pure Java jHDF library.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class HDF5Store implements HierarchicalStore {

  private static final Logger logger = Logger.getLogger(HDF5Store.class.getName());

  private final Path path;
  private final HdfFile hdfFile;

  /**
   * Open an HDF5 file read-only.
   *
   * @param path The file.
   * @throws IOException if the file is not a readable HDF5 file.
   */
  public HDF5Store(Path path) throws IOException {
    this.path = path;
    try {
      hdfFile = new HdfFile(path.toFile());
    } catch (HdfException e) {
      throw new IOException(format(" %s could not be opened as an HDF5 file.", path), e);
    }
    logger.fine(format(" Opened %s.", path));
  }

  /** {@inheritDoc} */
  @Override
  public Object read(String datasetPath) throws IOException {
    Node node = getNode(datasetPath);
    if (!(node instanceof Dataset)) {
      throw new MissingDatasetException(path.toString(), datasetPath);
    }
    try {
      return ((Dataset) node).getData();
    } catch (HdfException e) {
      throw new IOException(format(" %s: error reading %s.", path, datasetPath), e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public List<String> keys(String groupPath) throws IOException {
    Node node = getNode(groupPath);
    if (!(node instanceof Group)) {
      throw new MissingDatasetException(path.toString(), groupPath);
    }
    try {
      List<String> keys = new ArrayList<>(((Group) node).getChildren().keySet());
      Collections.sort(keys);
      return keys;
    } catch (HdfException e) {
      throw new IOException(format(" %s: error listing %s.", path, groupPath), e);
    }
  }

  private Node getNode(String nodePath) throws IOException {
    String normalized = nodePath;
    while (normalized.length() > 1 && normalized.endsWith("/")) {
      normalized = normalized.substring(0, normalized.length() - 1);
    }
    if (normalized.equals("/") || normalized.isEmpty()) {
      return hdfFile;
    }
    try {
      return hdfFile.getByPath(normalized);
    } catch (HdfInvalidPathException e) {
      throw new MissingDatasetException(path.toString(), nodePath, e);
    } catch (HdfException e) {
      throw new IOException(format(" %s: error resolving %s.", path, nodePath), e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void close() throws IOException {
    try {
      hdfFile.close();
    } catch (HdfException e) {
      throw new IOException(format(" %s could not be closed.", path), e);
    }
    logger.fine(format(" Closed %s.", path));
  }
}
