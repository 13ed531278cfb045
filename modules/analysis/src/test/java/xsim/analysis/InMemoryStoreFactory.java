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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

import static java.lang.String.format;

/**
 * Opens in-memory stores registered by file path, and counts how often they are opened and
 * closed.
 *
 * @author Michael J. Schnieders
 */
public class InMemoryStoreFactory implements HierarchicalStoreFactory {

  private final Map<Path, Map<String, Object>> files = new HashMap<>();
  private final List<Path> opened = new ArrayList<>();
  private int openHandles = 0;

  /**
   * Register a file (or return the datasets of one already registered).
   *
   * @param file the file path.
   * @return its mutable dataset map, keyed by absolute dataset path.
   */
  public Map<String, Object> file(Path file) {
    return files.computeIfAbsent(key(file), k -> new TreeMap<>());
  }

  /**
   * Files opened so far, in order.
   *
   * @return the list.
   */
  public List<Path> getOpened() {
    return opened;
  }

  public int getOpenCount() {
    return opened.size();
  }

  public int getOpenHandles() {
    return openHandles;
  }

  /** {@inheritDoc} */
  @Override
  public HierarchicalStore open(Path path) throws IOException {
    Path key = key(path);
    opened.add(key);
    Map<String, Object> datasets = files.get(key);
    if (datasets == null) {
      throw new IOException(format(" %s is not a data file.", path));
    }
    openHandles++;
    return new InMemoryStore(key.toString(), datasets);
  }

  private static Path key(Path path) {
    return path.toAbsolutePath().normalize();
  }

  private class InMemoryStore implements HierarchicalStore {

    private final String file;
    private final Map<String, Object> datasets;

    InMemoryStore(String file, Map<String, Object> datasets) {
      this.file = file;
      this.datasets = datasets;
    }

    @Override
    public Object read(String path) throws IOException {
      Object value = datasets.get(path);
      if (value == null) {
        throw new MissingDatasetException(file, path);
      }
      return value;
    }

    @Override
    public List<String> keys(String path) throws IOException {
      String prefix = path.endsWith("/") ? path : path + "/";
      TreeSet<String> keys = new TreeSet<>();
      for (String dataset : datasets.keySet()) {
        if (dataset.startsWith(prefix)) {
          String rest = dataset.substring(prefix.length());
          int slash = rest.indexOf('/');
          keys.add(slash < 0 ? rest : rest.substring(0, slash));
        }
      }
      if (keys.isEmpty()) {
        throw new MissingDatasetException(file, path);
      }
      return new ArrayList<>(keys);
    }

    @Override
    public void close() {
      openHandles--;
    }
  }
}
