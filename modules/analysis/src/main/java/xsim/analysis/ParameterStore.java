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

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

import static java.lang.String.format;

/**
 * The ParameterStore reads the beam and geometry parameters of a diffraction simulation.
 * <p>
 * For a directory of per-pattern files, the parameters are read from the first pattern file,
 * <code>diffr_out_0000001.h5</code>. A regular file is read directly. Every child of
 * <code>/params/beam</code> and <code>/params/geom</code> is copied verbatim.
 * <p>
 * Nothing is cached; callers that need the parameters repeatedly should keep the result.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class ParameterStore {

  private static final Logger logger = Logger.getLogger(ParameterStore.class.getName());

  /** File holding the parameters in a directory of per-pattern files. */
  public static final String FIRST_PATTERN_FILE = "diffr_out_0000001.h5";
  /** Root group of the parameters. */
  public static final String PARAMS = "/params";

  private final HierarchicalStoreFactory storeFactory;

  /**
   * Constructor for a ParameterStore that reads HDF5 files.
   */
  public ParameterStore() {
    this(HierarchicalStoreFactory.HDF5);
  }

  /**
   * Constructor for ParameterStore.
   *
   * @param storeFactory Opens the parameter file.
   */
  public ParameterStore(HierarchicalStoreFactory storeFactory) {
    this.storeFactory = storeFactory;
  }

  /**
   * Load the parameters of a diffraction file or directory.
   *
   * @param path A diffraction file, or a directory of per-pattern files.
   * @return the {@link DiffractionParameters}.
   * @throws FileNotFoundException   if the path is neither a file nor a directory.
   * @throws MissingDatasetException if a parameter group is absent.
   * @throws IOException             if the parameters cannot be read.
   */
  public DiffractionParameters load(Path path) throws IOException {
    Path file = resolve(path);
    Map<String, Object> beam = new LinkedHashMap<>();
    Map<String, Object> geom = new LinkedHashMap<>();
    try (HierarchicalStore store = storeFactory.open(file)) {
      readGroup(store, DiffractionParameters.BEAM, beam);
      readGroup(store, DiffractionParameters.GEOM, geom);
    }
    DiffractionParameters parameters = new DiffractionParameters(beam, geom);
    logger.fine(format(" Parameters read from %s\n%s", file, parameters));
    return parameters;
  }

  /**
   * The file that holds the parameters for a diffraction file or directory.
   *
   * @param path A diffraction file, or a directory of per-pattern files.
   * @return the parameter file.
   * @throws FileNotFoundException if the path is neither a file nor a directory.
   */
  public static Path resolve(Path path) throws FileNotFoundException {
    if (Files.isDirectory(path)) {
      return path.resolve(FIRST_PATTERN_FILE);
    } else if (Files.isRegularFile(path)) {
      return path;
    }
    throw new FileNotFoundException(format(" %s: no such file or directory.", path));
  }

  private static void readGroup(HierarchicalStore store, String group, Map<String, Object> values)
      throws IOException {
    String groupPath = PARAMS + "/" + group;
    for (String key : store.keys(groupPath)) {
      values.put(key, store.read(groupPath + "/" + key));
    }
  }
}
