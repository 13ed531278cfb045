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
import java.nio.file.Files;
import java.nio.file.Path;

import static java.lang.String.format;

/**
 * The two on-disk layouts of a set of diffraction patterns.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public enum StorageLayout {

  /**
   * A directory of per-pattern files, each with the datasets <code>/data/data</code> and
   * <code>/data/diffr</code>. Unreadable files are skipped by default.
   */
  LEGACY(ReadErrorPolicy.SKIP),

  /**
   * A single file with one group per pattern, <code>/data/&lt;7 digit index&gt;/{data,diffr}</code>.
   * Read errors abort by default.
   */
  CONSOLIDATED(ReadErrorPolicy.FAIL);

  private final ReadErrorPolicy defaultPolicy;

  StorageLayout(ReadErrorPolicy defaultPolicy) {
    this.defaultPolicy = defaultPolicy;
  }

  /**
   * The read error policy used when none is configured.
   *
   * @return the default ReadErrorPolicy.
   */
  public ReadErrorPolicy getDefaultPolicy() {
    return defaultPolicy;
  }

  /**
   * Determine the layout of a path: a directory is {@link #LEGACY}, a regular file
   * {@link #CONSOLIDATED}.
   *
   * @param path the input path.
   * @return the StorageLayout.
   * @throws FileNotFoundException if the path is neither a directory nor a regular file.
   */
  public static StorageLayout detect(Path path) throws FileNotFoundException {
    if (Files.isDirectory(path)) {
      return LEGACY;
    } else if (Files.isRegularFile(path)) {
      return CONSOLIDATED;
    }
    throw new FileNotFoundException(format(" %s: no such file or directory.", path));
  }
}
