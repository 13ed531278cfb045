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

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * A read-only handle on a hierarchical data file, addressed by slash separated paths such as
 * <code>/data/0000003/diffr</code>.
 *
 * @author Michael J. Schnieders
 * @see HDF5Store
 * @since 1.0
 */
public interface HierarchicalStore extends Closeable {

  /**
   * Read the value stored at a path.
   *
   * @param path Absolute path of a dataset.
   * @return A boxed scalar (for example {@link Double}) or a primitive array of any rank.
   * @throws MissingDatasetException if no dataset exists at the path.
   * @throws IOException             if the dataset cannot be read.
   */
  Object read(String path) throws IOException;

  /**
   * The names of the children of a group, in lexicographic order.
   *
   * @param path Absolute path of a group.
   * @return child names (not full paths).
   * @throws MissingDatasetException if no group exists at the path.
   * @throws IOException             if the group cannot be read.
   */
  List<String> keys(String path) throws IOException;
}
