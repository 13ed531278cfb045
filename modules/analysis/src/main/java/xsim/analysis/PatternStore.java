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
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import org.apache.commons.configuration2.CompositeConfiguration;

import static java.lang.String.format;
import static org.apache.commons.io.FilenameUtils.isExtension;

/**
 * The PatternStore reads the diffraction patterns of a simulation, one frame at a time.
 * <p>
 * The {@link StorageLayout} is detected once, when the store is created: a directory holds one
 * file per pattern ({@link StorageLayout#LEGACY}), while a regular file holds every pattern
 * ({@link StorageLayout#CONSOLIDATED}). Iteration is lazy: each frame is read only when it is
 * requested, and every file handle is closed before the frame is returned. Each call to
 * {@link #iterator()} starts a new pass.
 * <p>
 * The <code>poissonize</code> flag selects the frame with Poisson shot noise (the
 * <code>data</code> dataset) or the noise-free frame (the <code>diffr</code> dataset).
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class PatternStore implements Iterable<double[][]> {

  private static final Logger logger = Logger.getLogger(PatternStore.class.getName());

  /** Property that selects patterns ("all", or a comma separated list of indices and ranges). */
  public static final String PATTERN_INDICES = "pattern-indices";
  /** Property that selects the noisy (true) or noise-free (false) frames. */
  public static final String POISSONIZE = "poissonize";
  /** Property that overrides the layout's {@link ReadErrorPolicy}. */
  public static final String READ_ERROR_POLICY = "read-error-policy";

  /** Extension of per-pattern files in the legacy layout. */
  public static final String H5_EXTENSION = "h5";
  /** Dataset holding frames with shot noise. */
  public static final String POISSON_DATASET = "data";
  /** Dataset holding noise-free frames. */
  public static final String DIFFRACTION_DATASET = "diffr";
  /** Group holding the patterns. */
  public static final String DATA_GROUP = "/data";

  private final Path path;
  private final StorageLayout layout;
  private final HierarchicalStoreFactory storeFactory;
  private PatternSelection patternSelection = PatternSelection.all();
  private boolean poissonize = true;
  /** Null to use the layout default. */
  private ReadErrorPolicy readErrorPolicy = null;

  /**
   * Constructor for a PatternStore over HDF5 data that selects every noisy pattern.
   *
   * @param path a directory of pattern files, or a single pattern file.
   * @throws FileNotFoundException if the path is neither a directory nor a file.
   */
  public PatternStore(Path path) throws FileNotFoundException {
    this(path, HierarchicalStoreFactory.HDF5);
  }

  /**
   * Constructor for a PatternStore over HDF5 data.
   *
   * @param path             a directory of pattern files, or a single pattern file.
   * @param patternSelection the patterns to read.
   * @param poissonize       true to read frames with shot noise.
   * @throws FileNotFoundException if the path is neither a directory nor a file.
   */
  public PatternStore(Path path, PatternSelection patternSelection, boolean poissonize)
      throws FileNotFoundException {
    this(path, HierarchicalStoreFactory.HDF5);
    setPatternSelection(patternSelection);
    setPoissonize(poissonize);
  }

  /**
   * Constructor for a PatternStore over HDF5 data, configured by properties.
   *
   * @param path       a directory of pattern files, or a single pattern file.
   * @param properties the configuration (see {@link #PATTERN_INDICES}, {@link #POISSONIZE} and
   *                   {@link #READ_ERROR_POLICY}).
   * @throws FileNotFoundException    if the path is neither a directory nor a file.
   * @throws IllegalArgumentException if a property value is invalid.
   */
  public PatternStore(Path path, CompositeConfiguration properties) throws FileNotFoundException {
    this(path, properties, HierarchicalStoreFactory.HDF5);
  }

  /**
   * Constructor for a PatternStore configured by properties.
   *
   * @param path         a directory of pattern files, or a single pattern file.
   * @param properties   the configuration.
   * @param storeFactory opens the pattern files.
   * @throws FileNotFoundException    if the path is neither a directory nor a file.
   * @throws IllegalArgumentException if a property value is invalid.
   */
  public PatternStore(Path path, CompositeConfiguration properties,
      HierarchicalStoreFactory storeFactory) throws FileNotFoundException {
    this(path, storeFactory);
    if (properties != null) {
      if (properties.containsKey(PATTERN_INDICES)) {
        String indices = String.join(",", properties.getStringArray(PATTERN_INDICES));
        setPatternSelection(PatternSelection.parse(indices));
      }
      setPoissonize(properties.getBoolean(POISSONIZE, true));
      String policy = properties.getString(READ_ERROR_POLICY, null);
      if (policy != null) {
        setReadErrorPolicy(ReadErrorPolicy.parse(policy));
      }
    }
  }

  /**
   * Constructor for a PatternStore that selects every noisy pattern.
   *
   * @param path         a directory of pattern files, or a single pattern file.
   * @param storeFactory opens the pattern files.
   * @throws FileNotFoundException if the path is neither a directory nor a file.
   */
  public PatternStore(Path path, HierarchicalStoreFactory storeFactory)
      throws FileNotFoundException {
    if (path == null) {
      throw new IllegalArgumentException(" The pattern path may not be null.");
    }
    if (storeFactory == null) {
      throw new IllegalArgumentException(" The store factory may not be null.");
    }
    this.path = path;
    this.storeFactory = storeFactory;
    layout = StorageLayout.detect(path);
    logger.fine(format(" Pattern store %s uses the %s layout.", path, layout));
  }

  public Path getPath() {
    return path;
  }

  public StorageLayout getLayout() {
    return layout;
  }

  public PatternSelection getPatternSelection() {
    return patternSelection;
  }

  /**
   * Select patterns. In the legacy layout indices are positions in the sorted directory listing;
   * in the consolidated layout they name the 7 digit pattern keys.
   *
   * @param patternSelection the patterns to read.
   */
  public void setPatternSelection(PatternSelection patternSelection) {
    if (patternSelection == null) {
      throw new IllegalArgumentException(" The pattern selection may not be null.");
    }
    this.patternSelection = patternSelection;
  }

  /**
   * Select patterns from a loosely typed value.
   *
   * @param patternIndices null or "all", an Integer, an int[] or an Iterable of Integers.
   * @throws IllegalArgumentException for any other value.
   * @see PatternSelection#from(Object)
   */
  public void setPatternIndices(Object patternIndices) {
    setPatternSelection(PatternSelection.from(patternIndices));
  }

  public boolean isPoissonize() {
    return poissonize;
  }

  public void setPoissonize(boolean poissonize) {
    this.poissonize = poissonize;
  }

  /**
   * The policy applied to unreadable frames.
   *
   * @return the configured policy, or the default of the layout.
   */
  public ReadErrorPolicy getReadErrorPolicy() {
    return readErrorPolicy != null ? readErrorPolicy : layout.getDefaultPolicy();
  }

  /**
   * Override the policy applied to unreadable frames.
   *
   * @param readErrorPolicy the policy, or null for the default of the layout.
   */
  public void setReadErrorPolicy(ReadErrorPolicy readErrorPolicy) {
    this.readErrorPolicy = readErrorPolicy;
  }

  /**
   * {@inheritDoc}
   *
   * <p>The iterator throws an {@link UncheckedIOException} for a read failure that is not
   * skipped.
   */
  @Override
  public PatternIterator iterator() {
    return new PatternIterator();
  }

  /**
   * A sequential stream of the selected frames.
   *
   * @return the Stream.
   */
  public Stream<double[][]> stream() {
    return StreamSupport.stream(spliterator(), false);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" Patterns %s (layout %s, selection %s, %s)", path, layout, patternSelection,
        poissonize ? POISSON_DATASET : DIFFRACTION_DATASET);
  }

  /**
   * List the frames of the selection, without reading any of them.
   */
  private List<FrameSource> listFrames() throws IOException {
    String dataset = poissonize ? POISSON_DATASET : DIFFRACTION_DATASET;
    List<FrameSource> frames = new ArrayList<>();
    switch (layout) {
      case LEGACY:
        List<Path> listing = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(path)) {
          for (Path entry : stream) {
            listing.add(entry);
          }
        }
        listing.sort((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()));
        // Indices are positions before filtering on the extension.
        for (int i = 0; i < listing.size(); i++) {
          Path file = listing.get(i);
          if (patternSelection.includes(i)
              && isExtension(file.getFileName().toString(), H5_EXTENSION)) {
            frames.add(new FrameSource(file, DATA_GROUP + "/" + dataset));
          }
        }
        break;
      case CONSOLIDATED:
      default:
        List<String> keys;
        if (patternSelection.isAll()) {
          try (HierarchicalStore store = storeFactory.open(path)) {
            keys = store.keys(DATA_GROUP);
          }
        } else {
          keys = new ArrayList<>();
          for (int index : patternSelection.getIndices()) {
            keys.add(format(Locale.ROOT, "%07d", index));
          }
        }
        for (String key : keys) {
          frames.add(new FrameSource(path, DATA_GROUP + "/" + key + "/" + dataset));
        }
        break;
    }
    logger.fine(format(" %d frames selected from %s.", frames.size(), path));
    return frames;
  }

  /** A frame: the file that holds it and its dataset path. */
  private static class FrameSource {

    private final Path file;
    private final String dataset;

    FrameSource(Path file, String dataset) {
      this.file = file;
      this.dataset = dataset;
    }

    @Override
    public String toString() {
      return file + ":" + dataset;
    }
  }

  /**
   * A single pass over the selected frames. Frames are read on demand, so abandoning the iterator
   * early leaves the remaining frames unread.
   */
  public class PatternIterator implements Iterator<double[][]> {

    private final ReadErrorPolicy policy = getReadErrorPolicy();
    private final List<String> skipped = new ArrayList<>();
    private List<FrameSource> frames = null;
    private int position = 0;
    private double[][] next = null;
    private boolean reported = false;

    /** {@inheritDoc} */
    @Override
    public boolean hasNext() {
      if (frames == null) {
        try {
          frames = listFrames();
        } catch (IOException e) {
          throw new UncheckedIOException(e);
        }
      }
      while (next == null && position < frames.size()) {
        FrameSource frame = frames.get(position++);
        try {
          next = read(frame);
        } catch (IOException | IllegalArgumentException e) {
          if (policy == ReadErrorPolicy.FAIL) {
            if (e instanceof IOException) {
              throw new UncheckedIOException((IOException) e);
            }
            throw (IllegalArgumentException) e;
          }
          skipped.add(frame.toString());
          logger.log(Level.WARNING, format(" Skipping unreadable frame %s.", frame), e);
        }
      }
      if (next == null && !reported && !skipped.isEmpty()) {
        reported = true;
        logger.info(format(" %d of %d frames in %s could not be read and were skipped.",
            skipped.size(), frames.size(), path));
      }
      return next != null;
    }

    /** {@inheritDoc} */
    @Override
    public double[][] next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      double[][] frame = next;
      next = null;
      return frame;
    }

    /**
     * The frames skipped so far, as "file:dataset" descriptions.
     *
     * @return an unmodifiable list.
     */
    public List<String> getSkipped() {
      return Collections.unmodifiableList(skipped);
    }

    private double[][] read(FrameSource frame) throws IOException {
      try (HierarchicalStore store = storeFactory.open(frame.file)) {
        double[][] data = Frames.toFrame(store.read(frame.dataset));
        logger.finest(format(" Read frame %s.", frame));
        return data;
      }
    }
  }
}
