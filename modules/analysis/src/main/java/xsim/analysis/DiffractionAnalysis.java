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
import java.nio.file.Path;
import java.util.Iterator;
import java.util.logging.Logger;

import org.apache.commons.configuration2.CompositeConfiguration;

import xsim.utilities.XSimProperties;

import static java.lang.String.format;

/**
 * The DiffractionAnalysis class ties together the patterns and parameters of one simulated
 * diffraction experiment.
 * <p>
 * Patterns are read lazily through a {@link PatternStore}. Parameters are read through a
 * {@link ParameterStore} the first time they are needed and then kept.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class DiffractionAnalysis {

  private static final Logger logger = Logger.getLogger(DiffractionAnalysis.class.getName());

  private final Path inputPath;
  private final PatternStore patternStore;
  private final ParameterStore parameterStore;
  private final ResolutionRingCalculator ringCalculator;
  private DiffractionParameters parameters = null;

  /**
   * Constructor for DiffractionAnalysis of HDF5 data, configured by the properties found for the
   * input path.
   *
   * @param inputPath a directory of pattern files, or a single pattern file.
   * @throws FileNotFoundException if the path is neither a directory nor a file.
   * @see XSimProperties#loadProperties(java.io.File)
   */
  public DiffractionAnalysis(Path inputPath) throws FileNotFoundException {
    this(inputPath, XSimProperties.loadProperties(inputPath.toFile()),
        HierarchicalStoreFactory.HDF5);
  }

  /**
   * Constructor for DiffractionAnalysis of HDF5 data.
   *
   * @param inputPath        a directory of pattern files, or a single pattern file.
   * @param patternSelection the patterns to analyse.
   * @param poissonize       true to read frames with shot noise.
   * @throws FileNotFoundException if the path is neither a directory nor a file.
   */
  public DiffractionAnalysis(Path inputPath, PatternSelection patternSelection, boolean poissonize)
      throws FileNotFoundException {
    this(inputPath, null, HierarchicalStoreFactory.HDF5);
    patternStore.setPatternSelection(patternSelection);
    patternStore.setPoissonize(poissonize);
  }

  /**
   * Constructor for DiffractionAnalysis.
   *
   * @param inputPath    a directory of pattern files, or a single pattern file.
   * @param properties   the configuration; may be null.
   * @param storeFactory opens the data files.
   * @throws FileNotFoundException if the path is neither a directory nor a file.
   */
  public DiffractionAnalysis(Path inputPath, CompositeConfiguration properties,
      HierarchicalStoreFactory storeFactory) throws FileNotFoundException {
    this.inputPath = inputPath;
    patternStore = new PatternStore(inputPath, properties, storeFactory);
    parameterStore = new ParameterStore(storeFactory);
    ringCalculator = new ResolutionRingCalculator(properties);
  }

  public Path getInputPath() {
    return inputPath;
  }

  public PatternStore getPatternStore() {
    return patternStore;
  }

  /**
   * Select the patterns to analyse.
   *
   * @param patternIndices null or "all", an Integer, an int[] or an Iterable of Integers.
   * @throws IllegalArgumentException for any other value.
   */
  public void setPatternIndices(Object patternIndices) {
    patternStore.setPatternIndices(patternIndices);
  }

  public void setPoissonize(boolean poissonize) {
    patternStore.setPoissonize(poissonize);
  }

  /**
   * The beam and geometry parameters, loaded on first use.
   *
   * @return the DiffractionParameters.
   * @throws IOException if the parameters cannot be read.
   */
  public DiffractionParameters getParameters() throws IOException {
    if (parameters == null) {
      parameters = parameterStore.load(inputPath);
    }
    return parameters;
  }

  /**
   * Reduce the selected patterns to a single frame. A single selected pattern is returned as is.
   *
   * @param reduction the reduction, or null for {@link PatternReduction#SUM}.
   * @return the frame.
   * @throws IllegalStateException if no pattern could be read.
   * @throws java.io.UncheckedIOException if a pattern cannot be read and is not skipped.
   */
  public double[][] reducePatterns(PatternReduction reduction) {
    if (patternStore.getPatternSelection().size() == 1) {
      if (reduction != null) {
        logger.warning(
            format(" Reduction %s has no effect on a single pattern.", reduction));
      }
      Iterator<double[][]> iterator = patternStore.iterator();
      if (!iterator.hasNext()) {
        throw new IllegalStateException(
            format(" Pattern %s could not be read.", patternStore.getPatternSelection()));
      }
      return iterator.next();
    }
    PatternReduction r = reduction != null ? reduction : PatternReduction.SUM;
    return r.reduce(patternStore);
  }

  /**
   * Photon statistics of the selected patterns.
   *
   * @return the PhotonStatistics.
   * @throws IllegalStateException if no pattern could be read.
   */
  public PhotonStatistics statistics() {
    return new PhotonStatistics(patternStore);
  }

  /**
   * The resolution rings of the detector.
   *
   * @return the ResolutionRingSet.
   * @throws IOException         if the parameters cannot be read.
   * @throws ArithmeticException if the parameters are outside the domain of the calculation.
   */
  public ResolutionRingSet resolutionRings() throws IOException {
    return ringCalculator.calculate(getParameters());
  }
}
