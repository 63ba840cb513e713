// ******************************************************************************
//
// Title:       Multislice X.
// Description: Multislice X - Software for Electron Scattering Simulation.
// Copyright:   Copyright (c) Michael J. Schnieders 2001-2024.
//
// This file is part of Multislice X.
//
// Multislice X is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// Multislice X is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// Multislice X; if not, write to the Free Software Foundation, Inc., 59 Temple
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
package msx.array.ensemble;

import java.util.Arrays;
import java.util.List;
import msx.array.Chunks;
import msx.array.axes.AxisMetadata;

/**
 * An object that represents an ensemble of items along one or more axes, for example a series of
 * tilts or the configurations of a frozen phonon model. An ensemble can be partitioned into blocks
 * of its axes so that each block is computed independently.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public interface Ensemble {

  /**
   * Metadata of the ensemble axes.
   *
   * @return one entry per ensemble axis.
   */
  List<AxisMetadata> getEnsembleAxesMetadata();

  /**
   * The shape of the ensemble.
   *
   * @return the ensemble shape.
   */
  int[] getEnsembleShape();

  /**
   * Requested chunks along each ensemble axis (explicit sizes, {@link Chunks#AUTO} or {@link
   * Chunks#FULL}).
   *
   * @return the requested chunks.
   */
  default int[] getDefaultEnsembleChunks() {
    int[] chunks = new int[getEnsembleShape().length];
    Arrays.fill(chunks, Chunks.AUTO);
    return chunks;
  }

  /**
   * Split the per-axis arguments of this ensemble into blocks.
   *
   * @param chunks the chunk sizes of each ensemble axis.
   * @return the partitioned arguments.
   */
  PartitionedArgs partitionArgs(int[][] chunks);
}
