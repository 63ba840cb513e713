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
package msx.array;

import static java.lang.String.format;

import java.util.logging.Logger;
import msx.utilities.MSXProperties;
import org.apache.commons.configuration2.CompositeConfiguration;

/**
 * Immutable settings that control how lazy arrays are built and computed: the device, whether
 * results are lazy by default, the target chunk size in bytes, the worker thread count and whether
 * block completion is logged.
 *
 * <p>Settings are resolved once at the outermost entry point (usually from {@link
 * MSXProperties#defaultProperties()}) and passed explicitly to the operations that need them.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class ComputeSettings {

  private static final Logger logger = Logger.getLogger(ComputeSettings.class.getName());

  /** Default chunk size of 128 MiB. */
  public static final long DEFAULT_CHUNK_SIZE = 128L * 1024L * 1024L;

  private final Device device;
  private final boolean lazy;
  private final long chunkSize;
  private final int threads;
  private final boolean progress;

  /**
   * Constructor for ComputeSettings.
   *
   * @param device    the device.
   * @param lazy      true if results should be lazy by default.
   * @param chunkSize target chunk size in bytes.
   * @param threads   worker threads (zero or less uses the available processors).
   * @param progress  true to log block completion.
   */
  public ComputeSettings(Device device, boolean lazy, long chunkSize, int threads,
      boolean progress) {
    if (chunkSize <= 0) {
      throw new IllegalArgumentException(format(" The chunk size must be positive (%d).",
          chunkSize));
    }
    this.device = device;
    this.lazy = lazy;
    this.chunkSize = chunkSize;
    this.threads = threads > 0 ? threads : Runtime.getRuntime().availableProcessors();
    this.progress = progress;
  }

  /**
   * Settings from the default properties (system properties then bundled defaults).
   *
   * @return the ComputeSettings.
   */
  public static ComputeSettings defaults() {
    return fromProperties(MSXProperties.defaultProperties());
  }

  /**
   * Settings from a configuration.
   *
   * @param properties the configuration.
   * @return the ComputeSettings.
   */
  public static ComputeSettings fromProperties(CompositeConfiguration properties) {
    Device device = Device.parse(properties.getString(MSXProperties.DEVICE, "cpu"));
    boolean lazy = properties.getBoolean(MSXProperties.LAZY, true);
    long chunkSize = properties.getLong(MSXProperties.CHUNK_SIZE, DEFAULT_CHUNK_SIZE);
    int threads = properties.getInt(MSXProperties.THREADS, 0);
    boolean progress = properties.getBoolean(MSXProperties.PROGRESS, false);
    ComputeSettings settings = new ComputeSettings(device, lazy, chunkSize, threads, progress);
    logger.fine(settings.toString());
    return settings;
  }

  public Device getDevice() {
    return device;
  }

  public boolean isLazy() {
    return lazy;
  }

  public long getChunkSize() {
    return chunkSize;
  }

  public int getThreads() {
    return threads;
  }

  public boolean isProgress() {
    return progress;
  }

  /**
   * A copy with a different laziness.
   *
   * @param lazy true for lazy results.
   * @return new settings.
   */
  public ComputeSettings withLazy(boolean lazy) {
    return new ComputeSettings(device, lazy, chunkSize, threads, progress);
  }

  /**
   * A copy with a different chunk size.
   *
   * @param chunkSize the chunk size in bytes.
   * @return new settings.
   */
  public ComputeSettings withChunkSize(long chunkSize) {
    return new ComputeSettings(device, lazy, chunkSize, threads, progress);
  }

  /**
   * A copy with a different thread count.
   *
   * @param threads the thread count.
   * @return new settings.
   */
  public ComputeSettings withThreads(int threads) {
    return new ComputeSettings(device, lazy, chunkSize, threads, progress);
  }

  /**
   * A copy with a different device.
   *
   * @param device the device.
   * @return new settings.
   */
  public ComputeSettings withDevice(Device device) {
    return new ComputeSettings(device, lazy, chunkSize, threads, progress);
  }

  @Override
  public String toString() {
    return format(" Compute settings: device %s, lazy %b, chunk size %d bytes, %d threads.",
        device, lazy, chunkSize, threads);
  }
}
