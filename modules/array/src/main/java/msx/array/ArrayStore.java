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
import static java.util.Collections.singletonList;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.FileAlreadyExistsException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.logging.Level;
import java.util.logging.Logger;
import msx.array.axes.AxisMetadata;
import msx.array.lazy.LazyArray;
import msx.array.lazy.LazyEvaluator;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.io.FileHandler;
import org.apache.commons.io.FileUtils;

/**
 * Persists ArrayObjects as a directory of chunk files plus attributes.
 *
 * <p>Layout:
 * <br>
 * &lt;dir&gt;/attributes.properties - the type tag, device, axis metadata and scalar metadata.
 * <br>
 * &lt;dir&gt;/array/array.properties - shape, chunks and element type.
 * <br>
 * &lt;dir&gt;/array/&lt;i.j.k...&gt; - one little-endian block of doubles per chunk.
 *
 * <p>Attribute values carry a type prefix (double:, int:, long:, boolean: or string:) so that
 * metadata is restored with its original type. Lists are written as key.count followed by key.i
 * entries. Reading is lazy: blocks are loaded when the returned object is computed.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class ArrayStore {

  private static final Logger logger = Logger.getLogger(ArrayStore.class.getName());

  /** Attribute file name. */
  public static final String ATTRIBUTES = "attributes.properties";
  /** Array directory name. */
  public static final String ARRAY = "array";
  /** Array header file name. */
  public static final String HEADER = "array.properties";

  private static final String TYPE = "type";
  private static final String DEVICE = "device";
  private static final String ENSEMBLE_AXES = "ensemble_axes_metadata";
  private static final String BASE_AXES = "base_axes_metadata";
  private static final String METADATA = "metadata";
  private static final String COUNT = "count";
  private static final String ENCODING = "UTF-8";

  private ArrayStore() {
  }

  /**
   * Write an object. Lazy objects are computed block by block while writing.
   *
   * @param object    the object.
   * @param directory the target directory.
   * @param overwrite true to replace an existing directory.
   * @param settings  the compute settings.
   * @throws IOException if the directory exists (and overwrite is false) or cannot be written.
   */
  public static void write(ArrayObject object, File directory, boolean overwrite,
      ComputeSettings settings) throws IOException {
    if (directory.exists()) {
      if (!overwrite) {
        throw new FileAlreadyExistsException(directory.getPath());
      }
      FileUtils.deleteDirectory(directory);
    }
    File arrayDirectory = new File(directory, ARRAY);
    FileUtils.forceMkdir(arrayDirectory);

    ArrayObject lazy = object.ensureLazy(settings);
    LazyArray array = lazy.getLazyArray();

    PropertiesConfiguration header = new PropertiesConfiguration();
    header.setProperty("shape", join(array.getShape()));
    header.setProperty("dtype", array.getDataType().name());
    header.setProperty("byte_order", "little_endian");
    int[][] chunks = array.getChunks();
    for (int i = 0; i < chunks.length; i++) {
      header.setProperty("chunks." + i, join(chunks[i]));
    }
    save(header, new File(arrayDirectory, HEADER));

    PropertiesConfiguration attributes = new PropertiesConfiguration();
    attributes.setProperty(TYPE, encode(object.getType().getTag()));
    attributes.setProperty(DEVICE, encode(object.getDevice().getDeviceName()));
    putAxes(attributes, ENSEMBLE_AXES, object.getEnsembleAxesMetadata());
    putAxes(attributes, BASE_AXES, object.getBaseAxesMetadata());
    for (Map.Entry<String, Object> entry : object.getMetadata().entrySet()) {
      attributes.setProperty(METADATA + "." + entry.getKey(), encode(entry.getValue()));
    }
    save(attributes, new File(directory, ATTRIBUTES));

    LazyEvaluator.forEachBlock(singletonList(array), settings, (i, blockIndex, block) -> {
      double[] data = block.getData();
      ByteBuffer buffer = ByteBuffer.allocate(data.length * Double.BYTES)
          .order(ByteOrder.LITTLE_ENDIAN);
      buffer.asDoubleBuffer().put(data);
      FileUtils.writeByteArrayToFile(new File(arrayDirectory, blockName(blockIndex)),
          buffer.array());
    });
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" Wrote %s of shape %s to %s.", object.getType().getTag(),
          Arrays.toString(array.getShape()), directory));
    }
  }

  /**
   * Read an object written by {@link #write(ArrayObject, File, boolean, ComputeSettings)}. The
   * returned object is lazy.
   *
   * @param directory the directory.
   * @param types     the kinds that may be read, matched by tag.
   * @return the object.
   * @throws IOException if the directory cannot be read or its type is unknown.
   */
  public static ArrayObject read(File directory, Collection<? extends ArrayObjectType> types)
      throws IOException {
    File arrayDirectory = new File(directory, ARRAY);
    PropertiesConfiguration attributes = load(new File(directory, ATTRIBUTES));
    PropertiesConfiguration header = load(new File(arrayDirectory, HEADER));

    String tag = (String) decode(attributes.getString(TYPE));
    ArrayObjectType type = null;
    for (ArrayObjectType t : types) {
      if (t.getTag().equals(tag)) {
        type = t;
      }
    }
    if (type == null) {
      throw new IOException(format(" Unknown array object type %s in %s.", tag, directory));
    }
    Device device = Device.parse((String) decode(attributes.getString(DEVICE)));

    int[] shape = split(header.getString("shape"));
    DataType dtype = DataType.valueOf(header.getString("dtype"));
    int[][] chunks = new int[shape.length][];
    for (int i = 0; i < shape.length; i++) {
      chunks[i] = split(header.getString("chunks." + i));
    }

    LazyArray array = LazyArray.fromBlocks(chunks, dtype, (blockIndex, start, blockShape) -> {
      File file = new File(arrayDirectory, blockName(blockIndex));
      try {
        ByteBuffer buffer = ByteBuffer.wrap(FileUtils.readFileToByteArray(file))
            .order(ByteOrder.LITTLE_ENDIAN);
        double[] data = new double[buffer.remaining() / Double.BYTES];
        buffer.asDoubleBuffer().get(data);
        return ArrayData.wrap(dtype, data, blockShape);
      } catch (IOException e) {
        throw new UncheckedIOException(format(" Block %s could not be read.", file), e);
      }
    });

    List<AxisMetadata> axes = getAxes(attributes, ENSEMBLE_AXES);
    axes.addAll(getAxes(attributes, BASE_AXES));
    Map<String, Object> metadata = new LinkedHashMap<>();
    Iterator<String> keys = attributes.getKeys(METADATA);
    while (keys.hasNext()) {
      String key = keys.next();
      metadata.put(key.substring(METADATA.length() + 1), decode(attributes.getString(key)));
    }
    return type.create(BackingArray.of(array), axes, metadata, device);
  }

  private static String blockName(int[] blockIndex) {
    if (blockIndex.length == 0) {
      return "0";
    }
    StringJoiner joiner = new StringJoiner(".");
    for (int i : blockIndex) {
      joiner.add(Integer.toString(i));
    }
    return joiner.toString();
  }

  private static void putAxes(PropertiesConfiguration config, String prefix,
      List<AxisMetadata> axes) {
    config.setProperty(prefix + "." + COUNT, encode(axes.size()));
    for (int i = 0; i < axes.size(); i++) {
      for (Map.Entry<String, Object> entry : axes.get(i).toMap().entrySet()) {
        String key = prefix + "." + i + "." + entry.getKey();
        Object value = entry.getValue();
        if (value instanceof List) {
          List<?> list = (List<?>) value;
          config.setProperty(key + "." + COUNT, encode(list.size()));
          for (int j = 0; j < list.size(); j++) {
            config.setProperty(key + "." + j, encode(list.get(j)));
          }
        } else {
          config.setProperty(key, encode(value));
        }
      }
    }
  }

  private static List<AxisMetadata> getAxes(PropertiesConfiguration config, String prefix)
      throws IOException {
    int count = (Integer) decode(config.getString(prefix + "." + COUNT));
    List<AxisMetadata> axes = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      String axisPrefix = prefix + "." + i;
      Map<String, Object> map = new LinkedHashMap<>();
      Map<String, Integer> lists = new LinkedHashMap<>();
      Iterator<String> keys = config.getKeys(axisPrefix);
      while (keys.hasNext()) {
        String key = keys.next().substring(axisPrefix.length() + 1);
        if (key.endsWith("." + COUNT)) {
          String field = key.substring(0, key.length() - COUNT.length() - 1);
          lists.put(field, (Integer) decode(config.getString(axisPrefix + "." + key)));
        }
      }
      keys = config.getKeys(axisPrefix);
      while (keys.hasNext()) {
        String full = keys.next();
        String key = full.substring(axisPrefix.length() + 1);
        if (key.indexOf('.') < 0) {
          map.put(key, decode(config.getString(full)));
        }
      }
      for (Map.Entry<String, Integer> list : lists.entrySet()) {
        List<Object> values = new ArrayList<>(list.getValue());
        for (int j = 0; j < list.getValue(); j++) {
          values.add(decode(config.getString(axisPrefix + "." + list.getKey() + "." + j)));
        }
        map.put(list.getKey(), values);
      }
      try {
        axes.add(AxisMetadata.fromMap(map));
      } catch (IllegalArgumentException e) {
        throw new IOException(format(" Axis metadata %s could not be read.", axisPrefix), e);
      }
    }
    return axes;
  }

  /**
   * Encode a primitive value with a type prefix.
   *
   * @param value the value.
   * @return the encoded value.
   */
  static String encode(Object value) {
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return "int:" + value;
    } else if (value instanceof Long) {
      return "long:" + value;
    } else if (value instanceof Number) {
      return "double:" + ((Number) value).doubleValue();
    } else if (value instanceof Boolean) {
      return "boolean:" + value;
    } else if (value instanceof String) {
      return "string:" + value;
    }
    throw new IllegalArgumentException(format(" Value %s cannot be stored.", value));
  }

  /**
   * Decode a value written by {@link #encode(Object)}.
   *
   * @param encoded the encoded value.
   * @return the value.
   * @throws IOException if the value has no recognized prefix.
   */
  static Object decode(String encoded) throws IOException {
    if (encoded == null) {
      throw new IOException(" A required attribute is missing.");
    }
    int colon = encoded.indexOf(':');
    if (colon < 0) {
      throw new IOException(format(" Attribute %s has no type prefix.", encoded));
    }
    String value = encoded.substring(colon + 1);
    switch (encoded.substring(0, colon)) {
      case "int":
        return Integer.valueOf(value);
      case "long":
        return Long.valueOf(value);
      case "double":
        return Double.valueOf(value);
      case "boolean":
        return Boolean.valueOf(value);
      case "string":
        return value;
      default:
        throw new IOException(format(" Attribute %s has an unknown type prefix.", encoded));
    }
  }

  private static String join(int[] values) {
    StringJoiner joiner = new StringJoiner(" ");
    for (int v : values) {
      joiner.add(Integer.toString(v));
    }
    return joiner.toString();
  }

  private static int[] split(String values) throws IOException {
    if (values == null) {
      throw new IOException(" The array header is incomplete.");
    }
    String trimmed = values.trim();
    if (trimmed.isEmpty()) {
      return new int[0];
    }
    return Arrays.stream(trimmed.split("\\s+")).mapToInt(Integer::parseInt).toArray();
  }

  private static void save(PropertiesConfiguration config, File file) throws IOException {
    FileHandler handler = new FileHandler(config);
    handler.setEncoding(ENCODING);
    try {
      handler.save(file);
    } catch (ConfigurationException e) {
      throw new IOException(format(" %s could not be written.", file), e);
    }
  }

  private static PropertiesConfiguration load(File file) throws IOException {
    if (!file.isFile()) {
      throw new IOException(format(" %s does not exist.", file));
    }
    PropertiesConfiguration config = new PropertiesConfiguration();
    FileHandler handler = new FileHandler(config);
    handler.setEncoding(ENCODING);
    try {
      handler.load(file);
    } catch (ConfigurationException e) {
      throw new IOException(format(" %s could not be read.", file), e);
    }
    return config;
  }
}
