// This file is part of OpenTSDB.
// Copyright (C) 2018  The OpenTSDB Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.shardtsdb.utils;

import java.util.Map;
import java.util.Properties;

import com.google.common.collect.Maps;

/**
 * Query layer configuration.
 *
 * On initialization default values are configured for all variables. Callers
 * may then override single values, e.g. from the command line.
 * The {@link #getString(String)} helper returns null if the property isn't
 * found.
 */
public class Config {

  /** The name of the shard enumerating reader. */
  public static final String READER_KEY = "shardtsdb.query.reader";

  /** Mapper names per query kind. */
  public static final String MGET_MAPPER_KEY = "shardtsdb.query.mapper.mget";
  public static final String RANGE_MAPPER_KEY = "shardtsdb.query.mapper.range";
  public static final String INDEX_MAPPER_KEY = "shardtsdb.query.mapper.index";

  /** The {@code ExecutionMode} name plans are run with. */
  public static final String EXECUTION_MODE_KEY =
      "shardtsdb.query.execution_mode";

  /**
   * The list of properties configured to their defaults or modified by users
   */
  protected final Properties properties = new Properties();

  /** Constructor that initializes default configuration values. */
  public Config() {
    setDefaults();
  }

  /**
   * Allows for modifying properties after loading. Meant for initialization
   * and command line overrides.
   *
   * @param property The name of the property to override
   * @param value The value to store
   */
  public void overrideConfig(final String property, final String value) {
    properties.put(property, value);
  }

  /**
   * Returns the given property as a String
   * @param property The property to load
   * @return The property value as a string, null if it did not exist
   */
  public final String getString(final String property) {
    return properties.getProperty(property);
  }

  /**
   * Loads default entries that were not provided by a file or command line
   *
   * This should be called in the constructor
   */
  protected void setDefaults() {
    final Map<String, String> map = Maps.newHashMap();
    map.put(READER_KEY, "ShardIDReader");
    map.put(MGET_MAPPER_KEY, "ShardMgetMapper");
    map.put(RANGE_MAPPER_KEY, "ShardSeriesMapper");
    map.put(INDEX_MAPPER_KEY, "ShardQueryindexMapper");
    map.put(EXECUTION_MODE_KEY, "ASYNC");

    for (final Map.Entry<String, String> entry : map.entrySet()) {
      if (!properties.containsKey(entry.getKey())) {
        properties.put(entry.getKey(), entry.getValue());
      }
    }
  }

}
