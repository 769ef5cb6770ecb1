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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import org.junit.Test;

public class TestConfig {

  @Test
  public void defaults() throws Exception {
    final Config config = new Config();
    assertEquals("ShardIDReader", config.getString(Config.READER_KEY));
    assertEquals("ShardMgetMapper", config.getString(Config.MGET_MAPPER_KEY));
    assertEquals("ShardSeriesMapper",
        config.getString(Config.RANGE_MAPPER_KEY));
    assertEquals("ShardQueryindexMapper",
        config.getString(Config.INDEX_MAPPER_KEY));
    assertEquals("ASYNC", config.getString(Config.EXECUTION_MODE_KEY));
    assertNull(config.getString("no.such.key"));
  }

  @Test
  public void overrideConfig() throws Exception {
    final Config config = new Config();
    config.overrideConfig(Config.READER_KEY, "MyReader");
    config.overrideConfig(Config.EXECUTION_MODE_KEY, "SYNC");
    assertEquals("MyReader", config.getString(Config.READER_KEY));
    assertEquals("SYNC", config.getString(Config.EXECUTION_MODE_KEY));
    assertEquals("ShardMgetMapper", config.getString(Config.MGET_MAPPER_KEY));

    // defaults never clobber an override
    config.setDefaults();
    assertEquals("MyReader", config.getString(Config.READER_KEY));
  }
}
