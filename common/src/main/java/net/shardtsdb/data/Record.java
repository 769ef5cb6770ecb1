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
package net.shardtsdb.data;

import net.shardtsdb.rpc.ReplyWriter;

/**
 * An item collected from a shard. Every record knows how to write itself as
 * one reply element.
 * 
 * @since 3.0
 */
public interface Record {

  /** @return The record tag. */
  public RecordType type();
  
  /**
   * Writes this record as a single reply element.
   * @param writer A non-null writer.
   */
  public void sendReply(final ReplyWriter writer);
  
}
