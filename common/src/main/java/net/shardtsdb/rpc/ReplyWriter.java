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
package net.shardtsdb.rpc;

/**
 * The low level reply primitives of a client connection. An array header
 * announces the number of elements that follow; every element is one call
 * to a primitive or a nested array.
 * 
 * @since 3.0
 */
public interface ReplyWriter {

  /**
   * Starts an array of the given length.
   * @param length The number of elements that follow, 0 or more.
   */
  public void replyWithArray(final long length);
  
  public void replyWithString(final String value);
  
  public void replyWithSimpleString(final String value);
  
  public void replyWithLong(final long value);
  
  public void replyWithDouble(final double value);
  
  public void replyWithNull();
  
  /**
   * Writes an error reply.
   * @param message The error message, sent verbatim.
   */
  public void replyWithError(final String message);
  
}
