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
 * A client connection suspended while a distributed query runs. The handle is
 * used exactly once: a reply context is fetched, the reply written, then the
 * client is unblocked.
 * 
 * @since 3.0
 */
public interface BlockedClient {

  /** @return A new thread safe reply context for this client. */
  public ReplyContext threadSafeContext();
  
  /**
   * Resumes the connection. The reply must have been written already.
   * @throws IllegalStateException if the client was already unblocked.
   */
  public void unblock();
  
}
