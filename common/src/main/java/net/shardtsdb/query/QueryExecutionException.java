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
package net.shardtsdb.query;

/**
 * Base for the exceptions thrown while parsing, validating or dispatching a
 * distributed query. The message is suitable for returning to the client.
 * 
 * @since 3.0
 */
public class QueryExecutionException extends RuntimeException {
  /** Serial for this exception. Auto generated. */
  private static final long serialVersionUID = -3184561398723140931L;

  public QueryExecutionException(final String msg) {
    super(msg);
  }
  
  public QueryExecutionException(final String msg, final Throwable cause) {
    super(msg, cause);
  }
}
