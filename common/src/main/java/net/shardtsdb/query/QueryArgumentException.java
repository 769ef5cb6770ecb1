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
 * Thrown when the shape of a command is wrong, e.g. the arity is off or a
 * mandatory clause such as FILTER is missing. Raised before any distributed
 * work is started.
 * 
 * @since 3.0
 */
public class QueryArgumentException extends QueryExecutionException {
  /** Serial for this exception. Auto generated. */
  private static final long serialVersionUID = 2294016724398151277L;

  public QueryArgumentException(final String msg) {
    super(msg);
  }
  
  public QueryArgumentException(final String msg, final Throwable cause) {
    super(msg, cause);
  }
}
