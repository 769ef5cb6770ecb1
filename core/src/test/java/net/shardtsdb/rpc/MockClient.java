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

import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import com.google.common.collect.Lists;

/**
 * A connection that buffers everything written to it. Direct replies, made
 * before the client was blocked, and replies made through thread safe
 * contexts go to separate buffers so tests can tell the two paths apart.
 * Lifecycle calls are appended to {@link #events}.
 */
public class MockClient implements ClientConnection {

  /** Replies written on the connection itself. */
  public final ReplyBuffer direct = new ReplyBuffer();

  /** Replies written through thread safe contexts. */
  public final ReplyBuffer blocked = new ReplyBuffer();

  public final List<String> events =
      Collections.synchronizedList(Lists.<String>newArrayList());

  public final AtomicInteger blocks = new AtomicInteger();
  public final AtomicInteger unblocks = new AtomicInteger();
  public final AtomicInteger contexts = new AtomicInteger();
  public final AtomicInteger closed_contexts = new AtomicInteger();

  /** Set when a context was written to after it was closed or unblocked. */
  public volatile boolean late_write;

  @Override
  public BlockedClient block() {
    blocks.incrementAndGet();
    events.add("block");
    return new MockBlockedClient();
  }

  /** @return The number of top level replies on either path. */
  public int replyCount() {
    return direct.replies().size() + blocked.replies().size();
  }

  /** @return The single reply written, on whichever path. */
  public Object onlyReply() {
    if (replyCount() != 1) {
      throw new IllegalStateException("Expected exactly one reply but got "
          + direct.replies() + " and " + blocked.replies());
    }
    return direct.replies().isEmpty() ? blocked.lastReply() : direct.lastReply();
  }

  @Override
  public void replyWithArray(final long length) {
    direct.replyWithArray(length);
  }

  @Override
  public void replyWithString(final String value) {
    direct.replyWithString(value);
  }

  @Override
  public void replyWithSimpleString(final String value) {
    direct.replyWithSimpleString(value);
  }

  @Override
  public void replyWithLong(final long value) {
    direct.replyWithLong(value);
  }

  @Override
  public void replyWithDouble(final double value) {
    direct.replyWithDouble(value);
  }

  @Override
  public void replyWithNull() {
    direct.replyWithNull();
  }

  @Override
  public void replyWithError(final String message) {
    direct.replyWithError(message);
  }

  class MockBlockedClient implements BlockedClient {
    private volatile boolean unblocked;

    @Override
    public ReplyContext threadSafeContext() {
      contexts.incrementAndGet();
      events.add("context");
      return new MockContext(this);
    }

    @Override
    public void unblock() {
      if (unblocked) {
        throw new IllegalStateException("Client was already unblocked.");
      }
      unblocked = true;
      unblocks.incrementAndGet();
      events.add("unblock");
    }
  }

  class MockContext implements ReplyContext {
    private final MockBlockedClient client;
    private volatile boolean closed;
    private volatile boolean written;

    MockContext(final MockBlockedClient client) {
      this.client = client;
    }

    private ReplyWriter writer() {
      if (closed || client.unblocked) {
        late_write = true;
      }
      if (!written) {
        written = true;
        events.add("write");
      }
      return blocked;
    }

    @Override
    public void replyWithArray(final long length) {
      writer().replyWithArray(length);
    }

    @Override
    public void replyWithString(final String value) {
      writer().replyWithString(value);
    }

    @Override
    public void replyWithSimpleString(final String value) {
      writer().replyWithSimpleString(value);
    }

    @Override
    public void replyWithLong(final long value) {
      writer().replyWithLong(value);
    }

    @Override
    public void replyWithDouble(final double value) {
      writer().replyWithDouble(value);
    }

    @Override
    public void replyWithNull() {
      writer().replyWithNull();
    }

    @Override
    public void replyWithError(final String message) {
      writer().replyWithError(message);
    }

    @Override
    public void close() {
      if (closed) {
        throw new IllegalStateException("Context was already closed.");
      }
      closed = true;
      closed_contexts.incrementAndGet();
      events.add("close");
    }
  }
}
