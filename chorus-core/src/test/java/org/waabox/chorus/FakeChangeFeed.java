package org.waabox.chorus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.waabox.chorus.feed.ChangeFeed;
import org.waabox.chorus.feed.ChangeFeedException;
import org.waabox.chorus.feed.ChangeFeedHandle;
import org.waabox.chorus.feed.ChangeFeedListener;
import org.waabox.chorus.feed.ChangePayload;

/**
 * An in-memory {@link ChangeFeed} whose changes and failures are driven by
 * the test.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class FakeChangeFeed implements ChangeFeed {

  /** Every handle ever opened, in order. */
  private final List<FakeHandle> handles = new ArrayList<>();

  /** How many of the next opens must fail. */
  private final AtomicInteger failingOpens = new AtomicInteger(0);

  /** How many times open was called. */
  private final AtomicInteger openCalls = new AtomicInteger(0);

  /** How many times shutdown was called. */
  private final AtomicInteger shutdownCalls = new AtomicInteger(0);

  @Override
  public synchronized ChangeFeedHandle open(final String resource,
      final ChangeFeedListener listener) throws ChangeFeedException {
    openCalls.incrementAndGet();
    if (failingOpens.get() > 0) {
      failingOpens.decrementAndGet();
      throw new ChangeFeedException("backend unreachable");
    }
    final FakeHandle handle = new FakeHandle(resource, listener);
    handles.add(handle);
    return handle;
  }

  @Override
  public synchronized void close(final ChangeFeedHandle handle) {
    ((FakeHandle) handle).open = false;
  }

  @Override
  public void shutdown() {
    shutdownCalls.incrementAndGet();
  }

  /** Makes the next opens fail.
   *
   * @param count how many opens fail
   */
  void failNextOpens(final int count) {
    failingOpens.set(count);
  }

  /** Delivers a change to every open handle of the resource.
   *
   * @param resource the resource
   * @param action   the action
   */
  void emit(final String resource, final String action) {
    for (final FakeHandle handle : openHandles(resource)) {
      handle.listener.onChange(ChangePayload.of(resource, action, 1L,
          Instant.parse("2024-01-01T00:00:00Z")));
    }
  }

  /** Breaks every open handle of the resource.
   *
   * @param resource the resource
   */
  void breakHandles(final String resource) {
    for (final FakeHandle handle : openHandles(resource)) {
      handle.listener.onFailure(new IllegalStateException("stream reset"));
    }
  }

  /** Returns the open handles of a resource.
   *
   * @param resource the resource
   * @return the open handles
   */
  synchronized List<FakeHandle> openHandles(final String resource) {
    final List<FakeHandle> result = new ArrayList<>();
    for (final FakeHandle handle : handles) {
      if (handle.open && handle.resource.equals(resource)) {
        result.add(handle);
      }
    }
    return result;
  }

  /** Returns every handle ever opened.
   *
   * @return the handles, in order
   */
  synchronized List<FakeHandle> allHandles() {
    return new ArrayList<>(handles);
  }

  int openCalls() {
    return openCalls.get();
  }

  int shutdownCalls() {
    return shutdownCalls.get();
  }

  /** A handle that records whether it was closed. */
  static final class FakeHandle implements ChangeFeedHandle {

    private final String resource;

    private final ChangeFeedListener listener;

    private volatile boolean open = true;

    private FakeHandle(final String theResource,
        final ChangeFeedListener theListener) {
      resource = theResource;
      listener = theListener;
    }

    @Override
    public String resource() {
      return resource;
    }

    @Override
    public boolean isOpen() {
      return open;
    }

    /** Delivers a change through this handle, even if closed.
     *
     * @param action the action
     */
    void deliver(final String action) {
      listener.onChange(ChangePayload.of(resource, action, 1L,
          Instant.parse("2024-01-01T00:00:00Z")));
    }

    /** Reports a failure through this handle, even if closed. */
    void fail() {
      listener.onFailure(new IllegalStateException("late failure"));
    }
  }
}
