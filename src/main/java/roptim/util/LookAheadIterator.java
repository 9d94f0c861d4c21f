package roptim.util;

import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.Optional;

/** An {@link Iterator} decorator which enables look ahead into iterated elements. */
public class LookAheadIterator<T> implements Iterator<T> {

  private final Iterator<T> it;
  private final ArrayDeque<T> nextElements = new ArrayDeque<>(16);
  private boolean isBeforeFirstElement = true;

  public LookAheadIterator(Iterator<T> it) {
    this.it = it;
  }

  /**
   * Looks ahead into the stream of elements and returns the element that the n-th call to {@link
   * #next()} would return, or {@link Optional#empty()} if the stream ends before.
   *
   * <p>{@code lookAhead(0)} is always the 'current' element, if any. On a fresh iterator it is
   * empty, because we start 'before' the first element. {@code lookAhead(1)} is then the first
   * element.
   *
   * @param n non-negative number of elements to look ahead.
   */
  public Optional<T> lookAhead(int n) {
    if (n < 0) {
      throw new IllegalArgumentException("n was negative");
    }

    if (isBeforeFirstElement) {
      // next() wasn't called yet, so there is no current element at index 0 of the queue
      if (n == 0) {
        return Optional.empty();
      }
      n--;
    }

    while (nextElements.size() <= n) {
      if (!it.hasNext()) {
        return Optional.empty();
      }
      nextElements.addLast(it.next());
    }

    // ArrayDeque has no random access
    Iterator<T> q = nextElements.iterator();
    while (true) {
      T cur = q.next();
      if (n-- == 0) {
        return Optional.of(cur);
      }
    }
  }

  @Override
  public boolean hasNext() {
    return lookAhead(1).isPresent();
  }

  @Override
  public T next() {
    Optional<T> ret = lookAhead(1);

    if (!ret.isPresent()) {
      // let the decorated iterator figure out how to handle this
      return it.next();
    }

    if (isBeforeFirstElement) {
      isBeforeFirstElement = false;
    } else {
      nextElements.removeFirst();
    }
    return ret.get();
  }
}
