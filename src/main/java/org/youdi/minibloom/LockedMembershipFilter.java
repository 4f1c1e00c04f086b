package org.youdi.minibloom;

import java.util.BitSet;
import java.util.Collection;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Guards a filter with a read/write lock: lookups share the read lock, mutations take the write
 * lock. Bulk operations hold the lock for the whole collection.
 */
class LockedMembershipFilter<E> implements MembershipFilter<E> {

  private final MembershipFilter<E> filter;
  protected final ReentrantReadWriteLock updateLock = new ReentrantReadWriteLock();

  LockedMembershipFilter(MembershipFilter<E> filter) {
    if (filter == null) {
      throw new NullPointerException("filter can not be null");
    }
    this.filter = filter;
  }

  @Override
  public boolean add(byte[] bytes) {
    updateLock.writeLock().lock();
    try {
      return filter.add(bytes);
    } finally {
      updateLock.writeLock().unlock();
    }
  }

  @Override
  public boolean addAll(Collection<? extends E> elements) {
    updateLock.writeLock().lock();
    try {
      return filter.addAll(elements);
    } finally {
      updateLock.writeLock().unlock();
    }
  }

  @Override
  public boolean contains(byte[] bytes) {
    updateLock.readLock().lock();
    try {
      return filter.contains(bytes);
    } finally {
      updateLock.readLock().unlock();
    }
  }

  @Override
  public boolean containsAll(Collection<? extends E> elements) {
    updateLock.readLock().lock();
    try {
      return filter.containsAll(elements);
    } finally {
      updateLock.readLock().unlock();
    }
  }

  @Override
  public void clear() {
    updateLock.writeLock().lock();
    try {
      filter.clear();
    } finally {
      updateLock.writeLock().unlock();
    }
  }

  @Override
  public boolean getBit(int index) {
    updateLock.readLock().lock();
    try {
      return filter.getBit(index);
    } finally {
      updateLock.readLock().unlock();
    }
  }

  @Override
  public BitSet getBitSet() {
    updateLock.readLock().lock();
    try {
      return filter.getBitSet();
    } finally {
      updateLock.readLock().unlock();
    }
  }

  @Override
  public byte[] toBytes(E element) {
    return filter.toBytes(element);
  }

  @Override
  public FilterConfig getFilterConfig() {
    return filter.getFilterConfig();
  }

  @Override
  public Config getConfig() {
    return filter.getConfig();
  }

  @Override
  public long getNumberOfAddedElements() {
    updateLock.readLock().lock();
    try {
      return filter.getNumberOfAddedElements();
    } finally {
      updateLock.readLock().unlock();
    }
  }

  /**
   * @return a locked copy of the wrapped filter.
   */
  @Override
  public MembershipFilter<E> copy() {
    updateLock.readLock().lock();
    try {
      return new LockedMembershipFilter<>(filter.copy());
    } finally {
      updateLock.readLock().unlock();
    }
  }

  @Override
  public String toString() {
    updateLock.readLock().lock();
    try {
      return filter.toString();
    } finally {
      updateLock.readLock().unlock();
    }
  }
}
