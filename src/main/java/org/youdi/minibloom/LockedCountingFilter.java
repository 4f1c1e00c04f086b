package org.youdi.minibloom;

import java.util.Collection;

class LockedCountingFilter<E> extends LockedMembershipFilter<E> implements CountingFilter<E> {

  private final CountingFilter<E> filter;

  LockedCountingFilter(CountingFilter<E> filter) {
    super(filter);
    this.filter = filter;
  }

  @Override
  public int count(byte[] bytes) {
    updateLock.readLock().lock();
    try {
      return filter.count(bytes);
    } finally {
      updateLock.readLock().unlock();
    }
  }

  @Override
  public boolean remove(byte[] bytes) {
    updateLock.writeLock().lock();
    try {
      return filter.remove(bytes);
    } finally {
      updateLock.writeLock().unlock();
    }
  }

  @Override
  public boolean removeAll(Collection<? extends E> elements) {
    updateLock.writeLock().lock();
    try {
      return filter.removeAll(elements);
    } finally {
      updateLock.writeLock().unlock();
    }
  }

  @Override
  public int getCount(int index) {
    updateLock.readLock().lock();
    try {
      return filter.getCount(index);
    } finally {
      updateLock.readLock().unlock();
    }
  }

  @Override
  public int[] getCounters() {
    updateLock.readLock().lock();
    try {
      return filter.getCounters();
    } finally {
      updateLock.readLock().unlock();
    }
  }

  @Override
  public CountingFilter<E> copy() {
    updateLock.readLock().lock();
    try {
      return new LockedCountingFilter<>(filter.copy());
    } finally {
      updateLock.readLock().unlock();
    }
  }
}
