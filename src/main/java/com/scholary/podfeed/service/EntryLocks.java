package com.scholary.podfeed.service;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * One lock per entry id, held while an entry is published or deleted.
 *
 * <p>Locks are weakly referenced and disappear once no thread holds or waits on them, so the map
 * stays as small as the number of ids currently in flight.
 */
@Component
public class EntryLocks {

  private final LoadingCache<String, ReentrantLock> locks =
      Caffeine.newBuilder().weakValues().build(id -> new ReentrantLock());

  /** Run {@code action} while holding the lock for {@code entryId}. */
  public <T> T withLock(String entryId, Supplier<T> action) {
    ReentrantLock lock = locks.get(entryId);
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }
}
