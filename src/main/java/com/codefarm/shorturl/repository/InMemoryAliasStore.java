package com.codefarm.shorturl.repository;

import com.codefarm.shorturl.exception.ShortcodeConflictException;
import com.codefarm.shorturl.exception.ShortcodeNotFoundException;
import com.codefarm.shorturl.model.AliasRecord;
import com.codefarm.shorturl.model.AliasTarget;
import com.codefarm.shorturl.model.ClickEvent;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-lifetime store. Inserts race on {@link ConcurrentMap#putIfAbsent}; clicks lock only the
 * entry they touch, so different short codes never contend.
 */
@Repository
public class InMemoryAliasStore implements AliasStore {

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();

    @Override
    public void insert(AliasRecord record) {
        Entry previous = entries.putIfAbsent(record.getShortcode(), new Entry(record));
        if (previous != null) {
            throw new ShortcodeConflictException(record.getShortcode());
        }
    }

    @Override
    public boolean contains(String shortcode) {
        return entries.containsKey(shortcode);
    }

    @Override
    public Optional<AliasRecord> get(String shortcode) {
        Entry entry = entries.get(shortcode);
        return entry == null ? Optional.empty() : Optional.of(entry.snapshot());
    }

    @Override
    public Optional<AliasTarget> findTarget(String shortcode) {
        Entry entry = entries.get(shortcode);
        return entry == null ? Optional.empty() : Optional.of(entry.target);
    }

    @Override
    public int recordClick(String shortcode, ClickEvent event) {
        Entry entry = entries.get(shortcode);
        if (entry == null) {
            throw new ShortcodeNotFoundException(shortcode);
        }
        return entry.append(event);
    }

    @Override
    public int size() {
        return entries.size();
    }

    private static final class Entry {

        private final AliasRecord base;
        // immutable, read without the entry lock
        private final AliasTarget target;
        private final List<ClickEvent> clicks;

        private Entry(AliasRecord base) {
            this.base = base;
            this.target = new AliasTarget(base.getShortcode(), base.getOriginalUrl(), base.getExpiresAt());
            this.clicks = new ArrayList<>(base.getClicks());
        }

        private synchronized int append(ClickEvent event) {
            clicks.add(event);
            return clicks.size();
        }

        private synchronized AliasRecord snapshot() {
            return new AliasRecord(base.getId(), base.getOriginalUrl(), base.getShortcode(),
                    base.getCreatedAt(), base.getExpiresAt(), clicks);
        }
    }
}
