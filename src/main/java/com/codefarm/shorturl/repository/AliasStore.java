package com.codefarm.shorturl.repository;

import com.codefarm.shorturl.model.AliasRecord;
import com.codefarm.shorturl.model.AliasTarget;
import com.codefarm.shorturl.model.ClickEvent;

import java.util.Optional;

/**
 * Authoritative mapping from short code to alias. Implementations own the records and only ever
 * hand out snapshots.
 */
public interface AliasStore {

    /**
     * @throws com.codefarm.shorturl.exception.ShortcodeConflictException if the short code is taken
     */
    void insert(AliasRecord record);

    boolean contains(String shortcode);

    Optional<AliasRecord> get(String shortcode);

    /**
     * Redirect lookup. Unlike {@link #get(String)} it never copies the click history.
     */
    Optional<AliasTarget> findTarget(String shortcode);

    /**
     * Appends the click and bumps the counter as one step.
     *
     * @return the click count after this click
     * @throws com.codefarm.shorturl.exception.ShortcodeNotFoundException if the short code is unknown
     */
    int recordClick(String shortcode, ClickEvent event);

    int size();
}
