package com.redsched.entry;

import com.redsched.codec.EntryCodec;
import com.redsched.config.RedschedProperties;
import com.redsched.store.ScheduleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Loads, saves, advances and deletes entries in the shared store.
 *
 * <p>Each entry is a hash at {@code <key-prefix><name>} with two independently written fields,
 * {@code definition} and {@code meta}. The ordered index at {@code redsched.schedule-key} maps
 * every entry key to its due time in epoch seconds.
 */
@Component
public class ScheduleEntryRepository {

    private static final Logger log = LoggerFactory.getLogger(ScheduleEntryRepository.class);

    static final String DEFINITION_FIELD = "definition";
    static final String META_FIELD = "meta";

    private final ScheduleStore store;
    private final EntryCodec codec;
    private final Clock clock;
    private final String keyPrefix;
    private final String scheduleKey;

    public ScheduleEntryRepository(ScheduleStore store, EntryCodec codec,
                                   RedschedProperties properties, Clock clock) {
        this.store = store;
        this.codec = codec;
        this.clock = clock;
        this.keyPrefix = properties.getKeyPrefix();
        this.scheduleKey = properties.getScheduleKey();
    }

    public String keyFor(String name) {
        return keyPrefix + name;
    }

    public String keyFor(ScheduleEntry entry) {
        return keyFor(entry.getName());
    }

    public String getScheduleKey() {
        return scheduleKey;
    }

    /**
     * Run history for {@code name}; an entry that has never run gets {@link EntryMeta#initial()}.
     */
    public EntryMeta loadMeta(String name) {
        return readMeta(keyFor(name));
    }

    /**
     * @throws EntryNotFoundException if nothing is stored for {@code name}
     */
    public EntryDefinition loadDefinition(String name) {
        return readDefinition(keyFor(name));
    }

    /**
     * Reads the full entry stored at {@code key}.
     *
     * @throws EntryNotFoundException if the record or its definition is missing
     */
    public ScheduleEntry fromKey(String key) {
        EntryDefinition definition = readDefinition(key);
        return new ScheduleEntry(definition, readMeta(key));
    }

    public boolean exists(String name) {
        return store.exists(keyFor(name));
    }

    /**
     * Writes definition and meta and publishes the entry's current score.
     */
    public ScheduleEntry save(ScheduleEntry entry) {
        String key = keyFor(entry);
        store.putField(key, DEFINITION_FIELD, codec.encodeDefinition(entry.getDefinition()));
        store.putField(key, META_FIELD, codec.encodeMeta(entry.getMeta()));
        store.upsertScore(scheduleKey, key, entry.score(clock.instant()));
        log.debug("Saved entry {} (enabled={})", entry.getName(), entry.isEnabled());
        return entry;
    }

    public ScheduleEntry next(ScheduleEntry entry) {
        return next(entry, now(), false);
    }

    public ScheduleEntry next(ScheduleEntry entry, Instant lastRunAt) {
        return next(entry, lastRunAt, false);
    }

    /**
     * Produces and persists the successor of {@code entry}: writes its meta and republishes
     * its score. The given entry is left as it was.
     *
     * @param lastRunAt run time to record; {@code null} means now
     */
    public ScheduleEntry next(ScheduleEntry entry, Instant lastRunAt, boolean onlyUpdateLastRunAt) {
        ScheduleEntry successor = entry.next(lastRunAt != null ? lastRunAt : now(), onlyUpdateLastRunAt);
        String key = keyFor(successor);
        store.putField(key, META_FIELD, codec.encodeMeta(successor.getMeta()));
        store.upsertScore(scheduleKey, key, successor.score(clock.instant()));
        return successor;
    }

    /**
     * Removes the record and its index member. Deleting a missing entry is a no-op.
     */
    public void delete(ScheduleEntry entry) {
        delete(entry.getName());
    }

    public void delete(String name) {
        String key = keyFor(name);
        store.delete(key);
        store.removeScore(scheduleKey, key);
        log.debug("Deleted entry {}", name);
    }

    private EntryDefinition readDefinition(String key) {
        String encoded = store.getField(key, DEFINITION_FIELD)
                .orElseThrow(() -> new EntryNotFoundException(key));
        return codec.decodeDefinition(encoded);
    }

    private EntryMeta readMeta(String key) {
        return store.getField(key, META_FIELD)
                .map(codec::decodeMeta)
                .orElse(EntryMeta.initial());
    }

    private Instant now() {
        // stored timestamps carry microsecond precision
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }
}
