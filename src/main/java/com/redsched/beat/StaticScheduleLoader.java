package com.redsched.beat;

import com.redsched.config.RedschedProperties;
import com.redsched.entry.EntryDefinition;
import com.redsched.entry.EntryMeta;
import com.redsched.entry.ScheduleEntry;
import com.redsched.entry.ScheduleEntryRepository;
import com.redsched.schedule.CronSchedule;
import com.redsched.schedule.IntervalSchedule;
import com.redsched.schedule.Schedule;
import com.redsched.store.ScheduleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Installs the entries declared under {@code redsched.entries}.
 *
 * <p>Names installed this way are tracked in the statics set, so an entry removed from
 * configuration is deleted on the next start-up. Run history of entries that already exist
 * is preserved.
 */
@Component
public class StaticScheduleLoader {

    private static final Logger log = LoggerFactory.getLogger(StaticScheduleLoader.class);

    private final ScheduleEntryRepository entries;
    private final ScheduleStore store;
    private final RedschedProperties properties;

    public StaticScheduleLoader(ScheduleEntryRepository entries,
                                ScheduleStore store,
                                RedschedProperties properties) {
        this.entries = entries;
        this.store = store;
        this.properties = properties;
    }

    public List<ScheduleEntry> setupSchedule() {
        String staticsKey = properties.getStaticsKey();
        Set<String> configured = new LinkedHashSet<>();
        List<ScheduleEntry> installed = new ArrayList<>();

        for (RedschedProperties.EntryProperties config : properties.getEntries()) {
            EntryDefinition definition = toDefinition(config);
            EntryMeta meta = entries.loadMeta(definition.name());
            installed.add(entries.save(new ScheduleEntry(definition, meta)));
            configured.add(definition.name());
        }

        Set<String> removed = new LinkedHashSet<>(store.members(staticsKey));
        removed.removeAll(configured);
        for (String name : removed) {
            entries.delete(name);
        }
        store.removeMembers(staticsKey, removed);
        store.addMembers(staticsKey, configured);

        log.info("Installed {} static entries, removed {} no longer configured",
                installed.size(), removed.size());
        return installed;
    }

    static EntryDefinition toDefinition(RedschedProperties.EntryProperties config) {
        return new EntryDefinition(config.getName(), config.getTask(), toSchedule(config),
                config.getArgs(), config.getKwargs(), config.getOptions(), config.isEnabled());
    }

    private static Schedule toSchedule(RedschedProperties.EntryProperties config) {
        if (config.getEvery() != null && config.getCron() != null) {
            throw new IllegalArgumentException("Entry " + config.getName() + " sets both every and cron");
        }
        if (config.getEvery() != null) {
            return new IntervalSchedule(config.getEvery());
        }
        if (config.getCron() != null) {
            RedschedProperties.CronProperties cron = config.getCron();
            return new CronSchedule(cron.getMinute(), cron.getHour(), cron.getDayOfWeek(),
                    cron.getDayOfMonth(), cron.getMonthOfYear());
        }
        throw new IllegalArgumentException("Entry " + config.getName() + " needs every or cron");
    }
}
