package com.redsched.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "redsched")
public class RedschedProperties {

    private String keyPrefix = "";
    private String scheduleKey;
    private String staticsKey;
    private Duration maxInterval = Duration.ofMinutes(5);
    private Duration storeTimeout = Duration.ofSeconds(5);
    private BeatProperties beat = new BeatProperties();
    private DispatchProperties dispatch = new DispatchProperties();
    private List<EntryProperties> entries = new ArrayList<>();

    public String getKeyPrefix() { return keyPrefix; }
    public void setKeyPrefix(String keyPrefix) { this.keyPrefix = keyPrefix != null ? keyPrefix : ""; }

    /**
     * Key of the ordered index; defaults to {@code <key-prefix>:schedule}.
     */
    public String getScheduleKey() {
        return scheduleKey != null ? scheduleKey : keyPrefix + ":schedule";
    }
    public void setScheduleKey(String scheduleKey) { this.scheduleKey = scheduleKey; }

    /**
     * Key of the set holding names installed from {@link #getEntries()}.
     */
    public String getStaticsKey() {
        return staticsKey != null ? staticsKey : keyPrefix + ":statics";
    }
    public void setStaticsKey(String staticsKey) { this.staticsKey = staticsKey; }

    public Duration getMaxInterval() { return maxInterval; }
    public void setMaxInterval(Duration maxInterval) { this.maxInterval = maxInterval; }

    public Duration getStoreTimeout() { return storeTimeout; }
    public void setStoreTimeout(Duration storeTimeout) { this.storeTimeout = storeTimeout; }

    public BeatProperties getBeat() { return beat; }
    public void setBeat(BeatProperties beat) { this.beat = beat; }

    public DispatchProperties getDispatch() { return dispatch; }
    public void setDispatch(DispatchProperties dispatch) { this.dispatch = dispatch; }

    public List<EntryProperties> getEntries() { return entries; }
    public void setEntries(List<EntryProperties> entries) { this.entries = entries; }

    public static class BeatProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class DispatchProperties {
        private String mode = "redis-list";
        private String queuePrefix;
        private String defaultQueue = "default";

        public String getMode() { return mode; }
        public void setMode(String mode) { this.mode = mode; }
        public String getQueuePrefix() { return queuePrefix; }
        public void setQueuePrefix(String queuePrefix) { this.queuePrefix = queuePrefix; }
        public String getDefaultQueue() { return defaultQueue; }
        public void setDefaultQueue(String defaultQueue) { this.defaultQueue = defaultQueue; }
    }

    /**
     * A statically configured entry. Exactly one of {@code every} or {@code cron} is expected.
     */
    public static class EntryProperties {
        private String name;
        private String task;
        private Duration every;
        private CronProperties cron;
        private List<Object> args;
        private Map<String, Object> kwargs;
        private Map<String, Object> options = new LinkedHashMap<>();
        private boolean enabled = true;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getTask() { return task; }
        public void setTask(String task) { this.task = task; }
        public Duration getEvery() { return every; }
        public void setEvery(Duration every) { this.every = every; }
        public CronProperties getCron() { return cron; }
        public void setCron(CronProperties cron) { this.cron = cron; }
        public List<Object> getArgs() { return args; }
        public void setArgs(List<Object> args) { this.args = args; }
        public Map<String, Object> getKwargs() { return kwargs; }
        public void setKwargs(Map<String, Object> kwargs) { this.kwargs = kwargs; }
        public Map<String, Object> getOptions() { return options; }
        public void setOptions(Map<String, Object> options) { this.options = options; }
        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class CronProperties {
        private String minute = "*";
        private String hour = "*";
        private String dayOfWeek = "*";
        private String dayOfMonth = "*";
        private String monthOfYear = "*";

        public String getMinute() { return minute; }
        public void setMinute(String minute) { this.minute = minute; }
        public String getHour() { return hour; }
        public void setHour(String hour) { this.hour = hour; }
        public String getDayOfWeek() { return dayOfWeek; }
        public void setDayOfWeek(String dayOfWeek) { this.dayOfWeek = dayOfWeek; }
        public String getDayOfMonth() { return dayOfMonth; }
        public void setDayOfMonth(String dayOfMonth) { this.dayOfMonth = dayOfMonth; }
        public String getMonthOfYear() { return monthOfYear; }
        public void setMonthOfYear(String monthOfYear) { this.monthOfYear = monthOfYear; }
    }
}
