package com.redsched.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.redsched.entry.EntryDefinition;
import com.redsched.entry.EntryMeta;
import com.redsched.schedule.CronSchedule;
import com.redsched.schedule.IntervalSchedule;
import com.redsched.schedule.Schedule;
import com.redsched.schedule.ScheduleFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts entry definitions, run metadata and payload values to and from the JSON text kept
 * in the store.
 *
 * <p>Plain JSON covers maps, lists, strings, numbers, booleans and null. Everything else is
 * written as an object carrying a {@value #TYPE_FIELD} tag:
 * <ul>
 *   <li>{@code datetime}: year, month, day, hour, minute, second, microsecond (UTC)</li>
 *   <li>{@code timedelta}: days, seconds, microseconds</li>
 *   <li>a schedule's {@link Schedule#type()}: its {@link Schedule#arguments()}</li>
 * </ul>
 */
public class EntryCodec {

    public static final String TYPE_FIELD = "__type__";

    static final String DATETIME = "datetime";
    static final String TIMEDELTA = "timedelta";

    private static final long SECONDS_PER_DAY = 86_400L;

    private final ObjectMapper objectMapper;
    private final JsonNodeFactory nodes;
    private final Map<String, ScheduleFactory> scheduleFactories = new LinkedHashMap<>();

    public EntryCodec(ObjectMapper objectMapper) {
        this(objectMapper, List.of());
    }

    public EntryCodec(ObjectMapper objectMapper, List<ScheduleFactory> additionalFactories) {
        this.objectMapper = objectMapper;
        this.nodes = objectMapper.getNodeFactory();
        register(new IntervalSchedule.Factory());
        register(new CronSchedule.Factory());
        additionalFactories.forEach(this::register);
    }

    private void register(ScheduleFactory factory) {
        if (DATETIME.equals(factory.type()) || TIMEDELTA.equals(factory.type())) {
            throw new IllegalArgumentException("Reserved type tag: " + factory.type());
        }
        scheduleFactories.put(factory.type(), factory);
    }

    // --- Generic values ---

    public String encode(Object value) {
        try {
            return objectMapper.writeValueAsString(toNode(value));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to encode value", e);
        }
    }

    public Object decode(String text) {
        if (text == null || text.isBlank()) {
            throw new DecodeException("Empty encoded value");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new DecodeException("Malformed encoded value: " + e.getOriginalMessage(), e);
        }
        return fromNode(root);
    }

    // --- Entry fields ---

    public String encodeDefinition(EntryDefinition definition) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("name", definition.name());
        fields.put("task", definition.task());
        fields.put("schedule", definition.schedule());
        fields.put("args", definition.args());
        fields.put("kwargs", definition.kwargs());
        fields.put("options", definition.options());
        fields.put("enabled", definition.enabled());
        return encode(fields);
    }

    @SuppressWarnings("unchecked")
    public EntryDefinition decodeDefinition(String text) {
        Map<String, Object> fields = asMap(decode(text), "definition");
        try {
            Object schedule = fields.get("schedule");
            if (!(schedule instanceof Schedule)) {
                throw new DecodeException("Definition has no schedule");
            }
            Object enabled = fields.get("enabled");
            return new EntryDefinition(
                    (String) fields.get("name"),
                    (String) fields.get("task"),
                    (Schedule) schedule,
                    (List<Object>) fields.get("args"),
                    (Map<String, Object>) fields.get("kwargs"),
                    (Map<String, Object>) fields.get("options"),
                    enabled == null || (Boolean) enabled);
        } catch (ClassCastException | IllegalArgumentException e) {
            throw new DecodeException("Invalid definition: " + e.getMessage(), e);
        }
    }

    public String encodeMeta(EntryMeta meta) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("last_run_at", meta.lastRunAt());
        fields.put("total_run_count", meta.totalRunCount());
        return encode(fields);
    }

    public EntryMeta decodeMeta(String text) {
        Map<String, Object> fields = asMap(decode(text), "meta");
        try {
            Instant lastRunAt = (Instant) fields.get("last_run_at");
            Number count = (Number) fields.get("total_run_count");
            return new EntryMeta(lastRunAt, count != null ? count.longValue() : 0L);
        } catch (ClassCastException | IllegalArgumentException e) {
            throw new DecodeException("Invalid meta: " + e.getMessage(), e);
        }
    }

    // --- Tree conversion ---

    JsonNode toNode(Object value) {
        if (value == null) return nodes.nullNode();
        if (value instanceof String s) return nodes.textNode(s);
        if (value instanceof Boolean b) return nodes.booleanNode(b);
        if (value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte) {
            return nodes.numberNode(((Number) value).longValue());
        }
        if (value instanceof BigInteger i) return nodes.numberNode(i);
        if (value instanceof BigDecimal d) return nodes.numberNode(d);
        if (value instanceof Number n) return nodes.numberNode(n.doubleValue());
        if (value instanceof Instant instant) return encodeDatetime(instant);
        if (value instanceof Duration duration) return encodeTimedelta(duration);
        if (value instanceof Schedule schedule) return encodeSchedule(schedule);
        if (value instanceof Map<?, ?> map) {
            ObjectNode node = nodes.objectNode();
            map.forEach((k, v) -> node.set(String.valueOf(k), toNode(v)));
            return node;
        }
        if (value instanceof Collection<?> items) {
            ArrayNode node = nodes.arrayNode();
            items.forEach(item -> node.add(toNode(item)));
            return node;
        }
        if (value instanceof Object[] items) {
            ArrayNode node = nodes.arrayNode();
            for (Object item : items) node.add(toNode(item));
            return node;
        }
        throw new IllegalArgumentException("Cannot encode value of type " + value.getClass().getName());
    }

    Object fromNode(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (node.isMissingNode()) throw new DecodeException("Missing value");
        if (node.isTextual()) return node.textValue();
        if (node.isBoolean()) return node.booleanValue();
        if (node.isInt() || node.isLong()) return node.longValue();
        if (node.isBigInteger()) return node.bigIntegerValue();
        if (node.isNumber()) return node.doubleValue();
        if (node.isArray()) {
            List<Object> items = new ArrayList<>(node.size());
            node.forEach(item -> items.add(fromNode(item)));
            return items;
        }
        if (node.isObject()) {
            JsonNode tag = node.get(TYPE_FIELD);
            if (tag != null) {
                return decodeTagged(tag.asText(), node);
            }
            Map<String, Object> map = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                map.put(field.getKey(), fromNode(field.getValue()));
            }
            return map;
        }
        throw new DecodeException("Unsupported JSON node: " + node.getNodeType());
    }

    private Object decodeTagged(String type, JsonNode node) {
        try {
            if (DATETIME.equals(type)) return decodeDatetime(node);
            if (TIMEDELTA.equals(type)) return decodeTimedelta(node);
        } catch (DateTimeException | ArithmeticException e) {
            throw new DecodeException("Invalid " + type + ": " + e.getMessage(), e);
        }

        ScheduleFactory factory = scheduleFactories.get(type);
        if (factory == null) {
            throw new DecodeException("Unknown type tag: " + type);
        }
        Map<String, Object> arguments = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!TYPE_FIELD.equals(field.getKey())) {
                arguments.put(field.getKey(), fromNode(field.getValue()));
            }
        }
        try {
            return factory.create(arguments);
        } catch (IllegalArgumentException e) {
            throw new DecodeException("Invalid " + type + " schedule: " + e.getMessage(), e);
        }
    }

    private ObjectNode encodeSchedule(Schedule schedule) {
        ObjectNode node = nodes.objectNode();
        node.put(TYPE_FIELD, schedule.type());
        schedule.arguments().forEach((k, v) -> node.set(k, toNode(v)));
        return node;
    }

    private ObjectNode encodeDatetime(Instant instant) {
        ZonedDateTime utc = instant.atZone(ZoneOffset.UTC);
        ObjectNode node = nodes.objectNode();
        node.put(TYPE_FIELD, DATETIME);
        node.put("year", utc.getYear());
        node.put("month", utc.getMonthValue());
        node.put("day", utc.getDayOfMonth());
        node.put("hour", utc.getHour());
        node.put("minute", utc.getMinute());
        node.put("second", utc.getSecond());
        node.put("microsecond", utc.getNano() / 1_000);
        return node;
    }

    private Instant decodeDatetime(JsonNode node) {
        return LocalDateTime.of(
                requiredInt(node, "year"),
                requiredInt(node, "month"),
                requiredInt(node, "day"),
                node.path("hour").asInt(0),
                node.path("minute").asInt(0),
                node.path("second").asInt(0),
                node.path("microsecond").asInt(0) * 1_000
        ).toInstant(ZoneOffset.UTC);
    }

    private ObjectNode encodeTimedelta(Duration duration) {
        long seconds = duration.getSeconds();
        ObjectNode node = nodes.objectNode();
        node.put(TYPE_FIELD, TIMEDELTA);
        node.put("days", Math.floorDiv(seconds, SECONDS_PER_DAY));
        node.put("seconds", Math.floorMod(seconds, SECONDS_PER_DAY));
        node.put("microseconds", duration.getNano() / 1_000);
        return node;
    }

    private Duration decodeTimedelta(JsonNode node) {
        return Duration.ofDays(node.path("days").asLong(0))
                .plusSeconds(node.path("seconds").asLong(0))
                .plusNanos(node.path("microseconds").asLong(0) * 1_000);
    }

    private static int requiredInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.canConvertToInt()) {
            throw new DecodeException("datetime is missing '" + field + "'");
        }
        return value.intValue();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object decoded, String what) {
        if (!(decoded instanceof Map)) {
            throw new DecodeException("Encoded " + what + " is not an object");
        }
        return (Map<String, Object>) decoded;
    }
}
