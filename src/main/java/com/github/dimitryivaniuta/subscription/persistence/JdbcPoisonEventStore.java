package com.github.dimitryivaniuta.subscription.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.subscription.event.EventHeader;
import com.github.dimitryivaniuta.subscription.event.StreamId;
import com.github.dimitryivaniuta.subscription.event.TopicPartitionOffset;
import com.github.dimitryivaniuta.subscription.reliability.model.OccuredFailure;
import com.github.dimitryivaniuta.subscription.reliability.model.OpeningPoisonEvent;
import com.github.dimitryivaniuta.subscription.reliability.model.Reasons;
import com.github.dimitryivaniuta.subscription.reliability.model.StoredPoisonEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.SqlParameterValue;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * PostgreSQL quarantine on table {@code kafka_poison_event} (see {@code schema.sql}).
 * <p>
 * Headers are kept as a JSON array; header values are base64 encoded by Jackson.
 */
@RequiredArgsConstructor
public class JdbcPoisonEventStore implements PoisonEventStore {

    private static final TypeReference<List<EventHeader>> HEADERS = new TypeReference<>() {
    };

    private static final String SELECT_COLUMNS = """
            select topic, event_partition, event_offset, event_key, record_key, record_value,
                   record_timestamp, headers, stored_at, last_failure_at, last_failure_reason, total_failure_count
              from kafka_poison_event
            """;

    private final JdbcTemplate jdbc;
    private final ObjectMapper mapper;

    @Override
    @Transactional
    public void add(Instant timestamp, Collection<OpeningPoisonEvent> events) {
        if (events.isEmpty()) return;

        Timestamp now = Timestamp.from(timestamp);
        List<Object[]> rows = new ArrayList<>(events.size());
        for (OpeningPoisonEvent e : events) {
            rows.add(new Object[]{
                    e.position().topic(),
                    e.position().partition(),
                    e.position().offset(),
                    e.key(),
                    new SqlParameterValue(Types.BINARY, e.rawKey()),
                    new SqlParameterValue(Types.BINARY, e.rawValue()),
                    Timestamp.from(e.timestamp()),
                    writeHeaders(e.headers()),
                    now,
                    now,
                    Reasons.truncate(e.reason())
            });
        }

        jdbc.batchUpdate(
                """
                        insert into kafka_poison_event(
                            topic, event_partition, event_offset, event_key, record_key, record_value,
                            record_timestamp, headers, stored_at, last_failure_at, last_failure_reason, total_failure_count
                        ) values (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, 1)
                        on conflict (topic, event_partition, event_offset) do update
                           set last_failure_at = excluded.last_failure_at,
                               last_failure_reason = excluded.last_failure_reason,
                               total_failure_count = kafka_poison_event.total_failure_count + 1
                        """,
                rows
        );
    }

    @Override
    public void addFailure(Instant timestamp, OccuredFailure failure) {
        addFailures(timestamp, List.of(failure));
    }

    @Override
    @Transactional
    public void addFailures(Instant timestamp, Collection<OccuredFailure> failures) {
        if (failures.isEmpty()) return;

        Timestamp now = Timestamp.from(timestamp);
        List<Object[]> rows = new ArrayList<>(failures.size());
        for (OccuredFailure f : failures) {
            rows.add(new Object[]{
                    now,
                    Reasons.truncate(f.reason()),
                    f.position().topic(),
                    f.position().partition(),
                    f.position().offset()
            });
        }

        jdbc.batchUpdate(
                """
                        update kafka_poison_event
                           set last_failure_at = ?,
                               last_failure_reason = ?,
                               total_failure_count = total_failure_count + 1
                         where topic = ? and event_partition = ? and event_offset = ?
                        """,
                rows
        );
    }

    @Override
    public void remove(TopicPartitionOffset position) {
        remove(List.of(position));
    }

    @Override
    @Transactional
    public void remove(Collection<TopicPartitionOffset> positions) {
        if (positions.isEmpty()) return;

        List<Object[]> rows = new ArrayList<>(positions.size());
        for (TopicPartitionOffset p : positions) {
            rows.add(new Object[]{p.topic(), p.partition(), p.offset()});
        }
        jdbc.batchUpdate(
                "delete from kafka_poison_event where topic = ? and event_partition = ? and event_offset = ?",
                rows
        );
    }

    @Override
    public long count(String topic) {
        Long count = jdbc.queryForObject(
                "select count(*) from kafka_poison_event where topic = ?",
                Long.class,
                topic
        );
        return count == null ? 0 : count;
    }

    @Override
    public boolean isStreamStored(String topic, String key) {
        Boolean stored = key == null
                ? jdbc.queryForObject(
                "select exists(select 1 from kafka_poison_event where topic = ? and event_key is null)",
                Boolean.class, topic)
                : jdbc.queryForObject(
                "select exists(select 1 from kafka_poison_event where topic = ? and event_key = ?)",
                Boolean.class, topic, key);
        return Boolean.TRUE.equals(stored);
    }

    @Override
    public List<StreamId> getStoredStreams(Collection<StreamId> streamIds) {
        if (streamIds.isEmpty()) return List.of();

        Map<String, List<String>> keysByTopic = new LinkedHashMap<>();
        for (StreamId id : streamIds) {
            keysByTopic.computeIfAbsent(id.topic(), __ -> new ArrayList<>()).add(id.key());
        }

        List<StreamId> result = new ArrayList<>();
        keysByTopic.forEach((topic, keys) -> {
            List<String> nonNullKeys = keys.stream().filter(Objects::nonNull).distinct().toList();
            if (!nonNullKeys.isEmpty()) {
                String placeholders = String.join(", ", Collections.nCopies(nonNullKeys.size(), "?"));
                List<Object> args = new ArrayList<>(nonNullKeys.size() + 1);
                args.add(topic);
                args.addAll(nonNullKeys);
                result.addAll(jdbc.query(
                        "select distinct event_key from kafka_poison_event where topic = ? and event_key in (" + placeholders + ")",
                        (rs, rowNum) -> new StreamId(topic, rs.getString(1)),
                        args.toArray()
                ));
            }
            if (keys.contains(null) && isStreamStored(topic, null)) {
                result.add(new StreamId(topic, null));
            }
        });
        return result;
    }

    @Override
    public List<StoredPoisonEvent> getEventsForRetrying(String topic) {
        return jdbc.query(
                SELECT_COLUMNS + " where topic = ? order by event_partition, event_offset",
                storedEventMapper(),
                topic
        );
    }

    private RowMapper<StoredPoisonEvent> storedEventMapper() {
        return (rs, rowNum) -> new StoredPoisonEvent(
                new TopicPartitionOffset(rs.getString("topic"), rs.getInt("event_partition"), rs.getLong("event_offset")),
                rs.getString("event_key"),
                rs.getBytes("record_key"),
                rs.getBytes("record_value"),
                rs.getTimestamp("record_timestamp").toInstant(),
                readHeaders(rs.getString("headers")),
                rs.getTimestamp("stored_at").toInstant(),
                rs.getTimestamp("last_failure_at").toInstant(),
                rs.getString("last_failure_reason"),
                rs.getInt("total_failure_count")
        );
    }

    private String writeHeaders(List<EventHeader> headers) {
        try {
            return mapper.writeValueAsString(headers == null ? List.of() : headers);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize event headers", e);
        }
    }

    private List<EventHeader> readHeaders(String json) {
        try {
            return mapper.readValue(json, HEADERS);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot read stored event headers", e);
        }
    }
}
