/*
 * Where: crafting service layer
 * What: Keeps in-flight request compositions in process memory with a time to live
 * Why: A multi-step chat form outlives single interactions but never needs to survive a restart
 */
package com.guildcraft.crafting.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.guildcraft.crafting.config.CraftingSessionProperties;
import com.guildcraft.crafting.model.CompositionSession;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Session payloads are stored as detached JSON trees. Callers get a fresh copy on every read, so
 * mutating a returned tree never changes the stored session.
 */
@Service
public class CompositionSessionStore {

  private static final Logger logger = LoggerFactory.getLogger(CompositionSessionStore.class);

  private final Map<String, CompositionSession> sessions = new ConcurrentHashMap<>();

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper is a Spring-managed shared component and cannot be copied")
  private final ObjectMapper objectMapper;

  private final CraftingSessionProperties properties;
  private final CraftingMetrics metrics;
  private final Clock clock;

  public CompositionSessionStore(
      ObjectMapper objectMapper,
      CraftingSessionProperties properties,
      CraftingMetrics metrics,
      Clock clock) {
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
  }

  /**
   * Stores or replaces the session under {@code key}.
   *
   * <p>Replacing a live session of the same owner keeps its creation time and pushes its expiry
   * out to {@code now + ttl}.
   *
   * @param ttl lifetime; {@code null} uses {@code crafting.session.default-ttl}
   */
  public void put(String key, String ownerId, Object data, Duration ttl) {
    if (key == null || key.isBlank()) {
      throw new IllegalArgumentException("session key is required");
    }
    if (ownerId == null || ownerId.isBlank()) {
      throw new IllegalArgumentException("session owner is required");
    }
    final Duration lifetime = ttl == null ? properties.defaultTtl() : ttl;
    if (lifetime.isZero() || lifetime.isNegative()) {
      throw new IllegalArgumentException("session ttl must be positive: " + lifetime);
    }
    final JsonNode tree = toTree(data);
    final Instant now = Instant.now(clock);
    sessions.compute(
        key,
        (ignored, existing) -> {
          final Instant createdAt =
              existing != null && !existing.isExpiredAt(now) && ownerId.equals(existing.ownerId())
                  ? existing.createdAt()
                  : now;
          return new CompositionSession(key, ownerId, tree, createdAt, now.plus(lifetime));
        });
    metrics.updateActiveSessions(sessions.size());
  }

  public void put(String key, String ownerId, Object data) {
    put(key, ownerId, data, null);
  }

  public Optional<JsonNode> get(String key) {
    return findLive(key).map(session -> session.data().deepCopy());
  }

  public <T> Optional<T> get(String key, Class<T> type) {
    return findLive(key).map(session -> objectMapper.convertValue(session.data(), type));
  }

  /** Returns the live session with a copy of its payload, or empty once expired or deleted. */
  public Optional<CompositionSession> find(String key) {
    return findLive(key)
        .map(
            session ->
                new CompositionSession(
                    session.key(),
                    session.ownerId(),
                    session.data().deepCopy(),
                    session.createdAt(),
                    session.expiresAt()));
  }

  public void delete(String key) {
    if (key == null) {
      return;
    }
    sessions.remove(key);
    metrics.updateActiveSessions(sessions.size());
  }

  public boolean hasActive(String ownerId) {
    final Instant now = Instant.now(clock);
    return sessions.values().stream()
        .anyMatch(session -> session.ownerId().equals(ownerId) && !session.isExpiredAt(now));
  }

  /**
   * Drops every expired session.
   *
   * @return number of sessions removed
   */
  public int sweepExpired() {
    final Instant now = Instant.now(clock);
    int removed = 0;
    for (Map.Entry<String, CompositionSession> entry : sessions.entrySet()) {
      // Two-arg remove skips entries replaced since we read them.
      // Trade-off: a session that expires mid-sweep waits for the next run or its next read.
      if (entry.getValue().isExpiredAt(now) && sessions.remove(entry.getKey(), entry.getValue())) {
        removed++;
      }
    }
    metrics.updateActiveSessions(sessions.size());
    if (removed > 0) {
      logger.info("composition sessions swept removed={} remaining={}", removed, sessions.size());
    }
    return removed;
  }

  private Optional<CompositionSession> findLive(String key) {
    if (key == null) {
      return Optional.empty();
    }
    final CompositionSession session = sessions.get(key);
    if (session == null) {
      return Optional.empty();
    }
    if (session.isExpiredAt(Instant.now(clock))) {
      sessions.remove(key, session);
      metrics.updateActiveSessions(sessions.size());
      return Optional.empty();
    }
    return Optional.of(session);
  }

  private JsonNode toTree(Object data) {
    if (data == null) {
      return objectMapper.nullNode();
    }
    if (data instanceof JsonNode node) {
      return node.deepCopy();
    }
    try {
      return objectMapper.valueToTree(data);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("session data is not serializable as JSON", ex);
    }
  }
}
