package com.zzf.agentdock.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.agentdock.cache.KeyedLocks;
import com.zzf.agentdock.model.AttentionReason;
import com.zzf.agentdock.model.ImageAttachment;
import com.zzf.agentdock.model.Message;
import com.zzf.agentdock.model.MessageType;
import com.zzf.agentdock.model.Session;
import com.zzf.agentdock.model.SessionStatus;
import com.zzf.agentdock.model.TranscriptFormat;
import com.zzf.agentdock.model.WorkStatus;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Session 和 Message 的 SQLite 持久化 (WAL)。
 * <p>
 * One writer connection serializes every mutation, guarded additionally per session id. A separate
 * {@code query_only} reader connection serves reads; under WAL it sees the last committed state and is
 * never blocked by an open write transaction. Message ids are unique per session, not globally.
 */
@Slf4j
public class SessionStore implements AutoCloseable {
    private static final List<String> SCHEMA = List.of(
            "CREATE TABLE IF NOT EXISTS sessions ("
                    + "id TEXT PRIMARY KEY, format TEXT, project_path TEXT, project_name TEXT, model TEXT,"
                    + " model_provider TEXT, custom_name TEXT, summary TEXT, first_prompt TEXT, transcript_path TEXT,"
                    + " status TEXT NOT NULL DEFAULT 'ACTIVE', work_status TEXT NOT NULL DEFAULT 'UNKNOWN',"
                    + " attention_reason TEXT NOT NULL DEFAULT 'NONE', pending_tool_name TEXT, pending_tool_input TEXT,"
                    + " pending_question TEXT, prompt_count INTEGER NOT NULL DEFAULT 0,"
                    + " tool_count INTEGER NOT NULL DEFAULT 0, total_tokens INTEGER NOT NULL DEFAULT 0,"
                    + " total_cost_usd REAL NOT NULL DEFAULT 0, last_tool TEXT, last_tool_at TEXT, started_at TEXT,"
                    + " last_activity_at TEXT, ended_at TEXT, end_reason TEXT)",
            "CREATE TABLE IF NOT EXISTS messages ("
                    + "id TEXT NOT NULL, session_id TEXT NOT NULL, type TEXT NOT NULL, content TEXT,"
                    + " timestamp TEXT, sequence INTEGER NOT NULL, tool_name TEXT, tool_input TEXT, tool_output TEXT,"
                    + " tool_duration REAL, is_in_progress INTEGER NOT NULL DEFAULT 0, input_tokens INTEGER,"
                    + " output_tokens INTEGER, images_json TEXT, thinking TEXT, PRIMARY KEY (session_id, id))",
            "CREATE INDEX IF NOT EXISTS idx_messages_session_sequence ON messages(session_id, sequence)",
            "CREATE INDEX IF NOT EXISTS idx_sessions_activity ON sessions(last_activity_at)"
    );

    private static final String SESSION_COLUMNS = "id, format, project_path, project_name, model, model_provider,"
            + " custom_name, summary, first_prompt, transcript_path, status, work_status, attention_reason,"
            + " pending_tool_name, pending_tool_input, pending_question, prompt_count, tool_count, total_tokens,"
            + " total_cost_usd, last_tool, last_tool_at, started_at, last_activity_at, ended_at, end_reason";

    private static final String MESSAGE_COLUMNS = "id, session_id, type, content, timestamp, sequence, tool_name,"
            + " tool_input, tool_output, tool_duration, is_in_progress, input_tokens, output_tokens, images_json,"
            + " thinking";

    private static final TypeReference<List<ImageAttachment>> IMAGE_LIST = new TypeReference<List<ImageAttachment>>() {};

    @FunctionalInterface
    private interface SqlWork<T> {
        T run(Connection connection) throws SQLException;
    }

    private final Path dbPath;
    private final ObjectMapper objectMapper;
    private final Connection writer;
    private final Connection reader;
    private final ReentrantLock writerLock = new ReentrantLock();
    private final ReentrantLock readerLock = new ReentrantLock();
    private final KeyedLocks<String> sessionLocks = new KeyedLocks<>();

    private SessionStore(Path dbPath, ObjectMapper objectMapper, Connection writer, Connection reader) {
        this.dbPath = dbPath;
        this.objectMapper = objectMapper;
        this.writer = writer;
        this.reader = reader;
    }

    public static SessionStore open(Path dbPath, ObjectMapper objectMapper) {
        Connection writer = null;
        try {
            Path parent = dbPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            String url = "jdbc:sqlite:" + dbPath.toAbsolutePath();
            writer = DriverManager.getConnection(url);
            try (Statement st = writer.createStatement()) {
                st.execute("PRAGMA journal_mode=WAL");
                st.execute("PRAGMA busy_timeout=5000");
                st.execute("PRAGMA synchronous=NORMAL");
                for (String ddl : SCHEMA) {
                    st.execute(ddl);
                }
            }
            Connection reader = DriverManager.getConnection(url);
            try (Statement st = reader.createStatement()) {
                st.execute("PRAGMA busy_timeout=5000");
                st.execute("PRAGMA query_only=1");
            }
            log.info("store.open ok path={}", dbPath);
            return new SessionStore(dbPath, objectMapper, writer, reader);
        } catch (SQLException | IOException e) {
            closeQuietly(writer);
            throw new StoreUnavailableException("cannot open session store at " + dbPath, e);
        }
    }

    public Path getDbPath() {
        return dbPath;
    }

    // ---- writes ----

    public void upsertSession(Session session) {
        write(session.getId(), c -> {
            upsertSessionRow(c, session);
            return null;
        });
    }

    /**
     * Sets only the given columns. A null value clears the column.
     */
    public void updateSession(String sessionId, Map<SessionColumn, Object> fields) {
        if (fields.isEmpty()) {
            return;
        }
        StringJoiner sets = new StringJoiner(", ");
        List<SessionColumn> order = new ArrayList<>(fields.keySet());
        for (SessionColumn col : order) {
            sets.add(col.column() + " = ?");
        }
        String sql = "UPDATE sessions SET " + sets + " WHERE id = ?";
        write(sessionId, c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                int i = 1;
                for (SessionColumn col : order) {
                    bindValue(ps, i++, fields.get(col));
                }
                ps.setString(i, sessionId);
                return ps.executeUpdate();
            }
        });
    }

    public void endSession(String sessionId, String reason, Instant at) {
        write(sessionId, c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE sessions SET status = ?, ended_at = ?, end_reason = ? WHERE id = ?")) {
                ps.setString(1, SessionStatus.ENDED.name());
                ps.setString(2, text(at));
                ps.setString(3, reason);
                ps.setString(4, sessionId);
                return ps.executeUpdate();
            }
        });
    }

    /**
     * Deletes and re-inserts the session's messages in one transaction; sequence follows list position.
     */
    public void replaceMessages(String sessionId, List<Message> messages) {
        write(sessionId, c -> {
            replaceMessageRows(c, sessionId, messages);
            return null;
        });
    }

    /**
     * Session row and full message set, replaced atomically.
     */
    public void persistSnapshot(Session session, List<Message> messages) {
        write(session.getId(), c -> {
            upsertSessionRow(c, session);
            replaceMessageRows(c, session.getId(), messages);
            return null;
        });
    }

    /**
     * Session row plus incremental messages in one transaction. Known ids keep their sequence.
     */
    public void persistBatch(Session session, List<Message> messages) {
        write(session.getId(), c -> {
            upsertSessionRow(c, session);
            for (Message m : messages) {
                upsertMessageRow(c, m);
            }
            return null;
        });
    }

    /**
     * Inserts at the end of the session's sequence. Returns false when the id already exists.
     */
    public boolean appendMessage(Message message) {
        return write(message.getSessionId(), c -> insertAppended(c, message));
    }

    public void upsertMessage(Message message) {
        write(message.getSessionId(), c -> {
            upsertMessageRow(c, message);
            return null;
        });
    }

    // ---- reads ----

    public List<Message> readMessages(String sessionId) {
        return read(c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT " + MESSAGE_COLUMNS + " FROM messages WHERE session_id = ? ORDER BY sequence ASC")) {
                ps.setString(1, sessionId);
                try (ResultSet rs = ps.executeQuery()) {
                    List<Message> out = new ArrayList<>();
                    while (rs.next()) {
                        out.add(toMessage(rs));
                    }
                    return out;
                }
            }
        });
    }

    public Optional<Session> readSession(String sessionId) {
        return read(c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT " + SESSION_COLUMNS + " FROM sessions WHERE id = ?")) {
                ps.setString(1, sessionId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(toSession(rs)) : Optional.<Session>empty();
                }
            }
        });
    }

    public List<Session> listSessions() {
        return read(c -> {
            try (Statement st = c.createStatement();
                 ResultSet rs = st.executeQuery("SELECT " + SESSION_COLUMNS
                         + " FROM sessions ORDER BY last_activity_at DESC")) {
                List<Session> out = new ArrayList<>();
                while (rs.next()) {
                    out.add(toSession(rs));
                }
                return out;
            }
        });
    }

    public boolean hasMessages(String sessionId) {
        return read(c -> {
            try (PreparedStatement ps = c.prepareStatement("SELECT 1 FROM messages WHERE session_id = ? LIMIT 1")) {
                ps.setString(1, sessionId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next();
                }
            }
        });
    }

    @Override
    public void close() {
        writerLock.lock();
        readerLock.lock();
        try {
            closeQuietly(reader);
            closeQuietly(writer);
            log.info("store.close ok path={}", dbPath);
        } finally {
            readerLock.unlock();
            writerLock.unlock();
        }
    }

    // ---- internals ----

    private <T> T write(String sessionId, SqlWork<T> work) {
        String key = sessionId == null ? "" : sessionId;
        return sessionLocks.withLock(key, () -> {
            writerLock.lock();
            try {
                writer.setAutoCommit(false);
                try {
                    T result = work.run(writer);
                    writer.commit();
                    return result;
                } catch (SQLException | RuntimeException e) {
                    rollback();
                    throw e;
                } finally {
                    writer.setAutoCommit(true);
                }
            } catch (SQLException e) {
                throw new StoreException("store write failed session=" + sessionId, e);
            } finally {
                writerLock.unlock();
            }
        });
    }

    private <T> T read(SqlWork<T> work) {
        readerLock.lock();
        try {
            return work.run(reader);
        } catch (SQLException e) {
            throw new StoreException("store read failed", e);
        } finally {
            readerLock.unlock();
        }
    }

    private void rollback() {
        try {
            writer.rollback();
        } catch (SQLException e) {
            log.warn("store.rollback failed err={}", e.toString());
        }
    }

    private void upsertSessionRow(Connection c, Session s) throws SQLException {
        String[] cols = SESSION_COLUMNS.split(",\\s*");
        StringJoiner marks = new StringJoiner(", ");
        StringJoiner updates = new StringJoiner(", ");
        for (String col : cols) {
            marks.add("?");
            if (!col.equals("id")) {
                updates.add(col + " = excluded." + col);
            }
        }
        String sql = "INSERT INTO sessions (" + SESSION_COLUMNS + ") VALUES (" + marks + ")"
                + " ON CONFLICT(id) DO UPDATE SET " + updates;
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            int i = 1;
            ps.setString(i++, s.getId());
            ps.setString(i++, s.getFormat() == null ? null : s.getFormat().id());
            ps.setString(i++, s.getProjectPath());
            ps.setString(i++, s.getProjectName());
            ps.setString(i++, s.getModel());
            ps.setString(i++, s.getModelProvider());
            ps.setString(i++, s.getCustomName());
            ps.setString(i++, s.getSummary());
            ps.setString(i++, s.getFirstPrompt());
            ps.setString(i++, s.getTranscriptPath());
            ps.setString(i++, nameOr(s.getStatus(), SessionStatus.ACTIVE));
            ps.setString(i++, nameOr(s.getWorkStatus(), WorkStatus.UNKNOWN));
            ps.setString(i++, nameOr(s.getAttentionReason(), AttentionReason.NONE));
            ps.setString(i++, s.getPendingToolName());
            ps.setString(i++, s.getPendingToolInput());
            ps.setString(i++, s.getPendingQuestion());
            ps.setInt(i++, s.getPromptCount());
            ps.setInt(i++, s.getToolCount());
            ps.setLong(i++, s.getTotalTokens());
            ps.setDouble(i++, s.getTotalCostUsd());
            ps.setString(i++, s.getLastTool());
            ps.setString(i++, text(s.getLastToolAt()));
            ps.setString(i++, text(s.getStartedAt()));
            ps.setString(i++, text(s.getLastActivityAt()));
            ps.setString(i++, text(s.getEndedAt()));
            ps.setString(i, s.getEndReason());
            ps.executeUpdate();
        }
    }

    private void replaceMessageRows(Connection c, String sessionId, List<Message> messages) throws SQLException {
        try (PreparedStatement del = c.prepareStatement("DELETE FROM messages WHERE session_id = ?")) {
            del.setString(1, sessionId);
            del.executeUpdate();
        }
        String sql = "INSERT OR REPLACE INTO messages (" + MESSAGE_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            int sequence = 0;
            for (Message m : messages) {
                bindMessage(ps, m, sessionId, sequence++);
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private void upsertMessageRow(Connection c, Message m) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("UPDATE messages SET type = ?, content = ?,"
                + " timestamp = ?, tool_name = ?, tool_input = ?, tool_output = ?, tool_duration = ?,"
                + " is_in_progress = ?, input_tokens = ?, output_tokens = ?, images_json = ?, thinking = ?"
                + " WHERE session_id = ? AND id = ?")) {
            int i = 1;
            ps.setString(i++, m.getType().name());
            ps.setString(i++, m.getContent());
            ps.setString(i++, text(m.getTimestamp()));
            ps.setString(i++, m.getToolName());
            ps.setString(i++, m.getToolInput());
            ps.setString(i++, m.getToolOutput());
            bindValue(ps, i++, m.getToolDuration());
            ps.setInt(i++, m.isInProgress() ? 1 : 0);
            bindValue(ps, i++, m.getInputTokens());
            bindValue(ps, i++, m.getOutputTokens());
            ps.setString(i++, imagesJson(m.getImages()));
            ps.setString(i++, m.getThinking());
            ps.setString(i++, m.getSessionId());
            ps.setString(i, m.getId());
            if (ps.executeUpdate() > 0) {
                return;
            }
        }
        insertAppended(c, m);
    }

    private boolean insertAppended(Connection c, Message m) throws SQLException {
        int next;
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT COALESCE(MAX(sequence) + 1, 0) FROM messages WHERE session_id = ?")) {
            ps.setString(1, m.getSessionId());
            try (ResultSet rs = ps.executeQuery()) {
                next = rs.next() ? rs.getInt(1) : 0;
            }
        }
        String sql = "INSERT OR IGNORE INTO messages (" + MESSAGE_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            bindMessage(ps, m, m.getSessionId(), next);
            return ps.executeUpdate() > 0;
        }
    }

    private void bindMessage(PreparedStatement ps, Message m, String sessionId, int sequence) throws SQLException {
        int i = 1;
        ps.setString(i++, m.getId());
        ps.setString(i++, sessionId);
        ps.setString(i++, m.getType().name());
        ps.setString(i++, m.getContent());
        ps.setString(i++, text(m.getTimestamp()));
        ps.setInt(i++, sequence);
        ps.setString(i++, m.getToolName());
        ps.setString(i++, m.getToolInput());
        ps.setString(i++, m.getToolOutput());
        bindValue(ps, i++, m.getToolDuration());
        ps.setInt(i++, m.isInProgress() ? 1 : 0);
        bindValue(ps, i++, m.getInputTokens());
        bindValue(ps, i++, m.getOutputTokens());
        ps.setString(i++, imagesJson(m.getImages()));
        ps.setString(i, m.getThinking());
    }

    private static void bindValue(PreparedStatement ps, int index, Object value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.NULL);
        } else if (value instanceof Enum<?> e) {
            ps.setString(index, e.name());
        } else if (value instanceof Instant) {
            ps.setString(index, value.toString());
        } else if (value instanceof Integer) {
            ps.setInt(index, (Integer) value);
        } else if (value instanceof Long) {
            ps.setLong(index, (Long) value);
        } else if (value instanceof Double) {
            ps.setDouble(index, (Double) value);
        } else {
            ps.setString(index, value.toString());
        }
    }

    private Message toMessage(ResultSet rs) throws SQLException {
        return Message.builder()
                .id(rs.getString("id"))
                .sessionId(rs.getString("session_id"))
                .type(MessageType.valueOf(rs.getString("type")))
                .content(rs.getString("content"))
                .timestamp(instant(rs.getString("timestamp")))
                .sequence(rs.getInt("sequence"))
                .toolName(rs.getString("tool_name"))
                .toolInput(rs.getString("tool_input"))
                .toolOutput(rs.getString("tool_output"))
                .toolDuration(nullableDouble(rs, "tool_duration"))
                .inProgress(rs.getInt("is_in_progress") != 0)
                .inputTokens(nullableInt(rs, "input_tokens"))
                .outputTokens(nullableInt(rs, "output_tokens"))
                .images(images(rs.getString("images_json")))
                .thinking(rs.getString("thinking"))
                .build();
    }

    private static Session toSession(ResultSet rs) throws SQLException {
        String format = rs.getString("format");
        return Session.builder()
                .id(rs.getString("id"))
                .format(format == null ? null : TranscriptFormat.fromId(format))
                .projectPath(rs.getString("project_path"))
                .projectName(rs.getString("project_name"))
                .model(rs.getString("model"))
                .modelProvider(rs.getString("model_provider"))
                .customName(rs.getString("custom_name"))
                .summary(rs.getString("summary"))
                .firstPrompt(rs.getString("first_prompt"))
                .transcriptPath(rs.getString("transcript_path"))
                .status(SessionStatus.valueOf(rs.getString("status")))
                .workStatus(WorkStatus.valueOf(rs.getString("work_status")))
                .attentionReason(AttentionReason.valueOf(rs.getString("attention_reason")))
                .pendingToolName(rs.getString("pending_tool_name"))
                .pendingToolInput(rs.getString("pending_tool_input"))
                .pendingQuestion(rs.getString("pending_question"))
                .promptCount(rs.getInt("prompt_count"))
                .toolCount(rs.getInt("tool_count"))
                .totalTokens(rs.getLong("total_tokens"))
                .totalCostUsd(rs.getDouble("total_cost_usd"))
                .lastTool(rs.getString("last_tool"))
                .lastToolAt(instant(rs.getString("last_tool_at")))
                .startedAt(instant(rs.getString("started_at")))
                .lastActivityAt(instant(rs.getString("last_activity_at")))
                .endedAt(instant(rs.getString("ended_at")))
                .endReason(rs.getString("end_reason"))
                .build();
    }

    private String imagesJson(List<ImageAttachment> images) {
        if (images == null || images.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(images);
        } catch (JsonProcessingException e) {
            throw new StoreException("cannot serialize images", e);
        }
    }

    private List<ImageAttachment> images(String json) {
        if (json == null || json.isEmpty()) {
            return new ArrayList<>();
        }
        try {
            return objectMapper.readValue(json, IMAGE_LIST);
        } catch (JsonProcessingException e) {
            log.warn("store.images.decode failed err={}", e.getOriginalMessage());
            return Collections.emptyList();
        }
    }

    private static Double nullableDouble(ResultSet rs, String col) throws SQLException {
        double v = rs.getDouble(col);
        return rs.wasNull() ? null : v;
    }

    private static Integer nullableInt(ResultSet rs, String col) throws SQLException {
        int v = rs.getInt(col);
        return rs.wasNull() ? null : v;
    }

    private static String nameOr(Enum<?> value, Enum<?> fallback) {
        return (value != null ? value : fallback).name();
    }

    private static String text(Instant at) {
        return at == null ? null : at.toString();
    }

    private static Instant instant(String raw) {
        return raw == null ? null : Instant.parse(raw);
    }

    private static void closeQuietly(Connection c) {
        if (c == null) {
            return;
        }
        try {
            c.close();
        } catch (SQLException e) {
            log.warn("store.connection.close failed err={}", e.toString());
        }
    }
}
