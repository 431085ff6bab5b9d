package com.phillippitts.voiceanalysis.service.store;

import com.phillippitts.voiceanalysis.domain.AnalysisRecord;
import com.phillippitts.voiceanalysis.domain.PredictionChannel;
import com.phillippitts.voiceanalysis.domain.SendStatus;
import com.phillippitts.voiceanalysis.exception.StorageException;
import com.phillippitts.voiceanalysis.service.codec.ProbabilityMapCodec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link AnalysisStore} over {@link JdbcTemplate}.
 */
@Repository
public class JdbcAnalysisStore implements AnalysisStore {

    private static final Logger LOG = LogManager.getLogger(JdbcAnalysisStore.class);

    private static final String INSERT_SQL = "INSERT INTO AUDIO_ANALYSIS "
            + "(TITLE, DESCRIPTION, SEND_STATUS, ERROR_MESSAGE, RECORDING_PATH, CREATION_DATE, COMPLETION_DATE, "
            + "AGE_RESULT, GENDER_RESULT, NATIONALITY_RESULT, EMOTION_RESULT, "
            + "AGE_USER_FEEDBACK, GENDER_USER_FEEDBACK, NATIONALITY_USER_FEEDBACK, EMOTION_USER_FEEDBACK) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
    private static final String SELECT_SQL = "SELECT * FROM AUDIO_ANALYSIS";

    private final JdbcTemplate jdbcTemplate;

    public JdbcAnalysisStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate must not be null");
    }

    @Override
    public long insert(AnalysisRecord record) {
        if (record.id() != null) {
            throw new IllegalArgumentException("Record already has id " + record.id());
        }
        KeyHolder keyHolder = new GeneratedKeyHolder();
        try {
            jdbcTemplate.update(connection -> {
                PreparedStatement ps = connection.prepareStatement(INSERT_SQL, new String[] {AnalysisColumns.ID});
                int i = 1;
                ps.setString(i++, record.title());
                ps.setString(i++, record.description());
                ps.setInt(i++, record.sendStatus().code());
                ps.setString(i++, record.errorMessage());
                ps.setString(i++, record.audioPath());
                ps.setString(i++, record.creationDate().toString());
                ps.setString(i++, record.completionDate() == null ? null : record.completionDate().toString());
                for (PredictionChannel channel : PredictionChannel.values()) {
                    ps.setString(i++, ProbabilityMapCodec.encode(record.prediction(channel)));
                }
                for (PredictionChannel channel : PredictionChannel.values()) {
                    Boolean feedback = record.feedback(channel);
                    if (feedback == null) {
                        ps.setNull(i++, Types.INTEGER);
                    } else {
                        ps.setInt(i++, feedback ? 1 : 0);
                    }
                }
                return ps;
            }, keyHolder);
        } catch (DataAccessException e) {
            throw new StorageException("insert", null, e);
        }
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new StorageException("Insert into AUDIO_ANALYSIS returned no generated id");
        }
        LOG.debug("Inserted analysis {}", key.longValue());
        return key.longValue();
    }

    @Override
    public boolean update(long id, AnalysisUpdate update) {
        if (update.isEmpty()) {
            return exists(id);
        }
        StringBuilder sql = new StringBuilder("UPDATE AUDIO_ANALYSIS SET ");
        List<Object> args = new ArrayList<>();
        boolean first = true;
        for (Map.Entry<String, Object> column : update.columns().entrySet()) {
            if (!first) {
                sql.append(", ");
            }
            sql.append(column.getKey()).append(" = ?");
            args.add(column.getValue());
            first = false;
        }
        sql.append(" WHERE ID = ?");
        args.add(id);
        try {
            return jdbcTemplate.update(sql.toString(), args.toArray()) > 0;
        } catch (DataAccessException e) {
            throw new StorageException("update", id, e);
        }
    }

    @Override
    public Optional<AnalysisRecord> getById(long id) {
        try {
            List<AnalysisRecord> rows = jdbcTemplate.query(SELECT_SQL + " WHERE ID = ?", AnalysisRowMapper.INSTANCE, id);
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            throw new StorageException("getById", id, e);
        }
    }

    @Override
    public List<AnalysisRecord> queryAll(AnalysisOrder order, Integer limit) {
        AnalysisOrder effective = order == null ? AnalysisOrder.CREATION_DATE_DESC : order;
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
        String sql = SELECT_SQL + " ORDER BY " + effective.sql() + (limit == null ? "" : " LIMIT ?");
        try {
            return limit == null
                    ? jdbcTemplate.query(sql, AnalysisRowMapper.INSTANCE)
                    : jdbcTemplate.query(sql, AnalysisRowMapper.INSTANCE, limit);
        } catch (DataAccessException e) {
            throw new StorageException("queryAll", null, e);
        }
    }

    @Override
    public List<AnalysisRecord> findByStatus(SendStatus status) {
        try {
            return jdbcTemplate.query(SELECT_SQL + " WHERE SEND_STATUS = ? ORDER BY "
                    + AnalysisOrder.CREATION_DATE_DESC.sql(), AnalysisRowMapper.INSTANCE, status.code());
        } catch (DataAccessException e) {
            throw new StorageException("findByStatus", null, e);
        }
    }

    @Override
    public boolean delete(long id) {
        try {
            return jdbcTemplate.update("DELETE FROM AUDIO_ANALYSIS WHERE ID = ?", id) > 0;
        } catch (DataAccessException e) {
            throw new StorageException("delete", id, e);
        }
    }

    @Override
    public boolean exists(long id) {
        try {
            Integer count = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM AUDIO_ANALYSIS WHERE ID = ?", Integer.class, id);
            return count != null && count > 0;
        } catch (DataAccessException e) {
            throw new StorageException("exists", id, e);
        }
    }
}
