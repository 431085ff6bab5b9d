package com.phillippitts.voiceanalysis.service.store;

import com.phillippitts.voiceanalysis.domain.Tag;
import com.phillippitts.voiceanalysis.exception.StorageException;
import com.phillippitts.voiceanalysis.exception.ValidationException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.PreparedStatement;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * {@link TagStore} over {@link JdbcTemplate} using the {@code TAG} and {@code ANALYSIS_TAG} tables.
 */
@Repository
public class JdbcTagStore implements TagStore {

    static final int MAX_NAME_LENGTH = 100;

    private final JdbcTemplate jdbcTemplate;

    public JdbcTagStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate must not be null");
    }

    @Override
    public Set<String> findByAnalysisId(long analysisId) {
        String sql = "SELECT t.NAME FROM TAG t JOIN ANALYSIS_TAG at ON at.TAG_ID = t.ID "
                + "WHERE at.ANALYSIS_ID = ? ORDER BY t.NAME";
        try {
            return new LinkedHashSet<>(jdbcTemplate.queryForList(sql, String.class, analysisId));
        } catch (DataAccessException e) {
            throw new StorageException("findTags", analysisId, e);
        }
    }

    @Override
    @Transactional
    public Set<String> replaceTags(long analysisId, Collection<String> names) {
        Set<String> normalized = normalize(names);
        try {
            jdbcTemplate.update("DELETE FROM ANALYSIS_TAG WHERE ANALYSIS_ID = ?", analysisId);
            for (String name : normalized) {
                long tagId = findOrCreate(name);
                jdbcTemplate.update("INSERT INTO ANALYSIS_TAG (ANALYSIS_ID, TAG_ID) VALUES (?, ?)", analysisId, tagId);
            }
        } catch (DataAccessException e) {
            throw new StorageException("replaceTags", analysisId, e);
        }
        return Collections.unmodifiableSet(normalized);
    }

    @Override
    public List<Tag> findAll() {
        try {
            return jdbcTemplate.query("SELECT ID, NAME FROM TAG ORDER BY NAME",
                    (rs, rowNum) -> new Tag(rs.getLong("ID"), rs.getString("NAME")));
        } catch (DataAccessException e) {
            throw new StorageException("findAllTags", null, e);
        }
    }

    @Override
    public int deleteForAnalysis(long analysisId) {
        try {
            return jdbcTemplate.update("DELETE FROM ANALYSIS_TAG WHERE ANALYSIS_ID = ?", analysisId);
        } catch (DataAccessException e) {
            throw new StorageException("deleteTags", analysisId, e);
        }
    }

    private long findOrCreate(String name) {
        Optional<Long> existing = findId(name);
        if (existing.isPresent()) {
            return existing.get();
        }
        KeyHolder keyHolder = new GeneratedKeyHolder();
        try {
            jdbcTemplate.update(connection -> {
                PreparedStatement ps = connection.prepareStatement("INSERT INTO TAG (NAME) VALUES (?)", new String[] {"ID"});
                ps.setString(1, name);
                return ps;
            }, keyHolder);
        } catch (DuplicateKeyException e) {
            // Another writer created the same name between our select and insert
            return findId(name).orElseThrow(() -> new StorageException("Tag vanished after duplicate insert: " + name));
        }
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new StorageException("Insert into TAG returned no generated id");
        }
        return key.longValue();
    }

    private Optional<Long> findId(String name) {
        List<Long> ids = jdbcTemplate.queryForList("SELECT ID FROM TAG WHERE NAME = ?", Long.class, name);
        return ids.isEmpty() ? Optional.empty() : Optional.of(ids.get(0));
    }

    private static Set<String> normalize(Collection<String> names) {
        Set<String> result = new LinkedHashSet<>();
        if (names == null) {
            return result;
        }
        for (String name : names) {
            if (name == null || name.isBlank()) {
                throw new ValidationException("tags", "tag names must not be blank");
            }
            String trimmed = name.trim();
            if (trimmed.length() > MAX_NAME_LENGTH) {
                throw new ValidationException("tags", "tag names must be at most " + MAX_NAME_LENGTH + " characters");
            }
            result.add(trimmed);
        }
        return result;
    }
}
