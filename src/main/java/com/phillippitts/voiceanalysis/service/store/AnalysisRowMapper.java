package com.phillippitts.voiceanalysis.service.store;

import com.phillippitts.voiceanalysis.domain.AnalysisRecord;
import com.phillippitts.voiceanalysis.domain.ChannelPrediction;
import com.phillippitts.voiceanalysis.domain.PredictionChannel;
import com.phillippitts.voiceanalysis.domain.SendStatus;
import com.phillippitts.voiceanalysis.service.codec.DecodeResult;
import com.phillippitts.voiceanalysis.service.codec.ProbabilityMapCodec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Maps one {@code AUDIO_ANALYSIS} row to an {@link AnalysisRecord} without tags.
 *
 * <p>Dates are ISO-8601 text. Rows written without an offset are read in the system zone.
 * Channel columns that cannot be decoded read as empty channels.
 */
final class AnalysisRowMapper implements RowMapper<AnalysisRecord> {

    private static final Logger LOG = LogManager.getLogger(AnalysisRowMapper.class);

    static final AnalysisRowMapper INSTANCE = new AnalysisRowMapper();

    private AnalysisRowMapper() {
    }

    @Override
    public AnalysisRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        long id = rs.getLong(AnalysisColumns.ID);
        Map<PredictionChannel, ChannelPrediction> channels = new EnumMap<>(PredictionChannel.class);
        for (PredictionChannel channel : PredictionChannel.values()) {
            ChannelPrediction prediction = readChannel(rs, id, channel);
            if (prediction != null) {
                channels.put(channel, prediction);
            }
        }
        return new AnalysisRecord(
                id,
                rs.getString(AnalysisColumns.TITLE),
                rs.getString(AnalysisColumns.DESCRIPTION),
                SendStatus.fromCode(rs.getInt(AnalysisColumns.SEND_STATUS)),
                rs.getString(AnalysisColumns.ERROR_MESSAGE),
                rs.getString(AnalysisColumns.RECORDING_PATH),
                parseInstant(rs.getString(AnalysisColumns.CREATION_DATE)),
                parseInstant(rs.getString(AnalysisColumns.COMPLETION_DATE)),
                channels,
                Set.of());
    }

    private static ChannelPrediction readChannel(ResultSet rs, long id, PredictionChannel channel)
            throws SQLException {
        String raw = rs.getString(channel.resultColumn());
        Boolean feedback = readFeedback(rs, channel.feedbackColumn());
        if (raw == null) {
            if (feedback != null) {
                LOG.warn("Analysis {} has {} feedback without a prediction; ignoring it", id, channel);
            }
            return null;
        }
        DecodeResult decoded = ProbabilityMapCodec.decodeDetailed(raw);
        if (!decoded.isParsed()) {
            LOG.warn("Analysis {} has an unreadable {} column; treating the channel as empty", id, channel);
            return null;
        }
        if (decoded.outcome() == DecodeResult.Outcome.PARTIAL) {
            LOG.warn("Analysis {}: dropped {} malformed pair(s) in {}", id, decoded.droppedPairs(), channel);
        }
        return new ChannelPrediction(decoded.map(), feedback);
    }

    private static Boolean readFeedback(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        if (rs.wasNull()) {
            return null;
        }
        return value != 0;
    }

    static Instant parseInstant(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(text).atZone(ZoneId.systemDefault()).toInstant();
        }
    }
}
