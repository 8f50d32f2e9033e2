package com.tradingagent.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.tradingagent.domain.model.Position;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON codec for the on-disk files: the two ledger universes and the strategy results export.
 *
 * <p>Ledger files are an object keyed by ticker. Dates are ISO-8601 strings and output is
 * indented so the files stay readable and editable by hand. Field naming comes from the model
 * classes ({@link Position} is snake_case).
 */
public final class LedgerJson {

    private static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();

    private static final TypeReference<LinkedHashMap<String, Position>> POSITIONS_TYPE = new TypeReference<>() {};

    private LedgerJson() {}

    public static byte[] writePositions(Map<String, Position> positions) throws JsonProcessingException {
        return OBJECT_MAPPER.writeValueAsBytes(positions);
    }

    /**
     * Parses a ledger file. An empty file or a JSON {@code null} is an empty ledger.
     *
     * @throws IOException if the content is not a ticker-keyed position object
     */
    public static Map<String, Position> readPositions(byte[] json) throws IOException {
        if (json.length == 0) {
            return new LinkedHashMap<>();
        }
        Map<String, Position> positions = OBJECT_MAPPER.readValue(json, POSITIONS_TYPE);
        return positions != null ? positions : new LinkedHashMap<>();
    }

    /** Serializes a results export or any other report object. */
    public static byte[] writeReport(Object report) throws JsonProcessingException {
        return OBJECT_MAPPER.writeValueAsBytes(report);
    }
}
