package com.logq.log;

import com.logq.json.JsonNode;
import com.logq.json.LogJsonParser;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Turns the raw content of a document log into the records currently visible to queries.
 * <p>
 * Each line is one marker character followed directly by a JSON object. Only lines that start
 * with {@link #EXISTENCE_MARKER} are decoded; every other line, blank ones included, is skipped.
 * Records are returned in log order.
 */
public class RecordDecoder {
    private static final Logger LOG = LoggerFactory.getLogger(RecordDecoder.class);

    public static final char EXISTENCE_MARKER = 'E';

    private final LogJsonParser parser;

    public RecordDecoder() {
        this(new LogJsonParser());
    }

    public RecordDecoder(LogJsonParser parser) {
        this.parser = parser;
    }

    public MutableList<JsonNode.JsonObject> decode(String content) throws RecordDecodeException {
        MutableList<JsonNode.JsonObject> records = Lists.mutable.empty();
        String[] lines = content.split("\n", -1);
        int hidden = 0;

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (line.isEmpty() || line.charAt(0) != EXISTENCE_MARKER) {
                hidden++;
                continue;
            }
            records.add(decodeLine(i + 1, line.substring(1)));
        }

        LOG.debug("Decoded {} visible records, skipped {} lines", records.size(), hidden);
        return records;
    }

    private JsonNode.JsonObject decodeLine(int lineNumber, String payload) throws RecordDecodeException {
        try {
            return parser.parseObject(payload);
        } catch (IOException e) {
            throw new RecordDecodeException(lineNumber, e.getMessage(), e);
        }
    }
}
