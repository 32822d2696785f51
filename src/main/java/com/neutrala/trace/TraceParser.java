package com.neutrala.trace;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Decodes the trace artifact written by the instrumentation runtime.
 *
 * <p>The runtime writes one record per line between a header line ending in
 * {@code "events":[} and a footer line starting with {@code ]}. Reading is line based, so a
 * run that was killed mid-write still yields every record before the torn one. Records that
 * cannot be decoded are skipped and reported as {@link TraceWarning}s, never thrown.
 *
 * <p>Each record is decoded with a streaming parser so that the first {@code type} key is the
 * discriminant; variable records repeat {@code type} for the C type and that second value is
 * kept as the {@code varType} attribute.
 */
@Service
public class TraceParser {

    private static final Logger log = LoggerFactory.getLogger(TraceParser.class);

    private static final String HEADER_SUFFIX = "\"events\":[";

    private final ObjectMapper objectMapper;

    public TraceParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses the artifact at {@code artifact}.
     *
     * @throws UnreadableTraceArtifactException if the file is missing or cannot be read
     */
    public ParsedTrace parse(Path artifact) {
        if (!Files.isRegularFile(artifact)) {
            throw new UnreadableTraceArtifactException(artifact, "Trace artifact not found: " + artifact);
        }
        // a decoder that replaces malformed bytes, a torn multi-byte sequence must not fail the read
        try (Reader reader = new InputStreamReader(Files.newInputStream(artifact), StandardCharsets.UTF_8)) {
            ParsedTrace trace = parse(reader);
            log.info("Parsed {} trace events from {} ({} skipped, complete={})",
                    trace.events().size(), artifact.getFileName(), trace.skippedRecords(), trace.complete());
            return trace;
        } catch (IOException e) {
            throw new UnreadableTraceArtifactException(artifact,
                    "Failed to read trace artifact " + artifact + ": " + e.getMessage(), e);
        }
    }

    public ParsedTrace parse(String content) {
        try {
            return parse(new StringReader(content));
        } catch (IOException e) {
            throw new IllegalStateException("StringReader failed", e);
        }
    }

    ParsedTrace parse(Reader source) throws IOException {
        var state = new ParseState();
        BufferedReader reader = source instanceof BufferedReader br ? br : new BufferedReader(source);

        String line;
        long lineNumber = 0;
        boolean firstContent = true;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String text = line.strip();
            if (text.isEmpty()) {
                continue;
            }
            if (firstContent) {
                firstContent = false;
                if (text.endsWith(HEADER_SUFFIX)) {
                    continue;
                }
                if (text.startsWith("{\"") && text.contains("\"events\"")) {
                    String rest = reader.lines().collect(Collectors.joining("\n"));
                    parseDocument(text + "\n" + rest, state);
                    return state.finish();
                }
            }
            if (text.startsWith("]")) {
                parseFooter(text, lineNumber, state);
                break;
            }
            if (text.endsWith(",")) {
                text = text.substring(0, text.length() - 1);
            }
            parseLine(text, lineNumber, state);
        }
        return state.finish();
    }

    private void parseLine(String text, long lineNumber, ParseState state) {
        try (JsonParser parser = objectMapper.getFactory().createParser(text)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                state.skip(TraceWarning.of(TraceWarning.Kind.MALFORMED_RECORD, lineNumber,
                        "Line " + lineNumber + " is not a trace record"));
                return;
            }
            Map<String, Object> fields = readRecord(parser);
            if (parser.nextToken() != null) {
                state.skip(TraceWarning.of(TraceWarning.Kind.MALFORMED_RECORD, lineNumber,
                        "Trailing content after record on line " + lineNumber));
                return;
            }
            state.accept(fields, lineNumber);
        } catch (IOException e) {
            state.skip(TraceWarning.of(TraceWarning.Kind.MALFORMED_RECORD, lineNumber,
                    "Undecodable record on line " + lineNumber + ": " + firstLine(e)));
        }
    }

    private void parseFooter(String text, long lineNumber, ParseState state) {
        String body = text.substring(1).strip();
        if (body.startsWith(",")) {
            body = body.substring(1);
        }
        try {
            JsonNode footer = objectMapper.readTree("{" + body);
            state.complete = true;
            JsonNode tracked = footer.path("tracked_functions");
            if (tracked.isArray()) {
                tracked.forEach(node -> state.trackedFunctions.add(node.asText()));
            }
        } catch (JsonProcessingException e) {
            state.warnings.add(TraceWarning.of(TraceWarning.Kind.MALFORMED_RECORD, lineNumber,
                    "Unreadable footer on line " + lineNumber + ": " + firstLine(e)));
        }
    }

    /**
     * Compact artifact: the whole trace as one JSON document with an {@code events} array.
     */
    private void parseDocument(String content, ParseState state) {
        try (JsonParser parser = objectMapper.getFactory().createParser(content)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                state.warnings.add(TraceWarning.of(TraceWarning.Kind.MALFORMED_RECORD, 1,
                        "Trace document is not a JSON object"));
                return;
            }
            boolean eventsRead = false;
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                String field = parser.currentName();
                JsonToken value = parser.nextToken();
                if ("events".equals(field) && value == JsonToken.START_ARRAY) {
                    long index = 0;
                    while (parser.nextToken() == JsonToken.START_OBJECT) {
                        index++;
                        state.accept(readRecord(parser), index);
                    }
                    eventsRead = true;
                } else if ("tracked_functions".equals(field) && value == JsonToken.START_ARRAY) {
                    while (parser.nextToken() == JsonToken.VALUE_STRING) {
                        state.trackedFunctions.add(parser.getText());
                    }
                } else {
                    parser.skipChildren();
                }
            }
            state.complete = eventsRead;
        } catch (IOException e) {
            // everything decoded before the break is kept
            state.warnings.add(TraceWarning.of(TraceWarning.Kind.MALFORMED_RECORD, state.events.size() + 1L,
                    "Trace document ends in an undecodable record: " + firstLine(e)));
            state.skipped++;
        }
    }

    private Map<String, Object> readRecord(JsonParser parser) throws IOException {
        var fields = new LinkedHashMap<String, Object>();
        boolean typeSeen = false;
        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
            if (token != JsonToken.FIELD_NAME) {
                throw new IOException("Record ended before its closing brace");
            }
            String key = parser.currentName();
            parser.nextToken();
            Object value = readValue(parser);
            if ("type".equals(key)) {
                if (!typeSeen) {
                    typeSeen = true;
                    fields.put("type", value);
                } else {
                    fields.put("varType", value);
                }
            } else {
                fields.put(key, value);
            }
        }
        return fields;
    }

    private Object readValue(JsonParser parser) throws IOException {
        JsonToken token = parser.currentToken();
        if (token == null) {
            throw new IOException("Record is truncated");
        }
        return switch (token) {
            case VALUE_STRING -> parser.getText();
            case VALUE_NUMBER_INT -> parser.getNumberValue();
            case VALUE_NUMBER_FLOAT -> parser.getDoubleValue();
            case VALUE_TRUE -> Boolean.TRUE;
            case VALUE_FALSE -> Boolean.FALSE;
            case VALUE_NULL -> null;
            case START_ARRAY, START_OBJECT -> objectMapper.readValue(parser, Object.class);
            default -> throw new IOException("Unexpected token " + token);
        };
    }

    private static String firstLine(IOException e) {
        String message = e instanceof JsonProcessingException jpe
                ? String.valueOf(jpe.getOriginalMessage())
                : String.valueOf(e.getMessage());
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }

    /**
     * Accumulates events and warnings for one artifact.
     */
    private static final class ParseState {
        final List<TraceEvent> events = new ArrayList<>();
        final List<String> trackedFunctions = new ArrayList<>();
        final List<TraceWarning> warnings = new ArrayList<>();
        int skipped;
        boolean complete;

        void skip(TraceWarning warning) {
            skipped++;
            warnings.add(warning);
            log.debug("Skipping trace record: {}", warning.message());
        }

        void accept(Map<String, Object> fields, long position) {
            Object rawType = fields.remove("type");
            long sequence = asLong(fields.remove("id"), position);
            if (rawType == null) {
                skip(TraceWarning.of(TraceWarning.Kind.MALFORMED_RECORD, sequence,
                        "Record " + sequence + " has no type"));
                return;
            }
            Optional<TraceEventType> type = TraceEventType.fromWire(rawType.toString());
            if (type.isEmpty()) {
                skip(TraceWarning.of(TraceWarning.Kind.UNKNOWN_KIND, sequence,
                        "Record " + sequence + " has unknown kind '" + rawType + "'"));
                return;
            }
            Integer loopId = asInteger(fields.remove("loopId"));
            if (type.get().isLoopControl() && loopId == null) {
                skip(TraceWarning.of(TraceWarning.Kind.MALFORMED_RECORD, sequence,
                        "Loop record " + sequence + " (" + rawType + ") has no loopId"));
                return;
            }
            Object func = fields.remove("func");
            Object file = fields.remove("file");
            Integer line = asInteger(fields.remove("line"));
            Integer depth = asInteger(fields.remove("depth"));
            long ts = asLong(fields.remove("ts"), 0);
            events.add(new TraceEvent(
                    sequence,
                    type.get(),
                    func == null ? "unknown" : func.toString(),
                    file == null ? null : file.toString(),
                    line == null ? 0 : line,
                    depth == null ? 0 : depth,
                    ts,
                    loopId,
                    fields));
        }

        ParsedTrace finish() {
            if (!complete) {
                warnings.add(TraceWarning.of(TraceWarning.Kind.INCOMPLETE_ARTIFACT, -1,
                        "Trace artifact has no footer; " + events.size() + " records recovered"));
            }
            if (skipped > 0) {
                log.warn("Skipped {} undecodable trace records", skipped);
            }
            return new ParsedTrace(events, trackedFunctions, warnings, skipped, complete);
        }

        private static long asLong(Object value, long fallback) {
            if (value instanceof Number number) {
                return number.longValue();
            }
            if (value instanceof String text) {
                try {
                    return Long.parseLong(text);
                } catch (NumberFormatException e) {
                    return fallback;
                }
            }
            return fallback;
        }

        private static Integer asInteger(Object value) {
            if (value instanceof Number number) {
                return number.intValue();
            }
            if (value instanceof String text) {
                try {
                    return Integer.valueOf(text.strip());
                } catch (NumberFormatException e) {
                    return null;
                }
            }
            return null;
        }
    }
}
