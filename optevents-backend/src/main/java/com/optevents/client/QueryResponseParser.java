package com.optevents.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts the JSON body of a query service response into a {@link QueryResponse}.
 *
 * <p>Typed cells are objects with a {@code type} discriminator ({@code timestamp}, {@code complex},
 * {@code dataset}); everything else is kept as the plain JSON scalar, list or map.
 */
public class QueryResponseParser {
    private static final String TYPE = "type";

    private final ObjectMapper objectMapper;

    public QueryResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public QueryResponse parse(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new RemoteQueryException("query service returned invalid JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new RemoteQueryException("query service returned a non-object response");
        }

        List<QueryError> errors = new ArrayList<>();
        for (JsonNode err : root.path("errors")) {
            errors.add(new QueryError(textOrNull(err.get("title")), textOrNull(err.get("detail"))));
        }

        JsonNode mainNode = root.get("main");
        DataSet main = mainNode == null || mainNode.isNull() ? null : parseDataSet(mainNode);
        return QueryResponse.builder().errors(errors).main(main).build();
    }

    private DataSet parseDataSet(JsonNode node) {
        Map<String, String> links = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.path("links").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (e.getValue().isTextual()) {
                links.put(e.getKey(), e.getValue().asText());
            }
        }

        List<List<Object>> rows = new ArrayList<>();
        for (JsonNode rowNode : node.path("data")) {
            List<Object> row = new ArrayList<>();
            for (JsonNode cell : rowNode) {
                row.add(parseCell(cell));
            }
            rows.add(row);
        }

        return DataSet.builder()
                .name(textOrNull(node.get("name")))
                .data(rows)
                .links(links)
                .build();
    }

    private Object parseCell(JsonNode cell) {
        if (cell == null || cell.isNull()) {
            return null;
        }
        if (cell.isObject() && cell.hasNonNull(TYPE)) {
            String type = cell.get(TYPE).asText();
            switch (type) {
                case "timestamp":
                    return parseTimestamp(cell.path("value").asText());
                case "complex":
                    List<List<Object>> pairs = new ArrayList<>();
                    for (JsonNode pair : cell.path("data")) {
                        List<Object> kv = new ArrayList<>();
                        for (JsonNode v : pair) {
                            kv.add(parseCell(v));
                        }
                        pairs.add(kv);
                    }
                    return new ComplexData(pairs);
                case "dataset":
                    return parseDataSet(cell);
                default:
                    break;
            }
        }
        if (cell.isTextual()) {
            return cell.asText();
        }
        return objectMapper.convertValue(cell, Object.class);
    }

    private static Object parseTimestamp(String value) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(value).toInstant();
            } catch (DateTimeParseException ignored) {
                // Unparseable timestamps stay raw; the extractor reports the wrong cell type.
                return value;
            }
        }
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }
}
