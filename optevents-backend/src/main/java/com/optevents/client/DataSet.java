package com.optevents.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One table of a query response.
 *
 * <p>Cells are scalars, {@link java.time.Instant} timestamps, {@link ComplexData} attribute bags
 * or nested {@link DataSet} tables. Links are opaque continuation references keyed by name
 * ({@code next}, {@code follow}); only the remote service knows what they point at.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataSet {
    public static final String NEXT = "next";
    public static final String FOLLOW = "follow";

    private String name;

    @Builder.Default
    private List<List<Object>> data = new ArrayList<>();

    @Builder.Default
    private Map<String, String> links = new LinkedHashMap<>();

    public boolean hasLink(String linkName) {
        return links != null && links.containsKey(linkName);
    }

    public String getLink(String linkName) {
        return links == null ? null : links.get(linkName);
    }

    public int rowCount() {
        return data == null ? 0 : data.size();
    }
}
