package com.optevents.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Response of one execute or continue call.
 *
 * <p>A response may carry errors next to usable data; callers log them and keep going.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryResponse {
    @Builder.Default
    private List<QueryError> errors = new ArrayList<>();

    /** Main dataset, or {@code null} when the service returned none. */
    private DataSet main;

    public boolean hasErrors() {
        return errors != null && !errors.isEmpty();
    }
}
