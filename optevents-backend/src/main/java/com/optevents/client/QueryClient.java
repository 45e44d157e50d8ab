package com.optevents.client;

import com.optevents.model.QueryDocument;

/**
 * Boundary to the remote query service.
 *
 * <p>Implementations handle transport and authentication. Failures to reach the service or to
 * run the query surface as {@link RemoteQueryException}.
 */
public interface QueryClient {

    /**
     * Runs a query and returns its first page.
     *
     * @param query rendered query
     * @return response
     */
    QueryResponse executeQuery(QueryDocument query);

    /**
     * Follows a named continuation link of a previously returned dataset.
     *
     * @param dataSet dataset carrying the link
     * @param linkName link name, {@code next} or {@code follow}
     * @return response
     */
    QueryResponse continueQuery(DataSet dataSet, String linkName);
}
