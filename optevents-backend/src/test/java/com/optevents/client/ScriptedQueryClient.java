package com.optevents.client;

import com.optevents.model.QueryDocument;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Query client replaying scripted responses in order. Records every call.
 */
public class ScriptedQueryClient implements QueryClient {
    private final Deque<Supplier<QueryResponse>> executes = new ArrayDeque<>();
    private final Map<String, Deque<Supplier<QueryResponse>>> continues = new HashMap<>();
    private final List<QueryDocument> executedQueries = Collections.synchronizedList(new ArrayList<>());
    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());

    public ScriptedQueryClient onExecute(QueryResponse response) {
        executes.addLast(() -> response);
        return this;
    }

    public ScriptedQueryClient onExecute(Supplier<QueryResponse> response) {
        executes.addLast(response);
        return this;
    }

    public ScriptedQueryClient onContinue(String linkName, QueryResponse response) {
        return onContinue(linkName, () -> response);
    }

    public synchronized ScriptedQueryClient onContinue(String linkName, Supplier<QueryResponse> response) {
        continues.computeIfAbsent(linkName, k -> new ArrayDeque<>()).addLast(response);
        return this;
    }

    @Override
    public synchronized QueryResponse executeQuery(QueryDocument query) {
        executedQueries.add(query);
        calls.add("execute:" + query.getLabel());
        Supplier<QueryResponse> next = executes.pollFirst();
        if (next == null) {
            throw new IllegalStateException("unexpected execute of " + query.getLabel() + " query");
        }
        return next.get();
    }

    @Override
    public QueryResponse continueQuery(DataSet dataSet, String linkName) {
        Supplier<QueryResponse> next;
        synchronized (this) {
            calls.add("continue:" + linkName + ":" + dataSet.getLink(linkName));
            Deque<Supplier<QueryResponse>> queue = continues.get(linkName);
            next = queue == null ? null : queue.pollFirst();
        }
        if (next == null) {
            throw new IllegalStateException("unexpected continue via " + linkName);
        }
        return next.get();
    }

    public List<QueryDocument> getExecutedQueries() {
        return List.copyOf(executedQueries);
    }

    public List<String> getCalls() {
        return List.copyOf(calls);
    }

    public long countCalls(String prefix) {
        return getCalls().stream().filter(c -> c.startsWith(prefix)).count();
    }
}
