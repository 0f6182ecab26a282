package com.deepansh.codeagent.core;

import com.deepansh.codeagent.model.PlanItem;

import java.util.ArrayList;
import java.util.List;

/**
 * The session's task plan. Writes are serialized because tool calls of one
 * turn may run in parallel; readers always get an immutable snapshot.
 */
public class PlanState {

    private List<PlanItem> items = List.of();

    public synchronized void replace(List<PlanItem> newItems) {
        this.items = List.copyOf(new ArrayList<>(newItems));
    }

    public synchronized List<PlanItem> snapshot() {
        return items;
    }

    public synchronized boolean isEmpty() {
        return items.isEmpty();
    }
}
