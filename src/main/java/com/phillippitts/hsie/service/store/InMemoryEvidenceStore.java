package com.phillippitts.hsie.service.store;

import com.phillippitts.hsie.domain.Evidence;

import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Heap-backed store. Default when {@code hsie.store.type=memory}.
 */
public class InMemoryEvidenceStore extends AbstractEvidenceStore {

    private final Map<String, Evidence> byId = new ConcurrentHashMap<>();
    private final Map<String, Queue<String>> childIds = new ConcurrentHashMap<>();

    @Override
    protected Evidence doGet(String id) {
        return byId.get(id);
    }

    @Override
    protected Evidence doPutIfAbsent(Evidence evidence) {
        Evidence previous = byId.putIfAbsent(evidence.id(), evidence);
        if (previous == null && evidence.parentId() != null) {
            childIds.computeIfAbsent(evidence.parentId(), k -> new ConcurrentLinkedQueue<>()).add(evidence.id());
        }
        return previous;
    }

    @Override
    protected List<String> doChildIds(String id) {
        Queue<String> q = childIds.get(id);
        return q == null ? List.of() : List.copyOf(q);
    }

    @Override
    protected int doSize() {
        return byId.size();
    }
}
