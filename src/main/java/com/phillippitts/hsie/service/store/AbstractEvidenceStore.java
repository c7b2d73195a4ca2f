package com.phillippitts.hsie.service.store;

import com.phillippitts.hsie.domain.Evidence;
import com.phillippitts.hsie.domain.VersionKind;
import com.phillippitts.hsie.exception.IntegrityException;
import com.phillippitts.hsie.exception.NotFoundException;
import com.phillippitts.hsie.exception.PipelineStage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Template for {@link EvidenceStore} implementations.
 *
 * <p>All lineage and content-address checks live here; subclasses only provide atomic storage
 * primitives:
 * <ul>
 *   <li>{@link #doGet(String)} - lookup by id, {@code null} when absent</li>
 *   <li>{@link #doPutIfAbsent(Evidence)} - atomic insert returning the existing entry on conflict</li>
 *   <li>{@link #doChildIds(String)} - ids of direct children in commit order</li>
 *   <li>{@link #doSize()} - number of stored Evidence</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> no lock is taken here. Parents are never removed, so a parent that
 * passed the lineage check still exists when the child is inserted; equal content racing through
 * {@link #doPutIfAbsent(Evidence)} resolves to a single entry.
 */
public abstract class AbstractEvidenceStore implements EvidenceStore {

    private static final Logger LOG = LogManager.getLogger(AbstractEvidenceStore.class);

    @Override
    public final String put(Evidence evidence) {
        Objects.requireNonNull(evidence, "evidence");
        requireContentAddress(evidence);
        requireValidParent(evidence);

        Evidence existing = doPutIfAbsent(evidence);
        if (existing != null) {
            LOG.debug("Evidence {} already stored; returning existing id", evidence.id());
            return existing.id();
        }
        LOG.debug("Stored {} Evidence {} (parent={})", evidence.versionKind().wireName(),
                evidence.id(), evidence.parentId());
        return evidence.id();
    }

    @Override
    public final Evidence get(String id) {
        Evidence e = id == null ? null : doGet(id);
        if (e == null) {
            throw new NotFoundException("No Evidence with id " + id, PipelineStage.STORE, id);
        }
        return e;
    }

    @Override
    public final List<Evidence> children(String id) {
        get(id);
        List<Evidence> out = new ArrayList<>();
        for (String childId : doChildIds(id)) {
            out.add(get(childId));
        }
        return Collections.unmodifiableList(out);
    }

    @Override
    public final List<Evidence> lineage(String id) {
        List<Evidence> chain = new ArrayList<>();
        Evidence current = get(id);
        chain.add(current);
        while (current.parentId() != null) {
            Evidence parent = doGet(current.parentId());
            if (parent == null) {
                throw new IntegrityException("Parent " + current.parentId() + " of " + current.id()
                        + " is missing", PipelineStage.STORE, current.id());
            }
            if (chain.size() > VersionKind.values().length) {
                throw new IntegrityException("Lineage of " + id + " is longer than the version order allows",
                        PipelineStage.STORE, id);
            }
            chain.add(parent);
            current = parent;
        }
        Collections.reverse(chain);
        return Collections.unmodifiableList(chain);
    }

    @Override
    public Evidence verify(String id) {
        Evidence e = get(id);
        String actual = EvidenceFactory.addressOf(e);
        if (!actual.equals(e.id())) {
            throw new IntegrityException("Stored content of " + id + " hashes to " + actual,
                    PipelineStage.STORE, id);
        }
        return e;
    }

    @Override
    public final boolean contains(String id) {
        return id != null && doGet(id) != null;
    }

    @Override
    public final int size() {
        return doSize();
    }

    private static void requireContentAddress(Evidence evidence) {
        String expected = EvidenceFactory.addressOf(evidence);
        if (!expected.equals(evidence.id())) {
            throw new IntegrityException("Evidence id " + evidence.id() + " does not match its content address "
                    + expected, PipelineStage.STORE, evidence.id());
        }
    }

    private void requireValidParent(Evidence evidence) {
        VersionKind required = evidence.versionKind().requiredParentKind();
        String parentId = evidence.parentId();
        if (required == null) {
            if (parentId != null) {
                throw new IntegrityException("Raw Evidence must not have a parent, got " + parentId,
                        PipelineStage.STORE, evidence.id());
            }
            return;
        }
        if (parentId == null) {
            throw new IntegrityException(evidence.versionKind().wireName() + " Evidence requires a parent",
                    PipelineStage.STORE, evidence.id());
        }
        Evidence parent = doGet(parentId);
        if (parent == null) {
            throw new IntegrityException("Parent " + parentId + " does not exist", PipelineStage.STORE,
                    evidence.id());
        }
        if (parent.versionKind() != required) {
            throw new IntegrityException(evidence.versionKind().wireName() + " Evidence cannot derive from "
                    + parent.versionKind().wireName() + " Evidence " + parentId, PipelineStage.STORE,
                    evidence.id());
        }
    }

    protected abstract Evidence doGet(String id);

    /**
     * Atomically stores the Evidence unless its id is already present.
     *
     * @return the previously stored Evidence, or {@code null} if this call inserted it
     */
    protected abstract Evidence doPutIfAbsent(Evidence evidence);

    protected abstract List<String> doChildIds(String id);

    protected abstract int doSize();
}
