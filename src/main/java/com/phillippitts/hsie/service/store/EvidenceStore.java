package com.phillippitts.hsie.service.store;

import com.phillippitts.hsie.domain.Evidence;

import java.util.List;

/**
 * Append-only, content-addressed repository of immutable Evidence.
 *
 * <p>The store is the only owner of Evidence objects. Its contract has no update or delete
 * operation; the lineage graph is a forest of chains whose only edges are parent pointers.
 *
 * <p>Implementations must be safe for concurrent use without a global lock: concurrent {@link #put}
 * calls for equal content converge to one id.
 */
public interface EvidenceStore {

    /**
     * Commits an Evidence.
     *
     * @param evidence Evidence whose id is the content address of its kind, parent and payload
     * @return id of the stored Evidence; the existing id when equal content was already committed
     * @throws com.phillippitts.hsie.exception.IntegrityException if the id does not match the content,
     *         the parent is missing, or the version kind does not immediately follow the parent's
     */
    String put(Evidence evidence);

    /**
     * @throws com.phillippitts.hsie.exception.NotFoundException for unknown ids
     */
    Evidence get(String id);

    /**
     * @return direct descendants in commit order
     * @throws com.phillippitts.hsie.exception.NotFoundException for unknown ids
     */
    List<Evidence> children(String id);

    /**
     * @return the parent chain from the Raw root down to (and including) {@code id}
     * @throws com.phillippitts.hsie.exception.NotFoundException for unknown ids
     */
    List<Evidence> lineage(String id);

    /**
     * Recomputes the content address of a stored Evidence.
     *
     * @return the verified Evidence
     * @throws com.phillippitts.hsie.exception.IntegrityException if the stored content does not hash to its id
     * @throws com.phillippitts.hsie.exception.NotFoundException for unknown ids
     */
    Evidence verify(String id);

    boolean contains(String id);

    int size();
}
