package com.abroadhelper.resources.persistence;

import com.abroadhelper.resources.model.ResourceCategory;
import com.abroadhelper.resources.model.ResourceRecord;
import com.abroadhelper.resources.model.UpsertResult;

import java.util.List;
import java.util.Optional;

/** Record store for resources. Implementations throw Spring {@code DataAccessException}s on failure. */
public interface ResourceRepository {

    /** All resources, optionally of one category, ordered by id. */
    List<ResourceRecord> listAll(Optional<ResourceCategory> category);

    Optional<ResourceRecord> findById(String id);

    Optional<ResourceRecord> findByTitle(String title);

    /**
     * Updates the record with the same id, or failing that the same title, and inserts it
     * otherwise.
     *
     * @throws IllegalArgumentException if a date field cannot be stored
     */
    UpsertResult upsert(ResourceRecord record);

    boolean delete(String id);
}
