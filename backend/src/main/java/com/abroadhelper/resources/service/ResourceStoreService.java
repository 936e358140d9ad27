package com.abroadhelper.resources.service;

import com.abroadhelper.resources.model.BulkUpsertSummary;
import com.abroadhelper.resources.model.ResourceCategory;
import com.abroadhelper.resources.model.ResourceRecord;
import com.abroadhelper.resources.model.UpsertResult;
import com.abroadhelper.resources.persistence.ResourceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public class ResourceStoreService {
    private static final Logger log = LoggerFactory.getLogger(ResourceStoreService.class);

    private final ResourceRepository repository;

    public ResourceStoreService(ResourceRepository repository) {
        this.repository = repository;
    }

    public List<ResourceRecord> list(Optional<ResourceCategory> category) {
        try {
            return repository.listAll(category);
        } catch (DataAccessException e) {
            throw unavailable(e);
        }
    }

    public Optional<ResourceRecord> find(String id) {
        try {
            return repository.findById(id);
        } catch (DataAccessException e) {
            throw unavailable(e);
        }
    }

    public UpsertResult upsert(ResourceRecord record) {
        try {
            return repository.upsert(record);
        } catch (DataIntegrityViolationException e) {
            throw new IllegalArgumentException("Resource rejected by store: " + e.getMostSpecificCause().getMessage(), e);
        } catch (DataAccessException e) {
            throw unavailable(e);
        }
    }

    /** Upserts each record independently; one failing record does not stop the rest. */
    public BulkUpsertSummary bulkUpsert(List<ResourceRecord> records) {
        int success = 0;
        int failed = 0;
        for (ResourceRecord record : records) {
            try {
                repository.upsert(record);
                success++;
            } catch (IllegalArgumentException | DataAccessException e) {
                failed++;
                log.error("Error saving resource {}: {}", record.title(), e.getMessage());
            }
        }
        log.info("Bulk upsert finished success={} failed={}", success, failed);
        return new BulkUpsertSummary(success, failed);
    }

    public boolean delete(String id) {
        try {
            return repository.delete(id);
        } catch (DataAccessException e) {
            throw unavailable(e);
        }
    }

    private static ResourceStoreUnavailableException unavailable(DataAccessException e) {
        return new ResourceStoreUnavailableException("Resource store unavailable: " + e.getMostSpecificCause().getMessage(), e);
    }
}
