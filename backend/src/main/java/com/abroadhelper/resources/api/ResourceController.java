package com.abroadhelper.resources.api;

import com.abroadhelper.resources.model.ResourceRecord;
import com.abroadhelper.resources.model.UpsertResult;
import com.abroadhelper.resources.service.ResourceStoreService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api/resources")
public class ResourceController {
    private final ResourceStoreService storeService;

    public ResourceController(ResourceStoreService storeService) {
        this.storeService = storeService;
    }

    @GetMapping
    public List<ResourceRecord> list(@RequestParam(name = "category", required = false) String category) {
        return storeService.list(CategoryParam.parse(category));
    }

    @GetMapping("/{id}")
    public ResourceRecord get(@PathVariable("id") String id) {
        return storeService.find(id)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "Resource not found: " + id));
    }

    @PutMapping
    public UpsertResult upsert(@RequestBody ResourceRecord record) {
        if (record.title() == null || record.title().isBlank()) {
            throw new ResponseStatusException(BAD_REQUEST, "title is required");
        }
        if (CategoryParam.parse(record.category()).isEmpty()) {
            throw new ResponseStatusException(BAD_REQUEST, "category is required");
        }
        try {
            return storeService.upsert(record);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(BAD_REQUEST, e.getMessage());
        }
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") String id) {
        if (!storeService.delete(id)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }
}
