package com.abroadhelper.resources.api;

import com.abroadhelper.resources.model.ResourceCategory;
import org.springframework.web.server.ResponseStatusException;

import java.util.Optional;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

final class CategoryParam {
    private CategoryParam() {
    }

    static Optional<ResourceCategory> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        Optional<ResourceCategory> category = ResourceCategory.fromValue(raw);
        if (category.isEmpty()) {
            throw new ResponseStatusException(BAD_REQUEST, "Unsupported category value: " + raw);
        }
        return category;
    }
}
