package com.abroadhelper.resources.model;

import java.util.List;

public record InvalidDateFinding(String id, String title, List<String> errors) {
    public InvalidDateFinding {
        errors = List.copyOf(errors);
    }
}
