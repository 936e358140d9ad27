package com.abroadhelper.resources.model;

import java.util.List;

public record MissingFieldsFinding(String id, String title, List<String> missing) {
    public MissingFieldsFinding {
        missing = List.copyOf(missing);
    }
}
