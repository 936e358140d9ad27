package com.abroadhelper.resources.api;

import com.abroadhelper.resources.model.ValidationResult;
import com.abroadhelper.resources.service.ResourceValidationService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/validation")
public class ValidationController {
    private final ResourceValidationService validationService;

    public ValidationController(ResourceValidationService validationService) {
        this.validationService = validationService;
    }

    @PostMapping("/run")
    public ValidationResult run(@RequestParam(name = "category", required = false) String category) {
        return validationService.run(CategoryParam.parse(category));
    }
}
