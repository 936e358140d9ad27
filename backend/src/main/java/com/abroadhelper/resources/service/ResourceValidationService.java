package com.abroadhelper.resources.service;

import com.abroadhelper.resources.links.LinkChecker;
import com.abroadhelper.resources.model.BrokenLinkFinding;
import com.abroadhelper.resources.model.IndeterminateLinkFinding;
import com.abroadhelper.resources.model.InvalidDateFinding;
import com.abroadhelper.resources.model.LinkCheckResult;
import com.abroadhelper.resources.model.LinkStatus;
import com.abroadhelper.resources.model.LinkTarget;
import com.abroadhelper.resources.model.MissingFieldsFinding;
import com.abroadhelper.resources.model.ResourceCategory;
import com.abroadhelper.resources.model.ResourceRecord;
import com.abroadhelper.resources.model.StaleDataFinding;
import com.abroadhelper.resources.model.ValidationResult;
import com.abroadhelper.resources.persistence.ResourceRepository;
import com.abroadhelper.resources.validation.RecordValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the record checks and the link check over the stored resources and aggregates one
 * {@link ValidationResult}. The store is only read.
 */
@Service
public class ResourceValidationService {
    private static final Logger log = LoggerFactory.getLogger(ResourceValidationService.class);
    private static final Comparator<String> ID_ORDER = Comparator.nullsFirst(Comparator.naturalOrder());

    private final ResourceRepository repository;
    private final RecordValidator recordValidator;
    private final LinkChecker linkChecker;

    public ResourceValidationService(
        ResourceRepository repository,
        RecordValidator recordValidator,
        LinkChecker linkChecker
    ) {
        this.repository = repository;
        this.recordValidator = recordValidator;
        this.linkChecker = linkChecker;
    }

    public ValidationResult run(Optional<ResourceCategory> category) {
        List<ResourceRecord> records = load(category);
        log.info(
            "Validating {} resources category={}",
            records.size(),
            category.map(ResourceCategory::value).orElse("all")
        );

        List<MissingFieldsFinding> missingFields = new ArrayList<>();
        List<InvalidDateFinding> invalidDates = new ArrayList<>();
        List<StaleDataFinding> staleData = new ArrayList<>();
        List<String> passed = new ArrayList<>();
        List<LinkTarget> linkTargets = new ArrayList<>();

        for (ResourceRecord record : records) {
            List<String> missing = recordValidator.missingFields(record);
            if (!missing.isEmpty()) {
                missingFields.add(new MissingFieldsFinding(record.id(), record.title(), missing));
            }
            List<String> dateErrors = recordValidator.dateErrors(record);
            if (!dateErrors.isEmpty()) {
                invalidDates.add(new InvalidDateFinding(record.id(), record.title(), dateErrors));
            }
            recordValidator.staleness(record).ifPresent(staleData::add);
            if (missing.isEmpty() && dateErrors.isEmpty()) {
                passed.add(record.id());
            }
            if (record.hasUrl()) {
                linkTargets.add(LinkTarget.of(record));
            }
        }

        List<BrokenLinkFinding> brokenLinks = new ArrayList<>();
        List<IndeterminateLinkFinding> indeterminateLinks = new ArrayList<>();
        if (!linkTargets.isEmpty()) {
            Map<String, LinkCheckResult> linkResults = linkChecker.checkAll(linkTargets);
            for (LinkTarget target : linkTargets) {
                LinkCheckResult result = linkResults.get(target.recordId());
                if (result == null || result.isLive()) {
                    continue;
                }
                if (result.status() == LinkStatus.BROKEN) {
                    brokenLinks.add(new BrokenLinkFinding(
                        target.recordId(),
                        target.title(),
                        target.url(),
                        result.statusCode(),
                        target.category()
                    ));
                } else {
                    indeterminateLinks.add(new IndeterminateLinkFinding(
                        target.recordId(),
                        target.title(),
                        target.url(),
                        result.reason()
                    ));
                }
            }
        }

        brokenLinks.sort(Comparator.comparing(BrokenLinkFinding::id, ID_ORDER));
        staleData.sort(Comparator.comparing(StaleDataFinding::id, ID_ORDER));
        invalidDates.sort(Comparator.comparing(InvalidDateFinding::id, ID_ORDER));
        missingFields.sort(Comparator.comparing(MissingFieldsFinding::id, ID_ORDER));
        indeterminateLinks.sort(Comparator.comparing(IndeterminateLinkFinding::id, ID_ORDER));
        passed.sort(ID_ORDER);

        ValidationResult result = new ValidationResult(
            category.map(ResourceCategory::value).orElse(null),
            records.size(),
            brokenLinks,
            staleData,
            invalidDates,
            missingFields,
            indeterminateLinks,
            passed
        );
        log.info(
            "Validation finished total={} broken={} stale={} invalidDates={} missingFields={} indeterminate={} passed={}",
            result.totalResources(),
            brokenLinks.size(),
            staleData.size(),
            invalidDates.size(),
            missingFields.size(),
            indeterminateLinks.size(),
            passed.size()
        );
        return result;
    }

    private List<ResourceRecord> load(Optional<ResourceCategory> category) {
        try {
            return repository.listAll(category);
        } catch (DataAccessException e) {
            log.error("Resource store unavailable, validation aborted", e);
            throw new ResourceStoreUnavailableException("Resource store unavailable: " + e.getMostSpecificCause().getMessage(), e);
        }
    }
}
