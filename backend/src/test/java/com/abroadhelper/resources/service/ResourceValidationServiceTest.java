package com.abroadhelper.resources.service;

import com.abroadhelper.config.ResourceProperties;
import com.abroadhelper.resources.links.LinkChecker;
import com.abroadhelper.resources.model.BrokenLinkFinding;
import com.abroadhelper.resources.model.IndeterminateLinkFinding;
import com.abroadhelper.resources.model.InvalidDateFinding;
import com.abroadhelper.resources.model.LinkCheckResult;
import com.abroadhelper.resources.model.LinkTarget;
import com.abroadhelper.resources.model.MissingFieldsFinding;
import com.abroadhelper.resources.model.ResourceCategory;
import com.abroadhelper.resources.model.ResourceRecord;
import com.abroadhelper.resources.model.StaleDataFinding;
import com.abroadhelper.resources.model.ValidationResult;
import com.abroadhelper.resources.persistence.ResourceRepository;
import com.abroadhelper.resources.validation.RecordValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResourceValidationServiceTest {
    private static final String FRESH = "2024-05-20T00:00:00Z";

    @Mock
    private ResourceRepository repository;

    @Mock
    private LinkChecker linkChecker;

    private ResourceValidationService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC);
        RecordValidator validator = new RecordValidator(new ResourceProperties(), clock);
        service = new ResourceValidationService(repository, validator, linkChecker);
    }

    @Test
    void aggregatesEveryFindingListSortedById() {
        when(repository.listAll(Optional.empty())).thenReturn(List.of(
            record("d", "Old visa guide", "visa", "Canada", null, "https://example.com/d", null, "2023-01-01T00:00:00Z"),
            record("b", "Pearson", "scholarship", "Canada", "University of Toronto", "https://example.com/b", "2025-01-15", FRESH),
            record("c", "Barista", "job", "Canada", null, null, "2024-02-30", FRESH),
            record("a", "Permit", "visa", null, null, "https://example.com/a", null, FRESH)
        ));
        Map<String, LinkCheckResult> links = new LinkedHashMap<>();
        links.put("d", LinkCheckResult.live(200));
        links.put("b", LinkCheckResult.broken(404, null));
        links.put("a", LinkCheckResult.indeterminate("deadline_exceeded"));
        when(linkChecker.checkAll(anyCollection())).thenReturn(links);

        ValidationResult result = service.run(Optional.empty());

        assertThat(result.category()).isNull();
        assertThat(result.totalResources()).isEqualTo(4);
        assertThat(result.brokenLinks()).containsExactly(
            new BrokenLinkFinding("b", "Pearson", "https://example.com/b", 404, "scholarship"));
        assertThat(result.indeterminateLinks()).containsExactly(
            new IndeterminateLinkFinding("a", "Permit", "https://example.com/a", "deadline_exceeded"));
        assertThat(result.missingFields()).containsExactly(
            new MissingFieldsFinding("a", "Permit", List.of("country")));
        assertThat(result.invalidDates()).containsExactly(
            new InvalidDateFinding("c", "Barista", List.of("Invalid deadline format: 2024-02-30")));
        assertThat(result.staleData()).extracting(StaleDataFinding::id).containsExactly("d");
        assertThat(result.passed()).containsExactly("b", "d");
        assertThat(result.issuesCount()).isEqualTo(4);
    }

    @Test
    void onlyUrlBearingRecordsAreSentToLinkCheckInOneBatch() {
        when(repository.listAll(Optional.empty())).thenReturn(List.of(
            record("a", "With link", "visa", "Canada", null, "https://example.com/a", null, FRESH),
            record("b", "Without link", "visa", "Canada", null, " ", null, FRESH)
        ));
        when(linkChecker.checkAll(anyCollection())).thenReturn(Map.of("a", LinkCheckResult.live(200)));

        service.run(Optional.empty());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Collection<LinkTarget>> captor = ArgumentCaptor.forClass(Collection.class);
        verify(linkChecker).checkAll(captor.capture());
        assertThat(captor.getValue()).extracting(LinkTarget::recordId).containsExactly("a");
    }

    @Test
    void categoryFilterIsPassedToStoreAndReported() {
        when(repository.listAll(Optional.of(ResourceCategory.SCHOLARSHIP))).thenReturn(List.of());

        ValidationResult result = service.run(Optional.of(ResourceCategory.SCHOLARSHIP));

        assertThat(result.category()).isEqualTo("scholarship");
        verify(repository).listAll(Optional.of(ResourceCategory.SCHOLARSHIP));
    }

    @Test
    void emptyStoreYieldsEmptyResultWithoutProbing() {
        when(repository.listAll(Optional.empty())).thenReturn(List.of());

        ValidationResult result = service.run(Optional.empty());

        assertThat(result.totalResources()).isZero();
        assertThat(result.brokenLinks()).isEmpty();
        assertThat(result.staleData()).isEmpty();
        assertThat(result.invalidDates()).isEmpty();
        assertThat(result.missingFields()).isEmpty();
        assertThat(result.indeterminateLinks()).isEmpty();
        assertThat(result.passed()).isEmpty();
        verifyNoInteractions(linkChecker);
    }

    @Test
    void unreachableStoreFailsTheRun() {
        when(repository.listAll(any())).thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> service.run(Optional.empty()))
            .isInstanceOf(ResourceStoreUnavailableException.class)
            .hasMessageContaining("connection refused");
        verifyNoInteractions(linkChecker);
    }

    @Test
    void repeatedRunsOverUnchangedStoreAreEqualAndNeverWrite() {
        when(repository.listAll(Optional.empty())).thenReturn(List.of(
            record("b", "Pearson", "scholarship", "Canada", null, "https://example.com/b", null, FRESH),
            record("a", "Permit", "visa", "Canada", null, "https://example.com/a", null, FRESH)
        ));
        when(linkChecker.checkAll(anyCollection())).thenReturn(Map.of(
            "a", LinkCheckResult.broken(0, "io_error"),
            "b", LinkCheckResult.live(200)
        ));

        ValidationResult first = service.run(Optional.empty());
        ValidationResult second = service.run(Optional.empty());

        assertThat(second).isEqualTo(first);
        assertThat(first.brokenLinks()).extracting(BrokenLinkFinding::statusCode).containsExactly(0);
        verify(repository, never()).upsert(any());
        verify(repository, never()).delete(any());
    }

    private static ResourceRecord record(
        String id,
        String title,
        String category,
        String country,
        String institution,
        String url,
        String deadline,
        String lastUpdated
    ) {
        return new ResourceRecord(
            id, title, null, url, category, country, institution, deadline,
            null, null, List.of(), lastUpdated, Map.of()
        );
    }
}
