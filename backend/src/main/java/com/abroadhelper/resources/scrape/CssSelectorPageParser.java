package com.abroadhelper.resources.scrape;

import com.abroadhelper.config.ResourceProperties;
import com.abroadhelper.resources.model.ResourceRecord;
import com.abroadhelper.resources.util.TextCleaner;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads one record per element matching the source's item selector. Field selectors are applied
 * inside the item element.
 */
@Component
public class CssSelectorPageParser implements PageParser {

    @Override
    public List<ResourceRecord> parse(ResourceProperties.Source source, Document document) {
        ResourceProperties.Selectors selectors = source.getSelectors();
        if (isBlank(selectors.getItem())) {
            return List.of();
        }
        List<ResourceRecord> records = new ArrayList<>();
        for (Element item : document.select(selectors.getItem())) {
            String title = isBlank(selectors.getTitle()) ? TextCleaner.clean(item.text()) : text(item, selectors.getTitle());
            String institution = text(item, selectors.getInstitution());
            String deadlineText = text(item, selectors.getDeadline());
            Map<String, Object> metadata = new LinkedHashMap<>();
            String deadline = null;
            if (deadlineText != null) {
                if (isIsoDate(deadlineText)) {
                    deadline = deadlineText;
                } else {
                    metadata.put("deadline_text", deadlineText);
                }
            }
            records.add(new ResourceRecord(
                null,
                title,
                text(item, selectors.getDescription()),
                link(item, selectors.getLink()),
                source.getCategory(),
                source.getCountry(),
                institution != null ? institution : TextCleaner.clean(source.getInstitution()),
                deadline,
                null,
                null,
                source.getTags(),
                null,
                metadata
            ));
        }
        return records;
    }

    private static String text(Element item, String selector) {
        if (isBlank(selector)) {
            return null;
        }
        Element element = item.selectFirst(selector);
        return element == null ? null : TextCleaner.clean(element.text());
    }

    private static String link(Element item, String selector) {
        Element anchor = isBlank(selector) ? item.selectFirst("a[href]") : item.selectFirst(selector);
        if (anchor == null) {
            return null;
        }
        String href = anchor.absUrl("href");
        return href.isBlank() ? null : href;
    }

    private static boolean isIsoDate(String value) {
        try {
            LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
