package com.abroadhelper.resources.scrape;

import com.abroadhelper.config.ResourceProperties;
import com.abroadhelper.resources.model.ResourceRecord;
import org.jsoup.nodes.Document;

import java.util.List;

public interface PageParser {
    List<ResourceRecord> parse(ResourceProperties.Source source, Document document);
}
