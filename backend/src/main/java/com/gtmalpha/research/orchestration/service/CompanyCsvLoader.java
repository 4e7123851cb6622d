package com.gtmalpha.research.orchestration.service;

import com.gtmalpha.research.orchestration.model.CompanyEntity;
import com.gtmalpha.research.orchestration.model.EntityLoadResult;
import com.gtmalpha.research.orchestration.util.HashUtils;
import com.gtmalpha.research.orchestration.util.UrlNormalizer;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Service
public class CompanyCsvLoader {
    private static final Logger log = LoggerFactory.getLogger(CompanyCsvLoader.class);
    private static final int MAX_ERROR_SAMPLES = 10;
    private static final Map<String, String> METADATA_COLUMNS = metadataColumns();

    public EntityLoadResult load(String configuredPath, int limit) {
        Path path = resolvePath(configuredPath);
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(reader, limit);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read company CSV " + path, e);
        }
    }

    public EntityLoadResult load(Reader reader, int limit) throws IOException {
        List<CompanyEntity> entities = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        int skipped = 0;
        try (CSVParser parser = csvParser(reader)) {
            for (CSVRecord record : parser) {
                if (limit > 0 && entities.size() >= limit) {
                    break;
                }
                String name = getColumn(record, "Company Name", "company_name", "name");
                if (name == null) {
                    skipped++;
                    if (errors.size() < MAX_ERROR_SAMPLES) {
                        errors.add("row " + record.getRecordNumber() + ": missing company name");
                    }
                    continue;
                }
                String website = UrlNormalizer.cleanUrl(getColumn(record, "Website", "website", "domain"));
                String domain = UrlNormalizer.canonicalDomain(website);
                String zoomInfoId = getColumn(record, "ZoomInfo Company ID", "zoominfo_id", "entity_id");
                Map<String, String> metadata = new LinkedHashMap<>();
                METADATA_COLUMNS.forEach((column, key) -> {
                    String value = getColumn(record, column);
                    if (value != null) {
                        metadata.put(key, value);
                    }
                });
                entities.add(new CompanyEntity(stableId(zoomInfoId, domain, name), name, domain, metadata));
            }
        }
        if (skipped > 0) {
            log.warn("Skipped {} company rows without a name", skipped);
        }
        log.info("Loaded {} companies from CSV", entities.size());
        return new EntityLoadResult(entities, skipped, errors);
    }

    static String stableId(String zoomInfoId, String domain, String name) {
        if (zoomInfoId != null && !zoomInfoId.isBlank()) {
            return "zi-" + zoomInfoId.trim();
        }
        String basis = domain != null ? domain : name.trim().toLowerCase(Locale.ROOT);
        return "co-" + HashUtils.sha256Hex(basis).substring(0, 16);
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .setIgnoreEmptyLines(true)
            .build();
        return format.parse(reader);
    }

    private String getColumn(CSVRecord record, String... names) {
        for (String name : names) {
            for (String header : record.toMap().keySet()) {
                if (header == null) {
                    continue;
                }
                if (header.trim().equalsIgnoreCase(name) && record.isSet(header)) {
                    String value = record.get(header).trim();
                    return value.isEmpty() ? null : value;
                }
            }
        }
        return null;
    }

    private Path resolvePath(String configuredPath) {
        Path path = Paths.get(configuredPath);
        if (path.isAbsolute()) {
            return path.normalize();
        }
        return Paths.get("").toAbsolutePath().resolve(path).normalize();
    }

    private static Map<String, String> metadataColumns() {
        Map<String, String> columns = new LinkedHashMap<>();
        columns.put("Founded Year", "founded_year");
        columns.put("Revenue (in 000s USD)", "revenue");
        columns.put("Revenue Range (in USD)", "revenue_range");
        columns.put("Employees", "employees");
        columns.put("Employee Range", "employee_range");
        columns.put("Primary Industry", "industry");
        columns.put("Primary Sub-Industry", "sub_industry");
        columns.put("Ownership Type", "ownership_type");
        columns.put("Business Model", "business_model");
        columns.put("LinkedIn Company Profile URL", "linkedin_url");
        columns.put("Facebook Company Profile URL", "facebook_url");
        columns.put("Twitter Company Profile URL", "twitter_url");
        columns.put("Company Street Address", "address");
        columns.put("Company City", "city");
        columns.put("Company State", "state");
        columns.put("Company Zip Code", "zip_code");
        columns.put("Company Country", "country");
        return columns;
    }
}
