package com.gtmalpha.research.orchestration.service;

import com.gtmalpha.research.orchestration.model.CompanyEntity;
import com.gtmalpha.research.orchestration.model.EntityLoadResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompanyCsvLoaderTest {
    private final CompanyCsvLoader loader = new CompanyCsvLoader();

    @Test
    void loadsCompanyExportAndSkipsNamelessRows() throws Exception {
        EntityLoadResult result;
        try (Reader reader = fixture()) {
            result = loader.load(reader, 0);
        }

        assertThat(result.entities()).extracting(CompanyEntity::name)
            .containsExactly("Acme Analytics", "Northwind Logistics", "Globex  Corporation");
        assertThat(result.skippedRows()).isEqualTo(1);
        assertThat(result.sampleErrors()).singleElement().asString().contains("missing company name");

        CompanyEntity acme = result.entities().get(0);
        assertThat(acme.entityId()).isEqualTo("zi-100001");
        assertThat(acme.domain()).isEqualTo("acme-analytics.com");
        assertThat(acme.metadata())
            .containsEntry("founded_year", "2012")
            .containsEntry("employees", "250")
            .containsEntry("industry", "Software")
            .containsEntry("city", "Austin")
            .containsEntry("country", "United States")
            .doesNotContainKey("revenue");

        CompanyEntity northwind = result.entities().get(1);
        assertThat(northwind.domain()).isEqualTo("northwind.io");
        assertThat(northwind.entityId()).isEqualTo(CompanyCsvLoader.stableId(null, "northwind.io", "Northwind Logistics"));
        assertThat(northwind.entityId()).startsWith("co-").hasSize(19);
    }

    @Test
    void limitCapsLoadedEntities() throws Exception {
        try (Reader reader = fixture()) {
            EntityLoadResult result = loader.load(reader, 2);
            assertThat(result.entities()).hasSize(2);
            assertThat(result.skippedRows()).isZero();
        }
    }

    @Test
    void loadsFromFilePath(@TempDir Path dir) throws Exception {
        Path csv = dir.resolve("companies.csv");
        Files.writeString(csv, "name,website\nInitech,https://initech.com/\n", StandardCharsets.UTF_8);

        EntityLoadResult result = loader.load(csv.toString(), 10);

        assertThat(result.entities()).singleElement().satisfies(entity -> {
            assertThat(entity.name()).isEqualTo("Initech");
            assertThat(entity.domain()).isEqualTo("initech.com");
        });
    }

    @Test
    void missingFileIsReportedUnchecked(@TempDir Path dir) {
        assertThatThrownBy(() -> loader.load(dir.resolve("absent.csv").toString(), 10))
            .isInstanceOf(UncheckedIOException.class);
    }

    @Test
    void stableIdFallsBackToNameWithoutDomain() throws Exception {
        EntityLoadResult result = loader.load(new StringReader("Company Name,Website\n  Hooli ,\n"), 0);

        String expected = CompanyCsvLoader.stableId(null, null, "hooli");
        assertThat(result.entities()).singleElement().extracting(CompanyEntity::entityId).isEqualTo(expected);
        assertThat(CompanyCsvLoader.stableId(" 42 ", "hooli.com", "Hooli")).isEqualTo("zi-42");
    }

    private Reader fixture() {
        return new InputStreamReader(
            CompanyCsvLoaderTest.class.getResourceAsStream("/fixtures/companies.csv"),
            StandardCharsets.UTF_8
        );
    }
}
