package com.orderschedule.service;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.orderschedule.dto.DemandItemResponse;
import com.orderschedule.dto.DemandUploadResponse;
import com.orderschedule.exception.DemandFileException;
import com.orderschedule.model.DemandItem;
import com.orderschedule.repository.DemandCatalogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ingests the demand file the board is populated from. Only the required columns are read;
 * any other column is ignored.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DemandFileService {

    static final String PRODUCT_TITLE = "product_title";
    static final String VARIANT_TITLE = "variant_title";
    static final String VARIANT_SKU = "variant_sku";
    static final String ENDING_QUANTITY = "ending_quantity";
    static final String QUANTITY_SOLD_PER_DAY = "quantity_sold_per_day";
    static final List<String> REQUIRED_COLUMNS = List.of(
        PRODUCT_TITLE, VARIANT_TITLE, VARIANT_SKU, ENDING_QUANTITY, QUANTITY_SOLD_PER_DAY);

    private static final CsvMapper CSV_MAPPER = new CsvMapper();

    private final DemandCatalogRepository catalogRepository;

    @Value("${demand.upload.max-rows:10000}")
    private int maxRows;

    public DemandUploadResponse upload(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new DemandFileException("Demand file must not be empty");
        }
        List<String> warnings = new ArrayList<>();
        List<DemandItem> items;
        try (InputStream in = file.getInputStream()) {
            items = parse(in, warnings);
        } catch (IOException ex) {
            throw new DemandFileException("Error loading demand file. Please ensure it is a valid CSV.", ex);
        }

        catalogRepository.replaceAll(items);
        List<DemandItemResponse> catalog = catalogRepository.findAll().stream()
            .map(DemandItemResponse::from)
            .toList();
        log.info("Demand file uploaded | file={} | rows={} | items={} | warnings={}",
                 file.getOriginalFilename(), items.size(), catalog.size(), warnings.size());

        return DemandUploadResponse.builder()
            .uploadedAt(Instant.now())
            .fileName(file.getOriginalFilename())
            .rowCount(items.size())
            .itemCount(catalog.size())
            .warnings(warnings)
            .items(catalog)
            .build();
    }

    public List<DemandItemResponse> listItems() {
        return catalogRepository.findAll().stream().map(DemandItemResponse::from).toList();
    }

    List<DemandItem> parse(InputStream in, List<String> warnings) throws IOException {
        CsvSchema headerSchema = CsvSchema.emptySchema().withHeader();
        List<DemandItem> items = new ArrayList<>();
        Set<String> seenSkus = new HashSet<>();

        try (MappingIterator<Map<String, String>> rows =
                 CSV_MAPPER.readerForMapOf(String.class).with(headerSchema).readValues(in)) {
            int line = 1;
            while (rows.hasNextValue()) {
                if (line == 1) {
                    requireColumns((CsvSchema) rows.getParserSchema());
                }
                Map<String, String> row = rows.nextValue();
                line++;
                if (items.size() >= maxRows) {
                    throw new DemandFileException("Demand file exceeds the maximum of " + maxRows + " rows");
                }
                DemandItem item = toItem(row, line);
                if (!seenSkus.add(item.getSku())) {
                    warnings.add("Line " + line + ": duplicate SKU '" + item.getSku() + "' ignored");
                    continue;
                }
                items.add(item);
            }
            if (line == 1) {
                requireColumns((CsvSchema) rows.getParserSchema());
                throw new DemandFileException("Demand file contains no data rows");
            }
        }
        return items;
    }

    private void requireColumns(CsvSchema schema) {
        List<String> missing = REQUIRED_COLUMNS.stream()
            .filter(column -> schema == null || schema.column(column) == null)
            .toList();
        if (!missing.isEmpty()) {
            throw new DemandFileException("Demand file is missing required columns: " + String.join(", ", missing));
        }
    }

    private DemandItem toItem(Map<String, String> row, int line) {
        String sku = text(row, VARIANT_SKU);
        if (sku.isEmpty()) {
            throw new DemandFileException("Line " + line + ": " + VARIANT_SKU + " is empty");
        }
        return DemandItem.builder()
            .productTitle(text(row, PRODUCT_TITLE))
            .variantTitle(text(row, VARIANT_TITLE))
            .sku(sku)
            .endingQuantity(number(row, ENDING_QUANTITY, line))
            .quantitySoldPerDay(number(row, QUANTITY_SOLD_PER_DAY, line))
            .build();
    }

    private String text(Map<String, String> row, String column) {
        String value = row.get(column);
        return value != null ? value.trim() : "";
    }

    private double number(Map<String, String> row, String column, int line) {
        String value = text(row, column);
        try {
            double parsed = Double.parseDouble(value);
            if (!Double.isFinite(parsed)) {
                throw new NumberFormatException("not finite");
            }
            return parsed;
        } catch (NumberFormatException ex) {
            throw new DemandFileException(
                "Line " + line + ": " + column + " must be numeric, was '" + value + "'", ex);
        }
    }
}
