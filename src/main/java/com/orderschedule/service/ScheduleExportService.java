package com.orderschedule.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.orderschedule.dto.ScheduleRecord;
import com.orderschedule.simulation.ScheduleEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Converts schedules to and from their flat CSV form: header row, comma-separated,
 * one line per event.
 */
@Slf4j
@Service
public class ScheduleExportService {

    private static final DateTimeFormatter ISO_DATE = DateTimeFormatter.ISO_LOCAL_DATE;

    private final CsvMapper csvMapper = new CsvMapper();
    private final CsvSchema schema = csvMapper.schemaFor(ScheduleRecord.class).withHeader();

    public List<ScheduleRecord> toRecords(List<ScheduleEvent> schedule) {
        return schedule.stream().map(this::toRecord).toList();
    }

    public String writeCsv(List<ScheduleEvent> schedule) {
        try {
            String csv = csvMapper.writer(schema).writeValueAsString(toRecords(schedule));
            log.debug("Schedule exported | rows={}", schedule.size());
            return csv;
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Could not serialise schedule to CSV", ex);
        }
    }

    public List<ScheduleRecord> readCsv(String csv) {
        try (MappingIterator<ScheduleRecord> rows =
                 csvMapper.readerFor(ScheduleRecord.class).with(schema).readValues(csv)) {
            return rows.readAll();
        } catch (IOException ex) {
            throw new IllegalArgumentException("Could not parse schedule CSV: " + ex.getMessage(), ex);
        }
    }

    public String fileName(String sku) {
        return sku + "_order_schedule.csv";
    }

    private ScheduleRecord toRecord(ScheduleEvent event) {
        return ScheduleRecord.builder()
            .product(event.getProductTitle())
            .variant(event.getVariantTitle())
            .sku(event.getSku())
            .orderDate(event.getOrderDate() != null ? event.getOrderDate().format(ISO_DATE) : "")
            .arrivalDate(event.getArrivalDate().format(ISO_DATE))
            .orderQuantity(event.getQuantity())
            .event(event.getEventKind().label())
            .completed(event.isCompleted())
            .build();
    }
}
