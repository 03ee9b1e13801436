package com.orderschedule.controller;

import com.orderschedule.dto.AddProductRequest;
import com.orderschedule.dto.BoardProductResponse;
import com.orderschedule.dto.CompletionUpdateRequest;
import com.orderschedule.dto.ScheduleEventResponse;
import com.orderschedule.dto.ScheduleResponse;
import com.orderschedule.dto.UpdateProductRequest;
import com.orderschedule.service.ProductBoardService;
import com.orderschedule.service.ScheduleExportService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.List;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/board/products")
@RequiredArgsConstructor
public class BoardController {

    private static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);

    private final ProductBoardService boardService;
    private final ScheduleExportService exportService;

    @PostMapping
    public ResponseEntity<BoardProductResponse> add(@Valid @RequestBody AddProductRequest request) {
        log.info("POST /board/products | sku={}", request.getSku());
        return ResponseEntity.status(HttpStatus.CREATED).body(boardService.addProduct(request));
    }

    @PutMapping("/{sku}")
    public ResponseEntity<BoardProductResponse> update(
            @PathVariable String sku, @Valid @RequestBody UpdateProductRequest request) {
        return ResponseEntity.ok(boardService.updateProduct(sku, request));
    }

    @GetMapping
    public ResponseEntity<List<BoardProductResponse>> list() {
        return ResponseEntity.ok(boardService.listProducts());
    }

    @GetMapping("/{sku}/schedule")
    public ResponseEntity<ScheduleResponse> schedule(@PathVariable String sku) {
        return ResponseEntity.ok(boardService.getSchedule(sku));
    }

    @PutMapping("/{sku}/schedule/completion")
    public ResponseEntity<ScheduleEventResponse> completion(
            @PathVariable String sku, @Valid @RequestBody CompletionUpdateRequest request) {
        return ResponseEntity.ok(boardService.updateCompletion(sku, request));
    }

    @GetMapping("/{sku}/schedule/export")
    public ResponseEntity<byte[]> export(@PathVariable String sku) {
        String csv = exportService.writeCsv(boardService.scheduleEvents(sku));
        return ResponseEntity.ok()
            .contentType(TEXT_CSV)
            .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                .filename(exportService.fileName(sku))
                .build()
                .toString())
            .body(csv.getBytes(StandardCharsets.UTF_8));
    }
}
