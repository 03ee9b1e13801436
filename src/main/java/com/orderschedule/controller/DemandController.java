package com.orderschedule.controller;

import com.orderschedule.dto.DemandItemResponse;
import com.orderschedule.dto.DemandUploadResponse;
import com.orderschedule.service.DemandFileService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/v1/demand")
@RequiredArgsConstructor
public class DemandController {

    private final DemandFileService demandFileService;

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<DemandUploadResponse> upload(@RequestParam("file") MultipartFile file) {
        log.info("POST /demand/upload | file={} | bytes={}", file.getOriginalFilename(), file.getSize());
        return ResponseEntity.status(HttpStatus.CREATED).body(demandFileService.upload(file));
    }

    @GetMapping("/items")
    public ResponseEntity<List<DemandItemResponse>> items() {
        return ResponseEntity.ok(demandFileService.listItems());
    }
}
