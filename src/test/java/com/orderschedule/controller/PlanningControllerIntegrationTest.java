package com.orderschedule.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class PlanningControllerIntegrationTest {

    private static final String HEADER =
        "product_title,variant_title,variant_sku,ending_quantity,quantity_sold_per_day\n";

    @Autowired TestRestTemplate restTemplate;

    private Map<String, Object> scenarioA() {
        return Map.of(
            "productTitle", "Trail Runner",
            "variantTitle", "42 / Black",
            "sku", "TR-42-BLK",
            "dailyDemand", 10,
            "leadTimeDays", 20,
            "shippingTimeDays", 10,
            "safetyStockDays", 5,
            "startingInventory", 1000,
            "startDate", "2024-01-01"
        );
    }

    private ResponseEntity<Map> upload(String csv) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);
        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        body.add("file", new ByteArrayResource(csv.getBytes(StandardCharsets.UTF_8)) {
            @Override
            public String getFilename() {
                return "demand.csv";
            }
        });
        return restTemplate.postForEntity("/api/v1/demand/upload", new HttpEntity<>(body, headers), Map.class);
    }

    private ResponseEntity<Map> put(String path, Object body) {
        return restTemplate.exchange(path, HttpMethod.PUT, new HttpEntity<>(body), Map.class);
    }

    @Test
    void simulate_returnsScenarioASchedule() {
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/schedules/simulate", scenarioA(), Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(((Number) resp.getBody().get("orderCount")).intValue()).isEqualTo(8);
        List<Map<String, Object>> events = (List<Map<String, Object>>) resp.getBody().get("events");
        assertThat(events.get(0).get("orderDate")).isEqualTo("2024-03-05");
        assertThat(events.get(0).get("arrivalDate")).isEqualTo("2024-04-04");
        assertThat(events.get(0).get("eventKind")).isEqualTo("ORDER_PLACED");
        assertThat(((Number) events.get(0).get("quantity")).doubleValue()).isEqualTo(350.0);
        assertThat(events.get(0).get("completed")).isEqualTo(false);
    }

    @Test
    void parameters_returnsDerivedConstants() {
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/schedules/parameters", scenarioA(), Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(((Number) resp.getBody().get("totalLeadTime")).intValue()).isEqualTo(30);
        assertThat(((Number) resp.getBody().get("reorderPoint")).doubleValue()).isEqualTo(350.0);
        assertThat(((Number) resp.getBody().get("orderQuantity")).doubleValue()).isEqualTo(350.0);
    }

    @Test
    void simulate_negativeDemand_returns422() {
        Map<String, Object> body = new HashMap<>(scenarioA());
        body.put("dailyDemand", -1);

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/schedules/simulate", body, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(resp.getBody()).containsKey("fieldErrors");
    }

    @Test
    void simulate_inTransitWithoutDate_returns400() {
        Map<String, Object> body = new HashMap<>(scenarioA());
        body.put("inTransitQuantity", 200);

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/schedules/simulate", body, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(resp.getBody().get("code")).isEqualTo("INVALID_PARAMETER");
    }

    @Test
    void simulate_echoesRequestId() {
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-Request-ID", "trace-42");

        ResponseEntity<Map> resp = restTemplate.exchange("/api/v1/schedules/simulate", HttpMethod.POST,
            new HttpEntity<>(scenarioA(), headers), Map.class);

        assertThat(resp.getHeaders().getFirst("X-Request-ID")).isEqualTo("trace-42");
    }

    @Test
    void upload_missingColumn_returns400() {
        ResponseEntity<Map> resp = upload("product_title,variant_sku\nCap,SKU-1\n");

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(resp.getBody().get("code")).isEqualTo("DEMAND_FILE_ERROR");
    }

    @Test
    void board_addScheduleCompleteAndExport() {
        ResponseEntity<Map> uploaded = upload(HEADER
            + "Trail Runner,42 / Black,BOARD-1,1000,10\n"
            + "Wool Cap,One Size,BOARD-2,40,1\n");
        assertThat(uploaded.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(((Number) uploaded.getBody().get("itemCount")).intValue()).isEqualTo(2);

        ResponseEntity<List> items = restTemplate.getForEntity("/api/v1/demand/items", List.class);
        assertThat(items.getBody()).hasSize(2);

        Map<String, Object> add = Map.of(
            "sku", "BOARD-1", "leadTimeDays", 20, "shippingTimeDays", 10, "safetyStockDays", 5,
            "startDate", "2024-01-01");
        ResponseEntity<Map> added = restTemplate.postForEntity("/api/v1/board/products", add, Map.class);
        assertThat(added.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(((Number) added.getBody().get("reorderPoint")).doubleValue()).isEqualTo(350.0);

        ResponseEntity<Map> duplicate = restTemplate.postForEntity("/api/v1/board/products", add, Map.class);
        assertThat(duplicate.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);

        ResponseEntity<Map> completed = put("/api/v1/board/products/BOARD-1/schedule/completion",
            Map.of("eventKind", "ORDER_PLACED", "arrivalDate", "2024-04-04", "completed", true));
        assertThat(completed.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(completed.getBody().get("completed")).isEqualTo(true);

        ResponseEntity<Map> schedule = restTemplate.getForEntity("/api/v1/board/products/BOARD-1/schedule", Map.class);
        List<Map<String, Object>> events = (List<Map<String, Object>>) schedule.getBody().get("events");
        assertThat(events.get(0).get("completed")).isEqualTo(true);
        assertThat(events.get(1).get("completed")).isEqualTo(false);

        ResponseEntity<String> export = restTemplate.getForEntity(
            "/api/v1/board/products/BOARD-1/schedule/export", String.class);
        assertThat(export.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(export.getHeaders().getFirst(HttpHeaders.CONTENT_DISPOSITION))
            .contains("BOARD-1_order_schedule.csv");
        List<String> lines = export.getBody().lines().toList();
        assertThat(lines).hasSize(9);
        assertThat(lines.get(1)).contains("2024-03-05", "2024-04-04", "true");
    }

    @Test
    void board_unknownProductAndEvent_return404() {
        ResponseEntity<Map> missing = restTemplate.getForEntity("/api/v1/board/products/NOT-THERE/schedule", Map.class);
        assertThat(missing.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);

        upload(HEADER + "Wool Cap,One Size,BOARD-3,40,1\n");
        restTemplate.postForEntity("/api/v1/board/products",
            Map.of("sku", "BOARD-3", "startDate", "2024-01-01"), Map.class);

        ResponseEntity<Map> noEvent = put("/api/v1/board/products/BOARD-3/schedule/completion",
            Map.of("eventKind", "ORDER_PLACED", "arrivalDate", "2030-01-01", "completed", true));
        assertThat(noEvent.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(noEvent.getBody().get("code")).isEqualTo("SCHEDULE_EVENT_NOT_FOUND");
    }

    @Test
    void board_updateRegeneratesSchedule() {
        upload(HEADER + "Trail Runner,44 / Black,BOARD-4,1000,10\n");
        restTemplate.postForEntity("/api/v1/board/products", Map.of(
            "sku", "BOARD-4", "leadTimeDays", 20, "shippingTimeDays", 10, "safetyStockDays", 5,
            "startDate", "2024-01-01"), Map.class);

        ResponseEntity<Map> updated = put("/api/v1/board/products/BOARD-4", Map.of("safetyStockDays", 10));

        assertThat(updated.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(((Number) updated.getBody().get("reorderPoint")).doubleValue()).isEqualTo(400.0);
        ResponseEntity<List> board = restTemplate.getForEntity("/api/v1/board/products", List.class);
        assertThat(board.getBody()).isNotEmpty();
    }
}
