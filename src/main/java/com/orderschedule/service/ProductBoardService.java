package com.orderschedule.service;

import com.orderschedule.dto.AddProductRequest;
import com.orderschedule.dto.BoardProductResponse;
import com.orderschedule.dto.CompletionUpdateRequest;
import com.orderschedule.dto.ScheduleEventResponse;
import com.orderschedule.dto.ScheduleResponse;
import com.orderschedule.dto.UpdateProductRequest;
import com.orderschedule.exception.DuplicateProductException;
import com.orderschedule.exception.ProductNotFoundException;
import com.orderschedule.exception.ScheduleEventNotFoundException;
import com.orderschedule.model.BoardEntry;
import com.orderschedule.model.DemandItem;
import com.orderschedule.repository.DemandCatalogRepository;
import com.orderschedule.repository.ProductBoardRepository;
import com.orderschedule.simulation.EventKey;
import com.orderschedule.simulation.EventKind;
import com.orderschedule.simulation.ReplenishmentInputs;
import com.orderschedule.simulation.ReplenishmentScheduler;
import com.orderschedule.simulation.ScheduleEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * The product board: items picked from the uploaded demand file, each with its latest
 * schedule. Completion flags live in the repository overlay and are copied onto the
 * events whenever a schedule is produced or read.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProductBoardService {

    private final DemandCatalogRepository catalogRepository;
    private final ProductBoardRepository boardRepository;
    private final ReplenishmentScheduler scheduler;
    private final ScheduleService scheduleService;
    private final Clock clock;

    public BoardProductResponse addProduct(AddProductRequest request) {
        String sku = request.getSku().trim();
        if (boardRepository.existsBySku(sku)) {
            throw new DuplicateProductException(sku);
        }
        DemandItem item = catalogRepository.findBySku(sku)
            .orElseThrow(() -> new ProductNotFoundException(sku, "the uploaded demand file"));

        ReplenishmentInputs inputs = ReplenishmentInputs.builder()
            .productTitle(item.getProductTitle())
            .variantTitle(item.getVariantTitle())
            .sku(item.getSku())
            .startingInventory(item.getEndingQuantity())
            .dailyDemand(item.getQuantitySoldPerDay())
            .leadTimeDays(request.getLeadTimeDays())
            .shippingTimeDays(request.getShippingTimeDays())
            .safetyStockDays(request.getSafetyStockDays())
            .inTransitQuantity(request.getInTransitQuantity())
            .inTransitArrivalDate(request.getInTransitArrivalDate())
            .startDate(request.getStartDate() != null ? request.getStartDate() : scheduleService.today())
            .build();

        Instant now = Instant.now(clock);
        BoardEntry entry = generate(inputs, now, now);
        if (!boardRepository.addIfAbsent(entry)) {
            throw new DuplicateProductException(sku);
        }
        log.info("Product added | sku={} | reorderPoint={} | orders={}",
                 sku, entry.getParameters().reorderPoint(), countOrders(entry.getSchedule()));
        return toProductResponse(entry);
    }

    public BoardProductResponse updateProduct(String sku, UpdateProductRequest request) {
        BoardEntry existing = requireEntry(sku);
        ReplenishmentInputs current = existing.getInputs();
        ReplenishmentInputs.ReplenishmentInputsBuilder builder = current.toBuilder();
        if (request.getLeadTimeDays() != null) {
            builder.leadTimeDays(request.getLeadTimeDays());
        }
        if (request.getShippingTimeDays() != null) {
            builder.shippingTimeDays(request.getShippingTimeDays());
        }
        if (request.getSafetyStockDays() != null) {
            builder.safetyStockDays(request.getSafetyStockDays());
        }
        if (request.getInTransitQuantity() != null) {
            builder.inTransitQuantity(request.getInTransitQuantity());
        }
        if (request.getInTransitArrivalDate() != null) {
            builder.inTransitArrivalDate(request.getInTransitArrivalDate());
        }
        if (request.getStartDate() != null) {
            builder.startDate(request.getStartDate());
        }

        BoardEntry regenerated = boardRepository.replace(
            generate(builder.build(), existing.getAddedAt(), Instant.now(clock)));
        log.info("Product updated | sku={} | orders={}", sku, countOrders(regenerated.getSchedule()));
        return toProductResponse(regenerated);
    }

    public List<BoardProductResponse> listProducts() {
        return boardRepository.findAll().stream().map(this::toProductResponse).toList();
    }

    public ScheduleResponse getSchedule(String sku) {
        BoardEntry entry = requireEntry(sku);
        List<ScheduleEvent> schedule = applyCompletions(entry.getSchedule());
        return scheduleService.toResponse(entry.getInputs(), entry.getParameters(), schedule, entry.getGeneratedAt());
    }

    public List<ScheduleEvent> scheduleEvents(String sku) {
        return applyCompletions(requireEntry(sku).getSchedule());
    }

    public ScheduleEventResponse updateCompletion(String sku, CompletionUpdateRequest request) {
        BoardEntry entry = requireEntry(sku);
        EventKey key = new EventKey(sku, request.getArrivalDate(), request.getEventKind());
        ScheduleEvent event = entry.getSchedule().stream()
            .filter(e -> e.key().equals(key))
            .findFirst()
            .orElseThrow(() -> new ScheduleEventNotFoundException(key));

        boardRepository.setCompleted(key, request.isCompleted());
        event.setCompleted(request.isCompleted());
        log.info("Completion updated | sku={} | event={} | arrival={} | completed={}",
                 sku, key.eventKind(), key.arrivalDate(), request.isCompleted());
        return ScheduleEventResponse.from(event);
    }

    private BoardEntry generate(ReplenishmentInputs inputs, Instant addedAt, Instant generatedAt) {
        List<ScheduleEvent> schedule = applyCompletions(scheduler.simulateReplenishment(inputs));
        return BoardEntry.builder()
            .inputs(inputs)
            .parameters(scheduler.computeParameters(inputs))
            .schedule(schedule)
            .addedAt(addedAt)
            .generatedAt(generatedAt)
            .build();
    }

    private List<ScheduleEvent> applyCompletions(List<ScheduleEvent> schedule) {
        schedule.forEach(event -> event.setCompleted(boardRepository.isCompleted(event.key())));
        return schedule;
    }

    private BoardEntry requireEntry(String sku) {
        return boardRepository.findBySku(sku)
            .orElseThrow(() -> new ProductNotFoundException(sku, "the product board"));
    }

    private int countOrders(List<ScheduleEvent> schedule) {
        return (int) schedule.stream().filter(e -> e.getEventKind() == EventKind.ORDER_PLACED).count();
    }

    private BoardProductResponse toProductResponse(BoardEntry entry) {
        ReplenishmentInputs inputs = entry.getInputs();
        return BoardProductResponse.builder()
            .productTitle(inputs.getProductTitle())
            .variantTitle(inputs.getVariantTitle())
            .sku(inputs.getSku())
            .currentInventory(inputs.getStartingInventory())
            .dailyDemand(inputs.getDailyDemand())
            .manufacturingLeadTime(inputs.getLeadTimeDays())
            .shippingTime(inputs.getShippingTimeDays())
            .safetyStockDays(inputs.getSafetyStockDays())
            .orderQuantity(entry.getParameters().orderQuantity())
            .totalLeadTime(entry.getParameters().totalLeadTime())
            .safetyStock(entry.getParameters().safetyStock())
            .reorderPoint(entry.getParameters().reorderPoint())
            .inTransitQuantity(inputs.getInTransitQuantity())
            .inTransitArrivalDate(inputs.getInTransitArrivalDate())
            .startDate(inputs.getStartDate())
            .orderCount(countOrders(entry.getSchedule()))
            .addedAt(entry.getAddedAt())
            .build();
    }
}
