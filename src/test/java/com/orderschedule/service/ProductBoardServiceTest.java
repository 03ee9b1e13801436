package com.orderschedule.service;

import com.orderschedule.dto.AddProductRequest;
import com.orderschedule.dto.BoardProductResponse;
import com.orderschedule.dto.CompletionUpdateRequest;
import com.orderschedule.dto.ScheduleResponse;
import com.orderschedule.dto.UpdateProductRequest;
import com.orderschedule.exception.DuplicateProductException;
import com.orderschedule.exception.ProductNotFoundException;
import com.orderschedule.exception.ScheduleEventNotFoundException;
import com.orderschedule.model.DemandItem;
import com.orderschedule.repository.DemandCatalogRepository;
import com.orderschedule.repository.ProductBoardRepository;
import com.orderschedule.simulation.EventKind;
import com.orderschedule.simulation.ReplenishmentScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProductBoardServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 1, 1);
    private static final String SKU = "TR-42-BLK";

    @Mock
    DemandCatalogRepository catalogRepository;

    ProductBoardRepository boardRepository;
    ProductBoardService boardService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-01T09:00:00Z"), ZoneOffset.UTC);
        ReplenishmentScheduler scheduler = new ReplenishmentScheduler();
        boardRepository = new ProductBoardRepository();
        boardService = new ProductBoardService(catalogRepository, boardRepository, scheduler,
            new ScheduleService(scheduler, clock), clock);
    }

    private DemandItem catalogItem() {
        return DemandItem.builder()
            .productTitle("Trail Runner")
            .variantTitle("42 / Black")
            .sku(SKU)
            .endingQuantity(1000)
            .quantitySoldPerDay(10)
            .build();
    }

    private AddProductRequest addRequest() {
        return AddProductRequest.builder()
            .sku(SKU)
            .leadTimeDays(20)
            .shippingTimeDays(10)
            .safetyStockDays(5)
            .build();
    }

    @Test
    void addProduct_generatesScheduleFromCatalogRow() {
        when(catalogRepository.findBySku(SKU)).thenReturn(Optional.of(catalogItem()));

        BoardProductResponse product = boardService.addProduct(addRequest());

        assertThat(product.getCurrentInventory()).isEqualTo(1000.0);
        assertThat(product.getDailyDemand()).isEqualTo(10.0);
        assertThat(product.getTotalLeadTime()).isEqualTo(30);
        assertThat(product.getSafetyStock()).isEqualTo(50.0);
        assertThat(product.getOrderQuantity()).isEqualTo(350.0);
        assertThat(product.getStartDate()).isEqualTo(TODAY);
        assertThat(product.getOrderCount()).isEqualTo(8);

        ScheduleResponse schedule = boardService.getSchedule(SKU);
        assertThat(schedule.getEvents().get(0).getOrderDate()).isEqualTo(LocalDate.of(2024, 3, 5));
        assertThat(schedule.getHorizonEnd()).isEqualTo(TODAY.plusDays(365));
        assertThat(schedule.getMessage()).isNull();
    }

    @Test
    void addProduct_defaultsLeadTimesFromTheOriginalForm() {
        when(catalogRepository.findBySku(SKU)).thenReturn(Optional.of(catalogItem()));

        BoardProductResponse product = boardService.addProduct(AddProductRequest.builder().sku(SKU).build());

        assertThat(product.getManufacturingLeadTime()).isEqualTo(45);
        assertThat(product.getShippingTime()).isEqualTo(45);
        assertThat(product.getSafetyStockDays()).isEqualTo(10);
        assertThat(product.getReorderPoint()).isEqualTo(1000.0);
    }

    @Test
    void addProduct_rejectsDuplicateSku() {
        when(catalogRepository.findBySku(SKU)).thenReturn(Optional.of(catalogItem()));
        boardService.addProduct(addRequest());

        assertThatThrownBy(() -> boardService.addProduct(addRequest()))
            .isInstanceOf(DuplicateProductException.class)
            .hasMessageContaining(SKU);
        assertThat(boardService.listProducts()).hasSize(1);
    }

    @Test
    void addProduct_unknownSku_throwsNotFound() {
        when(catalogRepository.findBySku("NOPE")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> boardService.addProduct(AddProductRequest.builder().sku("NOPE").build()))
            .isInstanceOf(ProductNotFoundException.class);
        assertThat(boardRepository.existsBySku("NOPE")).isFalse();
    }

    @Test
    void getSchedule_reportsNoOrdersNeeded() {
        DemandItem slowMover = catalogItem().toBuilder().quantitySoldPerDay(0.5).build();
        when(catalogRepository.findBySku(SKU)).thenReturn(Optional.of(slowMover));
        boardService.addProduct(addRequest());

        ScheduleResponse schedule = boardService.getSchedule(SKU);

        assertThat(schedule.getEvents()).isEmpty();
        assertThat(schedule.getMessage()).isEqualTo(ScheduleService.NO_ORDERS_MESSAGE);
    }

    @Test
    void updateCompletion_marksEventCompleted() {
        when(catalogRepository.findBySku(SKU)).thenReturn(Optional.of(catalogItem()));
        boardService.addProduct(addRequest());

        var updated = boardService.updateCompletion(SKU, CompletionUpdateRequest.builder()
            .eventKind(EventKind.ORDER_PLACED)
            .arrivalDate(LocalDate.of(2024, 4, 4))
            .completed(true)
            .build());

        assertThat(updated.isCompleted()).isTrue();
        ScheduleResponse schedule = boardService.getSchedule(SKU);
        assertThat(schedule.getEvents().get(0).isCompleted()).isTrue();
        assertThat(schedule.getEvents().subList(1, schedule.getEvents().size()))
            .noneMatch(e -> e.isCompleted());
    }

    @Test
    void updateCompletion_followsEventKeyAcrossRegeneration() {
        when(catalogRepository.findBySku(SKU)).thenReturn(Optional.of(catalogItem()));
        boardService.addProduct(addRequest());
        boardService.updateCompletion(SKU, CompletionUpdateRequest.builder()
            .eventKind(EventKind.ORDER_PLACED)
            .arrivalDate(LocalDate.of(2024, 4, 4))
            .completed(true)
            .build());

        boardService.updateProduct(SKU, UpdateProductRequest.builder().safetyStockDays(10).build());
        ScheduleResponse changed = boardService.getSchedule(SKU);
        assertThat(changed.getEvents().get(0).getArrivalDate()).isEqualTo(LocalDate.of(2024, 3, 30));
        assertThat(changed.getEvents()).noneMatch(e -> e.isCompleted());

        boardService.updateProduct(SKU, UpdateProductRequest.builder().safetyStockDays(5).build());
        ScheduleResponse restored = boardService.getSchedule(SKU);
        assertThat(restored.getEvents().get(0).getArrivalDate()).isEqualTo(LocalDate.of(2024, 4, 4));
        assertThat(restored.getEvents().get(0).isCompleted()).isTrue();
    }

    @Test
    void updateCompletion_unknownEvent_throws() {
        when(catalogRepository.findBySku(SKU)).thenReturn(Optional.of(catalogItem()));
        boardService.addProduct(addRequest());

        assertThatThrownBy(() -> boardService.updateCompletion(SKU, CompletionUpdateRequest.builder()
                .eventKind(EventKind.IN_TRANSIT_ARRIVAL)
                .arrivalDate(LocalDate.of(2024, 4, 4))
                .completed(true)
                .build()))
            .isInstanceOf(ScheduleEventNotFoundException.class);
    }

    @Test
    void getSchedule_unknownSku_throwsWithoutTouchingCatalog() {
        assertThatThrownBy(() -> boardService.getSchedule("MISSING"))
            .isInstanceOf(ProductNotFoundException.class);
        verify(catalogRepository, never()).findBySku("MISSING");
    }
}
