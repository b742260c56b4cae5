package com.umihealth.pos_backend.controller;

import com.umihealth.pos_backend.dto.request.RestockRequest;
import com.umihealth.pos_backend.dto.response.InventoryResponse;
import com.umihealth.pos_backend.dto.response.PaginatedResponse;
import com.umihealth.pos_backend.enums.Role;
import com.umihealth.pos_backend.exception.ResourceNotFoundException;
import com.umihealth.pos_backend.security.JwtTokenProvider;
import com.umihealth.pos_backend.service.InventoryService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.UUID;

import static com.umihealth.pos_backend.testutil.TestDataBuilder.*;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(InventoryController.class)
@ContextConfiguration(classes = {InventoryController.class, WebMvcTestConfig.class})
@DisplayName("InventoryController Tests")
class InventoryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private InventoryService inventoryService;

    @MockBean
    private JwtTokenProvider jwtTokenProvider;

    private InventoryResponse inventoryResponse(UUID productId, int quantity) {
        return InventoryResponse.builder()
                .id(UUID.randomUUID())
                .branchId(BRANCH_ID)
                .productId(productId)
                .quantityOnHand(quantity)
                .reorderLevel(10)
                .lowStock(quantity <= 10)
                .build();
    }

    @Test
    @DisplayName("GET /inventory - Low-stock filter is passed to the service")
    void getInventory_LowStock_Returns200() throws Exception {
        UUID productId = UUID.randomUUID();
        when(inventoryService.getInventory(any(), eq(1), eq(50), eq(true)))
                .thenReturn(PaginatedResponse.of(List.of(inventoryResponse(productId, 3)), 1, 50, 1));

        mockMvc.perform(get("/api/v1/inventory").param("lowStock", "true").with(asUser(Role.PHARMACIST)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.data", hasSize(1)))
                .andExpect(jsonPath("$.data.data[0].lowStock").value(true))
                .andExpect(jsonPath("$.data.data[0].quantityOnHand").value(3));
    }

    @Test
    @DisplayName("GET /inventory/products/{productId} - Unknown product returns 404")
    void getInventoryForProduct_NotFound_Returns404() throws Exception {
        UUID productId = UUID.randomUUID();
        when(inventoryService.getInventoryForProduct(any(), eq(productId)))
                .thenThrow(new ResourceNotFoundException("Inventory", "productId", productId));

        mockMvc.perform(get("/api/v1/inventory/products/{productId}", productId).with(asUser(Role.CASHIER)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("RESOURCE_NOT_FOUND"));
    }

    @Test
    @DisplayName("POST /inventory/restock - Pharmacist restocks a product")
    void restock_Pharmacist_Returns200() throws Exception {
        UUID productId = UUID.randomUUID();
        when(inventoryService.restock(eq(tenantContext(Role.PHARMACIST)), any(RestockRequest.class)))
                .thenReturn(inventoryResponse(productId, 25));

        mockMvc.perform(post("/api/v1/inventory/restock")
                        .with(asUser(Role.PHARMACIST))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"productId\":\"" + productId + "\",\"quantity\":20}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Inventory restocked successfully"))
                .andExpect(jsonPath("$.data.quantityOnHand").value(25));
    }

    @Test
    @DisplayName("POST /inventory/restock - Zero quantity fails validation")
    void restock_ZeroQuantity_Returns400() throws Exception {
        mockMvc.perform(post("/api/v1/inventory/restock")
                        .with(asUser(Role.MANAGER))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"productId\":\"" + UUID.randomUUID() + "\",\"quantity\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.quantity").value("Quantity must be at least 1"));

        verifyNoInteractions(inventoryService);
    }

    @Test
    @DisplayName("POST /inventory/restock - Cashiers are forbidden")
    void restock_Cashier_Returns403() throws Exception {
        mockMvc.perform(post("/api/v1/inventory/restock")
                        .with(asUser(Role.CASHIER))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"productId\":\"" + UUID.randomUUID() + "\",\"quantity\":5}"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(inventoryService);
    }
}
