package com.umihealth.pos_backend.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * On-hand quantity of one product at one branch.
 * <p>
 * {@code quantityOnHand} never goes below zero; concurrent writers are serialized
 * by the {@code version} column at commit time.
 */
@Entity
@Table(name = "inventories", uniqueConstraints = {
        @UniqueConstraint(name = "uk_inventory_branch_product", columnNames = {"tenant_id", "branch_id", "product_id"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InventoryRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "branch_id", nullable = false, updatable = false)
    private UUID branchId;

    @Column(name = "product_id", nullable = false, updatable = false)
    private UUID productId;

    @Column(name = "quantity_on_hand", nullable = false)
    @Builder.Default
    private int quantityOnHand = 0;

    @Column(name = "reorder_level", nullable = false)
    @Builder.Default
    private int reorderLevel = 0;

    @Version
    private Long version;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public boolean canFulfil(int quantity) {
        return quantityOnHand >= quantity;
    }

    public void deduct(int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity to deduct must be positive");
        }
        if (!canFulfil(quantity)) {
            throw new IllegalStateException("Deduction of " + quantity + " exceeds on-hand quantity " + quantityOnHand);
        }
        this.quantityOnHand -= quantity;
        this.updatedAt = LocalDateTime.now();
    }

    public void restock(int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity to restock must be positive");
        }
        this.quantityOnHand += quantity;
        this.updatedAt = LocalDateTime.now();
    }

    public boolean isLowStock() {
        return quantityOnHand <= reorderLevel;
    }
}
