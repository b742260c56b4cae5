package com.umihealth.pos_backend.enums;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Sale and payment status Tests")
class SaleStatusTest {

    @Test
    @DisplayName("fromString - Any casing resolves")
    void fromString_IgnoresCase() {
        assertThat(SaleStatus.fromString("completed")).isEqualTo(SaleStatus.COMPLETED);
        assertThat(SaleStatus.fromString(" Returned ")).isEqualTo(SaleStatus.RETURNED);
        assertThat(PaymentStatus.fromString("PARTIAL")).isEqualTo(PaymentStatus.PARTIAL);
    }

    @Test
    @DisplayName("fromString - Unknown status is rejected")
    void fromString_Unknown() {
        assertThatThrownBy(() -> SaleStatus.fromString("shipped"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown sale status: shipped");
        assertThatThrownBy(() -> PaymentStatus.fromString("settled"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown payment status: settled");
        assertThat(SaleStatus.fromString(null)).isNull();
    }

    @Test
    @DisplayName("getValue - Statuses are written in lowercase")
    void getValue_Lowercase() {
        assertThat(SaleStatus.CANCELLED.getValue()).isEqualTo("cancelled");
        assertThat(PaymentStatus.REFUNDED.getValue()).isEqualTo("refunded");
    }
}
