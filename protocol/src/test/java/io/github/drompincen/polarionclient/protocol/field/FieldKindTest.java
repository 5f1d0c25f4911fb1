package io.github.drompincen.polarionclient.protocol.field;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FieldKindTest {

    @Test
    void wireNamesResolve() {
        assertThat(FieldKind.fromWireName("text/html")).isEqualTo(FieldKind.TEXT_HTML);
        assertThat(FieldKind.fromWireName("date-time")).isEqualTo(FieldKind.DATE_TIME);
    }

    @Test
    void currencyIsNumeric() {
        assertThat(FieldKind.CURRENCY.isNumeric()).isTrue();
        assertThat(FieldKind.ENUMERATION.isNumeric()).isFalse();
    }
}
