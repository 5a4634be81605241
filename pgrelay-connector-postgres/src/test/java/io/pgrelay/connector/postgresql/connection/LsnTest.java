/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.connector.postgresql.connection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.Test;

public class LsnTest {

    @Test
    public void shouldFormatAsHighAndLowHexWithoutPadding() {
        assertThat(Lsn.valueOf(0x00000000FFFFFFFFL).asString()).isEqualTo("0/FFFFFFFF");
        assertThat(Lsn.valueOf(0xFFFFFFFFFFFFFFFFL).asString()).isEqualTo("FFFFFFFF/FFFFFFFF");
        assertThat(Lsn.valueOf(0x1234567L).asString()).isEqualTo("0/1234567");
        assertThat(Lsn.valueOf(0x16_03002D50L).asString()).isEqualTo("16/3002D50");
        assertThat(Lsn.valueOf(0L).asString()).isEqualTo("0/0");
    }

    @Test
    public void shouldParseTextualForm() {
        assertThat(Lsn.valueOf("16/3002D50").asLong()).isEqualTo(0x16_03002D50L);
        assertThat(Lsn.valueOf("FFFFFFFF/FFFFFFFF").asLong()).isEqualTo(-1L);
        assertThat(Lsn.valueOf("0/15d68c50").asString()).isEqualTo("0/15D68C50");
    }

    @Test
    public void shouldRejectInvalidTextualForm() {
        for (String invalid : new String[]{ "", "123", "/1", "1/", "G/1", "1/2/3", "100000000/0" }) {
            assertThatThrownBy(() -> Lsn.valueOf(invalid)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    public void shouldCompareAsUnsignedPositions() {
        assertThat(Lsn.valueOf("FFFFFFFF/0")).isGreaterThan(Lsn.valueOf("1/0"));
        assertThat(Lsn.valueOf("0/10")).isLessThan(Lsn.valueOf("0/11"));
        assertThat(Lsn.valueOf("0/0").isValid()).isFalse();
        assertThat(Lsn.valueOf("0/1").isValid()).isTrue();
    }
}
