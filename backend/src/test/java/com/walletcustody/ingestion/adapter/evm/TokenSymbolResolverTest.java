package com.walletcustody.ingestion.adapter.evm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class TokenSymbolResolverTest {

    private static final String OFFSET_WORD = "0000000000000000000000000000000000000000000000000000000000000020";

    @Test
    void dynamicString_decoded() {
        String hex = "0x" + OFFSET_WORD
                + "0000000000000000000000000000000000000000000000000000000000000004"
                + "5553445400000000000000000000000000000000000000000000000000000000";

        assertThat(TokenSymbolResolver.decodeSymbolResult(hex)).isEqualTo("USDT");
    }

    @Test
    @DisplayName("dynamic strings longer than one word are read in full")
    void longDynamicString_decoded() {
        String symbol = "A".repeat(40);
        String data = "41".repeat(40) + "00".repeat(24);
        String hex = "0x" + OFFSET_WORD
                + "0000000000000000000000000000000000000000000000000000000000000028"
                + data;

        assertThat(TokenSymbolResolver.decodeSymbolResult(hex)).isEqualTo(symbol);
    }

    @Test
    void bytes32_stopsAtFirstZeroByte() {
        assertThat(TokenSymbolResolver.decodeSymbolResult(
                "0x4441490000000000000000000000000000000000000000000000000000000000")).isEqualTo("DAI");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "0x",
            "0x1234",
            "0xzz00000000000000000000000000000000000000000000000000000000000000",
            // declared length runs past the payload
            "0x0000000000000000000000000000000000000000000000000000000000000020"
                    + "00000000000000000000000000000000000000000000000000000000000000ff"
                    + "5553445400000000000000000000000000000000000000000000000000000000"
    })
    void malformedResults_decodeToEmpty(String hex) {
        assertThat(TokenSymbolResolver.decodeSymbolResult(hex)).isEmpty();
    }
}
