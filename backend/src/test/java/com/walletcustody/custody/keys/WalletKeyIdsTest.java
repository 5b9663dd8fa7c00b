package com.walletcustody.custody.keys;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WalletKeyIdsTest {

    @Test
    void keyId_isPrefixPlusChecksummedAddress() {
        assertThat(WalletKeyIds.keyId("wallet_", "0x5aaeb6053f3e94c9b9a09f33669435e7ef1beaed"))
                .isEqualTo("wallet_0x5aAeb6053F3E94C9b9A09f33669435E7Ef1BeAed");
        assertThat(WalletKeyIds.keyId("wallet_", "0x5AAEB6053F3E94C9B9A09F33669435E7EF1BEAED"))
                .isEqualTo("wallet_0x5aAeb6053F3E94C9b9A09f33669435E7Ef1BeAed");
    }
}
