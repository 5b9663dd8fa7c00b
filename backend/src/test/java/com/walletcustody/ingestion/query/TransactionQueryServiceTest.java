package com.walletcustody.ingestion.query;

import com.walletcustody.common.TransactionNotFoundException;
import com.walletcustody.domain.Confirmations;
import com.walletcustody.domain.Transaction;
import com.walletcustody.ingestion.adapter.LedgerClient;
import com.walletcustody.ingestion.store.TransactionStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TransactionQueryServiceTest {

    private static final String HASH = "0x" + "d".repeat(64);

    @Mock
    private TransactionStore transactionStore;
    @Mock
    private LedgerClient ledgerClient;

    @InjectMocks
    private TransactionQueryService service;

    @Test
    void getStatus_addsLiveConfirmations() {
        Transaction stored = new Transaction();
        stored.setHash(HASH);
        when(transactionStore.getByHash(HASH)).thenReturn(Optional.of(stored));
        when(ledgerClient.getConfirmations(HASH)).thenReturn(Confirmations.of(1));

        TransactionStatusView view = service.getStatus(HASH.toUpperCase().replace("0X", "0x"));

        assertThat(view.transaction()).isSameAs(stored);
        assertThat(view.confirmations()).isEqualTo(1L);
        assertThat(view.confirmed()).isTrue();
    }

    @Test
    void getStatus_unmined_notConfirmed() {
        when(transactionStore.getByHash(HASH)).thenReturn(Optional.of(new Transaction()));
        when(ledgerClient.getConfirmations(HASH)).thenReturn(Confirmations.of(0));

        assertThat(service.getStatus(HASH).confirmed()).isFalse();
    }

    @Test
    void getStatus_notStored_throwsNotFound() {
        when(transactionStore.getByHash(HASH)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getStatus(HASH)).isInstanceOf(TransactionNotFoundException.class);
        verifyNoInteractions(ledgerClient);
    }

    @Test
    void list_delegatesPaging() {
        when(transactionStore.list(50, 100)).thenReturn(List.of());

        assertThat(service.list(50, 100)).isEmpty();
    }
}
