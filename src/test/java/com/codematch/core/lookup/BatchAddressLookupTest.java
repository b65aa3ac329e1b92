package com.codematch.core.lookup;

import com.codematch.core.error.VerificationTransportException;
import com.codematch.core.metrics.CodematchMetrics;
import com.codematch.core.model.AddressStatus;
import com.codematch.core.model.CandidateStatus;
import com.codematch.core.model.Match;
import com.codematch.matching.VerificationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class BatchAddressLookupTest {

    private static final String A = "0x" + "a".repeat(40);
    private static final String B = "0x" + "b".repeat(40);

    private VerificationService verificationService;
    private CodematchMetrics metrics;
    private BatchAddressLookup lookup;

    @BeforeEach
    void setUp() {
        verificationService = mock(VerificationService.class);
        metrics = mock(CodematchMetrics.class);
        lookup = new BatchAddressLookup(verificationService, metrics);
        when(verificationService.findConfirmedMatches(anyString(), anyString())).thenReturn(List.of());
    }

    private static Match match(CandidateStatus status, String address, String chainId) {
        return new Match(status, address, chainId, null, null);
    }

    @Test
    @DisplayName("perfect on any chain wins over partial")
    void perfectWins() {
        when(verificationService.findConfirmedMatches(A, "1")).thenReturn(List.of(match(CandidateStatus.PERFECT, A, "1")));
        when(verificationService.findConfirmedMatches(A, "5")).thenReturn(List.of(match(CandidateStatus.PARTIAL, A, "5")));

        AddressStatus status = lookup.lookup(List.of(A), List.of("1", "5")).get(A);

        assertEquals(CandidateStatus.PERFECT, status.status());
        assertEquals(List.of("1", "5"), status.matchingChainIds());
        assertEquals(CandidateStatus.PARTIAL, status.chains().get(1).status());
    }

    @Test
    @DisplayName("address with no match on any chain is reported false")
    void notFound() {
        AddressStatus status = lookup.lookup(List.of(B), List.of("1")).get(B);

        assertEquals(CandidateStatus.FALSE, status.status());
        assertTrue(status.chains().isEmpty());
    }

    @Test
    @DisplayName("one entry per distinct address in request order")
    void distinctInOrder() {
        Map<String, AddressStatus> result = lookup.lookup(List.of(B, A, B), List.of("1"));

        assertEquals(List.of(B, A), List.copyOf(result.keySet()));
        verify(verificationService, times(1)).findConfirmedMatches(B, "1");
    }

    @Test
    @DisplayName("a failing pair is skipped and counted")
    void failingPairSkipped() {
        when(verificationService.findConfirmedMatches(A, "1")).thenThrow(new VerificationTransportException("timeout"));
        when(verificationService.findConfirmedMatches(A, "5")).thenReturn(List.of(match(CandidateStatus.PARTIAL, A, "5")));

        AddressStatus status = lookup.lookup(List.of(A), List.of("1", "5")).get(A);

        assertEquals(CandidateStatus.PARTIAL, status.status());
        assertEquals(List.of("5"), status.matchingChainIds());
        verify(metrics).recordLookupFailure();
    }
}
