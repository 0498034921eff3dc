package com.updownbacktest.backtester.service;

import com.updownbacktest.backtester.client.MarketMetadata;
import com.updownbacktest.backtester.client.MarketMetadataResolver;
import com.updownbacktest.backtester.config.BacktestProperties;
import com.updownbacktest.backtester.domain.MarketWindow;
import com.updownbacktest.backtester.domain.Timeframe;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.ResourceAccessException;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for MarketVerificationService sessions and fallback.
 */
@ExtendWith(MockitoExtension.class)
class MarketVerificationServiceTest {

    private static final String SLUG = "btc-updown-15m-1700000100";

    @Mock
    private MarketMetadataResolver resolver;

    private BacktestProperties properties;
    private MarketVerificationService service;
    private final MarketWindow market = MarketWindow.builder()
            .marketId("512")
            .eventStartMs(1_700_000_100_000L)
            .eventEndMs(1_700_001_000_000L)
            .tickCount(100)
            .build();

    @BeforeEach
    void setUp() {
        properties = new BacktestProperties();
        properties.getVerification().setDelayMs(0);
        service = new MarketVerificationService(resolver, properties);
    }

    @Test
    void testVerify_MatchingMarketIsAcceptedAndMemoized() {
        // Arrange
        when(resolver.resolveMarketBySlug(SLUG))
                .thenReturn(Optional.of(MarketMetadata.builder().marketId("512").build()));
        MarketVerificationService.VerificationSession session = service.openSession("BTC", Timeframe.FIFTEEN_MINUTES);

        // Act
        boolean first = session.test(market);
        boolean second = session.test(market);

        // Assert
        assertTrue(first);
        assertTrue(second);
        verify(resolver, times(1)).resolveMarketBySlug(SLUG);
    }

    @Test
    void testVerify_DifferentMarketIsRejected() {
        // Arrange
        when(resolver.resolveMarketBySlug(SLUG))
                .thenReturn(Optional.of(MarketMetadata.builder().marketId("999").build()));

        // Act & Assert
        assertFalse(service.openSession("BTC", Timeframe.FIFTEEN_MINUTES).test(market));
    }

    @Test
    void testVerify_UnknownSlugIsRejected() {
        // Arrange
        when(resolver.resolveMarketBySlug(SLUG)).thenReturn(Optional.empty());

        // Act & Assert
        assertFalse(service.openSession("BTC", Timeframe.FIFTEEN_MINUTES).test(market));
    }

    @Test
    void testVerify_NoSlugFormatAcceptsWithoutCall() {
        // Act
        boolean accepted = service.openSession("DOGE", Timeframe.FIFTEEN_MINUTES).test(market);

        // Assert
        assertTrue(accepted);
        verifyNoInteractions(resolver);
    }

    @Test
    void testVerify_RepeatedFailuresFallBackToDurationMatching() {
        // Arrange
        when(resolver.resolveMarketBySlug(anyString())).thenThrow(new ResourceAccessException("timeout"));
        MarketVerificationService.VerificationSession session = service.openSession("BTC", Timeframe.FIFTEEN_MINUTES);

        // Act
        boolean first = session.test(window("a"));
        boolean second = session.test(window("b"));
        boolean third = session.test(window("c"));
        boolean afterFallback = session.test(window("d"));

        // Assert
        assertFalse(first);
        assertFalse(second);
        assertTrue(third, "Third consecutive failure switches to fallback");
        assertTrue(afterFallback);
        assertTrue(session.isFallback());
        verify(resolver, times(3)).resolveMarketBySlug(anyString());
    }

    @Test
    void testVerify_DisabledAcceptsEverything() {
        // Arrange
        properties.getVerification().setEnabled(false);

        // Act & Assert
        assertTrue(service.openSession("BTC", Timeframe.FIFTEEN_MINUTES).test(market));
        verifyNoInteractions(resolver);
    }

    private MarketWindow window(String id) {
        return MarketWindow.builder()
                .marketId(id)
                .eventStartMs(1_700_000_100_000L)
                .eventEndMs(1_700_001_000_000L)
                .build();
    }
}
