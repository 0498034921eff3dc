package com.updownbacktest.backtester.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves markets through the Gamma markets API.
 */
@Component
@Slf4j
public class GammaMarketMetadataResolver implements MarketMetadataResolver {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public GammaMarketMetadataResolver(@Qualifier("gammaRestTemplate") RestTemplate restTemplate,
                                       ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<MarketMetadata> resolveMarketBySlug(String slug) {
        GammaMarket market;
        try {
            market = restTemplate.getForObject("/markets/slug/{slug}", GammaMarket.class, slug);
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("Market slug {} not found", slug);
            return Optional.empty();
        }
        if (market == null) {
            return Optional.empty();
        }

        List<String> tokenIds = stringList(market.getClobTokenIds());
        if (tokenIds.size() < 2) {
            log.warn("Market {} has no token pair, ignoring", slug);
            return Optional.empty();
        }

        int upIndex = 0;
        int downIndex = 1;
        List<String> outcomes = stringList(market.getOutcomes());
        for (int i = 0; i < outcomes.size() && i < tokenIds.size(); i++) {
            String outcome = outcomes.get(i).toLowerCase();
            if (outcome.equals("up") || outcome.equals("yes")) {
                upIndex = i;
            } else if (outcome.equals("down") || outcome.equals("no")) {
                downIndex = i;
            }
        }

        Long eventStart = parseInstant(market.getEventStartTime());
        return Optional.of(MarketMetadata.builder()
                .marketId(market.getId() != null ? market.getId() : market.getSlug())
                .conditionId(market.getConditionId())
                .slug(market.getSlug())
                .eventStart(eventStart)
                .eventEnd(parseInstant(market.getEndDate()))
                .yesTokenId(tokenIds.get(upIndex))
                .noTokenId(tokenIds.get(downIndex))
                .build());
    }

    /**
     * Gamma returns arrays either as JSON arrays or as JSON-encoded strings.
     */
    private List<String> stringList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || node.isNull()) {
            return values;
        }
        JsonNode array = node;
        if (node.isTextual()) {
            try {
                array = objectMapper.readTree(node.asText());
            } catch (JsonProcessingException e) {
                log.warn("Unparseable array value {}: {}", node.asText(), e.getOriginalMessage());
                return values;
            }
        }
        if (array.isArray()) {
            array.forEach(element -> {
                if (element.isTextual()) {
                    values.add(element.asText());
                }
            });
        }
        return values;
    }

    private Long parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value).toEpochMilli();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable timestamp {}", value);
            return null;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GammaMarket {
        private String id;
        private String slug;
        private String conditionId;
        private JsonNode clobTokenIds;
        private JsonNode outcomes;
        private String eventStartTime;
        private String endDate;
    }
}
