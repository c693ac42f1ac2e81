package com.kotsin.fairvalue.profile;

import com.kotsin.fairvalue.config.FairValueConfig;
import com.kotsin.fairvalue.profile.model.ProfileType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Classification backed by the ticker lists under pfv.classification.
 *
 * Lookup order is ETF, then meme/retail, then blue chip; a symbol listed twice
 * resolves to the first list that contains it.
 */
@Slf4j
@Component
public class ConfiguredTickerClassificationProvider implements TickerClassificationProvider {

    private final Map<ProfileType, Set<String>> lists = new LinkedHashMap<>();

    public ConfiguredTickerClassificationProvider(FairValueConfig config) {
        FairValueConfig.Classification classification = config.getClassification();
        lists.put(ProfileType.ETF, normalize(classification.getEtf()));
        lists.put(ProfileType.MEME_RETAIL, normalize(classification.getMemeRetail()));
        lists.put(ProfileType.BLUE_CHIP, normalize(classification.getBlueChip()));

        log.info("[PROFILE] Loaded ticker lists: etf={}, memeRetail={}, blueChip={}",
                lists.get(ProfileType.ETF).size(),
                lists.get(ProfileType.MEME_RETAIL).size(),
                lists.get(ProfileType.BLUE_CHIP).size());
    }

    @Override
    public Optional<ProfileType> classify(String ticker) {
        if (ticker == null || ticker.isBlank()) {
            return Optional.empty();
        }
        String symbol = ticker.trim().toUpperCase(Locale.ROOT);
        return lists.entrySet().stream()
                .filter(e -> e.getValue().contains(symbol))
                .map(Map.Entry::getKey)
                .findFirst();
    }

    private static Set<String> normalize(Collection<String> tickers) {
        if (tickers == null) {
            return Set.of();
        }
        return tickers.stream()
                .filter(t -> t != null && !t.isBlank())
                .map(t -> t.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
