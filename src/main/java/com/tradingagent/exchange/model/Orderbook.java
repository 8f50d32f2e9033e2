package com.tradingagent.exchange.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Resting bids on each side of a binary market. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Orderbook {

    private String ticker;

    @Builder.Default
    private List<PriceLevel> yes = new ArrayList<>();

    @Builder.Default
    private List<PriceLevel> no = new ArrayList<>();

    public Optional<Integer> bestYesBid() {
        return best(yes);
    }

    public Optional<Integer> bestNoBid() {
        return best(no);
    }

    private static Optional<Integer> best(List<PriceLevel> levels) {
        return levels.stream().map(PriceLevel::getPriceCents).max(Comparator.naturalOrder());
    }
}
