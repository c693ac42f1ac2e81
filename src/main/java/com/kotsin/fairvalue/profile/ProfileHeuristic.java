package com.kotsin.fairvalue.profile;

import com.kotsin.fairvalue.profile.model.ProfileType;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.function.Predicate;

/**
 * One (predicate, profile) rule of the data-driven profile fallback.
 * Rules are evaluated in list order and the first match wins.
 */
@Getter
@RequiredArgsConstructor
public class ProfileHeuristic {

    private final String name;
    private final Predicate<Context> condition;
    private final ProfileType profile;

    public boolean matches(Context context) {
        return context != null && condition.test(context);
    }

    /**
     * Default rule chain:
     * <ol>
     *   <li>52w range / price &gt; 1.5 is a retail-driven name</li>
     *   <li>price under $20 with range / price &gt; 1.0 is a low-float squeeze candidate</li>
     *   <li>price over $100, range / price &lt; 0.5 and more than 100k OI is a blue chip</li>
     * </ol>
     */
    public static List<ProfileHeuristic> defaults() {
        return List.of(
                new ProfileHeuristic("high-range-retail",
                        c -> c.getRangeRatio() > 1.5,
                        ProfileType.MEME_RETAIL),
                new ProfileHeuristic("cheap-volatile-low-float",
                        c -> c.getPrice() < 20 && c.getRangeRatio() > 1.0,
                        ProfileType.LOW_FLOAT),
                new ProfileHeuristic("expensive-stable-liquid",
                        c -> c.getPrice() > 100 && c.getRangeRatio() < 0.5 && c.getTotalOpenInterest() > 100_000,
                        ProfileType.BLUE_CHIP)
        );
    }

    /**
     * Inputs the rules look at. rangeRatio is NaN when the 52-week range is unknown,
     * which makes every comparison on it false.
     */
    @Getter
    @RequiredArgsConstructor
    public static class Context {
        private final double price;
        private final double rangeRatio;
        private final long totalOpenInterest;
    }
}
