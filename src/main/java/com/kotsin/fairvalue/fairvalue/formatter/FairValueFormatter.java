package com.kotsin.fairvalue.fairvalue.formatter;

import com.kotsin.fairvalue.fairvalue.model.BiasSentiment;
import com.kotsin.fairvalue.fairvalue.model.ConfidenceLevel;
import com.kotsin.fairvalue.fairvalue.model.MagneticLevel;
import com.kotsin.fairvalue.fairvalue.model.PFVComponentBreakdown;
import com.kotsin.fairvalue.fairvalue.model.PsychologicalFairValue;
import com.kotsin.fairvalue.options.model.ExpirationAnalysis;
import com.kotsin.fairvalue.technical.model.PriceZone;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Text renderings of a fair value result: a context block for a language model,
 * a one-paragraph interpretation, a console table and a one-line summary.
 */
@Component
public class FairValueFormatter {

    private static final int TOP_LEVELS = 8;
    private static final int TOP_EXPIRATIONS = 3;
    private static final int OPEX_IMMINENT_DAYS = 7;
    private static final String RULE = "=".repeat(50);

    /**
     * Multi-line block for an AI context window.
     */
    public String aiContext(PsychologicalFairValue pfv) {
        List<String> lines = new ArrayList<>();
        lines.add("=== PSYCHOLOGICAL FAIR VALUE: " + pfv.getTicker() + " ===");
        lines.add("");
        lines.add("Current Price: " + money(pfv.getCurrentPrice()));
        lines.add("Fair Value: " + money(pfv.getFairValue()));
        lines.add("Deviation: " + signedPercent(pfv.getDeviationPercent()));
        lines.add("Bias: " + pfv.getBias());
        lines.add("Confidence: " + pfv.getConfidence());
        lines.add("");
        lines.add("COMPONENT BREAKDOWN:");
        for (PFVComponentBreakdown c : pfv.getComponents()) {
            lines.add(String.format(Locale.ROOT, "  %s: %s (%.0f%% weight)", c.getName(), money(c.getValue()), c.getWeight() * 100));
        }

        lines.add("");
        lines.add("KEY MAGNETIC LEVELS:");
        for (MagneticLevel level : top(pfv.getMagneticLevels(), TOP_LEVELS)) {
            lines.add(String.format(Locale.ROOT, "  %s - %s (%s)",
                    money(level.getPrice()), level.getType().getLabel(), signedPercent(level.getDistance())));
        }

        if (!pfv.getExpirationAnalysis().isEmpty()) {
            lines.add("");
            lines.add("OPTIONS EXPIRATIONS ANALYZED:");
            for (ExpirationAnalysis exp : top(pfv.getExpirationAnalysis(), TOP_EXPIRATIONS)) {
                lines.add(String.format(Locale.ROOT, "  %s (%d DTE)%s: Max Pain %s",
                        exp.getExpiration(), exp.getDte(), exp.isMonthlyOpex() ? " [MONTHLY OPEX]" : "",
                        money(exp.getMaxPain().getPrice())));
            }
        }

        lines.add("");
        lines.add("=== END PFV ===");
        return String.join("\n", lines);
    }

    /**
     * Plain-language reading of the deviation, bias and confidence.
     */
    public String interpretation(PsychologicalFairValue pfv) {
        double fairValue = pfv.getFairValue();
        // Position of price relative to fair value
        String direction = pfv.getCurrentPrice() < fairValue ? "below" : "above";
        double absDeviation = Math.abs(pfv.getDeviationPercent());

        StringBuilder sb = new StringBuilder();
        if (absDeviation < 1) {
            sb.append("Price is trading very close to psychological fair value. ")
              .append("The market appears efficiently priced at current levels.");
        } else if (absDeviation < 3) {
            sb.append(String.format(Locale.ROOT, "Price is trading %.1f%% %s fair value (%s). ",
                    absDeviation, direction, money(fairValue)));
            if (pfv.getBias() == BiasSentiment.BULLISH) {
                sb.append("Options mechanics and technical levels suggest gravitational pull upward.");
            } else if (pfv.getBias() == BiasSentiment.BEARISH) {
                sb.append("Options mechanics and technical levels suggest gravitational pull downward.");
            } else {
                sb.append("The bias is neutral with no strong directional pull.");
            }
        } else {
            sb.append(String.format(Locale.ROOT, "Price is trading significantly %s fair value (%.1f%% deviation). ",
                    direction, absDeviation));
            if ("below".equals(direction)) {
                sb.append("Mean reversion suggests potential upside toward ").append(money(fairValue)).append(".");
            } else {
                sb.append("Price may be extended; watch for pullback toward ").append(money(fairValue)).append(".");
            }
        }

        if (pfv.getConfidence() == ConfidenceLevel.LOW) {
            sb.append(" Note: Confidence is LOW due to limited data or divergent signals.");
        }

        if (pfv.getProfile() != null) {
            sb.append(" (Profile: ").append(pfv.getProfile().getName()).append(")");
        }

        ExpirationAnalysis primary = pfv.getPrimaryExpiration();
        if (primary != null && primary.isMonthlyOpex() && primary.getDte() <= OPEX_IMMINENT_DAYS) {
            sb.append(" Monthly OPEX in ").append(primary.getDte()).append(" days - max pain magnetism strongest.");
        }

        return sb.toString();
    }

    /**
     * Human-readable table for a terminal.
     */
    public String console(PsychologicalFairValue pfv) {
        List<String> lines = new ArrayList<>();
        lines.add(RULE);
        lines.add("PSYCHOLOGICAL FAIR VALUE: " + pfv.getTicker());
        lines.add(RULE);
        lines.add("");
        lines.add("Current Price:  " + money(pfv.getCurrentPrice()));
        lines.add("Fair Value:     " + money(pfv.getFairValue()));
        lines.add("Deviation:      " + signedPercent(pfv.getDeviationPercent()) + " (" + pfv.getBias() + ")");
        lines.add("Confidence:     " + pfv.getConfidence());
        if (pfv.getProfile() != null) {
            lines.add("Profile:        " + pfv.getProfile().getName());
        }
        lines.add("");
        lines.add("COMPONENT BREAKDOWN");
        lines.add("-".repeat(50));
        for (PFVComponentBreakdown c : pfv.getComponents()) {
            lines.add(String.format(Locale.ROOT, "%-20s $%9.2f %6s", c.getName(), c.getValue(),
                    String.format(Locale.ROOT, "(%.0f%%)", c.getWeight() * 100)));
        }
        lines.add("-".repeat(50));
        lines.add("");
        lines.add("MAGNETIC LEVELS:");
        for (MagneticLevel level : top(pfv.getMagneticLevels(), TOP_LEVELS)) {
            String side = level.getDistance() < 0 ? "v" : "^";
            lines.add(String.format(Locale.ROOT, "  %s $%8.2f - %-14s (%s)",
                    side, level.getPrice(), level.getType().getLabel(), signedPercent(level.getDistance())));
        }

        if (pfv.getSupportZone() != null) {
            lines.add("");
            lines.add("Support Zone: " + zone(pfv.getSupportZone()));
        }
        if (pfv.getResistanceZone() != null) {
            lines.add("Resistance Zone: " + zone(pfv.getResistanceZone()));
        }

        lines.add("");
        lines.add("INTERPRETATION:");
        lines.add(pfv.getInterpretation() != null ? pfv.getInterpretation() : interpretation(pfv));
        lines.add("");
        lines.add(RULE);
        return String.join("\n", lines);
    }

    /**
     * One-line summary, e.g. {@code fair=$190 bias=neutral conf=medium dev=+0.7%}.
     */
    public String compact(PsychologicalFairValue pfv) {
        return String.format(Locale.ROOT, "fair=$%.0f bias=%s conf=%s dev=%s",
                pfv.getFairValue(),
                pfv.getBias().name().toLowerCase(Locale.ROOT),
                pfv.getConfidence().name().toLowerCase(Locale.ROOT),
                signedPercent(pfv.getDeviationPercent()));
    }

    private static String money(double value) {
        return String.format(Locale.ROOT, "$%.2f", value);
    }

    private static String signedPercent(double value) {
        return String.format(Locale.ROOT, "%s%.1f%%", value > 0 ? "+" : "", value);
    }

    private static String zone(PriceZone zone) {
        return money(zone.getLow()) + " - " + money(zone.getHigh());
    }

    private static <T> List<T> top(List<T> items, int n) {
        return items.subList(0, Math.min(n, items.size()));
    }
}
