package com.valuationradar.valuation;

import com.valuationradar.domain.StandardCondition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Maps free-text condition descriptions onto {@link StandardCondition} by keyword.
 * Rules are checked in order, so specific phrases ("near mint", "heavily played") win over the generic
 * words they contain. Graded, sealed and factory items count as Mint. Unmatched text is Good.
 */
@Slf4j
@Component
public class ConditionClassifier {

    private static final List<Rule> RULES = List.of(
            new Rule(StandardCondition.MINT, Pattern.compile("^(?!.*near[ -]?mint).*mint")),
            new Rule(StandardCondition.MINT, Pattern.compile("\\b(gem|pristine|sealed|factory|graded)\\b")),
            new Rule(StandardCondition.NEAR_MINT, Pattern.compile("near[ -]?mint|\\bnm\\b|like new|excellent\\+")),
            new Rule(StandardCondition.MINT, Pattern.compile("\\bnew\\b")),
            new Rule(StandardCondition.EXCELLENT, Pattern.compile("excellent|very good|lightly played|\\blp\\b")),
            new Rule(StandardCondition.POOR, Pattern.compile("heavily played|\\bhp\\b|poor|damaged|acceptable")),
            new Rule(StandardCondition.GOOD, Pattern.compile("good|moderately played|\\bmp\\b|played"))
    );

    public StandardCondition classify(String conditionText) {
        if (conditionText == null || conditionText.isBlank()) {
            return StandardCondition.GOOD;
        }
        String text = conditionText.toLowerCase(Locale.ROOT).strip();
        for (Rule rule : RULES) {
            if (rule.pattern().matcher(text).find()) {
                return rule.condition();
            }
        }
        log.warn("Unknown condition \"{}\", defaulting to {}", conditionText, StandardCondition.GOOD.getLabel());
        return StandardCondition.GOOD;
    }

    private record Rule(StandardCondition condition, Pattern pattern) {}
}
