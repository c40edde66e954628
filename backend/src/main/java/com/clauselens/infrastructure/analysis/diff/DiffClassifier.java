package com.clauselens.infrastructure.analysis.diff;

import com.clauselens.domain.comparison.model.ClauseComparisonStatus;
import com.clauselens.infrastructure.analysis.preprocessing.TextNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Classifies a matched clause pair by how much of its text changed.
 * A change ratio of 0.20 or more is significant; the boundary belongs to the significant side.
 */
@Component
@RequiredArgsConstructor
public class DiffClassifier {

    public static final double SIGNIFICANT_CHANGE_RATIO = 0.20;

    private final TextNormalizer textNormalizer;
    private final WordDiff wordDiff;

    public DiffClassification classify(String sourceText, String targetText) {
        String source = nullToEmpty(textNormalizer.normalize(sourceText));
        String target = nullToEmpty(textNormalizer.normalize(targetText));

        if (source.equals(target)) {
            return new DiffClassification(ClauseComparisonStatus.IDENTICAL, 0.0, source, target);
        }

        double ratio = WordDiff.changeRatio(wordDiff.diff(source, target));
        return new DiffClassification(statusFor(ratio), ratio, source, target);
    }

    public static ClauseComparisonStatus statusFor(double changeRatio) {
        return changeRatio >= SIGNIFICANT_CHANGE_RATIO
                ? ClauseComparisonStatus.SIGNIFICANT_CHANGE
                : ClauseComparisonStatus.MINOR_CHANGE;
    }

    private static String nullToEmpty(String text) {
        return text == null ? "" : text;
    }
}
