package com.phillippitts.affectsignal.service.aggregate;

import com.phillippitts.affectsignal.domain.EmotionCategory;
import com.phillippitts.affectsignal.domain.EmotionScore;
import com.phillippitts.affectsignal.domain.QuestionExpression;
import com.phillippitts.affectsignal.domain.RoundRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes per-round and session-wide statistics from stored expressions.
 *
 * <p>A category average divides the category's score sum by the number of expressions, so a
 * category missing from some vectors counts as 0 there. The session-wide report is computed
 * over the flattened expressions, which weights each round by its question count.
 *
 * <p>Stateless and thread-safe.
 */
@Component
public class EmotionAggregator {

    private final ExpressionAssessor assessor;

    public EmotionAggregator(ExpressionAssessor assessor) {
        this.assessor = Objects.requireNonNull(assessor, "assessor");
    }

    public RoundReport perRound(RoundRecord round) {
        Objects.requireNonNull(round, "round");
        return summarize(round.roundId(), round.expressions());
    }

    public RoundReport overall(List<RoundRecord> rounds) {
        Objects.requireNonNull(rounds, "rounds");
        List<QuestionExpression> flattened = new ArrayList<>();
        for (RoundRecord round : rounds) {
            flattened.addAll(round.expressions());
        }
        return summarize(RoundReport.OVERALL, flattened);
    }

    /**
     * Builds the full session report: per-round reports, the overall report and assessments.
     */
    public SessionReport report(List<RoundRecord> rounds) {
        Objects.requireNonNull(rounds, "rounds");
        List<RoundReport> perRound = new ArrayList<>(rounds.size());
        List<ExpressionAssessment> assessments = new ArrayList<>();
        int confident = 0;
        int nervous = 0;
        int struggling = 0;
        for (RoundRecord round : rounds) {
            perRound.add(perRound(round));
            for (QuestionExpression e : round.expressions()) {
                ExpressionAssessment a = assessor.assess(e);
                assessments.add(a);
                confident += a.confident() ? 1 : 0;
                nervous += a.nervous() ? 1 : 0;
                struggling += a.struggling() ? 1 : 0;
            }
        }
        return new SessionReport(perRound, overall(rounds), assessments, confident, nervous, struggling);
    }

    private RoundReport summarize(String roundId, List<QuestionExpression> expressions) {
        Map<String, Double> sums = new LinkedHashMap<>();
        for (String category : EmotionCategory.CANONICAL) {
            sums.put(category, 0.0);
        }
        int real = 0;
        for (QuestionExpression e : expressions) {
            if (e.isReal()) {
                real++;
            }
            for (EmotionScore s : e.vector().scores()) {
                sums.merge(s.label(), s.score(), Double::sum);
            }
        }

        int count = expressions.size();
        Map<String, Double> averages = new LinkedHashMap<>();
        String dominant = null;
        double best = Double.NEGATIVE_INFINITY;
        for (Map.Entry<String, Double> entry : sums.entrySet()) {
            double avg = count == 0 ? 0.0 : entry.getValue() / count;
            averages.put(entry.getKey(), avg);
            if (count > 0 && avg > best) {
                best = avg;
                dominant = entry.getKey();
            }
        }
        PerformanceTier tier = PerformanceTier.fromConfidence(averages.get(EmotionCategory.CONFIDENCE));
        return new RoundReport(roundId, averages, dominant, tier, count, real, count - real);
    }
}
