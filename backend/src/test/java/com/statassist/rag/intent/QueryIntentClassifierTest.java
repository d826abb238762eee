package com.statassist.rag.intent;

import com.statassist.rag.model.QueryIntent;
import com.statassist.rag.model.QueryType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class QueryIntentClassifierTest {

    private final QueryIntentClassifier classifier = new QueryIntentClassifier();

    @Test
    void classifiesCorrelationQuestionAndExtractsVariables() {
        QueryIntent intent = classifier.classify("What is the correlation between age and cholesterol?");

        assertThat(intent.getType()).isEqualTo(QueryType.CORRELATION);
        assertThat(intent.getConfidence()).isCloseTo(2.0 / 3.0, within(1e-9));
        assertThat(intent.getVariables()).containsExactlyInAnyOrder("age", "cholesterol");
        assertThat(intent.getOperations()).contains("correlation");
        assertThat(intent.getStatisticalTests()).contains("correlation");
        assertThat(intent.getVisualizationType()).isEqualTo("scatter");
    }

    @Test
    void correlationStemMatchesInflectedForms() {
        Map<QueryType, Integer> scores = classifier.scoreCategories("are these columns correlated");

        assertThat(scores).containsEntry(QueryType.CORRELATION, 1);
    }

    @Test
    @DisplayName("blank and null queries fall back to descriptive at 0.5")
    void blankQueryFallsBack() {
        for (String query : new String[]{null, "", "   "}) {
            QueryIntent intent = classifier.classify(query);
            assertThat(intent.getType()).isEqualTo(QueryType.DESCRIPTIVE);
            assertThat(intent.getConfidence()).isEqualTo(QueryIntentClassifier.FALLBACK_CONFIDENCE);
            assertThat(intent.getVariables()).isEmpty();
            assertThat(intent.getFilters()).isEmpty();
            assertThat(intent.visualization()).isEmpty();
        }
    }

    @Test
    void unmatchedQueryIsDescriptiveAtFallbackConfidence() {
        QueryIntent intent = classifier.classify("zzz qqq");

        assertThat(intent.getType()).isEqualTo(QueryType.DESCRIPTIVE);
        assertThat(intent.getConfidence()).isEqualTo(0.5);
    }

    @Test
    void tiesGoToTheEarlierCategory() {
        // one descriptive hit (mean) and one visualization hit (plot)
        QueryIntent intent = classifier.classify("plot the mean");

        assertThat(intent.getType()).isEqualTo(QueryType.DESCRIPTIVE);
        assertThat(intent.getConfidence()).isEqualTo(0.5);
    }

    @Test
    void confidenceIsShareOfTotalMatches() {
        QueryIntent intent = classifier.classify("Describe the dataset");

        assertThat(intent.getType()).isEqualTo(QueryType.DESCRIPTIVE);
        assertThat(intent.getConfidence()).isEqualTo(1.0);
    }

    @Test
    void extractsAgeAndGenderFilters() {
        QueryIntent intent = classifier.classify("Compare cholesterol for age > 40 among women");

        assertThat(intent.getFilters()).containsOnlyKeys("age", "gender");
        assertThat(intent.getFilters().get("age").asNumber().longValue()).isEqualTo(40L);
        assertThat(intent.getFilters().get("gender").asText()).isEqualTo("women");
    }

    @Test
    void extractsGroupFilterValue() {
        QueryIntent intent = classifier.classify("Show glucose where group = 'treatment_a'");

        assertThat(intent.getFilters().get("group").asText()).isEqualTo("treatment_a");
    }

    @Test
    void collectsOperationsTestsAndChartType() {
        QueryIntent intent = classifier.classify("Show a histogram of the average bmi with a t-test");

        assertThat(intent.getOperations()).contains("mean");
        assertThat(intent.getStatisticalTests()).contains("ttest");
        assertThat(intent.getVisualizationType()).isEqualTo("histogram");
        assertThat(intent.getVariables()).contains("bmi");
    }

    @Test
    void matchingIsCaseInsensitive() {
        QueryIntent upper = classifier.classify("WHAT IS THE CORRELATION BETWEEN AGE AND CHOLESTEROL?");
        QueryIntent lower = classifier.classify("what is the correlation between age and cholesterol?");

        assertThat(upper.getType()).isEqualTo(lower.getType());
        assertThat(upper.getVariables()).isEqualTo(lower.getVariables());
    }

    @Test
    void classificationIsRepeatableAndBounded() {
        String[] queries = {
                "Compare the treatment group versus control over time",
                "predict the outcome with a regression model",
                "plot a scatter of income and education",
                "is the difference in bmi significant (p-value)?"
        };
        for (String query : queries) {
            QueryIntent first = classifier.classify(query);
            QueryIntent second = classifier.classify(query);
            assertThat(second).isEqualTo(first);
            assertThat(first.getConfidence()).isBetween(0.0, 1.0);
        }
    }
}
