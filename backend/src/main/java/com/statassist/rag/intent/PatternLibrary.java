package com.statassist.rag.intent;

import com.statassist.rag.model.QueryType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Static regular-expression vocabularies used by {@link QueryIntentClassifier}.
 * <p>
 * All patterns are written in lower case and applied to lower-cased query text.
 * Iteration order of every table is significant:
 * <ul>
 *   <li>{@link #CATEGORY_PATTERNS}: tie-break priority, first category wins a tie</li>
 *   <li>{@link #VISUALIZATION_PATTERNS}: first matching family is the chart type</li>
 *   <li>the remaining tables: order in which tokens are reported</li>
 * </ul>
 */
public final class PatternLibrary {

    /**
     * Category → patterns, in tie-break priority order:
     * descriptive, inferential, correlation, visualization, comparison, predictive, temporal.
     */
    public static final Map<QueryType, List<Pattern>> CATEGORY_PATTERNS;

    public static final List<Pattern> VARIABLE_PATTERNS;

    public static final Map<String, Pattern> OPERATION_PATTERNS;

    public static final Map<String, Pattern> STATISTICAL_TEST_PATTERNS;

    public static final Map<String, Pattern> VISUALIZATION_PATTERNS;

    /** Numeric comparison directly after the literal "age", e.g. "age > 40". */
    public static final Pattern AGE_FILTER = compile("age\\s*[><=]\\s*(\\d+)");

    public static final Pattern GENDER_FILTER = compile("\\b(male|female|men|women)\\b");

    /** "group = value" / "group: 'value'"; captures to the end of the query. */
    public static final Pattern GROUP_FILTER = compile("group\\s*[=:]\\s*[\"']?([^\"']+)[\"']?");

    static {
        Map<QueryType, List<Pattern>> categories = new LinkedHashMap<>();

        categories.put(QueryType.DESCRIPTIVE, patterns(
                "\\b(describe|summary|overview|statistics|mean|average|median|mode|std|variance|distribution)\\b",
                "\\b(what is|what are|show me|tell me about|describe)\\b",
                "\\b(characteristics|profile|basic stats|descriptive)\\b"));

        categories.put(QueryType.INFERENTIAL, patterns(
                "\\b(test|hypothesis|significance|p-value|confidence|interval)\\b",
                "\\b(ttest|anova|chi-square|regression|correlation test)\\b",
                "\\b(difference|association|relationship|effect)\\b"));

        // "correlat" is a stem: it must be allowed to run on into correlation/correlated
        categories.put(QueryType.CORRELATION, patterns(
                "\\b(correlat\\w*|relationship|association|connect\\w*)\\b",
                "\\b(relate|link|depend|influence|affect)\\b",
                "\\b(between|among|with)\\b.*\\b(and|&)\\b"));

        categories.put(QueryType.VISUALIZATION, patterns(
                "\\b(plot|graph|chart|visualize|show|display)\\b",
                "\\b(histogram|scatter|bar|line|box|heatmap)\\b",
                "\\b(trend|pattern|distribution)\\b"));

        categories.put(QueryType.COMPARISON, patterns(
                "\\b(compare|contrast|difference|versus|vs|against)\\b",
                "\\b(group|category|segment|cohort)\\b",
                "\\b(higher|lower|greater|less|more|fewer)\\b"));

        categories.put(QueryType.PREDICTIVE, patterns(
                "\\b(predict|forecast|model|estimate|project)\\b",
                "\\b(future|outcome|result|prognosis)\\b",
                "\\b(regression|machine learning|ml|classification)\\b"));

        categories.put(QueryType.TEMPORAL, patterns(
                "\\b(time|temporal|trend|over time|longitudinal)\\b",
                "\\b(before|after|during|period|season)\\b",
                "\\b(change|evolution|progression|development)\\b"));

        CATEGORY_PATTERNS = Collections.unmodifiableMap(categories);

        // Common dataset variable names (demographic, measurement, clinical, grouping)
        VARIABLE_PATTERNS = patterns(
                "\\b(age|gender|sex|height|weight|bmi|income|salary|education|experience)\\b",
                "\\b(score|rating|price|cost|value|amount|quantity|count)\\b",
                "\\b(blood_pressure|heart_rate|temperature|cholesterol|glucose)\\b",
                "\\b(treatment|medication|therapy|intervention|group|category)\\b");

        Map<String, Pattern> operations = new LinkedHashMap<>();
        operations.put("mean", compile("\\b(mean|average|avg)\\b"));
        operations.put("median", compile("\\b(median|middle)\\b"));
        operations.put("mode", compile("\\b(mode|most common)\\b"));
        operations.put("std", compile("\\b(standard deviation|std|variability)\\b"));
        operations.put("var", compile("\\b(variance|var)\\b"));
        operations.put("min", compile("\\b(minimum|min|lowest)\\b"));
        operations.put("max", compile("\\b(maximum|max|highest)\\b"));
        operations.put("sum", compile("\\b(sum|total|add)\\b"));
        operations.put("count", compile("\\b(count|number|frequency)\\b"));
        operations.put("correlation", compile("\\b(correlation|relate|associate)\\b"));
        operations.put("regression", compile("\\b(regression|predict|model)\\b"));
        OPERATION_PATTERNS = Collections.unmodifiableMap(operations);

        Map<String, Pattern> tests = new LinkedHashMap<>();
        tests.put("ttest", compile("\\b(t-test|ttest|paired|unpaired|independent|student)\\b"));
        tests.put("anova", compile("\\b(anova|analysis of variance|f-test|one-way|two-way)\\b"));
        tests.put("chi_square", compile("\\b(chi-square|chi2|contingency|independence)\\b"));
        tests.put("correlation", compile("\\b(correlation|pearson|spearman|kendall)\\b"));
        tests.put("regression", compile("\\b(regression|linear|logistic|multiple)\\b"));
        tests.put("nonparametric", compile("\\b(mann-whitney|wilcoxon|kruskal|friedman)\\b"));
        STATISTICAL_TEST_PATTERNS = Collections.unmodifiableMap(tests);

        // Priority order: the first family that matches is reported
        Map<String, Pattern> charts = new LinkedHashMap<>();
        charts.put("histogram", compile("\\b(histogram|distribution|frequency)\\b"));
        charts.put("scatter", compile("\\b(scatter|relationship|correlation)\\b"));
        charts.put("bar", compile("\\b(bar|category|group|count)\\b"));
        charts.put("line", compile("\\b(line|trend|time|temporal)\\b"));
        charts.put("box", compile("\\b(box|quartile|outlier|spread)\\b"));
        charts.put("heatmap", compile("\\b(heatmap|correlation matrix|intensity)\\b"));
        VISUALIZATION_PATTERNS = Collections.unmodifiableMap(charts);
    }

    private PatternLibrary() {
    }

    private static Pattern compile(String regex) {
        return Pattern.compile(regex);
    }

    private static List<Pattern> patterns(String... regexes) {
        Pattern[] compiled = new Pattern[regexes.length];
        for (int i = 0; i < regexes.length; i++) {
            compiled[i] = compile(regexes[i]);
        }
        return List.of(compiled);
    }
}
