package org.carball.fathom.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.carball.fathom.model.analysis.AnalysisResult;
import org.carball.fathom.model.analysis.Counter;
import org.carball.fathom.model.analysis.ReadabilityScore;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;

@Slf4j
public class ReadabilityReport {

    private final AnalysisResult result;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public ReadabilityReport(AnalysisResult result) {
        this(result, LocalDateTime.now());
    }

    public ReadabilityReport(AnalysisResult result, LocalDateTime timestamp) {
        this.result = result;
        this.timestamp = timestamp;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * Plain report: one line per counter, then the score and its label.
     */
    public String toText() {
        ReadabilityScore score = result.score();
        StringBuilder text = new StringBuilder();
        for (Counter counter : Counter.values()) {
            int count = score.count(counter);
            text.append(String.format(Locale.ROOT, "%-5d %s%n", count, counter.label(count)));
        }
        text.append(String.format(Locale.ROOT, "readability is %.2f (%s)%n", score.getScore(), score.getLabel()));
        return text.toString();
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (Exception e) {
            log.error("Error generating JSON report", e);
            throw new RuntimeException("Failed to generate JSON report", e);
        }
    }

    private ReportData buildReportData() {
        ReadabilityScore score = result.score();
        ReportData data = new ReportData();
        data.setProgram(result.programName());
        data.setGenerated(timestamp);
        data.setTokens(score.getTokens());
        data.setExpressions(score.getExpressions());
        data.setStatements(score.getStatements());
        data.setSubroutines(score.getSubroutines());
        data.setTokenPerExpression(round(score.getTokenPerExpression()));
        data.setExpressionPerStatement(round(score.getExpressionPerStatement()));
        data.setStatementPerSubroutine(round(score.getStatementPerSubroutine()));
        data.setScore(round(score.getScore()));
        data.setLabel(score.getLabel());
        data.setAnalyzedSubroutines(result.analyzedSubroutines());
        data.setSkippedReexports(result.skippedReexports());

        Warnings warnings = new Warnings();
        warnings.setUnresolvedSymbols(result.unresolvedSymbols());
        warnings.setUnclassifiedNodes(result.unclassifiedNodes());
        data.setWarnings(warnings);
        return data;
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    @Data
    private static class ReportData {
        private String program;
        private LocalDateTime generated;
        private int tokens;
        private int expressions;
        private int statements;
        private int subroutines;
        @JsonProperty("token_per_expression")
        private double tokenPerExpression;
        @JsonProperty("expression_per_statement")
        private double expressionPerStatement;
        @JsonProperty("statement_per_subroutine")
        private double statementPerSubroutine;
        private double score;
        private String label;
        @JsonProperty("analyzed_subroutines")
        private int analyzedSubroutines;
        @JsonProperty("skipped_reexports")
        private List<String> skippedReexports;
        private Warnings warnings;
    }

    @Data
    private static class Warnings {
        @JsonProperty("unresolved_symbols")
        private int unresolvedSymbols;
        @JsonProperty("unclassified_nodes")
        private int unclassifiedNodes;
    }
}
