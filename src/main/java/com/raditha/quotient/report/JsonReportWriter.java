package com.raditha.quotient.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.quotient.model.ClonePair;
import com.raditha.quotient.model.CloneSpan;
import com.raditha.quotient.model.ConfidenceInterval;
import com.raditha.quotient.model.FileSummary;
import com.raditha.quotient.model.Pillar;
import com.raditha.quotient.model.PillarScore;
import com.raditha.quotient.model.Report;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serializes a {@link Report} to JSON.
 * <p>
 * Output carries no timestamps or host details, so equal reports give byte-identical JSON.
 */
public class JsonReportWriter {

    private static final ObjectMapper mapper = new ObjectMapper();

    /**
     * DTOs keep the wire format independent of the model records.
     */
    public record ReportDTO(
            @JsonProperty("overall_score") double overallScore,
            @JsonProperty("partial") boolean partial,
            @JsonProperty("pillars") Map<String, PillarDTO> pillars,
            @JsonProperty("effective_weights") Map<String, Double> effectiveWeights,
            @JsonProperty("confidence") IntervalDTO confidence,
            @JsonProperty("pillar_confidence") Map<String, IntervalDTO> pillarConfidence,
            @JsonProperty("findings") List<FindingDTO> findings,
            @JsonProperty("clone_pairs") List<ClonePairDTO> clonePairs,
            @JsonProperty("absent_relations") List<RelationDTO> absentRelations,
            @JsonProperty("files") List<FileDTO> files) {
    }

    public record PillarDTO(
            @JsonProperty("score") double score,
            @JsonProperty("available") boolean available,
            @JsonProperty("reason") String reason) {
    }

    public record IntervalDTO(
            @JsonProperty("point_estimate") double pointEstimate,
            @JsonProperty("interval_low") double intervalLow,
            @JsonProperty("interval_high") double intervalHigh,
            @JsonProperty("level") double level,
            @JsonProperty("sample_size") int sampleSize,
            @JsonProperty("resamples") int resamples) {
    }

    public record FindingDTO(
            @JsonProperty("file") String file,
            @JsonProperty("line") int line,
            @JsonProperty("category") String category,
            @JsonProperty("severity") String severity,
            @JsonProperty("message") String message) {
    }

    public record SpanDTO(
            @JsonProperty("file") String file,
            @JsonProperty("start_line") int startLine,
            @JsonProperty("end_line") int endLine,
            @JsonProperty("start_token") int startToken,
            @JsonProperty("end_token") int endToken) {
    }

    public record ClonePairDTO(
            @JsonProperty("first") SpanDTO first,
            @JsonProperty("second") SpanDTO second,
            @JsonProperty("token_length") int tokenLength,
            @JsonProperty("lines") int lines) {
    }

    public record RelationDTO(
            @JsonProperty("from") String from,
            @JsonProperty("to") String to) {
    }

    public record FileDTO(
            @JsonProperty("path") String path,
            @JsonProperty("role") String role,
            @JsonProperty("lines") int lines,
            @JsonProperty("tokens") int tokens,
            @JsonProperty("parsed") boolean parsed,
            @JsonProperty("duplication_ratio") double duplicationRatio,
            @JsonProperty("complexity") double complexity,
            @JsonProperty("complexity_score") double complexityScore,
            @JsonProperty("grade") double grade) {
    }

    public String toJson(Report report) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toDTO(report));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public void write(Report report, Path path) throws IOException {
        Files.writeString(path, toJson(report) + "\n", StandardCharsets.UTF_8);
    }

    ReportDTO toDTO(Report report) {
        Map<String, PillarDTO> pillars = new LinkedHashMap<>();
        Map<String, Double> weights = new LinkedHashMap<>();
        Map<String, IntervalDTO> intervals = new LinkedHashMap<>();
        for (Pillar pillar : Pillar.values()) {
            PillarScore score = report.pillar(pillar);
            pillars.put(pillar.key(), new PillarDTO(score.score(), score.available(), score.reason()));
            weights.put(pillar.key(), report.effectiveWeights().getOrDefault(pillar, 0.0));
            ConfidenceInterval interval = report.pillarIntervals().get(pillar);
            if (interval != null) {
                intervals.put(pillar.key(), toDTO(interval));
            }
        }

        List<FindingDTO> findings = report.findings().stream()
                .map(f -> new FindingDTO(f.file(), f.line(), f.category().name(), f.severity().name(), f.message()))
                .toList();
        List<ClonePairDTO> pairs = report.clonePairs().stream()
                .map(JsonReportWriter::toDTO)
                .toList();
        List<RelationDTO> absent = report.absentRelations().stream()
                .map(r -> new RelationDTO(r.fromLayer(), r.toLayer()))
                .toList();
        List<FileDTO> files = report.files().stream()
                .map(JsonReportWriter::toDTO)
                .toList();

        return new ReportDTO(report.overallScore(), report.partial(), pillars, weights,
                toDTO(report.confidence()), intervals, findings, pairs, absent, files);
    }

    private static IntervalDTO toDTO(ConfidenceInterval interval) {
        return new IntervalDTO(interval.pointEstimate(), interval.low(), interval.high(), interval.level(),
                interval.sampleSize(), interval.resamples());
    }

    private static ClonePairDTO toDTO(ClonePair pair) {
        return new ClonePairDTO(toDTO(pair.first()), toDTO(pair.second()), pair.tokenLength(),
                pair.duplicatedLines());
    }

    private static SpanDTO toDTO(CloneSpan span) {
        return new SpanDTO(span.file(), span.startLine(), span.endLine(), span.startToken(), span.endToken());
    }

    private static FileDTO toDTO(FileSummary file) {
        return new FileDTO(file.path(), file.role().key(), file.lines(), file.tokens(), file.parsed(),
                file.duplicationRatio(), file.complexity(), file.complexityScore(), file.grade());
    }
}
