package com.raditha.quotient.report;

import com.raditha.quotient.model.CloneSpan;
import com.raditha.quotient.model.ClonePair;
import com.raditha.quotient.model.ConfidenceInterval;
import com.raditha.quotient.model.FileRole;
import com.raditha.quotient.model.FileSummary;
import com.raditha.quotient.model.Finding;
import com.raditha.quotient.model.FindingCategory;
import com.raditha.quotient.model.LayerRelation;
import com.raditha.quotient.model.Pillar;
import com.raditha.quotient.model.PillarScore;
import com.raditha.quotient.model.Report;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * A small hand-built report shared by the writer tests.
 */
final class ReportFixtures {

    private ReportFixtures() {
    }

    static Report sample() {
        Map<Pillar, PillarScore> pillars = new EnumMap<>(Pillar.class);
        pillars.put(Pillar.DUPLICATION, PillarScore.of(0.9));
        pillars.put(Pillar.ARCHITECTURE, PillarScore.of(0.5));
        pillars.put(Pillar.LINT, PillarScore.unavailable("no lint command configured"));
        pillars.put(Pillar.TYPING, PillarScore.unavailable("exit code 2 | see log"));
        pillars.put(Pillar.COMPLEXITY, PillarScore.of(0.75));

        Map<Pillar, Double> weights = new EnumMap<>(Pillar.class);
        weights.put(Pillar.DUPLICATION, 0.25 / 0.65);
        weights.put(Pillar.ARCHITECTURE, 0.20 / 0.65);
        weights.put(Pillar.LINT, 0.0);
        weights.put(Pillar.TYPING, 0.0);
        weights.put(Pillar.COMPLEXITY, 0.20 / 0.65);

        Map<Pillar, ConfidenceInterval> intervals = new EnumMap<>(Pillar.class);
        intervals.put(Pillar.DUPLICATION, new ConfidenceInterval(0.9, 0.85, 0.95, 0.95, 2, 1000));

        ClonePair pair = ClonePair.of(
                new CloneSpan("src/b/Totals.java", 12, 70, 4, 15),
                new CloneSpan("src/a/Summary.java", 20, 78, 6, 17));

        return new Report(
                72.5,
                true,
                pillars,
                weights,
                new ConfidenceInterval(72.5, 70.0, 75.0, 0.95, 2, 1000),
                intervals,
                List.of(Finding.repositoryWarning(FindingCategory.TOOL, "typing unavailable: exit code 2"),
                        Finding.error("src/a/Summary.java", 3, FindingCategory.ARCHITECTURE,
                                "Divergent dependency a.Summary (domain) -> b.Totals (web)"),
                        Finding.info("src/a/Summary.java", 6, FindingCategory.DUPLICATION,
                                "Clone of src/b/Totals.java:4-15")),
                List.of(pair),
                List.of(new LayerRelation("web", "domain")),
                List.of(new FileSummary("src/a/Summary.java", FileRole.DEFAULT, 18, 80, true, 0.7, 4, 0.8, 65.0),
                        new FileSummary("src/b/Totals.java", FileRole.DEFAULT, 19, 90, true, 0.6, 4, 0.8, 80.0)));
    }
}
