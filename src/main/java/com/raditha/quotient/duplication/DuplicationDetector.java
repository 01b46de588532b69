package com.raditha.quotient.duplication;

import com.raditha.quotient.config.QualityConfig;
import com.raditha.quotient.model.ClonePair;
import com.raditha.quotient.model.CloneSpan;
import com.raditha.quotient.model.Finding;
import com.raditha.quotient.model.FindingCategory;
import com.raditha.quotient.model.Fingerprint;
import com.raditha.quotient.model.MetricSample;
import com.raditha.quotient.model.NormalizedToken;
import com.raditha.quotient.model.PillarScore;
import com.raditha.quotient.model.SourceSpan;
import com.raditha.quotient.normalization.NormalizedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;

/**
 * Winnowing-based duplicate detector over normalized token streams.
 * <p>
 * Phases:
 * <ol>
 * <li>fingerprint every file in parallel (pure, per file)</li>
 * <li>insert all fingerprints into one index in path order, then freeze it</li>
 * <li>pair up occurrences of shared hashes and merge them along diagonals</li>
 * <li>extend merged spans to maximal length, filter, and canonicalize into clone pairs</li>
 * </ol>
 * Files are sorted by path up front so the result never depends on discovery order.
 */
public class DuplicationDetector {

    private static final Logger logger = LoggerFactory.getLogger(DuplicationDetector.class);
    static final String METRIC_NAME = "duplication";

    private final int k;
    private final int w;
    private final int minCloneTokens;
    private final QualityConfig.RoleWeights roleWeights;

    public DuplicationDetector(QualityConfig.DuplicationSettings settings, QualityConfig.RoleWeights roleWeights) {
        this.k = settings.k();
        this.w = settings.w();
        this.minCloneTokens = settings.minCloneTokens();
        this.roleWeights = roleWeights;
    }

    public DuplicationResult detect(List<NormalizedFile> files) {
        return detect(files, ForkJoinPool.commonPool());
    }

    /**
     * Run the detector.
     *
     * @param files Successfully normalized files, in any order
     * @param pool  Pool used for per-file fingerprinting
     * @return Clone pairs, ratios and the pillar score
     */
    public DuplicationResult detect(List<NormalizedFile> files, ForkJoinPool pool) {
        if (files.isEmpty()) {
            return new DuplicationResult(PillarScore.unavailable("no parsable source files"), 0.0,
                    List.of(), Map.of(), List.of(), List.of());
        }

        List<NormalizedFile> sorted = new ArrayList<>(files);
        sorted.sort(Comparator.comparing(NormalizedFile::path));

        Winnower winnower = new Winnower(k, w);
        List<List<Fingerprint>> perFile = pool.submit(() -> sorted.parallelStream()
                .map(f -> winnower.winnow(f.path(), RollingHash.kgramHashes(f.tokens(), k)))
                .collect(Collectors.toList())).join();

        // Barrier: the index is complete and frozen before any matching happens
        FingerprintIndex.Builder builder = FingerprintIndex.builder();
        perFile.forEach(builder::addAll);
        FingerprintIndex index = builder.build();

        Map<String, Integer> fileIndex = new HashMap<>();
        for (int i = 0; i < sorted.size(); i++) {
            fileIndex.put(sorted.get(i).path(), i);
        }
        List<List<String>> keys = sorted.stream()
                .map(f -> f.tokens().stream().map(NormalizedToken::key).collect(Collectors.toList()))
                .collect(Collectors.toList());

        Map<Long, TreeMap<Integer, TreeSet<Integer>>> matches = collectMatches(index, fileIndex);
        List<Candidate> candidates = mergeAndExtend(matches, keys);
        List<ClonePair> clonePairs = toClonePairs(candidates, sorted);

        Map<String, Double> fileRatios = new TreeMap<>();
        List<MetricSample> samples = new ArrayList<>();
        double ratio = computeRatios(sorted, candidates, fileRatios, samples);

        List<Finding> findings = new ArrayList<>();
        for (ClonePair pair : clonePairs) {
            findings.add(toFinding(pair));
        }

        logger.info("Duplication: {} files, {} fingerprints, {} clone pairs, ratio {}",
                sorted.size(), index.size(), clonePairs.size(), String.format(Locale.ROOT, "%.4f", ratio));

        double score = Math.max(0.0, Math.min(1.0, 1.0 - ratio));
        return new DuplicationResult(PillarScore.of(score), ratio, clonePairs, fileRatios, samples, findings);
    }

    /**
     * Pair occurrences of every shared hash. Keyed by file pair, then diagonal, holding
     * the start positions on the first file.
     */
    private Map<Long, TreeMap<Integer, TreeSet<Integer>>> collectMatches(FingerprintIndex index,
                                                                        Map<String, Integer> fileIndex) {
        Map<Long, TreeMap<Integer, TreeSet<Integer>>> matches = new TreeMap<>();
        for (List<Fingerprint> cluster : index.clusters()) {
            for (int i = 0; i < cluster.size(); i++) {
                for (int j = i + 1; j < cluster.size(); j++) {
                    Fingerprint a = cluster.get(i);
                    Fingerprint b = cluster.get(j);
                    int fa = fileIndex.get(a.file());
                    int fb = fileIndex.get(b.file());
                    if (fa > fb || (fa == fb && a.startToken() > b.startToken())) {
                        Fingerprint tmp = a;
                        a = b;
                        b = tmp;
                        int t = fa;
                        fa = fb;
                        fb = t;
                    }
                    if (fa == fb && b.startToken() < a.endToken()) {
                        continue;
                    }
                    long pairKey = ((long) fa << 32) | fb;
                    int diagonal = b.startToken() - a.startToken();
                    matches.computeIfAbsent(pairKey, p -> new TreeMap<>())
                            .computeIfAbsent(diagonal, d -> new TreeSet<>())
                            .add(a.startToken());
                }
            }
        }
        return matches;
    }

    private List<Candidate> mergeAndExtend(Map<Long, TreeMap<Integer, TreeSet<Integer>>> matches,
                                           List<List<String>> keys) {
        int gap = Math.max(0, w - k);
        List<Candidate> result = new ArrayList<>();

        for (Map.Entry<Long, TreeMap<Integer, TreeSet<Integer>>> pairEntry : matches.entrySet()) {
            int fa = (int) (pairEntry.getKey() >>> 32);
            int fb = (int) (pairEntry.getKey() & 0xffffffffL);
            List<String> keysA = keys.get(fa);
            List<String> keysB = keys.get(fb);

            Set<Candidate> spans = new LinkedHashSet<>();
            for (Map.Entry<Integer, TreeSet<Integer>> diagonalEntry : pairEntry.getValue().entrySet()) {
                int diagonal = diagonalEntry.getKey();
                int runStart = -1;
                int runEnd = -1;
                for (int start : diagonalEntry.getValue()) {
                    if (runStart >= 0 && start <= runEnd + gap) {
                        runEnd = Math.max(runEnd, start + k);
                        continue;
                    }
                    if (runStart >= 0) {
                        spans.add(extend(fa, fb, runStart, runEnd, diagonal, keysA, keysB));
                    }
                    runStart = start;
                    runEnd = start + k;
                }
                if (runStart >= 0) {
                    spans.add(extend(fa, fb, runStart, runEnd, diagonal, keysA, keysB));
                }
            }

            List<Candidate> kept = spans.stream()
                    .filter(c -> c.length() >= minCloneTokens)
                    .collect(Collectors.toList());
            for (Candidate candidate : kept) {
                boolean contained = kept.stream().anyMatch(o -> !o.equals(candidate) && candidate.within(o));
                if (!contained) {
                    result.add(candidate);
                }
            }
        }
        return result;
    }

    /**
     * Grow a merged run to the maximal span whose token keys agree on both sides.
     * Within one file the two sides never overlap.
     */
    private Candidate extend(int fa, int fb, int startA, int endA, int diagonal,
                             List<String> keysA, List<String> keysB) {
        // Within one file a span may be at most `diagonal` tokens long
        boolean sameFile = fa == fb;
        int sA = startA;
        int eA = sameFile ? Math.min(endA, sA + diagonal) : endA;

        while (sA > 0 && sA + diagonal > 0 && (!sameFile || eA - (sA - 1) <= diagonal)
                && keysA.get(sA - 1).equals(keysB.get(sA - 1 + diagonal))) {
            sA--;
        }
        while (eA < keysA.size() && eA + diagonal < keysB.size() && (!sameFile || (eA + 1) - sA <= diagonal)
                && keysA.get(eA).equals(keysB.get(eA + diagonal))) {
            eA++;
        }
        return new Candidate(fa, sA, eA, fb, sA + diagonal);
    }

    private List<ClonePair> toClonePairs(List<Candidate> candidates, List<NormalizedFile> files) {
        List<ClonePair> pairs = new ArrayList<>();
        for (Candidate c : candidates) {
            CloneSpan first = toSpan(files.get(c.fileA()), c.startA(), c.endA());
            CloneSpan second = toSpan(files.get(c.fileB()), c.startB(), c.startB() + c.length());
            pairs.add(ClonePair.of(first, second));
        }
        pairs.sort(ClonePair.CANONICAL_ORDER);
        return pairs;
    }

    private CloneSpan toSpan(NormalizedFile file, int start, int end) {
        int firstLine = Integer.MAX_VALUE;
        int lastLine = 0;
        for (int i = start; i < end; i++) {
            SourceSpan span = file.tokens().get(i).span();
            if (span.startLine() > 0) {
                firstLine = Math.min(firstLine, span.startLine());
                lastLine = Math.max(lastLine, span.endLine());
            }
        }
        if (firstLine == Integer.MAX_VALUE) {
            firstLine = 0;
        }
        return new CloneSpan(file.path(), start, end, firstLine, Math.max(firstLine, lastLine));
    }

    /**
     * Fill the per-file ratios and samples and return the repository ratio.
     */
    private double computeRatios(List<NormalizedFile> files, List<Candidate> candidates,
                                 Map<String, Double> fileRatios, List<MetricSample> samples) {
        BitSet[] covered = new BitSet[files.size()];
        for (int i = 0; i < covered.length; i++) {
            covered[i] = new BitSet(files.get(i).tokenCount());
        }
        for (Candidate c : candidates) {
            covered[c.fileA()].set(c.startA(), c.endA());
            covered[c.fileB()].set(c.startB(), c.startB() + c.length());
        }

        double weightedCovered = 0.0;
        double weightedTotal = 0.0;
        for (int i = 0; i < files.size(); i++) {
            NormalizedFile file = files.get(i);
            int total = file.tokenCount();
            if (total == 0) {
                continue;
            }
            int dup = covered[i].cardinality();
            double fileRatio = (double) dup / total;
            fileRatios.put(file.path(), fileRatio);
            samples.add(new MetricSample(file.path(), METRIC_NAME, 1.0 - fileRatio));

            double roleWeight = roleWeights.weightOf(file.role());
            weightedCovered += dup * roleWeight;
            weightedTotal += total * roleWeight;
        }
        return weightedTotal > 0 ? weightedCovered / weightedTotal : 0.0;
    }

    private Finding toFinding(ClonePair pair) {
        CloneSpan first = pair.first();
        String message = String.format(Locale.ROOT, "Duplicated block of %d tokens (%d lines) also at %s",
                pair.tokenLength(), pair.duplicatedLines(), pair.second().toSourceSpan());
        return Finding.info(first.file(), first.startLine(), FindingCategory.DUPLICATION, message);
    }

    /**
     * A matched span pair, sides given by file index. Both sides have the same length.
     */
    record Candidate(int fileA, int startA, int endA, int fileB, int startB) {

        int length() {
            return endA - startA;
        }

        boolean within(Candidate other) {
            return fileA == other.fileA && fileB == other.fileB
                    && startA >= other.startA && endA <= other.endA
                    && startB >= other.startB && startB + length() <= other.startB + other.length();
        }
    }
}
