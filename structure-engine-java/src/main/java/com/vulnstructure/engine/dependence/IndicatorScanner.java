package com.vulnstructure.engine.dependence;

import com.vulnstructure.engine.model.StructureModel.*;
import com.vulnstructure.engine.support.Texts;

import java.util.List;
import java.util.Locale;

/**
 * Sorts statements into observational buckets by lexical cues in their text.
 * The buckets are counts of constructs, not vulnerability verdicts.
 */
final class IndicatorScanner {

    private static final List<String> BUFFER_CUES = List.of("[", "strcpy", "strcat", "memcpy", "memset");
    private static final List<String> POINTER_CUES = List.of("*", "->");
    private static final List<String> MEMORY_CUES = List.of("malloc", "free", "calloc", "realloc");

    private final List<String> trackedFunctions;
    private final int snippetLength;

    IndicatorScanner(List<String> trackedFunctions, int snippetLength) {
        this.trackedFunctions = trackedFunctions;
        this.snippetLength = snippetLength;
    }

    PatternBuckets scan(List<StatementRecord> statements) {
        PatternBuckets buckets = new PatternBuckets();
        for (StatementRecord statement : statements) {
            String text = statement.text.toLowerCase(Locale.ROOT);
            if (containsAny(text, BUFFER_CUES)) {
                buckets.bufferOperations.add(match(statement, "buffer_operation"));
            }
            if (containsAny(text, POINTER_CUES)) {
                buckets.pointerOperations.add(match(statement, "pointer_operation"));
            }
            if (containsAny(text, MEMORY_CUES)) {
                buckets.memoryOperations.add(match(statement, "memory_operation"));
            }
            for (String call : statement.functionCalls) {
                if (trackedFunctions.contains(call)) {
                    TrackedCall tracked = new TrackedCall();
                    tracked.line = statement.line;
                    tracked.function = call;
                    tracked.statement = Texts.truncate(statement.text, snippetLength);
                    buckets.functionCalls.add(tracked);
                }
            }
        }
        return buckets;
    }

    static IndicatorCounts count(PatternBuckets buckets) {
        IndicatorCounts counts = new IndicatorCounts();
        counts.bufferOps = buckets.bufferOperations.size();
        counts.pointerOps = buckets.pointerOperations.size();
        counts.memoryOps = buckets.memoryOperations.size();
        counts.trackedFuncs = buckets.functionCalls.size();
        return counts;
    }

    private PatternMatch match(StatementRecord statement, String type) {
        PatternMatch match = new PatternMatch();
        match.line = statement.line;
        match.statement = Texts.truncate(statement.text, snippetLength);
        match.type = type;
        return match;
    }

    private static boolean containsAny(String text, List<String> cues) {
        for (String cue : cues) {
            if (text.contains(cue)) return true;
        }
        return false;
    }
}
