package com.example.nl2cmd.strategy;

import com.example.nl2cmd.model.CandidateResolution;
import com.example.nl2cmd.model.OsFamily;
import com.example.nl2cmd.model.ProcessedQuery;
import com.example.nl2cmd.model.ResolutionMethod;

/**
 * One candidate source of the resolution cascade.
 */
public interface ResolutionStrategy {

    String name();

    /** The cascade stage this strategy fills. */
    ResolutionMethod method();

    boolean isAvailable();

    /**
     * Produces a candidate for {@code query}. Implementations report their own faults as failed
     * candidates; callers still guard against runtime exceptions.
     */
    CandidateResolution resolve(ProcessedQuery query, OsFamily os);
}
