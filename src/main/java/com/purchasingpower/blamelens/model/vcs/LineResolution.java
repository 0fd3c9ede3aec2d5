package com.purchasingpower.blamelens.model.vcs;

import com.purchasingpower.blamelens.model.blame.LineAttribution;
import lombok.Value;

/**
 * Resolution of a file line: its attribution, if the line is committed, and the outcome of the
 * change request lookup.
 */
@Value
public class LineResolution {

    /** Null for uncommitted lines and files that could not be blamed. */
    LineAttribution attribution;

    ResolutionOutcome outcome;
}
