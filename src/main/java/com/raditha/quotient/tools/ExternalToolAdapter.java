package com.raditha.quotient.tools;

import com.raditha.quotient.model.Pillar;
import com.raditha.quotient.source.RepositorySnapshot;

/**
 * Produces one pillar metric by running an external tool.
 * Implementations never throw: every failure becomes {@link ToolOutcome#unavailable}.
 */
public interface ExternalToolAdapter {

    Pillar pillar();

    ToolOutcome run(RepositorySnapshot snapshot);
}
