package com.optmodeler.core.generator.impl;

import com.optmodeler.core.exception.RenderInconsistencyException;
import com.optmodeler.core.generator.RenderPhase;

import java.util.ArrayList;
import java.util.List;

/**
 * Lines rendered for one container, written strictly in phase order: declarations,
 * then overrides, then statements.
 */
final class ProgramSection {

    private final String containerName;
    private final List<String> lines = new ArrayList<>();
    private RenderPhase phase;

    ProgramSection(String containerName) {
        this.containerName = containerName;
    }

    void declaration(String line) {
        require(null, "declaration");
        lines.add(line);
    }

    void override(String line) {
        require(RenderPhase.DECLARED, "override");
        lines.add(line);
    }

    void statement(List<String> statementLines) {
        require(RenderPhase.OVERRIDES_EMITTED, "statement");
        lines.addAll(statementLines);
    }

    /**
     * Moves to the next phase.
     *
     * @param next phase directly following the current one
     * @throws RenderInconsistencyException if the phase is skipped or repeated
     */
    void advance(RenderPhase next) {
        int expected = phase == null ? 0 : phase.ordinal() + 1;
        if (next.ordinal() != expected) {
            throw new RenderInconsistencyException("Container '" + containerName + "' cannot move from "
                    + (phase == null ? "START" : phase) + " to " + next);
        }
        phase = next;
    }

    RenderPhase phase() {
        return phase;
    }

    List<String> lines() {
        if (phase != RenderPhase.SEALED) {
            throw new RenderInconsistencyException("Container '" + containerName + "' read before sealing");
        }
        return List.copyOf(lines);
    }

    private void require(RenderPhase current, String what) {
        if (phase != current) {
            throw new RenderInconsistencyException("Cannot write " + what + " of '" + containerName
                    + "' in phase " + (phase == null ? "START" : phase));
        }
    }
}
