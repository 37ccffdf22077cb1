package com.deepresearch.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A clarification question asked in an earlier turn and the caller's answer to it.
 */
public record ClarificationTurn(String question, String answer) implements Serializable {

    /**
     * Appends every answered question to the query, oldest first. Returns the query
     * unchanged when there is nothing to fold in.
     */
    public static String foldInto(String query, List<ClarificationTurn> history) {
        if (history == null || history.isEmpty()) {
            return query;
        }
        var sb = new StringBuilder(query);
        for (ClarificationTurn turn : history) {
            if (turn.answer() == null || turn.answer().isBlank()) continue;
            sb.append("\n- ");
            if (turn.question() != null && !turn.question().isBlank()) {
                sb.append(turn.question().trim()).append(' ');
            }
            sb.append(turn.answer().trim());
        }
        return sb.toString();
    }
}
