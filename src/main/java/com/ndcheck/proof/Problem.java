package com.ndcheck.proof;

import com.ndcheck.logic.Logic;
import com.ndcheck.syntax.Formula;

import java.util.List;

/**
 * A parsed problem statement: the logic, its premises in order, and the conclusion.
 */
public record Problem(Logic logic, List<Formula> premises, Formula conclusion) {

    public Problem {
        premises = List.copyOf(premises);
    }
}
