package com.ndcheck.syntax;

import com.ndcheck.logic.Logic;
import com.ndcheck.logic.Operator;

/**
 * A well-formed formula uses an operator the selected logic does not admit.
 */
public class OperatorNotSupportedException extends SyntaxException {

    private final Operator operator;
    private final Logic logic;

    public OperatorNotSupportedException(Operator operator, Logic logic) {
        super("Operator " + operator.getLabel() + " is not supported in " + logic.name() + ".", operator.getLabel());
        this.operator = operator;
        this.logic = logic;
    }

    public Operator getOperator() {
        return operator;
    }

    public Logic getLogic() {
        return logic;
    }
}
