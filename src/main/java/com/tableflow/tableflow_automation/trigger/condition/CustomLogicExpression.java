package com.tableflow.tableflow_automation.trigger.condition;

import java.util.List;

/**
 * Parsed custom-logic expression over condition group results.
 */
public interface CustomLogicExpression {

    boolean evaluate(List<Boolean> groupResults);

    record GroupRef(int index) implements CustomLogicExpression {
        @Override
        public boolean evaluate(List<Boolean> groupResults) {
            return groupResults.get(index);
        }
    }

    record Not(CustomLogicExpression operand) implements CustomLogicExpression {
        @Override
        public boolean evaluate(List<Boolean> groupResults) {
            return !operand.evaluate(groupResults);
        }
    }

    record And(CustomLogicExpression left, CustomLogicExpression right) implements CustomLogicExpression {
        @Override
        public boolean evaluate(List<Boolean> groupResults) {
            return left.evaluate(groupResults) && right.evaluate(groupResults);
        }
    }

    record Or(CustomLogicExpression left, CustomLogicExpression right) implements CustomLogicExpression {
        @Override
        public boolean evaluate(List<Boolean> groupResults) {
            return left.evaluate(groupResults) || right.evaluate(groupResults);
        }
    }
}
