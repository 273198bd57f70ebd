package com.litesql.backend.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.litesql.backend.engine.Value;
import com.litesql.backend.engine.ValueType;

/**
 * step 的结果：一行数据，或者 DONE。
 */
public final class StepResult {

    private static final StepResult DONE = new StepResult(null);

    private final List<Value> row;

    private StepResult(List<Value> row) {
        this.row = row;
    }

    public static StepResult row(List<Value> values) {
        return new StepResult(Collections.unmodifiableList(new ArrayList<>(values)));
    }

    public static StepResult done() {
        return DONE;
    }

    public boolean isDone() {
        return row == null;
    }

    public List<Value> getRow() {
        return row;
    }

    public List<ValueType> getTypes() {
        List<ValueType> types = new ArrayList<>();
        if(row != null) {
            for (Value v : row) {
                types.add(v.getType());
            }
        }
        return types;
    }
}
