package com.stagesql.logical;

import com.stagesql.config.RenderDefaults;
import com.stagesql.generator.SQLQuoting;

/**
 * Stage counting the rows of the result.
 *
 * <p>Appended after a {@link Unique}, it is replaced by a {@link CountUnique}.
 */
public final class Count extends Stage {

    @Override
    public StageKind kind() {
        return StageKind.COUNT;
    }

    @Override
    public String toSQL(String placeholder) {
        return "COUNT(*) AS " + SQLQuoting.quoteIdentifier(RenderDefaults.COUNT_ALIAS);
    }

    @Override
    public String toString() {
        return "Count()";
    }
}
