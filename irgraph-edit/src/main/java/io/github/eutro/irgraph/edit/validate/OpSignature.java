package io.github.eutro.irgraph.edit.validate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What an operation is built from: its operand and attribute parameters,
 * and how many results and regions it has.
 */
public final class OpSignature {
    /**
     * The result count of operations with any number of results.
     */
    public static final int VARIADIC = -1;

    public final String opName;
    public final List<OpParam> params;
    /**
     * The number of results, or {@link #VARIADIC}.
     */
    public final int numResults;
    public final int numRegions;

    public OpSignature(String opName, List<OpParam> params, int numResults, int numRegions) {
        this.opName = opName;
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        this.numResults = numResults;
        this.numRegions = numRegions;
    }

    public static Builder builder(String opName) {
        return new Builder(opName);
    }

    /**
     * Get the fewest operands an operation can have, the number of required operand parameters.
     *
     * @return The count.
     */
    public int minOperands() {
        int count = 0;
        for (OpParam param : params) {
            if (param.kind == OpParam.Kind.OPERAND && param.required) count++;
        }
        return count;
    }

    public boolean hasVariadicResults() {
        return numResults == VARIADIC;
    }

    public static class Builder {
        private final String opName;
        private final List<OpParam> params = new ArrayList<>();
        private int numResults = 0;
        private int numRegions = 0;

        private Builder(String opName) {
            this.opName = opName;
        }

        public Builder operand(String name) {
            params.add(new OpParam(name, OpParam.Kind.OPERAND, true));
            return this;
        }

        public Builder optionalOperand(String name) {
            params.add(new OpParam(name, OpParam.Kind.OPERAND, false));
            return this;
        }

        public Builder attribute(String name) {
            params.add(new OpParam(name, OpParam.Kind.ATTRIBUTE, true));
            return this;
        }

        public Builder optionalAttribute(String name) {
            params.add(new OpParam(name, OpParam.Kind.ATTRIBUTE, false));
            return this;
        }

        public Builder results(int numResults) {
            this.numResults = numResults;
            return this;
        }

        public Builder variadicResults() {
            return results(VARIADIC);
        }

        public Builder regions(int numRegions) {
            this.numRegions = numRegions;
            return this;
        }

        public OpSignature build() {
            return new OpSignature(opName, params, numResults, numRegions);
        }
    }
}
